/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.coretree.compile;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.coretree.eval.Codes;
import org.junit.jupiter.api.Test;

/** Unit test for {@link BuiltIn}. */
class BuiltInTest {
  @Test void testLookup() {
    assertThat(BuiltIn.C_CONS_SKEL.functionName, is("c_cons_skel"));
    assertThat(BuiltIn.SET_ANN.functionName, is("set_ann"));
    assertThat(BuiltIn.lookup("c_tuple", 1), is(BuiltIn.C_TUPLE));
    assertThat(BuiltIn.lookup("make_list", 2), is(BuiltIn.MAKE_LIST));
    assertThat(BuiltIn.lookup("c_tuple", 2), nullValue());
    assertThat(BuiltIn.lookup("c_lambda", 2), nullValue());
  }

  /** Every built-in function has an implementation, and can be found by its
   * name and arity. */
  @Test void testComplete() {
    for (BuiltIn builtIn : BuiltIn.values()) {
      assertThat(BuiltIn.lookup(builtIn.functionName, builtIn.arity),
          is(builtIn));
      assertThat(Codes.applicable(builtIn), notNullValue());
    }
    assertThat(Codes.BUILT_IN_VALUES.size(), is(BuiltIn.values().length));
  }
}

// End BuiltInTest.java
