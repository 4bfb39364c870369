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
package net.hydromatic.coretree.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.coretree.util.ContractException;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Prop}. */
class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.META_MODULE.stringValue(map), is("core"));
    assertThat(Prop.META_VAR_MARKER.stringValue(map), is("meta_var"));
    assertThat(Prop.BATCH_LISTS.booleanValue(map), is(true));
  }

  @Test void testSetAndRemove() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.BATCH_LISTS.set(map, false);
    assertThat(Prop.BATCH_LISTS.booleanValue(map), is(false));
    assertThat(Prop.BATCH_LISTS.remove(map), is(false));
    assertThat(Prop.BATCH_LISTS.booleanValue(map), is(true));

    assertThrows(ContractException.class,
        () -> Prop.BATCH_LISTS.set(map, "yes"));
    assertThrows(ContractException.class,
        () -> Prop.META_MODULE.set(map, null));
    assertThrows(ContractException.class,
        () -> Prop.META_MODULE.booleanValue(map));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("metaModule"), is(Prop.META_MODULE));
    assertThat(Prop.lookup("BATCH_LISTS"), is(Prop.BATCH_LISTS));
    assertThrows(ContractException.class, () -> Prop.lookup("batch_lists"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.BATCH_LISTS));
  }
}

// End PropTest.java
