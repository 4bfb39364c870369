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
package net.hydromatic.coretree.util;

import static net.hydromatic.coretree.util.Static.allMatch;
import static net.hydromatic.coretree.util.Static.minusFirst;
import static net.hydromatic.coretree.util.Static.transformEager;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Static} and {@link ContractException}. */
class UtilTest {
  @Test void testMinusFirst() {
    final List<String> list = Arrays.asList("a", "b", "a", "c");
    assertThat(minusFirst(list, "a"), is(Arrays.asList("b", "a", "c")));
    assertThat(minusFirst(list, "c"), is(Arrays.asList("a", "b", "a")));
    assertThat(minusFirst(list, "z"), sameInstance(list));
    assertThat(minusFirst(ImmutableList.of(), "z"), is(ImmutableList.of()));
  }

  @Test void testAllMatch() {
    final List<Integer> list = Arrays.asList(2, 4, 6);
    assertThat(allMatch(list, i -> i % 2 == 0), is(true));
    assertThat(allMatch(list, i -> i > 2), is(false));
    assertThat(allMatch(ImmutableList.<Integer>of(), i -> i > 2), is(true));
  }

  @Test void testTransformEager() {
    assertThat(transformEager(ImmutableList.<String>of(), String::length),
        is(ImmutableList.of()));
    assertThat(transformEager(ImmutableList.of("ab"), String::length),
        is(ImmutableList.of(2)));
    assertThat(transformEager(Arrays.asList("a", "bcd", ""), String::length),
        is(ImmutableList.of(1, 3, 0)));
  }

  @Test void testContractException() {
    ContractException.check(true, "never %s", "thrown");
    final ContractException e =
        assertThrows(ContractException.class,
            () -> ContractException.check(false, "bad %s and %s", 1, "two"));
    assertThat(e, hasToString(ContractException.class.getName()
        + ": bad 1 and two"));
    assertThat(ContractException.wrongKind(3, "atom").getMessage(),
        is("expected atom, got 3"));
  }
}

// End UtilTest.java
