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

import static net.hydromatic.coretree.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.ast.TreeGenerator;
import net.hydromatic.coretree.ast.Trees;
import net.hydromatic.coretree.util.ContractException;
import org.junit.jupiter.api.Test;

/** Unit test for {@link PatternVars}. */
class PatternVarsTest {
  private final Core.Var x = core.var("X");
  private final Core.Var y = core.var("Y");
  private final Core.Var z = core.var("Z");

  @Test void testTupleAliasCons() {
    final AstNode pattern =
        core.tuple(x, core.intLiteral(1),
            core.alias(y, core.cons(z, core.nil())));
    assertThat(PatternVars.patVars(pattern), containsInAnyOrder(x, y, z));
  }

  @Test void testLiteral() {
    assertThat(PatternVars.patVars(core.stringLiteral("abc")), empty());
    assertThat(PatternVars.patVars(core.tupleSkel(core.intLiteral(1))),
        empty());
  }

  @Test void testList() {
    final AstNode pattern =
        core.makeList(ImmutableList.of(x, core.intLiteral(2), y), z);
    assertThat(PatternVars.patVars(pattern), containsInAnyOrder(x, y, z));
  }

  /** A map key is not a binding position; the value is. */
  @Test void testMap() {
    final AstNode pattern =
        core.mapPattern(
            ImmutableList.of(core.mapPairExact(x, y),
                core.mapPairExact(core.atom("k"), z)));
    assertThat(PatternVars.patVars(pattern), containsInAnyOrder(y, z));
  }

  /** The size of a segment is not a binding position; the value is. */
  @Test void testBinary() {
    final AstNode pattern =
        core.binary(
            ImmutableList.of(
                core.bitstr(x, core.intLiteral(8), core.atom("integer"),
                    core.nil()),
                core.bitstr(y, z, core.atom("binary"), core.nil())));
    assertThat(PatternVars.patVars(pattern), containsInAnyOrder(x, y));
  }

  @Test void testClauseVars() {
    final Core.Clause clause =
        core.clause(ImmutableList.of(x, core.tupleSkel(y, core.atom("a"))),
            core.atom("true"), z);
    assertThat(PatternVars.clauseVars(clause), containsInAnyOrder(x, y));
    assertThat(
        PatternVars.patListVars(ImmutableList.of(z, core.alias(x, y))),
        containsInAnyOrder(z, x, y));
    assertThrows(ContractException.class, () -> PatternVars.clauseVars(x));
  }

  @Test void testContractViolations() {
    // an expression is not a pattern
    assertThrows(ContractException.class,
        () -> PatternVars.patVars(core.seq(x, y)));
    assertThrows(ContractException.class,
        () -> PatternVars.patVars(core.tupleSkel(x, core.catchOf(y))));
    // a function name is not a pattern variable
    assertThrows(ContractException.class,
        () -> PatternVars.patVars(core.fname("f", 1)));
  }

  /** Every variable returned is a non-function-name variable that occurs in
   * the pattern. */
  @Test void testRandomPatterns() {
    final TreeGenerator generator = new TreeGenerator(42L);
    for (int i = 0; i < 200; i++) {
      final AstNode pattern = generator.pattern(4);
      final Set<AstNode> nodes = new HashSet<>();
      Trees.postorder(node -> {
        nodes.add(node);
        return node;
      }, pattern);
      for (Core.Var var : PatternVars.patVars(pattern)) {
        assertThat(var.isFname(), is(false));
        assertThat(nodes.contains(var), is(true));
      }
    }
  }
}

// End PatternVarsTest.java
