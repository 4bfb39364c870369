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
package net.hydromatic.coretree.ast;

import static net.hydromatic.coretree.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.MapTerm;
import net.hydromatic.coretree.term.Terms;
import org.junit.jupiter.api.Test;

/** Unit test for {@link MapFolder} and the map constructors of
 * {@link CoreBuilder}. */
class MapFolderTest {
  private static AstNode str(String s) {
    return core.stringLiteral(s);
  }

  @Test void testAssocThenExact() {
    final List<Core.MapPair> pairs =
        ImmutableList.of(core.mapPair(str("k1"), str("v1")),
            core.mapPairExact(str("k1"), str("v2")));
    final MapFolder.Result result = MapFolder.fold(MapTerm.EMPTY, pairs);
    assertThat(result.isComplete(2), is(true));
    assertThat(result.map,
        is(MapTerm.of(Terms.string("k1"), Terms.string("v2"))));

    final AstNode map = core.map(pairs);
    assertThat(map, instanceOf(Core.Literal.class));
    assertThat(map, hasToString("~{\"k1\"=>\"v2\"}~"));
  }

  @Test void testExactOnMissingKey() {
    final List<Core.MapPair> pairs =
        ImmutableList.of(core.mapPairExact(str("missing"), str("v")));
    final MapFolder.Result result = MapFolder.fold(MapTerm.EMPTY, pairs);
    assertThat(result.count, is(0));
    assertThat(result.isComplete(1), is(false));
    assertThat(result.map, sameInstance(MapTerm.EMPTY));

    final AstNode map = core.map(pairs);
    assertThat(map, instanceOf(Core.Map.class));
    assertThat(((Core.Map) map).base, is(core.emptyMap()));
    assertThat(((Core.Map) map).pairs, is(pairs));
    assertThat(map, hasToString("~{\"missing\" := \"v\"}~"));
  }

  /** Folds as far as the first pair that cannot be folded, and keeps the
   * rest. */
  @Test void testPartialFold() {
    final AstNode base =
        core.literal(MapTerm.of(Atom.of("a"), Atom.of("x")))
            .withAnns(ImmutableList.of(Atom.of("base")));
    final Core.MapPair p0 = core.mapPairExact(core.atom("a"), core.atom("y"));
    final Core.MapPair p1 = core.mapPair(core.atom("b"), core.atom("z"));
    final Core.MapPair p2 = core.mapPair(core.atom("c"), core.var("V"));
    final Core.MapPair p3 = core.mapPair(core.atom("d"), core.atom("w"));
    final AstNode map = core.map(base, ImmutableList.of(p0, p1, p2, p3));
    assertThat(map, instanceOf(Core.Map.class));
    final Core.Map m = (Core.Map) map;
    assertThat(m.pairs, is(ImmutableList.of(p2, p3)));
    assertThat(m.base,
        is(
            core.literal(
                    MapTerm.of(
                        ImmutableMap.of(Atom.of("a"), Atom.of("y"),
                            Atom.of("b"), Atom.of("z"))))
                .withAnns(ImmutableList.of(Atom.of("base")))));
    assertThat(m.isPattern, is(false));

    // Rebuilding the node does not fold any further
    assertThat(Trees.updateTree(m, Trees.subtrees(m)), is(m));
  }

  @Test void testNonLiteralBase() {
    final List<Core.MapPair> pairs =
        ImmutableList.of(core.mapPair(core.atom("k"), core.intLiteral(1)));
    final AstNode map = core.map(core.var("M"), pairs);
    assertThat(map, instanceOf(Core.Map.class));
    assertThat(map, hasToString("~{'k' => 1 | M}~"));

    // A literal base that is not a map is not folded either
    final AstNode map2 = core.map(core.atom("not_a_map"), pairs);
    assertThat(map2, instanceOf(Core.Map.class));
  }

  @Test void testNonLiteralKey() {
    final List<Core.MapPair> pairs =
        ImmutableList.of(core.mapPair(core.var("K"), core.intLiteral(1)),
            core.mapPair(core.atom("k"), core.intLiteral(2)));
    final MapFolder.Result result = MapFolder.fold(MapTerm.EMPTY, pairs);
    assertThat(result.count, is(0));
    final AstNode map = core.map(pairs);
    assertThat(((Core.Map) map).pairs, hasSize(2));
  }

  @Test void testPatternNeverFolds() {
    final Core.Map pattern =
        core.mapPattern(
            ImmutableList.of(core.mapPair(core.atom("k"), core.intLiteral(1))));
    assertThat(pattern.isPattern, is(true));
    assertThat(pattern.pairs, hasSize(1));
    assertThat(core.map(ImmutableList.of()), is(core.emptyMap()));
  }
}

// End MapFolderTest.java
