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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.IntFunction;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.BitString;
import net.hydromatic.coretree.term.FunRef;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.MapTerm;
import net.hydromatic.coretree.term.Terms;
import net.hydromatic.coretree.term.TupleTerm;

/** Generates random trees of bounded depth, for property tests.
 *
 * <p>Uses only the public constructors of {@link CoreBuilder}. Every kind of
 * node can occur; some nodes are given annotations, and some lists and tuples
 * are built as skeletons. The same seed always yields the same trees. */
public class TreeGenerator {
  private static final List<String> NAMES =
      ImmutableList.of("X", "Y", "Z", "Acc", "_cor0");

  private final Random random;

  public TreeGenerator(long seed) {
    this.random = new Random(seed);
  }

  private boolean chance(int n) {
    return random.nextInt(n) == 0;
  }

  private <E> List<E> listOf(int max, IntFunction<E> fn) {
    final int n = random.nextInt(max + 1);
    final List<E> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(fn.apply(i));
    }
    return list;
  }

  /** Adds annotations to a node, one time in four. */
  @SuppressWarnings("unchecked")
  private <T extends AstNode> T ann(T node) {
    if (!chance(4)) {
      return node;
    }
    final List<Object> anns =
        chance(2)
            ? ImmutableList.of(BigInteger.valueOf(random.nextInt(100)))
            : ImmutableList.of(Atom.of("compiler_generated"),
                TupleTerm.of(Atom.of("file"), Terms.string("a.core")));
    return (T) node.withAnns(anns);
  }

  // values

  /** Generates a value that can be represented as a literal. */
  public Object value(int depth) {
    final int n = depth <= 0 ? 6 : 10;
    switch (random.nextInt(n)) {
    case 0:
      return Atom.of("a" + random.nextInt(3));
    case 1:
      return BigInteger.valueOf(random.nextInt(2000) - 1000);
    case 2:
      return random.nextInt(100) / 4d + 0.5d;
    case 3:
      return ListTerm.NIL;
    case 4:
      return Terms.string("s" + random.nextInt(10));
    case 5:
      return chance(2)
          ? BitString.of((byte) random.nextInt(256))
          : FunRef.of("lists", "map", 2);
    case 6:
    case 7:
      return ListTerm.of(listOf(3, i -> value(depth - 1)));
    case 8:
      return TupleTerm.of(listOf(3, i -> value(depth - 1)));
    default:
      return MapTerm.of(
          ImmutableMap.of(Atom.of("k"), value(depth - 1),
              BigInteger.ONE, value(depth - 1)));
    }
  }

  /** Generates a literal, occasionally annotated. */
  public AstNode literal(int depth) {
    return ann(core.literal(value(depth)));
  }

  /** Generates a variable whose name is an atom or an integer. */
  public Core.Var var() {
    return ann(
        chance(3)
            ? core.var(random.nextInt(10))
            : core.var(NAMES.get(random.nextInt(NAMES.size()))));
  }

  /** Generates a function name. */
  public Core.Var fname() {
    return ann(core.fname("f" + random.nextInt(3), random.nextInt(3)));
  }

  // expressions

  /** Generates an expression. */
  public AstNode expr(int depth) {
    if (depth <= 0) {
      return chance(2) ? literal(0) : var();
    }
    final int d = depth - 1;
    switch (random.nextInt(22)) {
    case 0:
      return literal(depth);
    case 1:
      return var();
    case 2:
      return ann(core.cons(expr(d), expr(d)));
    case 3:
      return ann(core.consSkel(literal(d), literal(d)));
    case 4:
      return ann(core.makeList(listOf(4, i -> expr(d)), expr(d)));
    case 5:
      return ann(core.tuple(listOf(3, i -> expr(d))));
    case 6:
      return ann(core.tupleSkel(listOf(3, i -> literal(d))));
    case 7:
      return ann(core.values(listOf(3, i -> expr(d))));
    case 8:
      return ann(core.binary(listOf(2, i -> bitstr(d))));
    case 9:
      return ann(core.fun(listOf(2, i -> var()), expr(d)));
    case 10:
      return ann(core.seq(expr(d), expr(d)));
    case 11:
      return ann(core.let(listOf(2, i -> var()), expr(d), expr(d)));
    case 12:
      return ann(core.letrec(defs(d), expr(d)));
    case 13:
      final int arity = random.nextInt(3);
      return ann(core.caseOf(expr(d), listOf(2, i -> clause(d, arity))));
    case 14:
      return ann(
          core.receive(listOf(2, i -> clause(d, 1)), expr(d), expr(d)));
    case 15:
      return ann(core.apply(chance(2) ? fname() : expr(d),
          listOf(3, i -> expr(d))));
    case 16:
      return ann(core.call(expr(d), expr(d), listOf(3, i -> expr(d))));
    case 17:
      return ann(core.primop(core.atom("raise"), listOf(2, i -> expr(d))));
    case 18:
      return ann(
          core.tryOf(expr(d), listOf(2, i -> var()), expr(d),
              listOf(3, i -> var()), expr(d)));
    case 19:
      return ann(core.catchOf(expr(d)));
    case 20:
      return ann(
          core.map(chance(2) ? core.emptyMap() : expr(d),
              listOf(3, i -> mapPair(d))));
    default:
      final List<Map.Entry<AstNode, AstNode>> attrs =
          listOf(2, i ->
              Maps.<AstNode, AstNode>immutableEntry(core.atom("vsn"),
                  literal(d)));
      return ann(
          core.module(core.atom("m"), listOf(2, i -> fname()), attrs,
              defs(d)));
    }
  }

  private List<Map.Entry<Core.Var, AstNode>> defs(int depth) {
    return listOf(2, i ->
        core.def(fname(), core.fun(listOf(2, j -> var()), expr(depth))));
  }

  /** Generates a clause with a given number of patterns. */
  public Core.Clause clause(int depth, int arity) {
    final List<AstNode> pats = new ArrayList<>();
    for (int i = 0; i < arity; i++) {
      pats.add(pattern(depth));
    }
    return ann(
        chance(2)
            ? core.clause(pats, expr(depth))
            : core.clause(pats, expr(depth), expr(depth)));
  }

  /** Generates a map association; sometimes {@code exact}, and sometimes
   * with a key or value that is not a literal. */
  public Core.MapPair mapPair(int depth) {
    final AstNode key = chance(3) ? var() : literal(0);
    final AstNode val = chance(2) ? expr(depth) : literal(depth);
    return ann(
        chance(3) ? core.mapPairExact(key, val) : core.mapPair(key, val));
  }

  /** Generates a bit-string segment. */
  public Core.Bitstr bitstr(int depth) {
    final AstNode val =
        chance(2) ? var() : core.intLiteral(random.nextInt(256));
    final AstNode size = chance(2) ? core.intLiteral(8) : expr(depth);
    return ann(
        core.bitstr(val, size, core.intLiteral(1), core.atom("integer"),
            core.literal(ListTerm.of(Atom.of("unsigned"), Atom.of("big")))));
  }

  // patterns

  /** Generates a pattern. */
  public AstNode pattern(int depth) {
    if (depth <= 0) {
      return chance(2) ? literal(0) : var();
    }
    final int d = depth - 1;
    switch (random.nextInt(7)) {
    case 0:
      return literal(d);
    case 1:
      return var();
    case 2:
      return ann(core.cons(pattern(d), pattern(d)));
    case 3:
      return ann(core.tuple(listOf(3, i -> pattern(d))));
    case 4:
      return ann(core.alias(var(), pattern(d)));
    case 5:
      return ann(
          core.mapPattern(
              listOf(2, i ->
                  core.mapPairExact(literal(0), pattern(d)))));
    default:
      return ann(core.binary(listOf(2, i -> bitstr(d))));
    }
  }
}

// End TreeGenerator.java
