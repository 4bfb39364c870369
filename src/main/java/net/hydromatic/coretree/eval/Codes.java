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

import static net.hydromatic.coretree.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.compile.BuiltIn;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;

/** Implementations of the built-in functions. */
public abstract class Codes {
  private Codes() {}

  /** @see BuiltIn#C_ATOM */
  private static final Applicable C_ATOM = args ->
      core.atom(value(Atom.class, args.get(0)));

  /** @see BuiltIn#C_INT */
  private static final Applicable C_INT = args ->
      core.intLiteral(value(BigInteger.class, args.get(0)));

  /** @see BuiltIn#C_FLOAT */
  private static final Applicable C_FLOAT = args ->
      core.floatLiteral(value(Double.class, args.get(0)));

  private static final Applicable C_NIL = args -> core.nil();

  private static final Applicable ABSTRACT = args -> core.literal(args.get(0));

  private static final Applicable C_VAR = args -> core.var(args.get(0));

  private static final Applicable SET_ANN = args ->
      node(args.get(0)).withAnns(list(args.get(1)));

  private static final Applicable C_CONS = args ->
      core.cons(node(args.get(0)), node(args.get(1)));

  private static final Applicable C_CONS_SKEL = args ->
      core.consSkel(node(args.get(0)), node(args.get(1)));

  private static final Applicable MAKE_LIST = args ->
      core.makeList(nodes(AstNode.class, args.get(0)), node(args.get(1)));

  private static final Applicable C_TUPLE = args ->
      core.tuple(nodes(AstNode.class, args.get(0)));

  private static final Applicable C_TUPLE_SKEL = args ->
      core.tupleSkel(nodes(AstNode.class, args.get(0)));

  private static final Applicable C_VALUES = args ->
      core.values(nodes(AstNode.class, args.get(0)));

  private static final Applicable C_BINARY = args ->
      core.binary(nodes(Core.Bitstr.class, args.get(0)));

  private static final Applicable C_BITSTR = args ->
      core.bitstr(node(args.get(0)), node(args.get(1)), node(args.get(2)),
          node(args.get(3)), node(args.get(4)));

  private static final Applicable C_MAP = args ->
      core.map(node(args.get(0)), nodes(Core.MapPair.class, args.get(1)));

  private static final Applicable C_MAP_PATTERN = args ->
      core.mapPattern(node(args.get(0)),
          nodes(Core.MapPair.class, args.get(1)));

  private static final Applicable C_MAP_PAIR = args ->
      core.mapPair(node(args.get(0)), node(args.get(1)), node(args.get(2)));

  private static final Applicable C_LET = args ->
      core.let(nodes(Core.Var.class, args.get(0)), node(args.get(1)),
          node(args.get(2)));

  private static final Applicable C_SEQ = args ->
      core.seq(node(args.get(0)), node(args.get(1)));

  private static final Applicable C_APPLY = args ->
      core.apply(node(args.get(0)), nodes(AstNode.class, args.get(1)));

  private static final Applicable C_CALL = args ->
      core.call(node(args.get(0)), node(args.get(1)),
          nodes(AstNode.class, args.get(2)));

  private static final Applicable C_PRIMOP = args ->
      core.primop(node(args.get(0)), nodes(AstNode.class, args.get(1)));

  private static final Applicable C_CASE = args ->
      core.caseOf(node(args.get(0)), nodes(Core.Clause.class, args.get(1)));

  private static final Applicable C_CLAUSE = args ->
      core.clause(nodes(AstNode.class, args.get(0)), node(args.get(1)),
          node(args.get(2)));

  private static final Applicable C_ALIAS = args ->
      core.alias(value(Core.Var.class, args.get(0)), node(args.get(1)));

  private static final Applicable C_FUN = args ->
      core.fun(nodes(Core.Var.class, args.get(0)), node(args.get(1)));

  private static final Applicable C_RECEIVE = args ->
      core.receive(nodes(Core.Clause.class, args.get(0)), node(args.get(1)),
          node(args.get(2)));

  private static final Applicable C_TRY = args ->
      core.tryOf(node(args.get(0)), nodes(Core.Var.class, args.get(1)),
          node(args.get(2)), nodes(Core.Var.class, args.get(3)),
          node(args.get(4)));

  private static final Applicable C_CATCH = args ->
      core.catchOf(node(args.get(0)));

  private static final Applicable C_LETREC = args ->
      core.letrec(defs(Core.Var.class, args.get(0)), node(args.get(1)));

  private static final Applicable C_MODULE = args ->
      core.module(node(args.get(0)), nodes(Core.Var.class, args.get(1)),
          defs(AstNode.class, args.get(2)), defs(Core.Var.class, args.get(3)));

  /** Implementation of each built-in function. */
  public static final ImmutableMap<BuiltIn, Applicable> BUILT_IN_VALUES =
      new Builder()
          .put(BuiltIn.ABSTRACT, ABSTRACT)
          .put(BuiltIn.C_ALIAS, C_ALIAS)
          .put(BuiltIn.C_APPLY, C_APPLY)
          .put(BuiltIn.C_ATOM, C_ATOM)
          .put(BuiltIn.C_BINARY, C_BINARY)
          .put(BuiltIn.C_BITSTR, C_BITSTR)
          .put(BuiltIn.C_CALL, C_CALL)
          .put(BuiltIn.C_CASE, C_CASE)
          .put(BuiltIn.C_CATCH, C_CATCH)
          .put(BuiltIn.C_CLAUSE, C_CLAUSE)
          .put(BuiltIn.C_CONS, C_CONS)
          .put(BuiltIn.C_CONS_SKEL, C_CONS_SKEL)
          .put(BuiltIn.C_FLOAT, C_FLOAT)
          .put(BuiltIn.C_FUN, C_FUN)
          .put(BuiltIn.C_INT, C_INT)
          .put(BuiltIn.C_LET, C_LET)
          .put(BuiltIn.C_LETREC, C_LETREC)
          .put(BuiltIn.C_MAP, C_MAP)
          .put(BuiltIn.C_MAP_PAIR, C_MAP_PAIR)
          .put(BuiltIn.C_MAP_PATTERN, C_MAP_PATTERN)
          .put(BuiltIn.C_MODULE, C_MODULE)
          .put(BuiltIn.C_NIL, C_NIL)
          .put(BuiltIn.C_PRIMOP, C_PRIMOP)
          .put(BuiltIn.C_RECEIVE, C_RECEIVE)
          .put(BuiltIn.C_SEQ, C_SEQ)
          .put(BuiltIn.C_TRY, C_TRY)
          .put(BuiltIn.C_TUPLE, C_TUPLE)
          .put(BuiltIn.C_TUPLE_SKEL, C_TUPLE_SKEL)
          .put(BuiltIn.C_VALUES, C_VALUES)
          .put(BuiltIn.C_VAR, C_VAR)
          .put(BuiltIn.MAKE_LIST, MAKE_LIST)
          .put(BuiltIn.SET_ANN, SET_ANN)
          .build();

  /** Returns the implementation of a built-in function. */
  public static Applicable applicable(BuiltIn builtIn) {
    return BUILT_IN_VALUES.get(builtIn);
  }

  private static AstNode node(Object o) {
    return value(AstNode.class, o);
  }

  private static <T> T value(Class<T> clazz, Object o) {
    if (!clazz.isInstance(o)) {
      throw ContractException.wrongKind(o, clazz.getSimpleName());
    }
    return clazz.cast(o);
  }

  private static List<Object> list(Object o) {
    if (!(o instanceof ListTerm) || !((ListTerm) o).isProper()) {
      throw ContractException.wrongKind(o, "proper list");
    }
    return ((ListTerm) o).elements();
  }

  private static <T> List<T> nodes(Class<T> clazz, Object o) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    list(o).forEach(e -> b.add(value(clazz, e)));
    return b.build();
  }

  /** Converts a list of two-element tuples to a list of entries. */
  private static <K extends AstNode> List<Map.Entry<K, AstNode>> defs(
      Class<K> keyClass, Object o) {
    final ImmutableList.Builder<Map.Entry<K, AstNode>> b =
        ImmutableList.builder();
    for (Object e : list(o)) {
      final TupleTerm tuple = value(TupleTerm.class, e);
      if (tuple.arity() != 2) {
        throw ContractException.wrongKind(tuple, "two-element tuple");
      }
      b.add(
          Maps.immutableEntry(value(keyClass, tuple.get(0)),
              node(tuple.get(1))));
    }
    return b.build();
  }

  /** Builds the map of implementations, and checks that it is complete. */
  private static class Builder {
    final Map<BuiltIn, Applicable> map = new EnumMap<>(BuiltIn.class);

    Builder put(BuiltIn builtIn, Applicable applicable) {
      if (map.put(builtIn, applicable) != null) {
        throw new AssertionError("duplicate " + builtIn);
      }
      return this;
    }

    ImmutableMap<BuiltIn, Applicable> build() {
      for (BuiltIn builtIn : BuiltIn.values()) {
        if (!map.containsKey(builtIn)) {
          throw new AssertionError("no implementation for " + builtIn);
        }
      }
      return ImmutableMap.copyOf(map);
    }
  }
}

// End Codes.java
