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

import static net.hydromatic.coretree.util.Static.allMatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.MapTerm;
import net.hydromatic.coretree.term.Terms;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;

/** Builds nodes of the intermediate language.
 *
 * <p>The constructors of the node classes in {@link Core} are not public;
 * this is the only way to create a node. Every node created here has no
 * annotations; call {@link AstNode#withAnns} to add them.
 *
 * <p>The list and tuple constructors {@link #cons} and {@link #tuple} fold:
 * if all of their arguments are literals, they return a {@link Core.Literal}.
 * Their "skeleton" counterparts {@link #consSkel} and {@link #tupleSkel}
 * always return a composite node. */
public enum CoreBuilder {
  /** The singleton instance of the core builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.Literal nilLiteral = literal(ListTerm.NIL);

  private final Core.Literal trueLiteral = literal(Atom.TRUE);

  private final Core.Literal emptyMapLiteral = literal(MapTerm.EMPTY);

  // literals

  /** Creates a literal from a host value.
   *
   * <p>Takes constant time, and does not check that the value can be
   * represented as a literal; use {@link Terms#isLiteralTerm} if in doubt. */
  public Core.Literal literal(Object value) {
    return new Core.Literal(ImmutableList.of(), value);
  }

  /** Creates an atom literal. */
  public Core.Literal atom(String name) {
    return atom(Atom.of(name));
  }

  /** Creates an atom literal. */
  public Core.Literal atom(Atom atom) {
    return atom == Atom.TRUE ? trueLiteral : literal(atom);
  }

  /** Creates an integer literal. */
  public Core.Literal intLiteral(long value) {
    return literal(BigInteger.valueOf(value));
  }

  /** Creates an integer literal. */
  public Core.Literal intLiteral(BigInteger value) {
    return literal(value);
  }

  /** Creates a float literal. The value must be finite. */
  public Core.Literal floatLiteral(double value) {
    ContractException.check(Double.isFinite(value),
        "float literal must be finite: %s", value);
    return literal(value);
  }

  /** Creates a character literal. A character is an integer. */
  public Core.Literal charLiteral(int c) {
    ContractException.check(c >= 0, "invalid character %s", c);
    return intLiteral(c);
  }

  /** Creates a string literal. A string is a list of characters. */
  public Core.Literal stringLiteral(String s) {
    return literal(Terms.string(s));
  }

  /** Returns the empty list literal, "{@code []}". */
  public Core.Literal nil() {
    return nilLiteral;
  }

  /** Returns the empty map literal, "{@code ~{}~}". */
  public Core.Literal emptyMap() {
    return emptyMapLiteral;
  }

  // lists and tuples

  /** Creates a list cell, "{@code [hd | tl]}". If both arguments are
   * literals, returns a literal. The annotations of the arguments are
   * lost in that case. */
  public AstNode cons(AstNode hd, AstNode tl) {
    if (hd instanceof Core.Literal && tl instanceof Core.Literal) {
      return literal(
          ListTerm.cons(((Core.Literal) hd).value, ((Core.Literal) tl).value));
    }
    return consSkel(hd, tl);
  }

  /** Creates a list cell that is never folded into a literal. */
  public Core.Cons consSkel(AstNode hd, AstNode tl) {
    return new Core.Cons(ImmutableList.of(), hd, tl);
  }

  /** Creates a proper list from a list of elements. */
  public AstNode makeList(List<? extends AstNode> elements) {
    return makeList(elements, nil());
  }

  /** Creates a list from a list of elements and a tail.
   *
   * <p>Builds from the last element backwards, so the stack does not grow
   * with the length of the list. If all elements are literal, so is the
   * result. */
  public AstNode makeList(List<? extends AstNode> elements, AstNode tail) {
    AstNode list = tail;
    for (int i = elements.size() - 1; i >= 0; i--) {
      list = cons(elements.get(i), list);
    }
    return list;
  }

  /** Creates a tuple, "{@code {e1, ..., en}}". If all elements are literals,
   * returns a literal. */
  public AstNode tuple(List<? extends AstNode> es) {
    if (allMatch(es, e -> e instanceof Core.Literal)) {
      final Object[] values = new Object[es.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = ((Core.Literal) es.get(i)).value;
      }
      return literal(TupleTerm.of(values));
    }
    return tupleSkel(es);
  }

  /** Creates a tuple. */
  public AstNode tuple(AstNode... es) {
    return tuple(Arrays.asList(es));
  }

  /** Creates a tuple that is never folded into a literal. */
  public Core.Tuple tupleSkel(List<? extends AstNode> es) {
    return new Core.Tuple(ImmutableList.of(), ImmutableList.copyOf(es));
  }

  /** Creates a tuple that is never folded into a literal. */
  public Core.Tuple tupleSkel(AstNode... es) {
    return tupleSkel(Arrays.asList(es));
  }

  /** Creates a data constructor node of a given type: a list cell (two
   * elements), a tuple, or an atomic literal (no elements). Folds if
   * possible. */
  public AstNode makeData(DataType type, List<? extends AstNode> es) {
    switch (type.kind) {
    case CONS:
      checkDataArity(type, es, 2);
      return cons(es.get(0), es.get(1));
    case TUPLE:
      return tuple(es);
    default:
      checkDataArity(type, es, 0);
      return literal(type.value());
    }
  }

  /** Creates a data constructor node of a given type. Never folds; an atomic
   * type still yields a literal. */
  public AstNode makeDataSkel(DataType type, List<? extends AstNode> es) {
    switch (type.kind) {
    case CONS:
      checkDataArity(type, es, 2);
      return consSkel(es.get(0), es.get(1));
    case TUPLE:
      return tupleSkel(es);
    default:
      checkDataArity(type, es, 0);
      return literal(type.value());
    }
  }

  private static void checkDataArity(DataType type, List<?> es, int arity) {
    ContractException.check(es.size() == arity,
        "constructor %s requires %s elements, got %s", type, arity,
        es.size());
  }

  // variables

  /** Creates a variable with an atom name. */
  public Core.Var var(String name) {
    return var(Atom.of(name));
  }

  /** Creates a variable with an integer name. */
  public Core.Var var(int name) {
    return var(BigInteger.valueOf(name));
  }

  /** Creates a variable. The name must be an integer, an atom, or a
   * function name {@code {Atom, Arity}}. */
  public Core.Var var(Object name) {
    if (!Core.Var.isValidName(name)) {
      throw ContractException.wrongKind(name, "variable name");
    }
    return new Core.Var(ImmutableList.of(), name);
  }

  /** Creates a function-name variable, such as "{@code 'f'/2}". */
  public Core.Var fname(String name, int arity) {
    return fname(Atom.of(name), arity);
  }

  /** Creates a function-name variable. */
  public Core.Var fname(Atom name, int arity) {
    ContractException.check(arity >= 0, "negative arity %s", arity);
    return var(TupleTerm.of(name, BigInteger.valueOf(arity)));
  }

  // expressions

  /** Creates a multiple-value node, "{@code <e1, ..., en>}". */
  public Core.Values values(List<? extends AstNode> es) {
    return new Core.Values(ImmutableList.of(), ImmutableList.copyOf(es));
  }

  /** Creates a multiple-value node. */
  public Core.Values values(AstNode... es) {
    return values(Arrays.asList(es));
  }

  /** Creates a binary, "{@code #{s1, ..., sn}#}". */
  public Core.Binary binary(List<Core.Bitstr> segments) {
    return new Core.Binary(ImmutableList.of(),
        ImmutableList.copyOf(segments));
  }

  /** Creates a bit-string segment. */
  public Core.Bitstr bitstr(AstNode val, AstNode size, AstNode unit,
      AstNode type, AstNode flags) {
    return new Core.Bitstr(ImmutableList.of(), val, size, unit, type, flags);
  }

  /** Creates a bit-string segment with unit 1. */
  public Core.Bitstr bitstr(AstNode val, AstNode size, AstNode type,
      AstNode flags) {
    return bitstr(val, size, intLiteral(1), type, flags);
  }

  /** Creates a bit-string segment with size {@code all} and unit 1. */
  public Core.Bitstr bitstr(AstNode val, AstNode type, AstNode flags) {
    return bitstr(val, atom(Atom.ALL), intLiteral(1), type, flags);
  }

  /** Creates a lambda, "{@code fun (v1, ..., vn) -> body}". */
  public Core.Fun fun(List<Core.Var> vars, AstNode body) {
    return new Core.Fun(ImmutableList.of(), ImmutableList.copyOf(vars), body);
  }

  /** Creates a sequence, "{@code do arg body}". */
  public Core.Seq seq(AstNode arg, AstNode body) {
    return new Core.Seq(ImmutableList.of(), arg, body);
  }

  /** Creates a let, "{@code let <v1, ..., vn> = arg in body}".
   * The variables must not be function names. */
  public Core.Let let(List<Core.Var> vars, AstNode arg, AstNode body) {
    for (Core.Var var : vars) {
      if (var.isFname()) {
        throw ContractException.wrongKind(var,
            "non-function-name variable in let");
      }
    }
    return new Core.Let(ImmutableList.of(), ImmutableList.copyOf(vars), arg,
        body);
  }

  /** Creates a definition, for use in {@link #letrec} and {@link #module}. */
  public Map.Entry<Core.Var, AstNode> def(Core.Var name, AstNode value) {
    return Maps.immutableEntry(name, value);
  }

  /** Creates a recursive definition,
   * "{@code letrec f1/a1 = fun1 ... in body}". The names must be function
   * names. */
  public Core.Letrec letrec(List<Map.Entry<Core.Var, AstNode>> defs,
      AstNode body) {
    return new Core.Letrec(ImmutableList.of(), checkDefs(defs), body);
  }

  private static ImmutableList<Map.Entry<Core.Var, AstNode>> checkDefs(
      List<Map.Entry<Core.Var, AstNode>> defs) {
    for (Map.Entry<Core.Var, AstNode> def : defs) {
      if (!def.getKey().isFname()) {
        throw ContractException.wrongKind(def.getKey(),
            "function name in definition");
      }
    }
    return ImmutableList.copyOf(defs);
  }

  /** Creates a case, "{@code case arg of clause1 ... clauseN end}". */
  public Core.Case caseOf(AstNode arg, List<Core.Clause> clauses) {
    return new Core.Case(ImmutableList.of(), arg,
        ImmutableList.copyOf(clauses));
  }

  /** Creates a clause whose guard is {@code 'true'}. */
  public Core.Clause clause(List<? extends AstNode> pats, AstNode body) {
    return clause(pats, trueLiteral, body);
  }

  /** Creates a clause, "{@code <p1, ..., pn> when guard -> body}". */
  public Core.Clause clause(List<? extends AstNode> pats, AstNode guard,
      AstNode body) {
    return new Core.Clause(ImmutableList.of(), ImmutableList.copyOf(pats),
        guard, body);
  }

  /** Creates an alias pattern, "{@code var = pat}". */
  public Core.Alias alias(Core.Var var, AstNode pat) {
    return new Core.Alias(ImmutableList.of(), var, pat);
  }

  /** Creates a receive with timeout {@code 'infinity'} and action
   * {@code 'true'}. */
  public Core.Receive receive(List<Core.Clause> clauses) {
    return receive(clauses, atom(Atom.INFINITY), trueLiteral);
  }

  /** Creates a receive,
   * "{@code receive clause1 ... after timeout -> action}". */
  public Core.Receive receive(List<Core.Clause> clauses, AstNode timeout,
      AstNode action) {
    return new Core.Receive(ImmutableList.of(), ImmutableList.copyOf(clauses),
        timeout, action);
  }

  /** Creates an application, "{@code apply op(a1, ..., an)}". */
  public Core.Apply apply(AstNode operator, List<? extends AstNode> args) {
    return new Core.Apply(ImmutableList.of(), operator,
        ImmutableList.copyOf(args));
  }

  /** Creates a call, "{@code call module:name(a1, ..., an)}". */
  public Core.Call call(AstNode module, AstNode name,
      List<? extends AstNode> args) {
    return new Core.Call(ImmutableList.of(), module, name,
        ImmutableList.copyOf(args));
  }

  /** Creates a call to a function whose module and name are atoms. */
  public Core.Call call(String module, String name, AstNode... args) {
    return call(atom(module), atom(name), Arrays.asList(args));
  }

  /** Creates a primitive operation, "{@code primop name(a1, ..., an)}". */
  public Core.PrimOp primop(AstNode name, List<? extends AstNode> args) {
    return new Core.PrimOp(ImmutableList.of(), name,
        ImmutableList.copyOf(args));
  }

  /** Creates a try. */
  public Core.Try tryOf(AstNode arg, List<Core.Var> vars, AstNode body,
      List<Core.Var> evars, AstNode handler) {
    return new Core.Try(ImmutableList.of(), arg, ImmutableList.copyOf(vars),
        body, ImmutableList.copyOf(evars), handler);
  }

  /** Creates a catch, "{@code catch body}". */
  public Core.Catch catchOf(AstNode body) {
    return new Core.Catch(ImmutableList.of(), body);
  }

  /** Creates a module with no attributes. */
  public Core.Module module(AstNode name, List<Core.Var> exports,
      List<Map.Entry<Core.Var, AstNode>> defs) {
    return module(name, exports, ImmutableList.of(), defs);
  }

  /** Creates a module. The exports and the names of the definitions must be
   * function names. */
  public Core.Module module(AstNode name, List<Core.Var> exports,
      List<Map.Entry<AstNode, AstNode>> attrs,
      List<Map.Entry<Core.Var, AstNode>> defs) {
    for (Core.Var export : exports) {
      if (!export.isFname()) {
        throw ContractException.wrongKind(export, "function name in export");
      }
    }
    return new Core.Module(ImmutableList.of(), name,
        ImmutableList.copyOf(exports), ImmutableList.copyOf(attrs),
        checkDefs(defs));
  }

  // maps

  /** Creates a map expression over the empty map, folding if possible. */
  public AstNode map(List<Core.MapPair> pairs) {
    return map(emptyMapLiteral, pairs);
  }

  /** Creates a map expression, "{@code ~{pair1, ..., pairN | base}~}".
   *
   * <p>If {@code base} is a literal map, the pairs are folded into it as far
   * as possible (see {@link MapFolder}). If every pair is folded, returns a
   * literal; otherwise returns a map over the partially folded base and the
   * remaining pairs. */
  public AstNode map(AstNode base, List<Core.MapPair> pairs) {
    if (base instanceof Core.Literal
        && ((Core.Literal) base).value instanceof MapTerm) {
      final MapFolder.Result result =
          MapFolder.fold((MapTerm) ((Core.Literal) base).value, pairs);
      if (result.isComplete(pairs.size())) {
        return literal(result.map);
      }
      if (result.count > 0) {
        return new Core.Map(ImmutableList.of(),
            literal(result.map).withAnns(base.anns),
            ImmutableList.copyOf(pairs.subList(result.count, pairs.size())),
            false);
      }
    }
    return new Core.Map(ImmutableList.of(), base, ImmutableList.copyOf(pairs),
        false);
  }

  /** Creates a map pattern over the empty map. Never folds. */
  public Core.Map mapPattern(List<Core.MapPair> pairs) {
    return mapPattern(emptyMapLiteral, pairs);
  }

  /** Creates a map pattern. Never folds. */
  public Core.Map mapPattern(AstNode base, List<Core.MapPair> pairs) {
    return new Core.Map(ImmutableList.of(), base, ImmutableList.copyOf(pairs),
        true);
  }

  /** Creates a map association, "{@code key => val}". */
  public Core.MapPair mapPair(AstNode key, AstNode val) {
    return mapPair(atom(Atom.ASSOC), key, val);
  }

  /** Creates an exact map association, "{@code key := val}". */
  public Core.MapPair mapPairExact(AstNode key, AstNode val) {
    return mapPair(atom(Atom.EXACT), key, val);
  }

  /** Creates a map association with a given operator, which must be the
   * literal {@code assoc} or {@code exact}. */
  public Core.MapPair mapPair(AstNode operator, AstNode key, AstNode val) {
    if (!(operator instanceof Core.Literal
        && (((Core.Literal) operator).value == Atom.ASSOC
            || ((Core.Literal) operator).value == Atom.EXACT))) {
      throw ContractException.wrongKind(operator, "'assoc' or 'exact'");
    }
    return new Core.MapPair(ImmutableList.of(), operator, key, val);
  }
}

// End CoreBuilder.java
