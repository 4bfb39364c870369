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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.coretree.ast.CoreBuilder.core;
import static net.hydromatic.coretree.util.Static.allMatch;
import static net.hydromatic.coretree.util.Static.minusFirst;
import static net.hydromatic.coretree.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.eval.Prop;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;

/**
 * Generates a tree that, when evaluated, constructs a given tree.
 *
 * <p>For example, the tree {@code {X, 'a'}} (a tuple of a variable and an
 * atom) is quoted as
 *
 * <blockquote><pre>{@code
 * call 'core':'c_tuple'([call 'core':'c_var'('X'),
 *                        call 'core':'c_atom'('a')])
 * }</pre></blockquote>
 *
 * <p>Each node becomes a call to one of the {@link BuiltIn} functions of the
 * meta module, which is {@code core} by default (see
 * {@link Prop#META_MODULE}). If a node has annotations, the call is wrapped
 * in a call to {@code set_ann}.
 *
 * <p>A variable whose annotations include the meta-variable marker (see
 * {@link Prop#META_VAR_MARKER}) is not quoted; it is returned with the first
 * occurrence of the marker removed, and at evaluation time will be replaced
 * by its value. This allows a tree to be used as a template.
 *
 * <p>A list and tuple whose elements are all literals, but which have not been
 * folded into a literal, are quoted using {@code c_cons_skel} and
 * {@code c_tuple_skel}, so that evaluating the result does not fold them.
 */
public class Meta {
  private final Atom module;
  private final Atom marker;
  private final boolean batchLists;
  private final Tracer tracer;

  /** Creates a meta generator. */
  public Meta(Map<Prop, Object> config, Tracer tracer) {
    this.module = Atom.of(Prop.META_MODULE.stringValue(config));
    this.marker = Atom.of(Prop.META_VAR_MARKER.stringValue(config));
    this.batchLists = Prop.BATCH_LISTS.booleanValue(config);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Quotes a tree using the default configuration. */
  public static AstNode meta(AstNode node) {
    return new Meta(ImmutableMap.of(), Tracers.empty()).quote(node);
  }

  /** Quotes a tree. */
  public AstNode quote(AstNode node) {
    final AstNode quoted = quote_(node);
    tracer.onQuote(node, quoted);
    return quoted;
  }

  private AstNode quote_(AstNode node) {
    if (node instanceof Core.Var && node.anns.contains(marker)) {
      final Core.Var var =
          ((Core.Var) node).withAnns(minusFirst(node.anns, marker));
      tracer.onMetaVar(var);
      return var;
    }
    if (node.anns.isEmpty()) {
      return quoteBody(node);
    }
    return call(BuiltIn.SET_ANN, quoteBody(node),
        core.literal(ListTerm.of(node.anns)));
  }

  /** Quotes a node, ignoring its annotations. */
  private AstNode quoteBody(AstNode node) {
    switch (node.op) {
    case LITERAL:
      return quoteLiteral(((Core.Literal) node).value);

    case VAR:
      return call(BuiltIn.C_VAR, core.literal(((Core.Var) node).name));

    case VALUES:
      return call(BuiltIn.C_VALUES, list(((Core.Values) node).es));

    case BINARY:
      return call(BuiltIn.C_BINARY, list(((Core.Binary) node).segments));

    case BITSTR:
      final Core.Bitstr bitstr = (Core.Bitstr) node;
      return call(BuiltIn.C_BITSTR, quote(bitstr.val), quote(bitstr.size),
          quote(bitstr.unit), quote(bitstr.type), quote(bitstr.flags));

    case CONS:
      return quoteCons((Core.Cons) node);

    case TUPLE:
      final Core.Tuple tuple = (Core.Tuple) node;
      return call(
          allMatch(tuple.es, e -> e instanceof Core.Literal)
              ? BuiltIn.C_TUPLE_SKEL
              : BuiltIn.C_TUPLE,
          list(tuple.es));

    case MAP:
      final Core.Map map = (Core.Map) node;
      return call(map.isPattern ? BuiltIn.C_MAP_PATTERN : BuiltIn.C_MAP,
          quote(map.base), list(map.pairs));

    case MAP_PAIR:
      final Core.MapPair pair = (Core.MapPair) node;
      return call(BuiltIn.C_MAP_PAIR, quote(pair.operator), quote(pair.key),
          quote(pair.val));

    case LET:
      final Core.Let let = (Core.Let) node;
      return call(BuiltIn.C_LET, list(let.vars), quote(let.arg),
          quote(let.body));

    case SEQ:
      final Core.Seq seq = (Core.Seq) node;
      return call(BuiltIn.C_SEQ, quote(seq.arg), quote(seq.body));

    case APPLY:
      final Core.Apply apply = (Core.Apply) node;
      return call(BuiltIn.C_APPLY, quote(apply.operator), list(apply.args));

    case CALL:
      final Core.Call call = (Core.Call) node;
      return call(BuiltIn.C_CALL, quote(call.module), quote(call.name),
          list(call.args));

    case PRIMOP:
      final Core.PrimOp primOp = (Core.PrimOp) node;
      return call(BuiltIn.C_PRIMOP, quote(primOp.name), list(primOp.args));

    case CASE:
      final Core.Case case_ = (Core.Case) node;
      return call(BuiltIn.C_CASE, quote(case_.arg), list(case_.clauses));

    case CLAUSE:
      final Core.Clause clause = (Core.Clause) node;
      return call(BuiltIn.C_CLAUSE, list(clause.pats), quote(clause.guard),
          quote(clause.body));

    case ALIAS:
      final Core.Alias alias = (Core.Alias) node;
      return call(BuiltIn.C_ALIAS, quote(alias.var), quote(alias.pat));

    case FUN:
      final Core.Fun fun = (Core.Fun) node;
      return call(BuiltIn.C_FUN, list(fun.vars), quote(fun.body));

    case RECEIVE:
      final Core.Receive receive = (Core.Receive) node;
      return call(BuiltIn.C_RECEIVE, list(receive.clauses),
          quote(receive.timeout), quote(receive.action));

    case TRY:
      final Core.Try try_ = (Core.Try) node;
      return call(BuiltIn.C_TRY, quote(try_.arg), list(try_.vars),
          quote(try_.body), list(try_.evars), quote(try_.handler));

    case CATCH:
      return call(BuiltIn.C_CATCH, quote(((Core.Catch) node).body));

    case LETREC:
      final Core.Letrec letrec = (Core.Letrec) node;
      return call(BuiltIn.C_LETREC, defs(letrec.defs), quote(letrec.body));

    case MODULE:
      final Core.Module module = (Core.Module) node;
      return call(BuiltIn.C_MODULE, quote(module.name), list(module.exports),
          defs(module.attrs), defs(module.defs));

    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  /** Quotes a literal. Atomic values have their own constructors, to make the
   * generated tree more compact; everything else uses {@code abstract}. */
  private AstNode quoteLiteral(Object value) {
    if (value instanceof Atom) {
      return call(BuiltIn.C_ATOM, core.literal(value));
    } else if (value instanceof BigInteger) {
      return call(BuiltIn.C_INT, core.literal(value));
    } else if (value instanceof Double) {
      return call(BuiltIn.C_FLOAT, core.literal(value));
    } else if (value == ListTerm.NIL) {
      return call(BuiltIn.C_NIL);
    } else {
      return call(BuiltIn.ABSTRACT, core.literal(value));
    }
  }

  /**
   * Quotes a list.
   *
   * <p>Cells are collected along the tail until a cell that has annotations,
   * or a cell whose head and tail are both literal. (Such a cell must be
   * quoted using {@code c_cons_skel}, or evaluation would fold it.) If two or
   * more cells are collected, they are quoted as one call to
   * {@code make_list}.
   */
  private AstNode quoteCons(Core.Cons cons) {
    if (isSkeletal(cons)) {
      return call(BuiltIn.C_CONS_SKEL, quote(cons.hd), quote(cons.tl));
    }
    final List<AstNode> heads = new ArrayList<>();
    AstNode n = cons;
    while (n instanceof Core.Cons
        && (n == cons || n.anns.isEmpty())
        && !isSkeletal((Core.Cons) n)) {
      heads.add(((Core.Cons) n).hd);
      n = ((Core.Cons) n).tl;
    }
    final AstNode tail = quote(n);
    if (batchLists && heads.size() >= 2) {
      tracer.onListBatch(heads.size());
      return call(BuiltIn.MAKE_LIST, list(heads), tail);
    }
    AstNode list = tail;
    for (int i = heads.size() - 1; i >= 0; i--) {
      list = call(BuiltIn.C_CONS, quote(heads.get(i)), list);
    }
    return list;
  }

  private static boolean isSkeletal(Core.Cons cons) {
    return cons.hd instanceof Core.Literal && cons.tl instanceof Core.Literal;
  }

  /** Quotes each node in a list, and returns a list expression. */
  private AstNode list(List<? extends AstNode> nodes) {
    return core.makeList(transformEager(nodes, this::quote));
  }

  /** Quotes a list of definitions, and returns a list expression whose
   * elements are two-element tuples. */
  private AstNode defs(
      List<? extends Map.Entry<? extends AstNode, AstNode>> defs) {
    return core.makeList(
        transformEager(defs, def ->
            core.tuple(quote(def.getKey()), quote(def.getValue()))));
  }

  private Core.Call call(BuiltIn builtIn, AstNode... args) {
    if (args.length != builtIn.arity) {
      throw new AssertionError("wrong number of arguments for " + builtIn);
    }
    return core.call(core.atom(module), core.atom(builtIn.functionName),
        Arrays.asList(args));
  }
}

// End Meta.java
