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
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.MapTerm;
import net.hydromatic.coretree.term.Terms;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;

/**
 * Utilities for syntax trees.
 *
 * <h2>Generic traversal</h2>
 *
 * <p>{@link #subtrees(AstNode)} returns the children of a node as a list of
 * groups (slots); {@link #makeTree(Op, List)} builds a node of a given kind
 * from such a list. For every non-leaf node {@code n},
 * {@code makeTree(n.op, subtrees(n))} is equivalent to {@code n} apart from
 * annotations (and apart from folding of literals). These two methods are
 * the only places that need to know the layout of each kind of node; a pass
 * such as {@link #postorder} is written once, for all kinds.
 *
 * <h2>Accessors</h2>
 *
 * <p>Many accessors accept both the composite form of a node and its folded
 * literal form; for example {@link #consHd} accepts a {@link Core.Cons} and a
 * literal non-empty list. If the node is of the wrong kind, they throw
 * {@link ContractException}. The predicates ({@code is*}) never throw.
 */
public abstract class Trees {
  private Trees() {}

  // generic traversal

  /**
   * Returns the subtrees of a node, grouped by category.
   *
   * <p>Returns an empty list for a leaf. The groups, by kind, are:
   *
   * <pre>{@code
   * alias     [var] [pat]
   * apply     [op] [args...]
   * binary    [segments...]
   * bitstr    [val] [size] [unit] [type] [flags]
   * call      [module] [name] [args...]
   * case      [arg] [clauses...]
   * catch     [body]
   * clause    [pats...] [guard] [body]
   * cons      [hd] [tl]
   * fun       [vars...] [body]
   * let       [vars...] [arg] [body]
   * letrec    [n1, f1, ..., nk, fk] [body]
   * map       [base] [pairs...]
   * map_pair  [op] [key] [val]
   * module    [name] [exports...] [k1, v1, ...] [n1, f1, ...]
   * primop    [name] [args...]
   * receive   [clauses...] [timeout] [action]
   * seq       [arg] [body]
   * try       [arg] [vars...] [body] [evars...] [handler]
   * tuple     [es...]
   * values    [es...]
   * }</pre>
   */
  public static List<List<AstNode>> subtrees(AstNode node) {
    switch (node.op) {
    case LITERAL:
    case VAR:
      return ImmutableList.of();

    case ALIAS:
      final Core.Alias alias = (Core.Alias) node;
      return ImmutableList.of(ImmutableList.of(alias.var),
          ImmutableList.of(alias.pat));

    case APPLY:
      final Core.Apply apply = (Core.Apply) node;
      return ImmutableList.of(ImmutableList.of(apply.operator), apply.args);

    case BINARY:
      return ImmutableList.of(nodes(((Core.Binary) node).segments));

    case BITSTR:
      final Core.Bitstr bitstr = (Core.Bitstr) node;
      return ImmutableList.of(ImmutableList.of(bitstr.val),
          ImmutableList.of(bitstr.size), ImmutableList.of(bitstr.unit),
          ImmutableList.of(bitstr.type), ImmutableList.of(bitstr.flags));

    case CALL:
      final Core.Call call = (Core.Call) node;
      return ImmutableList.of(ImmutableList.of(call.module),
          ImmutableList.of(call.name), call.args);

    case CASE:
      final Core.Case case_ = (Core.Case) node;
      return ImmutableList.of(ImmutableList.of(case_.arg),
          nodes(case_.clauses));

    case CATCH:
      return ImmutableList.of(ImmutableList.of(((Core.Catch) node).body));

    case CLAUSE:
      final Core.Clause clause = (Core.Clause) node;
      return ImmutableList.of(clause.pats, ImmutableList.of(clause.guard),
          ImmutableList.of(clause.body));

    case CONS:
      final Core.Cons cons = (Core.Cons) node;
      return ImmutableList.of(ImmutableList.of(cons.hd),
          ImmutableList.of(cons.tl));

    case FUN:
      final Core.Fun fun = (Core.Fun) node;
      return ImmutableList.of(nodes(fun.vars), ImmutableList.of(fun.body));

    case LET:
      final Core.Let let = (Core.Let) node;
      return ImmutableList.of(nodes(let.vars), ImmutableList.of(let.arg),
          ImmutableList.of(let.body));

    case LETREC:
      final Core.Letrec letrec = (Core.Letrec) node;
      return ImmutableList.of(flatten(letrec.defs),
          ImmutableList.of(letrec.body));

    case MAP:
      final Core.Map map = (Core.Map) node;
      return ImmutableList.of(ImmutableList.of(map.base), nodes(map.pairs));

    case MAP_PAIR:
      final Core.MapPair pair = (Core.MapPair) node;
      return ImmutableList.of(ImmutableList.of(pair.operator),
          ImmutableList.of(pair.key), ImmutableList.of(pair.val));

    case MODULE:
      final Core.Module module = (Core.Module) node;
      return ImmutableList.of(ImmutableList.of(module.name),
          nodes(module.exports),
          flatten(module.attrs), flatten(module.defs));

    case PRIMOP:
      final Core.PrimOp primOp = (Core.PrimOp) node;
      return ImmutableList.of(ImmutableList.of(primOp.name), primOp.args);

    case RECEIVE:
      final Core.Receive receive = (Core.Receive) node;
      return ImmutableList.of(nodes(receive.clauses),
          ImmutableList.of(receive.timeout), ImmutableList.of(receive.action));

    case SEQ:
      final Core.Seq seq = (Core.Seq) node;
      return ImmutableList.of(ImmutableList.of(seq.arg),
          ImmutableList.of(seq.body));

    case TRY:
      final Core.Try try_ = (Core.Try) node;
      return ImmutableList.of(ImmutableList.of(try_.arg), nodes(try_.vars),
          ImmutableList.of(try_.body), nodes(try_.evars),
          ImmutableList.of(try_.handler));

    case TUPLE:
      return ImmutableList.of(((Core.Tuple) node).es);

    case VALUES:
      return ImmutableList.of(((Core.Values) node).es);

    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  /** Widens a list of nodes of one kind to a list of nodes. */
  private static List<AstNode> nodes(List<? extends AstNode> list) {
    return ImmutableList.copyOf(list);
  }

  private static ImmutableList<AstNode> flatten(
      List<? extends Map.Entry<? extends AstNode, AstNode>> entries) {
    final ImmutableList.Builder<AstNode> b = ImmutableList.builder();
    entries.forEach(e -> b.add(e.getKey(), e.getValue()));
    return b.build();
  }

  /**
   * Creates a node of a given kind from groups of subtrees, in the layout
   * returned by {@link #subtrees(AstNode)}.
   *
   * <p>A {@code cons}, {@code tuple} or {@code map} whose subtrees are all
   * literals is folded into a literal. For {@code map}, the base may be
   * omitted (a single group of pairs), in which case it is the empty map.
   *
   * @throws ContractException if the kind is a leaf, or the groups do not
   * have the layout of the kind
   */
  public static AstNode makeTree(Op op, List<? extends List<AstNode>> groups) {
    switch (op) {
    case ALIAS:
      checkGroups(op, groups, 2);
      return core.alias(var(one(op, groups.get(0))), one(op, groups.get(1)));

    case APPLY:
      checkGroups(op, groups, 2);
      return core.apply(one(op, groups.get(0)), groups.get(1));

    case BINARY:
      checkGroups(op, groups, 1);
      return core.binary(ofKind(Core.Bitstr.class, groups.get(0)));

    case BITSTR:
      checkGroups(op, groups, 5);
      return core.bitstr(one(op, groups.get(0)), one(op, groups.get(1)),
          one(op, groups.get(2)), one(op, groups.get(3)),
          one(op, groups.get(4)));

    case CALL:
      checkGroups(op, groups, 3);
      return core.call(one(op, groups.get(0)), one(op, groups.get(1)),
          groups.get(2));

    case CASE:
      checkGroups(op, groups, 2);
      return core.caseOf(one(op, groups.get(0)),
          ofKind(Core.Clause.class, groups.get(1)));

    case CATCH:
      checkGroups(op, groups, 1);
      return core.catchOf(one(op, groups.get(0)));

    case CLAUSE:
      checkGroups(op, groups, 3);
      return core.clause(groups.get(0), one(op, groups.get(1)),
          one(op, groups.get(2)));

    case CONS:
      checkGroups(op, groups, 2);
      return core.cons(one(op, groups.get(0)), one(op, groups.get(1)));

    case FUN:
      checkGroups(op, groups, 2);
      return core.fun(ofKind(Core.Var.class, groups.get(0)),
          one(op, groups.get(1)));

    case LET:
      checkGroups(op, groups, 3);
      return core.let(ofKind(Core.Var.class, groups.get(0)),
          one(op, groups.get(1)), one(op, groups.get(2)));

    case LETREC:
      checkGroups(op, groups, 2);
      return core.letrec(pairs(op, groups.get(0), Core.Var.class),
          one(op, groups.get(1)));

    case MAP:
      if (groups.size() == 1) {
        return core.map(ofKind(Core.MapPair.class, groups.get(0)));
      }
      checkGroups(op, groups, 2);
      return core.map(one(op, groups.get(0)),
          ofKind(Core.MapPair.class, groups.get(1)));

    case MAP_PAIR:
      checkGroups(op, groups, 3);
      return core.mapPair(one(op, groups.get(0)), one(op, groups.get(1)),
          one(op, groups.get(2)));

    case MODULE:
      checkGroups(op, groups, 4);
      return core.module(one(op, groups.get(0)),
          ofKind(Core.Var.class, groups.get(1)),
          pairs(op, groups.get(2), AstNode.class),
          pairs(op, groups.get(3), Core.Var.class));

    case PRIMOP:
      checkGroups(op, groups, 2);
      return core.primop(one(op, groups.get(0)), groups.get(1));

    case RECEIVE:
      checkGroups(op, groups, 3);
      return core.receive(ofKind(Core.Clause.class, groups.get(0)),
          one(op, groups.get(1)), one(op, groups.get(2)));

    case SEQ:
      checkGroups(op, groups, 2);
      return core.seq(one(op, groups.get(0)), one(op, groups.get(1)));

    case TRY:
      checkGroups(op, groups, 5);
      return core.tryOf(one(op, groups.get(0)),
          ofKind(Core.Var.class, groups.get(1)), one(op, groups.get(2)),
          ofKind(Core.Var.class, groups.get(3)), one(op, groups.get(4)));

    case TUPLE:
      checkGroups(op, groups, 1);
      return core.tuple(groups.get(0));

    case VALUES:
      checkGroups(op, groups, 1);
      return core.values(groups.get(0));

    default:
      throw new ContractException("cannot make a tree of kind '" + op.tag
          + "'; it is a leaf");
    }
  }

  /** Creates a node of a given kind from groups of subtrees, and gives it
   * annotations. */
  public static AstNode annMakeTree(List<?> anns, Op op,
      List<? extends List<AstNode>> groups) {
    return makeTree(op, groups).withAnns(anns);
  }

  /**
   * Creates a node of the same kind as an existing node, with new subtrees
   * and the same annotations.
   *
   * <p>Unlike the {@code copy} methods of the node classes, always creates a
   * new node, so that an all-literal {@code cons} or {@code tuple} is folded.
   * A map pattern remains a map pattern.
   */
  public static AstNode updateTree(AstNode old,
      List<? extends List<AstNode>> groups) {
    if (old instanceof Core.Map && ((Core.Map) old).isPattern) {
      final Op op = old.op;
      final AstNode base;
      final List<AstNode> pairs;
      if (groups.size() == 1) {
        base = core.emptyMap();
        pairs = groups.get(0);
      } else {
        checkGroups(op, groups, 2);
        base = one(op, groups.get(0));
        pairs = groups.get(1);
      }
      return core.mapPattern(base, ofKind(Core.MapPair.class, pairs))
          .withAnns(old.anns);
    }
    return annMakeTree(old.anns, old.op, groups);
  }

  /** Creates a node of a given kind, with new subtrees and the annotations of
   * an existing node. */
  public static AstNode updateTree(AstNode old, Op op,
      List<? extends List<AstNode>> groups) {
    return annMakeTree(old.anns, op, groups);
  }

  /** Applies a function to every node of a tree, bottom-up.
   *
   * <p>The function is applied to each leaf, and to each composite node after
   * its subtrees have been transformed and the node rebuilt. */
  public static AstNode postorder(UnaryOperator<AstNode> fn, AstNode tree) {
    return tree.accept(
        new Shuttle() {
          @Override protected AstNode visit(Core.Literal literal) {
            return fn.apply(literal);
          }

          @Override protected AstNode visit(Core.Var var) {
            return fn.apply(var);
          }

          @Override protected AstNode post(AstNode original, AstNode node) {
            return fn.apply(node);
          }
        });
  }

  /** Returns the number of nodes in a tree. */
  public static int size(AstNode tree) {
    final int[] count = {0};
    tree.accept(
        new Visitor() {
          @Override protected void visit(Core.Literal literal) {
            ++count[0];
          }

          @Override protected void visit(Core.Var var) {
            ++count[0];
          }

          @Override protected void visitTree(AstNode node) {
            ++count[0];
            super.visitTree(node);
          }
        });
    return count[0];
  }

  private static void checkGroups(Op op, List<?> groups, int n) {
    if (groups.size() != n) {
      throw new ContractException("kind '" + op.tag + "' requires " + n
          + " groups of subtrees, got " + groups.size());
    }
  }

  private static AstNode one(Op op, List<AstNode> group) {
    if (group.size() != 1) {
      throw new ContractException("kind '" + op.tag
          + "' requires a group of one subtree, got " + group.size());
    }
    return group.get(0);
  }

  private static Core.Var var(AstNode node) {
    if (!(node instanceof Core.Var)) {
      throw ContractException.wrongKind(node, "variable");
    }
    return (Core.Var) node;
  }

  @SuppressWarnings("unchecked")
  private static <T extends AstNode> List<T> ofKind(Class<T> clazz,
      List<AstNode> group) {
    for (AstNode node : group) {
      if (!clazz.isInstance(node)) {
        throw ContractException.wrongKind(node,
            clazz.getSimpleName().toLowerCase(Locale.ROOT));
      }
    }
    return (List<T>) (List<?>) group;
  }

  private static <K extends AstNode> List<Map.Entry<K, AstNode>> pairs(Op op,
      List<AstNode> group, Class<K> keyClass) {
    if (group.size() % 2 != 0) {
      throw new ContractException("kind '" + op.tag
          + "' requires an even number of definition subtrees, got "
          + group.size());
    }
    final List<Map.Entry<K, AstNode>> list = new ArrayList<>();
    for (int i = 0; i < group.size(); i += 2) {
      final AstNode key = group.get(i);
      if (!keyClass.isInstance(key)) {
        throw ContractException.wrongKind(key, "variable");
      }
      list.add(Maps.immutableEntry(keyClass.cast(key), group.get(i + 1)));
    }
    return list;
  }

  // literals

  /** Returns whether a node is a literal. */
  public static boolean isLiteral(AstNode node) {
    return node instanceof Core.Literal;
  }

  /** Returns the value of a literal. */
  public static Object concrete(AstNode node) {
    if (!(node instanceof Core.Literal)) {
      throw ContractException.wrongKind(node, "literal");
    }
    return ((Core.Literal) node).value;
  }

  /**
   * Folds list and tuple skeletons into literals, bottom-up, wherever all of
   * their elements are (or become) literal. Other kinds of node are returned
   * unchanged, and are not searched.
   *
   * <p>Each folded node keeps the annotations of the skeleton it replaces.
   * Walks along the tail of a list with a loop, so that the stack does not
   * grow with the length of the list.
   */
  public static AstNode foldLiteral(AstNode node) {
    switch (node.op) {
    case TUPLE:
      final Core.Tuple tuple = (Core.Tuple) node;
      final List<AstNode> es = new ArrayList<>(tuple.es.size());
      tuple.es.forEach(e -> es.add(foldLiteral(e)));
      return withAnns(core.tuple(es), tuple.anns);

    case CONS:
      final List<Core.Cons> cells = new ArrayList<>();
      AstNode n = node;
      for (; n instanceof Core.Cons; n = ((Core.Cons) n).tl) {
        cells.add((Core.Cons) n);
      }
      AstNode list = foldLiteral(n);
      for (int i = cells.size() - 1; i >= 0; i--) {
        final Core.Cons cell = cells.get(i);
        list = withAnns(core.cons(foldLiteral(cell.hd), list), cell.anns);
      }
      return list;

    default:
      return node;
    }
  }

  private static AstNode withAnns(AstNode node, List<Object> anns) {
    return anns.isEmpty() && node.anns.isEmpty() ? node : node.withAnns(anns);
  }

  /**
   * Expands a literal tuple or non-empty list into a skeleton of
   * {@link Core.Tuple} and {@link Core.Cons} nodes, down to atomic values.
   * Other nodes, including other literals, are returned unchanged.
   *
   * <p>The annotations of the literal are copied to the top node only.
   */
  public static AstNode unfoldLiteral(AstNode node) {
    if (node instanceof Core.Literal) {
      final Object value = ((Core.Literal) node).value;
      if (value instanceof TupleTerm || value instanceof ListTerm.Cons) {
        return unfoldValue(value).withAnns(node.anns);
      }
    }
    return node;
  }

  private static AstNode unfoldValue(Object value) {
    if (value instanceof TupleTerm) {
      final List<AstNode> es = new ArrayList<>();
      ((TupleTerm) value).elements.forEach(e -> es.add(unfoldValue(e)));
      return core.tupleSkel(es);
    }
    if (value instanceof ListTerm.Cons) {
      final List<Object> heads = new ArrayList<>();
      Object o = value;
      for (; o instanceof ListTerm.Cons; o = ((ListTerm.Cons) o).tail) {
        heads.add(((ListTerm.Cons) o).head);
      }
      AstNode list = unfoldValue(o);
      for (int i = heads.size() - 1; i >= 0; i--) {
        list = core.consSkel(unfoldValue(heads.get(i)), list);
      }
      return list;
    }
    return core.literal(value);
  }

  /** Returns whether a node is an atom literal. */
  public static boolean isAtom(AstNode node) {
    return node instanceof Core.Literal
        && ((Core.Literal) node).value instanceof Atom;
  }

  /** Returns the value of an atom literal. */
  public static Atom atomVal(AstNode node) {
    if (!isAtom(node)) {
      throw ContractException.wrongKind(node, "atom literal");
    }
    return (Atom) ((Core.Literal) node).value;
  }

  /** Returns whether a node is an integer literal. */
  public static boolean isInt(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isInteger(((Core.Literal) node).value);
  }

  /** Returns the value of an integer literal. */
  public static BigInteger intVal(AstNode node) {
    if (!isInt(node)) {
      throw ContractException.wrongKind(node, "integer literal");
    }
    return (BigInteger) ((Core.Literal) node).value;
  }

  /** Returns whether a node is a float literal. */
  public static boolean isFloat(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isFloat(((Core.Literal) node).value);
  }

  /** Returns the value of a float literal. */
  public static double floatVal(AstNode node) {
    if (!isFloat(node)) {
      throw ContractException.wrongKind(node, "float literal");
    }
    return (Double) ((Core.Literal) node).value;
  }

  /** Returns whether a node is the empty list literal. */
  public static boolean isNil(AstNode node) {
    return node instanceof Core.Literal
        && ((Core.Literal) node).value == ListTerm.NIL;
  }

  /** Returns whether a node is a literal that may represent a character. */
  public static boolean isChar(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isCharValue(((Core.Literal) node).value);
  }

  /** Returns whether a node is a literal that may represent a printing
   * character. */
  public static boolean isPrintChar(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isPrintCharValue(((Core.Literal) node).value);
  }

  /** Returns whether a node is a literal that may represent a string. */
  public static boolean isString(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isCharList(((Core.Literal) node).value);
  }

  /** Returns whether a node is a literal that may represent a string of
   * printing characters. */
  public static boolean isPrintString(AstNode node) {
    return node instanceof Core.Literal
        && Terms.isPrintCharList(((Core.Literal) node).value);
  }

  /** Returns the value of a string literal. */
  public static String stringVal(AstNode node) {
    if (!isString(node)) {
      throw ContractException.wrongKind(node, "string literal");
    }
    return Terms.javaString(((Core.Literal) node).value);
  }

  // lists

  /** Returns whether a node is a list cell, composite or literal. */
  public static boolean isCons(AstNode node) {
    return node instanceof Core.Cons
        || node instanceof Core.Literal
            && ((Core.Literal) node).value instanceof ListTerm.Cons;
  }

  /** Returns the head of a list cell. */
  public static AstNode consHd(AstNode node) {
    if (node instanceof Core.Cons) {
      return ((Core.Cons) node).hd;
    }
    return core.literal(literalCons(node).head);
  }

  /** Returns the tail of a list cell. */
  public static AstNode consTl(AstNode node) {
    if (node instanceof Core.Cons) {
      return ((Core.Cons) node).tl;
    }
    return core.literal(literalCons(node).tail);
  }

  private static ListTerm.Cons literalCons(AstNode node) {
    if (!isCons(node)) {
      throw ContractException.wrongKind(node, "list cell");
    }
    return (ListTerm.Cons) ((Core.Literal) node).value;
  }

  /** Returns whether a node is a proper list, composite or literal. */
  public static boolean isList(AstNode node) {
    AstNode n = node;
    while (n instanceof Core.Cons) {
      n = ((Core.Cons) n).tl;
    }
    return n instanceof Core.Literal
        && ((Core.Literal) n).value instanceof ListTerm
        && ((ListTerm) ((Core.Literal) n).value).isProper();
  }

  /** Returns the elements of a proper list. Elements of a literal list are
   * returned as literals. */
  public static List<AstNode> listElements(AstNode node) {
    if (!isList(node)) {
      throw ContractException.wrongKind(node, "proper list");
    }
    final ImmutableList.Builder<AstNode> b = ImmutableList.builder();
    AstNode n = node;
    for (; n instanceof Core.Cons; n = ((Core.Cons) n).tl) {
      b.add(((Core.Cons) n).hd);
    }
    for (Object o : (ListTerm) ((Core.Literal) n).value) {
      b.add(core.literal(o));
    }
    return b.build();
  }

  /** Returns the number of elements of a proper list. */
  public static int listLength(AstNode node) {
    if (!isList(node)) {
      throw ContractException.wrongKind(node, "proper list");
    }
    int count = 0;
    AstNode n = node;
    for (; n instanceof Core.Cons; n = ((Core.Cons) n).tl) {
      ++count;
    }
    return count + ((ListTerm) ((Core.Literal) n).value).length();
  }

  /** Creates a proper list. */
  public static AstNode makeList(List<? extends AstNode> elements) {
    return core.makeList(elements);
  }

  /** Creates a list with a given tail. */
  public static AstNode makeList(List<? extends AstNode> elements,
      AstNode tail) {
    return core.makeList(elements, tail);
  }

  // tuples

  /** Returns whether a node is a tuple, composite or literal. */
  public static boolean isTuple(AstNode node) {
    return node instanceof Core.Tuple
        || node instanceof Core.Literal
            && ((Core.Literal) node).value instanceof TupleTerm;
  }

  /** Returns the elements of a tuple. Elements of a literal tuple are
   * returned as literals. */
  public static List<AstNode> tupleEs(AstNode node) {
    if (node instanceof Core.Tuple) {
      return ((Core.Tuple) node).es;
    }
    if (!isTuple(node)) {
      throw ContractException.wrongKind(node, "tuple");
    }
    final TupleTerm tuple = (TupleTerm) ((Core.Literal) node).value;
    final ImmutableList.Builder<AstNode> b = ImmutableList.builder();
    tuple.elements.forEach(e -> b.add(core.literal(e)));
    return b.build();
  }

  /** Returns the number of elements of a tuple. */
  public static int tupleArity(AstNode node) {
    if (node instanceof Core.Tuple) {
      return ((Core.Tuple) node).es.size();
    }
    if (!isTuple(node)) {
      throw ContractException.wrongKind(node, "tuple");
    }
    return ((TupleTerm) ((Core.Literal) node).value).arity();
  }

  // maps

  /** Returns whether a node is a map, composite or literal. */
  public static boolean isMap(AstNode node) {
    return node instanceof Core.Map
        || node instanceof Core.Literal
            && ((Core.Literal) node).value instanceof MapTerm;
  }

  /** Returns whether a node is a map pattern. */
  public static boolean isMapPattern(AstNode node) {
    return node instanceof Core.Map && ((Core.Map) node).isPattern;
  }

  /** Returns whether a node is an empty map: a literal empty map, or a map
   * with no pairs. */
  public static boolean isMapEmpty(AstNode node) {
    return node instanceof Core.Map && ((Core.Map) node).pairs.isEmpty()
        || node instanceof Core.Literal
            && MapTerm.EMPTY.equals(((Core.Literal) node).value);
  }

  /** Returns the pairs of a map. The entries of a literal map are returned
   * as {@code assoc} pairs whose nodes all have the annotations of the
   * literal. */
  public static List<Core.MapPair> mapEs(AstNode node) {
    if (node instanceof Core.Map) {
      return ((Core.Map) node).pairs;
    }
    if (!isMap(node)) {
      throw ContractException.wrongKind(node, "map");
    }
    final List<Object> anns = node.anns;
    final ImmutableList.Builder<Core.MapPair> b = ImmutableList.builder();
    ((MapTerm) ((Core.Literal) node).value).map.forEach((k, v) ->
        b.add(
            core.mapPair(core.atom(Atom.ASSOC).withAnns(anns),
                core.literal(k).withAnns(anns),
                core.literal(v).withAnns(anns))
            .withAnns(anns)));
    return b.build();
  }

  /** Returns the base of a map. The base of a literal map is the empty map,
   * with the annotations of the literal. */
  public static AstNode mapArg(AstNode node) {
    if (node instanceof Core.Map) {
      return ((Core.Map) node).base;
    }
    if (!isMap(node)) {
      throw ContractException.wrongKind(node, "map");
    }
    return core.emptyMap().withAnns(node.anns);
  }

  // function names

  /** Returns whether a node is a function-name variable. */
  public static boolean isFname(AstNode node) {
    return node instanceof Core.Var && ((Core.Var) node).isFname();
  }

  /** Returns the identifier of a function-name variable. */
  public static Atom fnameId(AstNode node) {
    return (Atom) fnameName(node).get(0);
  }

  /** Returns the arity of a function-name variable. */
  public static int fnameArity(AstNode node) {
    return ((BigInteger) fnameName(node).get(1)).intValueExact();
  }

  private static TupleTerm fnameName(AstNode node) {
    if (!isFname(node)) {
      throw ContractException.wrongKind(node, "function name");
    }
    return (TupleTerm) ((Core.Var) node).name;
  }

  // arities

  private static <T extends AstNode> T as(Class<T> clazz, AstNode node) {
    if (!clazz.isInstance(node)) {
      throw ContractException.wrongKind(node,
          clazz.getSimpleName().toLowerCase(Locale.ROOT));
    }
    return clazz.cast(node);
  }

  /** Returns the number of parameters of a lambda. */
  public static int funArity(AstNode node) {
    return as(Core.Fun.class, node).vars.size();
  }

  /** Returns the number of variables bound by a let. */
  public static int letArity(AstNode node) {
    return as(Core.Let.class, node).vars.size();
  }

  /** Returns the number of patterns of a clause. */
  public static int clauseArity(AstNode node) {
    return as(Core.Clause.class, node).pats.size();
  }

  /** Returns the arity of a case, which is the arity of its first clause. */
  public static int caseArity(AstNode node) {
    final Core.Case case_ = as(Core.Case.class, node);
    if (case_.clauses.isEmpty()) {
      throw ContractException.wrongKind(node, "case with clauses");
    }
    return case_.clauses.get(0).pats.size();
  }

  /** Returns the number of arguments of an application. */
  public static int applyArity(AstNode node) {
    return as(Core.Apply.class, node).args.size();
  }

  /** Returns the number of arguments of a call. */
  public static int callArity(AstNode node) {
    return as(Core.Call.class, node).args.size();
  }

  /** Returns the number of arguments of a primitive operation. */
  public static int primopArity(AstNode node) {
    return as(Core.PrimOp.class, node).args.size();
  }

  /** Returns the number of values of a multiple-value node. */
  public static int valuesArity(AstNode node) {
    return as(Core.Values.class, node).es.size();
  }

  // derived

  /** Returns the names defined by a letrec. */
  public static List<Core.Var> letrecVars(AstNode node) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    as(Core.Letrec.class, node).defs.forEach(def -> b.add(def.getKey()));
    return b.build();
  }

  /** Returns the names defined by a module. */
  public static List<Core.Var> moduleVars(AstNode node) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    as(Core.Module.class, node).defs.forEach(def -> b.add(def.getKey()));
    return b.build();
  }

  /**
   * Returns the total size in bits of a bit-string segment.
   *
   * <p>Returns an integer (the literal size times the unit) if the size is a
   * literal integer; {@code 'all'} if the size is {@code 'all'};
   * {@code 'utf'} for a UTF segment, whose size is {@code 'undefined'};
   * {@code 'any'} if the size is not a literal.
   */
  public static Object bitstrBitsize(AstNode node) {
    final Core.Bitstr bitstr = as(Core.Bitstr.class, node);
    if (!(bitstr.size instanceof Core.Literal)) {
      return Atom.ANY;
    }
    final Object size = ((Core.Literal) bitstr.size).value;
    if (size == Atom.ALL) {
      return Atom.ALL;
    }
    if (size == Atom.UNDEFINED) {
      if (!isAtom(bitstr.type)
          || !atomVal(bitstr.type).name.startsWith("utf")) {
        throw ContractException.wrongKind(bitstr.type, "utf segment type");
      }
      return Atom.of("utf");
    }
    if (size instanceof BigInteger) {
      return ((BigInteger) size).multiply(intVal(bitstr.unit));
    }
    throw ContractException.wrongKind(bitstr.size, "segment size");
  }

  // data constructors

  /** Returns whether a node is a data constructor: a literal, list cell or
   * tuple. */
  public static boolean isData(AstNode node) {
    return node instanceof Core.Literal
        || node instanceof Core.Cons
        || node instanceof Core.Tuple;
  }

  /** Returns the type of a data constructor. */
  public static DataType dataType(AstNode node) {
    switch (node.op) {
    case CONS:
      return DataType.CONS;
    case TUPLE:
      return DataType.TUPLE;
    case LITERAL:
      final Object value = ((Core.Literal) node).value;
      if (value instanceof ListTerm.Cons) {
        return DataType.CONS;
      }
      if (value instanceof TupleTerm) {
        return DataType.TUPLE;
      }
      return DataType.atomic(value);
    default:
      throw ContractException.wrongKind(node, "data constructor");
    }
  }

  /** Returns the elements of a data constructor: head and tail of a list
   * cell, elements of a tuple, or no elements for an atomic value. */
  public static List<AstNode> dataEs(AstNode node) {
    switch (dataType(node).kind) {
    case CONS:
      return ImmutableList.of(consHd(node), consTl(node));
    case TUPLE:
      return tupleEs(node);
    default:
      return ImmutableList.of();
    }
  }

  /** Returns the number of elements of a data constructor. */
  public static int dataArity(AstNode node) {
    switch (dataType(node).kind) {
    case CONS:
      return 2;
    case TUPLE:
      return tupleArity(node);
    default:
      return 0;
    }
  }

  /** Creates a data constructor, folding if possible. */
  public static AstNode makeData(DataType type, List<? extends AstNode> es) {
    return core.makeData(type, es);
  }

  /** Creates a data constructor that is not folded. */
  public static AstNode makeDataSkel(DataType type,
      List<? extends AstNode> es) {
    return core.makeDataSkel(type, es);
  }

  /** Creates a data constructor with the annotations of an existing node,
   * folding if possible. */
  public static AstNode updateData(AstNode old, DataType type,
      List<? extends AstNode> es) {
    return makeData(type, es).withAnns(old.anns);
  }

  /** Creates a data constructor with the annotations of an existing node,
   * not folded. */
  public static AstNode updateDataSkel(AstNode old, DataType type,
      List<? extends AstNode> es) {
    return makeDataSkel(type, es).withAnns(old.anns);
  }

  // representation hooks

  /** Converts a tree to the record representation. Trees are already in
   * that representation, so returns the tree. */
  public static AstNode toRecords(AstNode tree) {
    return tree;
  }

  /** Converts a tree from the record representation. Returns the tree. */
  public static AstNode fromRecords(AstNode tree) {
    return tree;
  }
}

// End Trees.java
