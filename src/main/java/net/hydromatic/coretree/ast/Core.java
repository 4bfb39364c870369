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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.coretree.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Map.Entry;
import java.util.Objects;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.MapTerm;
import net.hydromatic.coretree.term.TupleTerm;

/**
 * Syntax tree of the intermediate language.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Each node class has public final fields, and a {@code copy} method
 * that returns a node of the same kind with new children and the same
 * annotations (or {@code this} if the children are unchanged).
 *
 * <p>The constructors are package-private; create nodes using
 * {@link CoreBuilder#core}.
 */
public class Core {
  private Core() {}

  /** Returns whether two lists contain the same objects, by identity. */
  static boolean same(List<?> list0, List<?> list1) {
    if (list0 == list1) {
      return true;
    }
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** Constant, such as {@code 42}, {@code 'ok'} or {@code [1,{2,3}]}. A
   * leaf. */
  public static final class Literal extends AstNode {
    public final Object value;

    Literal(ImmutableList<Object> anns, Object value) {
      super(Op.LITERAL, anns);
      this.value = requireNonNull(value, "value");
    }

    @Override public int hashCode() {
      return Objects.hash(value, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && value.equals(((Literal) o).value)
          && anns.equals(((Literal) o).anns);
    }

    @Override public Literal withAnns(List<?> anns) {
      return new Literal(annList(anns), value);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendTerm(value);
    }

    @Override public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Variable. A leaf.
   *
   * <p>The name is an integer, an atom, or a function name
   * {@code {Atom, Arity}}. */
  public static final class Var extends AstNode {
    public final Object name;

    Var(ImmutableList<Object> anns, Object name) {
      super(Op.VAR, anns);
      this.name = requireNonNull(name, "name");
    }

    /** Returns whether an object is a valid variable name. */
    public static boolean isValidName(Object name) {
      return name instanceof BigInteger
          || name instanceof Atom
          || isFnameName(name);
    }

    static boolean isFnameName(Object name) {
      if (!(name instanceof TupleTerm)) {
        return false;
      }
      final TupleTerm t = (TupleTerm) name;
      return t.arity() == 2
          && t.get(0) instanceof Atom
          && t.get(1) instanceof BigInteger
          && ((BigInteger) t.get(1)).signum() >= 0;
    }

    /** Returns whether this is a function-name variable, such as
     * {@code 'f'/2}. */
    public boolean isFname() {
      return isFnameName(name);
    }

    @Override public int hashCode() {
      return Objects.hash(name, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Var
          && name.equals(((Var) o).name)
          && anns.equals(((Var) o).anns);
    }

    @Override public Var withAnns(List<?> anns) {
      return new Var(annList(anns), name);
    }

    @Override AstWriter unparse(AstWriter w) {
      if (name instanceof Atom) {
        return w.append(((Atom) name).name);
      } else if (name instanceof BigInteger) {
        return w.append("_").append(name.toString());
      } else {
        final TupleTerm t = (TupleTerm) name;
        return w.appendTerm(t.get(0)).append("/").append(t.get(1).toString());
      }
    }

    @Override public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List constructor cell, "{@code [hd | tl]}".
   *
   * <p>Long lists are chains of cons cells, so {@link #equals},
   * {@link #hashCode()} and {@link #toString()} loop along the tail. */
  public static final class Cons extends AstNode {
    public final AstNode hd;
    public final AstNode tl;

    Cons(ImmutableList<Object> anns, AstNode hd, AstNode tl) {
      super(Op.CONS, anns);
      this.hd = requireNonNull(hd, "hd");
      this.tl = requireNonNull(tl, "tl");
    }

    @Override public int hashCode() {
      int h = 1;
      AstNode n = this;
      for (; n instanceof Cons; n = ((Cons) n).tl) {
        h = (h * 31 + ((Cons) n).hd.hashCode()) * 31 + n.anns.hashCode();
      }
      return h * 31 + n.hashCode();
    }

    @Override public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Cons)) {
        return false;
      }
      AstNode a = this;
      AstNode b = (Cons) o;
      while (a instanceof Cons && b instanceof Cons) {
        if (a == b) {
          return true;
        }
        final Cons ca = (Cons) a;
        final Cons cb = (Cons) b;
        if (!ca.anns.equals(cb.anns) || !ca.hd.equals(cb.hd)) {
          return false;
        }
        a = ca.tl;
        b = cb.tl;
      }
      return a.equals(b);
    }

    @Override public Cons withAnns(List<?> anns) {
      return new Cons(annList(anns), hd, tl);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("[").append(hd);
      AstNode n = tl;
      while (n instanceof Cons && n.anns.isEmpty()) {
        w.append(", ").append(((Cons) n).hd);
        n = ((Cons) n).tl;
      }
      if (!(n instanceof Literal) || !n.anns.isEmpty()) {
        return w.append(" | ").append(n).append("]");
      }
      // Elements of a literal tail are written as if they were cells
      Object o = ((Literal) n).value;
      for (; o instanceof ListTerm.Cons; o = ((ListTerm.Cons) o).tail) {
        w.append(", ").appendTerm(((ListTerm.Cons) o).head);
      }
      if (o != ListTerm.NIL) {
        w.append(" | ").appendTerm(o);
      }
      return w.append("]");
    }

    public AstNode copy(AstNode hd, AstNode tl) {
      return hd == this.hd && tl == this.tl ? this
          : core.cons(hd, tl).withAnns(anns);
    }
  }

  /** Tuple constructor, "{@code {e1, ..., en}}". */
  public static final class Tuple extends AstNode {
    public final ImmutableList<AstNode> es;

    Tuple(ImmutableList<Object> anns, ImmutableList<AstNode> es) {
      super(Op.TUPLE, anns);
      this.es = requireNonNull(es, "es");
    }

    @Override public int hashCode() {
      return Objects.hash(es, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple
          && es.equals(((Tuple) o).es)
          && anns.equals(((Tuple) o).anns);
    }

    @Override public Tuple withAnns(List<?> anns) {
      return new Tuple(annList(anns), es);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("{", es, "}");
    }

    public AstNode copy(List<? extends AstNode> es) {
      return same(es, this.es) ? this : core.tuple(es).withAnns(anns);
    }
  }

  /** Multiple values, "{@code <e1, ..., en>}". */
  public static final class Values extends AstNode {
    public final ImmutableList<AstNode> es;

    Values(ImmutableList<Object> anns, ImmutableList<AstNode> es) {
      super(Op.VALUES, anns);
      this.es = requireNonNull(es, "es");
    }

    @Override public int hashCode() {
      return Objects.hash(op, es, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Values
          && es.equals(((Values) o).es)
          && anns.equals(((Values) o).anns);
    }

    @Override public Values withAnns(List<?> anns) {
      return new Values(annList(anns), es);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("<", es, ">");
    }

    public Values copy(List<? extends AstNode> es) {
      return same(es, this.es) ? this : core.values(es).withAnns(anns);
    }
  }

  /** Binary, "{@code #{segment1, ..., segmentN}#}". */
  public static final class Binary extends AstNode {
    public final ImmutableList<Bitstr> segments;

    Binary(ImmutableList<Object> anns, ImmutableList<Bitstr> segments) {
      super(Op.BINARY, anns);
      this.segments = requireNonNull(segments, "segments");
    }

    @Override public int hashCode() {
      return Objects.hash(op, segments, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && segments.equals(((Binary) o).segments)
          && anns.equals(((Binary) o).anns);
    }

    @Override public Binary withAnns(List<?> anns) {
      return new Binary(annList(anns), segments);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("#{", segments, "}#");
    }

    public Binary copy(List<Bitstr> segments) {
      return same(segments, this.segments) ? this
          : core.binary(segments).withAnns(anns);
    }
  }

  /** Segment of a binary, "{@code #<val>(size, unit, type, flags)}". */
  public static final class Bitstr extends AstNode {
    public final AstNode val;
    public final AstNode size;
    public final AstNode unit;
    public final AstNode type;
    public final AstNode flags;

    Bitstr(ImmutableList<Object> anns, AstNode val, AstNode size,
        AstNode unit, AstNode type, AstNode flags) {
      super(Op.BITSTR, anns);
      this.val = requireNonNull(val, "val");
      this.size = requireNonNull(size, "size");
      this.unit = requireNonNull(unit, "unit");
      this.type = requireNonNull(type, "type");
      this.flags = requireNonNull(flags, "flags");
    }

    @Override public int hashCode() {
      return Objects.hash(val, size, unit, type, flags, anns);
    }

    @Override public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Bitstr)) {
        return false;
      }
      final Bitstr that = (Bitstr) o;
      return val.equals(that.val)
          && size.equals(that.size)
          && unit.equals(that.unit)
          && type.equals(that.type)
          && flags.equals(that.flags)
          && anns.equals(that.anns);
    }

    @Override public Bitstr withAnns(List<?> anns) {
      return new Bitstr(annList(anns), val, size, unit, type, flags);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("#<").append(val).append(">(")
          .append(size).append(", ")
          .append(unit).append(", ")
          .append(type).append(", ")
          .append(flags).append(")");
    }

    public Bitstr copy(AstNode val, AstNode size, AstNode unit,
        AstNode type, AstNode flags) {
      return val == this.val
          && size == this.size
          && unit == this.unit
          && type == this.type
          && flags == this.flags
          ? this
          : core.bitstr(val, size, unit, type, flags).withAnns(anns);
    }
  }

  /** Lambda, "{@code fun (v1, ..., vn) -> body}". */
  public static final class Fun extends AstNode {
    public final ImmutableList<Var> vars;
    public final AstNode body;

    Fun(ImmutableList<Object> anns, ImmutableList<Var> vars, AstNode body) {
      super(Op.FUN, anns);
      this.vars = requireNonNull(vars, "vars");
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, vars, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Fun
          && vars.equals(((Fun) o).vars)
          && body.equals(((Fun) o).body)
          && anns.equals(((Fun) o).anns);
    }

    @Override public Fun withAnns(List<?> anns) {
      return new Fun(annList(anns), vars, body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("fun (", vars, ") -> ").append(body);
    }

    public Fun copy(List<Var> vars, AstNode body) {
      return same(vars, this.vars) && body == this.body ? this
          : core.fun(vars, body).withAnns(anns);
    }
  }

  /** Sequencing, "{@code do arg body}". */
  public static final class Seq extends AstNode {
    public final AstNode arg;
    public final AstNode body;

    Seq(ImmutableList<Object> anns, AstNode arg, AstNode body) {
      super(Op.SEQ, anns);
      this.arg = requireNonNull(arg, "arg");
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Seq
          && arg.equals(((Seq) o).arg)
          && body.equals(((Seq) o).body)
          && anns.equals(((Seq) o).anns);
    }

    @Override public Seq withAnns(List<?> anns) {
      return new Seq(annList(anns), arg, body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("do ").append(arg).append(" ").append(body);
    }

    public Seq copy(AstNode arg, AstNode body) {
      return arg == this.arg && body == this.body ? this
          : core.seq(arg, body).withAnns(anns);
    }
  }

  /** Let expression, "{@code let <v1, ..., vn> = arg in body}". */
  public static final class Let extends AstNode {
    public final ImmutableList<Var> vars;
    public final AstNode arg;
    public final AstNode body;

    Let(ImmutableList<Object> anns, ImmutableList<Var> vars, AstNode arg,
        AstNode body) {
      super(Op.LET, anns);
      this.vars = requireNonNull(vars, "vars");
      this.arg = requireNonNull(arg, "arg");
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, vars, arg, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Let
          && vars.equals(((Let) o).vars)
          && arg.equals(((Let) o).arg)
          && body.equals(((Let) o).body)
          && anns.equals(((Let) o).anns);
    }

    @Override public Let withAnns(List<?> anns) {
      return new Let(annList(anns), vars, arg, body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("let <", vars, "> = ").append(arg)
          .append(" in ").append(body);
    }

    public Let copy(List<Var> vars, AstNode arg, AstNode body) {
      return same(vars, this.vars) && arg == this.arg && body == this.body
          ? this
          : core.let(vars, arg, body).withAnns(anns);
    }
  }

  /** Recursive definitions,
   * "{@code letrec f1/a1 = fun1 ... fn/an = funN in body}". */
  public static final class Letrec extends AstNode {
    public final ImmutableList<Entry<Var, AstNode>> defs;
    public final AstNode body;

    Letrec(ImmutableList<Object> anns,
        ImmutableList<Entry<Var, AstNode>> defs, AstNode body) {
      super(Op.LETREC, anns);
      this.defs = requireNonNull(defs, "defs");
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, defs, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Letrec
          && defs.equals(((Letrec) o).defs)
          && body.equals(((Letrec) o).body)
          && anns.equals(((Letrec) o).anns);
    }

    @Override public Letrec withAnns(List<?> anns) {
      return new Letrec(annList(anns), defs, body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("letrec ").appendDefs(defs, " ")
          .append(" in ").append(body);
    }

    public Letrec copy(List<Entry<Var, AstNode>> defs, AstNode body) {
      return defs.equals(this.defs) && body == this.body ? this
          : core.letrec(defs, body).withAnns(anns);
    }
  }

  /** Case expression, "{@code case arg of clause1 ... clauseN end}". */
  public static final class Case extends AstNode {
    public final AstNode arg;
    public final ImmutableList<Clause> clauses;

    Case(ImmutableList<Object> anns, AstNode arg,
        ImmutableList<Clause> clauses) {
      super(Op.CASE, anns);
      this.arg = requireNonNull(arg, "arg");
      this.clauses = requireNonNull(clauses, "clauses");
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg, clauses, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Case
          && arg.equals(((Case) o).arg)
          && clauses.equals(((Case) o).clauses)
          && anns.equals(((Case) o).anns);
    }

    @Override public Case withAnns(List<?> anns) {
      return new Case(annList(anns), arg, clauses);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("case ").append(arg).append(" of");
      clauses.forEach(clause -> w.append(" ").append(clause));
      return w.append(" end");
    }

    public Case copy(AstNode arg, List<Clause> clauses) {
      return arg == this.arg && same(clauses, this.clauses) ? this
          : core.caseOf(arg, clauses).withAnns(anns);
    }
  }

  /** Clause, "{@code <p1, ..., pn> when guard -> body}". */
  public static final class Clause extends AstNode {
    public final ImmutableList<AstNode> pats;
    public final AstNode guard;
    public final AstNode body;

    Clause(ImmutableList<Object> anns, ImmutableList<AstNode> pats,
        AstNode guard, AstNode body) {
      super(Op.CLAUSE, anns);
      this.pats = requireNonNull(pats, "pats");
      this.guard = requireNonNull(guard, "guard");
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, pats, guard, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Clause
          && pats.equals(((Clause) o).pats)
          && guard.equals(((Clause) o).guard)
          && body.equals(((Clause) o).body)
          && anns.equals(((Clause) o).anns);
    }

    @Override public Clause withAnns(List<?> anns) {
      return new Clause(annList(anns), pats, guard, body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.appendAll("<", pats, "> when ").append(guard)
          .append(" -> ").append(body);
    }

    public Clause copy(List<? extends AstNode> pats, AstNode guard,
        AstNode body) {
      return same(pats, this.pats) && guard == this.guard && body == this.body
          ? this
          : core.clause(pats, guard, body).withAnns(anns);
    }
  }

  /** Alias pattern, "{@code var = pat}". */
  public static final class Alias extends AstNode {
    public final Var var;
    public final AstNode pat;

    Alias(ImmutableList<Object> anns, Var var, AstNode pat) {
      super(Op.ALIAS, anns);
      this.var = requireNonNull(var, "var");
      this.pat = requireNonNull(pat, "pat");
    }

    @Override public int hashCode() {
      return Objects.hash(op, var, pat, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Alias
          && var.equals(((Alias) o).var)
          && pat.equals(((Alias) o).pat)
          && anns.equals(((Alias) o).anns);
    }

    @Override public Alias withAnns(List<?> anns) {
      return new Alias(annList(anns), var, pat);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(var).append(" = ").append(pat);
    }

    public Alias copy(Var var, AstNode pat) {
      return var == this.var && pat == this.pat ? this
          : core.alias(var, pat).withAnns(anns);
    }
  }

  /** Receive expression,
   * "{@code receive clause1 ... clauseN after timeout -> action}". */
  public static final class Receive extends AstNode {
    public final ImmutableList<Clause> clauses;
    public final AstNode timeout;
    public final AstNode action;

    Receive(ImmutableList<Object> anns, ImmutableList<Clause> clauses,
        AstNode timeout, AstNode action) {
      super(Op.RECEIVE, anns);
      this.clauses = requireNonNull(clauses, "clauses");
      this.timeout = requireNonNull(timeout, "timeout");
      this.action = requireNonNull(action, "action");
    }

    @Override public int hashCode() {
      return Objects.hash(op, clauses, timeout, action, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Receive
          && clauses.equals(((Receive) o).clauses)
          && timeout.equals(((Receive) o).timeout)
          && action.equals(((Receive) o).action)
          && anns.equals(((Receive) o).anns);
    }

    @Override public Receive withAnns(List<?> anns) {
      return new Receive(annList(anns), clauses, timeout, action);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("receive");
      clauses.forEach(clause -> w.append(" ").append(clause));
      return w.append(" after ").append(timeout)
          .append(" -> ").append(action);
    }

    public Receive copy(List<Clause> clauses, AstNode timeout,
        AstNode action) {
      return same(clauses, this.clauses)
          && timeout == this.timeout
          && action == this.action
          ? this
          : core.receive(clauses, timeout, action).withAnns(anns);
    }
  }

  /** Application of a function value, "{@code apply op(a1, ..., an)}". */
  public static final class Apply extends AstNode {
    public final AstNode operator;
    public final ImmutableList<AstNode> args;

    Apply(ImmutableList<Object> anns, AstNode operator,
        ImmutableList<AstNode> args) {
      super(Op.APPLY, anns);
      this.operator = requireNonNull(operator, "operator");
      this.args = requireNonNull(args, "args");
    }

    @Override public int hashCode() {
      return Objects.hash(op, operator, args, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && operator.equals(((Apply) o).operator)
          && args.equals(((Apply) o).args)
          && anns.equals(((Apply) o).anns);
    }

    @Override public Apply withAnns(List<?> anns) {
      return new Apply(annList(anns), operator, args);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("apply ").append(operator).appendAll("(", args, ")");
    }

    public Apply copy(AstNode operator, List<? extends AstNode> args) {
      return operator == this.operator && same(args, this.args) ? this
          : core.apply(operator, args).withAnns(anns);
    }
  }

  /** Inter-module call, "{@code call module:name(a1, ..., an)}". */
  public static final class Call extends AstNode {
    public final AstNode module;
    public final AstNode name;
    public final ImmutableList<AstNode> args;

    Call(ImmutableList<Object> anns, AstNode module, AstNode name,
        ImmutableList<AstNode> args) {
      super(Op.CALL, anns);
      this.module = requireNonNull(module, "module");
      this.name = requireNonNull(name, "name");
      this.args = requireNonNull(args, "args");
    }

    @Override public int hashCode() {
      return Objects.hash(op, module, name, args, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && module.equals(((Call) o).module)
          && name.equals(((Call) o).name)
          && args.equals(((Call) o).args)
          && anns.equals(((Call) o).anns);
    }

    @Override public Call withAnns(List<?> anns) {
      return new Call(annList(anns), module, name, args);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("call ").append(module).append(":").append(name)
          .appendAll("(", args, ")");
    }

    public Call copy(AstNode module, AstNode name,
        List<? extends AstNode> args) {
      return module == this.module && name == this.name
          && same(args, this.args)
          ? this
          : core.call(module, name, args).withAnns(anns);
    }
  }

  /** Primitive operation, "{@code primop name(a1, ..., an)}". */
  public static final class PrimOp extends AstNode {
    public final AstNode name;
    public final ImmutableList<AstNode> args;

    PrimOp(ImmutableList<Object> anns, AstNode name,
        ImmutableList<AstNode> args) {
      super(Op.PRIMOP, anns);
      this.name = requireNonNull(name, "name");
      this.args = requireNonNull(args, "args");
    }

    @Override public int hashCode() {
      return Objects.hash(op, name, args, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PrimOp
          && name.equals(((PrimOp) o).name)
          && args.equals(((PrimOp) o).args)
          && anns.equals(((PrimOp) o).anns);
    }

    @Override public PrimOp withAnns(List<?> anns) {
      return new PrimOp(annList(anns), name, args);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("primop ").append(name).appendAll("(", args, ")");
    }

    public PrimOp copy(AstNode name, List<? extends AstNode> args) {
      return name == this.name && same(args, this.args) ? this
          : core.primop(name, args).withAnns(anns);
    }
  }

  /** Try expression,
   * "{@code try arg of <v1, ...> -> body catch <e1, ...> -> handler}". */
  public static final class Try extends AstNode {
    public final AstNode arg;
    public final ImmutableList<Var> vars;
    public final AstNode body;
    public final ImmutableList<Var> evars;
    public final AstNode handler;

    Try(ImmutableList<Object> anns, AstNode arg, ImmutableList<Var> vars,
        AstNode body, ImmutableList<Var> evars, AstNode handler) {
      super(Op.TRY, anns);
      this.arg = requireNonNull(arg, "arg");
      this.vars = requireNonNull(vars, "vars");
      this.body = requireNonNull(body, "body");
      this.evars = requireNonNull(evars, "evars");
      this.handler = requireNonNull(handler, "handler");
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg, vars, body, evars, handler, anns);
    }

    @Override public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Try)) {
        return false;
      }
      final Try that = (Try) o;
      return arg.equals(that.arg)
          && vars.equals(that.vars)
          && body.equals(that.body)
          && evars.equals(that.evars)
          && handler.equals(that.handler)
          && anns.equals(that.anns);
    }

    @Override public Try withAnns(List<?> anns) {
      return new Try(annList(anns), arg, vars, body, evars, handler);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("try ").append(arg)
          .appendAll(" of <", vars, "> -> ").append(body)
          .appendAll(" catch <", evars, "> -> ").append(handler);
    }

    public Try copy(AstNode arg, List<Var> vars, AstNode body,
        List<Var> evars, AstNode handler) {
      return arg == this.arg
          && same(vars, this.vars)
          && body == this.body
          && same(evars, this.evars)
          && handler == this.handler
          ? this
          : core.tryOf(arg, vars, body, evars, handler).withAnns(anns);
    }
  }

  /** Catch expression, "{@code catch body}". */
  public static final class Catch extends AstNode {
    public final AstNode body;

    Catch(ImmutableList<Object> anns, AstNode body) {
      super(Op.CATCH, anns);
      this.body = requireNonNull(body, "body");
    }

    @Override public int hashCode() {
      return Objects.hash(op, body, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Catch
          && body.equals(((Catch) o).body)
          && anns.equals(((Catch) o).anns);
    }

    @Override public Catch withAnns(List<?> anns) {
      return new Catch(annList(anns), body);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("catch ").append(body);
    }

    public Catch copy(AstNode body) {
      return body == this.body ? this : core.catchOf(body).withAnns(anns);
    }
  }

  /** Map expression or pattern, "{@code ~{pair1, ..., pairN | base}~}".
   *
   * <p>A map expression whose base and pairs are all literal is normally
   * folded into a {@link Literal}; see {@link CoreBuilder#map}. A map pattern
   * is never folded. */
  public static final class Map extends AstNode {
    public final AstNode base;
    public final ImmutableList<MapPair> pairs;
    public final boolean isPattern;

    Map(ImmutableList<Object> anns, AstNode base,
        ImmutableList<MapPair> pairs, boolean isPattern) {
      super(Op.MAP, anns);
      this.base = requireNonNull(base, "base");
      this.pairs = requireNonNull(pairs, "pairs");
      this.isPattern = isPattern;
    }

    @Override public int hashCode() {
      return Objects.hash(op, base, pairs, isPattern, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Map
          && base.equals(((Map) o).base)
          && pairs.equals(((Map) o).pairs)
          && isPattern == ((Map) o).isPattern
          && anns.equals(((Map) o).anns);
    }

    @Override public Map withAnns(List<?> anns) {
      return new Map(annList(anns), base, pairs, isPattern);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.appendAll("~{", pairs, "");
      if (!(base instanceof Literal
          && base.anns.isEmpty()
          && MapTerm.EMPTY.equals(((Literal) base).value))) {
        w.append(" | ").append(base);
      }
      return w.append("}~");
    }

    /** Creates a copy of this map. A map pattern remains a pattern; a map
     * expression is folded if possible. */
    public AstNode copy(AstNode base, List<MapPair> pairs) {
      if (base == this.base && same(pairs, this.pairs)) {
        return this;
      }
      if (isPattern) {
        return core.mapPattern(base, pairs).withAnns(anns);
      }
      return core.map(base, pairs).withAnns(anns);
    }
  }

  /** Map association, "{@code key => val}" or "{@code key := val}".
   *
   * <p>The operator is a literal atom, {@code assoc} or {@code exact}. */
  public static final class MapPair extends AstNode {
    public final AstNode operator;
    public final AstNode key;
    public final AstNode val;

    MapPair(ImmutableList<Object> anns, AstNode operator, AstNode key,
        AstNode val) {
      super(Op.MAP_PAIR, anns);
      this.operator = requireNonNull(operator, "operator");
      this.key = requireNonNull(key, "key");
      this.val = requireNonNull(val, "val");
    }

    /** Returns whether the operator is "{@code :=}", which requires the key
     * to be present. */
    public boolean isExact() {
      return operator instanceof Literal
          && ((Literal) operator).value == Atom.EXACT;
    }

    @Override public int hashCode() {
      return Objects.hash(op, operator, key, val, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MapPair
          && operator.equals(((MapPair) o).operator)
          && key.equals(((MapPair) o).key)
          && val.equals(((MapPair) o).val)
          && anns.equals(((MapPair) o).anns);
    }

    @Override public MapPair withAnns(List<?> anns) {
      return new MapPair(annList(anns), operator, key, val);
    }

    @Override AstWriter unparse(AstWriter w) {
      final String s;
      if (operator instanceof Literal && operator.anns.isEmpty()) {
        s = isExact() ? " := " : " => ";
      } else {
        s = " " + operator + " ";
      }
      return w.append(key).append(s).append(val);
    }

    public MapPair copy(AstNode operator, AstNode key, AstNode val) {
      return operator == this.operator && key == this.key && val == this.val
          ? this
          : core.mapPair(operator, key, val).withAnns(anns);
    }
  }

  /** Module definition,
   * "{@code module name [exports] attributes [attrs] defs end}". */
  public static final class Module extends AstNode {
    public final AstNode name;
    public final ImmutableList<Var> exports;
    public final ImmutableList<Entry<AstNode, AstNode>> attrs;
    public final ImmutableList<Entry<Var, AstNode>> defs;

    Module(ImmutableList<Object> anns, AstNode name,
        ImmutableList<Var> exports,
        ImmutableList<Entry<AstNode, AstNode>> attrs,
        ImmutableList<Entry<Var, AstNode>> defs) {
      super(Op.MODULE, anns);
      this.name = requireNonNull(name, "name");
      this.exports = requireNonNull(exports, "exports");
      this.attrs = requireNonNull(attrs, "attrs");
      this.defs = requireNonNull(defs, "defs");
    }

    @Override public int hashCode() {
      return Objects.hash(op, name, exports, attrs, defs, anns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Module
          && name.equals(((Module) o).name)
          && exports.equals(((Module) o).exports)
          && attrs.equals(((Module) o).attrs)
          && defs.equals(((Module) o).defs)
          && anns.equals(((Module) o).anns);
    }

    @Override public Module withAnns(List<?> anns) {
      return new Module(annList(anns), name, exports, attrs, defs);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("module ").append(name)
          .appendAll(" [", exports, "]")
          .append(" attributes [").appendDefs(attrs, ", ").append("] ")
          .appendDefs(defs, " ")
          .append(" end");
    }

    public Module copy(AstNode name, List<Var> exports,
        List<Entry<AstNode, AstNode>> attrs,
        List<Entry<Var, AstNode>> defs) {
      return name == this.name
          && same(exports, this.exports)
          && attrs.equals(this.attrs)
          && defs.equals(this.defs)
          ? this
          : core.module(name, exports, attrs, defs).withAnns(anns);
    }
  }
}

// End Core.java
