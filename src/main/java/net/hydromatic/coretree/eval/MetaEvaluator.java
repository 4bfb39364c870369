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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.compile.BuiltIn;
import net.hydromatic.coretree.compile.Tracer;
import net.hydromatic.coretree.compile.Tracers;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;

/**
 * Evaluates trees generated by {@link net.hydromatic.coretree.compile.Meta}.
 *
 * <p>Only a small language is understood:
 *
 * <ul>
 *   <li>a literal evaluates to its value;
 *   <li>a list cell or tuple evaluates to a list or tuple of the values of its
 *       elements;
 *   <li>a variable evaluates to its value in the environment (this is how
 *       meta-variables are given values);
 *   <li>a call to a {@link BuiltIn} function of the meta module applies
 *       the function to the values of its arguments.
 * </ul>
 *
 * <p>Anything else throws {@link ContractException}.
 */
public class MetaEvaluator {
  private final Atom module;
  private final Map<Object, Object> env;
  private final Tracer tracer;

  /** Creates an evaluator.
   *
   * @param config Configuration; {@link Prop#META_MODULE} is the module whose
   *               calls are evaluated
   * @param env Values of variables, keyed by variable name
   * @param tracer Tracer
   */
  public MetaEvaluator(Map<Prop, Object> config, Map<Object, ?> env,
      Tracer tracer) {
    this.module = Atom.of(Prop.META_MODULE.stringValue(config));
    this.env = ImmutableMap.copyOf(env);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Evaluates a tree that constructs a tree, with default configuration
   * and an empty environment. */
  public static AstNode evalNode(AstNode tree) {
    return new MetaEvaluator(ImmutableMap.of(), ImmutableMap.of(),
        Tracers.empty()).evalToNode(tree);
  }

  /** Evaluates a tree, and checks that the result is a tree. */
  public AstNode evalToNode(AstNode tree) {
    final Object o = eval(tree);
    if (!(o instanceof AstNode)) {
      throw ContractException.wrongKind(o, "node");
    }
    return (AstNode) o;
  }

  /** Evaluates a tree. */
  public Object eval(AstNode tree) {
    switch (tree.op) {
    case LITERAL:
      return ((Core.Literal) tree).value;

    case VAR:
      final Core.Var var = (Core.Var) tree;
      final Object value = env.get(var.name);
      if (value == null) {
        throw new ContractException("unbound variable " + var);
      }
      return value;

    case CONS:
      final List<Object> heads = new ArrayList<>();
      AstNode n = tree;
      for (; n instanceof Core.Cons; n = ((Core.Cons) n).tl) {
        heads.add(eval(((Core.Cons) n).hd));
      }
      return ListTerm.of(heads, eval(n));

    case TUPLE:
      final List<Object> values = new ArrayList<>();
      ((Core.Tuple) tree).es.forEach(e -> values.add(eval(e)));
      return TupleTerm.of(values);

    case CALL:
      return evalCall((Core.Call) tree);

    default:
      throw ContractException.wrongKind(tree, "meta expression");
    }
  }

  private Object evalCall(Core.Call call) {
    if (!(call.module instanceof Core.Literal)
        || ((Core.Literal) call.module).value != module
        || !(call.name instanceof Core.Literal)
        || !(((Core.Literal) call.name).value instanceof Atom)) {
      throw ContractException.wrongKind(call, "call to module " + module);
    }
    final Atom name = (Atom) ((Core.Literal) call.name).value;
    final BuiltIn builtIn = BuiltIn.lookup(name.name, call.args.size());
    if (builtIn == null) {
      throw new ContractException("unknown built-in function " + name.name
          + "/" + call.args.size());
    }
    final List<Object> args = new ArrayList<>(call.args.size());
    call.args.forEach(arg -> args.add(eval(arg)));
    final Object result = Codes.applicable(builtIn).apply(args);
    tracer.onEval(call, result);
    return result;
  }
}

// End MetaEvaluator.java
