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
import static net.hydromatic.coretree.eval.MetaEvaluator.evalNode;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.compile.BuiltIn;
import net.hydromatic.coretree.compile.Tracer;
import net.hydromatic.coretree.compile.Tracers;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;
import org.junit.jupiter.api.Test;

/** Unit test for {@link MetaEvaluator} and {@link Codes}. */
class MetaEvaluatorTest {
  private static AstNode call(String name, AstNode... args) {
    return core.call("core", name, args);
  }

  @Test void testEvalValues() {
    final MetaEvaluator evaluator =
        new MetaEvaluator(ImmutableMap.of(),
            ImmutableMap.<Object, Object>of(Atom.of("N"), BigInteger.TEN),
            Tracers.empty());
    assertThat(evaluator.eval(core.atom("a")), is(Atom.of("a")));
    assertThat(evaluator.eval(core.var("N")), is(BigInteger.TEN));
    assertThat(
        evaluator.eval(
            core.makeList(ImmutableList.of(core.var("N"), core.atom("b")))),
        is(ListTerm.of(BigInteger.TEN, Atom.of("b"))));
    assertThat(
        evaluator.eval(core.tupleSkel(core.var("N"), core.var("N"))),
        is(TupleTerm.of(BigInteger.TEN, BigInteger.TEN)));
  }

  @Test void testEvalCalls() {
    assertThat(evalNode(call("c_atom", core.atom("x"))), is(core.atom("x")));
    assertThat(
        evalNode(
            call("c_cons", call("c_int", core.intLiteral(1)), call("c_nil"))),
        is(core.literal(ListTerm.of(BigInteger.ONE))));
    assertThat(
        evalNode(
            call("c_cons_skel", call("c_int", core.intLiteral(1)),
                call("c_nil"))),
        is(core.consSkel(core.intLiteral(1), core.nil())));
    assertThat(
        evalNode(
            call("c_letrec",
                core.makeList(
                    ImmutableList.of(
                        core.tupleSkel(
                            call("c_var",
                                core.literal(
                                    TupleTerm.of(Atom.of("f"),
                                        BigInteger.ZERO))),
                            call("c_fun", core.nil(),
                                call("c_atom", core.atom("ok")))))),
                call("c_apply",
                    call("c_var",
                        core.literal(
                            TupleTerm.of(Atom.of("f"), BigInteger.ZERO))),
                    core.nil()))),
        is(
            core.letrec(
                ImmutableList.of(
                    core.def(core.fname("f", 0),
                        core.fun(ImmutableList.of(), core.atom("ok")))),
                core.apply(core.fname("f", 0), ImmutableList.of()))));
  }

  @Test void testOnEval() {
    final List<Core.Call> calls = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnEval(Tracers.empty(), (call, result) -> calls.add(call));
    final MetaEvaluator evaluator =
        new MetaEvaluator(ImmutableMap.of(), ImmutableMap.of(), tracer);
    final AstNode tree =
        call("c_seq", call("c_var", core.atom("X")), call("c_nil"));
    assertThat(evaluator.evalToNode(tree),
        is(core.seq(core.var("X"), core.nil())));
    assertThat(calls, hasSize(3));
    assertThat(calls.get(2), is(tree));
  }

  @Test void testErrors() {
    // not a meta expression
    assertThrows(ContractException.class,
        () -> evalNode(core.seq(core.nil(), core.nil())));
    // unknown function, and known function with wrong number of arguments
    assertThrows(ContractException.class,
        () -> evalNode(call("c_lambda", core.nil())));
    assertThrows(ContractException.class,
        () -> evalNode(call("c_atom", core.atom("a"), core.atom("b"))));
    // wrong module
    assertThrows(ContractException.class,
        () -> evalNode(core.call("lists", "c_nil")));
    // function name is not an atom
    assertThrows(ContractException.class,
        () -> evalNode(
            core.call(core.atom("core"), core.var("F"), ImmutableList.of())));
    // argument of the wrong kind
    assertThrows(ContractException.class,
        () -> evalNode(call("c_atom", core.intLiteral(1))));
    assertThrows(ContractException.class,
        () -> evalNode(call("c_tuple", core.atom("not_a_list"))));
    assertThrows(ContractException.class,
        () -> evalNode(
            call("c_letrec",
                core.makeList(ImmutableList.of(core.tupleSkel(call("c_nil")))),
                call("c_nil"))));
    // the result is not a tree
    assertThrows(ContractException.class,
        () -> evalNode(core.atom("a")));
    // unbound variable
    assertThrows(ContractException.class,
        () -> evalNode(call("c_atom", core.var("A"))));
  }

  @Test void testAbstract() {
    final Object value =
        TupleTerm.of(Atom.of("a"), ListTerm.of(BigInteger.ONE));
    final AstNode node =
        (AstNode) Codes.applicable(BuiltIn.ABSTRACT)
            .apply(ImmutableList.of(value));
    assertThat(node, is(core.literal(value)));
    assertThrows(ContractException.class,
        () -> Codes.applicable(BuiltIn.C_FLOAT)
            .apply(ImmutableList.of(Double.NaN)));
  }
}

// End MetaEvaluatorTest.java
