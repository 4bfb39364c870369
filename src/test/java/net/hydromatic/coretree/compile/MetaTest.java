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
import static net.hydromatic.coretree.compile.Meta.meta;
import static net.hydromatic.coretree.eval.MetaEvaluator.evalNode;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.ast.TreeGenerator;
import net.hydromatic.coretree.ast.Trees;
import net.hydromatic.coretree.eval.MetaEvaluator;
import net.hydromatic.coretree.eval.Prop;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.ListTerm;
import net.hydromatic.coretree.term.TupleTerm;
import net.hydromatic.coretree.util.ContractException;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Meta}.
 *
 * <p>Most tests evaluate the generated tree using {@link MetaEvaluator}, and
 * check that the result is the original tree. */
class MetaTest {
  private static final List<Object> META_VAR =
      ImmutableList.of(Atom.of("meta_var"));

  private static void checkRoundTrip(AstNode tree) {
    assertThat(evalNode(meta(tree)), is(tree));
  }

  /** Quotes a tree and collects the sizes of the list batches. */
  private static List<Integer> batches(Map<Prop, Object> config,
      AstNode tree) {
    final List<Integer> sizes = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnListBatch(Tracers.empty(), sizes::add);
    final AstNode quoted = new Meta(config, tracer).quote(tree);
    assertThat(evalNode(quoted), is(tree));
    return sizes;
  }

  @Test void testQuoteTuple() {
    final AstNode tree = core.tuple(core.var("X"), core.atom("a"));
    final AstNode quoted = meta(tree);
    assertThat(quoted,
        hasToString("call 'core':'c_tuple'([call 'core':'c_var'('X'), "
            + "call 'core':'c_atom'('a')])"));
    checkRoundTrip(tree);
  }

  @Test void testQuoteLiterals() {
    assertThat(meta(core.intLiteral(3)), hasToString("call 'core':'c_int'(3)"));
    assertThat(meta(core.nil()), hasToString("call 'core':'c_nil'()"));
    assertThat(meta(core.floatLiteral(2.5)),
        hasToString("call 'core':'c_float'(2.5)"));
    assertThat(meta(core.stringLiteral("hi")),
        hasToString("call 'core':'abstract'(\"hi\")"));
    checkRoundTrip(core.floatLiteral(2.5));
    checkRoundTrip(core.stringLiteral("hi"));
    checkRoundTrip(core.emptyMap());
  }

  @Test void testQuoteAnnotations() {
    final AstNode x = core.var("X").withAnns(ImmutableList.of(Atom.of("a")));
    assertThat(meta(x),
        hasToString("call 'core':'set_ann'(call 'core':'c_var'('X'), "
            + "['a'])"));
    checkRoundTrip(x);
    // An annotated literal keeps its annotations; its value does not
    checkRoundTrip(core.atom("b").withAnns(ImmutableList.of(Atom.of("c"))));
  }

  /** A tuple of literals that has not been folded stays a tuple. */
  @Test void testQuoteSkeletons() {
    final AstNode tuple = core.tupleSkel(core.intLiteral(1), core.atom("a"));
    assertThat(meta(tuple),
        hasToString("call 'core':'c_tuple_skel'([call 'core':'c_int'(1), "
            + "call 'core':'c_atom'('a')])"));
    checkRoundTrip(tuple);

    final AstNode cons = core.consSkel(core.intLiteral(1), core.nil());
    assertThat(meta(cons),
        hasToString("call 'core':'c_cons_skel'(call 'core':'c_int'(1), "
            + "call 'core':'c_nil'())"));
    final AstNode cons2 = evalNode(meta(cons));
    assertThat(cons2, instanceOf(Core.Cons.class));
    assertThat(cons2, is(cons));

    // An unfolded literal survives a round trip, and is still unfolded
    final AstNode unfolded =
        Trees.unfoldLiteral(
            core.literal(
                ListTerm.of(Atom.of("x"),
                    TupleTerm.of(BigInteger.ONE, ListTerm.NIL))));
    checkRoundTrip(unfolded);
    assertThat(Trees.foldLiteral(evalNode(meta(unfolded))),
        instanceOf(Core.Literal.class));
  }

  @Test void testMetaVar() {
    final Core.Var x = core.var("X").withAnns(META_VAR);
    final AstNode tree = core.tuple(x, core.atom("a"));
    final List<Core.Var> metaVars = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnMetaVar(Tracers.empty(), metaVars::add);
    final AstNode quoted =
        new Meta(ImmutableMap.of(), tracer).quote(tree);
    assertThat(quoted,
        hasToString("call 'core':'c_tuple'([X, call 'core':'c_atom'('a')])"));
    assertThat(metaVars, is(ImmutableList.of(core.var("X"))));

    // The value of the meta-variable is a tree
    final MetaEvaluator evaluator =
        new MetaEvaluator(ImmutableMap.of(),
            ImmutableMap.<Object, AstNode>of(Atom.of("X"), core.var("Y")),
            Tracers.empty());
    assertThat(evaluator.evalToNode(quoted),
        is(core.tuple(core.var("Y"), core.atom("a"))));

    // If the value is a literal, the tuple folds
    final MetaEvaluator evaluator2 =
        new MetaEvaluator(ImmutableMap.of(),
            ImmutableMap.<Object, AstNode>of(Atom.of("X"),
                core.intLiteral(0)),
            Tracers.empty());
    assertThat(evaluator2.evalToNode(quoted),
        is(core.literal(TupleTerm.of(BigInteger.ZERO, Atom.of("a")))));

    // Without a value, evaluation fails
    assertThrows(ContractException.class, () -> evalNode(quoted));
  }

  /** Only one occurrence of the marker is removed. */
  @Test void testMetaVarMarkerTwice() {
    final List<Object> anns =
        ImmutableList.of(Atom.of("meta_var"), Atom.of("b"),
            Atom.of("meta_var"));
    final AstNode quoted = meta(core.var("X").withAnns(anns));
    assertThat(quoted, instanceOf(Core.Var.class));
    assertThat(quoted.anns,
        is(ImmutableList.of(Atom.of("b"), Atom.of("meta_var"))));
  }

  @Test void testMetaVarMarkerConfig() {
    final Map<Prop, Object> config = new HashMap<>();
    Prop.META_VAR_MARKER.set(config, "hole");
    final Meta meta = new Meta(config, Tracers.empty());
    final AstNode x = core.var("X").withAnns(META_VAR);
    // With a different marker, 'meta_var' is an ordinary annotation
    assertThat(meta.quote(x),
        hasToString("call 'core':'set_ann'(call 'core':'c_var'('X'), "
            + "['meta_var'])"));
    final AstNode y =
        core.var("Y").withAnns(ImmutableList.of(Atom.of("hole")));
    assertThat(meta.quote(y), is(core.var("Y")));
  }

  @Test void testMetaModuleConfig() {
    final Map<Prop, Object> config =
        ImmutableMap.<Prop, Object>of(Prop.META_MODULE, "cerl");
    final AstNode tree = core.seq(core.var("X"), core.atom("ok"));
    final AstNode quoted = new Meta(config, Tracers.empty()).quote(tree);
    assertThat(quoted,
        hasToString("call 'cerl':'c_seq'(call 'cerl':'c_var'('X'), "
            + "call 'cerl':'c_atom'('ok'))"));
    final MetaEvaluator evaluator =
        new MetaEvaluator(config, ImmutableMap.of(), Tracers.empty());
    assertThat(evaluator.evalToNode(quoted), is(tree));
    // The default evaluator only understands calls to 'core'
    assertThrows(ContractException.class, () -> evalNode(quoted));
  }

  @Test void testListBatches() {
    final AstNode list =
        core.makeList(
            ImmutableList.of(core.var("X"), core.var("Y"), core.var("Z")));
    assertThat(batches(ImmutableMap.of(), list), is(ImmutableList.of(3)));
    assertThat(meta(list),
        hasToString("call 'core':'make_list'([call 'core':'c_var'('X'), "
            + "call 'core':'c_var'('Y'), call 'core':'c_var'('Z')], "
            + "call 'core':'c_nil'())"));

    // With batching switched off, one call per cell
    final Map<Prop, Object> config =
        ImmutableMap.<Prop, Object>of(Prop.BATCH_LISTS, false);
    assertThat(batches(config, list), empty());
    assertThat(new Meta(config, Tracers.empty()).quote(list),
        hasToString("call 'core':'c_cons'(call 'core':'c_var'('X'), "
            + "call 'core':'c_cons'(call 'core':'c_var'('Y'), "
            + "call 'core':'c_cons'(call 'core':'c_var'('Z'), "
            + "call 'core':'c_nil'())))"));

    // A run of one cell is not batched
    final AstNode one = core.cons(core.var("X"), core.var("T"));
    assertThat(batches(ImmutableMap.of(), one), empty());
  }

  /** An annotated cell breaks a run; the annotated cell starts a new run. */
  @Test void testListBatchesWithAnnotatedCell() {
    final AstNode tail =
        core.makeList(ImmutableList.of(core.var("Y"), core.var("Z")))
            .withAnns(ImmutableList.of(Atom.of("a")));
    final AstNode list = core.cons(core.var("X"), tail);
    assertThat(batches(ImmutableMap.of(), list), is(ImmutableList.of(2)));

    final AstNode list2 =
        core.makeList(ImmutableList.of(core.var("W"), core.var("X")), tail);
    assertThat(batches(ImmutableMap.of(), list2), is(ImmutableList.of(2, 2)));
  }

  /** A cell whose head and tail are literals ends a run, and is quoted
   * using {@code c_cons_skel}. */
  @Test void testListBatchesWithSkeletalCell() {
    final AstNode list =
        core.makeList(ImmutableList.of(core.var("X"), core.var("Y")),
            core.consSkel(core.intLiteral(1), core.nil()));
    assertThat(batches(ImmutableMap.of(), list), is(ImmutableList.of(2)));
    assertThat(meta(list),
        hasToString("call 'core':'make_list'([call 'core':'c_var'('X'), "
            + "call 'core':'c_var'('Y')], "
            + "call 'core':'c_cons_skel'(call 'core':'c_int'(1), "
            + "call 'core':'c_nil'()))"));
  }

  /** Quoting and evaluating a long list does not need stack proportional to
   * its length. */
  @Test void testLongList() {
    final int n = 100_000;
    final List<AstNode> vars = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      vars.add(core.var(i));
    }
    final AstNode list = core.makeList(vars);
    assertThat(batches(ImmutableMap.of(), list), is(ImmutableList.of(n)));

    final List<AstNode> ints = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      ints.add(core.intLiteral(i));
    }
    final AstNode unfolded = Trees.unfoldLiteral(core.makeList(ints));
    assertThat(batches(ImmutableMap.of(), unfolded),
        is(ImmutableList.of(n - 1)));
  }

  @Test void testOnQuote() {
    final List<AstNode> nodes = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnQuote(Tracers.empty(), (node, quoted) -> nodes.add(node));
    final AstNode tree = core.tuple(core.var("X"), core.atom("a"));
    new Meta(ImmutableMap.of(), tracer).quote(tree);
    assertThat(nodes.size(), is(3));
    assertThat(nodes.get(2), sameInstance(tree));
  }

  /** Quotes random trees, evaluates them, and checks that the result equals
   * the original tree. */
  @Test void testRandomRoundTrip() {
    final TreeGenerator generator = new TreeGenerator(20240101L);
    for (int i = 0; i < 500; i++) {
      checkRoundTrip(generator.expr(5));
    }
  }

  /** Quoting a meta tree gives a tree that evaluates to the meta tree. */
  @Test void testQuoteTwice() {
    final TreeGenerator generator = new TreeGenerator(7L);
    for (int i = 0; i < 50; i++) {
      final AstNode tree = generator.expr(3);
      final AstNode quoted = meta(tree);
      final AstNode quoted2 = meta(quoted);
      assertThat(evalNode(quoted2), is(quoted));
      assertThat(evalNode(evalNode(quoted2)), is(tree));
    }
  }
}

// End MetaTest.java
