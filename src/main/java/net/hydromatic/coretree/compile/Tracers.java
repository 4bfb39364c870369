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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each quoted node,
   * then calls the underlying tracer. */
  public static Tracer withOnQuote(Tracer tracer,
      BiConsumer<AstNode, AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onQuote(AstNode node, AstNode quoted) {
        consumer.accept(node, quoted);
        super.onQuote(node, quoted);
      }
    };
  }

  /** Returns a tracer that performs the given action on each meta-variable,
   * then calls the underlying tracer. */
  public static Tracer withOnMetaVar(Tracer tracer,
      Consumer<Core.Var> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onMetaVar(Core.Var var) {
        consumer.accept(var);
        super.onMetaVar(var);
      }
    };
  }

  /** Returns a tracer that performs the given action on the size of each
   * batch of list cells, then calls the underlying tracer. */
  public static Tracer withOnListBatch(Tracer tracer, IntConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onListBatch(int size) {
        consumer.accept(size);
        super.onListBatch(size);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * evaluated call, then calls the underlying tracer. */
  public static Tracer withOnEval(Tracer tracer,
      BiConsumer<Core.Call, Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEval(Core.Call call, Object result) {
        consumer.accept(call, result);
        super.onEval(call, result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onQuote(AstNode node, AstNode quoted) {
    }

    @Override public void onMetaVar(Core.Var var) {
    }

    @Override public void onListBatch(int size) {
    }

    @Override public void onEval(Core.Call call, Object result) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onQuote(AstNode node, AstNode quoted) {
      tracer.onQuote(node, quoted);
    }

    @Override public void onMetaVar(Core.Var var) {
      tracer.onMetaVar(var);
    }

    @Override public void onListBatch(int size) {
      tracer.onListBatch(size);
    }

    @Override public void onEval(Core.Call call, Object result) {
      tracer.onEval(call, result);
    }
  }
}

// End Tracers.java
