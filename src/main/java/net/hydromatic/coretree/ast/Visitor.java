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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits syntax trees, in pre-order.
 *
 * <p>Leaves are handled by {@link #visit(Core.Literal)} and
 * {@link #visit(Core.Var)}; every other node by {@link #visitTree}, whose
 * default implementation visits the subtrees of the node in the order given
 * by {@link Trees#subtrees}. A sub-class that overrides {@code visitTree}
 * should do its work and then call {@code super.visitTree(node)}.
 *
 * <p>The walk keeps pending nodes on an explicit stack, not on the Java
 * stack, so a long list or a deep tree does not overflow it. During a walk,
 * {@code super.visitTree(node)} only schedules the subtrees of {@code node};
 * they are visited after {@code visitTree} returns.
 */
public class Visitor {
  /** Nodes waiting to be visited; null when no walk is in progress. */
  private @Nullable Deque<AstNode> pending;

  /** Visits a node. */
  public void visit(AstNode node) {
    node.accept(this);
  }

  protected void visit(Core.Literal literal) {
  }

  protected void visit(Core.Var var) {
  }

  protected void visitTree(AstNode node) {
    if (pending != null) {
      push(pending, node);
      return;
    }
    final Deque<AstNode> stack = new ArrayDeque<>();
    pending = stack;
    try {
      push(stack, node);
      while (!stack.isEmpty()) {
        stack.pop().accept(this);
      }
    } finally {
      pending = null;
    }
  }

  /** Pushes the subtrees of a node so that the first is popped first. */
  private static void push(Deque<AstNode> stack, AstNode node) {
    final List<List<AstNode>> groups = Trees.subtrees(node);
    for (int i = groups.size() - 1; i >= 0; i--) {
      final List<AstNode> group = groups.get(i);
      for (int j = group.size() - 1; j >= 0; j--) {
        stack.push(group.get(j));
      }
    }
  }
}

// End Visitor.java
