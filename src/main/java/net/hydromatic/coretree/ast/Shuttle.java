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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Leaves are handled by {@link #visit(Core.Literal)} and
 * {@link #visit(Core.Var)}. Every other node is handled by
 * {@link #visitTree(AstNode)}, which transforms the subtrees (as returned by
 * {@link Trees#subtrees}), rebuilds the node if any of them changed, and then
 * calls {@link #post}. Sub-classes do not need to know about each kind of
 * node.
 *
 * <p>The cells of a list are transformed in a loop along the tails, not by
 * recursive calls to {@link #visitTree}, so a long list does not need a deep
 * stack. The order of calls is the same as for any other node: every head,
 * then the last tail, then {@link #post} for each cell, last cell first.
 *
 * <p>If nothing changes, returns the original node.
 */
public class Shuttle {
  /** Transforms a node. */
  public AstNode visit(AstNode node) {
    return node.accept(this);
  }

  protected AstNode visit(Core.Literal literal) {
    return literal;
  }

  protected AstNode visit(Core.Var var) {
    return var;
  }

  /** Transforms a node that is not a leaf. */
  protected AstNode visitTree(AstNode node) {
    if (node instanceof Core.Cons) {
      return visitCons((Core.Cons) node);
    }
    final List<List<AstNode>> groups = Trees.subtrees(node);
    List<List<AstNode>> groups2 = null;
    for (int i = 0; i < groups.size(); i++) {
      final List<AstNode> group = groups.get(i);
      final List<AstNode> group2 = visitList(group);
      if (group2 != group && groups2 == null) {
        groups2 = new ArrayList<>(groups.subList(0, i));
      }
      if (groups2 != null) {
        groups2.add(group2);
      }
    }
    return post(node,
        groups2 == null ? node : Trees.updateTree(node, groups2));
  }

  private AstNode visitCons(Core.Cons cons) {
    final List<Core.Cons> cells = new ArrayList<>();
    final List<AstNode> heads = new ArrayList<>();
    AstNode node = cons;
    while (node instanceof Core.Cons) {
      final Core.Cons cell = (Core.Cons) node;
      cells.add(cell);
      heads.add(cell.hd.accept(this));
      node = cell.tl;
    }
    AstNode tail = node.accept(this);
    for (int i = cells.size() - 1; i >= 0; i--) {
      final Core.Cons cell = cells.get(i);
      final AstNode hd = heads.get(i);
      final AstNode cell2 = hd == cell.hd && tail == cell.tl
          ? cell
          : Trees.updateTree(cell,
              ImmutableList.of(ImmutableList.of(hd), ImmutableList.of(tail)));
      tail = post(cell, cell2);
    }
    return tail;
  }

  /** Transforms a list of nodes. Returns the original list if no node
   * changed. */
  protected List<AstNode> visitList(List<AstNode> nodes) {
    List<AstNode> nodes2 = null;
    for (int i = 0; i < nodes.size(); i++) {
      final AstNode node = nodes.get(i);
      final AstNode node2 = node.accept(this);
      if (node2 != node && nodes2 == null) {
        nodes2 = new ArrayList<>(nodes.subList(0, i));
      }
      if (nodes2 != null) {
        nodes2.add(node2);
      }
    }
    return nodes2 == null ? nodes : nodes2;
  }

  /** Called after the subtrees of a node have been transformed.
   *
   * @param original Node before its subtrees were transformed
   * @param node Node after its subtrees were transformed; same as
   *             {@code original} if no subtree changed
   * @return Transformed node
   */
  protected AstNode post(AstNode original, AstNode node) {
    return node;
  }
}

// End Shuttle.java
