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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax tree node.
 *
 * <p>Every node has a kind, {@link #op}, and a list of annotations,
 * {@link #anns}. Annotations are arbitrary values; the tree library carries
 * them but never interprets them. A new node has no annotations.
 *
 * <p>Nodes are immutable. Operations that "update" a node return a new node.
 * Nodes do not refer to their parents, so a sub-tree may be shared by several
 * trees.
 *
 * <p>Nodes are created via {@link CoreBuilder#core}, and the sub-classes are
 * in {@link Core}.
 */
public abstract class AstNode {
  public final Op op;
  public final ImmutableList<Object> anns;

  AstNode(Op op, ImmutableList<Object> anns) {
    this.op = requireNonNull(op);
    this.anns = requireNonNull(anns);
  }

  /** Returns whether this node is a leaf (a literal or variable). */
  public final boolean isLeaf() {
    return op.isLeaf();
  }

  /** Returns a copy of this node with the given list of annotations. */
  public abstract AstNode withAnns(List<?> anns);

  /**
   * Returns a copy of this node with some annotations added. The new
   * annotations come before the existing ones.
   */
  public AstNode addAnns(List<?> anns) {
    if (anns.isEmpty()) {
      return this;
    }
    return withAnns(
        ImmutableList.builder().addAll(anns).addAll(this.anns).build());
  }

  /**
   * Returns a copy of this node with the annotations of another node. The
   * annotations of this node are discarded, not merged.
   */
  public AstNode copyAnns(AstNode source) {
    return withAnns(source.anns);
  }

  /**
   * Converts this node into a string in the syntax of the intermediate
   * language.
   *
   * <p>The purpose of this string is debugging.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return new AstWriter().append(this).toString();
  }

  /** Writes the node, not including its annotations. */
  abstract AstWriter unparse(AstWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public AstNode accept(Shuttle shuttle) {
    return shuttle.visitTree(this);
  }

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this node.
   */
  public void accept(Visitor visitor) {
    visitor.visitTree(this);
  }

  /** Converts a list of annotations to an immutable list. */
  static ImmutableList<Object> annList(List<?> anns) {
    return ImmutableList.copyOf(anns);
  }
}

// End AstNode.java
