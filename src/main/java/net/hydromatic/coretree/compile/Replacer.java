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

import java.util.Map;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.ast.Shuttle;

/** Replaces variables with trees.
 *
 * <p>Variables are matched by name, whatever their annotations. Every
 * occurrence is replaced, including binding occurrences; so a variable that
 * is bound in the tree (by a {@code let}, {@code fun} or pattern, say) may
 * only be replaced by another variable. Replacing it by a tree of another
 * kind throws {@link net.hydromatic.coretree.util.ContractException}. */
public class Replacer extends Shuttle {
  protected final Map<Object, ? extends AstNode> substitution;

  private Replacer(Map<Object, ? extends AstNode> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Applies a substitution, keyed by variable name, to a tree. */
  public static AstNode substitute(Map<Object, ? extends AstNode> substitution,
      AstNode tree) {
    if (substitution.isEmpty()) {
      return tree;
    }
    final Replacer replacer = new Replacer(substitution);
    return tree.accept(replacer);
  }

  @Override protected AstNode visit(Core.Var var) {
    final AstNode node = substitution.get(var.name);
    return node != null ? node : var;
  }
}

// End Replacer.java
