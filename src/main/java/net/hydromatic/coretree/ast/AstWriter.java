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

import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.term.Terms;

/** Context for writing a tree out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a value in the syntax of literals. */
  public AstWriter appendTerm(Object o) {
    Terms.unparse(b, o);
    return this;
  }

  /**
   * Appends a node. If the node has annotations, writes
   * "{@code (node -| [ann1, ann2])}".
   */
  public AstWriter append(AstNode node) {
    if (node.anns.isEmpty()) {
      return node.unparse(this);
    }
    append("(");
    node.unparse(this);
    append(" -| [");
    for (int i = 0; i < node.anns.size(); i++) {
      append(i > 0 ? ", " : "").appendTerm(node.anns.get(i));
    }
    return append("])");
  }

  /** Appends a list of nodes, separated by commas, between delimiters. */
  public AstWriter appendAll(String left, List<? extends AstNode> nodes,
      String right) {
    append(left);
    for (int i = 0; i < nodes.size(); i++) {
      append(i > 0 ? ", " : "").append(nodes.get(i));
    }
    return append(right);
  }

  /** Appends a list of definitions, such as "{@code f/1 = fun ...}". */
  public AstWriter appendDefs(
      List<? extends Map.Entry<? extends AstNode, AstNode>> defs,
      String separator) {
    for (int i = 0; i < defs.size(); i++) {
      final Map.Entry<? extends AstNode, AstNode> def = defs.get(i);
      append(i > 0 ? separator : "").append(def.getKey())
          .append(" = ").append(def.getValue());
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
