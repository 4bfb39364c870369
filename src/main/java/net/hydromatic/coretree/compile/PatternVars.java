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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;
import net.hydromatic.coretree.util.ContractException;

/**
 * Finds the variables bound by patterns.
 *
 * <p>A pattern may contain only variables, literals, list cells, tuples,
 * maps and map pairs, binaries and bit-string segments, and aliases. The key
 * of a map pair and the size of a segment are expressions, not patterns, so
 * their variables are not bound by the pattern.
 *
 * <p>The order of the variables in the result is not defined.
 */
public abstract class PatternVars {
  private PatternVars() {}

  /** Returns the variables bound by a pattern. */
  public static List<Core.Var> patVars(AstNode pattern) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    addVars(b, pattern);
    return b.build();
  }

  /** Returns the variables bound by a list of patterns. */
  public static List<Core.Var> patListVars(List<? extends AstNode> patterns) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    patterns.forEach(pattern -> addVars(b, pattern));
    return b.build();
  }

  /** Returns the variables bound by the patterns of a clause. */
  public static List<Core.Var> clauseVars(AstNode clause) {
    if (!(clause instanceof Core.Clause)) {
      throw ContractException.wrongKind(clause, "clause");
    }
    return patListVars(((Core.Clause) clause).pats);
  }

  private static void addVars(ImmutableList.Builder<Core.Var> b,
      AstNode pattern) {
    AstNode node = pattern;
    // Loop along the tail of a list pattern; recurse into everything else.
    while (node instanceof Core.Cons) {
      addVars(b, ((Core.Cons) node).hd);
      node = ((Core.Cons) node).tl;
    }
    switch (node.op) {
    case VAR:
      final Core.Var var = (Core.Var) node;
      if (var.isFname()) {
        throw ContractException.wrongKind(var, "variable in pattern");
      }
      b.add(var);
      break;

    case LITERAL:
      break;

    case TUPLE:
      ((Core.Tuple) node).es.forEach(e -> addVars(b, e));
      break;

    case MAP:
      ((Core.Map) node).pairs.forEach(pair -> addVars(b, pair));
      break;

    case MAP_PAIR:
      final Core.MapPair pair = (Core.MapPair) node;
      addVars(b, pair.operator);
      addVars(b, pair.val);
      break;

    case BINARY:
      ((Core.Binary) node).segments.forEach(segment -> addVars(b, segment));
      break;

    case BITSTR:
      addVars(b, ((Core.Bitstr) node).val);
      break;

    case ALIAS:
      final Core.Alias alias = (Core.Alias) node;
      addVars(b, alias.var);
      addVars(b, alias.pat);
      break;

    default:
      throw ContractException.wrongKind(node, "pattern");
    }
  }
}

// End PatternVars.java
