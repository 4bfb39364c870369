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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.coretree.util.ContractException;

/** Kinds of {@link AstNode}. */
public enum Op {
  ALIAS,
  APPLY,
  BINARY,
  BITSTR,
  CALL,
  CASE,
  CATCH,
  CLAUSE,
  CONS,
  FUN,
  LET,
  LETREC,
  /** Constant; a leaf. */
  LITERAL(true),
  MAP,
  MAP_PAIR,
  MODULE,
  PRIMOP,
  RECEIVE,
  SEQ,
  TRY,
  TUPLE,
  VALUES,
  /** Variable; a leaf. */
  VAR(true);

  /** Lower-case name of the kind, e.g. "map_pair". */
  public final String tag;

  private final boolean leaf;

  /** Map from {@link #tag} to kind. */
  public static final ImmutableMap<String, Op> BY_TAG;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      b.put(op.tag, op);
    }
    BY_TAG = b.build();
  }

  Op() {
    this(false);
  }

  Op(boolean leaf) {
    this.leaf = leaf;
    this.tag = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_UNDERSCORE,
        name());
  }

  /** Returns whether nodes of this kind have no subtrees. The leaf kinds are
   * {@link #LITERAL} and {@link #VAR}. */
  public boolean isLeaf() {
    return leaf;
  }

  /** Looks up a kind by its tag. Throws if not found; never returns null. */
  public static Op lookup(String tag) {
    final Op op = BY_TAG.get(tag);
    if (op == null) {
      throw new ContractException("unknown node kind '" + tag + "'");
    }
    return op;
  }
}

// End Op.java
