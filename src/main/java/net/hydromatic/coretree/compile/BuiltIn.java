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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions of the meta module.
 *
 * <p>Each is a constructor of a tree node, and is identified by its name
 * (for example "c_cons") and its number of arguments. {@link Meta} generates
 * calls to these functions, and
 * {@link net.hydromatic.coretree.eval.MetaEvaluator} evaluates them.
 */
public enum BuiltIn {
  /** Function "c_atom(Name)" creates an atom literal. */
  C_ATOM(1),

  /** Function "c_int(Value)" creates an integer literal. */
  C_INT(1),

  /** Function "c_float(Value)" creates a float literal. */
  C_FLOAT(1),

  /** Function "c_nil()" creates the empty list literal. */
  C_NIL(0),

  /** Function "abstract(Value)" creates a literal of any value. */
  ABSTRACT(1),

  /** Function "c_var(Name)" creates a variable. */
  C_VAR(1),

  /** Function "set_ann(Node, Annotations)" sets the annotations of a
   * node. */
  SET_ANN(2),

  /** Function "c_cons(Head, Tail)" creates a list cell, folding if
   * possible. */
  C_CONS(2),

  /** Function "c_cons_skel(Head, Tail)" creates a list cell that is not
   * folded. */
  C_CONS_SKEL(2),

  /** Function "make_list(Elements, Tail)" creates a list from a list of
   * elements. */
  MAKE_LIST(2),

  /** Function "c_tuple(Elements)" creates a tuple, folding if possible. */
  C_TUPLE(1),

  /** Function "c_tuple_skel(Elements)" creates a tuple that is not
   * folded. */
  C_TUPLE_SKEL(1),

  C_VALUES(1),
  C_BINARY(1),
  C_BITSTR(5),

  /** Function "c_map(Base, Pairs)" creates a map, folding if possible. */
  C_MAP(2),

  /** Function "c_map_pattern(Base, Pairs)" creates a map pattern. */
  C_MAP_PATTERN(2),

  /** Function "c_map_pair(Operator, Key, Value)". */
  C_MAP_PAIR(3),

  C_LET(3),
  C_SEQ(2),
  C_APPLY(2),
  C_CALL(3),
  C_PRIMOP(2),
  C_CASE(2),
  C_CLAUSE(3),
  C_ALIAS(2),
  C_FUN(2),
  C_RECEIVE(3),
  C_TRY(5),
  C_CATCH(1),

  /** Function "c_letrec(Definitions, Body)"; each definition is a tuple
   * {@code {Name, Fun}}. */
  C_LETREC(2),

  /** Function "c_module(Name, Exports, Attributes, Definitions)"; each
   * attribute and definition is a two-element tuple. */
  C_MODULE(4);

  /** Name of the function, for example "c_cons". */
  public final String functionName;

  /** Number of arguments. */
  public final int arity;

  /** Map of all built-ins, keyed by name and arity, e.g. "c_cons/2". */
  private static final ImmutableMap<String, BuiltIn> BY_NAME_ARITY;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.functionName + "/" + builtIn.arity, builtIn);
    }
    BY_NAME_ARITY = b.build();
  }

  BuiltIn(int arity) {
    this.arity = arity;
    this.functionName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_UNDERSCORE, name());
  }

  /** Looks up a built-in by name and arity; returns null if not found. */
  public static @Nullable BuiltIn lookup(String functionName, int arity) {
    return BY_NAME_ARITY.get(functionName + "/" + arity);
  }
}

// End BuiltIn.java
