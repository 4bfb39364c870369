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

import java.util.Objects;
import net.hydromatic.coretree.term.Terms;
import net.hydromatic.coretree.util.ContractException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type of a data constructor: list cell, tuple, or an atomic value.
 *
 * <p>Data constructors are the nodes that build values from other values:
 * {@link Core.Cons}, {@link Core.Tuple}, and literals (whether atomic, or
 * folded lists and tuples).
 *
 * @see Trees#dataType(AstNode)
 * @see CoreBuilder#makeData(DataType, java.util.List)
 */
public final class DataType {
  /** List cell; two elements. */
  public static final DataType CONS = new DataType(Op.CONS, null);

  /** Tuple; any number of elements. */
  public static final DataType TUPLE = new DataType(Op.TUPLE, null);

  /** {@link Op#CONS}, {@link Op#TUPLE} or {@link Op#LITERAL}. */
  public final Op kind;
  private final @Nullable Object value;

  private DataType(Op kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  /** Creates an atomic data type, with no elements and a given value. */
  public static DataType atomic(Object value) {
    return new DataType(Op.LITERAL, requireNonNull(value));
  }

  /** Returns whether this is an atomic type. */
  public boolean isAtomic() {
    return kind == Op.LITERAL;
  }

  /** Returns the value of an atomic type. */
  public Object value() {
    if (value == null) {
      throw ContractException.wrongKind(this, "atomic data type");
    }
    return value;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof DataType
        && kind == ((DataType) o).kind
        && Objects.equals(value, ((DataType) o).value);
  }

  @Override public String toString() {
    return value == null ? kind.tag
        : "{atomic, " + Terms.unparse(value) + "}";
  }
}

// End DataType.java
