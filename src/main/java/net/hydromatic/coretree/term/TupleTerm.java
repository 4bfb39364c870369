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
package net.hydromatic.coretree.term;

import com.google.common.collect.ImmutableList;

/** Tuple value, for example {@code {foo, 1, [a, b]}}. Also used for
 * records. */
public final class TupleTerm {
  public static final TupleTerm EMPTY = new TupleTerm(ImmutableList.of());

  public final ImmutableList<Object> elements;

  private TupleTerm(ImmutableList<Object> elements) {
    this.elements = elements;
  }

  /** Creates a tuple. */
  public static TupleTerm of(Object... elements) {
    return of(ImmutableList.copyOf(elements));
  }

  /** Creates a tuple. */
  public static TupleTerm of(Iterable<?> elements) {
    final ImmutableList<Object> list = ImmutableList.copyOf(elements);
    return list.isEmpty() ? EMPTY : new TupleTerm(list);
  }

  /** Returns the number of elements. */
  public int arity() {
    return elements.size();
  }

  /** Returns the {@code i}th element, zero-based. */
  public Object get(int i) {
    return elements.get(i);
  }

  @Override
  public int hashCode() {
    return elements.hashCode() + 7;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleTerm && elements.equals(((TupleTerm) o).elements);
  }

  @Override
  public String toString() {
    return Terms.unparse(this);
  }
}

// End TupleTerm.java
