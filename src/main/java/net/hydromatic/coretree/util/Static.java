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
package net.hydromatic.coretree.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Removes the first occurrence of an element from a list. Returns the list
   * unchanged if the element does not occur.
   */
  public static <E> List<E> minusFirst(List<E> list, Object e) {
    final int i = list.indexOf(e);
    if (i < 0) {
      return list;
    }
    return ImmutableList.<E>builder()
        .addAll(list.subList(0, i))
        .addAll(list.subList(i + 1, list.size()))
        .build();
  }

  /** Returns whether a predicate is true for all elements of a list. */
  public static <E> boolean allMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function to
   * each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
      case 0:
        // Save ourselves the effort of creating a Builder.
        return ImmutableList.of();

      case 1:
        return ImmutableList.of(mapper.apply(elements.get(0)));

      default:
        // Optimize by making the builder the same size as the collection.
        final ImmutableList.Builder<T> b =
            ImmutableList.builderWithExpectedSize(elements.size());
        elements.forEach(e -> b.add(mapper.apply(e)));
        return b.build();
    }
  }
}

// End Static.java
