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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Map value, for example {@code ~{'a'=>1, 'b'=>2}~}.
 *
 * <p>Two maps are equal if they have the same keys and each key has the same
 * value; the order in which entries were added does not matter.
 */
public final class MapTerm {
  public static final MapTerm EMPTY = new MapTerm(ImmutableMap.of());

  public final ImmutableMap<Object, Object> map;

  private MapTerm(ImmutableMap<Object, Object> map) {
    this.map = map;
  }

  /** Creates a map value. */
  public static MapTerm of(Map<?, ?> map) {
    return map.isEmpty() ? EMPTY : new MapTerm(ImmutableMap.copyOf(map));
  }

  /** Creates a map value with one entry. */
  public static MapTerm of(Object key, Object value) {
    return new MapTerm(ImmutableMap.of(key, value));
  }

  public int size() {
    return map.size();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public boolean containsKey(Object key) {
    return map.containsKey(key);
  }

  public @Nullable Object get(Object key) {
    return map.get(key);
  }

  /** Returns a map with a given key associated with a given value. If the key
   * is already present, its value is replaced. */
  public MapTerm put(Object key, Object value) {
    requireNonNull(key, "key");
    requireNonNull(value, "value");
    if (value.equals(map.get(key))) {
      return this;
    }
    final Map<Object, Object> m = new LinkedHashMap<>(map);
    m.put(key, value);
    return new MapTerm(ImmutableMap.copyOf(m));
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof MapTerm && map.equals(((MapTerm) o).map);
  }

  @Override
  public String toString() {
    return Terms.unparse(this);
  }
}

// End MapTerm.java
