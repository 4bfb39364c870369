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

import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.coretree.term.Atom;
import net.hydromatic.coretree.term.MapTerm;

/**
 * Evaluates a sequence of map updates against a literal map, at compile time.
 *
 * <p>The updates are applied in order. An {@code assoc} update
 * ("{@code K => V}") always succeeds, inserting or overwriting the key. An
 * {@code exact} update ("{@code K := V}") succeeds only if the key is present
 * in the map accumulated so far. Folding stops at the first update that fails,
 * or whose operator, key or value is not a literal.
 */
public class MapFolder {
  private MapFolder() {}

  /** Folds the longest prefix of {@code pairs} that can be applied to
   * {@code base}. Never throws. */
  public static Result fold(MapTerm base, List<Core.MapPair> pairs) {
    final LinkedHashMap<Object, Object> map = new LinkedHashMap<>(base.map);
    int count = 0;
    for (Core.MapPair pair : pairs) {
      if (!(pair.operator instanceof Core.Literal
          && pair.key instanceof Core.Literal
          && pair.val instanceof Core.Literal)) {
        break;
      }
      final Object op = ((Core.Literal) pair.operator).value;
      final Object key = ((Core.Literal) pair.key).value;
      final Object value = ((Core.Literal) pair.val).value;
      if (op == Atom.EXACT) {
        if (!map.containsKey(key)) {
          break;
        }
      } else if (op != Atom.ASSOC) {
        break;
      }
      map.put(key, value);
      ++count;
    }
    return new Result(count == 0 ? base : MapTerm.of(map), count);
  }

  /** Result of folding. */
  public static class Result {
    /** The base map with the first {@link #count} updates applied. */
    public final MapTerm map;
    /** Number of updates that were applied. */
    public final int count;

    Result(MapTerm map, int count) {
      this.map = requireNonNull(map);
      this.count = count;
    }

    /** Returns whether all of the {@code n} updates were applied. */
    public boolean isComplete(int n) {
      return count == n;
    }
  }
}

// End MapFolder.java
