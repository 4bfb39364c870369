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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Atom, a named constant.
 *
 * <p>Atoms are interned: two atoms with the same name are the same object, so
 * they can be compared using {@code ==}.
 */
public final class Atom implements Comparable<Atom> {
  private static final Interner<Atom> INTERNER = Interners.newWeakInterner();

  public static final Atom TRUE = of("true");
  public static final Atom FALSE = of("false");
  public static final Atom ALL = of("all");
  public static final Atom ANY = of("any");
  public static final Atom UNDEFINED = of("undefined");
  public static final Atom INFINITY = of("infinity");
  public static final Atom INTEGER = of("integer");
  public static final Atom BINARY = of("binary");
  public static final Atom ASSOC = of("assoc");
  public static final Atom EXACT = of("exact");

  public final String name;

  private Atom(String name) {
    this.name = requireNonNull(name, "name");
  }

  /** Returns the atom with a given name. */
  public static Atom of(String name) {
    return INTERNER.intern(new Atom(name));
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Atom && ((Atom) o).name.equals(name);
  }

  @Override
  public int compareTo(Atom o) {
    return name.compareTo(o.name);
  }

  /** Returns the name in quotes; for example {@code 'foo'}. */
  @Override
  public String toString() {
    return Terms.unparse(this);
  }
}

// End Atom.java
