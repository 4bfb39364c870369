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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Reference to a function by module, name and arity, for example
 * {@code fun lists:reverse/1}.
 *
 * <p>Unlike a closure, a reference to a statically named function has no
 * captured environment, and may therefore occur in a literal.
 */
public final class FunRef {
  public final Atom module;
  public final Atom function;
  public final int arity;

  private FunRef(Atom module, Atom function, int arity) {
    this.module = requireNonNull(module, "module");
    this.function = requireNonNull(function, "function");
    this.arity = arity;
    checkArgument(arity >= 0, "negative arity %s", arity);
  }

  /** Creates a function reference. */
  public static FunRef of(Atom module, Atom function, int arity) {
    return new FunRef(module, function, arity);
  }

  /** Creates a function reference from names. */
  public static FunRef of(String module, String function, int arity) {
    return new FunRef(Atom.of(module), Atom.of(function), arity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(module, function, arity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FunRef
            && module == ((FunRef) o).module
            && function == ((FunRef) o).function
            && arity == ((FunRef) o).arity;
  }

  @Override
  public String toString() {
    return Terms.unparse(this);
  }
}

// End FunRef.java
