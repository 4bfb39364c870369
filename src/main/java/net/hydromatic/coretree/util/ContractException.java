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

import static com.google.common.base.Strings.lenientFormat;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a caller breaks the contract of a tree operation.
 *
 * <p>Examples are asking for the elements of a node that is not a tuple,
 * passing a {@code case} expression where a pattern is expected, and giving
 * {@link net.hydromatic.coretree.ast.Trees#makeTree} a list of subtree groups
 * of the wrong shape.
 *
 * <p>A contract violation is a bug in the caller. There is no recovery; use
 * the predicates (such as {@link net.hydromatic.coretree.ast.AstNode#isLeaf()}
 * and {@link net.hydromatic.coretree.term.Terms#isLiteralTerm(Object)}) to
 * probe the shape of a value before calling an operation that may throw.
 */
public class ContractException extends RuntimeException {
  public ContractException(String message) {
    super(message);
  }

  /**
   * Throws if a condition is false.
   *
   * <p>Similar to Guava's {@code Preconditions.checkArgument}, but throws a
   * {@code ContractException}.
   *
   * @param condition Condition that must hold
   * @param template Message template, with "%s" placeholders
   * @param args Arguments to the message template
   */
  public static void check(
      boolean condition, String template, @Nullable Object... args) {
    if (!condition) {
      throw new ContractException(lenientFormat(template, args));
    }
  }

  /** Creates an exception saying that a value is not of an expected kind. */
  public static ContractException wrongKind(
      Object actual, String expectedDescription) {
    return new ContractException(
        lenientFormat("expected %s, got %s", expectedDescription, actual));
  }
}

// End ContractException.java
