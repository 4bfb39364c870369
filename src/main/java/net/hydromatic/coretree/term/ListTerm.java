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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * List value: either the empty list {@link #NIL} or a {@link Cons} cell.
 *
 * <p>The tail of a cons cell is usually another list, but may be any value,
 * in which case the list is <em>improper</em>; for example {@code [1|2]}.
 *
 * <p>Lists may be very long, so {@link #equals}, {@link #hashCode()},
 * {@link #toString()} and the other operations that walk the spine use loops,
 * not recursion.
 */
public abstract class ListTerm implements Iterable<Object> {
  /** The empty list, {@code []}. */
  public static final ListTerm NIL = new Nil();

  private ListTerm() {}

  /** Creates a cons cell. */
  public static Cons cons(Object head, Object tail) {
    return new Cons(head, tail);
  }

  /** Creates a proper list. */
  public static ListTerm of(Object... elements) {
    return of(Arrays.asList(elements));
  }

  /** Creates a proper list. */
  public static ListTerm of(List<?> elements) {
    return (ListTerm) of(elements, NIL);
  }

  /**
   * Creates a list with a given tail. If {@code elements} is empty, returns
   * {@code tail}, which need not be a list.
   */
  public static Object of(List<?> elements, Object tail) {
    Object list = requireNonNull(tail, "tail");
    for (int i = elements.size() - 1; i >= 0; i--) {
      list = new Cons(elements.get(i), list);
    }
    return list;
  }

  /** Returns whether this is the empty list. */
  public abstract boolean isEmpty();

  /** Returns whether this list ends in {@link #NIL}. */
  public boolean isProper() {
    return finalTail() == NIL;
  }

  /**
   * Returns the value after the last cons cell; {@link #NIL} for a proper
   * list.
   */
  public Object finalTail() {
    Object o = this;
    while (o instanceof Cons) {
      o = ((Cons) o).tail;
    }
    return o;
  }

  /** Returns the number of cons cells in this list. */
  public int length() {
    int n = 0;
    for (Object o = this; o instanceof Cons; o = ((Cons) o).tail) {
      ++n;
    }
    return n;
  }

  /**
   * Returns the elements of this list. For an improper list, returns the
   * elements before the final tail.
   */
  public List<Object> elements() {
    return ImmutableList.copyOf(this);
  }

  /** Iterates over the heads of the cons cells of this list. */
  @Override
  public Iterator<Object> iterator() {
    return new Iterator<Object>() {
      Object o = ListTerm.this;

      @Override
      public boolean hasNext() {
        return o instanceof Cons;
      }

      @Override
      public Object next() {
        if (!(o instanceof Cons)) {
          throw new NoSuchElementException();
        }
        final Cons cons = (Cons) o;
        o = cons.tail;
        return cons.head;
      }
    };
  }

  @Override
  public String toString() {
    return Terms.unparse(this);
  }

  /** The empty list. */
  private static final class Nil extends ListTerm {
    @Override
    public boolean isEmpty() {
      return true;
    }

    @Override
    public int hashCode() {
      return 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this;
    }
  }

  /** Cons cell, a list with a head and a tail. */
  public static final class Cons extends ListTerm {
    public final Object head;
    public final Object tail;

    Cons(Object head, Object tail) {
      this.head = requireNonNull(head, "head");
      this.tail = requireNonNull(tail, "tail");
    }

    @Override
    public boolean isEmpty() {
      return false;
    }

    @Override
    public int hashCode() {
      int h = 1;
      Object o = this;
      for (; o instanceof Cons; o = ((Cons) o).tail) {
        h = h * 31 + ((Cons) o).head.hashCode();
      }
      return h * 31 + o.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == this) {
        return true;
      }
      if (!(obj instanceof Cons)) {
        return false;
      }
      Object a = this;
      Object b = obj;
      while (a instanceof Cons && b instanceof Cons) {
        if (a == b) {
          return true;
        }
        if (!((Cons) a).head.equals(((Cons) b).head)) {
          return false;
        }
        a = ((Cons) a).tail;
        b = ((Cons) b).tail;
      }
      return a.equals(b);
    }
  }
}

// End ListTerm.java
