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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.util.ContractException;

/**
 * Utilities for host values ("terms").
 *
 * <p>The values that can occur in a literal are:
 *
 * <ul>
 *   <li>integers, represented as {@link BigInteger};
 *   <li>floats, represented as finite {@link Double} values;
 *   <li>atoms ({@link Atom});
 *   <li>lists ({@link ListTerm}), possibly improper;
 *   <li>tuples ({@link TupleTerm});
 *   <li>maps ({@link MapTerm});
 *   <li>bit-strings ({@link BitString});
 *   <li>references to statically named functions ({@link FunRef}).
 * </ul>
 */
public abstract class Terms {
  private Terms() {}

  /** Returns an integer value. */
  public static BigInteger integer(long value) {
    return BigInteger.valueOf(value);
  }

  /** Returns whether a value is an integer. */
  public static boolean isInteger(Object o) {
    return o instanceof BigInteger;
  }

  /** Returns whether a value is a float. */
  public static boolean isFloat(Object o) {
    return o instanceof Double && Double.isFinite((Double) o);
  }

  /**
   * Returns whether a value can be represented as a literal.
   *
   * <p>Never throws, whatever the argument. Takes time proportional to the size
   * of the value; uses a work list rather than recursion, so the Java stack
   * does not grow with the size or depth of the value.
   */
  public static boolean isLiteralTerm(Object o) {
    final Deque<Object> stack = new ArrayDeque<>();
    if (o == null) {
      return false;
    }
    stack.push(o);
    while (!stack.isEmpty()) {
      Object t = stack.pop();
      if (t instanceof BigInteger
          || t instanceof Atom
          || t instanceof BitString
          || t instanceof FunRef
          || t == ListTerm.NIL) {
        continue;
      }
      if (t instanceof Double) {
        if (!Double.isFinite((Double) t)) {
          return false;
        }
      } else if (t instanceof ListTerm.Cons) {
        for (; t instanceof ListTerm.Cons; t = ((ListTerm.Cons) t).tail) {
          stack.push(((ListTerm.Cons) t).head);
        }
        stack.push(t);
      } else if (t instanceof TupleTerm) {
        ((TupleTerm) t).elements.forEach(stack::push);
      } else if (t instanceof MapTerm) {
        for (Map.Entry<Object, Object> e : ((MapTerm) t).map.entrySet()) {
          stack.push(e.getKey());
          stack.push(e.getValue());
        }
      } else {
        return false;
      }
    }
    return true;
  }

  // characters and strings

  /**
   * Returns whether a value is a character: an integer between 0 and 255.
   * Same as {@code io_lib:char_list} applied to one character.
   */
  public static boolean isCharValue(Object o) {
    if (!(o instanceof BigInteger)) {
      return false;
    }
    final BigInteger i = (BigInteger) o;
    return i.signum() >= 0 && i.bitLength() <= 8;
  }

  /**
   * Returns whether a value is a printable character. Same as
   * {@code io_lib:printable_list} applied to one character.
   */
  public static boolean isPrintCharValue(Object o) {
    if (!isCharValue(o)) {
      return false;
    }
    final int c = ((BigInteger) o).intValue();
    if (c >= 32 && c <= 126 || c >= 160 && c <= 255) {
      return true;
    }
    switch (c) {
      case '\b':
      case 127: // \d
      case 27: // \e
      case '\f':
      case '\n':
      case '\r':
      case '\t':
      case 11: // \v
        return true;
      default:
        return false;
    }
  }

  /** Returns whether a value is a proper list of characters. */
  public static boolean isCharList(Object o) {
    return o instanceof ListTerm && allChars((ListTerm) o, false);
  }

  /** Returns whether a value is a proper list of printable characters. */
  public static boolean isPrintCharList(Object o) {
    return o instanceof ListTerm && allChars((ListTerm) o, true);
  }

  private static boolean allChars(ListTerm list, boolean printable) {
    Object t = list;
    for (; t instanceof ListTerm.Cons; t = ((ListTerm.Cons) t).tail) {
      final Object head = ((ListTerm.Cons) t).head;
      if (printable ? !isPrintCharValue(head) : !isCharValue(head)) {
        return false;
      }
    }
    return t == ListTerm.NIL;
  }

  /** Converts a Java string to a list of character codes. */
  public static ListTerm string(String s) {
    final List<Object> list = new ArrayList<>(s.length());
    s.codePoints().forEach(c -> list.add(BigInteger.valueOf(c)));
    return ListTerm.of(list);
  }

  /** Converts a list of character codes to a Java string. */
  public static String javaString(Object o) {
    if (!(o instanceof ListTerm) || !((ListTerm) o).isProper()) {
      throw ContractException.wrongKind(o, "list of characters");
    }
    final StringBuilder b = new StringBuilder();
    for (Object c : (ListTerm) o) {
      if (!(c instanceof BigInteger)) {
        throw ContractException.wrongKind(o, "list of characters");
      }
      b.appendCodePoint(((BigInteger) c).intValueExact());
    }
    return b.toString();
  }

  // printing

  /** Converts a value to a string in the syntax of literals. */
  public static String unparse(Object o) {
    return unparse(new StringBuilder(), o).toString();
  }

  /** Appends a value to a string builder in the syntax of literals. */
  public static StringBuilder unparse(StringBuilder b, Object o) {
    if (o instanceof Atom) {
      return quote(b, ((Atom) o).name, '\'');
    }
    if (o instanceof ListTerm) {
      final ListTerm list = (ListTerm) o;
      if (!list.isEmpty() && isPrintCharList(list)) {
        return quote(b, javaString(list), '"');
      }
      b.append('[');
      Object t = list;
      for (; t instanceof ListTerm.Cons; t = ((ListTerm.Cons) t).tail) {
        if (t != list) {
          b.append(',');
        }
        unparse(b, ((ListTerm.Cons) t).head);
      }
      if (t != ListTerm.NIL) {
        unparse(b.append('|'), t);
      }
      return b.append(']');
    }
    if (o instanceof TupleTerm) {
      b.append('{');
      final List<Object> elements = ((TupleTerm) o).elements;
      for (int i = 0; i < elements.size(); i++) {
        unparse(i > 0 ? b.append(',') : b, elements.get(i));
      }
      return b.append('}');
    }
    if (o instanceof MapTerm) {
      b.append("~{");
      int i = 0;
      for (Map.Entry<Object, Object> e : ((MapTerm) o).map.entrySet()) {
        unparse(i++ > 0 ? b.append(',') : b, e.getKey());
        unparse(b.append("=>"), e.getValue());
      }
      return b.append("}~");
    }
    if (o instanceof FunRef) {
      final FunRef f = (FunRef) o;
      b.append("fun ");
      unparse(b, f.module).append(':');
      return unparse(b, f.function).append('/').append(f.arity);
    }
    return b.append(o);
  }

  private static StringBuilder quote(StringBuilder b, String s, char q) {
    b.append(q);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\\':
          b.append("\\\\");
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        default:
          if (c == q) {
            b.append('\\');
          }
          b.append(c);
      }
    }
    return b.append(q);
  }
}

// End Terms.java
