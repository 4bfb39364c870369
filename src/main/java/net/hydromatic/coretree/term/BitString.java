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

import java.util.Arrays;

/**
 * Bit-string value, a sequence of bits. A bit-string whose length is a
 * multiple of 8 is a binary.
 *
 * <p>Bits are stored most significant first; unused bits of the last byte are
 * zero.
 */
public final class BitString {
  public static final BitString EMPTY = new BitString(new byte[0], 0);

  private final byte[] bytes;
  /** Number of bits. */
  public final int bitSize;

  private BitString(byte[] bytes, int bitSize) {
    this.bytes = bytes;
    this.bitSize = bitSize;
  }

  /** Creates a binary from bytes. */
  public static BitString of(byte... bytes) {
    return ofBits(bytes, bytes.length * 8);
  }

  /** Creates a bit-string from the leading {@code bitSize} bits of an array
   * of bytes. */
  public static BitString ofBits(byte[] bytes, int bitSize) {
    checkArgument(bitSize >= 0 && bitSize <= bytes.length * 8,
        "bit size %s out of range", bitSize);
    final int byteCount = (bitSize + 7) / 8;
    final byte[] copy = Arrays.copyOf(bytes, byteCount);
    final int extra = byteCount * 8 - bitSize;
    if (extra > 0) {
      copy[byteCount - 1] &= (byte) (0xFF << extra);
    }
    return new BitString(copy, bitSize);
  }

  /** Returns whether this is a binary, that is, whether its size is a whole
   * number of bytes. */
  public boolean isBinary() {
    return bitSize % 8 == 0;
  }

  /** Returns a copy of the bytes. */
  public byte[] toByteArray() {
    return bytes.clone();
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes) * 31 + bitSize;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BitString
            && bitSize == ((BitString) o).bitSize
            && Arrays.equals(bytes, ((BitString) o).bytes);
  }

  /** Returns a string such as {@code <<1,2,3>>} or {@code <<255,1:3>>}. */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("<<");
    final int fullBytes = bitSize / 8;
    for (int i = 0; i < fullBytes; i++) {
      if (i > 0) {
        b.append(',');
      }
      b.append(bytes[i] & 0xFF);
    }
    final int rest = bitSize % 8;
    if (rest > 0) {
      if (fullBytes > 0) {
        b.append(',');
      }
      b.append((bytes[fullBytes] & 0xFF) >> (8 - rest))
          .append(':').append(rest);
    }
    return b.append(">>").toString();
  }
}

// End BitString.java
