/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.rb2js.sourcemap;

/**
 * Variable length quantities as used in source map segments: base64 digits, least significant
 * first, each carrying five bits of value and a continuation bit. The sign lives in the least
 * significant bit of the first digit.
 */
final class Base64VLQ {
  private Base64VLQ() {}

  // A Base64 VLQ digit can represent 5 bits, so it is base-32.
  private static final int VLQ_BASE_SHIFT = 5;
  private static final int VLQ_BASE = 1 << VLQ_BASE_SHIFT;

  // 11111 binary.
  private static final int VLQ_BASE_MASK = VLQ_BASE - 1;

  // The continuation bit is the 6th bit.
  private static final int VLQ_CONTINUATION_BIT = VLQ_BASE;

  /** 1 becomes 2 (10 binary), -1 becomes 3 (11 binary). */
  private static int toVLQSigned(int value) {
    return value < 0 ? ((-value) << 1) + 1 : value << 1;
  }

  /** 2 (10 binary) becomes 1, 3 (11 binary) becomes -1. */
  private static int fromVLQSigned(int value) {
    boolean negate = (value & 1) == 1;
    value = value >> 1;
    return negate ? -value : value;
  }

  /** Appends {@code value} to {@code out}. */
  static void encode(StringBuilder out, int value) {
    value = toVLQSigned(value);
    do {
      int digit = value & VLQ_BASE_MASK;
      value >>>= VLQ_BASE_SHIFT;
      if (value > 0) {
        digit |= VLQ_CONTINUATION_BIT;
      }
      out.append(Base64.toBase64(digit));
    } while (value > 0);
  }

  static String encode(int value) {
    StringBuilder sb = new StringBuilder();
    encode(sb, value);
    return sb.toString();
  }

  /** A cursor over the characters of a mappings string. */
  interface CharIterator {
    boolean hasNext();

    char next();
  }

  /** Decodes the value starting at the cursor and leaves the cursor after it. */
  static int decode(CharIterator in) {
    int result = 0;
    boolean continuation;
    int shift = 0;
    do {
      if (!in.hasNext()) {
        throw new IllegalArgumentException("truncated VLQ value");
      }
      int digit = Base64.fromBase64(in.next());
      continuation = (digit & VLQ_CONTINUATION_BIT) != 0;
      digit &= VLQ_BASE_MASK;
      result = result + (digit << shift);
      shift = shift + VLQ_BASE_SHIFT;
    } while (continuation);

    return fromVLQSigned(result);
  }
}
