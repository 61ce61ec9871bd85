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

import static com.google.common.truth.Truth.assertThat;

import junit.framework.TestCase;

public final class Base64VLQTest extends TestCase {
  public void testSmallValues() {
    for (int i = 0; i < 63; i++) {
      testValue(i);
    }
  }

  public void testPowersOfTwo() {
    int base = 1;
    for (int i = 0; i < 30; i++) {
      testValue(base - 1);
      testValue(base);
      base *= 2;
    }
  }

  public void testSignedValues() {
    for (int i = -(64 * 64 - 1); i < (64 * 64 - 1); i++) {
      testValue(i);
    }
  }

  public void testNegativePowersOfTwo() {
    int base = -1;
    for (int i = 0; i < 30; i++) {
      testValue(base - 1);
      testValue(base);
      base *= 2;
    }
  }

  public void testKnownEncodings() {
    assertThat(Base64VLQ.encode(0)).isEqualTo("A");
    assertThat(Base64VLQ.encode(1)).isEqualTo("C");
    assertThat(Base64VLQ.encode(-1)).isEqualTo("D");
    assertThat(Base64VLQ.encode(4)).isEqualTo("I");
    assertThat(Base64VLQ.encode(16)).isEqualTo("gB");
  }

  public void testTruncatedValue() {
    CharIteratorImpl ci = new CharIteratorImpl();
    ci.set("g");
    try {
      Base64VLQ.decode(ci);
      fail("expected a truncated value to be rejected");
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().contains("truncated");
    }
  }

  static class CharIteratorImpl implements Base64VLQ.CharIterator {
    private int current;
    private int length;
    private CharSequence cs;

    void set(CharSequence sb) {
      this.current = 0;
      this.length = sb.length();
      this.cs = sb;
    }

    @Override
    public boolean hasNext() {
      return current < length;
    }

    @Override
    public char next() {
      return cs.charAt(current++);
    }
  }

  private void testValue(int value) {
    try {
      StringBuilder sb = new StringBuilder();
      Base64VLQ.encode(sb, value);
      CharIteratorImpl ci = new CharIteratorImpl();
      ci.set(sb);
      int result = Base64VLQ.decode(ci);
      assertThat(result).isEqualTo(value);
      assertThat(ci.hasNext()).isFalse();
    } catch (RuntimeException e) {
      throw new RuntimeException("failed for value " + value, e);
    }
  }
}
