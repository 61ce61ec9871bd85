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

package com.google.rb2js.filters;

import com.google.rb2js.ConversionTestBase;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReturnFilterTest extends ConversionTestBase {

  @Before
  public void useReturnFilter() {
    setFilters(FilterRegistry.RETURN);
    setEsLevel(ConverterOptions.ES2015);
  }

  @Test
  public void testMethodReturnsLastExpression() {
    assertConvert(
        "(def :f (args (arg :x)) (send (lvar :x) :+ (int 1)))", "function f(x) {return x + 1}");
    assertConvert(
        "(def :f (args (arg :x)) (begin (send nil :g (lvar :x)) (lvar :x)))",
        "function f(x) {g(x); return x}");
  }

  @Test
  public void testEveryBranchReturns() {
    assertConvert(
        "(def :f (args (arg :x)) (if (lvar :x) (int 1) (int 2)))",
        "function f(x) {if (x) {return 1} else {return 2}}");
    assertConvert(
        "(def :f (args (arg :x)) (case (lvar :x) (when (int 1) (str \"one\")) (str \"other\")))",
        "function f(x) {switch (x) {case 1: return \"one\"; default: return \"other\"}}");
  }

  @Test
  public void testAssignmentReturnsTheVariable() {
    assertConvert("(def :f (args) (lvasgn :a (int 1)))", "function f() {let a = 1; return a}");
  }

  @Test
  public void testStatementsAreNotReturned() {
    assertConvert("(def :f (args) nil)", "function f() {}");
    assertConvert("(def :f (args) (send nil :raise (str \"x\")))", "function f() {throw \"x\"}");
  }

  @Test
  public void testConstructorsDoNotReturn() {
    assertConvert(
        "(class (const nil :A) nil (def :initialize (args (arg :x)) (ivasgn :@x (lvar :x))))",
        "class A {constructor(x) {this._x = x}}");
  }

  @Test
  public void testBlocksReturn() {
    assertConvert(
        "(block (send (lvar :a) :map) (args (arg :x)) (send (lvar :x) :* (int 2)))",
        "a.map((x) => x * 2)");
    assertConvert(
        "(lvasgn :f (block (send nil :lambda) (args (arg :x)) (send (lvar :x) :* (int 2))))",
        "let f = (x) => x * 2");
  }

  @Test
  public void testIteratorsDoNotReturn() {
    assertConvert(
        "(block (send (lvar :a) :each) (args (arg :x)) (send nil :f (lvar :x)))",
        "a.each((x) => {f(x)})");
    assertConvert(
        "(block (send (lvar :n) :times) (args (arg :i)) (send nil :f (lvar :i)))",
        "for (let i = 0; i < n; i++) {f(i)}");
  }
}
