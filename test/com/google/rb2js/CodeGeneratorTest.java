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

package com.google.rb2js;

import static com.google.common.truth.Truth.assertThat;

import com.google.rb2js.ConversionException.Stage;
import com.google.rb2js.ConverterOptions.Comparison;
import com.google.rb2js.ConverterOptions.LogicalOr;
import com.google.rb2js.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Single line output of the {@link CodeGenerator} at various ECMAScript levels. */
@RunWith(JUnit4.class)
public final class CodeGeneratorTest extends ConversionTestBase {

  @Test
  public void testLiterals() {
    assertConvert("(int 42)", "42");
    assertConvert("(float 1.5)", "1.5");
    assertConvert("(str \"a\\\"b\")", "\"a\\\"b\"");
    assertConvert("(sym :name)", "\"name\"");
    assertConvert("(true)", "true");
    assertConvert("(nil)", "null");
    assertConvert("(array (int 1) (int 2))", "[1, 2]");
    assertConvert("(array)", "[]");
  }

  @Test
  public void testHashStatementIsParenthesized() {
    assertConvert("(hash (pair (sym :a) (int 1)))", "({a: 1})");
    assertConvert(
        "(lvasgn :h (hash (pair (str \"a-b\") (int 1)) (pair (int 2) (int 3))))",
        "var h = {\"a-b\": 1, 2: 3}");
  }

  @Test
  public void testStatementsAreSeparated() {
    assertConvert("(lvasgn :a (int 1)) (send nil :f (lvar :a))", "var a = 1; f(a)");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(lvasgn :a (int 1)) (lvasgn :a (int 2))", "let a = 1; a = 2");
  }

  @Test
  public void testSends() {
    assertConvert("(send nil :f)", "f");
    assertConvert("(send nil :f (int 1) (str \"x\"))", "f(1, \"x\")");
    assertConvert("(send (lvar :a) :save!)", "a.save()");
    assertConvert("(send (lvar :a) :empty?)", "a.empty");
    assertConvert("(send (lvar :a) :b= (int 1))", "a.b = 1");
    assertConvert("(send (lvar :a) :[] (int 0))", "a[0]");
    assertConvert("(send (lvar :a) :[]= (int 0) (int 1))", "a[0] = 1");
    assertConvert("(send (int 1) :to_s)", "(1).to_s");
    assertConvert("(send (const nil :Foo) :new (int 1))", "new Foo(1)");
    assertConvert("(send (lvar :a) :<< (int 1))", "a.push(1)");
  }

  @Test
  public void testOperators() {
    assertConvert("(send (send (lvar :a) :+ (lvar :b)) :* (lvar :c))", "(a + b) * c");
    assertConvert("(send (lvar :a) :+ (send (lvar :b) :* (lvar :c)))", "a + b * c");
    assertConvert("(send (lvar :a) :- (send (lvar :b) :- (lvar :c)))", "a - (b - c)");
    assertConvert("(send (lvar :a) :-@)", "-a");
    assertConvert("(send (lvar :a) :!)", "!a");
    assertConvert("(send (send (lvar :a) :== (lvar :b)) :!)", "a != b");
  }

  @Test
  public void testExponent() {
    assertConvert("(send (lvar :a) :** (int 2))", "Math.pow(a, 2)");
    setEsLevel(ConverterOptions.ES2016);
    assertConvert("(send (lvar :a) :** (int 2))", "a ** 2");
  }

  @Test
  public void testEquality() {
    assertConvert("(send (lvar :a) :== (lvar :b))", "a == b");
    options.setComparison(Comparison.STRICT);
    assertConvert("(send (lvar :a) :== (lvar :b))", "a === b");
    assertConvert("(send (lvar :a) :!= (lvar :b))", "a !== b");
    assertConvert("(send (lvar :a) :== (nil))", "a == null");
  }

  @Test
  public void testRaise() {
    assertConvert(
        "(send nil :raise (const nil :ArgumentError) (str \"bad\"))",
        "throw new ArgumentError(\"bad\")");
    assertConvert("(send nil :raise (str \"bad\"))", "throw \"bad\"");
  }

  @Test
  public void testIf() {
    assertConvert("(if (lvar :a) (send nil :b) nil)", "if (a) b");
    assertConvert("(if (lvar :a) nil (send nil :b))", "if (!a) b");
    assertConvert("(if (lvar :a) (send nil :b) (send nil :c))", "if (a) {b} else {c}");
    assertConvert(
        "(if (lvar :a) (begin (send nil :b) (send nil :c)) nil)", "if (a) {b; c}");
    assertConvert(
        "(if (lvar :a) (send nil :b) (if (lvar :c) (send nil :d) (send nil :e)))",
        "if (a) {b} else if (c) {d} else {e}");
  }

  @Test
  public void testNestedIfKeepsBraces() {
    assertConvert(
        "(if (lvar :a) (if (lvar :b) (send nil :c) nil) nil)", "if (a) {if (b) c}");
  }

  @Test
  public void testTernary() {
    assertConvert(
        "(lvasgn :x (if (lvar :a) (int 1) (int 2)))", "var x = a ? 1 : 2");
  }

  @Test
  public void testCase() {
    assertConvert(
        "(case (lvar :a) (when (int 1) (send nil :f (int 1))) (send nil :g (int 2)))",
        "switch (a) {case 1: f(1); break; default: g(2)}");
  }

  @Test
  public void testCaseWithRanges() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(case (lvar :a) (when (irange (int 1) (int 3)) (send nil :f)) nil)",
        "switch (true) {case a >= 1 && a <= 3: f; break}");
  }

  @Test
  public void testWhile() {
    assertConvert("(while (lvar :a) (send nil :b))", "while (a) {b}");
    assertConvert("(until (lvar :a) (send nil :b))", "while (!a) {b}");
    assertConvert("(while_post (lvar :a) (kwbegin (send nil :b)))", "do {b} while (a)");
  }

  @Test
  public void testForOverRange() {
    assertConvert(
        "(for (lvasgn :i) (irange (int 1) (int 3)) (send nil :f (lvar :i)))",
        "for (var i = 1; i <= 3; i++) {f(i)}");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(for (lvasgn :i) (erange (int 0) (lvar :n)) (send nil :f (lvar :i)))",
        "for (let i = 0; i < n; i++) {f(i)}");
  }

  @Test
  public void testForOverCollection() {
    assertConvert(
        "(for (lvasgn :x) (lvar :xs) (send nil :f (lvar :x)))",
        "xs.forEach(function(x) {f(x)})");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(for (lvasgn :x) (lvar :xs) (send nil :f (lvar :x)))", "for (let x of xs) {f(x)}");
  }

  @Test
  public void testLoopBlocks() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(block (send (lvar :n) :times) (args (arg :i)) (send nil :f (lvar :i)))",
        "for (let i = 0; i < n; i++) {f(i)}");
    assertConvert(
        "(block (send (begin (irange (int 1) (int 5))) :each) (args (arg :i))"
            + " (send nil :f (lvar :i)))",
        "for (let i = 1; i <= 5; i++) {f(i)}");
    assertConvert(
        "(block (send nil :loop) (args) (send nil :f))", "while (true) {f}");
  }

  @Test
  public void testBreakAndNext() {
    assertConvert("(while (lvar :a) (break))", "while (a) {break}");
    assertConvert("(while (lvar :a) (next))", "while (a) {continue}");
  }

  @Test
  public void testDef() {
    assertConvert(
        "(def :add (args (arg :a) (arg :b)) (send (lvar :a) :+ (lvar :b)))",
        "function add(a, b) {a + b}");
    assertConvert("(def :empty? (args) nil)", "function empty() {}");
  }

  @Test
  public void testOptionalAndRestParameters() {
    assertConvert(
        "(def :f (args (optarg :a (int 1))) (lvar :a))",
        "function f(a) {if (typeof a === 'undefined') a = 1; a}");
    assertConvert(
        "(def :f (args (arg :a) (restarg :r)) (lvar :r))",
        "function f(a) {var r = Array.prototype.slice.call(arguments, 1); r}");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(def :f (args (optarg :a (int 1))) (lvar :a))", "function f(a = 1) {a}");
    assertConvert("(def :f (args (restarg :r)) (lvar :r))", "function f(...r) {r}");
  }

  @Test
  public void testKeywordParameters() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(def :f (args (kwarg :a) (kwoptarg :b (int 2))) (lvar :a))",
        "function f({a, b = 2}) {a}");
    assertConvert("(def :f (args (kwoptarg :b (int 2))) (lvar :b))", "function f({b = 2} = {}) {b}");
  }

  @Test
  public void testKeywordParametersNeedEs2015() {
    UnsupportedConstructException e = assertUnsupported("(def :f (args (kwarg :a)) (lvar :a))");
    assertThat(e.getDetail()).isEqualTo("keyword arguments requires ES2015 (eslevel is 2009)");
    assertThat(e.getKind()).isEqualTo(ConversionException.ErrorKind.UNSUPPORTED_CONSTRUCT);
    assertThat(e.getStage()).isEqualTo(Stage.GENERATE);
    assertThat(e.getNodeKind()).isEqualTo(Token.KWARG);
  }

  @Test
  public void testLambda() {
    String lambda = "(lvasgn :f (block (send nil :lambda) (args (arg :x))"
        + " (send (lvar :x) :* (int 2))))";
    assertConvert(lambda, "var f = function(x) {x * 2}");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(lambda, "let f = (x) => {x * 2}");
  }

  @Test
  public void testConciseArrowForAutoreturn() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(lvasgn :f (block (send nil :lambda) (args (arg :x))"
            + " (autoreturn (send (lvar :x) :* (int 2)))))",
        "let f = (x) => x * 2");
    assertConvert(
        "(lvasgn :f (block (send nil :lambda) (args)"
            + " (autoreturn (hash (pair (sym :a) (int 1))))))",
        "let f = () => ({a: 1})");
  }

  @Test
  public void testBlockArgument() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(block (send (lvar :a) :each) (args (arg :x)) (send nil :f (lvar :x)))",
        "a.each((x) => {f(x)})");
  }

  @Test
  public void testNumberedBlockParameters() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(numblock (send (lvar :a) :map) 1 (send (lvar :_1) :+ (int 1)))",
        "a.map((_1) => {_1 + 1})");
  }

  @Test
  public void testBindsThisInsideMethods() {
    assertConvert(
        "(class (const nil :A) nil (def :f (args (arg :a))"
            + " (block (send (lvar :a) :each) (args (arg :x)) (send (self) :g (lvar :x)))))",
        "function A() {}; A.prototype.f = function(a) {a.each(function(x) {this.g(x)}.bind(this))}");
  }

  @Test
  public void testClass() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(class (const nil :A) nil (def :initialize (args (arg :x)) (ivasgn :@x (lvar :x))))",
        "class A {constructor(x) {this._x = x}}");
    assertConvert("(class (const nil :B) (const nil :A) nil)", "class B extends A {}");
  }

  @Test
  public void testClassGettersAndAccessors() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(class (const nil :A) nil (def :name (args) (ivar :@name)))",
        "class A {get name() {this._name}}");
    assertConvert(
        "(class (const nil :A) nil (send nil :attr_accessor (sym :a)))",
        "class A {get a() {return this._a}; set a(a) {this._a = a}}");
  }

  @Test
  public void testClassConstants() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(class (const nil :A) nil (begin (casgn nil :X (int 1))"
            + " (def :f (args (arg :y)) (const nil :X))))",
        "class A {f(y) {A.X}}; A.X = 1");
  }

  @Test
  public void testPrototypeClass() {
    assertConvert(
        "(class (const nil :B) (const nil :A) nil)",
        "function B() {A.apply(this, arguments)}; B.prototype = Object.create(A.prototype);"
            + " B.prototype.constructor = B");
    assertConvert(
        "(class (const nil :A) nil (def :f (args (arg :x)) (lvar :x)))",
        "function A() {}; A.prototype.f = function(x) {x}");
  }

  @Test
  public void testModule() {
    assertConvert(
        "(module (const nil :M) (def :f (args (arg :x)) (lvar :x)))",
        "var M = {f: function(x) {x}}");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(module (const nil :M) (def :f (args (arg :x)) (lvar :x)))", "const M = {f(x) {x}}");
  }

  @Test
  public void testRescue() {
    assertConvert(
        "(kwbegin (rescue (send nil :f (int 1))"
            + " (resbody nil (lvasgn :e) (send nil :g (lvar :e))) nil))",
        "try {f(1)} catch (e) {g(e)}");
    assertConvert(
        "(kwbegin (ensure (send nil :f) (send nil :g)))", "try {f} finally {g}");
  }

  @Test
  public void testCatchWithoutVariable() {
    String source = "(kwbegin (rescue (send nil :f) (resbody nil nil (send nil :g)) nil))";
    assertConvert(source, "try {f} catch (e) {g}");
    setEsLevel(ConverterOptions.ES2019);
    assertConvert(source, "try {f} catch {g}");
  }

  @Test
  public void testSafeNavigation() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(csend (lvar :a) :b)", "a && a.b");
    setEsLevel(ConverterOptions.ES2020);
    assertConvert("(csend (lvar :a) :b)", "a?.b");
    assertConvert("(csend (lvar :a) :c (int 1))", "a?.c(1)");
  }

  @Test
  public void testSplat() {
    assertConvert("(send (lvar :a) :b (splat (lvar :c)))", "a.b.apply(a, c)");
    assertConvert("(array (int 1) (splat (lvar :c)))", "[1].concat(c)");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(send (lvar :a) :b (splat (lvar :c)))", "a.b(...c)");
  }

  @Test
  public void testLogicalAssignment() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(or_asgn (ivasgn :@a) (int 1))", "this._a = this._a || 1");
    assertConvert("(or_asgn (lvasgn :a) (int 1))", "let a = 1");
    setEsLevel(ConverterOptions.ES2021);
    assertConvert("(or_asgn (ivasgn :@a) (int 1))", "this._a ||= 1");
  }

  @Test
  public void testOperatorAssignment() {
    assertConvert("(op_asgn (lvasgn :a) :+ (int 1))", "a++");
    assertConvert("(op_asgn (lvasgn :a) :* (int 3))", "a *= 3");
  }

  @Test
  public void testMultipleAssignment() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(masgn (mlhs (lvasgn :a) (lvasgn :b)) (array (int 1) (int 2)))", "let [a, b] = [1, 2]");
  }

  @Test
  public void testHashSplat() {
    String source = "(lvasgn :h (hash (pair (sym :a) (int 1)) (kwsplat (lvar :b))))";
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(source, "let h = Object.assign({}, {a: 1}, b)");
    setEsLevel(ConverterOptions.ES2018);
    assertConvert(source, "let h = {a: 1, ...b}");
  }

  @Test
  public void testRegexp() {
    assertConvert(
        "(lvasgn :r (regexp (str \"\\\\Aa+\") (regopt :i)))", "var r = /^a+/i");
    assertConvert("(lvasgn :r (regexp (str \"a/b\") (regopt)))", "var r = /a\\/b/");
  }

  @Test
  public void testInterpolation() {
    String source = "(dstr (str \"a\") (begin (lvar :b)))";
    assertConvert(source, "\"a\" + b");
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(source, "`a${b}`");
  }

  @Test
  public void testStrictMode() {
    options.setStrict(true);
    assertConvert("(send nil :f (int 1))", "\"use strict\"; f(1)");
  }

  @Test
  public void testLogicalOr() {
    assertConvert("(or (lvar :a) (lvar :b))", "a || b");
    assertConvert("(and (or (lvar :a) (lvar :b)) (lvar :c))", "(a || b) && c");
    setEsLevel(ConverterOptions.ES2020);
    options.setOr(LogicalOr.NULLISH);
    assertConvert("(or (lvar :a) (lvar :b))", "a ?? b");
    assertConvert("(or (lvar :a) (true))", "a || true");
  }

  @Test
  public void testDefined() {
    assertConvert("(defined? (lvar :a))", "typeof a !== 'undefined'");
  }

  @Test
  public void testImports() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(import \"x.js\" (const nil :X))", "import X from \"x.js\"");
    assertConvert(
        "(import \"p\" (array (const nil :X) (const nil :Y)))", "import {X, Y} from \"p\"");
    assertConvert("(import \"p\" (splat (const nil :X)))", "import * as X from \"p\"");
    assertConvert("(import \"side-effect.js\")", "import \"side-effect.js\"");
  }

  @Test
  public void testExports() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert("(export \"default\" (const nil :X))", "export default X");
    assertConvert(
        "(export (array (const nil :A) (pair (const nil :B) (sym :default))))",
        "export {A, B as default}");
    assertConvert("(export (lvasgn :name (int 1)))", "export const name = 1");
    assertConvert(
        "(export (def :f (args) (nil)))", "export function f() {null}");
  }

  @Test
  public void testModulesNeedEs2015() {
    UnsupportedConstructException e = assertUnsupported("(import \"x.js\" (const nil :X))");
    assertThat(e.getDetail()).isEqualTo("import requires ES2015 (eslevel is 2009)");
  }

  @Test
  public void testRangeOutsideOfLoop() {
    UnsupportedConstructException e = assertUnsupported("(send nil :f (irange (int 1) (int 2)))");
    assertThat(e.getNodeKind()).isEqualTo(Token.IRANGE);
    assertThat(e.getSpan()).isNotNull();
    assertThat(e).hasMessageThat().contains("range outside of a loop or case");
  }

  @Test
  public void testStatementsInExpressionsUseFunctions() {
    setEsLevel(ConverterOptions.ES2015);
    assertConvert(
        "(lvasgn :x (case (lvar :a) (when (int 1) (int 2)) (int 3)))",
        "let x = (() => {switch (a) {case 1: return 2; default: return 3}})()");
  }
}
