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

package com.google.rb2js.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static final SourceSpan SPAN = SourceSpan.create("a.rb", 1, 0, 1, 5);

  @Test
  public void testIntegersAreStoredAsLongs() {
    Node n = Node.of(Token.INT, 42);
    assertThat(n.getChild(0)).isEqualTo(42L);
    assertThat(n).isEqualTo(IR.number(42));
  }

  @Test
  public void testEqualityIgnoresSpans() {
    Node plain = IR.lvar("a");
    Node located = plain.withSpan(SPAN);
    assertThat(located).isEqualTo(plain);
    assertThat(located.hashCode()).isEqualTo(plain.hashCode());
    assertThat(located.getSpan()).isEqualTo(SPAN);
    assertThat(plain.hasSpan()).isFalse();
  }

  @Test
  public void testEqualityIsStructural() {
    assertThat(IR.send(null, "f", IR.number(1))).isEqualTo(IR.send(null, "f", IR.number(1)));
    assertThat(IR.send(null, "f", IR.number(1))).isNotEqualTo(IR.send(null, "f", IR.number(2)));
    assertThat(IR.send(null, "f")).isNotEqualTo(IR.call(null, "f"));
  }

  @Test
  public void testInvalidChildIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Node.of(Token.ARRAY, new Object()));
  }

  @Test
  public void testChildrenCannotBeModified() {
    Node n = IR.array(IR.number(1));
    assertThrows(UnsupportedOperationException.class, () -> n.getChildren().add(IR.nil()));
  }

  @Test
  public void testCreateCopiesTheChildList() {
    List<Object> children = new ArrayList<>();
    children.add(IR.number(1));
    Node n = Node.create(Token.ARRAY, children, null);
    children.add(IR.number(2));
    assertThat(n.getChildCount()).isEqualTo(1);
  }

  @Test
  public void testWithChildrenReturnsSameInstanceWhenUnchanged() {
    Node one = IR.number(1);
    Node array = IR.array(one, IR.nil());
    assertThat(array.withChildren(array.getChildren())).isSameInstanceAs(array);
    assertThat(array.withChild(0, one)).isSameInstanceAs(array);
  }

  @Test
  public void testWithChildKeepsSpan() {
    Node send = IR.send(null, "f", IR.number(1)).withSpan(SPAN);
    Node rewritten = send.withChild(2, IR.number(2));
    assertThat(rewritten).isEqualTo(IR.send(null, "f", IR.number(2)));
    assertThat(rewritten.getSpan()).isEqualTo(SPAN);
    assertThat(send.getNode(2)).isEqualTo(IR.number(1));
  }

  @Test
  public void testWithTokenKeepsChildren() {
    Node send = IR.send(IR.lvar("a"), "b");
    Node attr = send.withToken(Token.ATTR);
    assertThat(attr.getToken()).isEqualTo(Token.ATTR);
    assertThat(attr.getChildren()).isEqualTo(send.getChildren());
    assertThat(send.withToken(Token.SEND)).isSameInstanceAs(send);
  }

  @Test
  public void testWithSpanOfOnlyFillsMissingSpans() {
    Node source = IR.lvar("x").withSpan(SPAN);
    SourceSpan other = SourceSpan.create("b.rb", 2, 0, 2, 1);
    assertThat(IR.nil().withSpanOf(source).getSpan()).isEqualTo(SPAN);
    assertThat(IR.nil().withSpan(other).withSpanOf(source).getSpan()).isEqualTo(other);
    assertThat(IR.nil().withSpanOf(null).getSpan()).isNull();
  }

  @Test
  public void testAccessors() {
    Node send = IR.send(null, "f", IR.number(1), IR.string("s"));
    assertThat(send.getNode(0)).isNull();
    assertThat(send.getString(1)).isEqualTo("f");
    assertThat(send.nodesFrom(2)).containsExactly(IR.number(1), IR.string("s")).inOrder();
    assertThat(send.nodeChildren()).hasSize(2);
    assertThat(send.getLastChild()).isEqualTo(IR.string("s"));
    assertThrows(IllegalStateException.class, () -> send.getNonNullNode(0));
    assertThrows(IllegalStateException.class, () -> send.getString(2));
    assertThrows(IndexOutOfBoundsException.class, () -> send.getChild(4));
  }

  @Test
  public void testToStringReadsBack() {
    Node n =
        IR.send(
            IR.constant("Foo"),
            "bar",
            IR.string("two words"),
            IR.sym("ok"),
            IR.number(1.5),
            IR.string("a\\b\n"));
    assertThat(n.toString())
        .isEqualTo("(send (const nil :Foo) :bar (str \"two words\") (sym :ok) (float 1.5)"
            + " (str \"a\\\\b\\n\"))");
    assertThat(SexpReader.read(n.toString())).isEqualTo(n);
  }

  @Test
  public void testTokenNames() {
    assertThat(Token.OP_ASGN.getName()).isEqualTo("op_asgn");
    assertThat(Token.DEFINED.getName()).isEqualTo("defined?");
    assertThat(Token.fromName("defined?")).isEqualTo(Token.DEFINED);
    assertThat(Token.fromName("nope")).isNull();
    assertThat(Token.AUTORETURN.isSynthetic()).isTrue();
    assertThat(Token.SEND.isSynthetic()).isFalse();
    assertThat(Token.KWOPTARG.isArgument()).isTrue();
    assertThat(Token.LVAR.isArgument()).isFalse();
  }

  @Test
  public void testSpanUnion() {
    SourceSpan first = SourceSpan.create("a.rb", 1, 4, 1, 9);
    SourceSpan second = SourceSpan.create("a.rb", 3, 0, 4, 2);
    SourceSpan union = second.union(first);
    assertThat(union).isEqualTo(SourceSpan.create("a.rb", 1, 4, 4, 2));
    assertThat(union.isMultiLine()).isTrue();
    assertThat(first.isMultiLine()).isFalse();
    assertThat(first.toString()).isEqualTo("a.rb:1:4");
  }

  @Test
  public void testIrShapes() {
    assertThat(IR.lvasgn("a", null).getChildCount()).isEqualTo(1);
    assertThat(IR.returnNode(null).hasChildren()).isFalse();
    assertThat(IR.args("a", "b").nodeChildren())
        .isEqualTo(ImmutableList.of(Node.of(Token.ARG, "a"), Node.of(Token.ARG, "b")));
    assertThat(IR.constant("A")).isEqualTo(Node.of(Token.CONST, null, "A"));
  }
}
