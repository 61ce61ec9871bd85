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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PipelineTest {

  private static final ConverterOptions OPTIONS = ConverterOptions.defaults();

  /** Notes every send it sees and declines to rewrite it. */
  private static final class Recording extends AbstractFilter {
    Recording(String name, List<String> log) {
      super(name);
      on(
          Token.SEND,
          (node, chain) -> {
            log.add(name + ":" + node.getString(1));
            return null;
          });
    }
  }

  /** Appends a suffix to every string, after the rest of the chain ran. */
  private static final class Suffix extends AbstractFilter {
    Suffix(String suffix) {
      super("suffix" + suffix);
      on(Token.STR, (node, chain) -> IR.string(chain.next(node).getString(0) + suffix));
    }
  }

  @Test
  public void testFirstFilterSeesNodesFirst() {
    List<String> log = new ArrayList<>();
    Pipeline pipeline =
        Pipeline.compose(
            ImmutableList.of(new Recording("a", log), new Recording("b", log)), OPTIONS);
    pipeline.process(IR.send(null, "f", IR.send(null, "g")));
    assertThat(log).containsExactly("a:f", "b:f", "a:g", "b:g").inOrder();
  }

  @Test
  public void testNextRunsTheRestOfTheChain() {
    Pipeline pipeline =
        Pipeline.compose(ImmutableList.of(new Suffix("1"), new Suffix("2")), OPTIONS);
    assertThat(pipeline.process(IR.array(IR.string("x")))).isEqualTo(IR.array(IR.string("x21")));
  }

  @Test
  public void testFirstRewriteWins() {
    AbstractFilter first =
        new AbstractFilter("first") {
          {
            on(Token.LVAR, (node, chain) -> IR.lvar("a"));
          }
        };
    AbstractFilter second =
        new AbstractFilter("second") {
          {
            on(Token.LVAR, (node, chain) -> IR.lvar("b"));
          }
        };
    Pipeline pipeline = Pipeline.compose(ImmutableList.of(first, second), OPTIONS);
    assertThat(pipeline.process(IR.lvar("x"))).isEqualTo(IR.lvar("a"));
  }

  @Test
  public void testRewritesAreNotWalkedAgain() {
    List<String> log = new ArrayList<>();
    AbstractFilter rename =
        new AbstractFilter("rename") {
          {
            on(Token.LVAR, (node, chain) -> IR.send(null, "renamed"));
          }
        };
    Pipeline pipeline =
        Pipeline.compose(ImmutableList.of(new Recording("log", log), rename), OPTIONS);
    assertThat(pipeline.process(IR.array(IR.lvar("x"))))
        .isEqualTo(IR.array(IR.send(null, "renamed")));
    assertThat(log).isEmpty();
  }

  @Test
  public void testUnchangedTreeIsReturnedAsIs() {
    Node root = IR.begin(IR.send(null, "f", IR.number(1)), IR.lvar("a"));
    Pipeline pipeline = Pipeline.compose(ImmutableList.<Filter>of(), OPTIONS);
    assertThat(pipeline.process(root)).isSameInstanceAs(root);
    assertThat(pipeline.getVisitCount()).isEqualTo(4);
  }

  @Test
  public void testPrependedStatementsGoFirst() {
    Node setup = IR.send(null, "setup");
    Node importNode = Node.of(Token.IMPORT, "x.js");
    AbstractFilter prepending =
        new AbstractFilter("prepending") {
          {
            on(
                Token.LVAR,
                (node, chain) -> {
                  chain.prepend(setup);
                  chain.prepend(importNode);
                  return null;
                });
          }
        };
    Pipeline pipeline = Pipeline.compose(ImmutableList.of(prepending), OPTIONS);
    Node result = pipeline.process(IR.array(IR.lvar("a"), IR.lvar("b")));
    assertThat(result)
        .isEqualTo(IR.begin(importNode, setup, IR.array(IR.lvar("a"), IR.lvar("b"))));
  }

  @Test
  public void testFinishSeesTheWholeProgram() {
    AbstractFilter appending =
        new AbstractFilter("appending") {
          @Override
          public Node finish(Node root, FilterChain chain) {
            return IR.begin(root, IR.nil());
          }
        };
    Pipeline pipeline = Pipeline.compose(ImmutableList.of(appending), OPTIONS);
    assertThat(pipeline.process(IR.lvar("a"))).isEqualTo(IR.begin(IR.lvar("a"), IR.nil()));
  }

  @Test
  public void testReorder() {
    List<String> log = new ArrayList<>();
    Recording early = new Recording("early", log);
    AbstractFilter eager =
        new AbstractFilter("eager") {
          @Override
          public ImmutableList<Filter> reorder(ImmutableList<Filter> filters) {
            return ImmutableList.<Filter>of(this, early);
          }
        };
    Pipeline pipeline = Pipeline.compose(ImmutableList.of(early, eager), OPTIONS);
    assertThat(pipeline.getFilters()).containsExactly(eager, early).inOrder();
  }

  @Test
  public void testReorderMayNotDropFilters() {
    AbstractFilter greedy =
        new AbstractFilter("greedy") {
          @Override
          public ImmutableList<Filter> reorder(ImmutableList<Filter> filters) {
            return ImmutableList.<Filter>of(this);
          }
        };
    AbstractFilter other = new AbstractFilter("other") {};
    assertThrows(
        IllegalStateException.class,
        () -> Pipeline.compose(ImmutableList.of(other, greedy), OPTIONS));
  }

  @Test
  public void testCamelCaseMovesToTheFront() {
    Pipeline pipeline =
        Pipeline.create(
            FilterRegistry.getDefault()
                .resolveAll(ImmutableList.of(FilterRegistry.FUNCTIONS, FilterRegistry.CAMEL_CASE)),
            OPTIONS);
    assertThat(pipeline.getFilters().get(0).getName()).isEqualTo(FilterRegistry.CAMEL_CASE);
    assertThat(pipeline.getFilters().get(1).getName()).isEqualTo(FilterRegistry.FUNCTIONS);
  }

  @Test
  public void testHandlersCannotBeRegisteredTwice() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new AbstractFilter("twice") {
              {
                on(Token.STR, (node, chain) -> null);
                on(Token.STR, (node, chain) -> null);
              }
            });
  }

  @Test
  public void testToString() {
    assertThat(new Suffix("!").toString()).isEqualTo("Filter(suffix!)");
  }
}
