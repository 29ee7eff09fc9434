/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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
package com.google.txt2tex.tree;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.txt2tex.parse.Parser;
import com.google.txt2tex.tree.Tree.BinaryOp;
import com.google.txt2tex.tree.Tree.Document;
import com.google.txt2tex.tree.Tree.Identifier;
import com.google.txt2tex.tree.Tree.Paragraph;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PrettyTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  @Test
  public void constructedTree() {
    BinaryOp op =
        new BinaryOp(
            1, 3, "land", new Identifier(1, 1, "p"), new Identifier(1, 8, "q"), false, false);
    Document document =
        new Document(1, 1, ImmutableList.of(op, new Paragraph(2, 1, "one\ntwo")));
    assertThat(document.kind()).isEqualTo(Tree.Kind.DOCUMENT);
    assertThat(Pretty.pretty(document)).isEqualTo(lines("(p land q)", "TEXT: one", "two"));
  }

  @Test
  public void withExplicitParens() {
    BinaryOp op = (BinaryOp) Parser.parse("p lor q");
    BinaryOp parenthesized = op.withExplicitParens();
    assertThat(parenthesized.explicitParens()).isTrue();
    assertThat(parenthesized.line()).isEqualTo(op.line());
    assertThat(parenthesized.column()).isEqualTo(op.column());
    assertThat(parenthesized.toString()).isEqualTo(op.toString());
  }

  @Test
  public void nestedItemsAreIndented() {
    assertThat(Parser.parse(lines("=== A ===", "** Solution 2 **", "(a) p", "TEXT: x")).toString())
        .isEqualTo(lines("=== A ===", "  ** Solution 2 **", "    (a)", "      p", "      TEXT: x"));
  }

  @Test
  public void gendef() {
    assertThat(Parser.parse(lines("gendef [X]", "  ident : X -> X", "end")).toString())
        .isEqualTo(lines("gendef [X]", "  ident : (X -> X)", "end"));
  }

  @Test
  public void positions() {
    Tree tree = Parser.parse("\n  p land q");
    assertThat(tree.kind()).isEqualTo(Tree.Kind.BINARY_OP);
    assertThat(tree.line()).isEqualTo(2);
    assertThat(tree.column()).isEqualTo(5);
  }
}
