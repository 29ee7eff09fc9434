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

package com.google.txt2tex.parse;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.txt2tex.tree.Tree;
import com.google.txt2tex.tree.Tree.Abbreviation;
import com.google.txt2tex.tree.Tree.AxDef;
import com.google.txt2tex.tree.Tree.BinaryOp;
import com.google.txt2tex.tree.Tree.Contents;
import com.google.txt2tex.tree.Tree.Document;
import com.google.txt2tex.tree.Tree.EquivChain;
import com.google.txt2tex.tree.Tree.FreeBranch;
import com.google.txt2tex.tree.Tree.FreeType;
import com.google.txt2tex.tree.Tree.FunctionType;
import com.google.txt2tex.tree.Tree.GivenType;
import com.google.txt2tex.tree.Tree.Identifier;
import com.google.txt2tex.tree.Tree.InfruleBlock;
import com.google.txt2tex.tree.Tree.Paragraph;
import com.google.txt2tex.tree.Tree.Part;
import com.google.txt2tex.tree.Tree.PureParagraph;
import com.google.txt2tex.tree.Tree.Quantifier;
import com.google.txt2tex.tree.Tree.Schema;
import com.google.txt2tex.tree.Tree.Section;
import com.google.txt2tex.tree.Tree.Solution;
import com.google.txt2tex.tree.Tree.SyntaxBlock;
import com.google.txt2tex.tree.Tree.TruthTable;
import com.google.txt2tex.tree.Tree.Zed;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  @Test
  public void singleItemIsNotWrapped() {
    Tree tree = Parser.parse("p land q");
    assertThat(tree).isInstanceOf(BinaryOp.class);
  }

  @Test
  public void severalItemsAreWrapped() {
    Tree tree = Parser.parse("p\n\nq");
    assertThat(tree).isInstanceOf(Document.class);
    Document document = (Document) tree;
    assertThat(document.items()).hasSize(2);
    assertThat(((Identifier) document.items().get(0)).name()).isEqualTo("p");
    assertThat(((Identifier) document.items().get(1)).name()).isEqualTo("q");
  }

  @Test
  public void emptyDocument() {
    Tree tree = Parser.parse("");
    assertThat(tree).isInstanceOf(Document.class);
    assertThat(((Document) tree).items()).isEmpty();
    assertThat(((Document) Parser.parse("\n\n  \n")).items()).isEmpty();
  }

  @Test
  public void parseDocumentAlwaysWraps() {
    Document document = Parser.parseDocument("p land q");
    assertThat(document.items()).hasSize(1);
    assertThat(document.items().get(0)).isInstanceOf(BinaryOp.class);
  }

  @Test
  public void deterministic() {
    String input = lines("forall x : N | x > 0", "", "PROOF:", "p", "  q [premise]");
    assertThat(Parser.parse(input).toString()).isEqualTo(Parser.parse(input).toString());
    assertThat(Parser.parse(Lexer.tokenize(input)).toString())
        .isEqualTo(Parser.parse(input).toString());
  }

  @Test
  public void arrowsAreRightAssociative() {
    FunctionType type = (FunctionType) Parser.parse("X -> Y -> Z");
    assertThat(((Identifier) type.domain()).name()).isEqualTo("X");
    FunctionType range = (FunctionType) type.range();
    assertThat(((Identifier) range.domain()).name()).isEqualTo("Y");
    assertThat(((Identifier) range.range()).name()).isEqualTo("Z");
  }

  @Test
  public void explicitParens() {
    BinaryOp root = (BinaryOp) Parser.parse("(A land B) land C");
    assertThat(root.explicitParens()).isFalse();
    assertThat(((BinaryOp) root.left()).explicitParens()).isTrue();

    root = (BinaryOp) Parser.parse("A land B land C");
    assertThat(root.explicitParens()).isFalse();
    assertThat(((BinaryOp) root.left()).explicitParens()).isFalse();
  }

  @Test
  public void lineBreakAfterOperator() {
    BinaryOp op = (BinaryOp) Parser.parse("p land\nq");
    assertThat(op.lineBreakAfter()).isTrue();
    op = (BinaryOp) Parser.parse("p land q");
    assertThat(op.lineBreakAfter()).isFalse();
  }

  @Test
  public void semicolonDesugaring() {
    Quantifier outer = (Quantifier) Parser.parse("forall x : N; y : N | x + y > 0");
    assertThat(outer.quantifier()).isEqualTo("forall");
    assertThat(outer.variables()).containsExactly("x");
    assertThat(outer.domain().toString()).isEqualTo("N");
    assertThat(outer.expression()).isNull();
    Quantifier inner = (Quantifier) outer.body();
    assertThat(inner.quantifier()).isEqualTo("forall");
    assertThat(inner.variables()).containsExactly("y");
    assertThat(inner.domain().toString()).isEqualTo("N");
    assertThat(inner.body().toString()).isEqualTo("((x + y) > 0)");
  }

  @Test
  public void tuplePattern() {
    Quantifier quantifier = (Quantifier) Parser.parse("exists (a, b) : R | a = b");
    assertThat(quantifier.tuplePattern()).isTrue();
    assertThat(quantifier.variables()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void lineBreakAfterPipe() {
    Quantifier quantifier = (Quantifier) Parser.parse("forall x : N |\n  x >= 0");
    assertThat(quantifier.lineBreakAfterPipe()).isTrue();
  }

  @Test
  public void truthTable() {
    TruthTable table =
        (TruthTable)
            Parser.parse(
                lines(
                    "TRUTH TABLE:",
                    "p | q | p land q",
                    "T | T | T",
                    "T | F | F",
                    "F | T | F",
                    "F | F | F"));
    assertThat(table.headers()).containsExactly("p", "q", "p land q").inOrder();
    assertThat(table.rows()).hasSize(4);
    assertThat(table.rows().get(0)).containsExactly("T", "T", "T").inOrder();
    assertThat(table.rows().get(1)).containsExactly("T", "F", "F").inOrder();
    assertThat(table.rows().get(2)).containsExactly("F", "T", "F").inOrder();
    assertThat(table.rows().get(3)).containsExactly("F", "F", "F").inOrder();
  }

  @Test
  public void truthValuesAreNormalized() {
    TruthTable table = (TruthTable) Parser.parse(lines("TRUTH TABLE:", "p", "t", "f"));
    assertThat(table.rows().get(0)).containsExactly("T");
    assertThat(table.rows().get(1)).containsExactly("F");
  }

  @Test
  public void truthTableWithoutRows() {
    TruthTable table = (TruthTable) Parser.parse(lines("TRUTH TABLE:", "p | lnot p"));
    assertThat(table.headers()).containsExactly("p", "lnot p").inOrder();
    assertThat(table.rows()).isEmpty();
  }

  @Test
  public void recursiveFreeType() {
    FreeType freeType = (FreeType) Parser.parse("Tree ::= leaf⟨N⟩ | branch⟨Tree × Tree⟩");
    assertThat(freeType.name()).isEqualTo("Tree");
    assertThat(freeType.branches()).hasSize(2);
    FreeBranch leaf = freeType.branches().get(0);
    assertThat(leaf.name()).isEqualTo("leaf");
    assertThat(((Identifier) leaf.parameters()).name()).isEqualTo("N");
    FreeBranch branch = freeType.branches().get(1);
    assertThat(branch.name()).isEqualTo("branch");
    BinaryOp product = (BinaryOp) branch.parameters();
    assertThat(product.operator()).isEqualTo("×");
    assertThat(((Identifier) product.left()).name()).isEqualTo("Tree");
    assertThat(((Identifier) product.right()).name()).isEqualTo("Tree");
  }

  @Test
  public void freeTypeAsciiBrackets() {
    assertThat(Parser.parse("List ::= nil | cons<N cross List>").toString())
        .isEqualTo("List ::= nil | cons<(N cross List)>");
  }

  @Test
  public void freeTypeContinuation() {
    FreeType freeType = (FreeType) Parser.parse(lines("Colour ::= red", "  | green", "  | blue"));
    assertThat(freeType.branches()).hasSize(3);
    assertThat(freeType.branches().get(2).parameters()).isNull();
  }

  @Test
  public void given() {
    GivenType given = (GivenType) Parser.parse("given Person, Book");
    assertThat(given.names()).containsExactly("Person", "Book").inOrder();
  }

  @Test
  public void abbreviations() {
    Abbreviation abbreviation = (Abbreviation) Parser.parse("Pair == N cross N");
    assertThat(abbreviation.name()).isEqualTo("Pair");
    assertThat(abbreviation.genericParams()).isEmpty();
    assertThat(abbreviation.expression().toString()).isEqualTo("(N cross N)");

    abbreviation = (Abbreviation) Parser.parse("[X, Y] Pair == X cross Y");
    assertThat(abbreviation.genericParams()).containsExactly("X", "Y").inOrder();
    assertThat(abbreviation.toString()).isEqualTo("[X, Y] Pair == (X cross Y)");

    abbreviation = (Abbreviation) Parser.parse("R+ == R o9 R");
    assertThat(abbreviation.name()).isEqualTo("R+");
  }

  @Test
  public void axdef() {
    AxDef axdef =
        (AxDef)
            Parser.parse(
                lines("axdef", "  limit : N", "where", "  limit > 0", "", "  limit < 10", "end"));
    assertThat(axdef.declarations()).hasSize(1);
    assertThat(axdef.declarations().get(0).variable()).isEqualTo("limit");
    assertThat(axdef.predicates()).hasSize(2);
    assertThat(axdef.toString())
        .isEqualTo(
            lines(
                "axdef",
                "  limit : N",
                "where",
                "  (limit > 0)",
                "",
                "  (limit < 10)",
                "end"));
  }

  @Test
  public void declarations() {
    AxDef axdef = (AxDef) Parser.parse(lines("axdef [X]", "  x, y : X; z : P X", "end"));
    assertThat(axdef.genericParams()).containsExactly("X");
    assertThat(axdef.declarations()).hasSize(3);
    assertThat(axdef.declarations().get(1).variable()).isEqualTo("y");
    assertThat(axdef.declarations().get(1).type().toString()).isEqualTo("X");
    assertThat(axdef.declarations().get(2).type().toString()).isEqualTo("P X");
    assertThat(axdef.predicates()).isEmpty();
  }

  @Test
  public void schema() {
    Schema schema =
        (Schema)
            Parser.parse(
                lines(
                    "schema State",
                    "  count : N",
                    "  items : seq N",
                    "where",
                    "  count <= 10",
                    "end"));
    assertThat(schema.name()).isEqualTo("State");
    assertThat(schema.declarations()).hasSize(2);
    assertThat(schema.predicates()).hasSize(1);
    assertThat(schema.toString())
        .isEqualTo(
            lines(
                "schema State",
                "  count : N",
                "  items : seq N",
                "where",
                "  (count <= 10)",
                "end"));
  }

  @Test
  public void zed() {
    Zed zed = (Zed) Parser.parse(lines("zed", "  x = 1", "end"));
    assertThat(zed.content()).isInstanceOf(BinaryOp.class);

    zed = (Zed) Parser.parse(lines("zed", "  given A", "  x = 1", "end"));
    assertThat(zed.content()).isInstanceOf(Document.class);
    assertThat(((Document) zed.content()).items().get(0)).isInstanceOf(GivenType.class);
  }

  @Test
  public void syntax() {
    SyntaxBlock syntax =
        (SyntaxBlock)
            Parser.parse(
                lines(
                    "syntax",
                    "  Exp ::= num<N> | add<Exp × Exp>",
                    "        | neg<Exp>",
                    "",
                    "  Val ::= v",
                    "end"));
    assertThat(syntax.groups()).hasSize(2);
    assertThat(syntax.groups().get(0).get(0).name()).isEqualTo("Exp");
    assertThat(syntax.groups().get(0).get(0).branches()).hasSize(3);
    assertThat(syntax.groups().get(1).get(0).name()).isEqualTo("Val");
  }

  @Test
  public void sections() {
    Document document =
        (Document) Parser.parse(lines("=== Intro ===", "p land q", "", "=== Next ===", "q"));
    assertThat(document.items()).hasSize(2);
    Section intro = (Section) document.items().get(0);
    assertThat(intro.title()).isEqualTo("Intro");
    assertThat(intro.items()).hasSize(1);
    Section next = (Section) document.items().get(1);
    assertThat(next.title()).isEqualTo("Next");
    assertThat(next.items()).hasSize(1);
  }

  @Test
  public void titlesThatReadLikeProse() {
    Section section =
        (Section)
            Parser.parse(
                lines(
                    "=== First Show Using Second ===",
                    "TEXT: Consider this",
                    "",
                    "** Solution 1 **",
                    "p"));
    assertThat(section.title()).isEqualTo("First Show Using Second");
    assertThat(section.items()).hasSize(2);
    assertThat(((Paragraph) section.items().get(0)).text()).isEqualTo("Consider this");
    Solution solution = (Solution) section.items().get(1);
    assertThat(solution.title()).isEqualTo("Solution 1");
    assertThat(((Identifier) solution.items().get(0)).name()).isEqualTo("p");

    Solution given = (Solution) Parser.parse(lines("** Given Consider Using **", "q"));
    assertThat(given.title()).isEqualTo("Given Consider Using");
    assertThat(given.items()).hasSize(1);
  }

  @Test
  public void solutionsAndParts() {
    Solution solution =
        (Solution) Parser.parse(lines("** Solution 1 **", "(a) p land q", "(b) q", "", "r"));
    assertThat(solution.title()).isEqualTo("Solution 1");
    assertThat(solution.items()).hasSize(2);
    Part a = (Part) solution.items().get(0);
    assertThat(a.label()).isEqualTo("a");
    assertThat(a.items()).hasSize(1);
    Part b = (Part) solution.items().get(1);
    assertThat(b.label()).isEqualTo("b");
    assertThat(b.items()).hasSize(2);
    assertThat(solution.toString())
        .isEqualTo(lines("** Solution 1 **", "  (a)", "    (p land q)", "  (b)", "    q", "    r"));
  }

  @Test
  public void textBlocks() {
    Document document =
        (Document)
            Parser.parse(
                lines(
                    "TEXT: Hello world",
                    "more text",
                    "",
                    "PURETEXT: raw text",
                    "LATEX: \\newpage",
                    "PAGEBREAK:",
                    "CONTENTS: 2",
                    "PARTS: inline"));
    assertThat(document.items()).hasSize(6);
    assertThat(((Paragraph) document.items().get(0)).text()).isEqualTo("Hello world\nmore text");
    assertThat(((PureParagraph) document.items().get(1)).text()).isEqualTo("raw text");
    assertThat(((Contents) document.items().get(4)).depth()).isEqualTo("2");
    assertThat(document.toString())
        .isEqualTo(
            lines(
                "TEXT: Hello world",
                "more text",
                "PURETEXT: raw text",
                "LATEX: \\newpage",
                "PAGEBREAK:",
                "CONTENTS: 2",
                "PARTS: inline"));
  }

  @Test
  public void equivChain() {
    EquivChain chain =
        (EquivChain)
            Parser.parse(
                lines("EQUIV:", "p land q", "<=> q land p [commutativity]", "<=> q land p"));
    assertThat(chain.argue()).isFalse();
    assertThat(chain.steps()).hasSize(3);
    assertThat(chain.steps().get(0).justification()).isNull();
    assertThat(chain.steps().get(1).justification()).isEqualTo("commutativity");
    assertThat(chain.steps().get(1).expression().toString()).isEqualTo("(q land p)");
  }

  @Test
  public void argueChainEndsAtBlankLine() {
    Document document =
        (Document) Parser.parse(lines("ARGUE:", "p => q [def of f, g]", "", "r"));
    EquivChain chain = (EquivChain) document.items().get(0);
    assertThat(chain.argue()).isTrue();
    assertThat(chain.steps()).hasSize(1);
    assertThat(chain.steps().get(0).justification()).isEqualTo("def of f, g");
    assertThat(document.items().get(1)).isInstanceOf(Identifier.class);
  }

  @Test
  public void infrule() {
    InfruleBlock rule =
        (InfruleBlock) Parser.parse(lines("INFRULE:", "p", "q", "---", "p land q [and-intro]"));
    assertThat(rule.premises()).hasSize(2);
    assertThat(rule.conclusion().expression().toString()).isEqualTo("(p land q)");
    assertThat(rule.conclusion().label()).isEqualTo("and-intro");
    assertThat(rule.toString())
        .isEqualTo(lines("INFRULE:", "  p", "  q", "  ---", "  (p land q) [and-intro]"));
  }
}
