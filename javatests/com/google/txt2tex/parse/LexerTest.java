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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LexerTest {

  @Test
  public void testSimple() {
    assertThat(lex("p land q")).containsExactly("IDENTIFIER(p)", "AND", "IDENTIFIER(q)", "EOF");
  }

  @Test
  public void aliases() {
    assertThat(lex("p ∧ q and r"))
        .containsExactly("IDENTIFIER(p)", "AND", "IDENTIFIER(q)", "AND", "IDENTIFIER(r)", "EOF");
    assertThat(lex("x elem A")).isEqualTo(lex("x in A"));
    assertThat(lex("x ∈ A")).isEqualTo(lex("x in A"));
    assertThat(lex("A ⊆ B")).isEqualTo(lex("A subseteq B"));
    assertThat(lex("A ⊂ B")).isEqualTo(lex("A psubset B"));
    assertThat(lex("f : A → B")).isEqualTo(lex("f : A -> B"));
  }

  @Test
  public void longestMatch() {
    assertThat(lex("A >->> B"))
        .containsExactly("IDENTIFIER(A)", "BIJECTION", "IDENTIFIER(B)", "EOF");
    assertThat(lex("A >-> B")).containsExactly("IDENTIFIER(A)", "TINJ", "IDENTIFIER(B)", "EOF");
    assertThat(lex("x |-> y")).containsExactly("IDENTIFIER(x)", "MAPLET", "IDENTIFIER(y)", "EOF");
    assertThat(lex("A <<| R")).containsExactly("IDENTIFIER(A)", "NDRES", "IDENTIFIER(R)", "EOF");
    assertThat(lex("A <| R")).containsExactly("IDENTIFIER(A)", "DRES", "IDENTIFIER(R)", "EOF");
    assertThat(lex("A +->> B")).containsExactly("IDENTIFIER(A)", "PSURJ", "IDENTIFIER(B)", "EOF");
    assertThat(lex("A +-> B")).containsExactly("IDENTIFIER(A)", "PFUN", "IDENTIFIER(B)", "EOF");
    assertThat(lex("A 77-> B")).containsExactly("IDENTIFIER(A)", "FINFUN", "IDENTIFIER(B)", "EOF");
    assertThat(lex("p <=> q")).containsExactly("IDENTIFIER(p)", "IFF", "IDENTIFIER(q)", "EOF");
  }

  @Test
  public void caret() {
    assertThat(lex("a^b")).containsExactly("IDENTIFIER(a)", "CARET", "IDENTIFIER(b)", "EOF");
    assertThat(lex("a ^ b")).containsExactly("IDENTIFIER(a)", "CAT", "IDENTIFIER(b)", "EOF");
  }

  @Test
  public void unspacedConcatenation() {
    LexerError e = assertThrows(LexerError.class, () -> Lexer.tokenize("<a>^<b>"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNSPACED_CONCATENATION);
    assertThat(e).hasMessageThat().contains("> ^ <");
    assertThat(e).hasMessageThat().contains(">^<");
  }

  @Test
  public void sequenceBrackets() {
    assertThat(lex("<a> ^ <b>"))
        .containsExactly(
            "LANGLE", "IDENTIFIER(a)", "RANGLE", "CAT", "LANGLE", "IDENTIFIER(b)", "RANGLE", "EOF")
        .inOrder();
    assertThat(lex("<>")).containsExactly("LANGLE", "RANGLE", "EOF").inOrder();
    assertThat(lex("x < y"))
        .containsExactly("IDENTIFIER(x)", "LESS_THAN", "IDENTIFIER(y)", "EOF")
        .inOrder();
    assertThat(lex("⟨a⟩")).containsExactly("LANGLE", "IDENTIFIER(a)", "RANGLE", "EOF").inOrder();
  }

  @Test
  public void identifiers() {
    assertThat(lex("479_courses")).containsExactly("IDENTIFIER(479_courses)", "EOF");
    assertThat(lex("12")).containsExactly("NUMBER(12)", "EOF");
    assertThat(lex("x' = x"))
        .containsExactly("IDENTIFIER(x')", "EQUALS", "IDENTIFIER(x)", "EOF")
        .inOrder();
  }

  @Test
  public void setFunctions() {
    assertThat(lex("P X")).containsExactly("POWER", "IDENTIFIER(X)", "EOF").inOrder();
    assertThat(lex("P")).containsExactly("IDENTIFIER(P)", "EOF");
    assertThat(lex("F land G"))
        .containsExactly("IDENTIFIER(F)", "AND", "IDENTIFIER(G)", "EOF")
        .inOrder();
  }

  @Test
  public void compoundAbbreviationName() {
    assertThat(lex("R+ == R"))
        .containsExactly("IDENTIFIER(R+)", "ABBREV", "IDENTIFIER(R)", "EOF")
        .inOrder();
    assertThat(lex("R+")).containsExactly("IDENTIFIER(R)", "PLUS", "EOF").inOrder();
  }

  @Test
  public void continuation() {
    assertThat(lex("p land \\\nq"))
        .containsExactly("IDENTIFIER(p)", "AND", "CONTINUATION", "IDENTIFIER(q)", "EOF")
        .inOrder();
    assertThat(lex("A \\ B"))
        .containsExactly("IDENTIFIER(A)", "SETMINUS", "IDENTIFIER(B)", "EOF")
        .inOrder();
  }

  @Test
  public void structure() {
    assertThat(lex("=== Intro ===\n"))
        .containsExactly("SECTION_MARKER", "TITLE(Intro)", "SECTION_MARKER", "NEWLINE", "EOF")
        .inOrder();
    assertThat(lex("** Solution 1 **"))
        .containsExactly("SOLUTION_MARKER", "TITLE(Solution 1)", "SOLUTION_MARKER", "EOF")
        .inOrder();
    assertThat(lex("(a) p"))
        .containsExactly("PART_LABEL((a))", "IDENTIFIER(p)", "EOF")
        .inOrder();
    assertThat(lex("TEXT: hello world\nmore text\n\np"))
        .containsExactly(
            "TEXT(hello world\nmore text)", "NEWLINE", "NEWLINE", "IDENTIFIER(p)", "EOF")
        .inOrder();
    assertThat(lex("TRUTH TABLE:")).containsExactly("TRUTH_TABLE", "EOF").inOrder();
  }

  @Test
  public void titleWordsAreNotProse() {
    assertThat(lex("=== Given the following ==="))
        .containsExactly(
            "SECTION_MARKER", "TITLE(Given the following)", "SECTION_MARKER", "EOF")
        .inOrder();
  }

  @Test
  public void proofIndentation() {
    assertThat(lex("PROOF:\np\n  q"))
        .containsExactly(
            "PROOF", "NEWLINE", "IDENTIFIER(p)", "NEWLINE", "INDENT(  )", "IDENTIFIER(q)", "EOF")
        .inOrder();
    // outside proofs, indentation is not significant
    assertThat(lex("p\n  q"))
        .containsExactly("IDENTIFIER(p)", "NEWLINE", "IDENTIFIER(q)", "EOF")
        .inOrder();
  }

  @Test
  public void positions() {
    ImmutableList<Token> tokens = Lexer.tokenize("p land\n  q");
    assertThat(tokens.get(1).line()).isEqualTo(1);
    assertThat(tokens.get(1).column()).isEqualTo(3);
    assertThat(tokens.get(3).text()).isEqualTo("q");
    assertThat(tokens.get(3).line()).isEqualTo(2);
    assertThat(tokens.get(3).column()).isEqualTo(3);
  }

  @Test
  public void unexpectedCharacter() {
    LexerError e = assertThrows(LexerError.class, () -> Lexer.tokenize("p @ q"));
    assertThat(e.kind()).isEqualTo(ErrorKind.UNEXPECTED_CHARACTER);
    assertThat(e.line()).isEqualTo(1);
    assertThat(e.column()).isEqualTo(3);
    assertThat(e).hasMessageThat().isEqualTo("Line 1, column 3: Unexpected character: '@'");
  }

  @Test
  public void singleUse() {
    Lexer lexer = new Lexer("p");
    lexer.tokenize();
    assertThrows(IllegalStateException.class, lexer::tokenize);
  }

  private static List<String> lex(String input) {
    List<String> tokens = new ArrayList<>();
    for (Token token : Lexer.tokenize(input)) {
      tokens.add(token.toString());
    }
    return tokens;
  }
}
