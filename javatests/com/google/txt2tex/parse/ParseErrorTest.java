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

import com.google.common.base.Joiner;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParseErrorTest {

  private static ParserError error(String... lines) {
    String input = Joiner.on('\n').join(lines);
    return assertThrows(ParserError.class, () -> Parser.parse(input));
  }

  @Test
  public void nestedTuplePattern() {
    ParserError e = error("forall ((a,b),c) : T | P");
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_TUPLE_PATTERN);
    assertThat(e)
        .hasMessageThat()
        .contains("Tuple pattern in forall binding must contain only identifiers");
  }

  @Test
  public void emptyTuplePattern() {
    assertThat(error("forall () : T | P").kind()).isEqualTo(ErrorKind.EMPTY_TUPLE_PATTERN);
  }

  @Test
  public void missingQuantifierBar() {
    ParserError e = error("forall x : N");
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_QUANTIFIER_BAR);
    assertThat(e.line()).isEqualTo(1);
    assertThat(e.column()).isEqualTo(13);
  }

  @Test
  public void missingComprehensionBar() {
    assertThat(error("{x : N}").kind()).isEqualTo(ErrorKind.EXPECTED_COMPREHENSION_BAR);
  }

  @Test
  public void unclosedParenthesis() {
    ParserError e = error("(p land q");
    assertThat(e.kind()).isEqualTo(ErrorKind.UNCLOSED);
    assertThat(e.column()).isEqualTo(10);
    assertThat(e.message()).isEqualTo("Unclosed parenthesis: expected ')'");
    assertThat(e.kind().hint()).contains("balanced");
  }

  @Test
  public void missingOperand() {
    ParserError e = error("p land");
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_EXPRESSION);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Line 1, column 7: Expected expression, found end of input");
  }

  @Test
  public void trailingToken() {
    ParserError e = error("p )");
    assertThat(e.kind()).isEqualTo(ErrorKind.TRAILING_TOKEN);
    assertThat(e.message()).isEqualTo("Unexpected token after expression: ')'");
    assertThat(e.token().kind()).isEqualTo(TokenKind.RPAREN);
  }

  @Test
  public void unclosedSection() {
    assertThat(error("=== Title").kind()).isEqualTo(ErrorKind.MISSING_SECTION_CLOSE);
  }

  @Test
  public void unclosedSolution() {
    assertThat(error("** Solution").kind()).isEqualTo(ErrorKind.MISSING_SOLUTION_CLOSE);
  }

  @Test
  public void missingEnd() {
    ParserError e = error("axdef", "  x : N");
    assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_END);
    assertThat(e.message()).isEqualTo("Expected 'end' to close axdef block");
  }

  @Test
  public void emptyFreeType() {
    assertThat(error("Tree ::=").kind()).isEqualTo(ErrorKind.EMPTY_FREE_TYPE);
  }

  @Test
  public void emptyGiven() {
    assertThat(error("given").kind()).isEqualTo(ErrorKind.EMPTY_GIVEN);
  }

  @Test
  public void truthTableErrors() {
    assertThat(error("TRUTH TABLE:", "| p").kind())
        .isEqualTo(ErrorKind.MISSING_TRUTH_TABLE_HEADER);
    assertThat(error("TRUTH TABLE:", "p | | q").kind())
        .isEqualTo(ErrorKind.EMPTY_TRUTH_TABLE_HEADERS);

    ParserError e = error("TRUTH TABLE:", "p | q", "T | X");
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_TRUTH_VALUE);
    assertThat(e.message()).isEqualTo("Expected truth value T or F, found 'X'");
    assertThat(e.line()).isEqualTo(3);
  }

  @Test
  public void chainErrors() {
    ParserError e = error("EQUIV:");
    assertThat(e.kind()).isEqualTo(ErrorKind.EMPTY_CHAIN);
    assertThat(e.message()).isEqualTo("Expected at least one step in EQUIV chain");
    assertThat(error("EQUIV:", "p [reason").kind()).isEqualTo(ErrorKind.UNCLOSED_JUSTIFICATION);
  }

  @Test
  public void infruleErrors() {
    assertThat(error("INFRULE:", "p", "q").kind()).isEqualTo(ErrorKind.MISSING_INFRULE_SEPARATOR);
    assertThat(error("INFRULE:", "---", "p").kind()).isEqualTo(ErrorKind.EMPTY_INFRULE_PREMISES);
    assertThat(error("INFRULE:", "p", "---").kind())
        .isEqualTo(ErrorKind.MISSING_INFRULE_CONCLUSION);
  }

  @Test
  public void missingElse() {
    assertThat(error("if p then q").kind()).isEqualTo(ErrorKind.MISSING_ELSE);
  }

  @Test
  public void missingGuard() {
    assertThat(error("f(x) =", "  x if x > 0", "  0").kind()).isEqualTo(ErrorKind.EXPECTED_GUARD);
  }

  @Test
  public void chainedComparison() {
    ParserError e = error("a < b < c");
    assertThat(e.kind()).isEqualTo(ErrorKind.CHAINED_OPERATOR);
    assertThat(e.column()).isEqualTo(7);
    assertThat(e.message()).contains("'<'");
    assertThat(error("x = y in S").kind()).isEqualTo(ErrorKind.CHAINED_OPERATOR);
  }

  @Test
  public void chainedRange() {
    ParserError e = error("1 .. 2 .. 3");
    assertThat(e.kind()).isEqualTo(ErrorKind.CHAINED_OPERATOR);
    assertThat(e.column()).isEqualTo(8);
  }

  @Test
  public void periodAtEndOfLineIsNotProjection() {
    ParserError e = error("x.");
    assertThat(e.kind()).isEqualTo(ErrorKind.TRAILING_TOKEN);
    assertThat(e.column()).isEqualTo(2);
    assertThat(error("x.", "y").kind()).isEqualTo(ErrorKind.TRAILING_TOKEN);
  }

  @Test
  public void missingProjection() {
    assertThat(error("x.)").kind()).isEqualTo(ErrorKind.EXPECTED_PROJECTION);
  }
}
