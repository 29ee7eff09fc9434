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

import com.google.common.collect.ImmutableList;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import com.google.txt2tex.tree.Tree.CaseAnalysis;
import com.google.txt2tex.tree.Tree.Expression;
import com.google.txt2tex.tree.Tree.ProofNode;
import com.google.txt2tex.tree.Tree.ProofStep;
import com.google.txt2tex.tree.Tree.ProofTree;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parses a {@code PROOF:} block.
 *
 * <p>The first line is the conclusion. Every later line is a child of the nearest line above it
 * that is indented less. A line may start with an assumption label {@code [N]} and a sibling
 * marker {@code ::}, and may end with a bracketed justification. A line {@code case name:} starts
 * a case analysis whose steps are the lines indented further than it.
 */
class ProofTreeParser {

  /** A proof line, before it is placed in the tree. */
  private record Line(
      Token start,
      @Nullable Integer label,
      boolean sibling,
      @Nullable String caseName,
      @Nullable Expression expression,
      @Nullable String justification) {

    int column() {
      return start.column();
    }
  }

  private final TokenCursor cursor;
  private final ExpressionParser expressions;
  private final List<Line> lines = new ArrayList<>();
  private int next;
  private int baseColumn;

  ProofTreeParser(TokenCursor cursor, ExpressionParser expressions) {
    this.cursor = cursor;
    this.expressions = expressions;
  }

  ProofTree proof() {
    Token proof = cursor.eat(TokenKind.PROOF, ErrorKind.EXPECTED_TOKEN, "'PROOF:'");
    cursor.skipBlankLines();
    if (cursor.is(TokenKind.EOF) || Parser.isStructural(cursor.kind())) {
      throw cursor.error(ErrorKind.EXPECTED_PROOF_NODE);
    }
    while (true) {
      lines.add(line());
      if (cursor.atBlankLine()) {
        if (!continuesAfterBlankLines()) {
          break;
        }
        cursor.skipBlankLines();
        continue;
      }
      cursor.next();
      cursor.maybe(TokenKind.INDENT);
      if (Parser.isStructural(cursor.kind())) {
        break;
      }
    }
    Line conclusion = lines.get(0);
    if (conclusion.caseName() != null) {
      throw new ParserError(ErrorKind.EXPECTED_PROOF_NODE, conclusion.start());
    }
    baseColumn = conclusion.column();
    next = 1;
    return new ProofTree(proof.line(), proof.column(), node(conclusion, Integer.MIN_VALUE));
  }

  /**
   * Returns true if the next non-blank line is indented, so that it continues the proof. An
   * unindented line after a blank line starts a new document item.
   */
  private boolean continuesAfterBlankLines() {
    boolean indented = false;
    int i = 0;
    while (true) {
      Token token = cursor.peek(i++);
      if (token.is(TokenKind.NEWLINE)) {
        indented = false;
      } else if (token.is(TokenKind.INDENT)) {
        indented = true;
      } else {
        return indented
            && !token.is(TokenKind.EOF)
            && !Parser.isStructural(token.kind());
      }
    }
  }

  private Line line() {
    cursor.maybe(TokenKind.INDENT);
    Token start = cursor.token();
    if (isCase(start)) {
      return caseLine(start);
    }
    Integer label = null;
    boolean sibling = false;
    while (true) {
      if (cursor.maybe(TokenKind.DOUBLE_COLON)) {
        sibling = true;
      } else if (label == null
          && cursor.is(TokenKind.LBRACKET)
          && !cursor.peek(1).is(TokenKind.LBRACKET)) {
        label = label();
      } else {
        break;
      }
    }
    Expression expression = expressions.expression();
    String justification = Justifications.read(cursor);
    endOfLine();
    return new Line(start, label, sibling, null, expression, justification);
  }

  private static boolean isCase(Token token) {
    return token.is(TokenKind.IDENTIFIER) && token.text().equals("case");
  }

  private Line caseLine(Token start) {
    cursor.next();
    List<Token> name = new ArrayList<>();
    while (!cursor.is(TokenKind.COLON)) {
      if (cursor.atLineEnd()) {
        throw cursor.error(
            name.isEmpty() ? ErrorKind.EXPECTED_CASE_NAME : ErrorKind.EXPECTED_CASE_COLON);
      }
      name.add(cursor.next());
    }
    if (name.isEmpty()) {
      throw cursor.error(ErrorKind.EXPECTED_CASE_NAME);
    }
    cursor.next();
    endOfLine();
    return new Line(start, null, false, Justifications.join(name), null, null);
  }

  private Integer label() {
    cursor.next();
    Token number = cursor.token();
    if (!number.is(TokenKind.NUMBER)) {
      throw cursor.error(ErrorKind.EXPECTED_ASSUMPTION_LABEL);
    }
    cursor.next();
    cursor.eat(TokenKind.RBRACKET, ErrorKind.UNCLOSED_ASSUMPTION_LABEL);
    return Integer.valueOf(number.text());
  }

  private void endOfLine() {
    if (!cursor.atLineEnd()) {
      throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
    }
  }

  /**
   * Builds the node for a line. Its children are the following lines indented further than
   * {@code threshold}.
   */
  private ProofNode node(Line line, int threshold) {
    ImmutableList.Builder<ProofStep> children = ImmutableList.builder();
    while (next < lines.size() && lines.get(next).column() > threshold) {
      Line child = lines.get(next++);
      if (child.caseName() != null) {
        children.add(caseAnalysis(child));
      } else {
        children.add(node(child, child.column()));
      }
    }
    Token start = line.start();
    return new ProofNode(
        start.line(),
        start.column(),
        line.expression(),
        line.justification(),
        line.label(),
        "assumption".equals(line.justification()),
        line.sibling(),
        children.build(),
        Math.max(0, line.column() - baseColumn));
  }

  private CaseAnalysis caseAnalysis(Line line) {
    ImmutableList.Builder<ProofNode> steps = ImmutableList.builder();
    while (next < lines.size() && lines.get(next).column() > line.column()) {
      Line step = lines.get(next++);
      if (step.caseName() != null) {
        throw new ParserError(ErrorKind.EXPECTED_PROOF_NODE, step.start());
      }
      steps.add(node(step, step.column()));
    }
    Token start = line.start();
    return new CaseAnalysis(start.line(), start.column(), line.caseName(), steps.build());
  }
}
