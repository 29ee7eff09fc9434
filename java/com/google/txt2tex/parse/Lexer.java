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

import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.ImmutableList;
import com.google.txt2tex.diag.LineMap;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Converts txt2tex source text into a flat list of tokens ending in {@link TokenKind#EOF}.
 *
 * <p>A lexer is single use; see {@link #tokenize(String)}.
 */
public class Lexer {

  private static final Pattern BLOCK_KEYWORD =
      Pattern.compile(
          "^(TEXT|PURETEXT|LATEX|PROOF|EQUIV|ARGUE|INFRULE|PAGEBREAK|CONTENTS|PARTS"
              + "|TRUTH[ \\t]+TABLE):");

  private static final Pattern STRUCTURAL_LINE =
      Pattern.compile(
          "^(===|\\*\\*|\\([a-z]\\)"
              + "|(TEXT|PURETEXT|LATEX|PROOF|EQUIV|ARGUE|INFRULE|PAGEBREAK|CONTENTS|PARTS"
              + "|TRUTH[ \\t]+TABLE):"
              + "|(given|axdef|schema|gendef|zed|syntax)\\b)");

  /** Tokenizes the given source. */
  public static ImmutableList<Token> tokenize(String input) {
    return new Lexer(input).tokenize();
  }

  private final String input;
  private final LineMap lineMap;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  /** The current input position. */
  private int position;

  /** The last token emitted, and the input position just past it. */
  private @Nullable Token last;

  private int lastEnd;

  /** Whether only indentation has been seen since the last line break. */
  private boolean lineStart = true;

  /** Whether indentation is significant, between {@code PROOF:} and the next structural line. */
  private boolean proofMode;

  /** Whether the current line defines a free type. */
  private boolean freeTypeLine;

  /** Whether the lexer is inside a {@code syntax} block. */
  private boolean syntaxBlock;

  /** The nesting depth of sequence brackets on the current line. */
  private int sequenceDepth;

  private boolean done;

  public Lexer(String input) {
    this.input = input;
    this.lineMap = LineMap.create(input);
  }

  /** Tokenizes the entire input. */
  public ImmutableList<Token> tokenize() {
    if (done) {
      throw new IllegalStateException("already tokenized");
    }
    done = true;
    while (position < input.length()) {
      next();
    }
    emit(TokenKind.EOF, "", input.length());
    return tokens.build();
  }

  private void next() {
    if (lineStart) {
      lineStart = false;
      if (lineStart()) {
        return;
      }
      if (position >= input.length()) {
        return;
      }
    }
    char ch = input.charAt(position);
    switch (ch) {
      case ' ', '\t', '\f' -> position++;
      case '\r', '\n' -> newline();
      case '\\' -> backslash();
      case '^' -> caret();
      default -> {
        if (Operators.isIdentifierStart(ch)) {
          word();
        } else if (isDigit(ch) && !input.startsWith("77->", position)) {
          number();
        } else {
          operator();
        }
      }
    }
  }

  /**
   * Handles indentation and the line-leading structure markers. Returns true if the rest of the
   * line was consumed as a marker.
   */
  private boolean lineStart() {
    int start = position;
    int idx = position;
    while (idx < input.length() && (input.charAt(idx) == ' ' || input.charAt(idx) == '\t')) {
      idx++;
    }
    int end = lineEnd(idx);
    String rest = input.substring(idx, end);
    if (rest.isBlank()) {
      position = idx;
      return false;
    }
    boolean structural = isStructuralLine(rest);
    if (structural) {
      proofMode = false;
    } else if (proofMode && idx > start) {
      emit(TokenKind.INDENT, input.substring(start, idx), start);
    }
    position = idx;
    freeTypeLine = rest.contains("::=") || (syntaxBlock && rest.startsWith("|"));

    if (rest.startsWith("===")) {
      titled(TokenKind.SECTION_MARKER, "===", end);
      return true;
    }
    if (rest.startsWith("**")) {
      titled(TokenKind.SOLUTION_MARKER, "**", end);
      return true;
    }
    if (rest.length() >= 3
        && rest.charAt(0) == '('
        && rest.charAt(1) >= 'a'
        && rest.charAt(1) <= 'z'
        && rest.charAt(2) == ')') {
      emit(TokenKind.PART_LABEL, rest.substring(0, 3), idx);
      position = idx + 3;
      return true;
    }
    String trimmed = rest.strip();
    if (trimmed.length() >= 3 && trimmed.chars().allMatch(c -> c == '-')) {
      emit(TokenKind.RULE_SEPARATOR, trimmed, idx);
      position = idx + trimmed.length();
      return true;
    }
    Matcher matcher = BLOCK_KEYWORD.matcher(rest);
    if (matcher.find()) {
      position = idx + matcher.end();
      blockKeyword(matcher.group(1), idx);
      return true;
    }
    return false;
  }

  private void blockKeyword(String keyword, int start) {
    switch (keyword) {
      case "TEXT" -> textBlock(TokenKind.TEXT, start);
      case "PURETEXT" -> textBlock(TokenKind.PURETEXT, start);
      case "LATEX" -> textBlock(TokenKind.LATEX, start);
      case "CONTENTS" -> restOfLine(TokenKind.CONTENTS, start);
      case "PARTS" -> restOfLine(TokenKind.PARTS, start);
      case "PROOF" -> {
        emit(TokenKind.PROOF, "PROOF:", start);
        proofMode = true;
      }
      case "EQUIV" -> emit(TokenKind.EQUIV, "EQUIV:", start);
      case "ARGUE" -> emit(TokenKind.ARGUE, "ARGUE:", start);
      case "INFRULE" -> emit(TokenKind.INFRULE, "INFRULE:", start);
      case "PAGEBREAK" -> emit(TokenKind.PAGEBREAK, "PAGEBREAK:", start);
      default -> emit(TokenKind.TRUTH_TABLE, "TRUTH TABLE:", start);
    }
  }

  /**
   * Emits a section or solution marker. If the closing marker is on the same line, the raw title
   * between them is a single {@link TokenKind#TITLE} token.
   */
  private void titled(TokenKind kind, String marker, int lineEnd) {
    int open = position;
    int close = input.indexOf(marker, open + marker.length());
    emit(kind, marker, open);
    position = open + marker.length();
    if (close < 0 || close >= lineEnd) {
      return;
    }
    String raw = input.substring(position, close);
    String title = raw.strip();
    int titleStart = position + raw.indexOf(title);
    emit(TokenKind.TITLE, title, titleStart, titleStart + title.length());
    emit(kind, marker, close);
    position = close + marker.length();
  }

  /** Captures the rest of the line, and any following lines of the same paragraph. */
  private void textBlock(TokenKind kind, int start) {
    int end = lineEnd(position);
    StringBuilder text = new StringBuilder(input.substring(position, end).strip());
    while (true) {
      int next = nextLineStart(end);
      if (next < 0) {
        break;
      }
      int nextEnd = lineEnd(next);
      String line = input.substring(next, nextEnd).strip();
      if (line.isEmpty() || isStructuralLine(line)) {
        break;
      }
      text.append('\n').append(line);
      end = nextEnd;
    }
    emit(kind, text.toString(), start, end);
    position = end;
  }

  private void restOfLine(TokenKind kind, int start) {
    int end = lineEnd(position);
    emit(kind, input.substring(position, end).strip(), start, end);
    position = end;
  }

  private void newline() {
    int start = position;
    if (input.charAt(position) == '\r'
        && position + 1 < input.length()
        && input.charAt(position + 1) == '\n') {
      position += 2;
    } else {
      position++;
    }
    emit(TokenKind.NEWLINE, "\n", start, position);
    lineStart = true;
    freeTypeLine = false;
    sequenceDepth = 0;
  }

  /** A {@code \} at the end of a line continues the line, anywhere else it is set difference. */
  private void backslash() {
    int idx = position + 1;
    while (idx < input.length() && (input.charAt(idx) == ' ' || input.charAt(idx) == '\t')) {
      idx++;
    }
    if (idx == input.length()) {
      emit(TokenKind.CONTINUATION, "\\", position);
      position = idx;
      return;
    }
    char ch = input.charAt(idx);
    if (ch == '\n' || ch == '\r') {
      emit(TokenKind.CONTINUATION, "\\", position);
      int next = nextLineStart(idx);
      position = next < 0 ? input.length() : next;
      return;
    }
    emit(TokenKind.SETMINUS, "\\", position);
    position++;
  }

  /** Whitespace before {@code ^} makes it concatenation, otherwise it is an exponent. */
  private void caret() {
    boolean spaced = position == 0 || isWhitespace(input.charAt(position - 1));
    if (spaced) {
      emit(TokenKind.CAT, "^", position);
    } else {
      if (last != null
          && last.is(TokenKind.RANGLE)
          && lastEnd == position
          && position + 1 < input.length()
          && isSequenceOpen(input, position + 1)) {
        throw error(ErrorKind.UNSPACED_CONCATENATION, position);
      }
      emit(TokenKind.CARET, "^", position);
    }
    position++;
  }

  private void word() {
    int start = position;
    position++;
    while (position < input.length() && Operators.isIdentifierPart(input.charAt(position))) {
      position++;
    }
    String word = input.substring(start, position);
    int decorated = decorations(position);
    if (decorated == position) {
      TokenKind keyword = Operators.keyword(word);
      if (keyword != null) {
        keyword(keyword, word, start);
        return;
      }
      TokenKind setFunction = setFunction(word);
      if (setFunction != null) {
        emit(setFunction, word, start);
        return;
      }
    }
    position = decorated;
    if (isClosureBeforeAbbreviation(position)) {
      position++;
    }
    emit(TokenKind.IDENTIFIER, input.substring(start, position), start);
  }

  private void keyword(TokenKind kind, String word, int start) {
    switch (kind) {
      case SYNTAX -> syntaxBlock = true;
      case END -> syntaxBlock = false;
      default -> {}
    }
    emit(kind, word, start);
  }

  /** Returns the position after any Z decorations ({@code '}, {@code ?}, {@code !}). */
  private int decorations(int idx) {
    while (idx < input.length()) {
      char ch = input.charAt(idx);
      if (ch == '\'' || ch == '?') {
        idx++;
      } else if (ch == '!' && (idx + 1 >= input.length() || input.charAt(idx + 1) != '=')) {
        idx++;
      } else {
        break;
      }
    }
    return idx;
  }

  /**
   * {@code P}, {@code P1}, {@code F} and {@code F1} are set functions when an operand follows them
   * on the same line, and identifiers otherwise.
   */
  private @Nullable TokenKind setFunction(String word) {
    TokenKind kind =
        switch (word) {
          case "P" -> TokenKind.POWER;
          case "P1" -> TokenKind.POWER1;
          case "F" -> TokenKind.FINSET;
          case "F1" -> TokenKind.FINSET1;
          default -> null;
        };
    if (kind == null) {
      return null;
    }
    int idx = position;
    while (idx < input.length() && (input.charAt(idx) == ' ' || input.charAt(idx) == '\t')) {
      idx++;
    }
    if (idx == input.length()) {
      return null;
    }
    char ch = input.charAt(idx);
    if (Operators.isIdentifierPart(ch)) {
      int end = idx;
      while (end < input.length() && Operators.isIdentifierPart(input.charAt(end))) {
        end++;
      }
      return Operators.isOperatorWord(input.substring(idx, end)) ? null : kind;
    }
    return switch (ch) {
      case '(', '{', '#', '⟨' -> kind;
      default -> null;
    };
  }

  /** Compound names such as {@code R+} absorb a closure operator only when {@code ==} follows. */
  private boolean isClosureBeforeAbbreviation(int idx) {
    if (idx >= input.length()) {
      return false;
    }
    char ch = input.charAt(idx);
    if (ch != '+' && ch != '*' && ch != '~') {
      return false;
    }
    idx++;
    while (idx < input.length() && (input.charAt(idx) == ' ' || input.charAt(idx) == '\t')) {
      idx++;
    }
    return input.startsWith("==", idx) && !input.startsWith("===", idx);
  }

  /** Digits, or a digit-leading identifier such as {@code 479_courses}. */
  private void number() {
    int start = position;
    while (position < input.length() && isDigit(input.charAt(position))) {
      position++;
    }
    if (position + 1 < input.length()
        && input.charAt(position) == '_'
        && Operators.isIdentifierPart(input.charAt(position + 1))) {
      while (position < input.length() && Operators.isIdentifierPart(input.charAt(position))) {
        position++;
      }
      emit(TokenKind.IDENTIFIER, input.substring(start, position), start);
      return;
    }
    emit(TokenKind.NUMBER, input.substring(start, position), start);
  }

  private void operator() {
    String symbol = Operators.longestSymbol(input, position);
    if (symbol == null) {
      throw error(
          ErrorKind.UNEXPECTED_CHARACTER,
          position,
          Character.toString(input.codePointAt(position)));
    }
    TokenKind kind = verifyNotNull(Operators.SYMBOLS.get(symbol));
    switch (kind) {
      case LESS_THAN -> {
        if (isSequenceOpen()) {
          kind = TokenKind.LANGLE;
        }
      }
      case GREATER_THAN -> {
        if (sequenceDepth > 0) {
          kind = TokenKind.RANGLE;
        }
      }
      default -> {}
    }
    switch (kind) {
      case LANGLE -> sequenceDepth++;
      case RANGLE -> sequenceDepth = Math.max(0, sequenceDepth - 1);
      default -> {}
    }
    emit(kind, symbol, position);
    position += symbol.length();
  }

  /**
   * An ASCII {@code <} opens a sequence when it cannot be a comparison: at the start of an operand,
   * as {@code <>}, or directly after a constructor name in a free type.
   */
  private boolean isSequenceOpen() {
    if (position + 1 < input.length() && input.charAt(position + 1) == '>') {
      return true;
    }
    if (last == null) {
      return true;
    }
    if (freeTypeLine && last.is(TokenKind.IDENTIFIER) && lastEnd == position) {
      return true;
    }
    return !endsOperand(last.kind());
  }

  private static boolean isSequenceOpen(String input, int idx) {
    return input.charAt(idx) == '<' || input.charAt(idx) == '⟨';
  }

  private static boolean endsOperand(TokenKind kind) {
    return switch (kind) {
      case IDENTIFIER, NUMBER, RPAREN, RBRACKET, RBRACE, RANGLE, RIMG, TILDE, ELLIPSIS -> true;
      default -> false;
    };
  }

  /** Returns true for lines that start a new document item of their own. */
  static boolean isStructuralLine(String line) {
    return STRUCTURAL_LINE.matcher(line.strip()).find();
  }

  private int lineEnd(int idx) {
    while (idx < input.length() && input.charAt(idx) != '\n' && input.charAt(idx) != '\r') {
      idx++;
    }
    return idx;
  }

  /** Returns the start of the line after the line terminator at {@code end}, or -1 at EOF. */
  private int nextLineStart(int end) {
    if (end >= input.length()) {
      return -1;
    }
    if (input.charAt(end) == '\r' && end + 1 < input.length() && input.charAt(end + 1) == '\n') {
      return end + 2;
    }
    return end + 1;
  }

  private void emit(TokenKind kind, String text, int start) {
    emit(kind, text, start, start + text.length());
  }

  private void emit(TokenKind kind, String text, int start, int end) {
    Token token = new Token(kind, text, lineMap.lineNumber(start), lineMap.column(start) + 1);
    tokens.add(token);
    last = token;
    lastEnd = end;
  }

  private LexerError error(ErrorKind kind, int position, Object... args) {
    return new LexerError(kind, lineMap.lineNumber(position), lineMap.column(position) + 1, args);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isWhitespace(char ch) {
    return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
  }
}
