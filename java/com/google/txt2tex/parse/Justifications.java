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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Utilities for the bracketed justification text of proof steps. */
public final class Justifications {

  /**
   * A run of justification text.
   *
   * @param text the source text of the run
   * @param kind the operator or keyword the run spells, or {@code null} for other text
   */
  public record Segment(String text, @Nullable TokenKind kind) {
    public Segment {
      requireNonNull(text);
    }

    /** Returns true if the segment spells an operator or keyword. */
    public boolean isOperator() {
      return kind != null;
    }
  }

  /**
   * Reads a bracketed justification from the rest of the current line, returning its text, or
   * {@code null} if the current token does not open one.
   */
  static @Nullable String read(TokenCursor cursor) {
    if (!cursor.is(TokenKind.LBRACKET)) {
      return null;
    }
    cursor.next();
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int depth = 0;
    while (depth > 0 || !cursor.is(TokenKind.RBRACKET)) {
      if (cursor.atLineEnd()) {
        throw cursor.error(ErrorKind.UNCLOSED_JUSTIFICATION);
      }
      switch (cursor.kind()) {
        case LBRACKET -> depth++;
        case RBRACKET -> depth--;
        default -> {}
      }
      tokens.add(cursor.next());
    }
    cursor.next();
    return join(tokens.build());
  }

  /**
   * Rebuilds justification text from its tokens. The spacing between tokens is kept as written,
   * except that there is no space before a comma or a closing parenthesis, exactly one space after
   * a comma, and no space after an opening parenthesis.
   */
  public static String join(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    Token previous = null;
    for (Token token : tokens) {
      if (previous != null) {
        sb.append(separator(previous, token));
      }
      sb.append(token.text());
      previous = token;
    }
    return sb.toString();
  }

  private static String separator(Token previous, Token token) {
    if (token.is(TokenKind.COMMA) || token.is(TokenKind.RPAREN)) {
      return "";
    }
    if (previous.is(TokenKind.COMMA)) {
      return " ";
    }
    if (previous.is(TokenKind.LPAREN)) {
      return "";
    }
    if (previous.line() != token.line()) {
      return " ";
    }
    return Strings.repeat(" ", Math.max(0, token.column() - previous.endColumn()));
  }

  /**
   * Splits text into segments, so that operator spellings can be substituted. Symbols are
   * matched longest first with the lexer's operator table, so {@code |->} is never read as
   * {@code |} and {@code ->}. Words are whole identifiers, and are marked as operators when they
   * spell a keyword such as {@code land}.
   *
   * <p>Concatenating the segment texts gives back the input.
   */
  public static ImmutableList<Segment> segments(String text) {
    ImmutableList.Builder<Segment> segments = ImmutableList.builder();
    StringBuilder other = new StringBuilder();
    int position = 0;
    while (position < text.length()) {
      String symbol = Operators.longestSymbol(text, position);
      if (symbol != null) {
        flush(segments, other);
        segments.add(new Segment(symbol, Operators.SYMBOLS.get(symbol)));
        position += symbol.length();
        continue;
      }
      char ch = text.charAt(position);
      if (Operators.isIdentifierPart(ch)) {
        int end = position;
        while (end < text.length() && Operators.isIdentifierPart(text.charAt(end))) {
          end++;
        }
        flush(segments, other);
        String word = text.substring(position, end);
        segments.add(new Segment(word, Operators.keyword(word)));
        position = end;
        continue;
      }
      other.append(ch);
      position++;
    }
    flush(segments, other);
    return segments.build();
  }

  private static void flush(ImmutableList.Builder<Segment> segments, StringBuilder other) {
    if (other.length() > 0) {
      segments.add(new Segment(other.toString(), null));
      other.setLength(0);
    }
  }

  private Justifications() {}
}
