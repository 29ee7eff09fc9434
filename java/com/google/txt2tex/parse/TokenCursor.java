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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import java.util.List;

/**
 * A position in a token list, shared by the parsers of one document.
 *
 * <p>Line continuations are never visible. Inside brackets (see {@link #enter}) newlines and
 * indentation are not visible either.
 */
final class TokenCursor {

  private final ImmutableList<Token> tokens;
  private int index;
  private int nesting;

  /** Whether a line break was skipped between the last consumed token and the current one. */
  private boolean lineBreak;

  TokenCursor(List<Token> tokens) {
    checkArgument(!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenKind.EOF));
    this.tokens = ImmutableList.copyOf(tokens);
    skipHidden();
  }

  /** The current token. */
  Token token() {
    return tokens.get(index);
  }

  TokenKind kind() {
    return token().kind();
  }

  boolean is(TokenKind kind) {
    return token().is(kind);
  }

  /**
   * Returns the token {@code n} raw positions after the current one, without skipping newlines.
   * Positions past the end return the final EOF.
   */
  Token peek(int n) {
    return tokens.get(Math.min(index + n, tokens.size() - 1));
  }

  /** Returns the first visible token after the current one. */
  Token lookahead() {
    int i = index + 1;
    while (i < tokens.size() - 1 && isHidden(tokens.get(i).kind())) {
      i++;
    }
    return tokens.get(Math.min(i, tokens.size() - 1));
  }

  /** The most recently consumed token. */
  Token previous() {
    checkState(index > 0);
    int i = index - 1;
    while (i > 0 && isHidden(tokens.get(i).kind())) {
      i--;
    }
    return tokens.get(i);
  }

  /** Consumes the current token and returns it. */
  @CanIgnoreReturnValue
  Token next() {
    Token token = token();
    if (!token.is(TokenKind.EOF)) {
      index++;
    }
    lineBreak = false;
    skipHidden();
    return token;
  }

  /** Consumes the current token if it has the given kind. */
  boolean maybe(TokenKind kind) {
    if (is(kind)) {
      next();
      return true;
    }
    return false;
  }

  /** Consumes a token of the given kind, or reports {@code kind} at the current token. */
  @CanIgnoreReturnValue
  Token eat(TokenKind expected, ErrorKind kind, Object... args) {
    if (!is(expected)) {
      throw error(kind, args);
    }
    return next();
  }

  /** Starts a bracketed region, in which newlines are insignificant. */
  void enter() {
    nesting++;
    skipHidden();
  }

  /** Ends a bracketed region. */
  void exit() {
    checkState(nesting > 0);
    nesting--;
  }

  boolean nested() {
    return nesting > 0;
  }

  /** Returns the current nesting depth of brackets. */
  int nesting() {
    return nesting;
  }

  /**
   * Returns true if a line break separated the previously consumed token from the current one,
   * either as a line continuation or inside brackets.
   */
  boolean lineBreakBefore() {
    return lineBreak;
  }

  /**
   * Skips newlines and indentation. Returns true if there was a line break before the current
   * token, including a line continuation.
   */
  @CanIgnoreReturnValue
  boolean skipLineBreaks() {
    boolean skipped = lineBreak;
    while (is(TokenKind.NEWLINE) || is(TokenKind.INDENT)) {
      skipped |= is(TokenKind.NEWLINE);
      index++;
      skipHidden();
    }
    lineBreak = skipped;
    return skipped;
  }

  /**
   * Skips line breaks if the first token after them has the given kind. Returns true if a line
   * break was skipped.
   */
  boolean skipLineBreaksBefore(TokenKind kind) {
    if (is(kind)) {
      return lineBreak;
    }
    int i = index;
    while (tokens.get(i).is(TokenKind.NEWLINE)
        || tokens.get(i).is(TokenKind.INDENT)
        || tokens.get(i).is(TokenKind.CONTINUATION)) {
      i++;
    }
    if (i == index || !tokens.get(i).is(kind)) {
      return false;
    }
    index = i;
    lineBreak = true;
    return true;
  }

  /** Returns true at a newline or at the end of input. */
  boolean atLineEnd() {
    return is(TokenKind.NEWLINE) || is(TokenKind.EOF);
  }

  /** Returns true at a newline that is followed by an empty line, or at the end of input. */
  boolean atBlankLine() {
    if (is(TokenKind.EOF)) {
      return true;
    }
    if (!is(TokenKind.NEWLINE)) {
      return false;
    }
    int i = index + 1;
    while (tokens.get(i).is(TokenKind.INDENT)) {
      i++;
    }
    return tokens.get(i).is(TokenKind.NEWLINE) || tokens.get(i).is(TokenKind.EOF);
  }

  /** Skips newlines and indentation between document items. */
  void skipBlankLines() {
    while (is(TokenKind.NEWLINE) || is(TokenKind.INDENT)) {
      index++;
      skipHidden();
    }
    lineBreak = false;
  }

  int mark() {
    return index;
  }

  void reset(int mark) {
    index = mark;
    lineBreak = false;
  }

  @CheckReturnValue
  ParserError error(ErrorKind kind, Object... args) {
    return new ParserError(kind, token(), args);
  }

  /** Describes a token for use in a diagnostic. */
  static String describe(Token token) {
    return switch (token.kind()) {
      case EOF -> "end of input";
      case NEWLINE -> "end of line";
      default -> "'" + token.text() + "'";
    };
  }

  private void skipHidden() {
    while (true) {
      TokenKind kind = tokens.get(index).kind();
      if (kind == TokenKind.CONTINUATION) {
        lineBreak = true;
      } else if (nesting > 0 && kind == TokenKind.NEWLINE) {
        lineBreak = true;
      } else if (!(nesting > 0 && kind == TokenKind.INDENT)) {
        return;
      }
      index++;
    }
  }

  private boolean isHidden(TokenKind kind) {
    return kind == TokenKind.CONTINUATION
        || (nesting > 0 && (kind == TokenKind.NEWLINE || kind == TokenKind.INDENT));
  }
}
