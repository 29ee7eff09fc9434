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

/**
 * A lexed token.
 *
 * @param kind the token kind
 * @param text the source text of the token, or its payload for text blocks and titles
 * @param line the one-indexed line of the token start
 * @param column the one-indexed column of the token start
 */
public record Token(TokenKind kind, String text, int line, int column) {

  public Token {
    requireNonNull(kind);
    requireNonNull(text);
  }

  /** Returns true if this token has the given kind. */
  public boolean is(TokenKind kind) {
    return this.kind == kind;
  }

  /** The column just past the end of this token's text. */
  int endColumn() {
    return column + text.length();
  }

  @Override
  public String toString() {
    if (kind.carriesText()) {
      return String.format("%s(%s)", kind.name(), text);
    }
    return kind.name();
  }
}
