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

import com.google.txt2tex.diag.Txt2texError;

/** A syntax error, reported at the offending token. */
public class ParserError extends Txt2texError {

  private final Token token;

  public ParserError(ErrorKind kind, Token token, Object... args) {
    super(kind, token.line(), token.column(), args);
    this.token = token;
  }

  /** The token at which parsing failed. */
  public Token token() {
    return token;
  }
}
