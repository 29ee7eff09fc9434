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

package com.google.txt2tex.diag;

import static com.google.common.base.MoreObjects.firstNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/** Renders {@link Txt2texError}s against their source, with a caret under the error column. */
public final class DiagnosticFormatter {

  /**
   * Formats a diagnostic.
   *
   * <pre>{@code
   * path:3: error: Expected 'end' to close schema block
   *   x : N
   *        ^
   * hint: Did you forget 'end' before starting a new block?
   * }</pre>
   *
   * @param source the source the error was reported against
   * @param error the error
   */
  public static String format(SourceFile source, Txt2texError error) {
    String path = firstNonNull(source.path(), "<>");
    LineMap lineMap = LineMap.create(source.source());
    int lineNumber = Math.min(error.line(), lineMap.lineCount());

    StringBuilder sb = new StringBuilder(path).append(":");
    sb.append(error.line()).append(": error: ");
    sb.append(error.message().trim()).append(System.lineSeparator());
    sb.append(CharMatcher.breakingWhitespace().trimTrailingFrom(lineMap.lineText(lineNumber)))
        .append(System.lineSeparator());
    sb.append(Strings.repeat(" ", error.column() - 1)).append('^');
    String hint = error.kind().hint();
    if (hint != null) {
      sb.append(System.lineSeparator()).append("hint: ").append(hint);
    }
    return sb.toString();
  }

  private DiagnosticFormatter() {}
}
