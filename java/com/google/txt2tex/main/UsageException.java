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

package com.google.txt2tex.main;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import org.jspecify.annotations.Nullable;

/** A command line usage error. */
class UsageException extends RuntimeException {

  private static final long serialVersionUID = 0;

  private static final String[] USAGE = {
    "",
    "Usage: txt2tex [options] <sources> [@argfile]",
    "",
    "Options:",
    "  --sources",
    "    The txt2tex files to parse.",
    "  --output",
    "    The file to write results to. Defaults to standard output.",
    "  --tokens",
    "    Print the tokens of each file instead of its syntax tree.",
    "  --help",
    "    Print this usage statement.",
    "  @<filename>",
    "    Read options and filenames from file.",
    "",
  };

  UsageException() {
    super(buildMessage(null));
  }

  UsageException(String message) {
    super(buildMessage(checkNotNull(message)));
  }

  private static String buildMessage(@Nullable String message) {
    StringBuilder builder = new StringBuilder();
    if (message != null) {
      builder.append(message).append('\n');
    }
    Joiner.on('\n').appendTo(builder, USAGE);
    return builder.toString();
  }
}
