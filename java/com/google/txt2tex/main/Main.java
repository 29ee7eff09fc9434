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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.MoreFiles;
import com.google.txt2tex.diag.DiagnosticFormatter;
import com.google.txt2tex.diag.SourceFile;
import com.google.txt2tex.diag.Txt2texError;
import com.google.txt2tex.options.Txt2texOptions;
import com.google.txt2tex.options.Txt2texOptionsParser;
import com.google.txt2tex.parse.Lexer;
import com.google.txt2tex.parse.Parser;
import com.google.txt2tex.parse.Token;
import com.google.txt2tex.parse.TokenKind;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/** Main entry point for the txt2tex CLI. */
public class Main {

  public static void main(String[] args) throws IOException {
    boolean ok;
    try {
      ok = compile(args);
    } catch (UsageException | IllegalArgumentException e) {
      System.err.println(e.getMessage());
      ok = false;
    } catch (Throwable txt2texCrash) {
      txt2texCrash.printStackTrace();
      ok = false;
    }
    System.exit(ok ? 0 : 1);
  }

  public static boolean compile(String[] args) throws IOException {
    Txt2texOptions options = Txt2texOptionsParser.parse(Arrays.asList(args));
    return compile(options);
  }

  /**
   * Parses each source file, and writes its syntax tree or tokens. Diagnostics are reported to
   * standard error, and nothing is written if any file fails to parse.
   *
   * @return true if every file parsed
   */
  public static boolean compile(Txt2texOptions options) throws IOException {
    usage(options);

    StringBuilder output = new StringBuilder();
    boolean ok = true;
    for (String source : options.sources()) {
      Path path = Paths.get(source);
      String text = MoreFiles.asCharSource(path, UTF_8).read();
      try {
        output.append(options.tokens() ? tokens(text) : Parser.parse(text).toString());
        output.append('\n');
      } catch (Txt2texError e) {
        System.err.println(DiagnosticFormatter.format(new SourceFile(source, text), e));
        ok = false;
      }
    }
    if (!ok) {
      return false;
    }

    if (options.output().isPresent()) {
      MoreFiles.asCharSink(Paths.get(options.output().get()), UTF_8).write(output);
    } else {
      System.out.print(output);
      System.out.flush();
    }
    return true;
  }

  private static void usage(Txt2texOptions options) {
    if (options.help()) {
      throw new UsageException();
    }
    if (options.sources().isEmpty()) {
      throw new UsageException("no sources were provided");
    }
  }

  /** One token per line, up to but not including the end of input. */
  private static String tokens(String text) {
    StringBuilder sb = new StringBuilder();
    for (Token token : Lexer.tokenize(text)) {
      if (token.is(TokenKind.EOF)) {
        break;
      }
      sb.append(token.line()).append(':').append(token.column()).append(' ').append(token);
      sb.append('\n');
    }
    return sb.toString();
  }
}
