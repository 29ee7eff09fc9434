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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.txt2tex.options.Txt2texOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MainTest {

  @Rule public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  private Path source(String name, String text) throws IOException {
    Path path = temporaryFolder.newFile(name).toPath();
    MoreFiles.asCharSink(path, UTF_8).write(text);
    return path;
  }

  @Test
  public void tree() throws IOException {
    Path src = source("good.txt", "p land q");
    Path output = temporaryFolder.getRoot().toPath().resolve("out.txt");

    boolean ok = Main.compile(new String[] {src.toString(), "--output", output.toString()});

    assertThat(ok).isTrue();
    assertThat(MoreFiles.asCharSource(output, UTF_8).read()).isEqualTo("(p land q)\n");
  }

  @Test
  public void severalSources() throws IOException {
    Path a = source("a.txt", "given A");
    Path b = source("b.txt", "x = 1");
    Path output = temporaryFolder.getRoot().toPath().resolve("out.txt");

    boolean ok =
        Main.compile(
            Txt2texOptions.builder()
                .addSources(ImmutableList.of(a.toString(), b.toString()))
                .setOutput(output.toString())
                .build());

    assertThat(ok).isTrue();
    assertThat(MoreFiles.asCharSource(output, UTF_8).read()).isEqualTo("given A\n(x = 1)\n");
  }

  @Test
  public void tokens() throws IOException {
    Path src = source("good.txt", "p land q");
    Path output = temporaryFolder.getRoot().toPath().resolve("out.txt");

    boolean ok =
        Main.compile(
            new String[] {"--tokens", "--sources", src.toString(), "--output", output.toString()});

    assertThat(ok).isTrue();
    assertThat(MoreFiles.asCharSource(output, UTF_8).read())
        .isEqualTo("1:1 IDENTIFIER(p)\n1:3 AND\n1:8 IDENTIFIER(q)\n\n");
  }

  @Test
  public void syntaxErrorWritesNothing() throws IOException {
    Path good = source("good.txt", "p land q");
    Path bad = source("bad.txt", "(p land q");
    Path output = temporaryFolder.getRoot().toPath().resolve("out.txt");

    boolean ok =
        Main.compile(new String[] {good.toString(), bad.toString(), "--output", output.toString()});

    assertThat(ok).isFalse();
    assertThat(Files.exists(output)).isFalse();
  }

  @Test
  public void help() throws IOException {
    try {
      Main.compile(new String[] {"--help"});
      fail();
    } catch (UsageException expected) {
      assertThat(expected).hasMessageThat().contains("Usage: txt2tex");
    }
  }

  @Test
  public void noSources() throws IOException {
    try {
      Main.compile(new String[] {"--tokens"});
      fail();
    } catch (UsageException expected) {
      assertThat(expected).hasMessageThat().contains("no sources were provided");
    }
  }
}
