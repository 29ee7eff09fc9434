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
package com.google.txt2tex.options;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class Txt2texOptionsParserTest {

  @Rule public final TemporaryFolder tmpFolder = new TemporaryFolder();

  @Test
  public void exhaustiveArgs() throws Exception {
    String[] lines = {
      "--sources", "a.txt", "b.txt", "--output", "out.txt", "--tokens", "--help",
    };

    Txt2texOptions options = Txt2texOptionsParser.parse(Arrays.asList(lines));

    assertThat(options.sources()).containsExactly("a.txt", "b.txt").inOrder();
    assertThat(options.output()).hasValue("out.txt");
    assertThat(options.tokens()).isTrue();
    assertThat(options.help()).isTrue();
  }

  @Test
  public void defaults() throws Exception {
    Txt2texOptions options = Txt2texOptions.builder().build();
    assertThat(options.sources()).isEmpty();
    assertThat(options.output()).isEmpty();
    assertThat(options.tokens()).isFalse();
    assertThat(options.help()).isFalse();
  }

  @Test
  public void bareSources() throws Exception {
    Txt2texOptions options =
        Txt2texOptionsParser.parse(
            ImmutableList.of("a.txt", "--sources", "b.txt", "--tokens", "c.txt"));
    assertThat(options.sources()).containsExactly("a.txt", "b.txt", "c.txt").inOrder();
  }

  @Test
  public void paramsFile() throws Exception {
    Path params = tmpFolder.newFile("params.txt").toPath();
    Files.write(
        params, ImmutableList.of("--sources a.txt", "b.txt", "--tokens"), StandardCharsets.UTF_8);

    Txt2texOptions options =
        Txt2texOptionsParser.parse(
            ImmutableList.of("@" + params.toAbsolutePath(), "--output", "out.txt"));

    assertThat(options.sources()).containsExactly("a.txt", "b.txt").inOrder();
    assertThat(options.tokens()).isTrue();
    assertThat(options.output()).hasValue("out.txt");
  }

  @Test
  public void escapedAt() throws Exception {
    Txt2texOptions options = Txt2texOptionsParser.parse(ImmutableList.of("@@notes.txt"));
    assertThat(options.sources()).containsExactly("@notes.txt");
  }

  @Test
  public void paramsFileExists() throws Exception {
    try {
      Txt2texOptionsParser.parse(ImmutableList.of("@/NOSUCH"));
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().contains("params file does not exist");
    }
  }

  @Test
  public void emptyParamsFile() throws Exception {
    Path params = tmpFolder.newFile("empty.txt").toPath();
    try {
      Txt2texOptionsParser.parse(ImmutableList.of("@" + params));
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().contains("empty params file");
    }
  }

  @Test
  public void unknownOption() throws Exception {
    try {
      Txt2texOptionsParser.parse(ImmutableList.of("--latex", "a.txt"));
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().isEqualTo("unknown option: --latex");
    }
  }

  @Test
  public void missingOutput() throws Exception {
    try {
      Txt2texOptionsParser.parse(ImmutableList.of("a.txt", "--output"));
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().isEqualTo("missing required argument for: --output");
    }
  }
}
