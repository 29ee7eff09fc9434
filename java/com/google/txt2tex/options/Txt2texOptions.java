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

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Optional;

/**
 * Command line options.
 *
 * @param sources Paths to the txt2tex source files to parse.
 * @param output The file to write the parse results to; standard output if absent.
 * @param tokens Print the token stream instead of the syntax tree.
 * @param help Print usage information.
 */
public record Txt2texOptions(
    ImmutableList<String> sources, Optional<String> output, boolean tokens, boolean help) {
  public Txt2texOptions {
    requireNonNull(sources, "sources");
    requireNonNull(output, "output");
  }

  public static Builder builder() {
    return new AutoBuilder_Txt2texOptions_Builder().setTokens(false).setHelp(false);
  }

  /** A {@link Builder} for {@link Txt2texOptions}. */
  @AutoBuilder
  public abstract static class Builder {
    abstract ImmutableList.Builder<String> sourcesBuilder();

    @CanIgnoreReturnValue
    public Builder addSources(Iterable<String> sources) {
      sourcesBuilder().addAll(sources);
      return this;
    }

    public abstract Builder setOutput(String output);

    public abstract Builder setTokens(boolean tokens);

    public abstract Builder setHelp(boolean help);

    public abstract Txt2texOptions build();
  }
}
