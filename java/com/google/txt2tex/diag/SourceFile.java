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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * A txt2tex source file.
 *
 * @param path the path of the file, or {@code null} for in-memory input
 * @param source the full text of the file
 */
public record SourceFile(@Nullable String path, String source) {

  public SourceFile {
    requireNonNull(source);
  }
}
