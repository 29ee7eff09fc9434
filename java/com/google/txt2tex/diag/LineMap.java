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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableRangeMap;
import com.google.common.collect.Range;

/**
 * Converts source positions to line and column information, for token positions and diagnostic
 * formatting.
 *
 * <p>Positions range over {@code [0, source.length()]}, the end of input is a valid position and
 * belongs to the last line.
 */
public class LineMap {

  private final String source;
  private final ImmutableRangeMap<Integer, Integer> lines;
  private final ImmutableList<Range<Integer>> ranges;

  private LineMap(
      String source,
      ImmutableRangeMap<Integer, Integer> lines,
      ImmutableList<Range<Integer>> ranges) {
    this.source = source;
    this.lines = lines;
    this.ranges = ranges;
  }

  public static LineMap create(String source) {
    int last = 0;
    int line = 1;
    ImmutableRangeMap.Builder<Integer, Integer> builder = ImmutableRangeMap.builder();
    ImmutableList.Builder<Range<Integer>> ranges = ImmutableList.builder();
    for (int idx = 0; idx < source.length(); idx++) {
      char ch = source.charAt(idx);
      switch (ch) {
        case '\r':
          if (idx + 1 < source.length() && source.charAt(idx + 1) == '\n') {
            idx++;
          }
        // falls through
        case '\n':
          Range<Integer> range = Range.closedOpen(last, idx + 1);
          builder.put(range, line++);
          ranges.add(range);
          last = idx + 1;
          break;
        default:
          break;
      }
    }
    // the final line also owns the end-of-input position
    Range<Integer> range = Range.closedOpen(last, source.length() + 1);
    builder.put(range, line);
    ranges.add(range);
    return new LineMap(source, builder.build(), ranges.build());
  }

  /** The zero-indexed column number of the given source position. */
  public int column(int position) {
    checkPosition(position);
    // requireNonNull is safe because `lines` covers the whole file length.
    return position - requireNonNull(lines.getEntry(position)).getKey().lowerEndpoint();
  }

  /** The one-indexed line number of the given source position. */
  public int lineNumber(int position) {
    checkPosition(position);
    return requireNonNull(lines.get(position));
  }

  /** The line containing the given source position, including its line terminator. */
  public String line(int position) {
    checkPosition(position);
    Range<Integer> range = requireNonNull(lines.getEntry(position)).getKey();
    return text(range);
  }

  /** The text of the given one-indexed line, including its line terminator. */
  public String lineText(int lineNumber) {
    checkArgument(0 < lineNumber && lineNumber <= ranges.size(), "%s", lineNumber);
    return text(ranges.get(lineNumber - 1));
  }

  /** The number of lines in the source. */
  public int lineCount() {
    return ranges.size();
  }

  private String text(Range<Integer> range) {
    return source.substring(
        range.lowerEndpoint(), Math.min(range.upperEndpoint(), source.length()));
  }

  private void checkPosition(int position) {
    checkArgument(0 <= position && position <= source.length(), "%s", position);
  }
}
