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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.txt2tex.parse.Justifications.Segment;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class JustificationsTest {

  private static String join(String text) {
    List<Token> tokens = Lexer.tokenize(text);
    return Justifications.join(tokens.subList(0, tokens.size() - 1));
  }

  private static String concat(List<Segment> segments) {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      sb.append(segment.text());
    }
    return sb.toString();
  }

  @Test
  public void longestOperatorWins() {
    ImmutableList<Segment> segments = Justifications.segments("x |-> y");
    assertThat(segments)
        .containsExactly(
            new Segment("x", null),
            new Segment(" ", null),
            new Segment("|->", TokenKind.MAPLET),
            new Segment(" ", null),
            new Segment("y", null))
        .inOrder();
  }

  @Test
  public void keywords() {
    ImmutableList<Segment> segments = Justifications.segments("a land b");
    assertThat(segments.get(2)).isEqualTo(new Segment("land", TokenKind.AND));
    assertThat(segments.get(2).isOperator()).isTrue();
    assertThat(segments.get(0).isOperator()).isFalse();
  }

  @Test
  public void multiCharacterSymbols() {
    assertThat(Justifications.segments("R <<| S").get(2).text()).isEqualTo("<<|");
    assertThat(Justifications.segments("A +->> B").get(2).text()).isEqualTo("+->>");
  }

  @Test
  public void segmentsCoverInput() {
    for (String text :
        ImmutableList.of("def of f, g", "x |-> y", "=> intro", "  spaced  out  ", "R <<| S")) {
      assertThat(concat(Justifications.segments(text))).isEqualTo(text);
    }
  }

  @Test
  public void joinNormalizesCommasAndParentheses() {
    assertThat(join("f(x,y)")).isEqualTo("f(x, y)");
    assertThat(join("f ( x , y )")).isEqualTo("f (x, y)");
    assertThat(join("and  elim")).isEqualTo("and  elim");
  }
}
