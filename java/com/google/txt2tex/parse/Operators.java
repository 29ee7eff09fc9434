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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Comparator.comparingInt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The operator spellings of txt2tex, shared by the {@link Lexer} and by {@link Justifications}.
 *
 * <p>Symbols are matched longest first, so {@code >->>} is never split into {@code >->} and
 * {@code >}, and {@code |->} is never split into {@code |} and {@code ->}.
 */
public final class Operators {

  /** Symbolic spellings, including Unicode aliases. */
  static final ImmutableMap<String, TokenKind> SYMBOLS =
      ImmutableMap.<String, TokenKind>builder()
          // logic
          .put("<=>", TokenKind.IFF)
          .put("⇔", TokenKind.IFF)
          .put("=>", TokenKind.IMPLIES)
          .put("⇒", TokenKind.IMPLIES)
          .put("∧", TokenKind.AND)
          .put("∨", TokenKind.OR)
          .put("¬", TokenKind.NOT)
          .put("∀", TokenKind.FORALL)
          .put("∃", TokenKind.EXISTS)
          .put("μ", TokenKind.MU)
          .put("λ", TokenKind.LAMBDA)
          // sets
          .put("∈", TokenKind.IN)
          .put("∉", TokenKind.NOTIN)
          .put("/in", TokenKind.NOTIN)
          .put("⊆", TokenKind.SUBSETEQ)
          .put("⊂", TokenKind.PSUBSET)
          .put("∪", TokenKind.UNION)
          .put("∩", TokenKind.INTERSECT)
          .put("#", TokenKind.HASH)
          .put("×", TokenKind.CROSS)
          .put("ℙ", TokenKind.POWER)
          // relations
          .put("|->", TokenKind.MAPLET)
          .put("↦", TokenKind.MAPLET)
          .put("<->", TokenKind.RELATION)
          .put("↔", TokenKind.RELATION)
          .put("<<|", TokenKind.NDRES)
          .put("⩤", TokenKind.NDRES)
          .put("|>>", TokenKind.NRRES)
          .put("⩥", TokenKind.NRRES)
          .put("<|", TokenKind.DRES)
          .put("◁", TokenKind.DRES)
          .put("|>", TokenKind.RRES)
          .put("▷", TokenKind.RRES)
          .put("∘", TokenKind.CIRC)
          .put(";", TokenKind.SEMICOLON)
          .put("~", TokenKind.TILDE)
          .put("(|", TokenKind.LIMG)
          .put("|)", TokenKind.RIMG)
          .put("++", TokenKind.OVERRIDE)
          .put("⊕", TokenKind.OVERRIDE)
          // functions
          .put("->", TokenKind.TFUN)
          .put("→", TokenKind.TFUN)
          .put("+->", TokenKind.PFUN)
          .put("⇸", TokenKind.PFUN)
          .put(">->", TokenKind.TINJ)
          .put("↣", TokenKind.TINJ)
          .put(">+>", TokenKind.PINJ)
          .put("-|>", TokenKind.PINJ)
          .put("⤔", TokenKind.PINJ)
          .put("-->>", TokenKind.TSURJ)
          .put("↠", TokenKind.TSURJ)
          .put("+->>", TokenKind.PSURJ)
          .put("⤀", TokenKind.PSURJ)
          .put(">->>", TokenKind.BIJECTION)
          .put("⤖", TokenKind.BIJECTION)
          .put("77->", TokenKind.FINFUN)
          .put(">7->", TokenKind.PBIJECTION)
          // sequences and bags
          .put("⟨", TokenKind.LANGLE)
          .put("⟩", TokenKind.RANGLE)
          .put("⌢", TokenKind.CAT)
          .put("↾", TokenKind.FILTER)
          .put("⊎", TokenKind.BAG_UNION)
          // arithmetic and comparison
          .put("+", TokenKind.PLUS)
          .put("-", TokenKind.MINUS)
          .put("*", TokenKind.STAR)
          .put("=", TokenKind.EQUALS)
          .put("!=", TokenKind.NOT_EQUAL)
          .put("/=", TokenKind.NOT_EQUAL)
          .put("≠", TokenKind.NOT_EQUAL)
          .put("<", TokenKind.LESS_THAN)
          .put("<=", TokenKind.LESS_EQUAL)
          .put("≤", TokenKind.LESS_EQUAL)
          .put(">", TokenKind.GREATER_THAN)
          .put(">=", TokenKind.GREATER_EQUAL)
          .put("≥", TokenKind.GREATER_EQUAL)
          // Z and punctuation
          .put("::=", TokenKind.FREE_TYPE)
          .put("==", TokenKind.ABBREV)
          .put("::", TokenKind.DOUBLE_COLON)
          .put(":", TokenKind.COLON)
          .put(",", TokenKind.COMMA)
          .put("|", TokenKind.PIPE)
          .put("(", TokenKind.LPAREN)
          .put(")", TokenKind.RPAREN)
          .put("[", TokenKind.LBRACKET)
          .put("]", TokenKind.RBRACKET)
          .put("{", TokenKind.LBRACE)
          .put("}", TokenKind.RBRACE)
          .put("...", TokenKind.ELLIPSIS)
          .put("…", TokenKind.ELLIPSIS)
          .put("..", TokenKind.RANGE)
          .put(".", TokenKind.PERIOD)
          .buildOrThrow();

  /** Word spellings of operators and keywords. */
  static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("land", TokenKind.AND)
          .put("and", TokenKind.AND)
          .put("lor", TokenKind.OR)
          .put("or", TokenKind.OR)
          .put("lnot", TokenKind.NOT)
          .put("not", TokenKind.NOT)
          .put("implies", TokenKind.IMPLIES)
          .put("iff", TokenKind.IFF)
          .put("forall", TokenKind.FORALL)
          .put("exists", TokenKind.EXISTS)
          .put("exists1", TokenKind.EXISTS1)
          .put("mu", TokenKind.MU)
          .put("lambda", TokenKind.LAMBDA)
          .put("elem", TokenKind.IN)
          .put("in", TokenKind.IN)
          .put("notin", TokenKind.NOTIN)
          .put("subset", TokenKind.SUBSET)
          .put("subseteq", TokenKind.SUBSETEQ)
          .put("psubset", TokenKind.PSUBSET)
          .put("union", TokenKind.UNION)
          .put("intersect", TokenKind.INTERSECT)
          .put("cross", TokenKind.CROSS)
          .put("comp", TokenKind.COMP)
          .put("o9", TokenKind.CIRC)
          .put("dom", TokenKind.DOM)
          .put("ran", TokenKind.RAN)
          .put("inv", TokenKind.INV)
          .put("id", TokenKind.ID)
          .put("bigcup", TokenKind.BIGCUP)
          .put("bigcap", TokenKind.BIGCAP)
          .put("filter", TokenKind.FILTER)
          .put("bag_union", TokenKind.BAG_UNION)
          .put("div", TokenKind.DIV)
          .put("mod", TokenKind.MOD)
          .put("seq", TokenKind.SEQ)
          .put("seq1", TokenKind.SEQ1)
          .put("iseq", TokenKind.ISEQ)
          .put("bag", TokenKind.BAG)
          .put("given", TokenKind.GIVEN)
          .put("axdef", TokenKind.AXDEF)
          .put("schema", TokenKind.SCHEMA)
          .put("gendef", TokenKind.GENDEF)
          .put("zed", TokenKind.ZED)
          .put("syntax", TokenKind.SYNTAX)
          .put("where", TokenKind.WHERE)
          .put("end", TokenKind.END)
          .put("if", TokenKind.IF)
          .put("then", TokenKind.THEN)
          .put("else", TokenKind.ELSE)
          .put("otherwise", TokenKind.OTHERWISE)
          .buildOrThrow();

  /** Symbol spellings, longest first. */
  static final ImmutableList<String> LONGEST_FIRST =
      SYMBOLS.keySet().stream()
          .sorted(comparingInt(String::length).reversed())
          .collect(toImmutableList());

  /**
   * Returns the longest operator symbol that starts at {@code position} in {@code text}, or {@code
   * null}. Symbols ending in a letter (such as {@code /in}) only match at a word boundary.
   */
  static @Nullable String longestSymbol(String text, int position) {
    for (String symbol : LONGEST_FIRST) {
      if (!text.startsWith(symbol, position)) {
        continue;
      }
      int end = position + symbol.length();
      if (Character.isLetter(symbol.charAt(symbol.length() - 1))
          && end < text.length()
          && isIdentifierPart(text.charAt(end))) {
        continue;
      }
      return symbol;
    }
    return null;
  }

  /** Returns the kind of a keyword, or {@code null} if the word is an ordinary identifier. */
  static @Nullable TokenKind keyword(String word) {
    return KEYWORDS.get(word);
  }

  /** Returns true for words that spell an infix or postfix operator or a clause keyword. */
  static boolean isOperatorWord(String word) {
    TokenKind kind = KEYWORDS.get(word);
    if (kind == null) {
      return false;
    }
    return switch (kind) {
      case AND, OR, IMPLIES, IFF, IN, NOTIN, SUBSET, SUBSETEQ, PSUBSET, UNION, INTERSECT, CROSS,
              COMP, CIRC, FILTER, BAG_UNION, DIV, MOD, WHERE, END, IF, THEN, ELSE, OTHERWISE ->
          true;
      default -> false;
    };
  }

  static boolean isIdentifierStart(int ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  static boolean isIdentifierPart(int ch) {
    return isIdentifierStart(ch) || (ch >= '0' && ch <= '9');
  }

  private Operators() {}
}
