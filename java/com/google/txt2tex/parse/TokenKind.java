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

import org.jspecify.annotations.Nullable;

/**
 * txt2tex token kinds.
 *
 * <p>Kinds with a fixed canonical spelling record it; kinds without one (identifiers, numbers,
 * text payloads) carry their text on the {@link Token}.
 */
public enum TokenKind {
  // values
  IDENTIFIER,
  NUMBER,
  TEXT,
  PURETEXT,
  LATEX,
  TITLE,

  // layout
  NEWLINE("\\n"),
  INDENT,
  CONTINUATION("\\"),
  EOF(""),

  // document structure
  SECTION_MARKER("==="),
  SOLUTION_MARKER("**"),
  PART_LABEL,
  PROOF("PROOF:"),
  EQUIV("EQUIV:"),
  ARGUE("ARGUE:"),
  INFRULE("INFRULE:"),
  TRUTH_TABLE("TRUTH TABLE:"),
  PAGEBREAK("PAGEBREAK:"),
  CONTENTS,
  PARTS,
  RULE_SEPARATOR("---"),

  // Z paragraphs
  GIVEN("given"),
  AXDEF("axdef"),
  SCHEMA("schema"),
  GENDEF("gendef"),
  ZED("zed"),
  SYNTAX("syntax"),
  WHERE("where"),
  END("end"),
  FREE_TYPE("::="),
  ABBREV("=="),

  // conditionals
  IF("if"),
  THEN("then"),
  ELSE("else"),
  OTHERWISE("otherwise"),

  // logic
  AND("land"),
  OR("lor"),
  NOT("lnot"),
  IMPLIES("=>"),
  IFF("<=>"),

  // quantifiers
  FORALL("forall"),
  EXISTS("exists"),
  EXISTS1("exists1"),
  MU("mu"),
  LAMBDA("lambda"),

  // sets
  IN("elem"),
  NOTIN("notin"),
  SUBSET("subset"),
  SUBSETEQ("subseteq"),
  PSUBSET("psubset"),
  UNION("union"),
  INTERSECT("intersect"),
  SETMINUS("\\"),
  HASH("#"),
  CROSS("cross"),
  POWER("P"),
  POWER1("P1"),
  FINSET("F"),
  FINSET1("F1"),
  BIGCUP("bigcup"),
  BIGCAP("bigcap"),

  // relations
  MAPLET("|->"),
  RELATION("<->"),
  DRES("<|"),
  RRES("|>"),
  NDRES("<<|"),
  NRRES("|>>"),
  COMP("comp"),
  CIRC("o9"),
  SEMICOLON(";"),
  TILDE("~"),
  DOM("dom"),
  RAN("ran"),
  INV("inv"),
  ID("id"),
  LIMG("(|"),
  RIMG("|)"),
  OVERRIDE("++"),

  // functions
  TFUN("->"),
  PFUN("+->"),
  TINJ(">->"),
  PINJ(">+>"),
  TSURJ("-->>"),
  PSURJ("+->>"),
  BIJECTION(">->>"),
  FINFUN("77->"),
  PBIJECTION(">7->"),

  // sequences and bags
  LANGLE("<"),
  RANGLE(">"),
  CAT("^"),
  CARET("^"),
  FILTER("filter"),
  BAG_UNION("bag_union"),
  SEQ("seq"),
  SEQ1("seq1"),
  ISEQ("iseq"),
  BAG("bag"),

  // arithmetic and comparison
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  DIV("div"),
  MOD("mod"),
  EQUALS("="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  LESS_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_EQUAL(">="),

  // punctuation
  LPAREN("("),
  RPAREN(")"),
  LBRACKET("["),
  RBRACKET("]"),
  LBRACE("{"),
  RBRACE("}"),
  COMMA(","),
  COLON(":"),
  DOUBLE_COLON("::"),
  PIPE("|"),
  PERIOD("."),
  RANGE(".."),
  ELLIPSIS("...");

  private final @Nullable String spelling;

  TokenKind() {
    this(null);
  }

  TokenKind(@Nullable String spelling) {
    this.spelling = spelling;
  }

  /** The canonical spelling of this kind, or {@code null} if tokens of this kind carry text. */
  public @Nullable String spelling() {
    return spelling;
  }

  /** Returns true if tokens of this kind carry source text that is not implied by the kind. */
  public boolean carriesText() {
    return spelling == null;
  }
}
