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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import com.google.txt2tex.tree.Tree;
import com.google.txt2tex.tree.Tree.Abbreviation;
import com.google.txt2tex.tree.Tree.AxDef;
import com.google.txt2tex.tree.Tree.Contents;
import com.google.txt2tex.tree.Tree.Declaration;
import com.google.txt2tex.tree.Tree.Document;
import com.google.txt2tex.tree.Tree.EquivChain;
import com.google.txt2tex.tree.Tree.EquivStep;
import com.google.txt2tex.tree.Tree.Expression;
import com.google.txt2tex.tree.Tree.FreeBranch;
import com.google.txt2tex.tree.Tree.FreeType;
import com.google.txt2tex.tree.Tree.GenDef;
import com.google.txt2tex.tree.Tree.GivenType;
import com.google.txt2tex.tree.Tree.InfruleBlock;
import com.google.txt2tex.tree.Tree.InfruleLine;
import com.google.txt2tex.tree.Tree.LatexBlock;
import com.google.txt2tex.tree.Tree.PageBreak;
import com.google.txt2tex.tree.Tree.Paragraph;
import com.google.txt2tex.tree.Tree.Part;
import com.google.txt2tex.tree.Tree.PartsFormat;
import com.google.txt2tex.tree.Tree.PureParagraph;
import com.google.txt2tex.tree.Tree.Schema;
import com.google.txt2tex.tree.Tree.Section;
import com.google.txt2tex.tree.Tree.Solution;
import com.google.txt2tex.tree.Tree.SyntaxBlock;
import com.google.txt2tex.tree.Tree.SyntaxDefinition;
import com.google.txt2tex.tree.Tree.TruthTable;
import com.google.txt2tex.tree.Tree.Zed;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A parser for txt2tex documents.
 *
 * <p>A document is a sequence of items: expressions, prose and LaTeX blocks, Z paragraphs, and
 * proof constructs. Expressions are handled by {@link ExpressionParser}, proof trees by {@link
 * ProofTreeParser}.
 */
public class Parser {

  private static final ImmutableSet<TokenKind> SECTION_END =
      ImmutableSet.of(TokenKind.SECTION_MARKER);
  private static final ImmutableSet<TokenKind> SOLUTION_END =
      ImmutableSet.of(TokenKind.SOLUTION_MARKER, TokenKind.SECTION_MARKER);
  private static final ImmutableSet<TokenKind> PART_END =
      ImmutableSet.of(TokenKind.PART_LABEL, TokenKind.SOLUTION_MARKER, TokenKind.SECTION_MARKER);
  private static final ImmutableSet<TokenKind> BLOCK_END = ImmutableSet.of(TokenKind.END);

  /**
   * Parses a document. A document with exactly one item is returned as that item, any other
   * document as a {@link Document}.
   */
  public static Tree parse(String source) {
    return parse(Lexer.tokenize(source));
  }

  /** Parses a tokenized document, see {@link #parse(String)}. */
  public static Tree parse(List<Token> tokens) {
    return single(parseDocument(tokens));
  }

  public static Document parseDocument(String source) {
    return parseDocument(Lexer.tokenize(source));
  }

  public static Document parseDocument(List<Token> tokens) {
    return new Parser(tokens).document();
  }

  /** Returns true for tokens that start a block and end any paragraph before them. */
  static boolean isStructural(TokenKind kind) {
    return switch (kind) {
      case SECTION_MARKER, SOLUTION_MARKER, PART_LABEL, TEXT, PURETEXT, LATEX, PROOF, EQUIV,
              ARGUE, INFRULE, TRUTH_TABLE, PAGEBREAK, CONTENTS, PARTS, GIVEN, AXDEF, SCHEMA,
              GENDEF, ZED, SYNTAX ->
          true;
      default -> false;
    };
  }

  private static Tree single(Document document) {
    return document.items().size() == 1 ? document.items().get(0) : document;
  }

  private final TokenCursor cursor;
  private final ExpressionParser expressions;

  private Parser(List<Token> tokens) {
    this.cursor = new TokenCursor(tokens);
    this.expressions = new ExpressionParser(cursor);
  }

  private Document document() {
    cursor.skipBlankLines();
    Token first = cursor.token();
    ImmutableList<Tree> items = items(ImmutableSet.of());
    if (!cursor.is(TokenKind.EOF)) {
      throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
    }
    return new Document(first.line(), first.column(), items);
  }

  /** Parses items up to the end of input or a token in {@code stop}. */
  private ImmutableList<Tree> items(Set<TokenKind> stop) {
    ImmutableList.Builder<Tree> items = ImmutableList.builder();
    while (true) {
      cursor.skipBlankLines();
      if (cursor.is(TokenKind.EOF) || stop.contains(cursor.kind())) {
        break;
      }
      items.add(item(stop));
    }
    return items.build();
  }

  private Tree item(Set<TokenKind> stop) {
    Token token = cursor.token();
    switch (token.kind()) {
      case SECTION_MARKER:
        return section(stop);
      case SOLUTION_MARKER:
        return solution(stop);
      case PART_LABEL:
        return part(stop);
      case TEXT:
        cursor.next();
        return endOfItem(new Paragraph(token.line(), token.column(), token.text()), stop);
      case PURETEXT:
        cursor.next();
        return endOfItem(new PureParagraph(token.line(), token.column(), token.text()), stop);
      case LATEX:
        cursor.next();
        return endOfItem(new LatexBlock(token.line(), token.column(), token.text()), stop);
      case PAGEBREAK:
        cursor.next();
        return endOfItem(new PageBreak(token.line(), token.column()), stop);
      case CONTENTS:
        cursor.next();
        return endOfItem(new Contents(token.line(), token.column(), token.text()), stop);
      case PARTS:
        cursor.next();
        return endOfItem(new PartsFormat(token.line(), token.column(), token.text()), stop);
      case GIVEN:
        return endOfItem(given(), stop);
      case AXDEF:
      case GENDEF:
      case SCHEMA:
        return endOfItem(paragraph(), stop);
      case ZED:
        return endOfItem(zed(), stop);
      case SYNTAX:
        return endOfItem(syntax(), stop);
      case TRUTH_TABLE:
        return truthTable();
      case EQUIV:
      case ARGUE:
        return chain();
      case PROOF:
        return new ProofTreeParser(cursor, expressions).proof();
      case INFRULE:
        return infrule(stop);
      case IDENTIFIER:
        switch (cursor.lookahead().kind()) {
          case FREE_TYPE:
            return endOfItem(freeType(), stop);
          case ABBREV:
            return endOfItem(abbreviation(), stop);
          default:
            break;
        }
        break;
      case LBRACKET:
        if (!cursor.peek(1).is(TokenKind.LBRACKET)) {
          return endOfItem(abbreviation(), stop);
        }
        break;
      default:
        break;
    }
    return endOfItem(expressions.expression(), stop);
  }

  /** Checks that an item is followed by the end of its line, or by a token in {@code stop}. */
  private <T extends Tree> T endOfItem(T item, Set<TokenKind> stop) {
    if (!cursor.atLineEnd() && !stop.contains(cursor.kind())) {
      throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
    }
    return item;
  }

  private void endOfLine() {
    if (!cursor.atLineEnd()) {
      throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
    }
  }

  /** Returns true at the start of a block, or at the end of input. */
  private boolean atBlockBoundary() {
    return cursor.is(TokenKind.EOF) || isStructural(cursor.kind());
  }

  private Section section(Set<TokenKind> stop) {
    Token marker = cursor.next();
    String title = title(TokenKind.SECTION_MARKER, ErrorKind.MISSING_SECTION_CLOSE);
    ImmutableList<Tree> items = items(Sets.union(stop, SECTION_END));
    return new Section(marker.line(), marker.column(), title, items);
  }

  private Solution solution(Set<TokenKind> stop) {
    Token marker = cursor.next();
    String title = title(TokenKind.SOLUTION_MARKER, ErrorKind.MISSING_SOLUTION_CLOSE);
    ImmutableList<Tree> items = items(Sets.union(stop, SOLUTION_END));
    return new Solution(marker.line(), marker.column(), title, items);
  }

  /** Reads a title and its closing marker; the opening marker has been consumed. */
  private String title(TokenKind marker, ErrorKind missingClose) {
    if (!cursor.is(TokenKind.TITLE)) {
      throw cursor.error(missingClose);
    }
    String title = cursor.next().text();
    cursor.eat(marker, missingClose);
    endOfLine();
    return title;
  }

  private Part part(Set<TokenKind> stop) {
    Token label = cursor.next();
    ImmutableList<Tree> items = items(Sets.union(stop, PART_END));
    return new Part(label.line(), label.column(), String.valueOf(label.text().charAt(1)), items);
  }

  private GivenType given() {
    Token given = cursor.next();
    if (cursor.atLineEnd()) {
      throw cursor.error(ErrorKind.EMPTY_GIVEN);
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    do {
      names.add(cursor.eat(TokenKind.IDENTIFIER, ErrorKind.EXPECTED_GIVEN_NAME).text());
    } while (cursor.maybe(TokenKind.COMMA));
    return new GivenType(given.line(), given.column(), names.build());
  }

  /** Parses {@code Name ::= branch | branch ...}. */
  private FreeType freeType() {
    Token name = cursor.next();
    cursor.eat(TokenKind.FREE_TYPE, ErrorKind.EXPECTED_TOKEN, "'::='");
    return new FreeType(name.line(), name.column(), name.text(), branches());
  }

  private ImmutableList<FreeBranch> branches() {
    if (cursor.atLineEnd()) {
      throw cursor.error(ErrorKind.EMPTY_FREE_TYPE);
    }
    ImmutableList.Builder<FreeBranch> branches = ImmutableList.builder();
    do {
      branches.add(branch());
    } while (cursor.maybe(TokenKind.PIPE)
        || (cursor.skipLineBreaksBefore(TokenKind.PIPE) && cursor.maybe(TokenKind.PIPE)));
    return branches.build();
  }

  /** A constructor: a name, optionally followed by {@code <parameters>}. */
  private FreeBranch branch() {
    Token name = cursor.eat(TokenKind.IDENTIFIER, ErrorKind.EXPECTED_BRANCH_NAME);
    Expression parameters = null;
    if (cursor.maybe(TokenKind.LANGLE)) {
      cursor.enter();
      parameters = expressions.expression();
      cursor.exit();
      cursor.eat(TokenKind.RANGLE, ErrorKind.UNCLOSED, "constructor parameters", "'>'");
    }
    return new FreeBranch(name.line(), name.column(), name.text(), parameters);
  }

  /** Parses {@code [X, Y] Name == expression}, where the generic parameters are optional. */
  private Abbreviation abbreviation() {
    Token start = cursor.token();
    ImmutableList<String> genericParams = genericParams();
    Token name = cursor.eat(TokenKind.IDENTIFIER, ErrorKind.EXPECTED_ABBREVIATION_NAME);
    cursor.eat(TokenKind.ABBREV, ErrorKind.EXPECTED_ABBREVIATION_DEFINITION);
    cursor.skipLineBreaks();
    Expression expression = expressions.expression();
    return new Abbreviation(
        start.line(), start.column(), name.text(), expression, genericParams);
  }

  /** Parses an optional generic parameter list {@code [X, Y]}. */
  private ImmutableList<String> genericParams() {
    if (!cursor.is(TokenKind.LBRACKET)) {
      return ImmutableList.of();
    }
    cursor.next();
    ImmutableList.Builder<String> params = ImmutableList.builder();
    do {
      Token param = cursor.token();
      if (!param.is(TokenKind.IDENTIFIER)) {
        throw cursor.error(ErrorKind.EXPECTED_IDENTIFIER, "in generic parameter list");
      }
      params.add(cursor.next().text());
    } while (cursor.maybe(TokenKind.COMMA));
    cursor.eat(TokenKind.RBRACKET, ErrorKind.UNCLOSED_GENERIC_PARAMETERS);
    return params.build();
  }

  /** Parses an {@code axdef}, {@code gendef} or {@code schema} block. */
  private Tree paragraph() {
    Token keyword = cursor.next();
    String block = keyword.kind().spelling();
    String name = null;
    if (keyword.is(TokenKind.SCHEMA)) {
      if (cursor.is(TokenKind.IDENTIFIER)) {
        name = cursor.next().text();
      } else if (!cursor.atLineEnd() && !cursor.is(TokenKind.LBRACKET)) {
        throw cursor.error(ErrorKind.EXPECTED_SCHEMA_NAME);
      }
    }
    ImmutableList<String> genericParams = genericParams();
    ImmutableList<Declaration> declarations = declarations();
    ImmutableList<ImmutableList<Expression>> predicates = ImmutableList.of();
    if (cursor.maybe(TokenKind.WHERE)) {
      predicates = predicates();
    }
    cursor.eat(TokenKind.END, ErrorKind.MISSING_END, block);
    return switch (keyword.kind()) {
      case AXDEF ->
          new AxDef(keyword.line(), keyword.column(), genericParams, declarations, predicates);
      case GENDEF ->
          new GenDef(keyword.line(), keyword.column(), genericParams, declarations, predicates);
      default ->
          new Schema(
              keyword.line(), keyword.column(), name, genericParams, declarations, predicates);
    };
  }

  /**
   * Parses declarations up to {@code where} or {@code end}. Declarations are separated by
   * newlines or semicolons, and {@code x, y : T} declares each name with the same type.
   */
  private ImmutableList<Declaration> declarations() {
    ImmutableList.Builder<Declaration> declarations = ImmutableList.builder();
    while (true) {
      cursor.skipBlankLines();
      if (cursor.is(TokenKind.WHERE) || cursor.is(TokenKind.END) || atBlockBoundary()) {
        break;
      }
      do {
        declaration(declarations);
      } while (cursor.maybe(TokenKind.SEMICOLON));
      if (!cursor.atLineEnd() && !cursor.is(TokenKind.WHERE) && !cursor.is(TokenKind.END)) {
        throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
      }
    }
    return declarations.build();
  }

  private void declaration(ImmutableList.Builder<Declaration> declarations) {
    List<Token> names = new ArrayList<>();
    do {
      if (!cursor.is(TokenKind.IDENTIFIER)) {
        throw cursor.error(ErrorKind.EXPECTED_IDENTIFIER, "in declaration");
      }
      names.add(cursor.next());
    } while (cursor.maybe(TokenKind.COMMA));
    cursor.eat(TokenKind.COLON, ErrorKind.EXPECTED_DECLARATION_COLON);
    Expression type = expressions.domain();
    for (Token name : names) {
      declarations.add(new Declaration(name.line(), name.column(), name.text(), type));
    }
  }

  /** Parses predicates up to {@code end}. Blank lines separate groups of predicates. */
  private ImmutableList<ImmutableList<Expression>> predicates() {
    ImmutableList.Builder<ImmutableList<Expression>> groups = ImmutableList.builder();
    List<Expression> group = new ArrayList<>();
    while (true) {
      if (cursor.atBlankLine() && !group.isEmpty()) {
        groups.add(ImmutableList.copyOf(group));
        group.clear();
      }
      cursor.skipBlankLines();
      if (cursor.is(TokenKind.END) || atBlockBoundary()) {
        break;
      }
      group.add(expressions.expression());
      if (!cursor.atLineEnd() && !cursor.is(TokenKind.END)) {
        throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
      }
    }
    if (!group.isEmpty()) {
      groups.add(ImmutableList.copyOf(group));
    }
    return groups.build();
  }

  /** Parses {@code zed ... end}. Several items in the block are wrapped in a document. */
  private Zed zed() {
    Token zed = cursor.next();
    cursor.skipBlankLines();
    Token first = cursor.token();
    ImmutableList<Tree> items = items(BLOCK_END);
    cursor.eat(TokenKind.END, ErrorKind.MISSING_END, "zed");
    Tree content =
        items.size() == 1 ? items.get(0) : new Document(first.line(), first.column(), items);
    return new Zed(zed.line(), zed.column(), content);
  }

  /** Parses {@code syntax ... end}. Blank lines separate groups of definitions. */
  private SyntaxBlock syntax() {
    Token syntax = cursor.next();
    ImmutableList.Builder<ImmutableList<SyntaxDefinition>> groups = ImmutableList.builder();
    List<SyntaxDefinition> group = new ArrayList<>();
    while (true) {
      if (cursor.atBlankLine() && !group.isEmpty()) {
        groups.add(ImmutableList.copyOf(group));
        group.clear();
      }
      cursor.skipBlankLines();
      if (cursor.is(TokenKind.END) || atBlockBoundary()) {
        break;
      }
      Token name =
          cursor.eat(TokenKind.IDENTIFIER, ErrorKind.EXPECTED_IDENTIFIER, "in syntax definition");
      cursor.eat(TokenKind.FREE_TYPE, ErrorKind.EXPECTED_TOKEN, "'::='");
      group.add(new SyntaxDefinition(name.line(), name.column(), name.text(), branches()));
      if (!cursor.atLineEnd() && !cursor.is(TokenKind.END)) {
        throw cursor.error(ErrorKind.TRAILING_TOKEN, TokenCursor.describe(cursor.token()));
      }
    }
    if (!group.isEmpty()) {
      groups.add(ImmutableList.copyOf(group));
    }
    cursor.eat(TokenKind.END, ErrorKind.MISSING_END, "syntax");
    return new SyntaxBlock(syntax.line(), syntax.column(), groups.build());
  }

  /**
   * Parses a truth table: a header row of {@code |}-separated expressions, then rows of {@code T}
   * and {@code F} values.
   */
  private TruthTable truthTable() {
    Token table = cursor.next();
    cursor.skipBlankLines();
    if (!cursor.is(TokenKind.IDENTIFIER)) {
      throw cursor.error(ErrorKind.MISSING_TRUTH_TABLE_HEADER);
    }
    ImmutableList.Builder<String> headers = ImmutableList.builder();
    for (List<Token> column : columns()) {
      if (column.isEmpty()) {
        throw cursor.error(ErrorKind.EMPTY_TRUTH_TABLE_HEADERS);
      }
      headers.add(Joiner.on(' ').join(Lists.transform(column, Token::text)));
    }
    ImmutableList.Builder<ImmutableList<String>> rows = ImmutableList.builder();
    while (cursor.is(TokenKind.NEWLINE) && isTruthValue(cursor.peek(1))) {
      cursor.next();
      ImmutableList.Builder<String> row = ImmutableList.builder();
      for (List<Token> cell : columns()) {
        row.add(truthValue(cell));
      }
      rows.add(row.build());
    }
    return new TruthTable(table.line(), table.column(), headers.build(), rows.build());
  }

  /** Splits the rest of the line at {@code |}. */
  private List<List<Token>> columns() {
    List<List<Token>> columns = new ArrayList<>();
    List<Token> column = new ArrayList<>();
    while (!cursor.atLineEnd()) {
      Token token = cursor.next();
      if (token.is(TokenKind.PIPE)) {
        columns.add(column);
        column = new ArrayList<>();
      } else {
        column.add(token);
      }
    }
    columns.add(column);
    return columns;
  }

  private String truthValue(List<Token> cell) {
    if (cell.size() != 1 || !isTruthValue(cell.get(0))) {
      Token token = cell.isEmpty() ? cursor.token() : cell.get(0);
      throw new ParserError(ErrorKind.INVALID_TRUTH_VALUE, token, TokenCursor.describe(token));
    }
    return Ascii.toUpperCase(cell.get(0).text());
  }

  /** {@code F} is also the finite set operator. */
  private static boolean isTruthValue(Token token) {
    return (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.FINSET))
        && (token.text().equalsIgnoreCase("T") || token.text().equalsIgnoreCase("F"));
  }

  /**
   * Parses an {@code EQUIV:} or {@code ARGUE:} chain. Each line is a step, optionally starting
   * with {@code <=>} and ending with a justification.
   */
  private EquivChain chain() {
    Token keyword = cursor.next();
    String name = keyword.is(TokenKind.ARGUE) ? "ARGUE" : "EQUIV";
    cursor.skipBlankLines();
    if (atBlockBoundary()) {
      throw cursor.error(ErrorKind.EMPTY_CHAIN, name);
    }
    ImmutableList.Builder<EquivStep> steps = ImmutableList.builder();
    while (true) {
      cursor.maybe(TokenKind.IFF);
      Expression expression = expressions.expression();
      String justification = Justifications.read(cursor);
      endOfLine();
      steps.add(
          new EquivStep(expression.line(), expression.column(), expression, justification));
      if (cursor.atBlankLine()) {
        break;
      }
      cursor.next();
      if (isStructural(cursor.kind())) {
        break;
      }
    }
    return new EquivChain(
        keyword.line(), keyword.column(), keyword.is(TokenKind.ARGUE), steps.build());
  }

  /** Parses premises, a {@code ---} line, and a conclusion. */
  private InfruleBlock infrule(Set<TokenKind> stop) {
    Token infrule = cursor.next();
    cursor.skipBlankLines();
    if (cursor.is(TokenKind.RULE_SEPARATOR) || atBlockBoundary()) {
      throw cursor.error(ErrorKind.EMPTY_INFRULE_PREMISES);
    }
    ImmutableList.Builder<InfruleLine> premises = ImmutableList.builder();
    while (!cursor.is(TokenKind.RULE_SEPARATOR)) {
      if (atBlockBoundary()) {
        throw cursor.error(ErrorKind.MISSING_INFRULE_SEPARATOR);
      }
      premises.add(infruleLine());
      endOfLine();
      cursor.skipBlankLines();
    }
    cursor.next();
    cursor.skipBlankLines();
    if (atBlockBoundary()) {
      throw cursor.error(ErrorKind.MISSING_INFRULE_CONCLUSION);
    }
    InfruleLine conclusion = infruleLine();
    return endOfItem(
        new InfruleBlock(infrule.line(), infrule.column(), premises.build(), conclusion), stop);
  }

  private InfruleLine infruleLine() {
    Expression expression = expressions.expression();
    String label = Justifications.read(cursor);
    return new InfruleLine(expression.line(), expression.column(), expression, label);
  }
}
