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

import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.ImmutableList;
import com.google.txt2tex.diag.Txt2texError.ErrorKind;
import com.google.txt2tex.tree.Tree;
import com.google.txt2tex.tree.Tree.BagLiteral;
import com.google.txt2tex.tree.Tree.BinaryOp;
import com.google.txt2tex.tree.Tree.Conditional;
import com.google.txt2tex.tree.Tree.Expression;
import com.google.txt2tex.tree.Tree.FunctionApp;
import com.google.txt2tex.tree.Tree.FunctionType;
import com.google.txt2tex.tree.Tree.GenericInstantiation;
import com.google.txt2tex.tree.Tree.GuardedBranch;
import com.google.txt2tex.tree.Tree.GuardedCases;
import com.google.txt2tex.tree.Tree.Identifier;
import com.google.txt2tex.tree.Tree.Lambda;
import com.google.txt2tex.tree.Tree.Quantifier;
import com.google.txt2tex.tree.Tree.Range;
import com.google.txt2tex.tree.Tree.RelationalImage;
import com.google.txt2tex.tree.Tree.SequenceLiteral;
import com.google.txt2tex.tree.Tree.SetComprehension;
import com.google.txt2tex.tree.Tree.SetLiteral;
import com.google.txt2tex.tree.Tree.Superscript;
import com.google.txt2tex.tree.Tree.Tuple;
import com.google.txt2tex.tree.Tree.TupleProjection;
import com.google.txt2tex.tree.Tree.UnaryOp;
import org.jspecify.annotations.Nullable;

/** A precedence-climbing parser for txt2tex expressions. */
class ExpressionParser {

  /** Binary operator precedence, loosest first. */
  enum Precedence {
    IFF(Associativity.LEFT),
    IMPLIES(Associativity.RIGHT),
    OR(Associativity.LEFT),
    AND(Associativity.LEFT),
    RELATIONAL(Associativity.NONE),
    TYPE(Associativity.RIGHT),
    MAPLET(Associativity.LEFT),
    UNION(Associativity.LEFT),
    ADDITIVE(Associativity.LEFT),
    MULTIPLICATIVE(Associativity.LEFT),
    RANGE(Associativity.NONE);

    private final Associativity associativity;

    Precedence(Associativity associativity) {
      this.associativity = associativity;
    }

    int rank() {
      return ordinal() + 1;
    }

    /** The rank that the right operand of an operator at this level must exceed. */
    int rightRank() {
      return associativity == Associativity.RIGHT ? rank() - 1 : rank();
    }
  }

  enum Associativity {
    LEFT,
    RIGHT,
    /** A second operator at the same level is an error. */
    NONE
  }

  private final TokenCursor cursor;

  /** The bracket nesting depth at which {@code ;} separates bindings, or -1. */
  private int separatorNesting = -1;

  ExpressionParser(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /** Parses a complete expression. */
  Expression expression() {
    return expression(0);
  }

  /** Parses an expression whose binary operators all bind tighter than {@code rank}. */
  private Expression expression(int rank) {
    Expression term = unary();
    return expression(term, rank);
  }

  private Expression expression(Expression term1, int rank) {
    while (true) {
      Token token = cursor.token();
      Precedence prec = precedence(token.kind());
      if (prec == null || prec.rank() <= rank) {
        return term1;
      }
      cursor.next();
      boolean lineBreak = cursor.skipLineBreaks();
      Expression term2 = expression(prec.rightRank());
      if (lineBreak && (cursor.is(TokenKind.IF) || cursor.is(TokenKind.OTHERWISE))) {
        term2 = guardedCases(term2);
      }
      term1 = binary(token, term1, term2, lineBreak);
      if (prec.associativity == Associativity.NONE && precedence(cursor.kind()) == prec) {
        throw cursor.error(ErrorKind.CHAINED_OPERATOR, TokenCursor.describe(cursor.token()));
      }
    }
  }

  private Expression binary(Token op, Expression left, Expression right, boolean lineBreak) {
    return switch (op.kind()) {
      case RANGE -> new Range(op.line(), op.column(), left, right);
      case TFUN, PFUN, TINJ, PINJ, TSURJ, PSURJ, BIJECTION, FINFUN, PBIJECTION ->
          new FunctionType(op.line(), op.column(), op.text(), left, right);
      default ->
          new BinaryOp(op.line(), op.column(), op.text(), left, right, false, lineBreak);
    };
  }

  private @Nullable Precedence precedence(TokenKind kind) {
    return switch (kind) {
      case IFF -> Precedence.IFF;
      case IMPLIES -> Precedence.IMPLIES;
      case OR -> Precedence.OR;
      case AND -> Precedence.AND;
      case EQUALS, NOT_EQUAL, IN, NOTIN, LESS_THAN, LESS_EQUAL, GREATER_THAN, GREATER_EQUAL,
              SUBSET, SUBSETEQ, PSUBSET ->
          Precedence.RELATIONAL;
      case RELATION, TFUN, PFUN, TINJ, PINJ, TSURJ, PSURJ, BIJECTION, FINFUN, PBIJECTION ->
          Precedence.TYPE;
      case MAPLET -> Precedence.MAPLET;
      case RANGE -> Precedence.RANGE;
      case UNION, INTERSECT, OVERRIDE, BAG_UNION, CAT, FILTER -> Precedence.UNION;
      case PLUS, MINUS, SETMINUS -> Precedence.ADDITIVE;
      case SEMICOLON ->
          cursor.nesting() == separatorNesting ? null : Precedence.MULTIPLICATIVE;
      case STAR, DIV, MOD, CROSS, CIRC, COMP, DRES, RRES, NDRES, NRRES ->
          Precedence.MULTIPLICATIVE;
      default -> null;
    };
  }

  /**
   * Parses the lines of a case-wise definition. The first branch expression has already been
   * parsed, and the current token is its {@code if} or {@code otherwise}.
   */
  private GuardedCases guardedCases(Expression first) {
    ImmutableList.Builder<GuardedBranch> branches = ImmutableList.builder();
    Expression expression = first;
    while (true) {
      Expression guard = guard();
      branches.add(
          new GuardedBranch(expression.line(), expression.column(), expression, guard));
      if (guard == null || !moreBranches()) {
        break;
      }
      expression = expression(0);
      if (!cursor.is(TokenKind.IF) && !cursor.is(TokenKind.OTHERWISE)) {
        throw cursor.error(ErrorKind.EXPECTED_GUARD);
      }
    }
    return new GuardedCases(first.line(), first.column(), branches.build());
  }

  /** Parses {@code if guard} or {@code otherwise}, returning null for the latter. */
  private @Nullable Expression guard() {
    if (cursor.maybe(TokenKind.OTHERWISE)) {
      return null;
    }
    cursor.eat(TokenKind.IF, ErrorKind.EXPECTED_GUARD);
    return expression(0);
  }

  /** Returns true, after skipping the line break, if another branch follows on the next line. */
  private boolean moreBranches() {
    if (cursor.nested()) {
      return startsOperand(cursor.token());
    }
    if (!cursor.is(TokenKind.NEWLINE) || cursor.atBlankLine()) {
      return false;
    }
    int mark = cursor.mark();
    cursor.skipLineBreaks();
    if (startsOperand(cursor.token())) {
      return true;
    }
    cursor.reset(mark);
    return false;
  }

  private Expression unary() {
    Token token = cursor.token();
    return switch (token.kind()) {
      case NOT, MINUS, HASH, POWER, POWER1, FINSET, FINSET1, DOM, RAN, INV, ID, BIGCUP, BIGCAP,
              SEQ, SEQ1, ISEQ, BAG -> {
        cursor.next();
        Expression operand = unary();
        yield new UnaryOp(token.line(), token.column(), token.text(), operand, false);
      }
      default -> postfix(primary());
    };
  }

  private Expression primary() {
    Token token = cursor.token();
    return switch (token.kind()) {
      case IDENTIFIER, ELLIPSIS -> {
        cursor.next();
        yield new Identifier(token.line(), token.column(), token.text());
      }
      case NUMBER -> {
        cursor.next();
        yield new Tree.Number(token.line(), token.column(), token.text());
      }
      case LPAREN -> parenthesized();
      case LBRACE -> set();
      case LANGLE -> sequence();
      case LBRACKET -> {
        if (!cursor.peek(1).is(TokenKind.LBRACKET)) {
          throw cursor.error(ErrorKind.EXPECTED_EXPRESSION, TokenCursor.describe(token));
        }
        yield bag();
      }
      case IF -> conditional();
      case FORALL, EXISTS, EXISTS1, MU -> quantifier();
      case LAMBDA -> lambda();
      default -> throw cursor.error(ErrorKind.EXPECTED_EXPRESSION, TokenCursor.describe(token));
    };
  }

  private Expression postfix(Expression base) {
    while (true) {
      Token token = cursor.token();
      switch (token.kind()) {
        case TILDE -> {
          cursor.next();
          base = new UnaryOp(token.line(), token.column(), token.text(), base, true);
        }
        case PLUS, STAR -> {
          if (startsOperand(cursor.lookahead())) {
            return base;
          }
          cursor.next();
          base = new UnaryOp(token.line(), token.column(), token.text(), base, true);
        }
        case CARET -> {
          cursor.next();
          base = new Superscript(base.line(), base.column(), base, exponent());
        }
        case PERIOD -> {
          Token next = cursor.lookahead();
          if (!adjacent(cursor.previous(), token)
              || !adjacent(token, next)
              || next.is(TokenKind.EOF)
              || next.is(TokenKind.NEWLINE)) {
            return base;
          }
          cursor.next();
          Token field = cursor.token();
          if (!field.is(TokenKind.NUMBER) && !field.is(TokenKind.IDENTIFIER)) {
            throw cursor.error(ErrorKind.EXPECTED_PROJECTION);
          }
          cursor.next();
          base = new TupleProjection(base.line(), base.column(), base, field.text());
        }
        case LPAREN -> {
          cursor.next();
          ImmutableList<Expression> args =
              cursor.is(TokenKind.RPAREN)
                  ? ImmutableList.of()
                  : list(TokenKind.RPAREN, "function application", "')'");
          base = new FunctionApp(base.line(), base.column(), base, args);
        }
        case LIMG -> {
          cursor.next();
          cursor.enter();
          Expression set = expression(0);
          cursor.exit();
          cursor.eat(TokenKind.RIMG, ErrorKind.UNCLOSED, "relational image", "'|)'");
          base = new RelationalImage(base.line(), base.column(), base, set);
        }
        case LBRACKET -> {
          if (!adjacent(cursor.previous(), token) || cursor.peek(1).is(TokenKind.LBRACKET)) {
            return base;
          }
          cursor.next();
          ImmutableList<Expression> params =
              list(TokenKind.RBRACKET, "generic instantiation", "']'");
          base = new GenericInstantiation(base.line(), base.column(), base, params);
        }
        default -> {
          if (!applicable(base) || !startsArgument(token) || cursor.lineBreakBefore()) {
            return base;
          }
          Expression arg = primary();
          base = new FunctionApp(base.line(), base.column(), base, ImmutableList.of(arg));
        }
      }
    }
  }

  /** An exponent: an atom, optionally negated. */
  private Expression exponent() {
    Token token = cursor.token();
    if (token.is(TokenKind.MINUS)) {
      cursor.next();
      return new UnaryOp(token.line(), token.column(), token.text(), exponent(), false);
    }
    return primary();
  }

  /** Parses a comma-separated list and its closing bracket; the open bracket has been consumed. */
  private ImmutableList<Expression> list(TokenKind close, String what, String closeText) {
    cursor.enter();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    do {
      elements.add(expression(0));
    } while (cursor.maybe(TokenKind.COMMA));
    cursor.exit();
    cursor.eat(close, ErrorKind.UNCLOSED, what, closeText);
    return elements.build();
  }

  private Expression parenthesized() {
    Token open = cursor.next();
    cursor.enter();
    Expression first = expression(0);
    if (cursor.is(TokenKind.COMMA)) {
      ImmutableList.Builder<Expression> elements = ImmutableList.builder();
      elements.add(first);
      while (cursor.maybe(TokenKind.COMMA)) {
        elements.add(expression(0));
      }
      cursor.exit();
      cursor.eat(TokenKind.RPAREN, ErrorKind.UNCLOSED, "parenthesis", "')'");
      return new Tuple(open.line(), open.column(), elements.build());
    }
    cursor.exit();
    cursor.eat(TokenKind.RPAREN, ErrorKind.UNCLOSED, "parenthesis", "')'");
    if (first instanceof BinaryOp binaryOp) {
      return binaryOp.withExplicitParens();
    }
    return first;
  }

  private Expression set() {
    Token open = cursor.next();
    cursor.enter();
    if (cursor.is(TokenKind.RBRACE)) {
      cursor.exit();
      cursor.next();
      return new SetLiteral(open.line(), open.column(), ImmutableList.of());
    }
    if (isComprehension()) {
      return comprehension(open);
    }
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    do {
      elements.add(expression(0));
    } while (cursor.maybe(TokenKind.COMMA));
    cursor.exit();
    cursor.eat(TokenKind.RBRACE, ErrorKind.UNCLOSED, "set", "'}'");
    return new SetLiteral(open.line(), open.column(), elements.build());
  }

  /** A comprehension starts with a variable list followed by {@code :} or {@code |}. */
  private boolean isComprehension() {
    int i = 0;
    while (true) {
      if (!visible(i).is(TokenKind.IDENTIFIER)) {
        return false;
      }
      TokenKind next = visible(i + 1).kind();
      if (next == TokenKind.COLON || next == TokenKind.PIPE) {
        return true;
      }
      if (next != TokenKind.COMMA) {
        return false;
      }
      i += 2;
    }
  }

  /** Returns the {@code n}th visible token from the current one. */
  private Token visible(int n) {
    int mark = cursor.mark();
    for (int i = 0; i < n; i++) {
      cursor.next();
    }
    Token token = cursor.token();
    cursor.reset(mark);
    return token;
  }

  private Expression comprehension(Token open) {
    ImmutableList<String> variables = variables("set comprehension");
    Expression domain = null;
    if (cursor.maybe(TokenKind.COLON)) {
      domain = domain();
    }
    Expression predicate = null;
    Expression expression = null;
    if (cursor.maybe(TokenKind.PIPE)) {
      cursor.skipLineBreaks();
      predicate = expression(0);
      if (cursor.maybe(TokenKind.PERIOD)) {
        expression = expression(0);
      }
    } else if (cursor.maybe(TokenKind.PERIOD)) {
      expression = expression(0);
    } else {
      throw cursor.error(ErrorKind.EXPECTED_COMPREHENSION_BAR);
    }
    cursor.exit();
    cursor.eat(TokenKind.RBRACE, ErrorKind.UNCLOSED_COMPREHENSION);
    return new SetComprehension(
        open.line(), open.column(), variables, domain, predicate, expression);
  }

  private Expression sequence() {
    Token open = cursor.next();
    cursor.enter();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    if (!cursor.is(TokenKind.RANGLE)) {
      do {
        elements.add(expression(0));
      } while (cursor.maybe(TokenKind.COMMA));
    }
    cursor.exit();
    cursor.eat(TokenKind.RANGLE, ErrorKind.UNCLOSED, "sequence", "'>'");
    return new SequenceLiteral(open.line(), open.column(), elements.build());
  }

  private Expression bag() {
    Token open = cursor.next();
    cursor.next();
    cursor.enter();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    if (!cursor.is(TokenKind.RBRACKET)) {
      do {
        elements.add(expression(0));
      } while (cursor.maybe(TokenKind.COMMA));
    }
    cursor.exit();
    cursor.eat(TokenKind.RBRACKET, ErrorKind.UNCLOSED, "bag", "']]'");
    cursor.eat(TokenKind.RBRACKET, ErrorKind.UNCLOSED, "bag", "']]'");
    return new BagLiteral(open.line(), open.column(), elements.build());
  }

  private Expression conditional() {
    Token token = cursor.next();
    Expression condition = expression(0);
    boolean breakAfterCondition = cursor.skipLineBreaksBefore(TokenKind.THEN);
    cursor.eat(TokenKind.THEN, ErrorKind.MISSING_THEN);
    breakAfterCondition |= cursor.skipLineBreaks();
    Expression thenExpr = expression(0);
    boolean breakAfterThen = cursor.skipLineBreaksBefore(TokenKind.ELSE);
    cursor.eat(TokenKind.ELSE, ErrorKind.MISSING_ELSE);
    breakAfterThen |= cursor.skipLineBreaks();
    Expression elseExpr = expression(0);
    return new Conditional(
        token.line(),
        token.column(),
        condition,
        thenExpr,
        elseExpr,
        breakAfterCondition,
        breakAfterThen);
  }

  private Expression quantifier() {
    Token token = cursor.next();
    String keyword = verifyNotNull(token.kind().spelling());
    return binding(token, keyword);
  }

  /**
   * Parses one binding group and the rest of a quantified expression. Groups separated by
   * {@code ;} become nested quantifiers.
   */
  private Quantifier binding(Token start, String keyword) {
    boolean tuplePattern = cursor.is(TokenKind.LPAREN);
    ImmutableList<String> variables =
        tuplePattern ? tuplePattern(keyword) : variables(keyword);
    Expression domain = null;
    if (cursor.maybe(TokenKind.COLON)) {
      domain = domain();
    }
    if (cursor.is(TokenKind.SEMICOLON)) {
      cursor.next();
      cursor.skipLineBreaks();
      Quantifier inner = binding(cursor.token(), keyword);
      return new Quantifier(
          start.line(),
          start.column(),
          keyword,
          variables,
          domain,
          inner,
          null,
          tuplePattern,
          false);
    }
    Expression body = null;
    Expression expression = null;
    boolean lineBreakAfterPipe = false;
    if (cursor.maybe(TokenKind.PIPE)) {
      lineBreakAfterPipe = cursor.skipLineBreaks();
      body = expression(0);
      if (cursor.maybe(TokenKind.PERIOD)) {
        cursor.skipLineBreaks();
        expression = expression(0);
      }
    } else if (cursor.maybe(TokenKind.PERIOD)) {
      cursor.skipLineBreaks();
      if (keyword.equals("mu")) {
        expression = expression(0);
      } else {
        body = expression(0);
      }
    } else {
      throw cursor.error(ErrorKind.EXPECTED_QUANTIFIER_BAR);
    }
    return new Quantifier(
        start.line(),
        start.column(),
        keyword,
        variables,
        domain,
        body,
        expression,
        tuplePattern,
        lineBreakAfterPipe);
  }

  private Expression lambda() {
    Token token = cursor.next();
    ImmutableList<String> variables = variables("lambda");
    Expression domain = null;
    if (cursor.maybe(TokenKind.COLON)) {
      domain = domain();
    }
    if (!cursor.maybe(TokenKind.PERIOD) && !cursor.maybe(TokenKind.PIPE)) {
      throw cursor.error(ErrorKind.EXPECTED_TOKEN, "'.' after lambda binding");
    }
    cursor.skipLineBreaks();
    Expression body = expression(0);
    return new Lambda(token.line(), token.column(), variables, domain, body);
  }

  /** Parses a comma-separated list of bound variable names. */
  private ImmutableList<String> variables(String binder) {
    ImmutableList.Builder<String> variables = ImmutableList.builder();
    do {
      if (!cursor.is(TokenKind.IDENTIFIER)) {
        throw cursor.error(ErrorKind.EXPECTED_QUANTIFIER_VARIABLE, binder);
      }
      variables.add(cursor.next().text());
    } while (cursor.maybe(TokenKind.COMMA));
    return variables.build();
  }

  /** Parses a tuple pattern such as {@code (a, b)}, which may only contain identifiers. */
  private ImmutableList<String> tuplePattern(String binder) {
    cursor.next();
    cursor.enter();
    if (cursor.is(TokenKind.RPAREN)) {
      throw cursor.error(ErrorKind.EMPTY_TUPLE_PATTERN, binder);
    }
    ImmutableList.Builder<String> variables = ImmutableList.builder();
    do {
      if (!cursor.is(TokenKind.IDENTIFIER)) {
        throw cursor.error(ErrorKind.INVALID_TUPLE_PATTERN, binder);
      }
      variables.add(cursor.next().text());
    } while (cursor.maybe(TokenKind.COMMA));
    if (!cursor.is(TokenKind.RPAREN)) {
      throw cursor.error(ErrorKind.INVALID_TUPLE_PATTERN, binder);
    }
    cursor.exit();
    cursor.next();
    return variables.build();
  }

  /** Parses the domain of a binding or the type of a declaration, which end at {@code ;}. */
  Expression domain() {
    int saved = separatorNesting;
    separatorNesting = cursor.nesting();
    try {
      return expression(0);
    } finally {
      separatorNesting = saved;
    }
  }

  /** Returns true if the token can start an operand. */
  static boolean startsOperand(Token token) {
    return switch (token.kind()) {
      case IDENTIFIER, NUMBER, ELLIPSIS, LPAREN, LBRACE, LANGLE, LBRACKET, IF, FORALL, EXISTS,
              EXISTS1, MU, LAMBDA, NOT, MINUS, HASH, POWER, POWER1, FINSET, FINSET1, DOM, RAN,
              INV, ID, BIGCUP, BIGCAP, SEQ, SEQ1, ISEQ, BAG ->
          true;
      default -> false;
    };
  }

  /** Returns true if the token can start the argument of a space-separated application. */
  private static boolean startsArgument(Token token) {
    return switch (token.kind()) {
      case IDENTIFIER, NUMBER, LBRACE, LANGLE -> true;
      default -> false;
    };
  }

  /** Only names and applications can be applied by juxtaposition. */
  private static boolean applicable(Expression base) {
    return base instanceof Identifier
        || base instanceof FunctionApp
        || base instanceof GenericInstantiation;
  }

  /** Returns true if {@code right} starts where {@code left} ends, on the same line. */
  private static boolean adjacent(Token left, Token right) {
    return left.line() == right.line() && left.endColumn() == right.column();
  }
}
