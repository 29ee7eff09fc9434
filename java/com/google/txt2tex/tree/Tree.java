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

package com.google.txt2tex.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A txt2tex AST node. Trees are immutable, and every node records its source position. */
public abstract class Tree {

  /** The kind of an AST node. */
  public enum Kind {
    DOCUMENT,
    IDENTIFIER,
    NUMBER,
    BINARY_OP,
    UNARY_OP,
    QUANTIFIER,
    LAMBDA,
    SET_LITERAL,
    SET_COMPREHENSION,
    SEQUENCE_LITERAL,
    BAG_LITERAL,
    TUPLE,
    TUPLE_PROJECTION,
    FUNCTION_APP,
    FUNCTION_TYPE,
    RELATIONAL_IMAGE,
    GENERIC_INSTANTIATION,
    RANGE,
    CONDITIONAL,
    SUPERSCRIPT,
    GUARDED_CASES,
    GUARDED_BRANCH,
    SECTION,
    SOLUTION,
    PART,
    PARAGRAPH,
    PURE_PARAGRAPH,
    LATEX_BLOCK,
    PAGE_BREAK,
    CONTENTS,
    PARTS_FORMAT,
    GIVEN_TYPE,
    FREE_TYPE,
    FREE_BRANCH,
    ABBREVIATION,
    DECLARATION,
    AX_DEF,
    GEN_DEF,
    SCHEMA,
    ZED,
    SYNTAX_BLOCK,
    SYNTAX_DEFINITION,
    TRUTH_TABLE,
    EQUIV_CHAIN,
    EQUIV_STEP,
    PROOF_TREE,
    PROOF_NODE,
    CASE_ANALYSIS,
    INFRULE_BLOCK,
    INFRULE_LINE
  }

  private final int line;
  private final int column;

  protected Tree(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** The one-indexed source line of the node. */
  public int line() {
    return line;
  }

  /** The one-indexed source column of the node. */
  public int column() {
    return column;
  }

  public abstract Kind kind();

  public abstract <I extends @Nullable Object, O extends @Nullable Object> O accept(
      Visitor<I, O> visitor, I input);

  @Override
  public String toString() {
    return Pretty.pretty(this);
  }

  /** A document: the ordered top-level items of a source file. */
  public static class Document extends Tree {
    private final ImmutableList<Tree> items;

    public Document(int line, int column, ImmutableList<Tree> items) {
      super(line, column);
      this.items = requireNonNull(items);
    }

    @Override
    public Kind kind() {
      return Kind.DOCUMENT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitDocument(this, input);
    }

    public ImmutableList<Tree> items() {
      return items;
    }
  }

  /** An expression. */
  public abstract static class Expression extends Tree {
    protected Expression(int line, int column) {
      super(line, column);
    }
  }

  /** A name, e.g. {@code x}, {@code 479_courses}, or {@code ...}. */
  public static class Identifier extends Expression {
    private final String name;

    public Identifier(int line, int column, String name) {
      super(line, column);
      this.name = requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.IDENTIFIER;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIdentifier(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A natural number literal, kept as written. */
  public static class Number extends Expression {
    private final String value;

    public Number(int line, int column, String value) {
      super(line, column);
      this.value = requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitNumber(this, input);
    }

    public String value() {
      return value;
    }
  }

  /** A binary operator application. */
  public static class BinaryOp extends Expression {
    private final String operator;
    private final Expression left;
    private final Expression right;
    private final boolean explicitParens;
    private final boolean lineBreakAfter;

    public BinaryOp(
        int line,
        int column,
        String operator,
        Expression left,
        Expression right,
        boolean explicitParens,
        boolean lineBreakAfter) {
      super(line, column);
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.explicitParens = explicitParens;
      this.lineBreakAfter = lineBreakAfter;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY_OP;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBinaryOp(this, input);
    }

    /** The operator as written in the source, e.g. {@code land} or {@code ×}. */
    public String operator() {
      return operator;
    }

    public Expression left() {
      return left;
    }

    public Expression right() {
      return right;
    }

    /** True if the source wrapped exactly this operation in parentheses. */
    public boolean explicitParens() {
      return explicitParens;
    }

    /** True if the source broke the line after the operator. */
    public boolean lineBreakAfter() {
      return lineBreakAfter;
    }

    /** Returns a copy of this operation, marked as parenthesized in the source. */
    public BinaryOp withExplicitParens() {
      return new BinaryOp(line(), column(), operator, left, right, true, lineBreakAfter);
    }
  }

  /** A prefix or postfix operator application, e.g. {@code lnot p}, {@code # s}, {@code R~}. */
  public static class UnaryOp extends Expression {
    private final String operator;
    private final Expression operand;
    private final boolean postfix;

    public UnaryOp(int line, int column, String operator, Expression operand, boolean postfix) {
      super(line, column);
      this.operator = requireNonNull(operator);
      this.operand = requireNonNull(operand);
      this.postfix = postfix;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY_OP;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitUnaryOp(this, input);
    }

    public String operator() {
      return operator;
    }

    public Expression operand() {
      return operand;
    }

    /** True for the relational closures {@code ~}, {@code +} and {@code *}. */
    public boolean postfix() {
      return postfix;
    }
  }

  /**
   * A quantified predicate or definite description: {@code forall}, {@code exists}, {@code
   * exists1} or {@code mu}.
   *
   * <p>A binding of several semicolon-separated groups is represented as nested quantifiers, one
   * per group.
   */
  public static class Quantifier extends Expression {
    private final String quantifier;
    private final ImmutableList<String> variables;
    private final @Nullable Expression domain;
    private final @Nullable Expression body;
    private final @Nullable Expression expression;
    private final boolean tuplePattern;
    private final boolean lineBreakAfterPipe;

    public Quantifier(
        int line,
        int column,
        String quantifier,
        ImmutableList<String> variables,
        @Nullable Expression domain,
        @Nullable Expression body,
        @Nullable Expression expression,
        boolean tuplePattern,
        boolean lineBreakAfterPipe) {
      super(line, column);
      checkArgument(!variables.isEmpty(), "empty binding");
      checkArgument(body != null || expression != null, "quantifier without body");
      this.quantifier = requireNonNull(quantifier);
      this.variables = variables;
      this.domain = domain;
      this.body = body;
      this.expression = expression;
      this.tuplePattern = tuplePattern;
      this.lineBreakAfterPipe = lineBreakAfterPipe;
    }

    @Override
    public Kind kind() {
      return Kind.QUANTIFIER;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitQuantifier(this, input);
    }

    /** The quantifier keyword: {@code forall}, {@code exists}, {@code exists1} or {@code mu}. */
    public String quantifier() {
      return quantifier;
    }

    public ImmutableList<String> variables() {
      return variables;
    }

    public @Nullable Expression domain() {
      return domain;
    }

    /** The predicate after {@code |}; absent for {@code mu x : T . E}. */
    public @Nullable Expression body() {
      return body;
    }

    /** The expression part after {@code .}, if any. */
    public @Nullable Expression expression() {
      return expression;
    }

    /** True if the variables were bound by a tuple pattern, as in {@code forall (a, b) : T}. */
    public boolean tuplePattern() {
      return tuplePattern;
    }

    public boolean lineBreakAfterPipe() {
      return lineBreakAfterPipe;
    }
  }

  /** A lambda abstraction {@code lambda x : T . E}. */
  public static class Lambda extends Expression {
    private final ImmutableList<String> variables;
    private final @Nullable Expression domain;
    private final Expression body;

    public Lambda(
        int line,
        int column,
        ImmutableList<String> variables,
        @Nullable Expression domain,
        Expression body) {
      super(line, column);
      this.variables = requireNonNull(variables);
      this.domain = domain;
      this.body = requireNonNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.LAMBDA;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLambda(this, input);
    }

    public ImmutableList<String> variables() {
      return variables;
    }

    public @Nullable Expression domain() {
      return domain;
    }

    public Expression body() {
      return body;
    }
  }

  /** A set display {@code {a, b, c}}, possibly empty. */
  public static class SetLiteral extends Expression {
    private final ImmutableList<Expression> elements;

    public SetLiteral(int line, int column, ImmutableList<Expression> elements) {
      super(line, column);
      this.elements = requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.SET_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSetLiteral(this, input);
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  /** A set comprehension {@code {x : T | P . E}}. */
  public static class SetComprehension extends Expression {
    private final ImmutableList<String> variables;
    private final @Nullable Expression domain;
    private final @Nullable Expression predicate;
    private final @Nullable Expression expression;

    public SetComprehension(
        int line,
        int column,
        ImmutableList<String> variables,
        @Nullable Expression domain,
        @Nullable Expression predicate,
        @Nullable Expression expression) {
      super(line, column);
      this.variables = requireNonNull(variables);
      this.domain = domain;
      this.predicate = predicate;
      this.expression = expression;
    }

    @Override
    public Kind kind() {
      return Kind.SET_COMPREHENSION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSetComprehension(this, input);
    }

    public ImmutableList<String> variables() {
      return variables;
    }

    public @Nullable Expression domain() {
      return domain;
    }

    public @Nullable Expression predicate() {
      return predicate;
    }

    /** The image expression after {@code .}, if any. */
    public @Nullable Expression expression() {
      return expression;
    }
  }

  /** A sequence display {@code <a, b>} or {@code ⟨a, b⟩}. */
  public static class SequenceLiteral extends Expression {
    private final ImmutableList<Expression> elements;

    public SequenceLiteral(int line, int column, ImmutableList<Expression> elements) {
      super(line, column);
      this.elements = requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSequenceLiteral(this, input);
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  /** A bag display {@code [[a, b]]}. */
  public static class BagLiteral extends Expression {
    private final ImmutableList<Expression> elements;

    public BagLiteral(int line, int column, ImmutableList<Expression> elements) {
      super(line, column);
      this.elements = requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.BAG_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBagLiteral(this, input);
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  /** A tuple {@code (a, b, ...)} of at least two elements. */
  public static class Tuple extends Expression {
    private final ImmutableList<Expression> elements;

    public Tuple(int line, int column, ImmutableList<Expression> elements) {
      super(line, column);
      checkArgument(elements.size() >= 2, "tuple of %s elements", elements.size());
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitTuple(this, input);
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  /** A projection {@code x.1} or a field selection {@code x.name}. */
  public static class TupleProjection extends Expression {
    private final Expression base;
    private final String field;

    public TupleProjection(int line, int column, Expression base, String field) {
      super(line, column);
      this.base = requireNonNull(base);
      this.field = requireNonNull(field);
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE_PROJECTION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitTupleProjection(this, input);
    }

    public Expression base() {
      return base;
    }

    /** The index or field name after the dot. */
    public String field() {
      return field;
    }

    /** True if the projection selects a tuple component by number. */
    public boolean isIndex() {
      return !field.isEmpty() && field.chars().allMatch(c -> c >= '0' && c <= '9');
    }
  }

  /** A function application, {@code f(x, y)} or the space-separated {@code f x}. */
  public static class FunctionApp extends Expression {
    private final Expression function;
    private final ImmutableList<Expression> args;

    public FunctionApp(
        int line, int column, Expression function, ImmutableList<Expression> args) {
      super(line, column);
      this.function = requireNonNull(function);
      this.args = requireNonNull(args);
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_APP;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFunctionApp(this, input);
    }

    public Expression function() {
      return function;
    }

    public ImmutableList<Expression> args() {
      return args;
    }
  }

  /** A function type {@code X -> Y}, or any of the other function arrows. */
  public static class FunctionType extends Expression {
    private final String arrow;
    private final Expression domain;
    private final Expression range;

    public FunctionType(int line, int column, String arrow, Expression domain, Expression range) {
      super(line, column);
      this.arrow = requireNonNull(arrow);
      this.domain = requireNonNull(domain);
      this.range = requireNonNull(range);
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_TYPE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFunctionType(this, input);
    }

    public String arrow() {
      return arrow;
    }

    public Expression domain() {
      return domain;
    }

    public Expression range() {
      return range;
    }
  }

  /** A relational image {@code R(| S |)}. */
  public static class RelationalImage extends Expression {
    private final Expression relation;
    private final Expression set;

    public RelationalImage(int line, int column, Expression relation, Expression set) {
      super(line, column);
      this.relation = requireNonNull(relation);
      this.set = requireNonNull(set);
    }

    @Override
    public Kind kind() {
      return Kind.RELATIONAL_IMAGE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRelationalImage(this, input);
    }

    public Expression relation() {
      return relation;
    }

    public Expression set() {
      return set;
    }
  }

  /** An explicit instantiation of a generic, {@code T[X, Y]}. */
  public static class GenericInstantiation extends Expression {
    private final Expression base;
    private final ImmutableList<Expression> params;

    public GenericInstantiation(
        int line, int column, Expression base, ImmutableList<Expression> params) {
      super(line, column);
      this.base = requireNonNull(base);
      this.params = requireNonNull(params);
    }

    @Override
    public Kind kind() {
      return Kind.GENERIC_INSTANTIATION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitGenericInstantiation(this, input);
    }

    public Expression base() {
      return base;
    }

    public ImmutableList<Expression> params() {
      return params;
    }
  }

  /** A number range {@code m..n}. */
  public static class Range extends Expression {
    private final Expression start;
    private final Expression end;

    public Range(int line, int column, Expression start, Expression end) {
      super(line, column);
      this.start = requireNonNull(start);
      this.end = requireNonNull(end);
    }

    @Override
    public Kind kind() {
      return Kind.RANGE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRange(this, input);
    }

    public Expression start() {
      return start;
    }

    public Expression end() {
      return end;
    }
  }

  /** A conditional expression {@code if c then a else b}. */
  public static class Conditional extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;
    private final boolean lineBreakAfterCondition;
    private final boolean lineBreakAfterThen;

    public Conditional(
        int line,
        int column,
        Expression condition,
        Expression thenExpr,
        Expression elseExpr,
        boolean lineBreakAfterCondition,
        boolean lineBreakAfterThen) {
      super(line, column);
      this.condition = requireNonNull(condition);
      this.thenExpr = requireNonNull(thenExpr);
      this.elseExpr = requireNonNull(elseExpr);
      this.lineBreakAfterCondition = lineBreakAfterCondition;
      this.lineBreakAfterThen = lineBreakAfterThen;
    }

    @Override
    public Kind kind() {
      return Kind.CONDITIONAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitConditional(this, input);
    }

    public Expression condition() {
      return condition;
    }

    public Expression thenExpr() {
      return thenExpr;
    }

    public Expression elseExpr() {
      return elseExpr;
    }

    /** True if the line breaks before {@code then}. */
    public boolean lineBreakAfterCondition() {
      return lineBreakAfterCondition;
    }

    /** True if the line breaks before {@code else}. */
    public boolean lineBreakAfterThen() {
      return lineBreakAfterThen;
    }
  }

  /** An exponent, {@code x^2}. */
  public static class Superscript extends Expression {
    private final Expression base;
    private final Expression exponent;

    public Superscript(int line, int column, Expression base, Expression exponent) {
      super(line, column);
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    @Override
    public Kind kind() {
      return Kind.SUPERSCRIPT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSuperscript(this, input);
    }

    public Expression base() {
      return base;
    }

    public Expression exponent() {
      return exponent;
    }
  }

  /** A case-wise definition: one expression per line, each with a guard. */
  public static class GuardedCases extends Expression {
    private final ImmutableList<GuardedBranch> branches;

    public GuardedCases(int line, int column, ImmutableList<GuardedBranch> branches) {
      super(line, column);
      checkArgument(!branches.isEmpty(), "no branches");
      this.branches = branches;
    }

    @Override
    public Kind kind() {
      return Kind.GUARDED_CASES;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitGuardedCases(this, input);
    }

    public ImmutableList<GuardedBranch> branches() {
      return branches;
    }
  }

  /** One line of a {@link GuardedCases}, {@code expr if guard} or {@code expr otherwise}. */
  public static class GuardedBranch extends Tree {
    private final Expression expression;
    private final @Nullable Expression guard;

    public GuardedBranch(int line, int column, Expression expression, @Nullable Expression guard) {
      super(line, column);
      this.expression = requireNonNull(expression);
      this.guard = guard;
    }

    @Override
    public Kind kind() {
      return Kind.GUARDED_BRANCH;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitGuardedBranch(this, input);
    }

    public Expression expression() {
      return expression;
    }

    /** The guard, or {@code null} for an {@code otherwise} branch. */
    public @Nullable Expression guard() {
      return guard;
    }
  }

  /** A section {@code === Title ===} and the items up to the next section. */
  public static class Section extends Tree {
    private final String title;
    private final ImmutableList<Tree> items;

    public Section(int line, int column, String title, ImmutableList<Tree> items) {
      super(line, column);
      this.title = requireNonNull(title);
      this.items = requireNonNull(items);
    }

    @Override
    public Kind kind() {
      return Kind.SECTION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSection(this, input);
    }

    public String title() {
      return title;
    }

    public ImmutableList<Tree> items() {
      return items;
    }
  }

  /** A solution {@code ** Solution 1 **} and the items up to the next solution or section. */
  public static class Solution extends Tree {
    private final String title;
    private final ImmutableList<Tree> items;

    public Solution(int line, int column, String title, ImmutableList<Tree> items) {
      super(line, column);
      this.title = requireNonNull(title);
      this.items = requireNonNull(items);
    }

    @Override
    public Kind kind() {
      return Kind.SOLUTION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSolution(this, input);
    }

    public String title() {
      return title;
    }

    public ImmutableList<Tree> items() {
      return items;
    }
  }

  /** A part {@code (a)} and the items up to the next part, solution or section. */
  public static class Part extends Tree {
    private final String label;
    private final ImmutableList<Tree> items;

    public Part(int line, int column, String label, ImmutableList<Tree> items) {
      super(line, column);
      this.label = requireNonNull(label);
      this.items = requireNonNull(items);
    }

    @Override
    public Kind kind() {
      return Kind.PART;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitPart(this, input);
    }

    /** The part letter, without parentheses. */
    public String label() {
      return label;
    }

    public ImmutableList<Tree> items() {
      return items;
    }
  }

  /** Prose from a {@code TEXT:} block; inline formulas are found later. */
  public static class Paragraph extends Tree {
    private final String text;

    public Paragraph(int line, int column, String text) {
      super(line, column);
      this.text = requireNonNull(text);
    }

    @Override
    public Kind kind() {
      return Kind.PARAGRAPH;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitParagraph(this, input);
    }

    public String text() {
      return text;
    }
  }

  /** Prose from a {@code PURETEXT:} block, which is never scanned for formulas. */
  public static class PureParagraph extends Tree {
    private final String text;

    public PureParagraph(int line, int column, String text) {
      super(line, column);
      this.text = requireNonNull(text);
    }

    @Override
    public Kind kind() {
      return Kind.PURE_PARAGRAPH;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitPureParagraph(this, input);
    }

    public String text() {
      return text;
    }
  }

  /** Raw LaTeX from a {@code LATEX:} block. */
  public static class LatexBlock extends Tree {
    private final String latex;

    public LatexBlock(int line, int column, String latex) {
      super(line, column);
      this.latex = requireNonNull(latex);
    }

    @Override
    public Kind kind() {
      return Kind.LATEX_BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLatexBlock(this, input);
    }

    public String latex() {
      return latex;
    }
  }

  /** {@code PAGEBREAK:} */
  public static class PageBreak extends Tree {
    public PageBreak(int line, int column) {
      super(line, column);
    }

    @Override
    public Kind kind() {
      return Kind.PAGE_BREAK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitPageBreak(this, input);
    }
  }

  /** {@code CONTENTS:}, with an optional depth such as {@code full} or {@code 2}. */
  public static class Contents extends Tree {
    private final String depth;

    public Contents(int line, int column, String depth) {
      super(line, column);
      this.depth = requireNonNull(depth);
    }

    @Override
    public Kind kind() {
      return Kind.CONTENTS;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitContents(this, input);
    }

    /** The requested depth, or the empty string for sections only. */
    public String depth() {
      return depth;
    }
  }

  /** {@code PARTS:}, selecting how parts are laid out. */
  public static class PartsFormat extends Tree {
    private final String style;

    public PartsFormat(int line, int column, String style) {
      super(line, column);
      this.style = requireNonNull(style);
    }

    @Override
    public Kind kind() {
      return Kind.PARTS_FORMAT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitPartsFormat(this, input);
    }

    public String style() {
      return style;
    }
  }

  /** A basic type declaration {@code given A, B}. */
  public static class GivenType extends Tree {
    private final ImmutableList<String> names;

    public GivenType(int line, int column, ImmutableList<String> names) {
      super(line, column);
      this.names = requireNonNull(names);
    }

    @Override
    public Kind kind() {
      return Kind.GIVEN_TYPE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitGivenType(this, input);
    }

    public ImmutableList<String> names() {
      return names;
    }
  }

  /** A free type {@code Tree ::= leaf<N> | branch<Tree × Tree>}. */
  public static class FreeType extends Tree {
    private final String name;
    private final ImmutableList<FreeBranch> branches;

    public FreeType(int line, int column, String name, ImmutableList<FreeBranch> branches) {
      super(line, column);
      this.name = requireNonNull(name);
      this.branches = requireNonNull(branches);
    }

    @Override
    public Kind kind() {
      return Kind.FREE_TYPE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFreeType(this, input);
    }

    public String name() {
      return name;
    }

    public ImmutableList<FreeBranch> branches() {
      return branches;
    }
  }

  /** A free type constructor, with the type of its parameter if it takes one. */
  public static class FreeBranch extends Tree {
    private final String name;
    private final @Nullable Expression parameters;

    public FreeBranch(int line, int column, String name, @Nullable Expression parameters) {
      super(line, column);
      this.name = requireNonNull(name);
      this.parameters = parameters;
    }

    @Override
    public Kind kind() {
      return Kind.FREE_BRANCH;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFreeBranch(this, input);
    }

    public String name() {
      return name;
    }

    public @Nullable Expression parameters() {
      return parameters;
    }
  }

  /** An abbreviation definition {@code [X] Name == Expression}. */
  public static class Abbreviation extends Tree {
    private final String name;
    private final Expression expression;
    private final ImmutableList<String> genericParams;

    public Abbreviation(
        int line,
        int column,
        String name,
        Expression expression,
        ImmutableList<String> genericParams) {
      super(line, column);
      this.name = requireNonNull(name);
      this.expression = requireNonNull(expression);
      this.genericParams = requireNonNull(genericParams);
    }

    @Override
    public Kind kind() {
      return Kind.ABBREVIATION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitAbbreviation(this, input);
    }

    /** The defined name, which may be a compound name such as {@code R+}. */
    public String name() {
      return name;
    }

    public Expression expression() {
      return expression;
    }

    public ImmutableList<String> genericParams() {
      return genericParams;
    }
  }

  /** A declaration {@code variable : type} in a schema or definition. */
  public static class Declaration extends Tree {
    private final String variable;
    private final Expression type;

    public Declaration(int line, int column, String variable, Expression type) {
      super(line, column);
      this.variable = requireNonNull(variable);
      this.type = requireNonNull(type);
    }

    @Override
    public Kind kind() {
      return Kind.DECLARATION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitDeclaration(this, input);
    }

    public String variable() {
      return variable;
    }

    public Expression type() {
      return type;
    }
  }

  /** An axiomatic definition, {@code axdef ... where ... end}. */
  public static class AxDef extends Tree {
    private final ImmutableList<String> genericParams;
    private final ImmutableList<Declaration> declarations;
    private final ImmutableList<ImmutableList<Expression>> predicates;

    public AxDef(
        int line,
        int column,
        ImmutableList<String> genericParams,
        ImmutableList<Declaration> declarations,
        ImmutableList<ImmutableList<Expression>> predicates) {
      super(line, column);
      this.genericParams = requireNonNull(genericParams);
      this.declarations = requireNonNull(declarations);
      this.predicates = requireNonNull(predicates);
    }

    @Override
    public Kind kind() {
      return Kind.AX_DEF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitAxDef(this, input);
    }

    public ImmutableList<String> genericParams() {
      return genericParams;
    }

    public ImmutableList<Declaration> declarations() {
      return declarations;
    }

    /** The predicates, in groups separated by blank lines in the source. */
    public ImmutableList<ImmutableList<Expression>> predicates() {
      return predicates;
    }
  }

  /** A generic definition, {@code gendef [X] ... where ... end}. */
  public static class GenDef extends Tree {
    private final ImmutableList<String> genericParams;
    private final ImmutableList<Declaration> declarations;
    private final ImmutableList<ImmutableList<Expression>> predicates;

    public GenDef(
        int line,
        int column,
        ImmutableList<String> genericParams,
        ImmutableList<Declaration> declarations,
        ImmutableList<ImmutableList<Expression>> predicates) {
      super(line, column);
      this.genericParams = requireNonNull(genericParams);
      this.declarations = requireNonNull(declarations);
      this.predicates = requireNonNull(predicates);
    }

    @Override
    public Kind kind() {
      return Kind.GEN_DEF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitGenDef(this, input);
    }

    public ImmutableList<String> genericParams() {
      return genericParams;
    }

    public ImmutableList<Declaration> declarations() {
      return declarations;
    }

    public ImmutableList<ImmutableList<Expression>> predicates() {
      return predicates;
    }
  }

  /** A schema, {@code schema Name[X] ... where ... end}; anonymous schemas have no name. */
  public static class Schema extends Tree {
    private final @Nullable String name;
    private final ImmutableList<String> genericParams;
    private final ImmutableList<Declaration> declarations;
    private final ImmutableList<ImmutableList<Expression>> predicates;

    public Schema(
        int line,
        int column,
        @Nullable String name,
        ImmutableList<String> genericParams,
        ImmutableList<Declaration> declarations,
        ImmutableList<ImmutableList<Expression>> predicates) {
      super(line, column);
      this.name = name;
      this.genericParams = requireNonNull(genericParams);
      this.declarations = requireNonNull(declarations);
      this.predicates = requireNonNull(predicates);
    }

    @Override
    public Kind kind() {
      return Kind.SCHEMA;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSchema(this, input);
    }

    public @Nullable String name() {
      return name;
    }

    public ImmutableList<String> genericParams() {
      return genericParams;
    }

    public ImmutableList<Declaration> declarations() {
      return declarations;
    }

    public ImmutableList<ImmutableList<Expression>> predicates() {
      return predicates;
    }
  }

  /** An unboxed Z paragraph, {@code zed ... end}. */
  public static class Zed extends Tree {
    private final Tree content;

    public Zed(int line, int column, Tree content) {
      super(line, column);
      this.content = requireNonNull(content);
    }

    @Override
    public Kind kind() {
      return Kind.ZED;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitZed(this, input);
    }

    /** A single item, or a {@link Document} if the block holds several. */
    public Tree content() {
      return content;
    }
  }

  /** Aligned free type definitions, {@code syntax ... end}. */
  public static class SyntaxBlock extends Tree {
    private final ImmutableList<ImmutableList<SyntaxDefinition>> groups;

    public SyntaxBlock(
        int line, int column, ImmutableList<ImmutableList<SyntaxDefinition>> groups) {
      super(line, column);
      this.groups = requireNonNull(groups);
    }

    @Override
    public Kind kind() {
      return Kind.SYNTAX_BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSyntaxBlock(this, input);
    }

    /** The definitions, in groups separated by blank lines in the source. */
    public ImmutableList<ImmutableList<SyntaxDefinition>> groups() {
      return groups;
    }
  }

  /** One definition in a {@link SyntaxBlock}. */
  public static class SyntaxDefinition extends Tree {
    private final String name;
    private final ImmutableList<FreeBranch> branches;

    public SyntaxDefinition(
        int line, int column, String name, ImmutableList<FreeBranch> branches) {
      super(line, column);
      this.name = requireNonNull(name);
      this.branches = requireNonNull(branches);
    }

    @Override
    public Kind kind() {
      return Kind.SYNTAX_DEFINITION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSyntaxDefinition(this, input);
    }

    public String name() {
      return name;
    }

    public ImmutableList<FreeBranch> branches() {
      return branches;
    }
  }

  /** A truth table; values are normalized to {@code T} and {@code F}. */
  public static class TruthTable extends Tree {
    private final ImmutableList<String> headers;
    private final ImmutableList<ImmutableList<String>> rows;

    public TruthTable(
        int line,
        int column,
        ImmutableList<String> headers,
        ImmutableList<ImmutableList<String>> rows) {
      super(line, column);
      this.headers = requireNonNull(headers);
      this.rows = requireNonNull(rows);
    }

    @Override
    public Kind kind() {
      return Kind.TRUTH_TABLE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitTruthTable(this, input);
    }

    public ImmutableList<String> headers() {
      return headers;
    }

    public ImmutableList<ImmutableList<String>> rows() {
      return rows;
    }
  }

  /** An {@code EQUIV:} or {@code ARGUE:} chain of rewriting steps. */
  public static class EquivChain extends Tree {
    private final boolean argue;
    private final ImmutableList<EquivStep> steps;

    public EquivChain(int line, int column, boolean argue, ImmutableList<EquivStep> steps) {
      super(line, column);
      this.argue = argue;
      this.steps = requireNonNull(steps);
    }

    @Override
    public Kind kind() {
      return Kind.EQUIV_CHAIN;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitEquivChain(this, input);
    }

    /** True for {@code ARGUE:} chains. */
    public boolean argue() {
      return argue;
    }

    public ImmutableList<EquivStep> steps() {
      return steps;
    }
  }

  /** A step of an {@link EquivChain}. */
  public static class EquivStep extends Tree {
    private final Expression expression;
    private final @Nullable String justification;

    public EquivStep(int line, int column, Expression expression, @Nullable String justification) {
      super(line, column);
      this.expression = requireNonNull(expression);
      this.justification = justification;
    }

    @Override
    public Kind kind() {
      return Kind.EQUIV_STEP;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitEquivStep(this, input);
    }

    public Expression expression() {
      return expression;
    }

    public @Nullable String justification() {
      return justification;
    }
  }

  /** A natural deduction proof, {@code PROOF:} followed by an indented tree of steps. */
  public static class ProofTree extends Tree {
    private final ProofNode conclusion;

    public ProofTree(int line, int column, ProofNode conclusion) {
      super(line, column);
      this.conclusion = requireNonNull(conclusion);
    }

    @Override
    public Kind kind() {
      return Kind.PROOF_TREE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitProofTree(this, input);
    }

    public ProofNode conclusion() {
      return conclusion;
    }
  }

  /** A child of a {@link ProofNode}: either a further node or a case analysis. */
  public abstract static class ProofStep extends Tree {
    protected ProofStep(int line, int column) {
      super(line, column);
    }
  }

  /** A line of a proof tree. */
  public static class ProofNode extends ProofStep {
    private final Expression expression;
    private final @Nullable String justification;
    private final @Nullable Integer label;
    private final boolean assumption;
    private final boolean sibling;
    private final ImmutableList<ProofStep> children;
    private final int indentLevel;

    public ProofNode(
        int line,
        int column,
        Expression expression,
        @Nullable String justification,
        @Nullable Integer label,
        boolean assumption,
        boolean sibling,
        ImmutableList<ProofStep> children,
        int indentLevel) {
      super(line, column);
      this.expression = requireNonNull(expression);
      this.justification = justification;
      this.label = label;
      this.assumption = assumption;
      this.sibling = sibling;
      this.children = requireNonNull(children);
      this.indentLevel = indentLevel;
    }

    @Override
    public Kind kind() {
      return Kind.PROOF_NODE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitProofNode(this, input);
    }

    public Expression expression() {
      return expression;
    }

    public @Nullable String justification() {
      return justification;
    }

    /** The assumption label {@code [N]} the line starts with, if any. */
    public @Nullable Integer label() {
      return label;
    }

    /** True if the justification is {@code [assumption]}. */
    public boolean assumption() {
      return assumption;
    }

    /** True if the line was marked {@code ::}, as a sibling premise of the previous line. */
    public boolean sibling() {
      return sibling;
    }

    public ImmutableList<ProofStep> children() {
      return children;
    }

    /** The column offset of the line from the conclusion's column. */
    public int indentLevel() {
      return indentLevel;
    }
  }

  /** A case split inside a proof, {@code case p:} followed by the steps for that case. */
  public static class CaseAnalysis extends ProofStep {
    private final String caseName;
    private final ImmutableList<ProofNode> steps;

    public CaseAnalysis(int line, int column, String caseName, ImmutableList<ProofNode> steps) {
      super(line, column);
      this.caseName = requireNonNull(caseName);
      this.steps = requireNonNull(steps);
    }

    @Override
    public Kind kind() {
      return Kind.CASE_ANALYSIS;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCaseAnalysis(this, input);
    }

    public String caseName() {
      return caseName;
    }

    public ImmutableList<ProofNode> steps() {
      return steps;
    }
  }

  /** An inference rule, premises above a {@code ---} line and the conclusion below. */
  public static class InfruleBlock extends Tree {
    private final ImmutableList<InfruleLine> premises;
    private final InfruleLine conclusion;

    public InfruleBlock(
        int line, int column, ImmutableList<InfruleLine> premises, InfruleLine conclusion) {
      super(line, column);
      this.premises = requireNonNull(premises);
      this.conclusion = requireNonNull(conclusion);
    }

    @Override
    public Kind kind() {
      return Kind.INFRULE_BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitInfruleBlock(this, input);
    }

    public ImmutableList<InfruleLine> premises() {
      return premises;
    }

    public InfruleLine conclusion() {
      return conclusion;
    }
  }

  /** A premise or conclusion of an {@link InfruleBlock}, with an optional label. */
  public static class InfruleLine extends Tree {
    private final Expression expression;
    private final @Nullable String label;

    public InfruleLine(int line, int column, Expression expression, @Nullable String label) {
      super(line, column);
      this.expression = requireNonNull(expression);
      this.label = label;
    }

    @Override
    public Kind kind() {
      return Kind.INFRULE_LINE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitInfruleLine(this, input);
    }

    public Expression expression() {
      return expression;
    }

    public @Nullable String label() {
      return label;
    }
  }

  /** A visitor for {@link Tree}s. */
  public interface Visitor<I extends @Nullable Object, O extends @Nullable Object> {
    O visitDocument(Document document, I input);

    O visitIdentifier(Identifier identifier, I input);

    O visitNumber(Number number, I input);

    O visitBinaryOp(BinaryOp binaryOp, I input);

    O visitUnaryOp(UnaryOp unaryOp, I input);

    O visitQuantifier(Quantifier quantifier, I input);

    O visitLambda(Lambda lambda, I input);

    O visitSetLiteral(SetLiteral setLiteral, I input);

    O visitSetComprehension(SetComprehension setComprehension, I input);

    O visitSequenceLiteral(SequenceLiteral sequenceLiteral, I input);

    O visitBagLiteral(BagLiteral bagLiteral, I input);

    O visitTuple(Tuple tuple, I input);

    O visitTupleProjection(TupleProjection tupleProjection, I input);

    O visitFunctionApp(FunctionApp functionApp, I input);

    O visitFunctionType(FunctionType functionType, I input);

    O visitRelationalImage(RelationalImage relationalImage, I input);

    O visitGenericInstantiation(GenericInstantiation genericInstantiation, I input);

    O visitRange(Range range, I input);

    O visitConditional(Conditional conditional, I input);

    O visitSuperscript(Superscript superscript, I input);

    O visitGuardedCases(GuardedCases guardedCases, I input);

    O visitGuardedBranch(GuardedBranch guardedBranch, I input);

    O visitSection(Section section, I input);

    O visitSolution(Solution solution, I input);

    O visitPart(Part part, I input);

    O visitParagraph(Paragraph paragraph, I input);

    O visitPureParagraph(PureParagraph pureParagraph, I input);

    O visitLatexBlock(LatexBlock latexBlock, I input);

    O visitPageBreak(PageBreak pageBreak, I input);

    O visitContents(Contents contents, I input);

    O visitPartsFormat(PartsFormat partsFormat, I input);

    O visitGivenType(GivenType givenType, I input);

    O visitFreeType(FreeType freeType, I input);

    O visitFreeBranch(FreeBranch freeBranch, I input);

    O visitAbbreviation(Abbreviation abbreviation, I input);

    O visitDeclaration(Declaration declaration, I input);

    O visitAxDef(AxDef axDef, I input);

    O visitGenDef(GenDef genDef, I input);

    O visitSchema(Schema schema, I input);

    O visitZed(Zed zed, I input);

    O visitSyntaxBlock(SyntaxBlock syntaxBlock, I input);

    O visitSyntaxDefinition(SyntaxDefinition syntaxDefinition, I input);

    O visitTruthTable(TruthTable truthTable, I input);

    O visitEquivChain(EquivChain equivChain, I input);

    O visitEquivStep(EquivStep equivStep, I input);

    O visitProofTree(ProofTree proofTree, I input);

    O visitProofNode(ProofNode proofNode, I input);

    O visitCaseAnalysis(CaseAnalysis caseAnalysis, I input);

    O visitInfruleBlock(InfruleBlock infruleBlock, I input);

    O visitInfruleLine(InfruleLine infruleLine, I input);
  }
}
