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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** An error in txt2tex input, reported at a source line and column. */
public class Txt2texError extends Error {

  /** A diagnostic kind. */
  public enum ErrorKind {
    UNEXPECTED_CHARACTER(
        "Unexpected character: '%s'", "This character is not valid in txt2tex notation"),
    UNSPACED_CONCATENATION(
        "Sequence concatenation needs a space before '^': write '> ^ <' instead of '>^<'",
        "Without spaces '^' is read as an exponent"),
    EXPECTED_EXPRESSION("Expected expression, found %s", null),
    TRAILING_TOKEN(
        "Unexpected token after expression: %s", "Check for missing operators or extra characters"),
    EXPECTED_TOKEN("Expected %s", null),
    CHAINED_OPERATOR(
        "Operator %s cannot follow another operator of the same kind",
        "Comparisons and ranges do not chain: write (a < b) land (b < c)"),
    UNCLOSED(
        "Unclosed %s: expected %s",
        "Make sure all brackets, braces, and parentheses are balanced"),
    EXPECTED_IDENTIFIER("Expected identifier %s", "A variable or type name is required here"),
    MISSING_SECTION_CLOSE(
        "Expected closing '===' for section", "Section markers must match: === Title ==="),
    MISSING_SOLUTION_CLOSE(
        "Expected closing '**' for solution", "Solution markers must match: ** Solution N **"),
    EXPECTED_QUANTIFIER_VARIABLE("Expected variable name after %s", null),
    EXPECTED_QUANTIFIER_BAR("Expected '|' after quantifier binding", null),
    EXPECTED_COMPREHENSION_BAR("Expected '|' after set comprehension binding", null),
    UNCLOSED_COMPREHENSION(
        "Expected '}' to close set comprehension",
        "Make sure all brackets, braces, and parentheses are balanced"),
    INVALID_TUPLE_PATTERN("Tuple pattern in %s binding must contain only identifiers", null),
    EMPTY_TUPLE_PATTERN("Empty tuple pattern in %s binding", null),
    MISSING_END(
        "Expected 'end' to close %s block", "Did you forget 'end' before starting a new block?"),
    EXPECTED_SCHEMA_NAME("Expected schema name", null),
    EXPECTED_DECLARATION_COLON(
        "Expected ':' in declaration", "Type declarations need a colon between name and type"),
    EXPECTED_GIVEN_NAME("Expected type name in given declaration", null),
    EMPTY_GIVEN("Expected at least one type name in given declaration", null),
    EMPTY_FREE_TYPE("Expected at least one branch in free type definition", null),
    EXPECTED_BRANCH_NAME("Expected branch name in free type definition", null),
    UNCLOSED_GENERIC_PARAMETERS("Expected ']' to close generic parameter list", null),
    EXPECTED_ABBREVIATION_NAME("Expected identifier in abbreviation", null),
    EXPECTED_ABBREVIATION_DEFINITION("Expected '==' in abbreviation", null),
    MISSING_TRUTH_TABLE_HEADER("Expected truth table header row", null),
    EMPTY_TRUTH_TABLE_HEADERS("Expected truth table headers", null),
    INVALID_TRUTH_VALUE("Expected truth value T or F, found %s", null),
    UNCLOSED_JUSTIFICATION("Expected closing ']' for justification", null),
    EMPTY_CHAIN("Expected at least one step in %s chain", null),
    EXPECTED_PROOF_NODE("Expected proof node after PROOF:", null),
    EXPECTED_ASSUMPTION_LABEL("Expected number in assumption label", null),
    UNCLOSED_ASSUMPTION_LABEL("Expected ']' after assumption label", null),
    EXPECTED_CASE_NAME("Expected case name after 'case'", null),
    EXPECTED_CASE_COLON("Expected ':' after case name", null),
    EMPTY_INFRULE_PREMISES("Expected at least one premise in inference rule", null),
    MISSING_INFRULE_SEPARATOR("Expected '---' separator line in inference rule", null),
    MISSING_INFRULE_CONCLUSION("Expected conclusion after '---' in inference rule", null),
    EXPECTED_PROJECTION("Expected field name or index after '.'", null),
    MISSING_THEN("Expected 'then' in conditional expression", null),
    MISSING_ELSE("Expected 'else' in conditional expression", null),
    EXPECTED_GUARD("Expected 'if' or 'otherwise' in guarded case", null);

    private final String message;
    private final @Nullable String hint;

    ErrorKind(String message, @Nullable String hint) {
      this.message = message;
      this.hint = hint;
    }

    String format(Object... args) {
      return String.format(message, args);
    }

    /** A suggestion shown below the diagnostic, if any. */
    public @Nullable String hint() {
      return hint;
    }
  }

  private final ErrorKind kind;
  private final String message;
  private final int line;
  private final int column;
  private final ImmutableList<Object> args;

  protected Txt2texError(ErrorKind kind, int line, int column, Object... args) {
    this(kind, kind.format(args), line, column, ImmutableList.copyOf(args));
  }

  private Txt2texError(
      ErrorKind kind, String message, int line, int column, ImmutableList<Object> args) {
    super(String.format("Line %d, column %d: %s", line, column, message));
    checkArgument(line > 0 && column > 0, "invalid position %s:%s", line, column);
    this.kind = kind;
    this.message = message;
    this.line = line;
    this.column = column;
    this.args = args;
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic message, without position information. */
  public String message() {
    return message;
  }

  /** The one-indexed line of the error. */
  public int line() {
    return line;
  }

  /** The one-indexed column of the error. */
  public int column() {
    return column;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }
}
