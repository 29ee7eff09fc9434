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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.txt2tex.tree.Tree.Abbreviation;
import com.google.txt2tex.tree.Tree.AxDef;
import com.google.txt2tex.tree.Tree.BagLiteral;
import com.google.txt2tex.tree.Tree.BinaryOp;
import com.google.txt2tex.tree.Tree.CaseAnalysis;
import com.google.txt2tex.tree.Tree.Conditional;
import com.google.txt2tex.tree.Tree.Contents;
import com.google.txt2tex.tree.Tree.Declaration;
import com.google.txt2tex.tree.Tree.Document;
import com.google.txt2tex.tree.Tree.EquivChain;
import com.google.txt2tex.tree.Tree.EquivStep;
import com.google.txt2tex.tree.Tree.Expression;
import com.google.txt2tex.tree.Tree.FreeBranch;
import com.google.txt2tex.tree.Tree.FreeType;
import com.google.txt2tex.tree.Tree.FunctionApp;
import com.google.txt2tex.tree.Tree.FunctionType;
import com.google.txt2tex.tree.Tree.GenDef;
import com.google.txt2tex.tree.Tree.GenericInstantiation;
import com.google.txt2tex.tree.Tree.GivenType;
import com.google.txt2tex.tree.Tree.GuardedBranch;
import com.google.txt2tex.tree.Tree.GuardedCases;
import com.google.txt2tex.tree.Tree.Identifier;
import com.google.txt2tex.tree.Tree.InfruleBlock;
import com.google.txt2tex.tree.Tree.InfruleLine;
import com.google.txt2tex.tree.Tree.Lambda;
import com.google.txt2tex.tree.Tree.LatexBlock;
import com.google.txt2tex.tree.Tree.PageBreak;
import com.google.txt2tex.tree.Tree.Paragraph;
import com.google.txt2tex.tree.Tree.Part;
import com.google.txt2tex.tree.Tree.PartsFormat;
import com.google.txt2tex.tree.Tree.ProofNode;
import com.google.txt2tex.tree.Tree.ProofTree;
import com.google.txt2tex.tree.Tree.PureParagraph;
import com.google.txt2tex.tree.Tree.Quantifier;
import com.google.txt2tex.tree.Tree.Range;
import com.google.txt2tex.tree.Tree.RelationalImage;
import com.google.txt2tex.tree.Tree.Schema;
import com.google.txt2tex.tree.Tree.Section;
import com.google.txt2tex.tree.Tree.SequenceLiteral;
import com.google.txt2tex.tree.Tree.SetComprehension;
import com.google.txt2tex.tree.Tree.SetLiteral;
import com.google.txt2tex.tree.Tree.Solution;
import com.google.txt2tex.tree.Tree.Superscript;
import com.google.txt2tex.tree.Tree.SyntaxBlock;
import com.google.txt2tex.tree.Tree.SyntaxDefinition;
import com.google.txt2tex.tree.Tree.TruthTable;
import com.google.txt2tex.tree.Tree.Tuple;
import com.google.txt2tex.tree.Tree.TupleProjection;
import com.google.txt2tex.tree.Tree.UnaryOp;
import com.google.txt2tex.tree.Tree.Zed;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A pretty-printer for {@link Tree}s.
 *
 * <p>Expressions are printed fully parenthesized, so the output shows how an expression was
 * grouped. Block structure is printed one item per line, with nested items indented.
 */
public class Pretty implements Tree.Visitor<@Nullable Void, @Nullable Void> {

  public static String pretty(Tree tree) {
    Pretty pretty = new Pretty();
    tree.accept(pretty, null);
    return CharMatcher.is('\n').trimTrailingFrom(pretty.sb);
  }

  private final StringBuilder sb = new StringBuilder();
  int indent = 0;
  boolean newLine = false;

  void printLine() {
    append('\n');
    newLine = true;
  }

  Pretty append(char c) {
    if (c == '\n') {
      newLine = true;
    } else if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(c);
    return this;
  }

  Pretty append(String s) {
    if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(s);
    return this;
  }

  /** Appends text that may span several lines, indenting each line. */
  private void appendLines(String text) {
    boolean first = true;
    for (String line : Splitter.on('\n').split(text)) {
      if (!first) {
        printLine();
      }
      first = false;
      append(line);
    }
  }

  private void printItems(List<? extends Tree> items) {
    indent++;
    for (Tree item : items) {
      printLine();
      item.accept(this, null);
    }
    indent--;
  }

  private void printList(String open, List<? extends Expression> elements, String close) {
    append(open);
    boolean first = true;
    for (Expression element : elements) {
      if (!first) {
        append(", ");
      }
      first = false;
      element.accept(this, null);
    }
    append(close);
  }

  private void printGenericParams(ImmutableList<String> params) {
    if (!params.isEmpty()) {
      append('[').append(Joiner.on(", ").join(params)).append(']');
    }
  }

  private void printParagraphBody(
      ImmutableList<Declaration> declarations,
      ImmutableList<ImmutableList<Expression>> predicates) {
    printItems(declarations);
    if (!predicates.isEmpty()) {
      printLine();
      append("where");
      boolean first = true;
      indent++;
      for (ImmutableList<Expression> group : predicates) {
        if (!first) {
          printLine();
        }
        first = false;
        for (Expression predicate : group) {
          printLine();
          predicate.accept(this, null);
        }
      }
      indent--;
    }
    printLine();
    append("end");
  }

  private void printJustification(@Nullable String justification) {
    if (justification != null) {
      append(" [").append(justification).append(']');
    }
  }

  @Override
  public @Nullable Void visitDocument(Document document, @Nullable Void input) {
    boolean first = true;
    for (Tree item : document.items()) {
      if (!first) {
        printLine();
      }
      first = false;
      item.accept(this, null);
    }
    return null;
  }

  @Override
  public @Nullable Void visitIdentifier(Identifier identifier, @Nullable Void input) {
    append(identifier.name());
    return null;
  }

  @Override
  public @Nullable Void visitNumber(Tree.Number number, @Nullable Void input) {
    append(number.value());
    return null;
  }

  @Override
  public @Nullable Void visitBinaryOp(BinaryOp binaryOp, @Nullable Void input) {
    append('(');
    binaryOp.left().accept(this, null);
    append(' ').append(binaryOp.operator()).append(' ');
    binaryOp.right().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitUnaryOp(UnaryOp unaryOp, @Nullable Void input) {
    if (unaryOp.postfix()) {
      unaryOp.operand().accept(this, null);
      append(unaryOp.operator());
      return null;
    }
    append(unaryOp.operator());
    if (Character.isLetterOrDigit(unaryOp.operator().charAt(0))) {
      append(' ');
    }
    unaryOp.operand().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitQuantifier(Quantifier quantifier, @Nullable Void input) {
    append('(').append(quantifier.quantifier()).append(' ');
    if (quantifier.tuplePattern()) {
      append('(').append(Joiner.on(", ").join(quantifier.variables())).append(')');
    } else {
      append(Joiner.on(", ").join(quantifier.variables()));
    }
    if (quantifier.domain() != null) {
      append(" : ");
      quantifier.domain().accept(this, null);
    }
    if (quantifier.body() != null) {
      append(" | ");
      quantifier.body().accept(this, null);
    }
    if (quantifier.expression() != null) {
      append(" . ");
      quantifier.expression().accept(this, null);
    }
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitLambda(Lambda lambda, @Nullable Void input) {
    append("(lambda ").append(Joiner.on(", ").join(lambda.variables()));
    if (lambda.domain() != null) {
      append(" : ");
      lambda.domain().accept(this, null);
    }
    append(" . ");
    lambda.body().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitSetLiteral(SetLiteral setLiteral, @Nullable Void input) {
    printList("{", setLiteral.elements(), "}");
    return null;
  }

  @Override
  public @Nullable Void visitSetComprehension(
      SetComprehension setComprehension, @Nullable Void input) {
    append('{').append(Joiner.on(", ").join(setComprehension.variables()));
    if (setComprehension.domain() != null) {
      append(" : ");
      setComprehension.domain().accept(this, null);
    }
    if (setComprehension.predicate() != null) {
      append(" | ");
      setComprehension.predicate().accept(this, null);
    }
    if (setComprehension.expression() != null) {
      append(" . ");
      setComprehension.expression().accept(this, null);
    }
    append('}');
    return null;
  }

  @Override
  public @Nullable Void visitSequenceLiteral(
      SequenceLiteral sequenceLiteral, @Nullable Void input) {
    printList("<", sequenceLiteral.elements(), ">");
    return null;
  }

  @Override
  public @Nullable Void visitBagLiteral(BagLiteral bagLiteral, @Nullable Void input) {
    printList("[[", bagLiteral.elements(), "]]");
    return null;
  }

  @Override
  public @Nullable Void visitTuple(Tuple tuple, @Nullable Void input) {
    printList("(", tuple.elements(), ")");
    return null;
  }

  @Override
  public @Nullable Void visitTupleProjection(
      TupleProjection tupleProjection, @Nullable Void input) {
    tupleProjection.base().accept(this, null);
    append('.').append(tupleProjection.field());
    return null;
  }

  @Override
  public @Nullable Void visitFunctionApp(FunctionApp functionApp, @Nullable Void input) {
    functionApp.function().accept(this, null);
    printList("(", functionApp.args(), ")");
    return null;
  }

  @Override
  public @Nullable Void visitFunctionType(FunctionType functionType, @Nullable Void input) {
    append('(');
    functionType.domain().accept(this, null);
    append(' ').append(functionType.arrow()).append(' ');
    functionType.range().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitRelationalImage(
      RelationalImage relationalImage, @Nullable Void input) {
    relationalImage.relation().accept(this, null);
    append("(| ");
    relationalImage.set().accept(this, null);
    append(" |)");
    return null;
  }

  @Override
  public @Nullable Void visitGenericInstantiation(
      GenericInstantiation genericInstantiation, @Nullable Void input) {
    genericInstantiation.base().accept(this, null);
    printList("[", genericInstantiation.params(), "]");
    return null;
  }

  @Override
  public @Nullable Void visitRange(Range range, @Nullable Void input) {
    append('(');
    range.start().accept(this, null);
    append(" .. ");
    range.end().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitConditional(Conditional conditional, @Nullable Void input) {
    append("(if ");
    conditional.condition().accept(this, null);
    append(" then ");
    conditional.thenExpr().accept(this, null);
    append(" else ");
    conditional.elseExpr().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitSuperscript(Superscript superscript, @Nullable Void input) {
    append('(');
    superscript.base().accept(this, null);
    append('^');
    superscript.exponent().accept(this, null);
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitGuardedCases(GuardedCases guardedCases, @Nullable Void input) {
    append("cases {");
    boolean first = true;
    for (GuardedBranch branch : guardedCases.branches()) {
      append(first ? " " : "; ");
      first = false;
      branch.accept(this, null);
    }
    append(" }");
    return null;
  }

  @Override
  public @Nullable Void visitGuardedBranch(GuardedBranch guardedBranch, @Nullable Void input) {
    guardedBranch.expression().accept(this, null);
    if (guardedBranch.guard() == null) {
      append(" otherwise");
    } else {
      append(" if ");
      guardedBranch.guard().accept(this, null);
    }
    return null;
  }

  @Override
  public @Nullable Void visitSection(Section section, @Nullable Void input) {
    append("=== ").append(section.title()).append(" ===");
    printItems(section.items());
    return null;
  }

  @Override
  public @Nullable Void visitSolution(Solution solution, @Nullable Void input) {
    append("** ").append(solution.title()).append(" **");
    printItems(solution.items());
    return null;
  }

  @Override
  public @Nullable Void visitPart(Part part, @Nullable Void input) {
    append('(').append(part.label()).append(')');
    printItems(part.items());
    return null;
  }

  @Override
  public @Nullable Void visitParagraph(Paragraph paragraph, @Nullable Void input) {
    append("TEXT: ");
    appendLines(paragraph.text());
    return null;
  }

  @Override
  public @Nullable Void visitPureParagraph(PureParagraph pureParagraph, @Nullable Void input) {
    append("PURETEXT: ");
    appendLines(pureParagraph.text());
    return null;
  }

  @Override
  public @Nullable Void visitLatexBlock(LatexBlock latexBlock, @Nullable Void input) {
    append("LATEX: ");
    appendLines(latexBlock.latex());
    return null;
  }

  @Override
  public @Nullable Void visitPageBreak(PageBreak pageBreak, @Nullable Void input) {
    append("PAGEBREAK:");
    return null;
  }

  @Override
  public @Nullable Void visitContents(Contents contents, @Nullable Void input) {
    append("CONTENTS:");
    if (!contents.depth().isEmpty()) {
      append(' ').append(contents.depth());
    }
    return null;
  }

  @Override
  public @Nullable Void visitPartsFormat(PartsFormat partsFormat, @Nullable Void input) {
    append("PARTS: ").append(partsFormat.style());
    return null;
  }

  @Override
  public @Nullable Void visitGivenType(GivenType givenType, @Nullable Void input) {
    append("given ").append(Joiner.on(", ").join(givenType.names()));
    return null;
  }

  @Override
  public @Nullable Void visitFreeType(FreeType freeType, @Nullable Void input) {
    append(freeType.name()).append(" ::= ");
    printBranches(freeType.branches());
    return null;
  }

  private void printBranches(ImmutableList<FreeBranch> branches) {
    boolean first = true;
    for (FreeBranch branch : branches) {
      if (!first) {
        append(" | ");
      }
      first = false;
      branch.accept(this, null);
    }
  }

  @Override
  public @Nullable Void visitFreeBranch(FreeBranch freeBranch, @Nullable Void input) {
    append(freeBranch.name());
    if (freeBranch.parameters() != null) {
      append('<');
      freeBranch.parameters().accept(this, null);
      append('>');
    }
    return null;
  }

  @Override
  public @Nullable Void visitAbbreviation(Abbreviation abbreviation, @Nullable Void input) {
    if (!abbreviation.genericParams().isEmpty()) {
      printGenericParams(abbreviation.genericParams());
      append(' ');
    }
    append(abbreviation.name()).append(" == ");
    abbreviation.expression().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitDeclaration(Declaration declaration, @Nullable Void input) {
    append(declaration.variable()).append(" : ");
    declaration.type().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitAxDef(AxDef axDef, @Nullable Void input) {
    append("axdef");
    if (!axDef.genericParams().isEmpty()) {
      append(' ');
      printGenericParams(axDef.genericParams());
    }
    printParagraphBody(axDef.declarations(), axDef.predicates());
    return null;
  }

  @Override
  public @Nullable Void visitGenDef(GenDef genDef, @Nullable Void input) {
    append("gendef ");
    printGenericParams(genDef.genericParams());
    printParagraphBody(genDef.declarations(), genDef.predicates());
    return null;
  }

  @Override
  public @Nullable Void visitSchema(Schema schema, @Nullable Void input) {
    append("schema");
    if (schema.name() != null) {
      append(' ').append(schema.name());
    }
    printGenericParams(schema.genericParams());
    printParagraphBody(schema.declarations(), schema.predicates());
    return null;
  }

  @Override
  public @Nullable Void visitZed(Zed zed, @Nullable Void input) {
    append("zed");
    printItems(ImmutableList.of(zed.content()));
    printLine();
    append("end");
    return null;
  }

  @Override
  public @Nullable Void visitSyntaxBlock(SyntaxBlock syntaxBlock, @Nullable Void input) {
    append("syntax");
    boolean first = true;
    for (ImmutableList<SyntaxDefinition> group : syntaxBlock.groups()) {
      if (!first) {
        printLine();
      }
      first = false;
      printItems(group);
    }
    printLine();
    append("end");
    return null;
  }

  @Override
  public @Nullable Void visitSyntaxDefinition(
      SyntaxDefinition syntaxDefinition, @Nullable Void input) {
    append(syntaxDefinition.name()).append(" ::= ");
    printBranches(syntaxDefinition.branches());
    return null;
  }

  @Override
  public @Nullable Void visitTruthTable(TruthTable truthTable, @Nullable Void input) {
    append("TRUTH TABLE:");
    indent++;
    printLine();
    append(Joiner.on(" | ").join(truthTable.headers()));
    for (ImmutableList<String> row : truthTable.rows()) {
      printLine();
      append(Joiner.on(" | ").join(row));
    }
    indent--;
    return null;
  }

  @Override
  public @Nullable Void visitEquivChain(EquivChain equivChain, @Nullable Void input) {
    append(equivChain.argue() ? "ARGUE:" : "EQUIV:");
    printItems(equivChain.steps());
    return null;
  }

  @Override
  public @Nullable Void visitEquivStep(EquivStep equivStep, @Nullable Void input) {
    equivStep.expression().accept(this, null);
    printJustification(equivStep.justification());
    return null;
  }

  @Override
  public @Nullable Void visitProofTree(ProofTree proofTree, @Nullable Void input) {
    append("PROOF:");
    printItems(ImmutableList.of(proofTree.conclusion()));
    return null;
  }

  @Override
  public @Nullable Void visitProofNode(ProofNode proofNode, @Nullable Void input) {
    if (proofNode.sibling()) {
      append(":: ");
    }
    if (proofNode.label() != null) {
      append('[').append(String.valueOf(proofNode.label())).append("] ");
    }
    proofNode.expression().accept(this, null);
    printJustification(proofNode.justification());
    printItems(proofNode.children());
    return null;
  }

  @Override
  public @Nullable Void visitCaseAnalysis(CaseAnalysis caseAnalysis, @Nullable Void input) {
    append("case ").append(caseAnalysis.caseName()).append(':');
    printItems(caseAnalysis.steps());
    return null;
  }

  @Override
  public @Nullable Void visitInfruleBlock(InfruleBlock infruleBlock, @Nullable Void input) {
    append("INFRULE:");
    printItems(infruleBlock.premises());
    indent++;
    printLine();
    append("---");
    printLine();
    infruleBlock.conclusion().accept(this, null);
    indent--;
    return null;
  }

  @Override
  public @Nullable Void visitInfruleLine(InfruleLine infruleLine, @Nullable Void input) {
    infruleLine.expression().accept(this, null);
    printJustification(infruleLine.label());
    return null;
  }
}
