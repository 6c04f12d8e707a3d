// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pycst.java.syntax;

import javax.annotation.Nullable;

/**
 * A traversal that rebuilds a syntax tree, in source order.
 *
 * <p>Each {@code leave} overload receives the node as it was in the input tree and the node as
 * rebuilt from its already transformed children, and returns the node to put in its place. The
 * two are the same instance when nothing below changed. Returning null removes the node from a
 * sequence or an optional slot; removing a required child fails with {@link
 * InvalidNodeException}. Use {@link Node#visit(CstTransformer)} to start a traversal.
 *
 * <p>Only the changed nodes and their ancestors are rebuilt. Everything else in the result is
 * shared with the input tree.
 */
public abstract class CstTransformer extends CstVisitFunctions {

  /**
   * Called on leaving any node, after its children. Returns the replacement for {@code original},
   * or null to remove it.
   */
  @Nullable
  public Node onLeave(Node original, Node updated) {
    if (original.kind() != updated.kind()) {
      // Rebuilding a node never changes its kind.
      throw new IllegalStateException(original.kind() + " rebuilt as " + updated.kind());
    }
    switch (original.kind()) {
      case SIMPLE_WHITESPACE:
        return leave((SimpleWhitespace) original, (SimpleWhitespace) updated);
      case PARENTHESIZED_WHITESPACE:
        return leave((ParenthesizedWhitespace) original, (ParenthesizedWhitespace) updated);
      case COMMENT:
        return leave((Comment) original, (Comment) updated);
      case NEWLINE:
        return leave((Newline) original, (Newline) updated);
      case TRAILING_WHITESPACE:
        return leave((TrailingWhitespace) original, (TrailingWhitespace) updated);
      case EMPTY_LINE:
        return leave((EmptyLine) original, (EmptyLine) updated);
      case MODULE:
        return leave((Module) original, (Module) updated);
      case SIMPLE_STATEMENT_LINE:
        return leave((SimpleStatementLine) original, (SimpleStatementLine) updated);
      case SIMPLE_STATEMENT_SUITE:
        return leave((SimpleStatementSuite) original, (SimpleStatementSuite) updated);
      case INDENTED_BLOCK:
        return leave((IndentedBlock) original, (IndentedBlock) updated);
      case EXPRESSION_STATEMENT:
        return leave((ExpressionStatement) original, (ExpressionStatement) updated);
      case ASSIGN_STATEMENT:
        return leave((AssignStatement) original, (AssignStatement) updated);
      case ANNOTATED_ASSIGN_STATEMENT:
        return leave((AnnotatedAssignStatement) original, (AnnotatedAssignStatement) updated);
      case AUGMENTED_ASSIGN_STATEMENT:
        return leave((AugmentedAssignStatement) original, (AugmentedAssignStatement) updated);
      case FLOW_STATEMENT:
        return leave((FlowStatement) original, (FlowStatement) updated);
      case RETURN_STATEMENT:
        return leave((ReturnStatement) original, (ReturnStatement) updated);
      case RAISE_STATEMENT:
        return leave((RaiseStatement) original, (RaiseStatement) updated);
      case ASSERT_STATEMENT:
        return leave((AssertStatement) original, (AssertStatement) updated);
      case DEL_STATEMENT:
        return leave((DelStatement) original, (DelStatement) updated);
      case GLOBAL_STATEMENT:
        return leave((GlobalStatement) original, (GlobalStatement) updated);
      case IMPORT_STATEMENT:
        return leave((ImportStatement) original, (ImportStatement) updated);
      case IMPORT_FROM_STATEMENT:
        return leave((ImportFromStatement) original, (ImportFromStatement) updated);
      case IF_STATEMENT:
        return leave((IfStatement) original, (IfStatement) updated);
      case ELSE_CLAUSE:
        return leave((ElseClause) original, (ElseClause) updated);
      case WHILE_STATEMENT:
        return leave((WhileStatement) original, (WhileStatement) updated);
      case FOR_STATEMENT:
        return leave((ForStatement) original, (ForStatement) updated);
      case TRY_STATEMENT:
        return leave((TryStatement) original, (TryStatement) updated);
      case EXCEPT_HANDLER:
        return leave((ExceptHandler) original, (ExceptHandler) updated);
      case FINALLY_CLAUSE:
        return leave((FinallyClause) original, (FinallyClause) updated);
      case WITH_STATEMENT:
        return leave((WithStatement) original, (WithStatement) updated);
      case WITH_ITEM:
        return leave((WithItem) original, (WithItem) updated);
      case FUNCTION_DEF:
        return leave((FunctionDef) original, (FunctionDef) updated);
      case CLASS_DEF:
        return leave((ClassDef) original, (ClassDef) updated);
      case DECORATOR:
        return leave((Decorator) original, (Decorator) updated);
      case ASYNCHRONOUS:
        return leave((Asynchronous) original, (Asynchronous) updated);
      case NAME:
        return leave((Name) original, (Name) updated);
      case INT_LITERAL:
        return leave((IntLiteral) original, (IntLiteral) updated);
      case FLOAT_LITERAL:
        return leave((FloatLiteral) original, (FloatLiteral) updated);
      case IMAGINARY_LITERAL:
        return leave((ImaginaryLiteral) original, (ImaginaryLiteral) updated);
      case STRING_LITERAL:
        return leave((StringLiteral) original, (StringLiteral) updated);
      case FORMATTED_STRING:
        return leave((FormattedString) original, (FormattedString) updated);
      case CONCATENATED_STRING:
        return leave((ConcatenatedString) original, (ConcatenatedString) updated);
      case ELLIPSIS:
        return leave((Ellipsis) original, (Ellipsis) updated);
      case ATTRIBUTE:
        return leave((Attribute) original, (Attribute) updated);
      case SUBSCRIPT:
        return leave((Subscript) original, (Subscript) updated);
      case CALL:
        return leave((Call) original, (Call) updated);
      case BINARY_OPERATION:
        return leave((BinaryOperation) original, (BinaryOperation) updated);
      case UNARY_OPERATION:
        return leave((UnaryOperation) original, (UnaryOperation) updated);
      case BOOLEAN_OPERATION:
        return leave((BooleanOperation) original, (BooleanOperation) updated);
      case COMPARISON:
        return leave((Comparison) original, (Comparison) updated);
      case CONDITIONAL_EXPRESSION:
        return leave((ConditionalExpression) original, (ConditionalExpression) updated);
      case LAMBDA:
        return leave((Lambda) original, (Lambda) updated);
      case NAMED_EXPRESSION:
        return leave((NamedExpression) original, (NamedExpression) updated);
      case AWAIT:
        return leave((Await) original, (Await) updated);
      case YIELD:
        return leave((Yield) original, (Yield) updated);
      case TUPLE_EXPRESSION:
        return leave((TupleExpression) original, (TupleExpression) updated);
      case LIST_EXPRESSION:
        return leave((ListExpression) original, (ListExpression) updated);
      case SET_EXPRESSION:
        return leave((SetExpression) original, (SetExpression) updated);
      case DICT_EXPRESSION:
        return leave((DictExpression) original, (DictExpression) updated);
      case LIST_COMPREHENSION:
        return leave((ListComprehension) original, (ListComprehension) updated);
      case SET_COMPREHENSION:
        return leave((SetComprehension) original, (SetComprehension) updated);
      case DICT_COMPREHENSION:
        return leave((DictComprehension) original, (DictComprehension) updated);
      case GENERATOR_EXPRESSION:
        return leave((GeneratorExpression) original, (GeneratorExpression) updated);
      case SUBSCRIPT_ELEMENT:
        return leave((SubscriptElement) original, (SubscriptElement) updated);
      case INDEX:
        return leave((Index) original, (Index) updated);
      case SLICE:
        return leave((Slice) original, (Slice) updated);
      case ARGUMENT:
        return leave((Argument) original, (Argument) updated);
      case COMPARISON_TARGET:
        return leave((ComparisonTarget) original, (ComparisonTarget) updated);
      case FROM_CLAUSE:
        return leave((FromClause) original, (FromClause) updated);
      case ELEMENT:
        return leave((Element) original, (Element) updated);
      case STARRED_ELEMENT:
        return leave((StarredElement) original, (StarredElement) updated);
      case DICT_ELEMENT:
        return leave((DictElement) original, (DictElement) updated);
      case STARRED_DICT_ELEMENT:
        return leave((StarredDictElement) original, (StarredDictElement) updated);
      case COMPREHENSION_FOR:
        return leave((ComprehensionFor) original, (ComprehensionFor) updated);
      case COMPREHENSION_IF:
        return leave((ComprehensionIf) original, (ComprehensionIf) updated);
      case PARAMETERS:
        return leave((Parameters) original, (Parameters) updated);
      case PARAMETER:
        return leave((Parameter) original, (Parameter) updated);
      case PARAM_STAR:
        return leave((ParamStar) original, (ParamStar) updated);
      case PARAM_SLASH:
        return leave((ParamSlash) original, (ParamSlash) updated);
      case ANNOTATION:
        return leave((Annotation) original, (Annotation) updated);
      case LEFT_PAREN:
        return leave((LeftParen) original, (LeftParen) updated);
      case RIGHT_PAREN:
        return leave((RightParen) original, (RightParen) updated);
      case LEFT_BRACKET:
        return leave((LeftBracket) original, (LeftBracket) updated);
      case RIGHT_BRACKET:
        return leave((RightBracket) original, (RightBracket) updated);
      case COMMA:
        return leave((Comma) original, (Comma) updated);
      case DOT:
        return leave((Dot) original, (Dot) updated);
      case COLON:
        return leave((Colon) original, (Colon) updated);
      case SEMICOLON:
        return leave((Semicolon) original, (Semicolon) updated);
      case ASSIGN_EQUAL:
        return leave((AssignEqual) original, (AssignEqual) updated);
      case ASSIGN_TARGET:
        return leave((AssignTarget) original, (AssignTarget) updated);
      case AS_NAME:
        return leave((AsName) original, (AsName) updated);
      case NAME_ITEM:
        return leave((NameItem) original, (NameItem) updated);
      case IMPORT_ALIAS:
        return leave((ImportAlias) original, (ImportAlias) updated);
      case IMPORT_STAR:
        return leave((ImportStar) original, (ImportStar) updated);
      case BINARY_OPERATOR:
        return leave((BinaryOperator) original, (BinaryOperator) updated);
      case UNARY_OPERATOR:
        return leave((UnaryOperator) original, (UnaryOperator) updated);
      case BOOLEAN_OPERATOR:
        return leave((BooleanOperator) original, (BooleanOperator) updated);
      case COMPARISON_OPERATOR:
        return leave((ComparisonOperator) original, (ComparisonOperator) updated);
      case AUGMENTED_OPERATOR:
        return leave((AugmentedOperator) original, (AugmentedOperator) updated);
    }
    throw new IllegalStateException("unknown kind: " + original.kind());
  }

  @Nullable
  public ParenthesizableWhitespace leave(SimpleWhitespace original, SimpleWhitespace updated) {
    return updated;
  }

  @Nullable
  public ParenthesizableWhitespace leave(
      ParenthesizedWhitespace original, ParenthesizedWhitespace updated) {
    return updated;
  }

  @Nullable
  public Node leave(Comment original, Comment updated) {
    return updated;
  }

  @Nullable
  public Node leave(Newline original, Newline updated) {
    return updated;
  }

  @Nullable
  public Node leave(TrailingWhitespace original, TrailingWhitespace updated) {
    return updated;
  }

  @Nullable
  public Node leave(EmptyLine original, EmptyLine updated) {
    return updated;
  }

  @Nullable
  public Node leave(Module original, Module updated) {
    return updated;
  }

  @Nullable
  public Statement leave(SimpleStatementLine original, SimpleStatementLine updated) {
    return updated;
  }

  @Nullable
  public Suite leave(SimpleStatementSuite original, SimpleStatementSuite updated) {
    return updated;
  }

  @Nullable
  public Suite leave(IndentedBlock original, IndentedBlock updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(ExpressionStatement original, ExpressionStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(AssignStatement original, AssignStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(AnnotatedAssignStatement original, AnnotatedAssignStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(AugmentedAssignStatement original, AugmentedAssignStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(FlowStatement original, FlowStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(ReturnStatement original, ReturnStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(RaiseStatement original, RaiseStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(AssertStatement original, AssertStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(DelStatement original, DelStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(GlobalStatement original, GlobalStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(ImportStatement original, ImportStatement updated) {
    return updated;
  }

  @Nullable
  public SmallStatement leave(ImportFromStatement original, ImportFromStatement updated) {
    return updated;
  }

  @Nullable
  public Statement leave(IfStatement original, IfStatement updated) {
    return updated;
  }

  @Nullable
  public Node leave(ElseClause original, ElseClause updated) {
    return updated;
  }

  @Nullable
  public Statement leave(WhileStatement original, WhileStatement updated) {
    return updated;
  }

  @Nullable
  public Statement leave(ForStatement original, ForStatement updated) {
    return updated;
  }

  @Nullable
  public Statement leave(TryStatement original, TryStatement updated) {
    return updated;
  }

  @Nullable
  public Node leave(ExceptHandler original, ExceptHandler updated) {
    return updated;
  }

  @Nullable
  public Node leave(FinallyClause original, FinallyClause updated) {
    return updated;
  }

  @Nullable
  public Statement leave(WithStatement original, WithStatement updated) {
    return updated;
  }

  @Nullable
  public Node leave(WithItem original, WithItem updated) {
    return updated;
  }

  @Nullable
  public Statement leave(FunctionDef original, FunctionDef updated) {
    return updated;
  }

  @Nullable
  public Statement leave(ClassDef original, ClassDef updated) {
    return updated;
  }

  @Nullable
  public Node leave(Decorator original, Decorator updated) {
    return updated;
  }

  @Nullable
  public Node leave(Asynchronous original, Asynchronous updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Name original, Name updated) {
    return updated;
  }

  @Nullable
  public Expression leave(IntLiteral original, IntLiteral updated) {
    return updated;
  }

  @Nullable
  public Expression leave(FloatLiteral original, FloatLiteral updated) {
    return updated;
  }

  @Nullable
  public Expression leave(ImaginaryLiteral original, ImaginaryLiteral updated) {
    return updated;
  }

  @Nullable
  public Expression leave(StringLiteral original, StringLiteral updated) {
    return updated;
  }

  @Nullable
  public Expression leave(FormattedString original, FormattedString updated) {
    return updated;
  }

  @Nullable
  public Expression leave(ConcatenatedString original, ConcatenatedString updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Ellipsis original, Ellipsis updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Attribute original, Attribute updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Subscript original, Subscript updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Call original, Call updated) {
    return updated;
  }

  @Nullable
  public Expression leave(BinaryOperation original, BinaryOperation updated) {
    return updated;
  }

  @Nullable
  public Expression leave(UnaryOperation original, UnaryOperation updated) {
    return updated;
  }

  @Nullable
  public Expression leave(BooleanOperation original, BooleanOperation updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Comparison original, Comparison updated) {
    return updated;
  }

  @Nullable
  public Expression leave(ConditionalExpression original, ConditionalExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Lambda original, Lambda updated) {
    return updated;
  }

  @Nullable
  public Expression leave(NamedExpression original, NamedExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Await original, Await updated) {
    return updated;
  }

  @Nullable
  public Expression leave(Yield original, Yield updated) {
    return updated;
  }

  @Nullable
  public Expression leave(TupleExpression original, TupleExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(ListExpression original, ListExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(SetExpression original, SetExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(DictExpression original, DictExpression updated) {
    return updated;
  }

  @Nullable
  public Expression leave(ListComprehension original, ListComprehension updated) {
    return updated;
  }

  @Nullable
  public Expression leave(SetComprehension original, SetComprehension updated) {
    return updated;
  }

  @Nullable
  public Expression leave(DictComprehension original, DictComprehension updated) {
    return updated;
  }

  @Nullable
  public Expression leave(GeneratorExpression original, GeneratorExpression updated) {
    return updated;
  }

  @Nullable
  public Node leave(SubscriptElement original, SubscriptElement updated) {
    return updated;
  }

  @Nullable
  public SubscriptSlice leave(Index original, Index updated) {
    return updated;
  }

  @Nullable
  public SubscriptSlice leave(Slice original, Slice updated) {
    return updated;
  }

  @Nullable
  public Node leave(Argument original, Argument updated) {
    return updated;
  }

  @Nullable
  public Node leave(ComparisonTarget original, ComparisonTarget updated) {
    return updated;
  }

  @Nullable
  public Node leave(FromClause original, FromClause updated) {
    return updated;
  }

  @Nullable
  public SequenceElement leave(Element original, Element updated) {
    return updated;
  }

  @Nullable
  public SequenceElement leave(StarredElement original, StarredElement updated) {
    return updated;
  }

  @Nullable
  public DictItem leave(DictElement original, DictElement updated) {
    return updated;
  }

  @Nullable
  public DictItem leave(StarredDictElement original, StarredDictElement updated) {
    return updated;
  }

  @Nullable
  public Node leave(ComprehensionFor original, ComprehensionFor updated) {
    return updated;
  }

  @Nullable
  public Node leave(ComprehensionIf original, ComprehensionIf updated) {
    return updated;
  }

  @Nullable
  public Node leave(Parameters original, Parameters updated) {
    return updated;
  }

  @Nullable
  public Node leave(Parameter original, Parameter updated) {
    return updated;
  }

  @Nullable
  public Node leave(ParamStar original, ParamStar updated) {
    return updated;
  }

  @Nullable
  public Node leave(ParamSlash original, ParamSlash updated) {
    return updated;
  }

  @Nullable
  public Node leave(Annotation original, Annotation updated) {
    return updated;
  }

  @Nullable
  public Node leave(LeftParen original, LeftParen updated) {
    return updated;
  }

  @Nullable
  public Node leave(RightParen original, RightParen updated) {
    return updated;
  }

  @Nullable
  public Node leave(LeftBracket original, LeftBracket updated) {
    return updated;
  }

  @Nullable
  public Node leave(RightBracket original, RightBracket updated) {
    return updated;
  }

  @Nullable
  public Node leave(Comma original, Comma updated) {
    return updated;
  }

  @Nullable
  public Node leave(Dot original, Dot updated) {
    return updated;
  }

  @Nullable
  public Node leave(Colon original, Colon updated) {
    return updated;
  }

  @Nullable
  public Node leave(Semicolon original, Semicolon updated) {
    return updated;
  }

  @Nullable
  public Node leave(AssignEqual original, AssignEqual updated) {
    return updated;
  }

  @Nullable
  public Node leave(AssignTarget original, AssignTarget updated) {
    return updated;
  }

  @Nullable
  public Node leave(AsName original, AsName updated) {
    return updated;
  }

  @Nullable
  public Node leave(NameItem original, NameItem updated) {
    return updated;
  }

  @Nullable
  public Node leave(ImportAlias original, ImportAlias updated) {
    return updated;
  }

  @Nullable
  public Node leave(ImportStar original, ImportStar updated) {
    return updated;
  }

  @Nullable
  public Node leave(BinaryOperator original, BinaryOperator updated) {
    return updated;
  }

  @Nullable
  public Node leave(UnaryOperator original, UnaryOperator updated) {
    return updated;
  }

  @Nullable
  public Node leave(BooleanOperator original, BooleanOperator updated) {
    return updated;
  }

  @Nullable
  public Node leave(ComparisonOperator original, ComparisonOperator updated) {
    return updated;
  }

  @Nullable
  public Node leave(AugmentedOperator original, AugmentedOperator updated) {
    return updated;
  }
}
