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

/**
 * The enter hooks shared by {@link CstVisitor} and {@link CstTransformer}.
 *
 * <p>{@link #onVisit} is called before a node's children are traversed and dispatches to the
 * {@code visit} overload for the node's class. Returning false skips the children; the leave hook
 * for the node is still called. Subclasses override the overloads for the node types they care
 * about.
 */
public abstract class CstVisitFunctions {

  CstVisitFunctions() {}

  /** Called on entering any node. Returns whether to traverse its children. */
  public boolean onVisit(Node node) {
    switch (node.kind()) {
      case SIMPLE_WHITESPACE:
        return visit((SimpleWhitespace) node);
      case PARENTHESIZED_WHITESPACE:
        return visit((ParenthesizedWhitespace) node);
      case COMMENT:
        return visit((Comment) node);
      case NEWLINE:
        return visit((Newline) node);
      case TRAILING_WHITESPACE:
        return visit((TrailingWhitespace) node);
      case EMPTY_LINE:
        return visit((EmptyLine) node);
      case MODULE:
        return visit((Module) node);
      case SIMPLE_STATEMENT_LINE:
        return visit((SimpleStatementLine) node);
      case SIMPLE_STATEMENT_SUITE:
        return visit((SimpleStatementSuite) node);
      case INDENTED_BLOCK:
        return visit((IndentedBlock) node);
      case EXPRESSION_STATEMENT:
        return visit((ExpressionStatement) node);
      case ASSIGN_STATEMENT:
        return visit((AssignStatement) node);
      case ANNOTATED_ASSIGN_STATEMENT:
        return visit((AnnotatedAssignStatement) node);
      case AUGMENTED_ASSIGN_STATEMENT:
        return visit((AugmentedAssignStatement) node);
      case FLOW_STATEMENT:
        return visit((FlowStatement) node);
      case RETURN_STATEMENT:
        return visit((ReturnStatement) node);
      case RAISE_STATEMENT:
        return visit((RaiseStatement) node);
      case ASSERT_STATEMENT:
        return visit((AssertStatement) node);
      case DEL_STATEMENT:
        return visit((DelStatement) node);
      case GLOBAL_STATEMENT:
        return visit((GlobalStatement) node);
      case IMPORT_STATEMENT:
        return visit((ImportStatement) node);
      case IMPORT_FROM_STATEMENT:
        return visit((ImportFromStatement) node);
      case IF_STATEMENT:
        return visit((IfStatement) node);
      case ELSE_CLAUSE:
        return visit((ElseClause) node);
      case WHILE_STATEMENT:
        return visit((WhileStatement) node);
      case FOR_STATEMENT:
        return visit((ForStatement) node);
      case TRY_STATEMENT:
        return visit((TryStatement) node);
      case EXCEPT_HANDLER:
        return visit((ExceptHandler) node);
      case FINALLY_CLAUSE:
        return visit((FinallyClause) node);
      case WITH_STATEMENT:
        return visit((WithStatement) node);
      case WITH_ITEM:
        return visit((WithItem) node);
      case FUNCTION_DEF:
        return visit((FunctionDef) node);
      case CLASS_DEF:
        return visit((ClassDef) node);
      case DECORATOR:
        return visit((Decorator) node);
      case ASYNCHRONOUS:
        return visit((Asynchronous) node);
      case NAME:
        return visit((Name) node);
      case INT_LITERAL:
        return visit((IntLiteral) node);
      case FLOAT_LITERAL:
        return visit((FloatLiteral) node);
      case IMAGINARY_LITERAL:
        return visit((ImaginaryLiteral) node);
      case STRING_LITERAL:
        return visit((StringLiteral) node);
      case FORMATTED_STRING:
        return visit((FormattedString) node);
      case CONCATENATED_STRING:
        return visit((ConcatenatedString) node);
      case ELLIPSIS:
        return visit((Ellipsis) node);
      case ATTRIBUTE:
        return visit((Attribute) node);
      case SUBSCRIPT:
        return visit((Subscript) node);
      case CALL:
        return visit((Call) node);
      case BINARY_OPERATION:
        return visit((BinaryOperation) node);
      case UNARY_OPERATION:
        return visit((UnaryOperation) node);
      case BOOLEAN_OPERATION:
        return visit((BooleanOperation) node);
      case COMPARISON:
        return visit((Comparison) node);
      case CONDITIONAL_EXPRESSION:
        return visit((ConditionalExpression) node);
      case LAMBDA:
        return visit((Lambda) node);
      case NAMED_EXPRESSION:
        return visit((NamedExpression) node);
      case AWAIT:
        return visit((Await) node);
      case YIELD:
        return visit((Yield) node);
      case TUPLE_EXPRESSION:
        return visit((TupleExpression) node);
      case LIST_EXPRESSION:
        return visit((ListExpression) node);
      case SET_EXPRESSION:
        return visit((SetExpression) node);
      case DICT_EXPRESSION:
        return visit((DictExpression) node);
      case LIST_COMPREHENSION:
        return visit((ListComprehension) node);
      case SET_COMPREHENSION:
        return visit((SetComprehension) node);
      case DICT_COMPREHENSION:
        return visit((DictComprehension) node);
      case GENERATOR_EXPRESSION:
        return visit((GeneratorExpression) node);
      case SUBSCRIPT_ELEMENT:
        return visit((SubscriptElement) node);
      case INDEX:
        return visit((Index) node);
      case SLICE:
        return visit((Slice) node);
      case ARGUMENT:
        return visit((Argument) node);
      case COMPARISON_TARGET:
        return visit((ComparisonTarget) node);
      case FROM_CLAUSE:
        return visit((FromClause) node);
      case ELEMENT:
        return visit((Element) node);
      case STARRED_ELEMENT:
        return visit((StarredElement) node);
      case DICT_ELEMENT:
        return visit((DictElement) node);
      case STARRED_DICT_ELEMENT:
        return visit((StarredDictElement) node);
      case COMPREHENSION_FOR:
        return visit((ComprehensionFor) node);
      case COMPREHENSION_IF:
        return visit((ComprehensionIf) node);
      case PARAMETERS:
        return visit((Parameters) node);
      case PARAMETER:
        return visit((Parameter) node);
      case PARAM_STAR:
        return visit((ParamStar) node);
      case PARAM_SLASH:
        return visit((ParamSlash) node);
      case ANNOTATION:
        return visit((Annotation) node);
      case LEFT_PAREN:
        return visit((LeftParen) node);
      case RIGHT_PAREN:
        return visit((RightParen) node);
      case LEFT_BRACKET:
        return visit((LeftBracket) node);
      case RIGHT_BRACKET:
        return visit((RightBracket) node);
      case COMMA:
        return visit((Comma) node);
      case DOT:
        return visit((Dot) node);
      case COLON:
        return visit((Colon) node);
      case SEMICOLON:
        return visit((Semicolon) node);
      case ASSIGN_EQUAL:
        return visit((AssignEqual) node);
      case ASSIGN_TARGET:
        return visit((AssignTarget) node);
      case AS_NAME:
        return visit((AsName) node);
      case NAME_ITEM:
        return visit((NameItem) node);
      case IMPORT_ALIAS:
        return visit((ImportAlias) node);
      case IMPORT_STAR:
        return visit((ImportStar) node);
      case BINARY_OPERATOR:
        return visit((BinaryOperator) node);
      case UNARY_OPERATOR:
        return visit((UnaryOperator) node);
      case BOOLEAN_OPERATOR:
        return visit((BooleanOperator) node);
      case COMPARISON_OPERATOR:
        return visit((ComparisonOperator) node);
      case AUGMENTED_OPERATOR:
        return visit((AugmentedOperator) node);
    }
    throw new IllegalStateException("unknown kind: " + node.kind());
  }

  public boolean visit(SimpleWhitespace node) {
    return true;
  }

  public boolean visit(ParenthesizedWhitespace node) {
    return true;
  }

  public boolean visit(Comment node) {
    return true;
  }

  public boolean visit(Newline node) {
    return true;
  }

  public boolean visit(TrailingWhitespace node) {
    return true;
  }

  public boolean visit(EmptyLine node) {
    return true;
  }

  public boolean visit(Module node) {
    return true;
  }

  public boolean visit(SimpleStatementLine node) {
    return true;
  }

  public boolean visit(SimpleStatementSuite node) {
    return true;
  }

  public boolean visit(IndentedBlock node) {
    return true;
  }

  public boolean visit(ExpressionStatement node) {
    return true;
  }

  public boolean visit(AssignStatement node) {
    return true;
  }

  public boolean visit(AnnotatedAssignStatement node) {
    return true;
  }

  public boolean visit(AugmentedAssignStatement node) {
    return true;
  }

  public boolean visit(FlowStatement node) {
    return true;
  }

  public boolean visit(ReturnStatement node) {
    return true;
  }

  public boolean visit(RaiseStatement node) {
    return true;
  }

  public boolean visit(AssertStatement node) {
    return true;
  }

  public boolean visit(DelStatement node) {
    return true;
  }

  public boolean visit(GlobalStatement node) {
    return true;
  }

  public boolean visit(ImportStatement node) {
    return true;
  }

  public boolean visit(ImportFromStatement node) {
    return true;
  }

  public boolean visit(IfStatement node) {
    return true;
  }

  public boolean visit(ElseClause node) {
    return true;
  }

  public boolean visit(WhileStatement node) {
    return true;
  }

  public boolean visit(ForStatement node) {
    return true;
  }

  public boolean visit(TryStatement node) {
    return true;
  }

  public boolean visit(ExceptHandler node) {
    return true;
  }

  public boolean visit(FinallyClause node) {
    return true;
  }

  public boolean visit(WithStatement node) {
    return true;
  }

  public boolean visit(WithItem node) {
    return true;
  }

  public boolean visit(FunctionDef node) {
    return true;
  }

  public boolean visit(ClassDef node) {
    return true;
  }

  public boolean visit(Decorator node) {
    return true;
  }

  public boolean visit(Asynchronous node) {
    return true;
  }

  public boolean visit(Name node) {
    return true;
  }

  public boolean visit(IntLiteral node) {
    return true;
  }

  public boolean visit(FloatLiteral node) {
    return true;
  }

  public boolean visit(ImaginaryLiteral node) {
    return true;
  }

  public boolean visit(StringLiteral node) {
    return true;
  }

  public boolean visit(FormattedString node) {
    return true;
  }

  public boolean visit(ConcatenatedString node) {
    return true;
  }

  public boolean visit(Ellipsis node) {
    return true;
  }

  public boolean visit(Attribute node) {
    return true;
  }

  public boolean visit(Subscript node) {
    return true;
  }

  public boolean visit(Call node) {
    return true;
  }

  public boolean visit(BinaryOperation node) {
    return true;
  }

  public boolean visit(UnaryOperation node) {
    return true;
  }

  public boolean visit(BooleanOperation node) {
    return true;
  }

  public boolean visit(Comparison node) {
    return true;
  }

  public boolean visit(ConditionalExpression node) {
    return true;
  }

  public boolean visit(Lambda node) {
    return true;
  }

  public boolean visit(NamedExpression node) {
    return true;
  }

  public boolean visit(Await node) {
    return true;
  }

  public boolean visit(Yield node) {
    return true;
  }

  public boolean visit(TupleExpression node) {
    return true;
  }

  public boolean visit(ListExpression node) {
    return true;
  }

  public boolean visit(SetExpression node) {
    return true;
  }

  public boolean visit(DictExpression node) {
    return true;
  }

  public boolean visit(ListComprehension node) {
    return true;
  }

  public boolean visit(SetComprehension node) {
    return true;
  }

  public boolean visit(DictComprehension node) {
    return true;
  }

  public boolean visit(GeneratorExpression node) {
    return true;
  }

  public boolean visit(SubscriptElement node) {
    return true;
  }

  public boolean visit(Index node) {
    return true;
  }

  public boolean visit(Slice node) {
    return true;
  }

  public boolean visit(Argument node) {
    return true;
  }

  public boolean visit(ComparisonTarget node) {
    return true;
  }

  public boolean visit(FromClause node) {
    return true;
  }

  public boolean visit(Element node) {
    return true;
  }

  public boolean visit(StarredElement node) {
    return true;
  }

  public boolean visit(DictElement node) {
    return true;
  }

  public boolean visit(StarredDictElement node) {
    return true;
  }

  public boolean visit(ComprehensionFor node) {
    return true;
  }

  public boolean visit(ComprehensionIf node) {
    return true;
  }

  public boolean visit(Parameters node) {
    return true;
  }

  public boolean visit(Parameter node) {
    return true;
  }

  public boolean visit(ParamStar node) {
    return true;
  }

  public boolean visit(ParamSlash node) {
    return true;
  }

  public boolean visit(Annotation node) {
    return true;
  }

  public boolean visit(LeftParen node) {
    return true;
  }

  public boolean visit(RightParen node) {
    return true;
  }

  public boolean visit(LeftBracket node) {
    return true;
  }

  public boolean visit(RightBracket node) {
    return true;
  }

  public boolean visit(Comma node) {
    return true;
  }

  public boolean visit(Dot node) {
    return true;
  }

  public boolean visit(Colon node) {
    return true;
  }

  public boolean visit(Semicolon node) {
    return true;
  }

  public boolean visit(AssignEqual node) {
    return true;
  }

  public boolean visit(AssignTarget node) {
    return true;
  }

  public boolean visit(AsName node) {
    return true;
  }

  public boolean visit(NameItem node) {
    return true;
  }

  public boolean visit(ImportAlias node) {
    return true;
  }

  public boolean visit(ImportStar node) {
    return true;
  }

  public boolean visit(BinaryOperator node) {
    return true;
  }

  public boolean visit(UnaryOperator node) {
    return true;
  }

  public boolean visit(BooleanOperator node) {
    return true;
  }

  public boolean visit(ComparisonOperator node) {
    return true;
  }

  public boolean visit(AugmentedOperator node) {
    return true;
  }
}
