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
 * A read-only traversal of a syntax tree, in source order.
 *
 * <p>Subclasses override {@code visit} overloads, called before a node's children, and {@code
 * leave} overloads, called after them. Use {@link Node#visit(CstVisitor)} to start a traversal.
 */
public abstract class CstVisitor extends CstVisitFunctions {

  /** Called on leaving any node, after its children. */
  public void onLeave(Node node) {
    switch (node.kind()) {
      case SIMPLE_WHITESPACE:
        leave((SimpleWhitespace) node);
        return;
      case PARENTHESIZED_WHITESPACE:
        leave((ParenthesizedWhitespace) node);
        return;
      case COMMENT:
        leave((Comment) node);
        return;
      case NEWLINE:
        leave((Newline) node);
        return;
      case TRAILING_WHITESPACE:
        leave((TrailingWhitespace) node);
        return;
      case EMPTY_LINE:
        leave((EmptyLine) node);
        return;
      case MODULE:
        leave((Module) node);
        return;
      case SIMPLE_STATEMENT_LINE:
        leave((SimpleStatementLine) node);
        return;
      case SIMPLE_STATEMENT_SUITE:
        leave((SimpleStatementSuite) node);
        return;
      case INDENTED_BLOCK:
        leave((IndentedBlock) node);
        return;
      case EXPRESSION_STATEMENT:
        leave((ExpressionStatement) node);
        return;
      case ASSIGN_STATEMENT:
        leave((AssignStatement) node);
        return;
      case ANNOTATED_ASSIGN_STATEMENT:
        leave((AnnotatedAssignStatement) node);
        return;
      case AUGMENTED_ASSIGN_STATEMENT:
        leave((AugmentedAssignStatement) node);
        return;
      case FLOW_STATEMENT:
        leave((FlowStatement) node);
        return;
      case RETURN_STATEMENT:
        leave((ReturnStatement) node);
        return;
      case RAISE_STATEMENT:
        leave((RaiseStatement) node);
        return;
      case ASSERT_STATEMENT:
        leave((AssertStatement) node);
        return;
      case DEL_STATEMENT:
        leave((DelStatement) node);
        return;
      case GLOBAL_STATEMENT:
        leave((GlobalStatement) node);
        return;
      case IMPORT_STATEMENT:
        leave((ImportStatement) node);
        return;
      case IMPORT_FROM_STATEMENT:
        leave((ImportFromStatement) node);
        return;
      case IF_STATEMENT:
        leave((IfStatement) node);
        return;
      case ELSE_CLAUSE:
        leave((ElseClause) node);
        return;
      case WHILE_STATEMENT:
        leave((WhileStatement) node);
        return;
      case FOR_STATEMENT:
        leave((ForStatement) node);
        return;
      case TRY_STATEMENT:
        leave((TryStatement) node);
        return;
      case EXCEPT_HANDLER:
        leave((ExceptHandler) node);
        return;
      case FINALLY_CLAUSE:
        leave((FinallyClause) node);
        return;
      case WITH_STATEMENT:
        leave((WithStatement) node);
        return;
      case WITH_ITEM:
        leave((WithItem) node);
        return;
      case FUNCTION_DEF:
        leave((FunctionDef) node);
        return;
      case CLASS_DEF:
        leave((ClassDef) node);
        return;
      case DECORATOR:
        leave((Decorator) node);
        return;
      case ASYNCHRONOUS:
        leave((Asynchronous) node);
        return;
      case NAME:
        leave((Name) node);
        return;
      case INT_LITERAL:
        leave((IntLiteral) node);
        return;
      case FLOAT_LITERAL:
        leave((FloatLiteral) node);
        return;
      case IMAGINARY_LITERAL:
        leave((ImaginaryLiteral) node);
        return;
      case STRING_LITERAL:
        leave((StringLiteral) node);
        return;
      case FORMATTED_STRING:
        leave((FormattedString) node);
        return;
      case CONCATENATED_STRING:
        leave((ConcatenatedString) node);
        return;
      case ELLIPSIS:
        leave((Ellipsis) node);
        return;
      case ATTRIBUTE:
        leave((Attribute) node);
        return;
      case SUBSCRIPT:
        leave((Subscript) node);
        return;
      case CALL:
        leave((Call) node);
        return;
      case BINARY_OPERATION:
        leave((BinaryOperation) node);
        return;
      case UNARY_OPERATION:
        leave((UnaryOperation) node);
        return;
      case BOOLEAN_OPERATION:
        leave((BooleanOperation) node);
        return;
      case COMPARISON:
        leave((Comparison) node);
        return;
      case CONDITIONAL_EXPRESSION:
        leave((ConditionalExpression) node);
        return;
      case LAMBDA:
        leave((Lambda) node);
        return;
      case NAMED_EXPRESSION:
        leave((NamedExpression) node);
        return;
      case AWAIT:
        leave((Await) node);
        return;
      case YIELD:
        leave((Yield) node);
        return;
      case TUPLE_EXPRESSION:
        leave((TupleExpression) node);
        return;
      case LIST_EXPRESSION:
        leave((ListExpression) node);
        return;
      case SET_EXPRESSION:
        leave((SetExpression) node);
        return;
      case DICT_EXPRESSION:
        leave((DictExpression) node);
        return;
      case LIST_COMPREHENSION:
        leave((ListComprehension) node);
        return;
      case SET_COMPREHENSION:
        leave((SetComprehension) node);
        return;
      case DICT_COMPREHENSION:
        leave((DictComprehension) node);
        return;
      case GENERATOR_EXPRESSION:
        leave((GeneratorExpression) node);
        return;
      case SUBSCRIPT_ELEMENT:
        leave((SubscriptElement) node);
        return;
      case INDEX:
        leave((Index) node);
        return;
      case SLICE:
        leave((Slice) node);
        return;
      case ARGUMENT:
        leave((Argument) node);
        return;
      case COMPARISON_TARGET:
        leave((ComparisonTarget) node);
        return;
      case FROM_CLAUSE:
        leave((FromClause) node);
        return;
      case ELEMENT:
        leave((Element) node);
        return;
      case STARRED_ELEMENT:
        leave((StarredElement) node);
        return;
      case DICT_ELEMENT:
        leave((DictElement) node);
        return;
      case STARRED_DICT_ELEMENT:
        leave((StarredDictElement) node);
        return;
      case COMPREHENSION_FOR:
        leave((ComprehensionFor) node);
        return;
      case COMPREHENSION_IF:
        leave((ComprehensionIf) node);
        return;
      case PARAMETERS:
        leave((Parameters) node);
        return;
      case PARAMETER:
        leave((Parameter) node);
        return;
      case PARAM_STAR:
        leave((ParamStar) node);
        return;
      case PARAM_SLASH:
        leave((ParamSlash) node);
        return;
      case ANNOTATION:
        leave((Annotation) node);
        return;
      case LEFT_PAREN:
        leave((LeftParen) node);
        return;
      case RIGHT_PAREN:
        leave((RightParen) node);
        return;
      case LEFT_BRACKET:
        leave((LeftBracket) node);
        return;
      case RIGHT_BRACKET:
        leave((RightBracket) node);
        return;
      case COMMA:
        leave((Comma) node);
        return;
      case DOT:
        leave((Dot) node);
        return;
      case COLON:
        leave((Colon) node);
        return;
      case SEMICOLON:
        leave((Semicolon) node);
        return;
      case ASSIGN_EQUAL:
        leave((AssignEqual) node);
        return;
      case ASSIGN_TARGET:
        leave((AssignTarget) node);
        return;
      case AS_NAME:
        leave((AsName) node);
        return;
      case NAME_ITEM:
        leave((NameItem) node);
        return;
      case IMPORT_ALIAS:
        leave((ImportAlias) node);
        return;
      case IMPORT_STAR:
        leave((ImportStar) node);
        return;
      case BINARY_OPERATOR:
        leave((BinaryOperator) node);
        return;
      case UNARY_OPERATOR:
        leave((UnaryOperator) node);
        return;
      case BOOLEAN_OPERATOR:
        leave((BooleanOperator) node);
        return;
      case COMPARISON_OPERATOR:
        leave((ComparisonOperator) node);
        return;
      case AUGMENTED_OPERATOR:
        leave((AugmentedOperator) node);
        return;
    }
    throw new IllegalStateException("unknown kind: " + node.kind());
  }

  public void leave(SimpleWhitespace node) {}

  public void leave(ParenthesizedWhitespace node) {}

  public void leave(Comment node) {}

  public void leave(Newline node) {}

  public void leave(TrailingWhitespace node) {}

  public void leave(EmptyLine node) {}

  public void leave(Module node) {}

  public void leave(SimpleStatementLine node) {}

  public void leave(SimpleStatementSuite node) {}

  public void leave(IndentedBlock node) {}

  public void leave(ExpressionStatement node) {}

  public void leave(AssignStatement node) {}

  public void leave(AnnotatedAssignStatement node) {}

  public void leave(AugmentedAssignStatement node) {}

  public void leave(FlowStatement node) {}

  public void leave(ReturnStatement node) {}

  public void leave(RaiseStatement node) {}

  public void leave(AssertStatement node) {}

  public void leave(DelStatement node) {}

  public void leave(GlobalStatement node) {}

  public void leave(ImportStatement node) {}

  public void leave(ImportFromStatement node) {}

  public void leave(IfStatement node) {}

  public void leave(ElseClause node) {}

  public void leave(WhileStatement node) {}

  public void leave(ForStatement node) {}

  public void leave(TryStatement node) {}

  public void leave(ExceptHandler node) {}

  public void leave(FinallyClause node) {}

  public void leave(WithStatement node) {}

  public void leave(WithItem node) {}

  public void leave(FunctionDef node) {}

  public void leave(ClassDef node) {}

  public void leave(Decorator node) {}

  public void leave(Asynchronous node) {}

  public void leave(Name node) {}

  public void leave(IntLiteral node) {}

  public void leave(FloatLiteral node) {}

  public void leave(ImaginaryLiteral node) {}

  public void leave(StringLiteral node) {}

  public void leave(FormattedString node) {}

  public void leave(ConcatenatedString node) {}

  public void leave(Ellipsis node) {}

  public void leave(Attribute node) {}

  public void leave(Subscript node) {}

  public void leave(Call node) {}

  public void leave(BinaryOperation node) {}

  public void leave(UnaryOperation node) {}

  public void leave(BooleanOperation node) {}

  public void leave(Comparison node) {}

  public void leave(ConditionalExpression node) {}

  public void leave(Lambda node) {}

  public void leave(NamedExpression node) {}

  public void leave(Await node) {}

  public void leave(Yield node) {}

  public void leave(TupleExpression node) {}

  public void leave(ListExpression node) {}

  public void leave(SetExpression node) {}

  public void leave(DictExpression node) {}

  public void leave(ListComprehension node) {}

  public void leave(SetComprehension node) {}

  public void leave(DictComprehension node) {}

  public void leave(GeneratorExpression node) {}

  public void leave(SubscriptElement node) {}

  public void leave(Index node) {}

  public void leave(Slice node) {}

  public void leave(Argument node) {}

  public void leave(ComparisonTarget node) {}

  public void leave(FromClause node) {}

  public void leave(Element node) {}

  public void leave(StarredElement node) {}

  public void leave(DictElement node) {}

  public void leave(StarredDictElement node) {}

  public void leave(ComprehensionFor node) {}

  public void leave(ComprehensionIf node) {}

  public void leave(Parameters node) {}

  public void leave(Parameter node) {}

  public void leave(ParamStar node) {}

  public void leave(ParamSlash node) {}

  public void leave(Annotation node) {}

  public void leave(LeftParen node) {}

  public void leave(RightParen node) {}

  public void leave(LeftBracket node) {}

  public void leave(RightBracket node) {}

  public void leave(Comma node) {}

  public void leave(Dot node) {}

  public void leave(Colon node) {}

  public void leave(Semicolon node) {}

  public void leave(AssignEqual node) {}

  public void leave(AssignTarget node) {}

  public void leave(AsName node) {}

  public void leave(NameItem node) {}

  public void leave(ImportAlias node) {}

  public void leave(ImportStar node) {}

  public void leave(BinaryOperator node) {}

  public void leave(UnaryOperator node) {}

  public void leave(BooleanOperator node) {}

  public void leave(ComparisonOperator node) {}

  public void leave(AugmentedOperator node) {}
}
