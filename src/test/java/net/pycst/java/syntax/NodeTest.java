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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of node construction, copying and structural comparison. */
@RunWith(JUnit4.class)
public final class NodeTest {

  private static Module module(Statement... body) {
    return new Module(
        ImmutableList.of(),
        ImmutableList.copyOf(body),
        ImmutableList.of(),
        "utf-8",
        "    ",
        "\n",
        true);
  }

  @Test
  public void testInvalidIdentifier() {
    InvalidNodeException e = assertThrows(InvalidNodeException.class, () -> new Name("1x"));
    assertThat(e).hasMessageThat().contains("1x");
  }

  @Test
  public void testInvalidSimpleWhitespace() {
    assertThrows(InvalidNodeException.class, () -> SimpleWhitespace.of("\n"));
    assertThrows(InvalidNodeException.class, () -> SimpleWhitespace.of("x"));
  }

  @Test
  public void testUnbalancedParentheses() {
    assertThrows(
        InvalidNodeException.class,
        () -> new Name("a", ImmutableList.of(LeftParen.of()), ImmutableList.of()));
  }

  @Test
  public void testEmptyTupleMustBeParenthesized() {
    assertThrows(InvalidNodeException.class, () -> new TupleExpression(ImmutableList.of()));
    TupleExpression empty =
        new TupleExpression(
            ImmutableList.of(),
            ImmutableList.of(LeftParen.of()),
            ImmutableList.of(RightParen.of()));
    assertThat(module().codeFor(empty)).isEqualTo("()");
  }

  @Test
  public void testNullElementRejected() {
    assertThrows(
        InvalidNodeException.class,
        () -> new TupleExpression(Arrays.<SequenceElement>asList(Element.of(Name.of("a")), null)));
  }

  @Test
  public void testHandBuiltTreeUsesDefaults() {
    Expression sum =
        new BinaryOperation(Name.of("a"), BinaryOperator.of(TokenKind.PLUS), new IntLiteral("1"));
    Module module =
        module(
            SimpleStatementLine.of(
                new AssignStatement(ImmutableList.of(AssignTarget.of(Name.of("x"))), sum)));
    assertThat(module.getCode()).isEqualTo("x = a + 1\n");
  }

  @Test
  public void testWithChangesReplacesNamedFieldsOnly() throws Exception {
    Expression e = Expression.parse("a  +  b");
    BinaryOperation op = (BinaryOperation) e;
    BinaryOperation changed = (BinaryOperation) op.withChanges("right", Name.of("c"));
    assertThat(module().codeFor(changed)).isEqualTo("a  +  c");
    assertThat(changed.getLeft()).isSameInstanceAs(op.getLeft());
    assertThat(module().codeFor(op)).isEqualTo("a  +  b");
  }

  @Test
  public void testWithChangesAcceptsSequences() throws Exception {
    Name name = Name.of("a");
    Name parenthesized =
        (Name)
            name.withChanges(
                ImmutableMap.of(
                    "lpar", ImmutableList.of(LeftParen.of()),
                    "rpar", ImmutableList.of(RightParen.of())));
    assertThat(module().codeFor(parenthesized)).isEqualTo("(a)");
  }

  @Test
  public void testWithChangesRejectsUnknownField() {
    InvalidNodeException e =
        assertThrows(InvalidNodeException.class, () -> Name.of("a").withChanges("nope", 1));
    assertThat(e).hasMessageThat().contains("nope");
  }

  @Test
  public void testWithChangesRejectsWrongType() {
    assertThrows(
        InvalidNodeException.class, () -> Name.of("a").withChanges("lpar", Name.of("b")));
    assertThrows(InvalidNodeException.class, () -> Name.of("a").withChanges("value", 3));
  }

  @Test
  public void testWithChangesRevalidates() {
    assertThrows(InvalidNodeException.class, () -> Name.of("a").withChanges("value", "not ok"));
  }

  @Test
  public void testChildrenInSourceOrder() throws Exception {
    BinaryOperation op = (BinaryOperation) Expression.parse("a + b");
    ImmutableList<Node> children = op.children();
    assertThat(children).hasSize(3);
    assertThat(children.get(0)).isSameInstanceAs(op.getLeft());
    assertThat(children.get(1)).isSameInstanceAs(op.getOperator());
    assertThat(children.get(2)).isSameInstanceAs(op.getRight());
  }

  @Test
  public void testDeepEquals() throws Exception {
    assertThat(Expression.parse("f(a, b)").deepEquals(Expression.parse("f(a, b)"))).isTrue();
    assertThat(Expression.parse("f(a, b)").deepEquals(Expression.parse("f(a,b)"))).isFalse();
    assertThat(Expression.parse("f(a, b)").deepEquals(Expression.parse("f(a, c)"))).isFalse();
    assertThat(Expression.parse("a").deepEquals(Expression.parse("(a)"))).isFalse();
  }

  @Test
  public void testDeepCloneSharesNothing() throws Exception {
    Module module = Module.parse("def f(x):\n    return x\n");
    Module clone = (Module) module.deepClone();
    assertThat(clone).isNotSameInstanceAs(module);
    assertThat(clone.deepEquals(module)).isTrue();
    assertThat(clone.getBody().get(0)).isNotSameInstanceAs(module.getBody().get(0));
    assertThat(clone.getCode()).isEqualTo(module.getCode());
  }

  @Test
  public void testDeepReplace() throws Exception {
    Module module = Module.parse("x = a + b\n");
    SimpleStatementLine line = (SimpleStatementLine) module.getBody().get(0);
    BinaryOperation op = (BinaryOperation) ((AssignStatement) line.getBody().get(0)).getValue();
    Module replaced = (Module) module.deepReplace(op.getRight(), Name.of("c"));
    assertThat(replaced.getCode()).isEqualTo("x = a + c\n");
    assertThat(module.getCode()).isEqualTo("x = a + b\n");
  }

  @Test
  public void testDeepRemoveFromSequence() throws Exception {
    Module module = Module.parse("a = 1\nb = 2\nc = 3\n");
    Module removed = (Module) module.deepRemove(module.getBody().get(1));
    assertThat(removed.getCode()).isEqualTo("a = 1\nc = 3\n");
  }

  @Test
  public void testDeepRemoveOfRequiredChildFails() throws Exception {
    BinaryOperation op = (BinaryOperation) Expression.parse("a + b");
    assertThrows(InvalidNodeException.class, () -> op.deepRemove(op.getLeft()));
  }

  @Test
  public void testDeepRemoveOfSelf() throws Exception {
    Expression e = Expression.parse("a");
    assertThat(e.deepRemove(e)).isNull();
  }

  @Test
  public void testParenthesize() throws Exception {
    Expression e = Expression.parse("a + b").parenthesize();
    assertThat(e.isParenthesized()).isTrue();
    assertThat(module().codeFor(e)).isEqualTo("(a + b)");
  }
}
