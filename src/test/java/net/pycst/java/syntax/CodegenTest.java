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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of code generation from modified and hand-built trees. */
@RunWith(JUnit4.class)
public final class CodegenTest {

  private static SimpleStatementLine line(String name) {
    return SimpleStatementLine.of(new ExpressionStatement(Name.of(name)));
  }

  private static Module append(Module module, Statement statement) {
    return (Module)
        module.withChanges(
            "body",
            ImmutableList.<Statement>builder().addAll(module.getBody()).add(statement).build());
  }

  @Test
  public void testNewBlockUsesDetectedIndent() throws Exception {
    Module module = Module.parse("if x:\n\tpass\n");
    IfStatement ifStatement = (IfStatement) module.getBody().get(0);
    Node changed =
        module.deepReplace(
            ifStatement.getBody(), IndentedBlock.of(ImmutableList.of(line("y"), line("z"))));
    assertThat(((Module) changed).getCode()).isEqualTo("if x:\n\ty\n\tz\n");
  }

  @Test
  public void testEmptyBlockGeneratesPass() throws Exception {
    Module module = Module.parse("while x:\n  y\n");
    WhileStatement loop = (WhileStatement) module.getBody().get(0);
    Module changed =
        (Module) module.deepReplace(loop.getBody(), IndentedBlock.of(ImmutableList.of()));
    assertThat(changed.getCode()).isEqualTo("while x:\n  pass\n");
  }

  @Test
  public void testNestedBlocksIndentCumulatively() throws Exception {
    Module module = Module.parse("def f():\n    if a:\n        b\n");
    FunctionDef def = (FunctionDef) module.getBody().get(0);
    IndentedBlock body = (IndentedBlock) def.getBody();
    IfStatement inner = (IfStatement) body.getBody().get(0);
    Module changed =
        (Module)
            module.deepReplace(
                inner.getBody(), IndentedBlock.of(ImmutableList.of(line("c"), line("d"))));
    assertThat(changed.getCode()).isEqualTo("def f():\n    if a:\n        c\n        d\n");
  }

  @Test
  public void testAppendedStatementUsesDefaultNewline() throws Exception {
    Module module = Module.parse("x = 1\r\n");
    assertThat(append(module, line("y")).getCode()).isEqualTo("x = 1\r\ny\r\n");
  }

  @Test
  public void testMissingTrailingNewlineIsKept() throws Exception {
    Module module = Module.parse("x = 1");
    assertThat(module.getCode()).isEqualTo("x = 1");
    assertThat(append(module, line("y")).getCode()).isEqualTo("x = 1\ny");
  }

  @Test
  public void testEmptyModule() throws Exception {
    assertThat(Module.parse("").getCode()).isEmpty();
    assertThat(Module.parse("\n").getCode()).isEqualTo("\n");
  }

  @Test
  public void testCodeForStatementInsideBlock() throws Exception {
    Module module = Module.parse("if x:\n    y = 1\n");
    IfStatement ifStatement = (IfStatement) module.getBody().get(0);
    Statement inner = ((IndentedBlock) ifStatement.getBody()).getBody().get(0);
    assertThat(module.codeFor(inner)).isEqualTo("y = 1\n");
  }

  @Test
  public void testReusedWhitespaceIsNotDuplicated() throws Exception {
    Expression call = Expression.parse("f( a )");
    Expression renamed = (Expression) call.deepReplace(((Call) call).getFunc(), Name.of("g"));
    assertThat(Module.parse("").codeFor(renamed)).isEqualTo("g( a )");
  }

  @Test
  public void testParenthesizedExpressionOwnsParens() throws Exception {
    Module module = Module.parse("x = ( a )\n");
    SimpleStatementLine line = (SimpleStatementLine) module.getBody().get(0);
    Expression value = ((AssignStatement) line.getBody().get(0)).getValue();
    assertThat(module.codeFor(value)).isEqualTo("( a )");
    Module stripped =
        (Module)
            module.deepReplace(
                value,
                value.withChanges(
                    ImmutableMap.of("lpar", ImmutableList.of(), "rpar", ImmutableList.of())));
    assertThat(stripped.getCode()).isEqualTo("x = a\n");
  }

  @Test
  public void testComputePositions() throws Exception {
    Module module = Module.parse("x = a + b\ndef f():\n    return y\n");
    ImmutableMap<Node, CodeRange> positions = module.computePositions();

    SimpleStatementLine first = (SimpleStatementLine) module.getBody().get(0);
    BinaryOperation sum = (BinaryOperation) ((AssignStatement) first.getBody().get(0)).getValue();
    assertThat(positions.get(sum).toString()).isEqualTo("1:4-1:9");
    assertThat(positions.get(sum.getRight()).toString()).isEqualTo("1:8-1:9");
    assertThat(positions.get(sum.getOperator()).toString()).isEqualTo("1:5-1:8");

    FunctionDef def = (FunctionDef) module.getBody().get(1);
    assertThat(positions.get(def.getName()).toString()).isEqualTo("2:4-2:5");
    IndentedBlock body = (IndentedBlock) def.getBody();
    SimpleStatementLine ret = (SimpleStatementLine) body.getBody().get(0);
    ReturnStatement returnStatement = (ReturnStatement) ret.getBody().get(0);
    assertThat(positions.get(returnStatement.getValue()).toString()).isEqualTo("3:11-3:12");
    assertThat(positions.get(module).start()).isEqualTo(CodePosition.create(1, 0));
  }

  @Test
  public void testPositionsCountUtf16Units() throws Exception {
    Module module = Module.parse("s = 'é'; t\n");
    SimpleStatementLine line = (SimpleStatementLine) module.getBody().get(0);
    Expression t = ((ExpressionStatement) line.getBody().get(1)).getValue();
    assertThat(module.computePositions().get(t).toString()).isEqualTo("1:9-1:10");
  }

  @Test
  public void testBytesKeepByteOrderMark() throws Exception {
    byte[] source = "\ufeffx = 1\n".getBytes(UTF_8);
    Module module = Module.parse(source, ParserConfig.DEFAULT);
    assertThat(module.getCode()).isEqualTo("x = 1\n");
    assertThat(module.getBytes()).isEqualTo(source);
  }
}
