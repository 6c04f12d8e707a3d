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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodePrinterTest {

  @Test
  public void testFullDump() throws Exception {
    assertThat(NodePrinter.dump(Expression.parse("(a)")))
        .isEqualTo(
            String.join(
                "\n",
                "Name(",
                "  lpar=[",
                "    LeftParen(",
                "      whitespaceAfter=SimpleWhitespace(",
                "        value=\"\",",
                "      ),",
                "    ),",
                "  ],",
                "  value=\"a\",",
                "  rpar=[",
                "    RightParen(",
                "      whitespaceBefore=SimpleWhitespace(",
                "        value=\"\",",
                "      ),",
                "    ),",
                "  ],",
                ")"));
  }

  @Test
  public void testCompactDumpOmitsFormattingAndDefaults() throws Exception {
    assertThat(NodePrinter.dump(Expression.parse("a + 1"), false))
        .isEqualTo(
            String.join(
                "\n",
                "BinaryOperation(",
                "  left=Name(",
                "    value=\"a\",",
                "  ),",
                "  operator=BinaryOperator(",
                "    operator=\"+\",",
                "  ),",
                "  right=IntLiteral(",
                "    value=\"1\",",
                "  ),",
                ")"));
  }

  @Test
  public void testStringsAreEscaped() throws Exception {
    String dump = NodePrinter.dump(Module.parse("x = 'a\\tb'  # c\r\n"));
    assertThat(dump).contains("value=\"'a\\\\tb'\",");
    assertThat(dump).contains("value=\"# c\",");
    assertThat(dump).contains("defaultNewline=\"\\r\\n\",");
  }

  @Test
  public void testToStringIsFullDump() throws Exception {
    Node node = Statement.parse("pass\n");
    assertThat(node.toString()).isEqualTo(NodePrinter.dump(node));
  }

  @Test
  public void testPrintAtDepth() {
    StringBuilder buf = new StringBuilder("x=");
    new NodePrinter(buf, 1).printNode(Comma.of());
    assertThat(buf.toString())
        .isEqualTo(
            String.join(
                "\n",
                "x=Comma(",
                "    whitespaceBefore=SimpleWhitespace(",
                "      value=\"\",",
                "    ),",
                "    whitespaceAfter=SimpleWhitespace(",
                "      value=\" \",",
                "    ),",
                "  )"));
  }
}
