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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link WhitespaceParser}. */
@RunWith(JUnit4.class)
public final class WhitespaceParserTest {

  private static ParseInput input(String source) {
    return ParseInput.of(source, ParserConfig.DEFAULT);
  }

  private static WhitespaceState at(int line, int column) {
    return new WhitespaceState(line, column, "", false);
  }

  @Test
  public void testSimpleWhitespaceStopsAtToken() {
    WhitespaceState state = at(1, 0);
    SimpleWhitespace ws = WhitespaceParser.parseSimpleWhitespace(input(" \t x\n"), state);
    assertThat(ws.getValue()).isEqualTo(" \t ");
    assertThat(state.line).isEqualTo(1);
    assertThat(state.column).isEqualTo(3);
  }

  @Test
  public void testSimpleWhitespaceFollowsContinuations() {
    WhitespaceState state = at(1, 1);
    SimpleWhitespace ws =
        WhitespaceParser.parseSimpleWhitespace(input("a \\\n\\\n  b\n"), state);
    assertThat(ws.getValue()).isEqualTo(" \\\n\\\n  ");
    assertThat(state.line).isEqualTo(3);
    assertThat(state.column).isEqualTo(2);
  }

  @Test
  public void testConsumedWhitespaceIsNotClaimedTwice() {
    ParseInput input = input("a   b\n");
    WhitespaceState state = at(1, 1);
    assertThat(WhitespaceParser.parseSimpleWhitespace(input, state).getValue()).isEqualTo("   ");
    assertThat(WhitespaceParser.parseSimpleWhitespace(input, state).isEmpty()).isTrue();
  }

  @Test
  public void testParenthesizableWhitespaceOutsideBrackets() {
    WhitespaceState state = at(1, 1);
    ParenthesizableWhitespace ws =
        WhitespaceParser.parseParenthesizableWhitespace(input("a  \nb\n"), state);
    assertThat(ws).isInstanceOf(SimpleWhitespace.class);
    assertThat(((SimpleWhitespace) ws).getValue()).isEqualTo("  ");
  }

  @Test
  public void testParenthesizedWhitespace() {
    WhitespaceState state = new WhitespaceState(1, 1, "", true);
    ParenthesizableWhitespace ws =
        WhitespaceParser.parseParenthesizableWhitespace(input("(  # c\n\n    x)\n"), state);
    assertThat(ws).isInstanceOf(ParenthesizedWhitespace.class);
    ParenthesizedWhitespace pw = (ParenthesizedWhitespace) ws;
    assertThat(pw.getFirstLine().getWhitespace().getValue()).isEqualTo("  ");
    assertThat(pw.getFirstLine().getComment().getValue()).isEqualTo("# c");
    assertThat(pw.getEmptyLines()).hasSize(1);
    assertThat(pw.getLastLine().getValue()).isEqualTo("    ");
    assertThat(state.line).isEqualTo(3);
    assertThat(state.column).isEqualTo(4);
  }

  @Test
  public void testTrailingWhitespaceKeepsNonDefaultNewline() {
    WhitespaceState state = at(2, 1);
    TrailingWhitespace ws =
        WhitespaceParser.parseTrailingWhitespace(input("a\nb  # c\r\n"), state);
    assertThat(ws.getWhitespace().getValue()).isEqualTo("  ");
    assertThat(ws.getComment().getValue()).isEqualTo("# c");
    assertThat(ws.getNewline().getValue()).isEqualTo("\r\n");
    assertThat(state.line).isEqualTo(3);
    assertThat(state.column).isEqualTo(0);
  }

  @Test
  public void testTrailingWhitespaceUsesDefaultNewline() {
    TrailingWhitespace ws = WhitespaceParser.parseTrailingWhitespace(input("a\n"), at(1, 1));
    assertThat(ws.getNewline().getValue()).isNull();
  }

  @Test
  public void testTrailingWhitespaceRequiresEndOfLine() {
    assertThrows(
        IllegalStateException.class,
        () -> WhitespaceParser.parseTrailingWhitespace(input("a b\n"), at(1, 1)));
  }

  @Test
  public void testEmptyLines() {
    WhitespaceState state = at(1, 0);
    ImmutableList<EmptyLine> lines =
        WhitespaceParser.parseEmptyLines(input("\n  # c\n\nx\n"), state);
    assertThat(lines).hasSize(3);
    assertThat(lines.get(1).getWhitespace().getValue()).isEqualTo("  ");
    assertThat(lines.get(1).getComment().getValue()).isEqualTo("# c");
    assertThat(state.line).isEqualTo(4);
    assertThat(state.column).isEqualTo(0);
  }

  @Test
  public void testNoEmptyLinesLeavesStateUntouched() {
    WhitespaceState state = at(1, 0);
    assertThat(WhitespaceParser.parseEmptyLines(input("x\n"), state)).isEmpty();
    assertThat(state.line).isEqualTo(1);
    assertThat(state.column).isEqualTo(0);
  }

  @Test
  public void testEmptyLinesAreJudgedAgainstBlockIndentation() {
    WhitespaceState state = new WhitespaceState(1, 0, "    ", false);
    ImmutableList<EmptyLine> lines =
        WhitespaceParser.parseEmptyLines(input("    # a\n  # b\nx\n"), state);
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0).isIndent()).isTrue();
    assertThat(lines.get(1).isIndent()).isFalse();
    assertThat(lines.get(1).getWhitespace().getValue()).isEqualTo("  ");
  }

  @Test
  public void testOverrideIndentLeavesOuterLinesForFollowingCode() {
    WhitespaceState state = at(1, 0);
    ImmutableList<EmptyLine> lines =
        WhitespaceParser.parseEmptyLines(input("    # in\n# out\nx\n"), state, "    ");
    assertThat(lines).hasSize(1);
    assertThat(lines.get(0).getComment().getValue()).isEqualTo("# in");
    assertThat(state.line).isEqualTo(2);
  }
}
