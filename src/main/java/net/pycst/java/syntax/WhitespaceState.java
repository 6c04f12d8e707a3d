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
 * A cursor into the source lines marking where the whitespace between two adjacent tokens
 * starts. Adjacent tokens share one instance (the "after" state of a token is the "before" state
 * of the next), so once a node consumes the whitespace and advances the cursor, no other node can
 * claim the same text.
 *
 * <p>Mutable, but only during a single parse.
 */
final class WhitespaceState {
  int line; // 1-based
  int column; // 0-based
  String absoluteIndent;
  boolean isParenthesized;

  WhitespaceState(int line, int column, String absoluteIndent, boolean isParenthesized) {
    this.line = line;
    this.column = column;
    this.absoluteIndent = absoluteIndent;
    this.isParenthesized = isParenthesized;
  }

  @Override
  public String toString() {
    return String.format(
        "WhitespaceState(%d:%d, indent=%s, parenthesized=%s)",
        line, column, absoluteIndent.replace("\t", "\\t"), isParenthesized);
  }
}
