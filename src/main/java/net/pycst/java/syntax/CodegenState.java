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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Accumulates generated source text. Carries the module's default indentation and newline,
 * which nodes that do not record their own fall back to, and the stack of indentation strings
 * of the enclosing blocks.
 */
final class CodegenState {

  private final String defaultIndent;
  private final String defaultNewline;
  private final List<String> indentTokens = new ArrayList<>();
  private final List<String> tokens = new ArrayList<>();

  // Position tracking, enabled only when computing node ranges.
  @Nullable private final Map<Node, CodeRange> positions;
  private final ArrayDeque<CodePosition> starts = new ArrayDeque<>();
  private int line = 1;
  private int column = 0;

  CodegenState(String defaultIndent, String defaultNewline, boolean trackPositions) {
    this.defaultIndent = defaultIndent;
    this.defaultNewline = defaultNewline;
    this.positions = trackPositions ? new LinkedHashMap<>() : null;
  }

  String getDefaultIndent() {
    return defaultIndent;
  }

  String getDefaultNewline() {
    return defaultNewline;
  }

  void add(String token) {
    if (token.isEmpty()) {
      return;
    }
    tokens.add(token);
    if (positions != null) {
      advance(token);
    }
  }

  /** Emits the indentation of every enclosing block. */
  void addIndentTokens() {
    for (String indent : indentTokens) {
      add(indent);
    }
  }

  void increaseIndent(String indent) {
    indentTokens.add(indent);
  }

  void decreaseIndent() {
    indentTokens.remove(indentTokens.size() - 1);
  }

  boolean isEmpty() {
    return tokens.isEmpty();
  }

  /** Drops the last token if it is the default newline. */
  void popTrailingNewline() {
    if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).equals(defaultNewline)) {
      tokens.remove(tokens.size() - 1);
    }
  }

  void enter(Node node) {
    if (positions != null) {
      starts.push(CodePosition.create(line, column));
    }
  }

  void exit(Node node) {
    if (positions != null) {
      CodeRange range = CodeRange.create(starts.pop(), CodePosition.create(line, column));
      // A node instance reused in several places keeps its first range.
      positions.putIfAbsent(node, range);
    }
  }

  String getCode() {
    return String.join("", tokens);
  }

  ImmutableMap<Node, CodeRange> getPositions() {
    return positions == null ? ImmutableMap.of() : ImmutableMap.copyOf(positions);
  }

  private void advance(String token) {
    int n = token.length();
    for (int i = 0; i < n; i++) {
      char c = token.charAt(i);
      if (c == '\r' && i + 1 < n && token.charAt(i + 1) == '\n') {
        continue;
      }
      if (c == '\n' || c == '\r') {
        line++;
        column = 0;
      } else {
        column++;
      }
    }
  }
}
