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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The {@code else} clause of an if, while, for or try statement. */
public final class ElseClause extends Node {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;

  public ElseClause(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body) {
    super(Kind.ELSE_CLAUSE);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Override
  ElseClause walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    return visitor.changed() ? new ElseClause(leadingLines, whitespaceBeforeColon, body) : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add("else");
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
  }
}
