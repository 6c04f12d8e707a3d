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

/** A decorator line, {@code @expression}, owning its own leading lines. */
public final class Decorator extends Node {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceAfterAt;
  private final Expression decorator;
  private final TrailingWhitespace trailingWhitespace;

  public Decorator(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceAfterAt,
      Expression decorator,
      TrailingWhitespace trailingWhitespace) {
    super(Kind.DECORATOR);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceAfterAt = require("whitespaceAfterAt", whitespaceAfterAt);
    this.decorator = require("decorator", decorator);
    this.trailingWhitespace = require("trailingWhitespace", trailingWhitespace);
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceAfterAt() {
    return whitespaceAfterAt;
  }

  public Expression getDecorator() {
    return decorator;
  }

  public TrailingWhitespace getTrailingWhitespace() {
    return trailingWhitespace;
  }

  @Override
  Decorator walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceAfterAt =
        visitor.node("whitespaceAfterAt", this.whitespaceAfterAt, SimpleWhitespace.class);
    Expression decorator = visitor.node("decorator", this.decorator, Expression.class);
    TrailingWhitespace trailingWhitespace =
        visitor.node("trailingWhitespace", this.trailingWhitespace, TrailingWhitespace.class);
    return visitor.changed()
        ? new Decorator(leadingLines, whitespaceAfterAt, decorator, trailingWhitespace)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add("@");
    whitespaceAfterAt.generate(state);
    decorator.generate(state);
    trailingWhitespace.generate(state);
  }
}
