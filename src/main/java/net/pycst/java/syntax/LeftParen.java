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

/** An opening parenthesis owned by an expression or statement. */
public final class LeftParen extends Node {

  private final ParenthesizableWhitespace whitespaceAfter;

  public LeftParen(ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.LEFT_PAREN);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  LeftParen walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new LeftParen(whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add("(");
    whitespaceAfter.generate(state);
  }

  public static LeftParen of() {
    return new LeftParen(SimpleWhitespace.of(""));
  }
}
