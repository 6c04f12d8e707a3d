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

/** A closing parenthesis owned by an expression or statement. */
public final class RightParen extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;

  public RightParen(ParenthesizableWhitespace whitespaceBefore) {
    super(Kind.RIGHT_PAREN);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  @Override
  RightParen walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    return visitor.changed() ? new RightParen(whitespaceBefore) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add(")");
  }

  public static RightParen of() {
    return new RightParen(SimpleWhitespace.of(""));
  }
}
