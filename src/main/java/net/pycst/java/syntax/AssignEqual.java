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

/** The {@code =} of a keyword argument, default value or annotated assignment. */
public final class AssignEqual extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final ParenthesizableWhitespace whitespaceAfter;

  public AssignEqual(
      ParenthesizableWhitespace whitespaceBefore,
      ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.ASSIGN_EQUAL);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  AssignEqual walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new AssignEqual(whitespaceBefore, whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add("=");
    whitespaceAfter.generate(state);
  }

  /** Returns {@code " = "}. */
  public static AssignEqual of() {
    return new AssignEqual(SimpleWhitespace.of(" "), SimpleWhitespace.of(" "));
  }
}
