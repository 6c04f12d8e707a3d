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

/** A colon of a slice or lambda. */
public final class Colon extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final ParenthesizableWhitespace whitespaceAfter;

  public Colon(
      ParenthesizableWhitespace whitespaceBefore,
      ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.COLON);
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
  Colon walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new Colon(whitespaceBefore, whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add(":");
    whitespaceAfter.generate(state);
  }

  /** Returns {@code ":"}. */
  public static Colon of() {
    return new Colon(SimpleWhitespace.of(""), SimpleWhitespace.of(""));
  }
}
