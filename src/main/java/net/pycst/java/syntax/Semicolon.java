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

/** A semicolon separating small statements on one line. */
public final class Semicolon extends Node {

  private final SimpleWhitespace whitespaceBefore;
  private final SimpleWhitespace whitespaceAfter;

  public Semicolon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) {
    super(Kind.SEMICOLON);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
  }

  public SimpleWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  public SimpleWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  Semicolon walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, SimpleWhitespace.class);
    SimpleWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, SimpleWhitespace.class);
    return visitor.changed() ? new Semicolon(whitespaceBefore, whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add(";");
    whitespaceAfter.generate(state);
  }

  /** Returns {@code "; "}. */
  public static Semicolon of() {
    return new Semicolon(SimpleWhitespace.of(""), SimpleWhitespace.of(" "));
  }
}
