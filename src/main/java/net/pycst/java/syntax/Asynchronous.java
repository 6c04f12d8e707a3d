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

/** The {@code async} keyword of an async function, loop, with or comprehension. */
public final class Asynchronous extends Node {

  private final ParenthesizableWhitespace whitespaceAfter;

  public Asynchronous(ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.ASYNCHRONOUS);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    checkNode(!whitespaceAfter.isEmpty(), "'async' must be followed by whitespace");
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  Asynchronous walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new Asynchronous(whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add("async");
    whitespaceAfter.generate(state);
  }
}
