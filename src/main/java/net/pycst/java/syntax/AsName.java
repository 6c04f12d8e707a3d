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

/** The {@code as name} part of an import, with item or except handler. */
public final class AsName extends Node {

  private final ParenthesizableWhitespace whitespaceBeforeAs;
  private final ParenthesizableWhitespace whitespaceAfterAs;
  private final Expression name;

  public AsName(
      ParenthesizableWhitespace whitespaceBeforeAs,
      ParenthesizableWhitespace whitespaceAfterAs,
      Expression name) {
    super(Kind.AS_NAME);
    this.whitespaceBeforeAs = require("whitespaceBeforeAs", whitespaceBeforeAs);
    this.whitespaceAfterAs = require("whitespaceAfterAs", whitespaceAfterAs);
    this.name = require("name", name);
  }

  public ParenthesizableWhitespace getWhitespaceBeforeAs() {
    return whitespaceBeforeAs;
  }

  public ParenthesizableWhitespace getWhitespaceAfterAs() {
    return whitespaceAfterAs;
  }

  public Expression getName() {
    return name;
  }

  @Override
  AsName walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBeforeAs =
        visitor.node(
            "whitespaceBeforeAs",
            this.whitespaceBeforeAs,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterAs =
        visitor.node("whitespaceAfterAs", this.whitespaceAfterAs, ParenthesizableWhitespace.class);
    Expression name = visitor.node("name", this.name, Expression.class);
    return visitor.changed() ? new AsName(whitespaceBeforeAs, whitespaceAfterAs, name) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBeforeAs.generate(state);
    state.add("as");
    whitespaceAfterAs.generate(state);
    name.generate(state);
  }
}
