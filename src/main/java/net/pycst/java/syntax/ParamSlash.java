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

import javax.annotation.Nullable;

/** The {@code /} marking the end of positional-only parameters. */
public final class ParamSlash extends Node {

  private final ParenthesizableWhitespace whitespaceAfter;
  @Nullable private final Comma comma;

  public ParamSlash(ParenthesizableWhitespace whitespaceAfter, @Nullable Comma comma) {
    super(Kind.PARAM_SLASH);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    this.comma = comma;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  ParamSlash walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new ParamSlash(whitespaceAfter, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    state.add("/");
    whitespaceAfter.generate(state);
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
  }
}
