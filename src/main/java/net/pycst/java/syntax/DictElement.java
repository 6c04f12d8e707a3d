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

/** A {@code key: value} pair of a dict display. */
public final class DictElement extends DictItem {

  private final Expression key;
  private final ParenthesizableWhitespace whitespaceBeforeColon;
  private final ParenthesizableWhitespace whitespaceAfterColon;
  private final Expression value;
  @Nullable private final Comma comma;

  public DictElement(
      Expression key,
      ParenthesizableWhitespace whitespaceBeforeColon,
      ParenthesizableWhitespace whitespaceAfterColon,
      Expression value,
      @Nullable Comma comma) {
    super(Kind.DICT_ELEMENT);
    this.key = require("key", key);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.whitespaceAfterColon = require("whitespaceAfterColon", whitespaceAfterColon);
    this.value = require("value", value);
    this.comma = comma;
  }

  public Expression getKey() {
    return key;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public ParenthesizableWhitespace getWhitespaceAfterColon() {
    return whitespaceAfterColon;
  }

  public Expression getValue() {
    return value;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  DictElement walkFields(FieldVisitor visitor) {
    Expression key = visitor.node("key", this.key, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeColon =
        visitor.node(
            "whitespaceBeforeColon",
            this.whitespaceBeforeColon,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterColon =
        visitor.node(
            "whitespaceAfterColon",
            this.whitespaceAfterColon,
            ParenthesizableWhitespace.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed()
        ? new DictElement(key, whitespaceBeforeColon, whitespaceAfterColon, value, comma)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    key.generate(state);
    whitespaceBeforeColon.generate(state);
    state.add(":");
    whitespaceAfterColon.generate(state);
    value.generate(state);
    generateComma(state, defaultComma);
  }
}
