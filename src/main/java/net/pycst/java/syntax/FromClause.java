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

/**
 * The {@code from} part of {@code raise exc from cause} or {@code yield from iterable}.
 *
 * <p>A null {@code whitespaceBeforeFrom} stands for one space after a raise and for nothing after a
 * yield, whose own whitespace already separates the keywords.
 */
public final class FromClause extends Node {

  @Nullable private final ParenthesizableWhitespace whitespaceBeforeFrom;
  private final ParenthesizableWhitespace whitespaceAfterFrom;
  private final Expression item;

  public FromClause(
      @Nullable ParenthesizableWhitespace whitespaceBeforeFrom,
      ParenthesizableWhitespace whitespaceAfterFrom,
      Expression item) {
    super(Kind.FROM_CLAUSE);
    this.whitespaceBeforeFrom = whitespaceBeforeFrom;
    this.whitespaceAfterFrom = require("whitespaceAfterFrom", whitespaceAfterFrom);
    this.item = require("item", item);
  }

  @Nullable
  public ParenthesizableWhitespace getWhitespaceBeforeFrom() {
    return whitespaceBeforeFrom;
  }

  public ParenthesizableWhitespace getWhitespaceAfterFrom() {
    return whitespaceAfterFrom;
  }

  public Expression getItem() {
    return item;
  }

  @Override
  FromClause walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBeforeFrom =
        visitor.optional(
            "whitespaceBeforeFrom",
            this.whitespaceBeforeFrom,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterFrom =
        visitor.node(
            "whitespaceAfterFrom",
            this.whitespaceAfterFrom,
            ParenthesizableWhitespace.class);
    Expression item = visitor.node("item", this.item, Expression.class);
    return visitor.changed()
        ? new FromClause(whitespaceBeforeFrom, whitespaceAfterFrom, item)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean spaceBeforeFrom) {
    if (whitespaceBeforeFrom != null) {
      whitespaceBeforeFrom.generate(state);
    } else if (spaceBeforeFrom) {
      state.add(" ");
    }
    state.add("from");
    whitespaceAfterFrom.generate(state);
    item.generate(state);
  }
}
