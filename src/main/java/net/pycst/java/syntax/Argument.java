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

import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * A call or class argument: positional, keyword ({@code key=value}), or unpacked ({@code *args},
 * {@code **kwargs}).
 *
 * <p>The whitespace after the last argument, before the closing parenthesis, belongs to {@code
 * whitespaceAfterArg}.
 */
public final class Argument extends Node {

  private final String star;
  private final ParenthesizableWhitespace whitespaceAfterStar;
  @Nullable private final Name keyword;
  @Nullable private final AssignEqual equal;
  private final Expression value;
  @Nullable private final Comma comma;
  private final ParenthesizableWhitespace whitespaceAfterArg;

  public Argument(
      String star,
      ParenthesizableWhitespace whitespaceAfterStar,
      @Nullable Name keyword,
      @Nullable AssignEqual equal,
      Expression value,
      @Nullable Comma comma,
      ParenthesizableWhitespace whitespaceAfterArg) {
    super(Kind.ARGUMENT);
    this.star = require("star", star);
    this.whitespaceAfterStar = require("whitespaceAfterStar", whitespaceAfterStar);
    this.keyword = keyword;
    this.equal = equal;
    this.value = require("value", value);
    this.comma = comma;
    this.whitespaceAfterArg = require("whitespaceAfterArg", whitespaceAfterArg);
    checkNode(STARS.contains(star), "invalid argument star: '%s'", star);
    checkNode(keyword == null || star.isEmpty(), "a keyword argument cannot be unpacked");
    checkNode(equal == null || keyword != null, "an '=' requires a keyword");
  }

  /** Returns "", "*" or "**". */
  public String getStar() {
    return star;
  }

  public ParenthesizableWhitespace getWhitespaceAfterStar() {
    return whitespaceAfterStar;
  }

  @Nullable
  public Name getKeyword() {
    return keyword;
  }

  @Nullable
  public AssignEqual getEqual() {
    return equal;
  }

  public Expression getValue() {
    return value;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  public ParenthesizableWhitespace getWhitespaceAfterArg() {
    return whitespaceAfterArg;
  }

  @Override
  Argument walkFields(FieldVisitor visitor) {
    String star = visitor.attribute("star", this.star, String.class);
    ParenthesizableWhitespace whitespaceAfterStar =
        visitor.node(
            "whitespaceAfterStar",
            this.whitespaceAfterStar,
            ParenthesizableWhitespace.class);
    Name keyword = visitor.optional("keyword", this.keyword, Name.class);
    AssignEqual equal = visitor.optional("equal", this.equal, AssignEqual.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    ParenthesizableWhitespace whitespaceAfterArg =
        visitor.node(
            "whitespaceAfterArg",
            this.whitespaceAfterArg,
            ParenthesizableWhitespace.class);
    return visitor.changed()
        ? new Argument(star, whitespaceAfterStar, keyword, equal, value, comma, whitespaceAfterArg)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    state.add(star);
    whitespaceAfterStar.generate(state);
    if (keyword != null) {
      keyword.generate(state);
      if (equal != null) {
        equal.generate(state);
      } else {
        state.add(" = ");
      }
    }
    value.generate(state);
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
    whitespaceAfterArg.generate(state);
  }

  static final ImmutableSet<String> STARS = ImmutableSet.of("", "*", "**");

  /** Returns a positional argument. */
  public static Argument of(Expression value) {
    SimpleWhitespace empty = SimpleWhitespace.of("");
    return new Argument("", empty, null, null, value, null, SimpleWhitespace.of(""));
  }
}
