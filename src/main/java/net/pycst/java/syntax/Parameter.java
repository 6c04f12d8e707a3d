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
 * A single parameter: {@code name: annotation = default}, or a starred {@code *args} or {@code
 * **kwargs}.
 *
 * <p>A null {@code equal} before a default is generated as {@code " = "} when the parameter is
 * annotated and {@code "="} otherwise. The whitespace after the last parameter, before the closing
 * parenthesis, belongs to {@code whitespaceAfterParam}.
 */
public final class Parameter extends Node {

  private final String star;
  private final ParenthesizableWhitespace whitespaceAfterStar;
  private final Name name;
  @Nullable private final Annotation annotation;
  @Nullable private final AssignEqual equal;
  @Nullable private final Expression defaultValue;
  @Nullable private final Comma comma;
  private final ParenthesizableWhitespace whitespaceAfterParam;

  public Parameter(
      String star,
      ParenthesizableWhitespace whitespaceAfterStar,
      Name name,
      @Nullable Annotation annotation,
      @Nullable AssignEqual equal,
      @Nullable Expression defaultValue,
      @Nullable Comma comma,
      ParenthesizableWhitespace whitespaceAfterParam) {
    super(Kind.PARAMETER);
    this.star = require("star", star);
    this.whitespaceAfterStar = require("whitespaceAfterStar", whitespaceAfterStar);
    this.name = require("name", name);
    this.annotation = annotation;
    this.equal = equal;
    this.defaultValue = defaultValue;
    this.comma = comma;
    this.whitespaceAfterParam = require("whitespaceAfterParam", whitespaceAfterParam);
    checkNode(Argument.STARS.contains(star), "invalid parameter star: '%s'", star);
    checkNode(equal == null || defaultValue != null, "an '=' requires a default value");
    checkNode(defaultValue == null || star.isEmpty(), "a starred parameter cannot have a default");
  }

  /** Returns "", "*" or "**". */
  public String getStar() {
    return star;
  }

  public ParenthesizableWhitespace getWhitespaceAfterStar() {
    return whitespaceAfterStar;
  }

  public Name getName() {
    return name;
  }

  @Nullable
  public Annotation getAnnotation() {
    return annotation;
  }

  @Nullable
  public AssignEqual getEqual() {
    return equal;
  }

  @Nullable
  public Expression getDefaultValue() {
    return defaultValue;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  public ParenthesizableWhitespace getWhitespaceAfterParam() {
    return whitespaceAfterParam;
  }

  @Override
  Parameter walkFields(FieldVisitor visitor) {
    String star = visitor.attribute("star", this.star, String.class);
    ParenthesizableWhitespace whitespaceAfterStar =
        visitor.node(
            "whitespaceAfterStar",
            this.whitespaceAfterStar,
            ParenthesizableWhitespace.class);
    Name name = visitor.node("name", this.name, Name.class);
    Annotation annotation = visitor.optional("annotation", this.annotation, Annotation.class);
    AssignEqual equal = visitor.optional("equal", this.equal, AssignEqual.class);
    Expression defaultValue = visitor.optional("defaultValue", this.defaultValue, Expression.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    ParenthesizableWhitespace whitespaceAfterParam =
        visitor.node(
            "whitespaceAfterParam",
            this.whitespaceAfterParam,
            ParenthesizableWhitespace.class);
    return visitor.changed()
        ? new Parameter(
            star,
            whitespaceAfterStar,
            name,
            annotation,
            equal,
            defaultValue,
            comma,
            whitespaceAfterParam)
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
    name.generate(state);
    if (annotation != null) {
      annotation.generateWithIndicator(state, ":");
    }
    if (defaultValue != null) {
      if (equal != null) {
        equal.generate(state);
      } else {
        state.add(annotation != null ? " = " : "=");
      }
      defaultValue.generate(state);
    }
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
    whitespaceAfterParam.generate(state);
  }

  /** Returns a plain parameter with the given name. */
  public static Parameter of(String name) {
    return new Parameter(
        "",
        SimpleWhitespace.of(""),
        Name.of(name),
        null,
        null,
        null,
        null,
        SimpleWhitespace.of(""));
  }
}
