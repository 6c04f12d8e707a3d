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
 * A type annotation together with its indicator: {@code :} for parameters and variables, {@code ->}
 * for return types. The indicator is supplied by the owner when code is generated. A null {@code
 * whitespaceBeforeIndicator} stands for nothing before {@code :} and one space before {@code ->}.
 */
public final class Annotation extends Node {

  @Nullable private final ParenthesizableWhitespace whitespaceBeforeIndicator;
  private final ParenthesizableWhitespace whitespaceAfterIndicator;
  private final Expression annotation;

  public Annotation(
      @Nullable ParenthesizableWhitespace whitespaceBeforeIndicator,
      ParenthesizableWhitespace whitespaceAfterIndicator,
      Expression annotation) {
    super(Kind.ANNOTATION);
    this.whitespaceBeforeIndicator = whitespaceBeforeIndicator;
    this.whitespaceAfterIndicator = require("whitespaceAfterIndicator", whitespaceAfterIndicator);
    this.annotation = require("annotation", annotation);
  }

  @Nullable
  public ParenthesizableWhitespace getWhitespaceBeforeIndicator() {
    return whitespaceBeforeIndicator;
  }

  public ParenthesizableWhitespace getWhitespaceAfterIndicator() {
    return whitespaceAfterIndicator;
  }

  public Expression getAnnotation() {
    return annotation;
  }

  @Override
  Annotation walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBeforeIndicator =
        visitor.optional(
            "whitespaceBeforeIndicator",
            this.whitespaceBeforeIndicator,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterIndicator =
        visitor.node(
            "whitespaceAfterIndicator",
            this.whitespaceAfterIndicator,
            ParenthesizableWhitespace.class);
    Expression annotation = visitor.node("annotation", this.annotation, Expression.class);
    return visitor.changed()
        ? new Annotation(whitespaceBeforeIndicator, whitespaceAfterIndicator, annotation)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegenWithIndicator(state, ":");
  }

  /** Returns an annotation with default spacing. */
  public static Annotation of(Expression annotation) {
    return new Annotation(null, SimpleWhitespace.of(" "), annotation);
  }

  void generateWithIndicator(CodegenState state, String indicator) {
    state.enter(this);
    codegenWithIndicator(state, indicator);
    state.exit(this);
  }

  private void codegenWithIndicator(CodegenState state, String indicator) {
    if (whitespaceBeforeIndicator != null) {
      whitespaceBeforeIndicator.generate(state);
    } else if (indicator.equals("->")) {
      state.add(" ");
    }
    state.add(indicator);
    whitespaceAfterIndicator.generate(state);
    annotation.generate(state);
  }
}
