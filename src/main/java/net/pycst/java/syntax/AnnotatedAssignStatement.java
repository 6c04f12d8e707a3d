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
 * Syntax node for an annotated assignment, {@code target: annotation = value}, where the value is
 * optional.
 */
public final class AnnotatedAssignStatement extends SmallStatement {

  private final Expression target;
  private final Annotation annotation;
  @Nullable private final AssignEqual equal;
  @Nullable private final Expression value;

  public AnnotatedAssignStatement(
      Expression target,
      Annotation annotation,
      @Nullable AssignEqual equal,
      @Nullable Expression value,
      @Nullable Semicolon semicolon) {
    super(Kind.ANNOTATED_ASSIGN_STATEMENT, semicolon);
    this.target = require("target", target);
    this.annotation = require("annotation", annotation);
    this.equal = equal;
    this.value = value;
    checkNode(equal == null || value != null, "an '=' requires a value");
  }

  /** Constructs an instance with no trailing semicolon. */
  public AnnotatedAssignStatement(
      Expression target,
      Annotation annotation,
      @Nullable AssignEqual equal,
      @Nullable Expression value) {
    this(target, annotation, equal, value, null);
  }

  public Expression getTarget() {
    return target;
  }

  public Annotation getAnnotation() {
    return annotation;
  }

  @Nullable
  public AssignEqual getEqual() {
    return equal;
  }

  @Nullable
  public Expression getValue() {
    return value;
  }

  @Override
  AnnotatedAssignStatement walkFields(FieldVisitor visitor) {
    Expression target = visitor.node("target", this.target, Expression.class);
    Annotation annotation = visitor.node("annotation", this.annotation, Annotation.class);
    AssignEqual equal = visitor.optional("equal", this.equal, AssignEqual.class);
    Expression value = visitor.optional("value", this.value, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new AnnotatedAssignStatement(target, annotation, equal, value, semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    target.generate(state);
    annotation.generateWithIndicator(state, ":");
    if (value != null) {
      if (equal != null) {
        equal.generate(state);
      } else {
        state.add(" = ");
      }
      value.generate(state);
    }
  }
}
