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

/** One target of an assignment, together with the {@code =} after it. */
public final class AssignTarget extends Node {

  private final Expression target;
  private final SimpleWhitespace whitespaceBeforeEqual;
  private final SimpleWhitespace whitespaceAfterEqual;

  public AssignTarget(
      Expression target,
      SimpleWhitespace whitespaceBeforeEqual,
      SimpleWhitespace whitespaceAfterEqual) {
    super(Kind.ASSIGN_TARGET);
    this.target = require("target", target);
    this.whitespaceBeforeEqual = require("whitespaceBeforeEqual", whitespaceBeforeEqual);
    this.whitespaceAfterEqual = require("whitespaceAfterEqual", whitespaceAfterEqual);
  }

  public Expression getTarget() {
    return target;
  }

  public SimpleWhitespace getWhitespaceBeforeEqual() {
    return whitespaceBeforeEqual;
  }

  public SimpleWhitespace getWhitespaceAfterEqual() {
    return whitespaceAfterEqual;
  }

  @Override
  AssignTarget walkFields(FieldVisitor visitor) {
    Expression target = visitor.node("target", this.target, Expression.class);
    SimpleWhitespace whitespaceBeforeEqual =
        visitor.node("whitespaceBeforeEqual", this.whitespaceBeforeEqual, SimpleWhitespace.class);
    SimpleWhitespace whitespaceAfterEqual =
        visitor.node("whitespaceAfterEqual", this.whitespaceAfterEqual, SimpleWhitespace.class);
    return visitor.changed()
        ? new AssignTarget(target, whitespaceBeforeEqual, whitespaceAfterEqual)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    target.generate(state);
    whitespaceBeforeEqual.generate(state);
    state.add("=");
    whitespaceAfterEqual.generate(state);
  }

  /** Returns {@code target = } with single spaces. */
  public static AssignTarget of(Expression target) {
    return new AssignTarget(target, SimpleWhitespace.of(" "), SimpleWhitespace.of(" "));
  }
}
