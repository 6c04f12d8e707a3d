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

/** Syntax node for a del statement. */
public final class DelStatement extends SmallStatement {

  private final SimpleWhitespace whitespaceAfterDel;
  private final Expression target;

  public DelStatement(
      SimpleWhitespace whitespaceAfterDel,
      Expression target,
      @Nullable Semicolon semicolon) {
    super(Kind.DEL_STATEMENT, semicolon);
    this.whitespaceAfterDel = require("whitespaceAfterDel", whitespaceAfterDel);
    this.target = require("target", target);
  }

  /** Constructs an instance with no trailing semicolon. */
  public DelStatement(SimpleWhitespace whitespaceAfterDel, Expression target) {
    this(whitespaceAfterDel, target, null);
  }

  public SimpleWhitespace getWhitespaceAfterDel() {
    return whitespaceAfterDel;
  }

  public Expression getTarget() {
    return target;
  }

  @Override
  DelStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterDel =
        visitor.node("whitespaceAfterDel", this.whitespaceAfterDel, SimpleWhitespace.class);
    Expression target = visitor.node("target", this.target, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new DelStatement(whitespaceAfterDel, target, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("del");
    whitespaceAfterDel.generate(state);
    target.generate(state);
  }
}
