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

/** Syntax node for {@code raise exc from cause}. */
public final class RaiseStatement extends SmallStatement {

  @Nullable private final SimpleWhitespace whitespaceAfterRaise;
  @Nullable private final Expression exc;
  @Nullable private final FromClause cause;

  public RaiseStatement(
      @Nullable SimpleWhitespace whitespaceAfterRaise,
      @Nullable Expression exc,
      @Nullable FromClause cause,
      @Nullable Semicolon semicolon) {
    super(Kind.RAISE_STATEMENT, semicolon);
    this.whitespaceAfterRaise = whitespaceAfterRaise;
    this.exc = exc;
    this.cause = cause;
    checkNode(cause == null || exc != null, "a raise with a cause must have an exception");
  }

  /** Constructs an instance with no trailing semicolon. */
  public RaiseStatement(
      @Nullable SimpleWhitespace whitespaceAfterRaise,
      @Nullable Expression exc,
      @Nullable FromClause cause) {
    this(whitespaceAfterRaise, exc, cause, null);
  }

  @Nullable
  public SimpleWhitespace getWhitespaceAfterRaise() {
    return whitespaceAfterRaise;
  }

  @Nullable
  public Expression getExc() {
    return exc;
  }

  @Nullable
  public FromClause getCause() {
    return cause;
  }

  @Override
  RaiseStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterRaise =
        visitor.optional("whitespaceAfterRaise", this.whitespaceAfterRaise, SimpleWhitespace.class);
    Expression exc = visitor.optional("exc", this.exc, Expression.class);
    FromClause cause = visitor.optional("cause", this.cause, FromClause.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new RaiseStatement(whitespaceAfterRaise, exc, cause, semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("raise");
    if (whitespaceAfterRaise != null) {
      whitespaceAfterRaise.generate(state);
    } else if (exc != null) {
      state.add(" ");
    }
    if (exc != null) {
      exc.generate(state);
    }
    if (cause != null) {
      cause.generate(state, true);
    }
  }
}
