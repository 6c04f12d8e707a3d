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

/** Syntax node for {@code assert test, msg}. */
public final class AssertStatement extends SmallStatement {

  private final SimpleWhitespace whitespaceAfterAssert;
  private final Expression test;
  @Nullable private final Comma comma;
  @Nullable private final Expression msg;

  public AssertStatement(
      SimpleWhitespace whitespaceAfterAssert,
      Expression test,
      @Nullable Comma comma,
      @Nullable Expression msg,
      @Nullable Semicolon semicolon) {
    super(Kind.ASSERT_STATEMENT, semicolon);
    this.whitespaceAfterAssert = require("whitespaceAfterAssert", whitespaceAfterAssert);
    this.test = require("test", test);
    this.comma = comma;
    this.msg = msg;
    checkNode(comma == null || msg != null, "a comma requires a message");
  }

  /** Constructs an instance with no trailing semicolon. */
  public AssertStatement(
      SimpleWhitespace whitespaceAfterAssert,
      Expression test,
      @Nullable Comma comma,
      @Nullable Expression msg) {
    this(whitespaceAfterAssert, test, comma, msg, null);
  }

  public SimpleWhitespace getWhitespaceAfterAssert() {
    return whitespaceAfterAssert;
  }

  public Expression getTest() {
    return test;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Nullable
  public Expression getMsg() {
    return msg;
  }

  @Override
  AssertStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterAssert =
        visitor.node("whitespaceAfterAssert", this.whitespaceAfterAssert, SimpleWhitespace.class);
    Expression test = visitor.node("test", this.test, Expression.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    Expression msg = visitor.optional("msg", this.msg, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new AssertStatement(whitespaceAfterAssert, test, comma, msg, semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("assert");
    whitespaceAfterAssert.generate(state);
    test.generate(state);
    if (comma != null) {
      comma.generate(state);
    } else if (msg != null) {
      state.add(", ");
    }
    if (msg != null) {
      msg.generate(state);
    }
  }
}
