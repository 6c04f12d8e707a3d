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

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** Syntax node for a for loop, {@code for target in iter: ...}. */
public final class ForStatement extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  @Nullable private final Asynchronous asynchronous;
  private final SimpleWhitespace whitespaceAfterFor;
  private final Expression target;
  private final SimpleWhitespace whitespaceBeforeIn;
  private final SimpleWhitespace whitespaceAfterIn;
  private final Expression iter;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;
  @Nullable private final ElseClause orelse;

  public ForStatement(
      List<EmptyLine> leadingLines,
      @Nullable Asynchronous asynchronous,
      SimpleWhitespace whitespaceAfterFor,
      Expression target,
      SimpleWhitespace whitespaceBeforeIn,
      SimpleWhitespace whitespaceAfterIn,
      Expression iter,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body,
      @Nullable ElseClause orelse) {
    super(Kind.FOR_STATEMENT);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.asynchronous = asynchronous;
    this.whitespaceAfterFor = require("whitespaceAfterFor", whitespaceAfterFor);
    this.target = require("target", target);
    this.whitespaceBeforeIn = require("whitespaceBeforeIn", whitespaceBeforeIn);
    this.whitespaceAfterIn = require("whitespaceAfterIn", whitespaceAfterIn);
    this.iter = require("iter", iter);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    this.orelse = orelse;
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  /** Returns the {@code async} keyword of an async for loop. */
  @Nullable
  public Asynchronous getAsynchronous() {
    return asynchronous;
  }

  public SimpleWhitespace getWhitespaceAfterFor() {
    return whitespaceAfterFor;
  }

  /** Returns the variables assigned by each iteration. */
  public Expression getTarget() {
    return target;
  }

  public SimpleWhitespace getWhitespaceBeforeIn() {
    return whitespaceBeforeIn;
  }

  public SimpleWhitespace getWhitespaceAfterIn() {
    return whitespaceAfterIn;
  }

  /** Returns the iterable value. */
  public Expression getIter() {
    return iter;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Nullable
  public ElseClause getOrelse() {
    return orelse;
  }

  @Override
  ForStatement walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    Asynchronous asynchronous =
        visitor.optional("asynchronous", this.asynchronous, Asynchronous.class);
    SimpleWhitespace whitespaceAfterFor =
        visitor.node("whitespaceAfterFor", this.whitespaceAfterFor, SimpleWhitespace.class);
    Expression target = visitor.node("target", this.target, Expression.class);
    SimpleWhitespace whitespaceBeforeIn =
        visitor.node("whitespaceBeforeIn", this.whitespaceBeforeIn, SimpleWhitespace.class);
    SimpleWhitespace whitespaceAfterIn =
        visitor.node("whitespaceAfterIn", this.whitespaceAfterIn, SimpleWhitespace.class);
    Expression iter = visitor.node("iter", this.iter, Expression.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    ElseClause orelse = visitor.optional("orelse", this.orelse, ElseClause.class);
    return visitor.changed()
        ? new ForStatement(
            leadingLines,
            asynchronous,
            whitespaceAfterFor,
            target,
            whitespaceBeforeIn,
            whitespaceAfterIn,
            iter,
            whitespaceBeforeColon,
            body,
            orelse)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    if (asynchronous != null) {
      asynchronous.generate(state);
    }
    state.add("for");
    whitespaceAfterFor.generate(state);
    target.generate(state);
    whitespaceBeforeIn.generate(state);
    state.add("in");
    whitespaceAfterIn.generate(state);
    iter.generate(state);
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
    if (orelse != null) {
      orelse.generate(state);
    }
  }
}
