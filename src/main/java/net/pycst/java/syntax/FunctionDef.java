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

/**
 * Syntax node for a function definition, possibly async and decorated.
 *
 * <p>The leading lines are those before the first decorator (or before {@code def} when there are
 * no decorators); lines between the last decorator and {@code def} are {@code
 * linesAfterDecorators}.
 */
public final class FunctionDef extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final ImmutableList<Decorator> decorators;
  private final ImmutableList<EmptyLine> linesAfterDecorators;
  @Nullable private final Asynchronous asynchronous;
  private final SimpleWhitespace whitespaceAfterDef;
  private final Name name;
  private final SimpleWhitespace whitespaceAfterName;
  private final ParenthesizableWhitespace whitespaceBeforeParams;
  private final Parameters params;
  @Nullable private final Annotation returns;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;

  public FunctionDef(
      List<EmptyLine> leadingLines,
      List<Decorator> decorators,
      List<EmptyLine> linesAfterDecorators,
      @Nullable Asynchronous asynchronous,
      SimpleWhitespace whitespaceAfterDef,
      Name name,
      SimpleWhitespace whitespaceAfterName,
      ParenthesizableWhitespace whitespaceBeforeParams,
      Parameters params,
      @Nullable Annotation returns,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body) {
    super(Kind.FUNCTION_DEF);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.decorators = copyOf("decorators", decorators);
    this.linesAfterDecorators = copyOf("linesAfterDecorators", linesAfterDecorators);
    this.asynchronous = asynchronous;
    this.whitespaceAfterDef = require("whitespaceAfterDef", whitespaceAfterDef);
    this.name = require("name", name);
    this.whitespaceAfterName = require("whitespaceAfterName", whitespaceAfterName);
    this.whitespaceBeforeParams = require("whitespaceBeforeParams", whitespaceBeforeParams);
    this.params = require("params", params);
    this.returns = returns;
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public ImmutableList<Decorator> getDecorators() {
    return decorators;
  }

  public ImmutableList<EmptyLine> getLinesAfterDecorators() {
    return linesAfterDecorators;
  }

  @Nullable
  public Asynchronous getAsynchronous() {
    return asynchronous;
  }

  public SimpleWhitespace getWhitespaceAfterDef() {
    return whitespaceAfterDef;
  }

  public Name getName() {
    return name;
  }

  public SimpleWhitespace getWhitespaceAfterName() {
    return whitespaceAfterName;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeParams() {
    return whitespaceBeforeParams;
  }

  public Parameters getParams() {
    return params;
  }

  /** Returns the return annotation, generated after {@code ->}. */
  @Nullable
  public Annotation getReturns() {
    return returns;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Override
  FunctionDef walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    ImmutableList<Decorator> decorators =
        visitor.nodes("decorators", this.decorators, Decorator.class);
    ImmutableList<EmptyLine> linesAfterDecorators =
        visitor.nodes("linesAfterDecorators", this.linesAfterDecorators, EmptyLine.class);
    Asynchronous asynchronous =
        visitor.optional("asynchronous", this.asynchronous, Asynchronous.class);
    SimpleWhitespace whitespaceAfterDef =
        visitor.node("whitespaceAfterDef", this.whitespaceAfterDef, SimpleWhitespace.class);
    Name name = visitor.node("name", this.name, Name.class);
    SimpleWhitespace whitespaceAfterName =
        visitor.node("whitespaceAfterName", this.whitespaceAfterName, SimpleWhitespace.class);
    ParenthesizableWhitespace whitespaceBeforeParams =
        visitor.node(
            "whitespaceBeforeParams",
            this.whitespaceBeforeParams,
            ParenthesizableWhitespace.class);
    Parameters params = visitor.node("params", this.params, Parameters.class);
    Annotation returns = visitor.optional("returns", this.returns, Annotation.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    return visitor.changed()
        ? new FunctionDef(
            leadingLines,
            decorators,
            linesAfterDecorators,
            asynchronous,
            whitespaceAfterDef,
            name,
            whitespaceAfterName,
            whitespaceBeforeParams,
            params,
            returns,
            whitespaceBeforeColon,
            body)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    generateAll(state, decorators);
    generateAll(state, linesAfterDecorators);
    state.addIndentTokens();
    if (asynchronous != null) {
      asynchronous.generate(state);
    }
    state.add("def");
    whitespaceAfterDef.generate(state);
    name.generate(state);
    whitespaceAfterName.generate(state);
    state.add("(");
    whitespaceBeforeParams.generate(state);
    params.generate(state);
    state.add(")");
    if (returns != null) {
      returns.generateWithIndicator(state, "->");
    }
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
  }
}
