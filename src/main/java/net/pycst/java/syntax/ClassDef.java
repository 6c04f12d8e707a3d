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
 * Syntax node for a class definition.
 *
 * <p>Base classes and keywords (such as {@code metaclass=M}) are kept in one argument list in
 * source order; see {@link #getBases} and {@link #getKeywords}. When the parentheses are null they
 * are generated only if there are arguments.
 */
public final class ClassDef extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final ImmutableList<Decorator> decorators;
  private final ImmutableList<EmptyLine> linesAfterDecorators;
  private final SimpleWhitespace whitespaceAfterClass;
  private final Name name;
  private final SimpleWhitespace whitespaceAfterName;
  @Nullable private final LeftParen lpar;
  private final ImmutableList<Argument> arguments;
  @Nullable private final RightParen rpar;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;

  public ClassDef(
      List<EmptyLine> leadingLines,
      List<Decorator> decorators,
      List<EmptyLine> linesAfterDecorators,
      SimpleWhitespace whitespaceAfterClass,
      Name name,
      SimpleWhitespace whitespaceAfterName,
      @Nullable LeftParen lpar,
      List<Argument> arguments,
      @Nullable RightParen rpar,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body) {
    super(Kind.CLASS_DEF);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.decorators = copyOf("decorators", decorators);
    this.linesAfterDecorators = copyOf("linesAfterDecorators", linesAfterDecorators);
    this.whitespaceAfterClass = require("whitespaceAfterClass", whitespaceAfterClass);
    this.name = require("name", name);
    this.whitespaceAfterName = require("whitespaceAfterName", whitespaceAfterName);
    this.lpar = lpar;
    this.arguments = copyOf("arguments", arguments);
    this.rpar = rpar;
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    checkNode((lpar == null) == (rpar == null), "cannot have unbalanced parentheses");
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

  public SimpleWhitespace getWhitespaceAfterClass() {
    return whitespaceAfterClass;
  }

  public Name getName() {
    return name;
  }

  public SimpleWhitespace getWhitespaceAfterName() {
    return whitespaceAfterName;
  }

  @Nullable
  public LeftParen getLpar() {
    return lpar;
  }

  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Nullable
  public RightParen getRpar() {
    return rpar;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Override
  ClassDef walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    ImmutableList<Decorator> decorators =
        visitor.nodes("decorators", this.decorators, Decorator.class);
    ImmutableList<EmptyLine> linesAfterDecorators =
        visitor.nodes("linesAfterDecorators", this.linesAfterDecorators, EmptyLine.class);
    SimpleWhitespace whitespaceAfterClass =
        visitor.node("whitespaceAfterClass", this.whitespaceAfterClass, SimpleWhitespace.class);
    Name name = visitor.node("name", this.name, Name.class);
    SimpleWhitespace whitespaceAfterName =
        visitor.node("whitespaceAfterName", this.whitespaceAfterName, SimpleWhitespace.class);
    LeftParen lpar = visitor.optional("lpar", this.lpar, LeftParen.class);
    ImmutableList<Argument> arguments = visitor.nodes("arguments", this.arguments, Argument.class);
    RightParen rpar = visitor.optional("rpar", this.rpar, RightParen.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    return visitor.changed()
        ? new ClassDef(
            leadingLines,
            decorators,
            linesAfterDecorators,
            whitespaceAfterClass,
            name,
            whitespaceAfterName,
            lpar,
            arguments,
            rpar,
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
    state.add("class");
    whitespaceAfterClass.generate(state);
    name.generate(state);
    whitespaceAfterName.generate(state);
    if (lpar != null) {
      lpar.generate(state);
    } else if (!arguments.isEmpty()) {
      state.add("(");
    }
    generateSeparated(state, arguments);
    if (rpar != null) {
      rpar.generate(state);
    } else if (!arguments.isEmpty()) {
      state.add(")");
    }
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
  }

  /** Returns the positional arguments, the base classes. */
  public ImmutableList<Argument> getBases() {
    return arguments.stream()
        .filter(arg -> arg.getKeyword() == null && arg.getStar().isEmpty())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the keyword and starred arguments. */
  public ImmutableList<Argument> getKeywords() {
    return arguments.stream()
        .filter(arg -> arg.getKeyword() != null || !arg.getStar().isEmpty())
        .collect(ImmutableList.toImmutableList());
  }
}
