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

/** Syntax node for a set display, {@code {a, b}}. */
public final class SetExpression extends Expression {

  private final LeftBracket lbrace;
  private final ImmutableList<SequenceElement> elements;
  private final RightBracket rbrace;

  public SetExpression(
      LeftBracket lbrace,
      List<SequenceElement> elements,
      RightBracket rbrace,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.SET_EXPRESSION, lpar, rpar);
    this.lbrace = require("lbrace", lbrace);
    this.elements = copyOf("elements", elements);
    this.rbrace = require("rbrace", rbrace);
    checkNode(!this.elements.isEmpty(), "a set must have at least one element");
    checkNode(
        lbrace.getToken() == TokenKind.LBRACE && rbrace.getToken() == TokenKind.RBRACE,
        "a set requires braces");
  }

  /** Constructs an unparenthesized instance. */
  public SetExpression(LeftBracket lbrace, List<SequenceElement> elements, RightBracket rbrace) {
    this(lbrace, elements, rbrace, ImmutableList.of(), ImmutableList.of());
  }

  public LeftBracket getLbrace() {
    return lbrace;
  }

  public ImmutableList<SequenceElement> getElements() {
    return elements;
  }

  public RightBracket getRbrace() {
    return rbrace;
  }

  @Override
  SetExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    LeftBracket lbrace = visitor.node("lbrace", this.lbrace, LeftBracket.class);
    ImmutableList<SequenceElement> elements =
        visitor.nodes("elements", this.elements, SequenceElement.class);
    RightBracket rbrace = visitor.node("rbrace", this.rbrace, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new SetExpression(lbrace, elements, rbrace, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    lbrace.generate(state);
    generateSeparated(state, elements);
    rbrace.generate(state);
  }
}
