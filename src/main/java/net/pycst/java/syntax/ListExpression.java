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

/** Syntax node for a list display, {@code [a, b]}. */
public final class ListExpression extends Expression {

  private final LeftBracket lbracket;
  private final ImmutableList<SequenceElement> elements;
  private final RightBracket rbracket;

  public ListExpression(
      LeftBracket lbracket,
      List<SequenceElement> elements,
      RightBracket rbracket,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.LIST_EXPRESSION, lpar, rpar);
    this.lbracket = require("lbracket", lbracket);
    this.elements = copyOf("elements", elements);
    this.rbracket = require("rbracket", rbracket);
    checkNode(
        lbracket.getToken() == TokenKind.LBRACKET && rbracket.getToken() == TokenKind.RBRACKET,
        "a list requires square brackets");
  }

  /** Constructs an unparenthesized instance. */
  public ListExpression(
      LeftBracket lbracket,
      List<SequenceElement> elements,
      RightBracket rbracket) {
    this(lbracket, elements, rbracket, ImmutableList.of(), ImmutableList.of());
  }

  public LeftBracket getLbracket() {
    return lbracket;
  }

  public ImmutableList<SequenceElement> getElements() {
    return elements;
  }

  public RightBracket getRbracket() {
    return rbracket;
  }

  @Override
  ListExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    LeftBracket lbracket = visitor.node("lbracket", this.lbracket, LeftBracket.class);
    ImmutableList<SequenceElement> elements =
        visitor.nodes("elements", this.elements, SequenceElement.class);
    RightBracket rbracket = visitor.node("rbracket", this.rbracket, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new ListExpression(lbracket, elements, rbracket, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    lbracket.generate(state);
    generateSeparated(state, elements);
    rbracket.generate(state);
  }
}
