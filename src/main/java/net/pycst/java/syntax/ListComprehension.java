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

/** Syntax node for a list comprehension, {@code [elt for ...]}. */
public final class ListComprehension extends Expression {

  private final LeftBracket lbracket;
  private final Expression elt;
  private final ComprehensionFor forIn;
  private final RightBracket rbracket;

  public ListComprehension(
      LeftBracket lbracket,
      Expression elt,
      ComprehensionFor forIn,
      RightBracket rbracket,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.LIST_COMPREHENSION, lpar, rpar);
    this.lbracket = require("lbracket", lbracket);
    this.elt = require("elt", elt);
    this.forIn = require("forIn", forIn);
    this.rbracket = require("rbracket", rbracket);
  }

  /** Constructs an unparenthesized instance. */
  public ListComprehension(
      LeftBracket lbracket,
      Expression elt,
      ComprehensionFor forIn,
      RightBracket rbracket) {
    this(lbracket, elt, forIn, rbracket, ImmutableList.of(), ImmutableList.of());
  }

  public LeftBracket getLbracket() {
    return lbracket;
  }

  public Expression getElt() {
    return elt;
  }

  public ComprehensionFor getForIn() {
    return forIn;
  }

  public RightBracket getRbracket() {
    return rbracket;
  }

  @Override
  ListComprehension walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    LeftBracket lbracket = visitor.node("lbracket", this.lbracket, LeftBracket.class);
    Expression elt = visitor.node("elt", this.elt, Expression.class);
    ComprehensionFor forIn = visitor.node("forIn", this.forIn, ComprehensionFor.class);
    RightBracket rbracket = visitor.node("rbracket", this.rbracket, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new ListComprehension(lbracket, elt, forIn, rbracket, lpar, rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    lbracket.generate(state);
    elt.generate(state);
    forIn.generate(state);
    rbracket.generate(state);
  }
}
