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

/** Syntax node for a set comprehension, {@code {elt for ...}}. */
public final class SetComprehension extends Expression {

  private final LeftBracket lbrace;
  private final Expression elt;
  private final ComprehensionFor forIn;
  private final RightBracket rbrace;

  public SetComprehension(
      LeftBracket lbrace,
      Expression elt,
      ComprehensionFor forIn,
      RightBracket rbrace,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.SET_COMPREHENSION, lpar, rpar);
    this.lbrace = require("lbrace", lbrace);
    this.elt = require("elt", elt);
    this.forIn = require("forIn", forIn);
    this.rbrace = require("rbrace", rbrace);
  }

  /** Constructs an unparenthesized instance. */
  public SetComprehension(
      LeftBracket lbrace,
      Expression elt,
      ComprehensionFor forIn,
      RightBracket rbrace) {
    this(lbrace, elt, forIn, rbrace, ImmutableList.of(), ImmutableList.of());
  }

  public LeftBracket getLbrace() {
    return lbrace;
  }

  public Expression getElt() {
    return elt;
  }

  public ComprehensionFor getForIn() {
    return forIn;
  }

  public RightBracket getRbrace() {
    return rbrace;
  }

  @Override
  SetComprehension walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    LeftBracket lbrace = visitor.node("lbrace", this.lbrace, LeftBracket.class);
    Expression elt = visitor.node("elt", this.elt, Expression.class);
    ComprehensionFor forIn = visitor.node("forIn", this.forIn, ComprehensionFor.class);
    RightBracket rbrace = visitor.node("rbrace", this.rbrace, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new SetComprehension(lbrace, elt, forIn, rbrace, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    lbrace.generate(state);
    elt.generate(state);
    forIn.generate(state);
    rbrace.generate(state);
  }
}
