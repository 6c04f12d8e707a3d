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

/**
 * Syntax node for a generator expression. Its parentheses are the expression's own, and may be
 * absent when it is the sole argument of a call.
 */
public final class GeneratorExpression extends Expression {

  private final Expression elt;
  private final ComprehensionFor forIn;

  public GeneratorExpression(
      Expression elt,
      ComprehensionFor forIn,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.GENERATOR_EXPRESSION, lpar, rpar);
    this.elt = require("elt", elt);
    this.forIn = require("forIn", forIn);
  }

  /** Constructs an unparenthesized instance. */
  public GeneratorExpression(Expression elt, ComprehensionFor forIn) {
    this(elt, forIn, ImmutableList.of(), ImmutableList.of());
  }

  public Expression getElt() {
    return elt;
  }

  public ComprehensionFor getForIn() {
    return forIn;
  }

  @Override
  GeneratorExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression elt = visitor.node("elt", this.elt, Expression.class);
    ComprehensionFor forIn = visitor.node("forIn", this.forIn, ComprehensionFor.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new GeneratorExpression(elt, forIn, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    elt.generate(state);
    forIn.generate(state);
  }
}
