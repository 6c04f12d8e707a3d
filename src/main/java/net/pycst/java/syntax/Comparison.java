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

/** Syntax node for a comparison chain such as {@code a < b <= c}, kept flat as in the source. */
public final class Comparison extends Expression {

  private final Expression left;
  private final ImmutableList<ComparisonTarget> comparisons;

  public Comparison(
      Expression left,
      List<ComparisonTarget> comparisons,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.COMPARISON, lpar, rpar);
    this.left = require("left", left);
    this.comparisons = copyOf("comparisons", comparisons);
    checkNode(!this.comparisons.isEmpty(), "a comparison must have at least one operator");
  }

  /** Constructs an unparenthesized instance. */
  public Comparison(Expression left, List<ComparisonTarget> comparisons) {
    this(left, comparisons, ImmutableList.of(), ImmutableList.of());
  }

  public Expression getLeft() {
    return left;
  }

  public ImmutableList<ComparisonTarget> getComparisons() {
    return comparisons;
  }

  @Override
  Comparison walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression left = visitor.node("left", this.left, Expression.class);
    ImmutableList<ComparisonTarget> comparisons =
        visitor.nodes("comparisons", this.comparisons, ComparisonTarget.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Comparison(left, comparisons, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    left.generate(state);
    generateAll(state, comparisons);
  }
}
