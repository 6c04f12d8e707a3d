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

/** One operator and right-hand operand of a comparison chain. */
public final class ComparisonTarget extends Node {

  private final ComparisonOperator operator;
  private final Expression comparator;

  public ComparisonTarget(ComparisonOperator operator, Expression comparator) {
    super(Kind.COMPARISON_TARGET);
    this.operator = require("operator", operator);
    this.comparator = require("comparator", comparator);
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public Expression getComparator() {
    return comparator;
  }

  @Override
  ComparisonTarget walkFields(FieldVisitor visitor) {
    ComparisonOperator operator = visitor.node("operator", this.operator, ComparisonOperator.class);
    Expression comparator = visitor.node("comparator", this.comparator, Expression.class);
    return visitor.changed() ? new ComparisonTarget(operator, comparator) : this;
  }

  @Override
  void codegen(CodegenState state) {
    operator.generate(state);
    comparator.generate(state);
  }
}
