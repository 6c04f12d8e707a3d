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

/** Syntax node for a tuple. The parentheses, when present, are the expression's own. */
public final class TupleExpression extends Expression {

  private final ImmutableList<SequenceElement> elements;

  public TupleExpression(
      List<SequenceElement> elements,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.TUPLE_EXPRESSION, lpar, rpar);
    this.elements = copyOf("elements", elements);
    checkNode(
        !this.elements.isEmpty() || isParenthesized(), "an empty tuple must be parenthesized");
  }

  /** Constructs an unparenthesized instance. */
  public TupleExpression(List<SequenceElement> elements) {
    this(elements, ImmutableList.of(), ImmutableList.of());
  }

  public ImmutableList<SequenceElement> getElements() {
    return elements;
  }

  @Override
  TupleExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    ImmutableList<SequenceElement> elements =
        visitor.nodes("elements", this.elements, SequenceElement.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new TupleExpression(elements, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    int n = elements.size();
    for (int i = 0; i < n; i++) {
      // A one-element tuple needs its comma.
      elements.get(i).generate(state, i < n - 1 || n == 1);
    }
  }
}
