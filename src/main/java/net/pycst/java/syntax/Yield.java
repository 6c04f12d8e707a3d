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

/** Syntax node for {@code yield value} or {@code yield from iterable}. */
public final class Yield extends Expression {

  @Nullable private final ParenthesizableWhitespace whitespaceAfterYield;
  @Nullable private final Node value;

  public Yield(
      @Nullable ParenthesizableWhitespace whitespaceAfterYield,
      @Nullable Node value,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.YIELD, lpar, rpar);
    this.whitespaceAfterYield = whitespaceAfterYield;
    this.value = value;
    checkNode(
        value == null || value instanceof Expression || value instanceof FromClause,
        "a yield value must be an expression or a from clause, got %s",
        value == null ? null : value.kind());
  }

  /** Constructs an unparenthesized instance. */
  public Yield(@Nullable ParenthesizableWhitespace whitespaceAfterYield, @Nullable Node value) {
    this(whitespaceAfterYield, value, ImmutableList.of(), ImmutableList.of());
  }

  /** Returns the whitespace after {@code yield}, or null for one space when there is a value. */
  @Nullable
  public ParenthesizableWhitespace getWhitespaceAfterYield() {
    return whitespaceAfterYield;
  }

  /** Returns the yielded Expression, a FromClause, or null. */
  @Nullable
  public Node getValue() {
    return value;
  }

  @Override
  Yield walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    ParenthesizableWhitespace whitespaceAfterYield =
        visitor.optional(
            "whitespaceAfterYield",
            this.whitespaceAfterYield,
            ParenthesizableWhitespace.class);
    Node value = visitor.optional("value", this.value, Node.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Yield(whitespaceAfterYield, value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("yield");
    if (whitespaceAfterYield != null) {
      whitespaceAfterYield.generate(state);
    } else if (value != null) {
      state.add(" ");
    }
    if (value != null) {
      value.generate(state, false);
    }
  }
}
