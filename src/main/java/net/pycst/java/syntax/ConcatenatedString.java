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
 * Syntax node for implicitly concatenated string literals, {@code "a" "b"}. Longer runs nest to the
 * right: {@code "a" "b" "c"} has {@code "a"} on the left and {@code "b" "c"} on the right.
 */
public final class ConcatenatedString extends StringExpression {

  private final StringExpression left;
  private final ParenthesizableWhitespace whitespaceBetween;
  private final StringExpression right;

  public ConcatenatedString(
      StringExpression left,
      ParenthesizableWhitespace whitespaceBetween,
      StringExpression right,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.CONCATENATED_STRING, lpar, rpar);
    this.left = require("left", left);
    this.whitespaceBetween = require("whitespaceBetween", whitespaceBetween);
    this.right = require("right", right);
    checkNode(left.isBytes() == right.isBytes(), "cannot concatenate bytes and str");
  }

  /** Constructs an unparenthesized instance. */
  public ConcatenatedString(
      StringExpression left,
      ParenthesizableWhitespace whitespaceBetween,
      StringExpression right) {
    this(left, whitespaceBetween, right, ImmutableList.of(), ImmutableList.of());
  }

  public StringExpression getLeft() {
    return left;
  }

  public ParenthesizableWhitespace getWhitespaceBetween() {
    return whitespaceBetween;
  }

  public StringExpression getRight() {
    return right;
  }

  @Override
  ConcatenatedString walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    StringExpression left = visitor.node("left", this.left, StringExpression.class);
    ParenthesizableWhitespace whitespaceBetween =
        visitor.node("whitespaceBetween", this.whitespaceBetween, ParenthesizableWhitespace.class);
    StringExpression right = visitor.node("right", this.right, StringExpression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new ConcatenatedString(left, whitespaceBetween, right, lpar, rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    left.generate(state);
    whitespaceBetween.generate(state);
    right.generate(state);
  }

  @Override
  public boolean isBytes() {
    return left.isBytes();
  }
}
