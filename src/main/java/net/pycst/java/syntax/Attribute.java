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

/** Syntax node for an attribute access, {@code value.attr}. */
public final class Attribute extends Expression {

  private final Expression value;
  private final Dot dot;
  private final Name attr;

  public Attribute(
      Expression value,
      Dot dot,
      Name attr,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.ATTRIBUTE, lpar, rpar);
    this.value = require("value", value);
    this.dot = require("dot", dot);
    this.attr = require("attr", attr);
  }

  /** Constructs an unparenthesized instance. */
  public Attribute(Expression value, Dot dot, Name attr) {
    this(value, dot, attr, ImmutableList.of(), ImmutableList.of());
  }

  public Expression getValue() {
    return value;
  }

  public Dot getDot() {
    return dot;
  }

  public Name getAttr() {
    return attr;
  }

  @Override
  Attribute walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    Dot dot = visitor.node("dot", this.dot, Dot.class);
    Name attr = visitor.node("attr", this.attr, Name.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Attribute(value, dot, attr, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    value.generate(state);
    dot.generate(state);
    attr.generate(state);
  }
}
