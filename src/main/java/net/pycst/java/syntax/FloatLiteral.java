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
import java.util.regex.Pattern;

/** Syntax node for a floating-point literal, as written. */
public final class FloatLiteral extends Expression {

  private final String value;

  public FloatLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.FLOAT_LITERAL, lpar, rpar);
    this.value = require("value", value);
    checkNode(PATTERN.matcher(value).matches(), "not a float literal: '%s'", value);
  }

  /** Constructs an unparenthesized instance. */
  public FloatLiteral(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  public String getValue() {
    return value;
  }

  @Override
  FloatLiteral walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new FloatLiteral(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  static final String DIGITS = "[0-9](?:_?[0-9])*";
  static final String EXPONENT = "[eE][-+]?" + DIGITS;
  static final String POINT_FLOAT = "(?:(?:" + DIGITS + ")?\\." + DIGITS + "|" + DIGITS + "\\.)";
  static final String FLOAT =
      "(?:" + POINT_FLOAT + "(?:" + EXPONENT + ")?|" + DIGITS + EXPONENT + ")";

  private static final Pattern PATTERN = Pattern.compile(FLOAT);

  /** Returns the value denoted by this literal. */
  public double evaluatedValue() {
    return Double.parseDouble(value.replace("_", ""));
  }
}
