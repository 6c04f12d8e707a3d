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

/** Syntax node for an imaginary literal such as {@code 2j}. */
public final class ImaginaryLiteral extends Expression {

  private final String value;

  public ImaginaryLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.IMAGINARY_LITERAL, lpar, rpar);
    this.value = require("value", value);
    checkNode(PATTERN.matcher(value).matches(), "not an imaginary literal: '%s'", value);
  }

  /** Constructs an unparenthesized instance. */
  public ImaginaryLiteral(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  public String getValue() {
    return value;
  }

  @Override
  ImaginaryLiteral walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new ImaginaryLiteral(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  private static final Pattern PATTERN =
      Pattern.compile("(?:" + FloatLiteral.FLOAT + "|" + FloatLiteral.DIGITS + ")[jJ]");

  /** Returns the imaginary part denoted by this literal. */
  public double evaluatedValue() {
    return Double.parseDouble(value.substring(0, value.length() - 1).replace("_", ""));
  }
}
