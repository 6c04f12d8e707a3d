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
import java.math.BigInteger;
import java.util.List;
import java.util.regex.Pattern;

/** Syntax node for an integer literal, in any base, as written. */
public final class IntLiteral extends Expression {

  private final String value;

  public IntLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.INT_LITERAL, lpar, rpar);
    this.value = require("value", value);
    checkNode(PATTERN.matcher(value).matches(), "not an integer literal: '%s'", value);
  }

  /** Constructs an unparenthesized instance. */
  public IntLiteral(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  /** Returns the literal exactly as written. */
  public String getValue() {
    return value;
  }

  @Override
  IntLiteral walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new IntLiteral(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  private static final Pattern PATTERN =
      Pattern.compile(
          "0[xX](?:_?[0-9a-fA-F])+|0[bB](?:_?[01])+|0[oO](?:_?[0-7])+"
              + "|0(?:_?0)*|[1-9](?:_?[0-9])*");

  /** Returns the value denoted by this literal. */
  public BigInteger evaluatedValue() {
    String digits = value.replace("_", "");
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      switch (Character.toLowerCase(digits.charAt(1))) {
        case 'x':
          return new BigInteger(digits.substring(2), 16);
        case 'o':
          return new BigInteger(digits.substring(2), 8);
        case 'b':
          return new BigInteger(digits.substring(2), 2);
        default:
          break;
      }
    }
    return new BigInteger(digits);
  }
}
