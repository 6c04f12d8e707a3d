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
import java.util.Locale;

/**
 * Syntax node for a single string or bytes literal, with its prefix and quotes, exactly as
 * written.
 */
public final class StringLiteral extends StringExpression {

  private final String value;

  public StringLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.STRING_LITERAL, lpar, rpar);
    this.value = require("value", value);
    checkNode(
        prefixLength(value) >= 0 && !getPrefix().toLowerCase(Locale.ROOT).contains("f"),
        "not a string literal: '%s'",
        value);
  }

  /** Constructs an unparenthesized instance. */
  public StringLiteral(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  /** Returns the literal exactly as written, including prefix and quotes. */
  public String getValue() {
    return value;
  }

  @Override
  StringLiteral walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new StringLiteral(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  /** Returns a literal with the given source text, such as {@code "'abc'"}. */
  public static StringLiteral of(String value) {
    return new StringLiteral(value);
  }

  /** Returns the prefix, such as {@code rb}, in its original case. */
  public String getPrefix() {
    return value.substring(0, prefixLength(value));
  }

  /** Returns the quote, one of {@code '}, {@code "}, {@code \'\'\'} or {@code """}. */
  public String getQuote() {
    return quoteOf(value, getPrefix().length());
  }

  /** Returns the text between the quotes, with escapes left as written. */
  public String getRawValue() {
    int start = getPrefix().length() + getQuote().length();
    return value.substring(start, value.length() - getQuote().length());
  }

  @Override
  public boolean isBytes() {
    return getPrefix().toLowerCase(Locale.ROOT).contains("b");
  }
}
