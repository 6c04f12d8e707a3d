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
 * Syntax node for an f-string. The literal is kept as a single leaf, exactly as written; the
 * replacement fields inside it are not parsed.
 */
public final class FormattedString extends StringExpression {

  private final String value;

  public FormattedString(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.FORMATTED_STRING, lpar, rpar);
    this.value = require("value", value);
    checkNode(
        prefixLength(value) >= 0 && getPrefix().toLowerCase(Locale.ROOT).contains("f"),
        "not an f-string: '%s'",
        value);
  }

  /** Constructs an unparenthesized instance. */
  public FormattedString(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  public String getValue() {
    return value;
  }

  @Override
  FormattedString walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new FormattedString(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  /** Returns the prefix, such as {@code rf}, in its original case. */
  public String getPrefix() {
    return value.substring(0, prefixLength(value));
  }

  /** Returns the quote that delimits this literal. */
  public String getQuote() {
    return quoteOf(value, getPrefix().length());
  }

  @Override
  public boolean isBytes() {
    return false;
  }
}
