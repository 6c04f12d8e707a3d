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

/** Syntax node for an identifier, including {@code None}, {@code True} and {@code False}. */
public final class Name extends Expression {

  private final String value;

  public Name(String value, List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.NAME, lpar, rpar);
    this.value = require("value", value);
    checkNode(isValid(value), "not a valid identifier: '%s'", value);
  }

  /** Constructs an unparenthesized instance. */
  public Name(String value) {
    this(value, ImmutableList.of(), ImmutableList.of());
  }

  public String getValue() {
    return value;
  }

  @Override
  Name walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    String value = visitor.attribute("value", this.value, String.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Name(value, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(value);
  }

  /** Returns an unparenthesized name. */
  public static Name of(String value) {
    return new Name(value);
  }

  /** Reports whether {@code value} is a syntactically valid Python identifier. */
  static boolean isValid(String value) {
    if (value.isEmpty()) {
      return false;
    }
    int cp = value.codePointAt(0);
    if (cp != '_' && !Character.isUnicodeIdentifierStart(cp)) {
      return false;
    }
    for (int i = Character.charCount(cp); i < value.length(); i += Character.charCount(cp)) {
      cp = value.codePointAt(i);
      if (cp != '_' && !Character.isUnicodeIdentifierPart(cp)) {
        return false;
      }
    }
    return true;
  }
}
