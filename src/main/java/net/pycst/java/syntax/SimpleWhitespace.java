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

/**
 * Whitespace that cannot contain a newline except after a backslash continuation: spaces, tabs,
 * form feeds and escaped line breaks.
 */
public final class SimpleWhitespace extends ParenthesizableWhitespace {

  private final String value;

  public SimpleWhitespace(String value) {
    super(Kind.SIMPLE_WHITESPACE);
    this.value = require("value", value);
    checkNode(isValid(value), "invalid simple whitespace: '%s'", value);
  }

  /** Returns the exact whitespace text. */
  public String getValue() {
    return value;
  }

  @Override
  SimpleWhitespace walkFields(FieldVisitor visitor) {
    String value = visitor.attribute("value", this.value, String.class);
    return visitor.changed() ? new SimpleWhitespace(value) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add(value);
  }

  /** Returns whitespace with the given text. */
  public static SimpleWhitespace of(String value) {
    return new SimpleWhitespace(value);
  }

  @Override
  public boolean isEmpty() {
    return value.isEmpty();
  }

  private static boolean isValid(String value) {
    int n = value.length();
    for (int i = 0; i < n; i++) {
      char c = value.charAt(i);
      if (c == ' ' || c == '\t' || c == '\f') {
        continue;
      }
      if (c != '\\' || i + 1 >= n) {
        return false;
      }
      char next = value.charAt(++i);
      if (next == '\r' && i + 1 < n && value.charAt(i + 1) == '\n') {
        i++;
      } else if (next != '\n' && next != '\r') {
        return false;
      }
    }
    return true;
  }
}
