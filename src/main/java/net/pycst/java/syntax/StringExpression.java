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

import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;

/** Base class for string literals, f-strings and implicitly concatenated strings. */
public abstract class StringExpression extends Expression {

  StringExpression(Kind kind, List<LeftParen> lpar, List<RightParen> rpar) {
    super(kind, lpar, rpar);
  }

  /** Reports whether this is a bytes literal. */
  public abstract boolean isBytes();

  /**
   * Returns the length of the prefix of the quoted literal {@code value}, or -1 if {@code value}
   * does not start with a valid prefix followed by a quote and end with the same quote.
   */
  static int prefixLength(String value) {
    int i = 0;
    while (i < value.length() && Character.isLetter(value.charAt(i))) {
      i++;
    }
    if (i > 2 || !isValidPrefix(value.substring(0, i))) {
      return -1;
    }
    String quote = quoteOf(value, i);
    if (quote == null || value.length() < i + 2 * quote.length() || !value.endsWith(quote)) {
      return -1;
    }
    return i;
  }

  /** Returns the quote starting at {@code start}, or null if there is none. */
  @Nullable
  static String quoteOf(String value, int start) {
    if (start >= value.length()) {
      return null;
    }
    char c = value.charAt(start);
    if (c != '\'' && c != '"') {
      return null;
    }
    String triple = String.valueOf(new char[] {c, c, c});
    if (value.startsWith(triple, start) && value.length() >= start + 6) {
      return triple;
    }
    return String.valueOf(c);
  }

  private static boolean isValidPrefix(String prefix) {
    switch (prefix.toLowerCase(Locale.ROOT)) {
      case "":
      case "r":
      case "u":
      case "b":
      case "f":
      case "br":
      case "rb":
      case "fr":
      case "rf":
        return true;
      default:
        return false;
    }
  }
}
