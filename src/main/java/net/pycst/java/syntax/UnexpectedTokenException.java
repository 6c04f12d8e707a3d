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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

/** Thrown when the parser finds a token that no grammar production accepts at that point. */
public final class UnexpectedTokenException extends ParseException {

  private final ImmutableSet<String> expected;
  private final Token found;

  UnexpectedTokenException(ImmutableSet<String> expected, Token found, String sourceLine) {
    super(message(expected, found), found.getStart(), sourceLine);
    this.expected = expected;
    this.found = found;
  }

  /** Returns descriptions of the tokens or constructs that would have been accepted. */
  public ImmutableSet<String> getExpected() {
    return expected;
  }

  /** Returns the offending token. */
  public Token getFound() {
    return found;
  }

  private static String message(ImmutableSet<String> expected, Token found) {
    String what =
        expected.size() == 1
            ? expected.iterator().next()
            : "one of " + Joiner.on(", ").join(expected);
    return "expected " + what + ", got " + found.describe();
  }
}
