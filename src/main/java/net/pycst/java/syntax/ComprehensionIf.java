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

/** An {@code if} filter of a comprehension. */
public final class ComprehensionIf extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final ParenthesizableWhitespace whitespaceBeforeTest;
  private final Expression test;

  public ComprehensionIf(
      ParenthesizableWhitespace whitespaceBefore,
      ParenthesizableWhitespace whitespaceBeforeTest,
      Expression test) {
    super(Kind.COMPREHENSION_IF);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.whitespaceBeforeTest = require("whitespaceBeforeTest", whitespaceBeforeTest);
    this.test = require("test", test);
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeTest() {
    return whitespaceBeforeTest;
  }

  public Expression getTest() {
    return test;
  }

  @Override
  ComprehensionIf walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceBeforeTest =
        visitor.node(
            "whitespaceBeforeTest",
            this.whitespaceBeforeTest,
            ParenthesizableWhitespace.class);
    Expression test = visitor.node("test", this.test, Expression.class);
    return visitor.changed()
        ? new ComprehensionIf(whitespaceBefore, whitespaceBeforeTest, test)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add("if");
    whitespaceBeforeTest.generate(state);
    test.generate(state);
  }
}
