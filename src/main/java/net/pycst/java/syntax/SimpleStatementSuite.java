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

/**
 * A suite of small statements on the same line as its compound statement header, as in {@code if
 * x: return y}.
 */
public final class SimpleStatementSuite extends Suite {

  private final SimpleWhitespace leadingWhitespace;
  private final ImmutableList<SmallStatement> body;
  private final TrailingWhitespace trailingWhitespace;

  public SimpleStatementSuite(
      SimpleWhitespace leadingWhitespace,
      List<SmallStatement> body,
      TrailingWhitespace trailingWhitespace) {
    super(Kind.SIMPLE_STATEMENT_SUITE);
    this.leadingWhitespace = require("leadingWhitespace", leadingWhitespace);
    this.body = copyOf("body", body);
    this.trailingWhitespace = require("trailingWhitespace", trailingWhitespace);
  }

  public SimpleWhitespace getLeadingWhitespace() {
    return leadingWhitespace;
  }

  public ImmutableList<SmallStatement> getBody() {
    return body;
  }

  public TrailingWhitespace getTrailingWhitespace() {
    return trailingWhitespace;
  }

  @Override
  SimpleStatementSuite walkFields(FieldVisitor visitor) {
    SimpleWhitespace leadingWhitespace =
        visitor.node("leadingWhitespace", this.leadingWhitespace, SimpleWhitespace.class);
    ImmutableList<SmallStatement> body = visitor.nodes("body", this.body, SmallStatement.class);
    TrailingWhitespace trailingWhitespace =
        visitor.node("trailingWhitespace", this.trailingWhitespace, TrailingWhitespace.class);
    return visitor.changed()
        ? new SimpleStatementSuite(leadingWhitespace, body, trailingWhitespace)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    leadingWhitespace.generate(state);
    SmallStatement.generateBody(state, body);
    trailingWhitespace.generate(state);
  }
}
