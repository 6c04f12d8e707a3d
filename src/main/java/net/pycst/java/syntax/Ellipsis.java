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

/** Syntax node for the ellipsis literal {@code ...}. */
public final class Ellipsis extends Expression {

  public Ellipsis(List<LeftParen> lpar, List<RightParen> rpar) {
    super(Kind.ELLIPSIS, lpar, rpar);
  }

  /** Constructs an unparenthesized instance. */
  public Ellipsis() {
    this(ImmutableList.of(), ImmutableList.of());
  }

  @Override
  Ellipsis walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Ellipsis(lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("...");
  }
}
