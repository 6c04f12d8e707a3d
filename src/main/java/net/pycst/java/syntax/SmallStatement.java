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
import javax.annotation.Nullable;

/**
 * Base class for statements that fit on one line and may be separated by semicolons. A null
 * semicolon means the statement is followed by a default {@code "; "} when it is not the last on
 * its line, and by nothing otherwise.
 */
public abstract class SmallStatement extends Node {

  @Nullable private final Semicolon semicolon;

  SmallStatement(Kind kind, @Nullable Semicolon semicolon) {
    super(kind);
    this.semicolon = semicolon;
  }

  /** Returns the semicolon after this statement, if written. */
  @Nullable
  public Semicolon getSemicolon() {
    return semicolon;
  }

  /** Generates the statement itself, without the semicolon. */
  abstract void codegenContent(CodegenState state);

  @Override
  final void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  final void codegen(CodegenState state, boolean defaultSemicolon) {
    codegenContent(state);
    if (semicolon != null) {
      semicolon.generate(state);
    } else if (defaultSemicolon) {
      state.add("; ");
    }
  }

  /** Generates the statements of one line; a line with no statements gets {@code pass}. */
  static void generateBody(CodegenState state, List<SmallStatement> body) {
    if (body.isEmpty()) {
      state.add("pass");
      return;
    }
    generateSeparated(state, body);
  }
}
