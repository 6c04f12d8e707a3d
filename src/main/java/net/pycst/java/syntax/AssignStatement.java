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
import javax.annotation.Nullable;

/**
 * Syntax node for an assignment, {@code a = b = value}. Each target owns the {@code =} after it.
 */
public final class AssignStatement extends SmallStatement {

  private final ImmutableList<AssignTarget> targets;
  private final Expression value;

  public AssignStatement(
      List<AssignTarget> targets,
      Expression value,
      @Nullable Semicolon semicolon) {
    super(Kind.ASSIGN_STATEMENT, semicolon);
    this.targets = copyOf("targets", targets);
    this.value = require("value", value);
    checkNode(!this.targets.isEmpty(), "an assignment must have at least one target");
  }

  /** Constructs an instance with no trailing semicolon. */
  public AssignStatement(List<AssignTarget> targets, Expression value) {
    this(targets, value, null);
  }

  public ImmutableList<AssignTarget> getTargets() {
    return targets;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  AssignStatement walkFields(FieldVisitor visitor) {
    ImmutableList<AssignTarget> targets =
        visitor.nodes("targets", this.targets, AssignTarget.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new AssignStatement(targets, value, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    generateAll(state, targets);
    value.generate(state);
  }
}
