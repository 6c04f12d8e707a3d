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

import javax.annotation.Nullable;

/**
 * A slice of a subscript, {@code lower:upper:step}. Every part is optional except the first colon;
 * a null second colon is generated only if there is a step.
 */
public final class Slice extends SubscriptSlice {

  @Nullable private final Expression lower;
  private final Colon firstColon;
  @Nullable private final Expression upper;
  @Nullable private final Colon secondColon;
  @Nullable private final Expression step;

  public Slice(
      @Nullable Expression lower,
      Colon firstColon,
      @Nullable Expression upper,
      @Nullable Colon secondColon,
      @Nullable Expression step) {
    super(Kind.SLICE);
    this.lower = lower;
    this.firstColon = require("firstColon", firstColon);
    this.upper = upper;
    this.secondColon = secondColon;
    this.step = step;
  }

  @Nullable
  public Expression getLower() {
    return lower;
  }

  public Colon getFirstColon() {
    return firstColon;
  }

  @Nullable
  public Expression getUpper() {
    return upper;
  }

  @Nullable
  public Colon getSecondColon() {
    return secondColon;
  }

  @Nullable
  public Expression getStep() {
    return step;
  }

  @Override
  Slice walkFields(FieldVisitor visitor) {
    Expression lower = visitor.optional("lower", this.lower, Expression.class);
    Colon firstColon = visitor.node("firstColon", this.firstColon, Colon.class);
    Expression upper = visitor.optional("upper", this.upper, Expression.class);
    Colon secondColon = visitor.optional("secondColon", this.secondColon, Colon.class);
    Expression step = visitor.optional("step", this.step, Expression.class);
    return visitor.changed() ? new Slice(lower, firstColon, upper, secondColon, step) : this;
  }

  @Override
  void codegen(CodegenState state) {
    if (lower != null) {
      lower.generate(state);
    }
    firstColon.generate(state);
    if (upper != null) {
      upper.generate(state);
    }
    if (secondColon != null) {
      secondColon.generate(state);
    } else if (step != null) {
      state.add(":");
    }
    if (step != null) {
      step.generate(state);
    }
  }
}
