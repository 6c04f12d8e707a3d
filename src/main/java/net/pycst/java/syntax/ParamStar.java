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

/** A bare {@code *} marking the start of keyword-only parameters. */
public final class ParamStar extends Node {

  private final Comma comma;

  public ParamStar(Comma comma) {
    super(Kind.PARAM_STAR);
    this.comma = require("comma", comma);
  }

  public Comma getComma() {
    return comma;
  }

  @Override
  ParamStar walkFields(FieldVisitor visitor) {
    Comma comma = visitor.node("comma", this.comma, Comma.class);
    return visitor.changed() ? new ParamStar(comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add("*");
    comma.generate(state);
  }
}
