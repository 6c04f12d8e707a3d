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

/** A plain index of a subscript, {@code x[value]}. */
public final class Index extends SubscriptSlice {

  private final Expression value;

  public Index(Expression value) {
    super(Kind.INDEX);
    this.value = require("value", value);
  }

  public Expression getValue() {
    return value;
  }

  @Override
  Index walkFields(FieldVisitor visitor) {
    Expression value = visitor.node("value", this.value, Expression.class);
    return visitor.changed() ? new Index(value) : this;
  }

  @Override
  void codegen(CodegenState state) {
    value.generate(state);
  }
}
