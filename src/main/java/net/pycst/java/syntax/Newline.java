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

/** A line ending. A null value stands for the module's default newline. */
public final class Newline extends Node {

  @Nullable private final String value;

  public Newline(@Nullable String value) {
    super(Kind.NEWLINE);
    this.value = value;
    checkNode(
        value == null || ParserConfig.NEWLINES.contains(value),
        "invalid newline: '%s'",
        value);
  }

  /** Returns the exact line ending, or null for the module default. */
  @Nullable
  public String getValue() {
    return value;
  }

  @Override
  Newline walkFields(FieldVisitor visitor) {
    String value = visitor.optionalAttribute("value", this.value, String.class);
    return visitor.changed() ? new Newline(value) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add(value == null ? state.getDefaultNewline() : value);
  }

  /** Returns a newline using the module default. */
  public static Newline of() {
    return new Newline(null);
  }
}
