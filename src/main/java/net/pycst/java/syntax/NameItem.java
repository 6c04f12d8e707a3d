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

/** A name declared by a global or nonlocal statement. */
public final class NameItem extends Node {

  private final Name name;
  @Nullable private final Comma comma;

  public NameItem(Name name, @Nullable Comma comma) {
    super(Kind.NAME_ITEM);
    this.name = require("name", name);
    this.comma = comma;
  }

  public Name getName() {
    return name;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  NameItem walkFields(FieldVisitor visitor) {
    Name name = visitor.node("name", this.name, Name.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new NameItem(name, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    name.generate(state);
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
  }
}
