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

/** A module or name imported by an import statement, {@code a.b as c}. */
public final class ImportAlias extends Node {

  private final Expression name;
  @Nullable private final AsName asname;
  @Nullable private final Comma comma;

  public ImportAlias(Expression name, @Nullable AsName asname, @Nullable Comma comma) {
    super(Kind.IMPORT_ALIAS);
    this.name = require("name", name);
    this.asname = asname;
    this.comma = comma;
    checkNode(
        name instanceof Name || name instanceof Attribute,
        "an imported name must be a dotted name");
    checkNode(
        asname == null || asname.getName() instanceof Name,
        "an import can only be bound to a name");
  }

  /** Returns the imported Name or dotted Attribute. */
  public Expression getName() {
    return name;
  }

  @Nullable
  public AsName getAsname() {
    return asname;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  ImportAlias walkFields(FieldVisitor visitor) {
    Expression name = visitor.node("name", this.name, Expression.class);
    AsName asname = visitor.optional("asname", this.asname, AsName.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new ImportAlias(name, asname, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    name.generate(state);
    if (asname != null) {
      asname.generate(state);
    }
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
  }
}
