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

/** A single context manager of a with statement, {@code item as name}. */
public final class WithItem extends Node {

  private final Expression item;
  @Nullable private final AsName asname;
  @Nullable private final Comma comma;

  public WithItem(Expression item, @Nullable AsName asname, @Nullable Comma comma) {
    super(Kind.WITH_ITEM);
    this.item = require("item", item);
    this.asname = asname;
    this.comma = comma;
  }

  public Expression getItem() {
    return item;
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
  WithItem walkFields(FieldVisitor visitor) {
    Expression item = visitor.node("item", this.item, Expression.class);
    AsName asname = visitor.optional("asname", this.asname, AsName.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new WithItem(item, asname, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    item.generate(state);
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
