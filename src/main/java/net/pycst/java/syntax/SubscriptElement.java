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

/** One index or slice of a subscript, with its trailing comma. */
public final class SubscriptElement extends Node {

  private final SubscriptSlice slice;
  @Nullable private final Comma comma;

  public SubscriptElement(SubscriptSlice slice, @Nullable Comma comma) {
    super(Kind.SUBSCRIPT_ELEMENT);
    this.slice = require("slice", slice);
    this.comma = comma;
  }

  public SubscriptSlice getSlice() {
    return slice;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  SubscriptElement walkFields(FieldVisitor visitor) {
    SubscriptSlice slice = visitor.node("slice", this.slice, SubscriptSlice.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new SubscriptElement(slice, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    slice.generate(state);
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
  }
}
