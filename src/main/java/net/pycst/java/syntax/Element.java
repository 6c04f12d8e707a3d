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

/** An element of a tuple, list or set display. */
public final class Element extends SequenceElement {

  private final Expression value;
  @Nullable private final Comma comma;

  public Element(Expression value, @Nullable Comma comma) {
    super(Kind.ELEMENT);
    this.value = require("value", value);
    this.comma = comma;
  }

  public Expression getValue() {
    return value;
  }

  @Nullable
  public Comma getComma() {
    return comma;
  }

  @Override
  Element walkFields(FieldVisitor visitor) {
    Expression value = visitor.node("value", this.value, Expression.class);
    Comma comma = visitor.optional("comma", this.comma, Comma.class);
    return visitor.changed() ? new Element(value, comma) : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean defaultComma) {
    value.generate(state);
    generateComma(state, defaultComma);
  }

  /** Returns an element with no explicit comma. */
  public static Element of(Expression value) {
    return new Element(value, null);
  }
}
