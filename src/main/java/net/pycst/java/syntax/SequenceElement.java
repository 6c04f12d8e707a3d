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

/** An element of a tuple, list or set display: a plain or a starred expression. */
public abstract class SequenceElement extends Node {

  SequenceElement(Kind kind) {
    super(kind);
  }

  public abstract Expression getValue();

  /** Returns the comma after this element, or null if none is written. */
  @Nullable
  public abstract Comma getComma();

  final void generateComma(CodegenState state, boolean defaultComma) {
    Comma comma = getComma();
    if (comma != null) {
      comma.generate(state);
    } else if (defaultComma) {
      state.add(", ");
    }
  }
}
