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

/** A comment, from the {@code #} up to but excluding the line ending. */
public final class Comment extends Node {

  private final String value;

  public Comment(String value) {
    super(Kind.COMMENT);
    this.value = require("value", value);
    checkNode(
        value.startsWith("#") && value.indexOf('\n') < 0 && value.indexOf('\r') < 0,
        "comment must start with '#' and contain no line break: '%s'",
        value);
  }

  public String getValue() {
    return value;
  }

  @Override
  Comment walkFields(FieldVisitor visitor) {
    String value = visitor.attribute("value", this.value, String.class);
    return visitor.changed() ? new Comment(value) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add(value);
  }
}
