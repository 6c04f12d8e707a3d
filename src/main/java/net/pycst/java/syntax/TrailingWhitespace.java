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

/** The end of a line: whitespace, an optional comment and the newline. */
public final class TrailingWhitespace extends Node {

  private final SimpleWhitespace whitespace;
  @Nullable private final Comment comment;
  private final Newline newline;

  public TrailingWhitespace(
      SimpleWhitespace whitespace,
      @Nullable Comment comment,
      Newline newline) {
    super(Kind.TRAILING_WHITESPACE);
    this.whitespace = require("whitespace", whitespace);
    this.comment = comment;
    this.newline = require("newline", newline);
  }

  public SimpleWhitespace getWhitespace() {
    return whitespace;
  }

  @Nullable
  public Comment getComment() {
    return comment;
  }

  public Newline getNewline() {
    return newline;
  }

  @Override
  TrailingWhitespace walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespace =
        visitor.node("whitespace", this.whitespace, SimpleWhitespace.class);
    Comment comment = visitor.optional("comment", this.comment, Comment.class);
    Newline newline = visitor.node("newline", this.newline, Newline.class);
    return visitor.changed() ? new TrailingWhitespace(whitespace, comment, newline) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespace.generate(state);
    if (comment != null) {
      comment.generate(state);
    }
    newline.generate(state);
  }

  /** Returns a bare default newline. */
  public static TrailingWhitespace of() {
    return new TrailingWhitespace(SimpleWhitespace.of(""), null, Newline.of());
  }
}
