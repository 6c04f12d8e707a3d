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

/**
 * A line holding nothing but whitespace and possibly a comment.
 *
 * <p>When {@code indent} is true, the line starts with the indentation of the block that owns it
 * and generation emits that indentation; the whitespace field holds only what follows it.
 */
public final class EmptyLine extends Node {

  private final boolean indent;
  private final SimpleWhitespace whitespace;
  @Nullable private final Comment comment;
  private final Newline newline;

  public EmptyLine(
      boolean indent,
      SimpleWhitespace whitespace,
      @Nullable Comment comment,
      Newline newline) {
    super(Kind.EMPTY_LINE);
    this.indent = indent;
    this.whitespace = require("whitespace", whitespace);
    this.comment = comment;
    this.newline = require("newline", newline);
  }

  public boolean isIndent() {
    return indent;
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
  EmptyLine walkFields(FieldVisitor visitor) {
    boolean indent = visitor.attribute("indent", this.indent, Boolean.class);
    SimpleWhitespace whitespace =
        visitor.node("whitespace", this.whitespace, SimpleWhitespace.class);
    Comment comment = visitor.optional("comment", this.comment, Comment.class);
    Newline newline = visitor.node("newline", this.newline, Newline.class);
    return visitor.changed() ? new EmptyLine(indent, whitespace, comment, newline) : this;
  }

  @Override
  void codegen(CodegenState state) {
    if (indent) {
      state.addIndentTokens();
    }
    whitespace.generate(state);
    if (comment != null) {
      comment.generate(state);
    }
    newline.generate(state);
  }

  /** Returns an indented empty line holding only {@code comment}. */
  public static EmptyLine ofComment(String comment) {
    return new EmptyLine(true, SimpleWhitespace.of(""), new Comment(comment), Newline.of());
  }
}
