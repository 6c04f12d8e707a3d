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

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** An {@code except} (or {@code except*}) clause of a try statement. */
public final class ExceptHandler extends Node {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceAfterExcept;
  private final boolean star;
  private final SimpleWhitespace whitespaceAfterStar;
  @Nullable private final Expression type;
  @Nullable private final AsName name;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;

  public ExceptHandler(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceAfterExcept,
      boolean star,
      SimpleWhitespace whitespaceAfterStar,
      @Nullable Expression type,
      @Nullable AsName name,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body) {
    super(Kind.EXCEPT_HANDLER);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceAfterExcept = require("whitespaceAfterExcept", whitespaceAfterExcept);
    this.star = star;
    this.whitespaceAfterStar = require("whitespaceAfterStar", whitespaceAfterStar);
    this.type = type;
    this.name = name;
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    checkNode(name == null || type != null, "an except handler with a name must have a type");
    checkNode(!star || type != null, "an except* handler must have a type");
    checkNode(
        star || whitespaceAfterStar.isEmpty(),
        "whitespace after a star requires an except* handler");
    checkNode(
        name == null || name.getName() instanceof Name,
        "an except handler can only bind a name");
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceAfterExcept() {
    return whitespaceAfterExcept;
  }

  /** Reports whether this is an {@code except*} handler. */
  public boolean isStar() {
    return star;
  }

  public SimpleWhitespace getWhitespaceAfterStar() {
    return whitespaceAfterStar;
  }

  /** Returns the exception type matched, or null for a bare except. */
  @Nullable
  public Expression getType() {
    return type;
  }

  @Nullable
  public AsName getName() {
    return name;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Override
  ExceptHandler walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceAfterExcept =
        visitor.node("whitespaceAfterExcept", this.whitespaceAfterExcept, SimpleWhitespace.class);
    boolean star = visitor.attribute("star", this.star, Boolean.class);
    SimpleWhitespace whitespaceAfterStar =
        visitor.node("whitespaceAfterStar", this.whitespaceAfterStar, SimpleWhitespace.class);
    Expression type = visitor.optional("type", this.type, Expression.class);
    AsName name = visitor.optional("name", this.name, AsName.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    return visitor.changed()
        ? new ExceptHandler(
            leadingLines,
            whitespaceAfterExcept,
            star,
            whitespaceAfterStar,
            type,
            name,
            whitespaceBeforeColon,
            body)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add("except");
    whitespaceAfterExcept.generate(state);
    if (star) {
      state.add("*");
      whitespaceAfterStar.generate(state);
    }
    if (type != null) {
      type.generate(state);
    }
    if (name != null) {
      name.generate(state);
    }
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
  }
}
