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
import com.google.common.collect.Iterables;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax node for a with statement. The items may be enclosed in parentheses (Python 3.9 and
 * later); those parentheses belong to the statement, not to any item.
 */
public final class WithStatement extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  @Nullable private final Asynchronous asynchronous;
  private final SimpleWhitespace whitespaceAfterWith;
  @Nullable private final LeftParen lpar;
  private final ImmutableList<WithItem> items;
  @Nullable private final RightParen rpar;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;

  public WithStatement(
      List<EmptyLine> leadingLines,
      @Nullable Asynchronous asynchronous,
      SimpleWhitespace whitespaceAfterWith,
      @Nullable LeftParen lpar,
      List<WithItem> items,
      @Nullable RightParen rpar,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body) {
    super(Kind.WITH_STATEMENT);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.asynchronous = asynchronous;
    this.whitespaceAfterWith = require("whitespaceAfterWith", whitespaceAfterWith);
    this.lpar = lpar;
    this.items = copyOf("items", items);
    this.rpar = rpar;
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    checkNode(!this.items.isEmpty(), "a with statement must have at least one item");
    checkNode((lpar == null) == (rpar == null), "cannot have unbalanced parentheses");
    checkNode(
        lpar != null || Iterables.getLast(this.items).getComma() == null,
        "a trailing comma requires parentheses");
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  @Nullable
  public Asynchronous getAsynchronous() {
    return asynchronous;
  }

  public SimpleWhitespace getWhitespaceAfterWith() {
    return whitespaceAfterWith;
  }

  @Nullable
  public LeftParen getLpar() {
    return lpar;
  }

  public ImmutableList<WithItem> getItems() {
    return items;
  }

  @Nullable
  public RightParen getRpar() {
    return rpar;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Override
  WithStatement walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    Asynchronous asynchronous =
        visitor.optional("asynchronous", this.asynchronous, Asynchronous.class);
    SimpleWhitespace whitespaceAfterWith =
        visitor.node("whitespaceAfterWith", this.whitespaceAfterWith, SimpleWhitespace.class);
    LeftParen lpar = visitor.optional("lpar", this.lpar, LeftParen.class);
    ImmutableList<WithItem> items = visitor.nodes("items", this.items, WithItem.class);
    RightParen rpar = visitor.optional("rpar", this.rpar, RightParen.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    return visitor.changed()
        ? new WithStatement(
            leadingLines,
            asynchronous,
            whitespaceAfterWith,
            lpar,
            items,
            rpar,
            whitespaceBeforeColon,
            body)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    if (asynchronous != null) {
      asynchronous.generate(state);
    }
    state.add("with");
    whitespaceAfterWith.generate(state);
    if (lpar != null) {
      lpar.generate(state);
    }
    generateSeparated(state, items);
    if (rpar != null) {
      rpar.generate(state);
    }
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
  }
}
