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

/** Syntax node for a {@code global} or {@code nonlocal} declaration. */
public final class GlobalStatement extends SmallStatement {

  private final TokenKind keyword;
  private final SimpleWhitespace whitespaceAfterKeyword;
  private final ImmutableList<NameItem> names;

  public GlobalStatement(
      TokenKind keyword,
      SimpleWhitespace whitespaceAfterKeyword,
      List<NameItem> names,
      @Nullable Semicolon semicolon) {
    super(Kind.GLOBAL_STATEMENT, semicolon);
    this.keyword = require("keyword", keyword);
    this.whitespaceAfterKeyword = require("whitespaceAfterKeyword", whitespaceAfterKeyword);
    this.names = copyOf("names", names);
    checkNode(
        keyword == TokenKind.GLOBAL || keyword == TokenKind.NONLOCAL,
        "not a declaration keyword: %s",
        keyword);
    checkNode(!this.names.isEmpty(), "a %s statement must declare at least one name", keyword);
    checkNode(
        Iterables.getLast(this.names).getComma() == null, "the last name cannot have a comma");
  }

  /** Constructs an instance with no trailing semicolon. */
  public GlobalStatement(
      TokenKind keyword,
      SimpleWhitespace whitespaceAfterKeyword,
      List<NameItem> names) {
    this(keyword, whitespaceAfterKeyword, names, null);
  }

  /** Returns GLOBAL or NONLOCAL. */
  public TokenKind getKeyword() {
    return keyword;
  }

  public SimpleWhitespace getWhitespaceAfterKeyword() {
    return whitespaceAfterKeyword;
  }

  public ImmutableList<NameItem> getNames() {
    return names;
  }

  @Override
  GlobalStatement walkFields(FieldVisitor visitor) {
    TokenKind keyword = visitor.attribute("keyword", this.keyword, TokenKind.class);
    SimpleWhitespace whitespaceAfterKeyword =
        visitor.node("whitespaceAfterKeyword", this.whitespaceAfterKeyword, SimpleWhitespace.class);
    ImmutableList<NameItem> names = visitor.nodes("names", this.names, NameItem.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new GlobalStatement(keyword, whitespaceAfterKeyword, names, semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(keyword.text());
    whitespaceAfterKeyword.generate(state);
    generateSeparated(state, names);
  }
}
