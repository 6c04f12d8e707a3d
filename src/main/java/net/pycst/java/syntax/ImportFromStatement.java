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
 * Syntax node for {@code from module import names}. The module may be relative (leading dots) and
 * the names may be parenthesized, or replaced by a single {@code *}.
 */
public final class ImportFromStatement extends SmallStatement {

  private final SimpleWhitespace whitespaceAfterFrom;
  private final ImmutableList<Dot> relative;
  @Nullable private final Expression module;
  private final SimpleWhitespace whitespaceBeforeImport;
  private final SimpleWhitespace whitespaceAfterImport;
  @Nullable private final LeftParen lpar;
  private final ImmutableList<ImportAlias> names;
  @Nullable private final ImportStar star;
  @Nullable private final RightParen rpar;

  public ImportFromStatement(
      SimpleWhitespace whitespaceAfterFrom,
      List<Dot> relative,
      @Nullable Expression module,
      SimpleWhitespace whitespaceBeforeImport,
      SimpleWhitespace whitespaceAfterImport,
      @Nullable LeftParen lpar,
      List<ImportAlias> names,
      @Nullable ImportStar star,
      @Nullable RightParen rpar,
      @Nullable Semicolon semicolon) {
    super(Kind.IMPORT_FROM_STATEMENT, semicolon);
    this.whitespaceAfterFrom = require("whitespaceAfterFrom", whitespaceAfterFrom);
    this.relative = copyOf("relative", relative);
    this.module = module;
    this.whitespaceBeforeImport = require("whitespaceBeforeImport", whitespaceBeforeImport);
    this.whitespaceAfterImport = require("whitespaceAfterImport", whitespaceAfterImport);
    this.lpar = lpar;
    this.names = copyOf("names", names);
    this.star = star;
    this.rpar = rpar;
    checkNode(
        module == null || module instanceof Name || module instanceof Attribute,
        "the module of an import must be a dotted name");
    checkNode(module != null || !this.relative.isEmpty(), "an import must name a module");
    checkNode(
        (star == null) != this.names.isEmpty(),
        "an import must have either names or a star, not both");
    checkNode((lpar == null) == (rpar == null), "cannot have unbalanced parentheses");
    checkNode(star == null || lpar == null, "cannot parenthesize a star import");
    checkNode(
        lpar != null || this.names.isEmpty() || Iterables.getLast(this.names).getComma() == null,
        "a trailing comma requires parentheses");
  }

  /** Constructs an instance with no trailing semicolon. */
  public ImportFromStatement(
      SimpleWhitespace whitespaceAfterFrom,
      List<Dot> relative,
      @Nullable Expression module,
      SimpleWhitespace whitespaceBeforeImport,
      SimpleWhitespace whitespaceAfterImport,
      @Nullable LeftParen lpar,
      List<ImportAlias> names,
      @Nullable ImportStar star,
      @Nullable RightParen rpar) {
    this(
        whitespaceAfterFrom,
        relative,
        module,
        whitespaceBeforeImport,
        whitespaceAfterImport,
        lpar,
        names,
        star,
        rpar,
        null);
  }

  public SimpleWhitespace getWhitespaceAfterFrom() {
    return whitespaceAfterFrom;
  }

  /** Returns the leading dots of a relative import. */
  public ImmutableList<Dot> getRelative() {
    return relative;
  }

  /** Returns the module name, a Name or dotted Attribute, or null for {@code from . import x}. */
  @Nullable
  public Expression getModule() {
    return module;
  }

  public SimpleWhitespace getWhitespaceBeforeImport() {
    return whitespaceBeforeImport;
  }

  public SimpleWhitespace getWhitespaceAfterImport() {
    return whitespaceAfterImport;
  }

  @Nullable
  public LeftParen getLpar() {
    return lpar;
  }

  public ImmutableList<ImportAlias> getNames() {
    return names;
  }

  @Nullable
  public ImportStar getStar() {
    return star;
  }

  @Nullable
  public RightParen getRpar() {
    return rpar;
  }

  @Override
  ImportFromStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterFrom =
        visitor.node("whitespaceAfterFrom", this.whitespaceAfterFrom, SimpleWhitespace.class);
    ImmutableList<Dot> relative = visitor.nodes("relative", this.relative, Dot.class);
    Expression module = visitor.optional("module", this.module, Expression.class);
    SimpleWhitespace whitespaceBeforeImport =
        visitor.node("whitespaceBeforeImport", this.whitespaceBeforeImport, SimpleWhitespace.class);
    SimpleWhitespace whitespaceAfterImport =
        visitor.node("whitespaceAfterImport", this.whitespaceAfterImport, SimpleWhitespace.class);
    LeftParen lpar = visitor.optional("lpar", this.lpar, LeftParen.class);
    ImmutableList<ImportAlias> names = visitor.nodes("names", this.names, ImportAlias.class);
    ImportStar star = visitor.optional("star", this.star, ImportStar.class);
    RightParen rpar = visitor.optional("rpar", this.rpar, RightParen.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new ImportFromStatement(
            whitespaceAfterFrom,
            relative,
            module,
            whitespaceBeforeImport,
            whitespaceAfterImport,
            lpar,
            names,
            star,
            rpar,
            semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("from");
    whitespaceAfterFrom.generate(state);
    generateAll(state, relative);
    if (module != null) {
      module.generate(state);
    }
    whitespaceBeforeImport.generate(state);
    state.add("import");
    whitespaceAfterImport.generate(state);
    if (lpar != null) {
      lpar.generate(state);
    }
    if (star != null) {
      star.generate(state);
    } else {
      generateSeparated(state, names);
    }
    if (rpar != null) {
      rpar.generate(state);
    }
  }
}
