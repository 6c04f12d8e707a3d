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

/** Syntax node for {@code import a.b as c, d}. */
public final class ImportStatement extends SmallStatement {

  private final SimpleWhitespace whitespaceAfterImport;
  private final ImmutableList<ImportAlias> names;

  public ImportStatement(
      SimpleWhitespace whitespaceAfterImport,
      List<ImportAlias> names,
      @Nullable Semicolon semicolon) {
    super(Kind.IMPORT_STATEMENT, semicolon);
    this.whitespaceAfterImport = require("whitespaceAfterImport", whitespaceAfterImport);
    this.names = copyOf("names", names);
    checkNode(!this.names.isEmpty(), "an import must have at least one name");
    checkNode(
        Iterables.getLast(this.names).getComma() == null, "the last name cannot have a comma");
  }

  /** Constructs an instance with no trailing semicolon. */
  public ImportStatement(SimpleWhitespace whitespaceAfterImport, List<ImportAlias> names) {
    this(whitespaceAfterImport, names, null);
  }

  public SimpleWhitespace getWhitespaceAfterImport() {
    return whitespaceAfterImport;
  }

  public ImmutableList<ImportAlias> getNames() {
    return names;
  }

  @Override
  ImportStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterImport =
        visitor.node("whitespaceAfterImport", this.whitespaceAfterImport, SimpleWhitespace.class);
    ImmutableList<ImportAlias> names = visitor.nodes("names", this.names, ImportAlias.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new ImportStatement(whitespaceAfterImport, names, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("import");
    whitespaceAfterImport.generate(state);
    generateSeparated(state, names);
  }
}
