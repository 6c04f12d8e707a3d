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
import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * The root of a parsed file.
 *
 * <p>Empty lines and comments before the first statement belong to {@code header}; those after the
 * last statement belong to {@code footer}. The module also records the defaults that nodes without
 * explicit indentation or newlines inherit when code is generated.
 */
public final class Module extends Node {

  private final ImmutableList<EmptyLine> header;
  private final ImmutableList<Statement> body;
  private final ImmutableList<EmptyLine> footer;
  private final String encoding;
  private final String defaultIndent;
  private final String defaultNewline;
  private final boolean hasTrailingNewline;

  public Module(
      List<EmptyLine> header,
      List<Statement> body,
      List<EmptyLine> footer,
      String encoding,
      String defaultIndent,
      String defaultNewline,
      boolean hasTrailingNewline) {
    super(Kind.MODULE);
    this.header = copyOf("header", header);
    this.body = copyOf("body", body);
    this.footer = copyOf("footer", footer);
    this.encoding = require("encoding", encoding);
    this.defaultIndent = require("defaultIndent", defaultIndent);
    this.defaultNewline = require("defaultNewline", defaultNewline);
    this.hasTrailingNewline = hasTrailingNewline;
    checkNode(
        ParserConfig.NEWLINES.contains(defaultNewline),
        "invalid default newline: '%s'",
        defaultNewline);
    checkNode(
        isWhitespace(defaultIndent),
        "invalid default indent: '%s'",
        defaultIndent);
  }

  public ImmutableList<EmptyLine> getHeader() {
    return header;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<EmptyLine> getFooter() {
    return footer;
  }

  /** Returns the name of the source encoding, such as {@code utf-8}. */
  public String getEncoding() {
    return encoding;
  }

  public String getDefaultIndent() {
    return defaultIndent;
  }

  public String getDefaultNewline() {
    return defaultNewline;
  }

  /** Reports whether the source ended with a newline. */
  public boolean hasTrailingNewline() {
    return hasTrailingNewline;
  }

  @Override
  Module walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> header = visitor.nodes("header", this.header, EmptyLine.class);
    ImmutableList<Statement> body = visitor.nodes("body", this.body, Statement.class);
    ImmutableList<EmptyLine> footer = visitor.nodes("footer", this.footer, EmptyLine.class);
    String encoding = visitor.attribute("encoding", this.encoding, String.class);
    String defaultIndent = visitor.attribute("defaultIndent", this.defaultIndent, String.class);
    String defaultNewline = visitor.attribute("defaultNewline", this.defaultNewline, String.class);
    boolean hasTrailingNewline =
        visitor.attribute("hasTrailingNewline", this.hasTrailingNewline, Boolean.class);
    return visitor.changed()
        ? new Module(
            header,
            body,
            footer,
            encoding,
            defaultIndent,
            defaultNewline,
            hasTrailingNewline)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, header);
    generateAll(state, body);
    generateAll(state, footer);
    if (hasTrailingNewline) {
      if (state.isEmpty()) {
        state.add(state.getDefaultNewline());
      }
    } else {
      state.popTrailingNewline();
    }
  }

  /** Parses a whole file. */
  public static Module parse(String source) throws ParseException {
    return parse(source, ParserConfig.DEFAULT);
  }

  /** Parses a whole file using {@code config}. */
  public static Module parse(String source, ParserConfig config) throws ParseException {
    return Parser.parseModule(ParseInput.of(source, config));
  }

  /**
   * Parses a whole file given as bytes. The encoding comes from the configuration, else from a
   * UTF-8 byte order mark or a coding declaration, else defaults to UTF-8.
   *
   * @throws EncodingException if the bytes cannot be decoded
   */
  public static Module parse(byte[] source, ParserConfig config) throws ParseException {
    return Parser.parseModule(ParseInput.of(source, config));
  }

  /** Returns the source code of this module. */
  public String getCode() {
    return codeFor(this);
  }

  /** Returns the source code of this module encoded with its encoding. */
  public byte[] getBytes() {
    byte[] code = getCode().getBytes(ParseInput.charsetFor(encoding));
    if (!encoding.equalsIgnoreCase(ParseInput.UTF8_SIG)) {
      return code;
    }
    byte[] withBom = new byte[code.length + 3];
    withBom[0] = (byte) 0xef;
    withBom[1] = (byte) 0xbb;
    withBom[2] = (byte) 0xbf;
    System.arraycopy(code, 0, withBom, 3, code.length);
    return withBom;
  }

  /**
   * Returns the source code of {@code node}, using this module's default indentation and newline
   * for nodes that do not record their own.
   */
  public String codeFor(Node node) {
    CodegenState state = new CodegenState(defaultIndent, defaultNewline, false);
    node.generate(state);
    return state.getCode();
  }

  /**
   * Generates this module and returns the span of generated text covered by each node, including
   * the whitespace the node owns.
   */
  public ImmutableMap<Node, CodeRange> computePositions() {
    CodegenState state = new CodegenState(defaultIndent, defaultNewline, true);
    generate(state);
    return state.getPositions();
  }

  @Override
  public Module visit(CstTransformer transformer) {
    Node result = super.visit(transformer);
    if (!(result instanceof Module)) {
      throw new InvalidNodeException("transforming a module must produce a module");
    }
    return (Module) result;
  }
}
