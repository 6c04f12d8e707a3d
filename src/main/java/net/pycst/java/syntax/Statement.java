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

/** Base class for all statements: a line of simple statements or a compound statement. */
public abstract class Statement extends Node {

  Statement(Kind kind) {
    super(kind);
  }

  /** Returns the empty lines and comments owned by this statement, above its first line. */
  public abstract ImmutableList<EmptyLine> getLeadingLines();

  /** Parses a single statement, which may span several lines. */
  public static Statement parse(String source) throws ParseException {
    return parse(source, ParserConfig.DEFAULT);
  }

  /** Parses a single statement using {@code config}. */
  public static Statement parse(String source, ParserConfig config) throws ParseException {
    return Parser.parseStatement(ParseInput.of(source, config));
  }
}
