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
 * Base class for all expressions.
 *
 * <p>An expression owns the parentheses written directly around it, outermost first in {@code
 * lpar} and innermost first in {@code rpar}, and the whitespace inside them. Whitespace outside
 * the parentheses belongs to the enclosing operator or punctuation.
 */
public abstract class Expression extends Node {

  private final ImmutableList<LeftParen> lpar;
  private final ImmutableList<RightParen> rpar;

  Expression(Kind kind, List<LeftParen> lpar, List<RightParen> rpar) {
    super(kind);
    this.lpar = copyOf("lpar", lpar);
    this.rpar = copyOf("rpar", rpar);
    checkNode(
        this.lpar.size() == this.rpar.size(),
        "%s has %s left and %s right parentheses",
        kind,
        this.lpar.size(),
        this.rpar.size());
  }

  public final ImmutableList<LeftParen> getLpar() {
    return lpar;
  }

  public final ImmutableList<RightParen> getRpar() {
    return rpar;
  }

  /** Reports whether this expression is enclosed in at least one pair of parentheses. */
  public final boolean isParenthesized() {
    return !lpar.isEmpty();
  }

  /** Returns a copy of this expression wrapped in one more pair of parentheses. */
  public final Expression parenthesize() {
    return (Expression)
        withChanges(
            ImmutableMap.of(
                "lpar",
                ImmutableList.<LeftParen>builder().add(LeftParen.of()).addAll(lpar).build(),
                "rpar",
                ImmutableList.<RightParen>builder().addAll(rpar).add(RightParen.of()).build()));
  }

  /** Generates the expression between its parentheses. */
  abstract void codegenContent(CodegenState state);

  @Override
  final void codegen(CodegenState state) {
    generateAll(state, lpar);
    codegenContent(state);
    generateAll(state, rpar);
  }

  /** Parses a single expression. */
  public static Expression parse(String source) throws ParseException {
    return parse(source, ParserConfig.DEFAULT);
  }

  /** Parses a single expression using {@code config}. */
  public static Expression parse(String source, ParserConfig config) throws ParseException {
    return Parser.parseExpression(ParseInput.of(source, config));
  }
}
