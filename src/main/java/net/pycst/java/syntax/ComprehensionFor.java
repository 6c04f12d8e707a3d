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

/**
 * The {@code for target in iter} clause of a comprehension, with the {@code if} clauses that
 * follow it and the next {@code for} clause, if any.
 */
public final class ComprehensionFor extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  @Nullable private final Asynchronous asynchronous;
  private final ParenthesizableWhitespace whitespaceAfterFor;
  private final Expression target;
  private final ParenthesizableWhitespace whitespaceBeforeIn;
  private final ParenthesizableWhitespace whitespaceAfterIn;
  private final Expression iter;
  private final ImmutableList<ComprehensionIf> ifs;
  @Nullable private final ComprehensionFor innerForIn;

  public ComprehensionFor(
      ParenthesizableWhitespace whitespaceBefore,
      @Nullable Asynchronous asynchronous,
      ParenthesizableWhitespace whitespaceAfterFor,
      Expression target,
      ParenthesizableWhitespace whitespaceBeforeIn,
      ParenthesizableWhitespace whitespaceAfterIn,
      Expression iter,
      List<ComprehensionIf> ifs,
      @Nullable ComprehensionFor innerForIn) {
    super(Kind.COMPREHENSION_FOR);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.asynchronous = asynchronous;
    this.whitespaceAfterFor = require("whitespaceAfterFor", whitespaceAfterFor);
    this.target = require("target", target);
    this.whitespaceBeforeIn = require("whitespaceBeforeIn", whitespaceBeforeIn);
    this.whitespaceAfterIn = require("whitespaceAfterIn", whitespaceAfterIn);
    this.iter = require("iter", iter);
    this.ifs = copyOf("ifs", ifs);
    this.innerForIn = innerForIn;
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  @Nullable
  public Asynchronous getAsynchronous() {
    return asynchronous;
  }

  public ParenthesizableWhitespace getWhitespaceAfterFor() {
    return whitespaceAfterFor;
  }

  public Expression getTarget() {
    return target;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeIn() {
    return whitespaceBeforeIn;
  }

  public ParenthesizableWhitespace getWhitespaceAfterIn() {
    return whitespaceAfterIn;
  }

  public Expression getIter() {
    return iter;
  }

  public ImmutableList<ComprehensionIf> getIfs() {
    return ifs;
  }

  @Nullable
  public ComprehensionFor getInnerForIn() {
    return innerForIn;
  }

  @Override
  ComprehensionFor walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    Asynchronous asynchronous =
        visitor.optional("asynchronous", this.asynchronous, Asynchronous.class);
    ParenthesizableWhitespace whitespaceAfterFor =
        visitor.node(
            "whitespaceAfterFor",
            this.whitespaceAfterFor,
            ParenthesizableWhitespace.class);
    Expression target = visitor.node("target", this.target, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeIn =
        visitor.node(
            "whitespaceBeforeIn",
            this.whitespaceBeforeIn,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterIn =
        visitor.node("whitespaceAfterIn", this.whitespaceAfterIn, ParenthesizableWhitespace.class);
    Expression iter = visitor.node("iter", this.iter, Expression.class);
    ImmutableList<ComprehensionIf> ifs = visitor.nodes("ifs", this.ifs, ComprehensionIf.class);
    ComprehensionFor innerForIn =
        visitor.optional("innerForIn", this.innerForIn, ComprehensionFor.class);
    return visitor.changed()
        ? new ComprehensionFor(
            whitespaceBefore,
            asynchronous,
            whitespaceAfterFor,
            target,
            whitespaceBeforeIn,
            whitespaceAfterIn,
            iter,
            ifs,
            innerForIn)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    if (asynchronous != null) {
      asynchronous.generate(state);
    }
    state.add("for");
    whitespaceAfterFor.generate(state);
    target.generate(state);
    whitespaceBeforeIn.generate(state);
    state.add("in");
    whitespaceAfterIn.generate(state);
    iter.generate(state);
    generateAll(state, ifs);
    if (innerForIn != null) {
      innerForIn.generate(state);
    }
  }
}
