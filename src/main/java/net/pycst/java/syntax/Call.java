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

/** Syntax node for a function call, {@code func(args)}. */
public final class Call extends Expression {

  private final Expression func;
  private final ParenthesizableWhitespace whitespaceAfterFunc;
  private final ParenthesizableWhitespace whitespaceBeforeArgs;
  private final ImmutableList<Argument> args;

  public Call(
      Expression func,
      ParenthesizableWhitespace whitespaceAfterFunc,
      ParenthesizableWhitespace whitespaceBeforeArgs,
      List<Argument> args,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.CALL, lpar, rpar);
    this.func = require("func", func);
    this.whitespaceAfterFunc = require("whitespaceAfterFunc", whitespaceAfterFunc);
    this.whitespaceBeforeArgs = require("whitespaceBeforeArgs", whitespaceBeforeArgs);
    this.args = copyOf("args", args);
    boolean keywordSeen = false;
    for (Argument arg : this.args) {
      if (arg.getKeyword() != null || arg.getStar().equals("**")) {
        keywordSeen = true;
      } else if (keywordSeen) {
        checkNode(
            !arg.getStar().isEmpty(), "a positional argument cannot follow a keyword argument");
      }
    }
  }

  /** Constructs an unparenthesized instance. */
  public Call(
      Expression func,
      ParenthesizableWhitespace whitespaceAfterFunc,
      ParenthesizableWhitespace whitespaceBeforeArgs,
      List<Argument> args) {
    this(
        func,
        whitespaceAfterFunc,
        whitespaceBeforeArgs,
        args,
        ImmutableList.of(),
        ImmutableList.of());
  }

  public Expression getFunc() {
    return func;
  }

  public ParenthesizableWhitespace getWhitespaceAfterFunc() {
    return whitespaceAfterFunc;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeArgs() {
    return whitespaceBeforeArgs;
  }

  public ImmutableList<Argument> getArgs() {
    return args;
  }

  @Override
  Call walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression func = visitor.node("func", this.func, Expression.class);
    ParenthesizableWhitespace whitespaceAfterFunc =
        visitor.node(
            "whitespaceAfterFunc",
            this.whitespaceAfterFunc,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceBeforeArgs =
        visitor.node(
            "whitespaceBeforeArgs",
            this.whitespaceBeforeArgs,
            ParenthesizableWhitespace.class);
    ImmutableList<Argument> args = visitor.nodes("args", this.args, Argument.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new Call(func, whitespaceAfterFunc, whitespaceBeforeArgs, args, lpar, rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    func.generate(state);
    whitespaceAfterFunc.generate(state);
    state.add("(");
    whitespaceBeforeArgs.generate(state);
    generateSeparated(state, args);
    state.add(")");
  }
}
