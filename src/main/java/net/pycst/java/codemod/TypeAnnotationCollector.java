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

package net.pycst.java.codemod;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import net.pycst.java.syntax.AnnotatedAssignStatement;
import net.pycst.java.syntax.Annotation;
import net.pycst.java.syntax.ClassDef;
import net.pycst.java.syntax.CstVisitor;
import net.pycst.java.syntax.Expression;
import net.pycst.java.syntax.FunctionDef;
import net.pycst.java.syntax.Name;
import net.pycst.java.syntax.Parameter;

/**
 * Collects the function signatures and attribute annotations declared by a stub module.
 *
 * <p>Only declarations at module or class level are recorded. Function bodies are not entered.
 */
public final class TypeAnnotationCollector extends CstVisitor {

  private static final Joiner DOT = Joiner.on('.');

  // Names of the enclosing classes and functions, outermost first.
  private final ArrayDeque<String> scope = new ArrayDeque<>();

  private final Map<String, FunctionAnnotations> functions = new LinkedHashMap<>();
  private final Map<String, Expression> attributes = new LinkedHashMap<>();

  /** Returns everything collected so far. */
  public StubAnnotations getAnnotations() {
    return StubAnnotations.create(
        ImmutableMap.copyOf(functions), ImmutableMap.copyOf(attributes));
  }

  private String qualify(String name) {
    return scope.isEmpty() ? name : DOT.join(scope) + "." + name;
  }

  @Override
  public boolean visit(ClassDef node) {
    scope.addLast(node.getName().getValue());
    return true;
  }

  @Override
  public void leave(ClassDef node) {
    scope.removeLast();
  }

  @Override
  public boolean visit(FunctionDef node) {
    ImmutableMap.Builder<String, Expression> params = ImmutableMap.builder();
    for (Parameter param : node.getParams().getAll()) {
      if (param.getAnnotation() != null) {
        params.put(param.getName().getValue(), param.getAnnotation().getAnnotation());
      }
    }
    Annotation returns = node.getReturns();
    // A later definition of the same name, such as a property setter, wins.
    functions.put(
        qualify(node.getName().getValue()),
        FunctionAnnotations.create(
            params.buildKeepingLast(), returns == null ? null : returns.getAnnotation()));
    scope.addLast(node.getName().getValue());
    return false;
  }

  @Override
  public void leave(FunctionDef node) {
    scope.removeLast();
  }

  @Override
  public boolean visit(AnnotatedAssignStatement node) {
    if (node.getTarget() instanceof Name) {
      String name = ((Name) node.getTarget()).getValue();
      attributes.put(qualify(name), node.getAnnotation().getAnnotation());
    }
    return false;
  }
}
