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
import java.util.ArrayList;
import java.util.List;
import net.pycst.java.syntax.AnnotatedAssignStatement;
import net.pycst.java.syntax.Annotation;
import net.pycst.java.syntax.AssignEqual;
import net.pycst.java.syntax.AssignStatement;
import net.pycst.java.syntax.AssignTarget;
import net.pycst.java.syntax.ClassDef;
import net.pycst.java.syntax.CstTransformer;
import net.pycst.java.syntax.Expression;
import net.pycst.java.syntax.FunctionDef;
import net.pycst.java.syntax.Name;
import net.pycst.java.syntax.Node;
import net.pycst.java.syntax.Parameter;
import net.pycst.java.syntax.Parameters;
import net.pycst.java.syntax.SmallStatement;
import net.pycst.java.syntax.Statement;

/**
 * Copies stub annotations onto the matching definitions of a source module.
 *
 * <p>A function matches by qualified name; each of its parameters gains the stub's annotation
 * for the parameter of the same name, and the function gains the stub's return annotation.
 * A single-target assignment {@code x = v} at module or class level whose qualified name has an
 * attribute annotation becomes {@code x: T = v}. Existing annotations are kept unless the
 * transformer was created to overwrite them.
 */
public final class ApplyTypeAnnotationsTransformer extends CstTransformer {

  private static final Joiner DOT = Joiner.on('.');

  private final StubAnnotations annotations;
  private final boolean overwriteExisting;

  private final ArrayDeque<String> scope = new ArrayDeque<>();
  private int functionDepth;
  private int applied;

  public ApplyTypeAnnotationsTransformer(
      StubAnnotations annotations, boolean overwriteExisting) {
    this.annotations = annotations;
    this.overwriteExisting = overwriteExisting;
  }

  /** Returns the number of annotations added or replaced so far. */
  public int getAppliedCount() {
    return applied;
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
  public Statement leave(ClassDef original, ClassDef updated) {
    scope.removeLast();
    return updated;
  }

  @Override
  public boolean visit(FunctionDef node) {
    scope.addLast(node.getName().getValue());
    functionDepth++;
    return true;
  }

  @Override
  public Statement leave(FunctionDef original, FunctionDef updated) {
    scope.removeLast();
    functionDepth--;
    FunctionAnnotations stub =
        annotations.functions().get(qualify(updated.getName().getValue()));
    if (stub == null) {
      return updated;
    }
    FunctionDef result = updated;
    Parameters params = annotateParameters(updated.getParams(), stub.parameters());
    if (params != updated.getParams()) {
      result = (FunctionDef) result.withChanges("params", params);
    }
    if (stub.returns() != null && (updated.getReturns() == null || overwriteExisting)) {
      result = (FunctionDef) result.withChanges("returns", annotationOf(stub.returns()));
      applied++;
    }
    return result;
  }

  private Parameters annotateParameters(
      Parameters params, ImmutableMap<String, Expression> stub) {
    int before = applied;
    Node starArg = params.getStarArg();
    Parameter starKwarg = params.getStarKwarg();
    Parameters result =
        new Parameters(
            annotateAll(params.getPosonlyParams(), stub),
            params.getPosonlyInd(),
            annotateAll(params.getParams(), stub),
            starArg instanceof Parameter ? annotate((Parameter) starArg, stub) : starArg,
            annotateAll(params.getKwonlyParams(), stub),
            starKwarg == null ? null : annotate(starKwarg, stub));
    return applied == before ? params : result;
  }

  private List<Parameter> annotateAll(
      List<Parameter> params, ImmutableMap<String, Expression> stub) {
    List<Parameter> result = new ArrayList<>(params.size());
    for (Parameter param : params) {
      result.add(annotate(param, stub));
    }
    return result;
  }

  private Parameter annotate(Parameter param, ImmutableMap<String, Expression> stub) {
    Expression annotation = stub.get(param.getName().getValue());
    if (annotation == null || (param.getAnnotation() != null && !overwriteExisting)) {
      return param;
    }
    applied++;
    Parameter result = (Parameter) param.withChanges("annotation", annotationOf(annotation));
    AssignEqual equal = param.getEqual();
    if (equal != null
        && equal.getWhitespaceBefore().isEmpty()
        && equal.getWhitespaceAfter().isEmpty()) {
      // "x=1" becomes "x: int = 1".
      result = (Parameter) result.withChanges("equal", AssignEqual.of());
    }
    return result;
  }

  @Override
  public SmallStatement leave(AssignStatement original, AssignStatement updated) {
    if (functionDepth > 0 || updated.getTargets().size() != 1) {
      return updated;
    }
    AssignTarget target = updated.getTargets().get(0);
    if (!(target.getTarget() instanceof Name)) {
      return updated;
    }
    Expression annotation =
        annotations.attributes().get(qualify(((Name) target.getTarget()).getValue()));
    if (annotation == null) {
      return updated;
    }
    applied++;
    return new AnnotatedAssignStatement(
        target.getTarget(),
        annotationOf(annotation),
        new AssignEqual(target.getWhitespaceBeforeEqual(), target.getWhitespaceAfterEqual()),
        updated.getValue(),
        updated.getSemicolon());
  }

  @Override
  public SmallStatement leave(
      AnnotatedAssignStatement original, AnnotatedAssignStatement updated) {
    if (!overwriteExisting || functionDepth > 0 || !(updated.getTarget() instanceof Name)) {
      return updated;
    }
    Expression annotation =
        annotations.attributes().get(qualify(((Name) updated.getTarget()).getValue()));
    if (annotation == null) {
      return updated;
    }
    applied++;
    Annotation existing = updated.getAnnotation();
    return (SmallStatement)
        updated.withChanges(
            "annotation",
            new Annotation(
                existing.getWhitespaceBeforeIndicator(),
                existing.getWhitespaceAfterIndicator(),
                (Expression) annotation.deepClone()));
  }

  // Stub nodes are cloned so that no node appears in two trees.
  private static Annotation annotationOf(Expression annotation) {
    return Annotation.of((Expression) annotation.deepClone());
  }
}
