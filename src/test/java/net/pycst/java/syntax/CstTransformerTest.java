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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CstTransformerTest {

  private static class Renamer extends CstTransformer {
    private final String from;
    private final String to;

    Renamer(String from, String to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public Expression leave(Name original, Name updated) {
      if (!updated.getValue().equals(from)) {
        return updated;
      }
      return (Expression) updated.withChanges("value", to);
    }
  }

  @Test
  public void testRenamePreservesFormatting() throws Exception {
    Module module = Module.parse("a  =  a+1  # keep\n\nprint( a )\n");
    Module renamed = module.visit(new Renamer("a", "b"));
    assertThat(renamed.getCode()).isEqualTo("b  =  b+1  # keep\n\nprint( b )\n");
    assertThat(module.getCode()).isEqualTo("a  =  a+1  # keep\n\nprint( a )\n");
  }

  @Test
  public void testIdentityTransformReturnsSameTree() throws Exception {
    Module module = Module.parse("def f(x, *, y=1):\n    return [i for i in x if i]\n");
    assertThat(module.visit(new CstTransformer() {})).isSameInstanceAs(module);
  }

  @Test
  public void testUnchangedSubtreesAreShared() throws Exception {
    Module module = Module.parse("x = 1\ny = a\nz = 2\n");
    Module renamed = module.visit(new Renamer("a", "b"));
    assertThat(renamed).isNotSameInstanceAs(module);
    assertThat(renamed.getBody().get(0)).isSameInstanceAs(module.getBody().get(0));
    assertThat(renamed.getBody().get(1)).isNotSameInstanceAs(module.getBody().get(1));
    assertThat(renamed.getBody().get(2)).isSameInstanceAs(module.getBody().get(2));
  }

  @Test
  public void testReturningNullRemovesFromSequence() throws Exception {
    Module module = Module.parse("import os\nx = 1\nimport sys\n");
    Module result =
        module.visit(
            new CstTransformer() {
              @Override
              public Statement leave(SimpleStatementLine original, SimpleStatementLine updated) {
                return updated.getBody().get(0) instanceof ImportStatement ? null : updated;
              }
            });
    assertThat(result.getCode()).isEqualTo("x = 1\n");
  }

  @Test
  public void testReturningNullForRequiredChildFails() throws Exception {
    Module module = Module.parse("x = a\n");
    CstTransformer removeNames =
        new CstTransformer() {
          @Override
          public Expression leave(Name original, Name updated) {
            return null;
          }
        };
    assertThrows(InvalidNodeException.class, () -> module.visit(removeNames));
  }

  @Test
  public void testHookFailureAbortsAndLeavesInputUntouched() throws Exception {
    String code = "x = a + b\ny = c\n";
    Module module = Module.parse(code);
    IllegalStateException failure = new IllegalStateException("stop at c");
    List<String> renamed = new ArrayList<>();
    CstTransformer failing =
        new CstTransformer() {
          @Override
          public Expression leave(Name original, Name updated) {
            if (updated.getValue().equals("c")) {
              throw failure;
            }
            renamed.add(updated.getValue());
            return (Expression) updated.withChanges("value", updated.getValue() + "2");
          }
        };
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> module.visit(failing));
    assertThat(e).isSameInstanceAs(failure);
    assertThat(renamed).containsExactly("x", "a", "b", "y").inOrder();
    assertThat(module.getCode()).isEqualTo(code);
  }

  @Test
  public void testReplacementOfWrongTypeFails() throws Exception {
    Module module = Module.parse("f(a)\n");
    CstTransformer argumentsToCommas =
        new CstTransformer() {
          @Override
          public Node leave(Argument original, Argument updated) {
            return Comma.of();
          }
        };
    InvalidNodeException e =
        assertThrows(InvalidNodeException.class, () -> module.visit(argumentsToCommas));
    assertThat(e).hasMessageThat().contains("Argument");
  }

  @Test
  public void testLeaveSeesOriginalAndUpdated() throws Exception {
    Module module = Module.parse("f(a)\n");
    Module result =
        module.visit(
            new CstTransformer() {
              @Override
              public Expression leave(Name original, Name updated) {
                return (Expression) updated.withChanges("value", original.getValue() + "_");
              }

              @Override
              public Expression leave(Call original, Call updated) {
                assertThat(module.codeFor(original)).isEqualTo("f(a)");
                assertThat(module.codeFor(updated)).isEqualTo("f_(a_)");
                return updated;
              }
            });
    assertThat(result.getCode()).isEqualTo("f_(a_)\n");
  }

  @Test
  public void testVisitFalseSkipsTransformOfChildren() throws Exception {
    Module module = Module.parse("def a():\n    a\na\n");
    Module result =
        module.visit(
            new Renamer("a", "b") {
              @Override
              public boolean visit(FunctionDef node) {
                return false;
              }
            });
    assertThat(result.getCode()).isEqualTo("def a():\n    a\nb\n");
  }
}
