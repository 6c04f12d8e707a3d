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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CstVisitorTest {

  private static final class NameCollector extends CstVisitor {
    final List<String> names = new ArrayList<>();

    @Override
    public boolean visit(Name node) {
      names.add(node.getValue());
      return true;
    }
  }

  @Test
  public void testVisitsNamesInSourceOrder() throws Exception {
    NameCollector collector = new NameCollector();
    Module.parse("a = b + c(d)\nif e:\n    f[g] = h\n").visit(collector);
    assertThat(collector.names).containsExactly("a", "b", "c", "d", "e", "f", "g", "h").inOrder();
  }

  @Test
  public void testEnterAndLeaveAreNested() throws Exception {
    List<String> events = new ArrayList<>();
    Expression.parse("a+b")
        .visit(
            new CstVisitor() {
              @Override
              public boolean onVisit(Node node) {
                events.add("enter " + node.kind());
                return super.onVisit(node);
              }

              @Override
              public void onLeave(Node node) {
                events.add("leave " + node.kind());
                super.onLeave(node);
              }
            });
    assertThat(events.get(0)).isEqualTo("enter BINARY_OPERATION");
    assertThat(events.get(1)).isEqualTo("enter NAME");
    assertThat(events.get(2)).isEqualTo("leave NAME");
    assertThat(events.get(events.size() - 1)).isEqualTo("leave BINARY_OPERATION");
    assertThat(events).contains("enter BINARY_OPERATOR");
  }

  @Test
  public void testReturningFalseSkipsChildrenButStillLeaves() throws Exception {
    List<String> seen = new ArrayList<>();
    List<String> left = new ArrayList<>();
    Module.parse("def f(x):\n    return y\nz = 1\n")
        .visit(
            new CstVisitor() {
              @Override
              public boolean visit(FunctionDef node) {
                return false;
              }

              @Override
              public void leave(FunctionDef node) {
                left.add(node.getName().getValue());
              }

              @Override
              public boolean visit(Name node) {
                seen.add(node.getValue());
                return true;
              }
            });
    assertThat(seen).containsExactly("z");
    assertThat(left).containsExactly("f");
  }

  @Test
  public void testVisitsWhitespaceAndComments() throws Exception {
    List<String> comments = new ArrayList<>();
    Module.parse("# header\nx = (  # inside\n    1)  # trailing\n")
        .visit(
            new CstVisitor() {
              @Override
              public boolean visit(Comment node) {
                comments.add(node.getValue());
                return true;
              }
            });
    assertThat(comments).containsExactly("# header", "# inside", "# trailing").inOrder();
  }
}
