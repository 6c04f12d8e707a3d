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

import static com.google.common.truth.Truth.assertThat;

import net.pycst.java.syntax.Module;
import net.pycst.java.syntax.ParserConfig;
import net.pycst.java.syntax.PythonVersion;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ApplyTypeAnnotationsTest {

  private static String lines(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  @Test
  public void testCollect() throws Exception {
    StubAnnotations annotations =
        ApplyTypeAnnotations.collect(
            Module.parse(
                lines(
                    "x: int",
                    "def f(a: int, b, *args: str) -> bool: ...",
                    "class C:",
                    "    y: str",
                    "    def m(self, x: int) -> None: ...")));
    assertThat(annotations.attributes().keySet()).containsExactly("x", "C.y").inOrder();
    assertThat(annotations.functions().keySet()).containsExactly("f", "C.m").inOrder();
    assertThat(annotations.functions().get("f").parameters().keySet())
        .containsExactly("a", "args");
    assertThat(annotations.functions().get("C.m").returns()).isNotNull();
  }

  @Test
  public void testAnnotatesParametersAndReturn() throws Exception {
    String result =
        ApplyTypeAnnotations.apply(
            "def f(a: int, b: str = ...) -> bool: ...\n",
            lines("def f(a, b='x'):", "    return a  # note"));
    assertThat(result)
        .isEqualTo(lines("def f(a: int, b: str = 'x') -> bool:", "    return a  # note"));
  }

  @Test
  public void testMethodsMatchByQualifiedName() throws Exception {
    String result =
        ApplyTypeAnnotations.apply(
            lines("class C:", "    def m(self, x: int) -> None: ..."),
            lines(
                "class C:",
                "    def m(self, x):",
                "        pass",
                "",
                "def m(self, x):",
                "    pass"));
    assertThat(result)
        .isEqualTo(
            lines(
                "class C:",
                "    def m(self, x: int) -> None:",
                "        pass",
                "",
                "def m(self, x):",
                "    pass"));
  }

  @Test
  public void testAnnotatesModuleAndClassAttributes() throws Exception {
    String result =
        ApplyTypeAnnotations.apply(
            lines("x: int", "class C:", "    y: str"),
            lines(
                "x = 1",
                "class C:",
                "    y = 'a'",
                "    def f(self):",
                "        y = 2",
                "z = x"));
    assertThat(result)
        .isEqualTo(
            lines(
                "x: int = 1",
                "class C:",
                "    y: str = 'a'",
                "    def f(self):",
                "        y = 2",
                "z = x"));
  }

  @Test
  public void testExistingAnnotationsAreKept() throws Exception {
    String stub = lines("x: int", "def f(a: int) -> int: ...");
    String source = lines("x: str = ''", "def f(a: str) -> str: pass");
    assertThat(ApplyTypeAnnotations.apply(stub, source)).isEqualTo(source);
  }

  @Test
  public void testOverwriteExisting() throws Exception {
    Module stub = Module.parse(lines("x: int", "def f(a: int) -> int: ..."));
    Module source = Module.parse(lines("x :  str = 0", "def f(a: str) -> str: pass"));
    assertThat(ApplyTypeAnnotations.apply(stub, source, true).getCode())
        .isEqualTo(lines("x :  int = 0", "def f(a: int) -> int: pass"));
  }

  @Test
  public void testUnmatchedSourceIsReturnedUnchanged() throws Exception {
    Module source = Module.parse(lines("def g(a):", "    pass"));
    Module stub = Module.parse(lines("def f(a: int): ..."));
    assertThat(ApplyTypeAnnotations.apply(stub, source)).isSameInstanceAs(source);
    assertThat(ApplyTypeAnnotations.apply(Module.parse(""), source)).isSameInstanceAs(source);
  }

  @Test
  public void testKeywordOnlyAndStarParameters() throws Exception {
    String result =
        ApplyTypeAnnotations.apply(
            "def f(a: int, /, *args: str, key: bool, **kw: float): ...\n",
            "def f(a, /, *args, key, **kw): pass\n",
            ParserConfig.builder().pythonVersion(PythonVersion.PY_3_8).build());
    assertThat(result)
        .isEqualTo("def f(a: int, /, *args: str, key: bool, **kw: float): pass\n");
  }

  @Test
  public void testFormattingElsewhereIsPreserved() throws Exception {
    String source =
        lines(
            "# header comment",
            "import os",
            "",
            "",
            "def f(a,",
            "      b):  # trailing",
            "    return (a +",
            "            b)");
    String result = ApplyTypeAnnotations.apply("def f(a: int, b: int) -> int: ...\n", source);
    assertThat(result)
        .isEqualTo(
            lines(
                "# header comment",
                "import os",
                "",
                "",
                "def f(a: int,",
                "      b: int) -> int:  # trailing",
                "    return (a +",
                "            b)"));
  }
}
