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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import net.pycst.java.syntax.Expression;

/**
 * The annotations collected from a stub module, keyed by qualified name: the dotted path of
 * enclosing class names followed by the function or attribute name, such as {@code Foo.bar}.
 */
@AutoValue
public abstract class StubAnnotations {

  public abstract ImmutableMap<String, FunctionAnnotations> functions();

  /** Returns the annotations of module and class attributes. */
  public abstract ImmutableMap<String, Expression> attributes();

  /** Reports whether the stub declared nothing applicable. */
  public final boolean isEmpty() {
    return functions().isEmpty() && attributes().isEmpty();
  }

  static StubAnnotations create(
      ImmutableMap<String, FunctionAnnotations> functions,
      ImmutableMap<String, Expression> attributes) {
    return new AutoValue_StubAnnotations(functions, attributes);
  }
}
