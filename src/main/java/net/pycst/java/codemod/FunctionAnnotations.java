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
import javax.annotation.Nullable;
import net.pycst.java.syntax.Expression;

/** The annotations a stub declares for one function: its parameters by name, and its return. */
@AutoValue
public abstract class FunctionAnnotations {

  /** Returns the annotation of each annotated parameter, keyed by parameter name. */
  public abstract ImmutableMap<String, Expression> parameters();

  /** Returns the return annotation, or null if the stub declares none. */
  @Nullable
  public abstract Expression returns();

  static FunctionAnnotations create(
      ImmutableMap<String, Expression> parameters, @Nullable Expression returns) {
    return new AutoValue_FunctionAnnotations(parameters, returns);
  }
}
