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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** The half-open span of generated text covered by a node. */
@AutoValue
public abstract class CodeRange {

  public abstract CodePosition start();

  public abstract CodePosition end();

  public static CodeRange create(CodePosition start, CodePosition end) {
    Preconditions.checkArgument(start.compareTo(end) <= 0, "range ends before it starts");
    return new AutoValue_CodeRange(start, end);
  }

  @Override
  public final String toString() {
    return start() + "-" + end();
  }
}
