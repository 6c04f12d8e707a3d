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

/** A position in source text: 1-based line, 0-based column. */
@AutoValue
public abstract class CodePosition implements Comparable<CodePosition> {

  public abstract int line();

  public abstract int column();

  public static CodePosition create(int line, int column) {
    return new AutoValue_CodePosition(line, column);
  }

  @Override
  public final int compareTo(CodePosition that) {
    int cmp = Integer.compare(line(), that.line());
    return cmp != 0 ? cmp : Integer.compare(column(), that.column());
  }

  @Override
  public final String toString() {
    return line() + ":" + column();
  }
}
