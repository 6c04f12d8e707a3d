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
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * Options that affect how source is decoded and parsed.
 *
 * <p>Fields left null are detected from the input: the encoding from a byte order mark or a
 * coding declaration, the default indentation from the first indented block, and the default
 * newline from the first line ending.
 */
@AutoValue
public abstract class ParserConfig {

  /** The default configuration: the newest supported grammar, everything else detected. */
  public static final ParserConfig DEFAULT = builder().build();

  static final ImmutableSet<String> NEWLINES = ImmutableSet.of("\n", "\r\n", "\r");

  /** The grammar version to accept. */
  public abstract PythonVersion pythonVersion();

  /** The character encoding of byte input, or null to detect it. */
  @Nullable
  public abstract String encoding();

  /** The indentation used by blocks that do not record their own, or null to detect it. */
  @Nullable
  public abstract String defaultIndent();

  /** The line ending used by newlines that do not record their own, or null to detect it. */
  @Nullable
  public abstract String defaultNewline();

  public static Builder builder() {
    return new AutoValue_ParserConfig.Builder().pythonVersion(PythonVersion.PY_3_11);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ParserConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder pythonVersion(PythonVersion value);

    public abstract Builder encoding(@Nullable String value);

    public abstract Builder defaultIndent(@Nullable String value);

    public abstract Builder defaultNewline(@Nullable String value);

    abstract ParserConfig autoBuild();

    public ParserConfig build() {
      ParserConfig config = autoBuild();
      String indent = config.defaultIndent();
      if (indent != null && !Node.isWhitespace(indent)) {
        throw new IllegalArgumentException("invalid default indent: '" + indent + "'");
      }
      String newline = config.defaultNewline();
      if (newline != null && !NEWLINES.contains(newline)) {
        throw new IllegalArgumentException("invalid default newline");
      }
      return config;
    }
  }
}
