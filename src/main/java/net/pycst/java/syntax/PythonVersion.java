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

/** The Python grammar version a parse targets. Later versions accept strictly more syntax. */
public enum PythonVersion {
  PY_3_7(3, 7),
  PY_3_8(3, 8),
  PY_3_9(3, 9),
  PY_3_10(3, 10),
  PY_3_11(3, 11);

  private final int major;
  private final int minor;

  PythonVersion(int major, int minor) {
    this.major = major;
    this.minor = minor;
  }

  /** Reports whether this version is the same as or newer than {@code other}. */
  public boolean atLeast(PythonVersion other) {
    return compareTo(other) >= 0;
  }

  /** Parses a version string such as {@code "3.9"}. */
  public static PythonVersion fromString(String version) {
    for (PythonVersion v : values()) {
      if (v.toString().equals(version)) {
        return v;
      }
    }
    throw new IllegalArgumentException("unsupported Python version: " + version);
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
