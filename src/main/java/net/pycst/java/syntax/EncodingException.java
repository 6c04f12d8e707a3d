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

/** Thrown when byte input cannot be decoded with its declared or detected encoding. */
public final class EncodingException extends ParseException {

  private final String encoding;

  EncodingException(String message, String encoding, CodePosition position) {
    super(message, position, null);
    this.encoding = encoding;
  }

  /** Returns the name of the encoding that failed. */
  public String getEncoding() {
    return encoding;
  }
}
