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

import com.google.common.flogger.GoogleLogger;
import net.pycst.java.syntax.Module;
import net.pycst.java.syntax.ParseException;
import net.pycst.java.syntax.ParserConfig;

/**
 * Applies the annotations of a type stub to a source module.
 *
 * <p>Only the annotated definitions change; all other formatting and comments of the source are
 * preserved verbatim.
 */
public final class ApplyTypeAnnotations {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private ApplyTypeAnnotations() {}

  /** Collects the annotations declared by {@code stub}. */
  public static StubAnnotations collect(Module stub) {
    TypeAnnotationCollector collector = new TypeAnnotationCollector();
    stub.visit(collector);
    StubAnnotations annotations = collector.getAnnotations();
    logger.atFine().log(
        "collected %d function signatures and %d attribute annotations",
        annotations.functions().size(), annotations.attributes().size());
    return annotations;
  }

  /** Returns {@code source} with the annotations of {@code stub} added where missing. */
  public static Module apply(Module stub, Module source) {
    return apply(stub, source, false);
  }

  /**
   * Returns {@code source} with the annotations of {@code stub} applied. If {@code
   * overwriteExisting} is set, annotations already present in the source are replaced.
   */
  public static Module apply(Module stub, Module source, boolean overwriteExisting) {
    StubAnnotations annotations = collect(stub);
    if (annotations.isEmpty()) {
      return source;
    }
    ApplyTypeAnnotationsTransformer transformer =
        new ApplyTypeAnnotationsTransformer(annotations, overwriteExisting);
    Module result = source.visit(transformer);
    logger.atFine().log("applied %d annotations", transformer.getAppliedCount());
    return result;
  }

  /** Parses both texts, applies the stub, and returns the resulting source code. */
  public static String apply(String stub, String source) throws ParseException {
    return apply(Module.parse(stub), Module.parse(source)).getCode();
  }

  /** Like {@link #apply(String, String)}, parsing both texts with {@code config}. */
  public static String apply(String stub, String source, ParserConfig config)
      throws ParseException {
    return apply(Module.parse(stub, config), Module.parse(source, config)).getCode();
  }
}
