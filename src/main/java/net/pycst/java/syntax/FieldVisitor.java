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

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Receives the fields of a node, in source order, from {@link Node#walkFields}. Each hook returns
 * the value the field should have afterwards; a node whose fields all come back unchanged is
 * returned as is, otherwise a new node is built from the results (and validated by its
 * constructor).
 *
 * <p>The typed methods called by {@code walkFields} check the shape of whatever a hook returns,
 * so an ill-typed replacement fails with {@link InvalidNodeException} naming the field.
 */
abstract class FieldVisitor {

  private boolean changed;
  private boolean forceRebuild;

  /** Reports whether the node being walked must be rebuilt. */
  final boolean changed() {
    return changed || forceRebuild;
  }

  /** Makes {@code walkFields} build a new node even if no field changes. */
  final void forceRebuild() {
    this.forceRebuild = true;
  }

  // --- hooks ---

  /** Returns the new value of a child slot holding {@code value}, or null to remove it. */
  @Nullable
  Object visitNode(String field, Node value) {
    return value;
  }

  /** Returns the new value of an optional child slot. */
  @Nullable
  Object visitOptional(String field, @Nullable Node value) {
    return value == null ? null : visitNode(field, value);
  }

  /**
   * Returns the new value of a sequence field. By default each element goes through {@link
   * #visitNode}; elements mapped to null are dropped.
   */
  Object visitNodes(String field, ImmutableList<? extends Node> value) {
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    boolean same = true;
    for (Node element : value) {
      Object replacement = visitNode(field, element);
      if (replacement != element) {
        same = false;
      }
      if (replacement != null) {
        result.add(replacement);
      }
    }
    return same ? value : result.build();
  }

  /** Returns the new value of a scalar field. */
  @Nullable
  Object visitAttribute(String field, @Nullable Object value) {
    return value;
  }

  // --- typed entry points used by walkFields ---

  final <T extends Node> T node(String field, T value, Class<T> type) {
    Object result = visitNode(field, value);
    if (result == null) {
      throw new InvalidNodeException(
          String.format("field '%s' is required and cannot be removed", field));
    }
    return record(value, cast(field, result, type));
  }

  @Nullable
  final <T extends Node> T optional(String field, @Nullable T value, Class<T> type) {
    Object result = visitOptional(field, value);
    return record(value, result == null ? null : cast(field, result, type));
  }

  final <T extends Node> ImmutableList<T> nodes(
      String field, ImmutableList<T> value, Class<T> type) {
    Object result = visitNodes(field, value);
    if (result == value) {
      return value;
    }
    if (!(result instanceof Iterable)) {
      throw new InvalidNodeException(
          String.format(
              "field '%s' expects a sequence of %s, got %s",
              field, type.getSimpleName(), describe(result)));
    }
    ImmutableList.Builder<T> elements = ImmutableList.builder();
    for (Object element : (Iterable<?>) result) {
      elements.add(cast(field, element, type));
    }
    changed = true;
    return elements.build();
  }

  final <T> T attribute(String field, T value, Class<T> type) {
    T result = optionalAttribute(field, value, type);
    if (result == null) {
      throw new InvalidNodeException(String.format("field '%s' cannot be null", field));
    }
    return result;
  }

  @Nullable
  final <T> T optionalAttribute(String field, @Nullable T value, Class<T> type) {
    Object result = visitAttribute(field, value);
    if (Objects.equals(result, value)) {
      return value;
    }
    if (result != null && !type.isInstance(result)) {
      throw new InvalidNodeException(
          String.format(
              "field '%s' expects %s, got %s", field, type.getSimpleName(), describe(result)));
    }
    changed = true;
    return type.cast(result);
  }

  private <T> T record(@Nullable T before, @Nullable T after) {
    if (before != after) {
      changed = true;
    }
    return after;
  }

  private static <T> T cast(String field, @Nullable Object value, Class<T> type) {
    if (!type.isInstance(value)) {
      throw new InvalidNodeException(
          String.format(
              "field '%s' expects %s, got %s", field, type.getSimpleName(), describe(value)));
    }
    return type.cast(value);
  }

  private static String describe(@Nullable Object value) {
    if (value == null) {
      return "null";
    }
    return value instanceof Node
        ? ((Node) value).kind().toString()
        : value.getClass().getSimpleName();
  }
}
