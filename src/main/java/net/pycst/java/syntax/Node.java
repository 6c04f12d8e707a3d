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
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * A node in the concrete syntax tree.
 *
 * <p>Nodes are immutable and hold no reference to their parent, so one instance may appear in
 * several trees. Every node owns, besides its semantic children, the formatting immediately around
 * them: generating code from a parsed tree reproduces the source exactly.
 *
 * <p>{@link #equals} is identity. Use {@link #deepEquals} to compare structure.
 */
public abstract class Node {

  /** The kind of a node. Each kind corresponds to exactly one final subclass. */
  public enum Kind {
    SIMPLE_WHITESPACE,
    PARENTHESIZED_WHITESPACE,
    COMMENT,
    NEWLINE,
    TRAILING_WHITESPACE,
    EMPTY_LINE,
    MODULE,
    SIMPLE_STATEMENT_LINE,
    SIMPLE_STATEMENT_SUITE,
    INDENTED_BLOCK,
    EXPRESSION_STATEMENT,
    ASSIGN_STATEMENT,
    ANNOTATED_ASSIGN_STATEMENT,
    AUGMENTED_ASSIGN_STATEMENT,
    FLOW_STATEMENT,
    RETURN_STATEMENT,
    RAISE_STATEMENT,
    ASSERT_STATEMENT,
    DEL_STATEMENT,
    GLOBAL_STATEMENT,
    IMPORT_STATEMENT,
    IMPORT_FROM_STATEMENT,
    IF_STATEMENT,
    ELSE_CLAUSE,
    WHILE_STATEMENT,
    FOR_STATEMENT,
    TRY_STATEMENT,
    EXCEPT_HANDLER,
    FINALLY_CLAUSE,
    WITH_STATEMENT,
    WITH_ITEM,
    FUNCTION_DEF,
    CLASS_DEF,
    DECORATOR,
    ASYNCHRONOUS,
    NAME,
    INT_LITERAL,
    FLOAT_LITERAL,
    IMAGINARY_LITERAL,
    STRING_LITERAL,
    FORMATTED_STRING,
    CONCATENATED_STRING,
    ELLIPSIS,
    ATTRIBUTE,
    SUBSCRIPT,
    CALL,
    BINARY_OPERATION,
    UNARY_OPERATION,
    BOOLEAN_OPERATION,
    COMPARISON,
    CONDITIONAL_EXPRESSION,
    LAMBDA,
    NAMED_EXPRESSION,
    AWAIT,
    YIELD,
    TUPLE_EXPRESSION,
    LIST_EXPRESSION,
    SET_EXPRESSION,
    DICT_EXPRESSION,
    LIST_COMPREHENSION,
    SET_COMPREHENSION,
    DICT_COMPREHENSION,
    GENERATOR_EXPRESSION,
    SUBSCRIPT_ELEMENT,
    INDEX,
    SLICE,
    ARGUMENT,
    COMPARISON_TARGET,
    FROM_CLAUSE,
    ELEMENT,
    STARRED_ELEMENT,
    DICT_ELEMENT,
    STARRED_DICT_ELEMENT,
    COMPREHENSION_FOR,
    COMPREHENSION_IF,
    PARAMETERS,
    PARAMETER,
    PARAM_STAR,
    PARAM_SLASH,
    ANNOTATION,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    DOT,
    COLON,
    SEMICOLON,
    ASSIGN_EQUAL,
    ASSIGN_TARGET,
    AS_NAME,
    NAME_ITEM,
    IMPORT_ALIAS,
    IMPORT_STAR,
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    BOOLEAN_OPERATOR,
    COMPARISON_OPERATOR,
    AUGMENTED_OPERATOR;
  }

  private final Kind kind;

  Node(Kind kind) {
    this.kind = kind;
  }

  /** Returns the kind of this node. */
  public final Kind kind() {
    return kind;
  }

  /**
   * Passes each field of this node through {@code visitor}, in source order, and returns a node of
   * the same kind built from the results, or this node if no field changed.
   */
  abstract Node walkFields(FieldVisitor visitor);

  /** Appends the source text of this node, including the whitespace it owns, to {@code state}. */
  abstract void codegen(CodegenState state);

  /**
   * Like {@link #codegen(CodegenState)}, for nodes whose output depends on their position among
   * siblings; {@code defaultSeparator} reports whether a default comma, semicolon or similar is
   * needed when the node does not record one.
   */
  void codegen(CodegenState state, boolean defaultSeparator) {
    codegen(state);
  }

  final void generate(CodegenState state) {
    generate(state, false);
  }

  final void generate(CodegenState state, boolean defaultSeparator) {
    state.enter(this);
    codegen(state, defaultSeparator);
    state.exit(this);
  }

  /** Returns the child nodes of this node in source order. */
  public final ImmutableList<Node> children() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    walkFields(
        new FieldVisitor() {
          @Override
          Object visitNode(String field, Node value) {
            children.add(value);
            return value;
          }
        });
    return children.build();
  }

  /**
   * Returns a copy of this node with the named fields replaced. Fields not named are shared with
   * this node. Sequence fields accept any {@link Iterable} of nodes.
   *
   * @throws InvalidNodeException if a name is not a field of this node, or the result would be
   *     structurally invalid
   */
  public final Node withChanges(Map<String, ?> changes) {
    TreeSet<String> unknown = new TreeSet<>(changes.keySet());
    Node result =
        walkFields(
            new FieldVisitor() {
              @Override
              Object visitNode(String field, Node value) {
                return override(field, value);
              }

              @Override
              Object visitOptional(String field, @Nullable Node value) {
                return override(field, value);
              }

              @Override
              Object visitNodes(String field, ImmutableList<? extends Node> value) {
                return override(field, value);
              }

              @Override
              Object visitAttribute(String field, @Nullable Object value) {
                return override(field, value);
              }

              @Nullable
              private Object override(String field, @Nullable Object value) {
                if (!changes.containsKey(field)) {
                  return value;
                }
                unknown.remove(field);
                return changes.get(field);
              }
            });
    if (!unknown.isEmpty()) {
      throw new InvalidNodeException(String.format("%s has no field %s", kind, unknown));
    }
    return result;
  }

  /** Returns a copy of this node with one field replaced. */
  public final Node withChanges(String field, @Nullable Object value) {
    return withChanges(Collections.singletonMap(field, value));
  }

  /**
   * Traverses this subtree depth-first in source order, calling the visitor's enter hook before
   * and its leave hook after each node's children.
   */
  public final void visit(CstVisitor visitor) {
    if (visitor.onVisit(this)) {
      walkFields(
          new FieldVisitor() {
            @Override
            Object visitNode(String field, Node value) {
              value.visit(visitor);
              return value;
            }
          });
    }
    visitor.onLeave(this);
  }

  /**
   * Transforms this subtree depth-first in source order and returns the result: the node
   * returned by the transformer's leave hook for this node, or null if it asked for removal.
   * Ancestors of changed nodes are rebuilt; unchanged subtrees are shared with the input.
   */
  @Nullable
  public Node visit(CstTransformer transformer) {
    Node updated = this;
    if (transformer.onVisit(this)) {
      updated =
          walkFields(
              new FieldVisitor() {
                @Override
                Object visitNode(String field, Node value) {
                  return value.visit(transformer);
                }
              });
    }
    return transformer.onLeave(this, updated);
  }

  /**
   * Reports whether {@code other} has the same kind and recursively equal fields, whitespace
   * included. Two nodes that are deeply equal generate the same code.
   */
  public final boolean deepEquals(Node other) {
    return deepEquals((Object) this, other);
  }

  /** Returns a copy of this subtree that shares no node with it. */
  public final Node deepClone() {
    FieldVisitor cloner =
        new FieldVisitor() {
          @Override
          Object visitNode(String field, Node value) {
            return value.deepClone();
          }
        };
    cloner.forceRebuild();
    return walkFields(cloner);
  }

  /**
   * Returns this subtree with every occurrence of {@code old}, compared by identity, replaced by
   * {@code replacement}.
   */
  public final Node deepReplace(Node old, Node replacement) {
    Node result = visit(new ChildReplacer(old, replacement));
    return Objects.requireNonNull(result);
  }

  /**
   * Returns this subtree with every occurrence of {@code old}, compared by identity, removed from
   * its parent, or null if this node is {@code old}.
   *
   * @throws InvalidNodeException if {@code old} fills a required slot
   */
  @Nullable
  public final Node deepRemove(Node old) {
    return visit(new ChildReplacer(old, null));
  }

  /** Returns a structural dump of this subtree; see {@link NodePrinter}. */
  @Override
  public String toString() {
    return NodePrinter.dump(this);
  }

  // --- field access ---

  /** Returns the fields of this node, by name, in source order. Values may be null. */
  final Map<String, Object> fields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    walkFields(
        new FieldVisitor() {
          @Override
          Object visitNode(String field, Node value) {
            fields.put(field, value);
            return value;
          }

          @Override
          Object visitOptional(String field, @Nullable Node value) {
            fields.put(field, value);
            return value;
          }

          @Override
          Object visitNodes(String field, ImmutableList<? extends Node> value) {
            fields.put(field, value);
            return value;
          }

          @Override
          Object visitAttribute(String field, @Nullable Object value) {
            fields.put(field, value);
            return value;
          }
        });
    return fields;
  }

  private static boolean deepEquals(@Nullable Object x, @Nullable Object y) {
    if (x == y) {
      return true;
    }
    if (x instanceof Node && y instanceof Node) {
      Node a = (Node) x;
      Node b = (Node) y;
      if (a.kind != b.kind) {
        return false;
      }
      Map<String, Object> fieldsA = a.fields();
      Map<String, Object> fieldsB = b.fields();
      for (Map.Entry<String, Object> e : fieldsA.entrySet()) {
        if (!deepEquals(e.getValue(), fieldsB.get(e.getKey()))) {
          return false;
        }
      }
      return true;
    }
    if (x instanceof List && y instanceof List) {
      List<?> a = (List<?>) x;
      List<?> b = (List<?>) y;
      if (a.size() != b.size()) {
        return false;
      }
      for (int i = 0; i < a.size(); i++) {
        if (!deepEquals(a.get(i), b.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(x, y);
  }

  // --- helpers for subclasses ---

  @FormatMethod
  static void checkNode(boolean condition, @FormatString String format, Object... args) {
    if (!condition) {
      throw new InvalidNodeException(String.format(format, args));
    }
  }

  static <T> T require(String field, @Nullable T value) {
    if (value == null) {
      throw new InvalidNodeException(String.format("field '%s' is required", field));
    }
    return value;
  }

  static <T> ImmutableList<T> copyOf(String field, @Nullable List<? extends T> list) {
    if (list == null) {
      throw new InvalidNodeException(String.format("field '%s' is required", field));
    }
    List<T> elements = new ArrayList<>(list.size());
    for (T element : list) {
      if (element == null) {
        throw new InvalidNodeException(String.format("field '%s' cannot hold null", field));
      }
      elements.add(element);
    }
    return ImmutableList.copyOf(elements);
  }

  /** Reports whether {@code s} is a non-empty run of spaces and tabs. */
  static boolean isWhitespace(String s) {
    return !s.isEmpty() && s.chars().allMatch(c -> c == ' ' || c == '\t');
  }

  static void generateAll(CodegenState state, List<? extends Node> nodes) {
    for (Node node : nodes) {
      node.generate(state);
    }
  }

  /** Generates {@code nodes}, asking every node but the last for a default separator. */
  static void generateSeparated(CodegenState state, List<? extends Node> nodes) {
    int n = nodes.size();
    for (int i = 0; i < n; i++) {
      nodes.get(i).generate(state, i < n - 1);
    }
  }

  /** Replaces, or with a null replacement removes, every occurrence of one node. */
  private static final class ChildReplacer extends CstTransformer {
    private final Node old;
    @Nullable private final Node replacement;

    ChildReplacer(Node old, @Nullable Node replacement) {
      this.old = old;
      this.replacement = replacement;
    }

    @Override
    public boolean onVisit(Node node) {
      return node != old;
    }

    @Override
    @Nullable
    public Node onLeave(Node original, Node updated) {
      return original == old ? replacement : updated;
    }
  }
}
