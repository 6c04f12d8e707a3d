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

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Prints the structure of a syntax tree: one node per block, its kind name followed by its
 * fields in source order, nested by indentation.
 *
 * <p>A full dump shows every field. A compact dump leaves out whitespace and comments, along with
 * fields that hold their default value (null, false, an empty string or an empty list), which
 * makes the semantic shape of the tree easier to read.
 */
public final class NodePrinter {

  private static final String INDENT = "  ";

  private final StringBuilder buf;
  private final int indentLevel;
  private final boolean full;

  /** Creates a printer that writes a full dump to {@code buf}, starting at the given depth. */
  NodePrinter(StringBuilder buf, int indentLevel) {
    this(buf, indentLevel, true);
  }

  private NodePrinter(StringBuilder buf, int indentLevel, boolean full) {
    this.buf = buf;
    this.indentLevel = indentLevel;
    this.full = full;
  }

  /** Returns the full structural dump of {@code node}. */
  public static String dump(Node node) {
    return dump(node, true);
  }

  /**
   * Returns the structural dump of {@code node}. If {@code full} is false, whitespace, comments
   * and default-valued fields are omitted.
   */
  public static String dump(Node node, boolean full) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, 0, full).printNode(node);
    return buf.toString();
  }

  /** Appends the dump of {@code node}, without a trailing newline. */
  void printNode(Node node) {
    printNode(node, indentLevel);
  }

  private void printNode(Node node, int level) {
    buf.append(kindName(node)).append('(');
    boolean any = false;
    for (Map.Entry<String, Object> field : node.fields().entrySet()) {
      Object value = field.getValue();
      if (!full && (isFormatting(value) || isDefault(value))) {
        continue;
      }
      any = true;
      buf.append('\n');
      indent(level + 1);
      buf.append(field.getKey()).append('=');
      printValue(value, level + 1);
      buf.append(',');
    }
    if (any) {
      buf.append('\n');
      indent(level);
    }
    buf.append(')');
  }

  private void printValue(@Nullable Object value, int level) {
    if (value == null) {
      buf.append("null");
    } else if (value instanceof Node) {
      printNode((Node) value, level);
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      if (list.isEmpty()) {
        buf.append("[]");
        return;
      }
      buf.append('[');
      for (Object element : list) {
        buf.append('\n');
        indent(level + 1);
        printValue(element, level + 1);
        buf.append(',');
      }
      buf.append('\n');
      indent(level);
      buf.append(']');
    } else if (value instanceof String || value instanceof TokenKind) {
      appendQuoted(value.toString());
    } else {
      buf.append(value);
    }
  }

  private void indent(int level) {
    for (int i = 0; i < level; i++) {
      buf.append(INDENT);
    }
  }

  private void appendQuoted(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        case '\f':
          buf.append("\\f");
          break;
        default:
          buf.append(c);
      }
    }
    buf.append('"');
  }

  // Name of the node class, e.g. "SimpleStatementLine" for SIMPLE_STATEMENT_LINE.
  private static String kindName(Node node) {
    return node.getClass().getSimpleName();
  }

  private static boolean isFormatting(@Nullable Object value) {
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      return !list.isEmpty() && list.stream().allMatch(NodePrinter::isFormatting);
    }
    return value instanceof ParenthesizableWhitespace
        || value instanceof TrailingWhitespace
        || value instanceof EmptyLine
        || value instanceof Comment
        || value instanceof Newline;
  }

  private static boolean isDefault(@Nullable Object value) {
    return value == null
        || Boolean.FALSE.equals(value)
        || "".equals(value)
        || (value instanceof List && ((List<?>) value).isEmpty());
  }
}
