package me.christianrobert.camlbuilder.caml.util;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.logical.LogicalJoin;
import me.christianrobert.camlbuilder.caml.operator.CamlOperator;
import me.christianrobert.camlbuilder.caml.query.CamlQuery;
import me.christianrobert.camlbuilder.caml.query.OrderByField;
import me.christianrobert.camlbuilder.caml.value.CamlValue;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Formats CAML trees into human-readable, indented text.
 *
 * <p>Useful for debugging how a list of statements was folded.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * And
 *   And
 *     Eq [Title]
 *       Text "Report"
 *     IsNull [AssignedTo]
 *   Gt [Modified]
 *     DateTime &lt;Today/&gt;
 * </pre>
 */
public class CamlTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;
  static final int MAX_INDENT_DEPTH = 64;

  private static final class Frame {
    private final CamlNode node;
    private final int depth;

    private Frame(CamlNode node, int depth) {
      this.node = node;
      this.depth = depth;
    }
  }

  /**
   * Formats a tree into human-readable text.
   *
   * @param node Root of the tree
   * @return Formatted string representation
   */
  public static String format(CamlNode node) {
    if (node == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();

    // Explicit stack: a left-deep fold nests one join per statement.
    // Entries are either nodes still to format or finished lines.
    Deque<Object> pending = new ArrayDeque<>();
    pending.push(new Frame(node, 0));
    while (!pending.isEmpty()) {
      Object next = pending.pop();
      if (next instanceof String) {
        sb.append((String) next);
      } else {
        formatNode((Frame) next, sb, pending);
      }
    }
    return sb.toString();
  }

  private static void formatNode(Frame frame, StringBuilder sb, Deque<Object> pending) {
    CamlNode node = frame.node;
    int depth = frame.depth;
    indent(depth, sb);

    if (node instanceof LogicalJoin) {
      LogicalJoin join = (LogicalJoin) node;
      sb.append(join.getJoinType().getTag()).append("\n");
      pending.push(new Frame(join.getRight(), depth + 1));
      pending.push(new Frame(join.getLeft(), depth + 1));

    } else if (node instanceof CamlOperator) {
      CamlOperator operator = (CamlOperator) node;
      sb.append(operator.getOperatorType().getTag())
          .append(" [").append(operator.getFieldName()).append("]\n");
      if (operator.getValue() != null) {
        pending.push(new Frame(operator.getValue(), depth + 1));
      }

    } else if (node instanceof CamlValue) {
      CamlValue value = (CamlValue) node;
      sb.append(value.getValueType().getCamlTypeName());
      if (value.isIncludeTimeValue()) {
        sb.append(" (time)");
      }
      sb.append(" ");
      if (value.getValueType().isSentinel()) {
        sb.append(value.getCamlValue());
      } else {
        sb.append("\"").append(escapeAndTruncate(value.getCamlValue())).append("\"");
      }
      sb.append("\n");

    } else if (node instanceof CamlQuery) {
      CamlQuery query = (CamlQuery) node;
      sb.append("Query\n");
      // Pushed in reverse: GroupBy, OrderBy, Where subtree, Where header
      if (!query.getGroupBy().isEmpty()) {
        StringBuilder line = new StringBuilder();
        indent(depth + 1, line);
        line.append("GroupBy ").append(query.getGroupBy()).append("\n");
        pending.push(line.toString());
      }
      if (!query.getOrderBy().isEmpty()) {
        StringBuilder line = new StringBuilder();
        indent(depth + 1, line);
        line.append("OrderBy");
        for (OrderByField field : query.getOrderBy()) {
          line.append(" [").append(field).append("]");
        }
        line.append("\n");
        pending.push(line.toString());
      }
      if (query.getWhere() != null) {
        pending.push(new Frame(query.getWhere(), depth + 2));
        StringBuilder line = new StringBuilder();
        indent(depth + 1, line);
        line.append("Where\n");
        pending.push(line.toString());
      }

    } else {
      // Unknown node type
      sb.append("(unknown: ").append(node.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Indents by depth. Past {@link #MAX_INDENT_DEPTH} the indent stops growing
   * and the real depth is printed instead, keeping the output linear in tree size.
   */
  private static void indent(int depth, StringBuilder sb) {
    int levels = Math.min(depth, MAX_INDENT_DEPTH);
    for (int i = 0; i < levels; i++) {
      sb.append(INDENT);
    }
    if (depth > MAX_INDENT_DEPTH) {
      sb.append("[").append(depth).append("] ");
    }
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
