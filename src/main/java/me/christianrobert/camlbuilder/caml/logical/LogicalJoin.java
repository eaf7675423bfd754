package me.christianrobert.camlbuilder.caml.logical;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Represents a logical join of exactly two statements.
 *
 * <p>Dialect rule:
 * <pre>
 * &lt;And&gt; statement statement &lt;/And&gt;
 * &lt;Or&gt;  statement statement &lt;/Or&gt;
 * </pre>
 *
 * <p>CAML has no n-ary And/Or. Joins of more than two statements are nested;
 * use {@link #andAll(CamlStatement...)}, {@link #orAll(CamlStatement...)} or
 * {@link ConnectiveFolder} to build them.
 */
public class LogicalJoin extends CamlStatement {

    private final LogicalJoinType joinType;
    private final CamlStatement left;
    private final CamlStatement right;

    public LogicalJoin(LogicalJoinType joinType, CamlStatement left, CamlStatement right) {
        if (joinType == null) {
            throw new CamlBuildException("LogicalJoin joinType cannot be null");
        }
        if (left == null || right == null) {
            throw new CamlBuildException("LogicalJoin requires two statements", joinType.getTag());
        }
        this.joinType = joinType;
        this.left = left;
        this.right = right;
    }

    /**
     * Joins all statements with {@code <And>}, nesting left-deep.
     * A single statement is returned unchanged.
     */
    public static CamlStatement andAll(CamlStatement... statements) {
        return join(LogicalJoinType.AND, statements);
    }

    /**
     * Joins all statements with {@code <Or>}, nesting left-deep.
     * A single statement is returned unchanged.
     */
    public static CamlStatement orAll(CamlStatement... statements) {
        return join(LogicalJoinType.OR, statements);
    }

    private static CamlStatement join(LogicalJoinType joinType, CamlStatement... statements) {
        if (statements == null) {
            throw new CamlBuildException("A logical join requires at least one statement", joinType.getTag());
        }
        return ConnectiveFolder.fold(joinType, Arrays.asList(statements));
    }

    /**
     * Writes the join with an explicit stack. A left-deep fold of N statements
     * nests N-1 joins, so the walk must not use the call stack.
     */
    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        // Entries are nodes still to render, or closing tags still to write
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof String) {
                sb.append((String) next);
            } else if (next instanceof LogicalJoin) {
                LogicalJoin join = (LogicalJoin) next;
                String tag = join.joinType.getTag();
                sb.append('<').append(tag).append('>');
                pending.push("</" + tag + ">");
                pending.push(join.right);
                pending.push(join.left);
            } else {
                ((CamlNode) next).appendCaml(sb, context);
            }
        }
    }

    public LogicalJoinType getJoinType() {
        return joinType;
    }

    public CamlStatement getLeft() {
        return left;
    }

    public CamlStatement getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "LogicalJoin{" + toCaml(CamlContext.defaults()) + "}";
    }
}
