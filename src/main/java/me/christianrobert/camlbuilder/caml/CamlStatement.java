package me.christianrobert.camlbuilder.caml;

import me.christianrobert.camlbuilder.caml.logical.LogicalJoin;
import me.christianrobert.camlbuilder.caml.logical.LogicalJoinType;

/**
 * A renderable predicate: either a single operator or a logical join of two statements.
 * This is what goes inside a {@code <Where>} element.
 */
public abstract class CamlStatement implements CamlNode {

    /**
     * Joins this statement with another one: {@code <And>this other</And>}.
     */
    public CamlStatement and(CamlStatement other) {
        return new LogicalJoin(LogicalJoinType.AND, this, other);
    }

    /**
     * Joins this statement with another one: {@code <Or>this other</Or>}.
     */
    public CamlStatement or(CamlStatement other) {
        return new LogicalJoin(LogicalJoinType.OR, this, other);
    }
}
