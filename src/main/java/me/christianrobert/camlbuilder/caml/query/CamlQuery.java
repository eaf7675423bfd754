package me.christianrobert.camlbuilder.caml.query;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.operator.FieldRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Represents a complete {@code <Query>} element.
 *
 * <p>Dialect rule:
 * <pre>
 * &lt;Query&gt;
 *     &lt;Where&gt; statement &lt;/Where&gt;?
 *     &lt;OrderBy&gt; FieldRef+ &lt;/OrderBy&gt;?
 *     &lt;GroupBy Collapse="TRUE"?&gt; FieldRef+ &lt;/GroupBy&gt;?
 * &lt;/Query&gt;
 * </pre>
 *
 * <p>Sections without content are left out.
 */
public class CamlQuery implements CamlNode {

    private final CamlStatement where;
    private final List<OrderByField> orderBy;
    private final List<String> groupBy;
    private final boolean collapse;

    private CamlQuery(Builder builder) {
        this.where = builder.where;
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.collapse = builder.collapse;
    }

    /**
     * Query holding only a Where section.
     */
    public static CamlQuery where(CamlStatement statement) {
        if (statement == null) {
            throw new CamlBuildException("Where statement cannot be null", "Where");
        }
        return builder().where(statement).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        sb.append("<Query>");
        appendWhere(sb, context);
        appendOrderBy(sb, context);
        appendGroupBy(sb, context);
        sb.append("</Query>");
    }

    /**
     * Renders only the Where section, as most list APIs expect it.
     *
     * @return {@code <Where>...</Where>}, or an empty string when no predicate is set
     */
    public String toWhereCaml(CamlContext context) {
        StringBuilder sb = new StringBuilder();
        appendWhere(sb, context);
        return sb.toString();
    }

    private void appendWhere(StringBuilder sb, CamlContext context) {
        if (where == null) {
            return;
        }
        sb.append("<Where>");
        where.appendCaml(sb, context);
        sb.append("</Where>");
    }

    private void appendOrderBy(StringBuilder sb, CamlContext context) {
        if (orderBy.isEmpty()) {
            return;
        }
        sb.append("<OrderBy>");
        for (OrderByField field : orderBy) {
            field.toFieldRef().appendCaml(sb, context);
        }
        sb.append("</OrderBy>");
    }

    private void appendGroupBy(StringBuilder sb, CamlContext context) {
        if (groupBy.isEmpty()) {
            return;
        }
        sb.append(collapse ? "<GroupBy Collapse=\"TRUE\">" : "<GroupBy>");
        for (String fieldName : groupBy) {
            FieldRef.of(fieldName).appendCaml(sb, context);
        }
        sb.append("</GroupBy>");
    }

    public CamlStatement getWhere() {
        return where;
    }

    public List<OrderByField> getOrderBy() {
        return orderBy;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public boolean isCollapse() {
        return collapse;
    }

    @Override
    public String toString() {
        return "CamlQuery{where=" + where + ", orderBy=" + orderBy + ", groupBy=" + groupBy + "}";
    }

    public static class Builder {

        private CamlStatement where;
        private final List<OrderByField> orderBy = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private boolean collapse;

        private Builder() {
        }

        public Builder where(CamlStatement statement) {
            this.where = statement;
            return this;
        }

        public Builder orderBy(String fieldName, boolean ascending) {
            orderBy.add(new OrderByField(fieldName, ascending));
            return this;
        }

        public Builder orderBy(OrderByField field) {
            if (field == null) {
                throw new CamlBuildException("OrderBy field cannot be null", "OrderBy");
            }
            orderBy.add(field);
            return this;
        }

        public Builder groupBy(boolean collapse, String... fieldNames) {
            if (fieldNames == null || fieldNames.length == 0) {
                throw new CamlBuildException("GroupBy requires at least one field", "GroupBy");
            }
            for (String fieldName : fieldNames) {
                FieldRef.of(fieldName);
            }
            groupBy.addAll(Arrays.asList(fieldNames));
            this.collapse = collapse;
            return this;
        }

        public CamlQuery build() {
            return new CamlQuery(this);
        }
    }
}
