package me.christianrobert.camlbuilder.caml.query;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.operator.FieldRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Represents a {@code <View>} element: a query plus the returned fields and paging.
 *
 * <p>Dialect rule:
 * <pre>
 * &lt;View Scope="..."?&gt;
 *     &lt;Query&gt;...&lt;/Query&gt;?
 *     &lt;ViewFields&gt; FieldRef+ &lt;/ViewFields&gt;?
 *     &lt;RowLimit Paged="TRUE"?&gt; n &lt;/RowLimit&gt;?
 * &lt;/View&gt;
 * </pre>
 */
public class CamlView implements CamlNode {

    private final CamlQuery query;
    private final List<String> viewFields;
    private final Integer rowLimit;
    private final boolean paged;
    private final ViewScope scope;

    private CamlView(Builder builder) {
        this.query = builder.query;
        this.viewFields = Collections.unmodifiableList(new ArrayList<>(builder.viewFields));
        this.rowLimit = builder.rowLimit;
        this.paged = builder.paged;
        this.scope = builder.scope;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        sb.append("<View");
        if (scope.getAttributeValue() != null) {
            sb.append(" Scope=\"").append(scope.getAttributeValue()).append('"');
        }
        sb.append('>');

        if (query != null) {
            query.appendCaml(sb, context);
        }

        if (!viewFields.isEmpty()) {
            sb.append("<ViewFields>");
            for (String fieldName : viewFields) {
                FieldRef.of(fieldName).appendCaml(sb, context);
            }
            sb.append("</ViewFields>");
        }

        if (rowLimit != null) {
            sb.append(paged ? "<RowLimit Paged=\"TRUE\">" : "<RowLimit>")
                .append(rowLimit)
                .append("</RowLimit>");
        }

        sb.append("</View>");
    }

    public CamlQuery getQuery() {
        return query;
    }

    public List<String> getViewFields() {
        return viewFields;
    }

    public Integer getRowLimit() {
        return rowLimit;
    }

    public boolean isPaged() {
        return paged;
    }

    public ViewScope getScope() {
        return scope;
    }

    @Override
    public String toString() {
        return "CamlView{query=" + query + ", viewFields=" + viewFields + ", rowLimit=" + rowLimit
            + ", scope=" + scope + "}";
    }

    public static class Builder {

        private CamlQuery query;
        private final Set<String> viewFields = new LinkedHashSet<>();
        private Integer rowLimit;
        private boolean paged;
        private ViewScope scope = ViewScope.DEFAULT;

        private Builder() {
        }

        public Builder query(CamlQuery query) {
            this.query = query;
            return this;
        }

        public Builder viewFields(String... fieldNames) {
            if (fieldNames == null) {
                throw new CamlBuildException("ViewFields cannot be null", "ViewFields");
            }
            // Validate everything first so a rejected call leaves the builder untouched
            Set<String> added = new LinkedHashSet<>();
            for (String fieldName : fieldNames) {
                FieldRef.of(fieldName);
                if (viewFields.contains(fieldName) || !added.add(fieldName)) {
                    throw new CamlBuildException("Duplicate view field: " + fieldName, "ViewFields");
                }
            }
            viewFields.addAll(added);
            return this;
        }

        public Builder rowLimit(int rowLimit, boolean paged) {
            if (rowLimit <= 0) {
                throw new CamlBuildException("RowLimit must be positive, got " + rowLimit, "RowLimit");
            }
            this.rowLimit = rowLimit;
            this.paged = paged;
            return this;
        }

        public Builder scope(ViewScope scope) {
            this.scope = scope != null ? scope : ViewScope.DEFAULT;
            return this;
        }

        public CamlView build() {
            return new CamlView(this);
        }
    }
}
