package me.christianrobert.camlbuilder.caml.operator;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;

/**
 * Reference to a list field: {@code <FieldRef Name="Title"/>}.
 *
 * <p>Used by operators, and by the OrderBy, GroupBy and ViewFields sections of a query.
 */
public class FieldRef implements CamlNode {

    private final String name;
    private final boolean lookupId;
    private final Boolean ascending;

    private FieldRef(String name, boolean lookupId, Boolean ascending) {
        if (name == null || name.trim().isEmpty()) {
            throw new CamlBuildException("FieldRef name cannot be null or empty");
        }
        this.name = name;
        this.lookupId = lookupId;
        this.ascending = ascending;
    }

    public static FieldRef of(String name) {
        return new FieldRef(name, false, null);
    }

    /**
     * Field compared by lookup id rather than by lookup text ({@code LookupId="TRUE"}).
     */
    public static FieldRef lookupId(String name) {
        return new FieldRef(name, true, null);
    }

    /**
     * Field inside an OrderBy section. Only descending order is written out,
     * ascending being the dialect's default.
     */
    public static FieldRef ordered(String name, boolean ascending) {
        return new FieldRef(name, false, ascending);
    }

    public String getName() {
        return name;
    }

    public boolean isLookupId() {
        return lookupId;
    }

    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        sb.append("<FieldRef Name=\"").append(context.escapeAttribute(name)).append('"');
        if (lookupId) {
            sb.append(" LookupId=\"TRUE\"");
        }
        if (Boolean.FALSE.equals(ascending)) {
            sb.append(" Ascending=\"FALSE\"");
        }
        sb.append("/>");
    }

    @Override
    public String toString() {
        return "FieldRef{name='" + name + "'}";
    }
}
