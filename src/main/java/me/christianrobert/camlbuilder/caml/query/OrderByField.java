package me.christianrobert.camlbuilder.caml.query;

import me.christianrobert.camlbuilder.caml.operator.FieldRef;

/**
 * One sort key of an OrderBy section.
 */
public class OrderByField {

    private final String fieldName;
    private final boolean ascending;

    public OrderByField(String fieldName, boolean ascending) {
        // FieldRef validates the name
        FieldRef.of(fieldName);
        this.fieldName = fieldName;
        this.ascending = ascending;
    }

    public static OrderByField ascending(String fieldName) {
        return new OrderByField(fieldName, true);
    }

    public static OrderByField descending(String fieldName) {
        return new OrderByField(fieldName, false);
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isAscending() {
        return ascending;
    }

    FieldRef toFieldRef() {
        return FieldRef.ordered(fieldName, ascending);
    }

    @Override
    public String toString() {
        return fieldName + (ascending ? " ASC" : " DESC");
    }
}
