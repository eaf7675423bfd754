package me.christianrobert.camlbuilder.caml.logical;

public enum LogicalJoinType {

    AND("And"),
    OR("Or");

    private final String tag;

    LogicalJoinType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
