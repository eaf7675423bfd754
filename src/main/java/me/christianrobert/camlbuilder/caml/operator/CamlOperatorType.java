package me.christianrobert.camlbuilder.caml.operator;

/**
 * Comparison operators of the CAML dialect, each with its element name.
 */
public enum CamlOperatorType {

    EQUAL("Eq"),
    NOT_EQUAL("Neq"),
    GREATER_THAN("Gt"),
    GREATER_THAN_OR_EQUAL_TO("Geq"),
    LOWER_THAN("Lt"),
    LOWER_THAN_OR_EQUAL_TO("Leq"),
    IS_NULL("IsNull"),
    IS_NOT_NULL("IsNotNull"),
    BEGINS_WITH("BeginsWith"),
    CONTAINS("Contains"),
    DATE_RANGES_OVERLAP("DateRangesOverlap"),
    INCLUDES("Includes"),
    NOT_INCLUDES("NotIncludes");

    private final String tag;

    CamlOperatorType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Unary operators test the field alone and take no value.
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }
}
