package me.christianrobert.camlbuilder.caml.query;

/**
 * Folder scope of a view. DEFAULT writes no attribute.
 */
public enum ViewScope {

    DEFAULT(null),
    RECURSIVE("Recursive"),
    RECURSIVE_ALL("RecursiveAll"),
    FILES_ONLY("FilesOnly");

    private final String attributeValue;

    ViewScope(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public String getAttributeValue() {
        return attributeValue;
    }
}
