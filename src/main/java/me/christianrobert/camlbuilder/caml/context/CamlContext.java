package me.christianrobert.camlbuilder.caml.context;

import org.apache.commons.text.StringEscapeUtils;

/**
 * Render options passed to every node's {@code toCaml()} method.
 *
 * <p>Contains:
 * <ul>
 *   <li>Whether literal payloads and field names are XML-escaped</li>
 * </ul>
 *
 * <p>Instances are immutable and can be shared between concurrent renders.
 */
public class CamlContext {

    private static final CamlContext DEFAULTS = new CamlContext(true);

    private final boolean escapeValues;

    /**
     * Creates a context.
     *
     * @param escapeValues Whether payload text and attribute values are XML-escaped
     */
    public CamlContext(boolean escapeValues) {
        this.escapeValues = escapeValues;
    }

    /**
     * Context used when the caller supplies none: escaping on.
     */
    public static CamlContext defaults() {
        return DEFAULTS;
    }

    public boolean isEscapeValues() {
        return escapeValues;
    }

    // ========== Escaping ==========

    /**
     * Escapes text that ends up as element content.
     *
     * @param text Raw text (may be null)
     * @return Escaped text, or the input unchanged when escaping is off
     */
    public String escapeText(String text) {
        if (text == null || !escapeValues) {
            return text;
        }
        return StringEscapeUtils.escapeXml10(text);
    }

    /**
     * Escapes text that ends up inside a double-quoted attribute.
     *
     * @param value Raw attribute value (may be null)
     * @return Escaped value, or the input unchanged when escaping is off
     */
    public String escapeAttribute(String value) {
        // escapeXml10 covers quotes as well, so the same routine serves both
        return escapeText(value);
    }

    @Override
    public String toString() {
        return "CamlContext{escapeValues=" + escapeValues + "}";
    }
}
