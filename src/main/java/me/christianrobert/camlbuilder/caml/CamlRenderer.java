package me.christianrobert.camlbuilder.caml;

import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;

/**
 * Entry point for turning a built tree into CAML text.
 *
 * <p>Output is the concatenation of each node's wrapper around its children,
 * depth-first, left before right. No whitespace is inserted.
 */
public final class CamlRenderer {

    private CamlRenderer() {
    }

    /**
     * Renders with {@link CamlContext#defaults()}.
     */
    public static String render(CamlNode node) {
        return render(node, CamlContext.defaults());
    }

    public static String render(CamlNode node, CamlContext context) {
        if (node == null) {
            throw new CamlBuildException("Cannot render a null node");
        }
        return node.toCaml(context != null ? context : CamlContext.defaults());
    }
}
