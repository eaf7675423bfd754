package me.christianrobert.camlbuilder.caml;

import me.christianrobert.camlbuilder.caml.context.CamlContext;

/**
 * Base interface for all CAML tree nodes.
 * Each node knows how to render itself as a CAML markup fragment.
 *
 * <p>Nodes are immutable once built. Rendering is a pure function of the node
 * and the supplied context, so a tree can be rendered any number of times,
 * from any thread, with byte-identical output.
 */
public interface CamlNode {

    /**
     * Render this node to CAML markup.
     *
     * @param context Render options (escaping etc.)
     * @return CAML markup fragment
     */
    default String toCaml(CamlContext context) {
        StringBuilder sb = new StringBuilder();
        appendCaml(sb, context);
        return sb.toString();
    }

    /**
     * Append this node's markup to a shared buffer.
     * Whole trees are written into one buffer; implementations must not
     * recurse per nesting level of And/Or joins.
     *
     * @param sb Target buffer
     * @param context Render options (escaping etc.)
     */
    void appendCaml(StringBuilder sb, CamlContext context);
}
