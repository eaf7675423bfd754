package me.christianrobert.camlbuilder.caml.logical;

import me.christianrobert.camlbuilder.caml.context.CamlBuildException;

import java.util.Locale;

/**
 * How {@link ConnectiveFolder} nests more than two statements.
 *
 * <p>For {@code [a, b, c, d]}:
 * <pre>
 * LEFT_DEEP: (((a b) c) d)
 * BALANCED:  ((a b) (c d))
 * </pre>
 * Both keep the statements in their original left-to-right order.
 */
public enum FoldStrategy {

    LEFT_DEEP,
    BALANCED;

    /**
     * Parses a configuration value, case-insensitive, {@code -} and {@code _} interchangeable.
     *
     * @param value e.g. "left-deep", "BALANCED"
     * @return Matching strategy
     * @throws CamlBuildException if the value names no strategy
     */
    public static FoldStrategy fromConfigValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new CamlBuildException("Fold strategy cannot be null or empty");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (FoldStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new CamlBuildException("Unknown fold strategy: " + value);
    }
}
