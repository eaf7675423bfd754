package me.christianrobert.camlbuilder.caml.value;

/**
 * Value kinds understood by the CAML dialect.
 *
 * <p>Each constant carries the {@code Type} attribute written on the
 * {@code <Value>} element. The names are part of the dialect and must not change.
 */
public enum CamlValueType {

    TEXT("Text"),
    NOTE("Note"),
    INTEGER("Integer"),
    NUMBER("Number"),
    CURRENCY("Currency"),
    BOOLEAN("Boolean"),
    DATE("DateTime"),
    DATE_TIME("DateTime"),
    LOOKUP_ID("Lookup"),
    LOOKUP_VALUE("Lookup"),
    USER_ID("Integer"),
    CHOICE("Choice"),
    MULTI_CHOICE("MultiChoice"),
    GUID("Guid"),
    URL("URL"),
    COUNTER("Counter"),
    COMPUTED("Computed"),

    // Sentinels: resolved by the server, never carry a payload
    CURRENT_USER("Integer"),
    TODAY("DateTime"),
    NOW("DateTime");

    private final String camlTypeName;

    CamlValueType(String camlTypeName) {
        this.camlTypeName = camlTypeName;
    }

    /**
     * Gets the value of the {@code Type} attribute.
     */
    public String getCamlTypeName() {
        return camlTypeName;
    }

    public boolean isSentinel() {
        return this == CURRENT_USER || this == TODAY || this == NOW;
    }

    /**
     * Whether {@code IncludeTimeValue} is meaningful for this kind.
     */
    public boolean supportsTimeValue() {
        return this == DATE || this == DATE_TIME || this == TODAY || this == NOW;
    }

    /**
     * Whether the compared field must be referenced by lookup id
     * ({@code <FieldRef LookupId="TRUE"/>}).
     */
    public boolean isLookupIdReference() {
        return this == LOOKUP_ID || this == USER_ID;
    }
}
