package me.christianrobert.camlbuilder.caml.value;

import me.christianrobert.camlbuilder.caml.CamlNode;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;

/**
 * Defines a CAML value. This is an abstract class; use the static factories to
 * obtain an instance.
 *
 * <p>Renders as:
 * <pre>
 * &lt;Value Type="DateTime" IncludeTimeValue="TRUE"&gt;2024-05-01T08:30:00Z&lt;/Value&gt;
 * &lt;Value Type="Integer"&gt;&lt;UserID/&gt;&lt;/Value&gt;
 * </pre>
 */
public abstract class CamlValue implements CamlNode {

    private final CamlValueType valueType;
    private final Boolean includeTimeValue;

    protected CamlValue(CamlValueType valueType, Boolean includeTimeValue) {
        if (valueType == null) {
            throw new CamlBuildException("CamlValue valueType cannot be null");
        }
        this.valueType = valueType;
        this.includeTimeValue = includeTimeValue;
    }

    /**
     * Instantiates a value of the given type.
     *
     * @param valueType Field type
     * @param value Payload; ignored for sentinel types, required otherwise
     * @return Value instance
     * @throws CamlBuildException if a literal type has no payload or the payload cannot be formatted
     */
    public static CamlValue value(CamlValueType valueType, Object value) {
        return value(valueType, value, null);
    }

    /**
     * Instantiates a value of the given type.
     *
     * @param valueType Field type
     * @param value Payload; ignored for sentinel types, required otherwise
     * @param includeTimeValue Whether the time of day takes part in the comparison (date kinds only)
     * @return Value instance
     */
    public static CamlValue value(CamlValueType valueType, Object value, Boolean includeTimeValue) {
        if (valueType == null) {
            throw new CamlBuildException("CamlValue valueType cannot be null");
        }
        switch (valueType) {
            case CURRENT_USER:
                return new UserIdValue();
            case TODAY:
            case NOW:
                return new TodayValue(valueType, includeTimeValue);
            default:
                if (value == null) {
                    throw new CamlBuildException(
                        "A value of type " + valueType + " requires a payload", valueType.name());
                }
                return new LiteralValue(valueType, includeTimeValue, value);
        }
    }

    /**
     * The current user ({@code <UserID/>}).
     */
    public static CamlValue userId() {
        return new UserIdValue();
    }

    /**
     * Today's date ({@code <Today/>}), date part only.
     */
    public static CamlValue today() {
        return new TodayValue(CamlValueType.TODAY, null);
    }

    public static CamlValue today(boolean includeTimeValue) {
        return new TodayValue(CamlValueType.TODAY, includeTimeValue);
    }

    /**
     * The current instant ({@code <Now/>}).
     */
    public static CamlValue now() {
        return new TodayValue(CamlValueType.NOW, null);
    }

    public static CamlValue now(boolean includeTimeValue) {
        return new TodayValue(CamlValueType.NOW, includeTimeValue);
    }

    public CamlValueType getValueType() {
        return valueType;
    }

    public Boolean getIncludeTimeValue() {
        return includeTimeValue;
    }

    public boolean isIncludeTimeValue() {
        return valueType.supportsTimeValue() && Boolean.TRUE.equals(includeTimeValue);
    }

    /**
     * Gets the unescaped inner text of the {@code <Value>} element.
     * For sentinels this is the sentinel markup itself.
     */
    public abstract String getCamlValue();

    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        sb.append("<Value Type=\"").append(valueType.getCamlTypeName()).append('"');
        if (isIncludeTimeValue()) {
            sb.append(" IncludeTimeValue=\"TRUE\"");
        }
        sb.append('>');
        sb.append(valueType.isSentinel() ? getCamlValue() : context.escapeText(getCamlValue()));
        sb.append("</Value>");
    }
}
