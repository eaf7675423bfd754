package me.christianrobert.camlbuilder.caml.value;

/**
 * A value carrying a caller supplied payload.
 * The payload is formatted once, at construction, so bad payloads fail early.
 */
class LiteralValue extends CamlValue {

    private final Object rawValue;
    private final String formattedValue;

    LiteralValue(CamlValueType valueType, Boolean includeTimeValue, Object rawValue) {
        super(valueType, includeTimeValue);
        if (valueType.isSentinel()) {
            throw new IllegalStateException("LiteralValue cannot hold sentinel type " + valueType);
        }
        this.rawValue = rawValue;
        this.formattedValue = CamlValueFormatter.format(valueType, rawValue, Boolean.TRUE.equals(includeTimeValue));
    }

    public Object getRawValue() {
        return rawValue;
    }

    @Override
    public String getCamlValue() {
        return formattedValue;
    }

    @Override
    public String toString() {
        return "LiteralValue{type=" + getValueType() + ", value='" + formattedValue + "'}";
    }
}
