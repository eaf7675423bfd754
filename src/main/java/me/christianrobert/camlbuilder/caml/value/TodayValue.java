package me.christianrobert.camlbuilder.caml.value;

/**
 * Date sentinels resolved by the server at query time: {@code <Today/>} and {@code <Now/>}.
 */
class TodayValue extends CamlValue {

    TodayValue(CamlValueType valueType, Boolean includeTimeValue) {
        super(valueType, includeTimeValue);
        if (valueType != CamlValueType.TODAY && valueType != CamlValueType.NOW) {
            throw new IllegalStateException("TodayValue cannot hold type " + valueType);
        }
    }

    @Override
    public String getCamlValue() {
        return getValueType() == CamlValueType.NOW ? "<Now/>" : "<Today/>";
    }

    @Override
    public String toString() {
        return "TodayValue{type=" + getValueType() + ", includeTimeValue=" + isIncludeTimeValue() + "}";
    }
}
