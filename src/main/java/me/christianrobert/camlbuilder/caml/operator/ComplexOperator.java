package me.christianrobert.camlbuilder.caml.operator;

import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.value.CamlValue;

/**
 * Binary operator: a field compared to exactly one value.
 */
class ComplexOperator extends CamlOperator {

    private final CamlValue value;

    ComplexOperator(CamlOperatorType operatorType, String fieldName, CamlValue value) {
        super(operatorType, fieldName);
        if (operatorType.isUnary()) {
            throw new IllegalStateException(
                "ComplexOperator cannot represent unary operator " + operatorType);
        }
        if (value == null) {
            throw new CamlBuildException(operatorType.getTag() + " requires a value", fieldName);
        }
        this.value = value;
    }

    @Override
    public CamlValue getValue() {
        return value;
    }

    @Override
    protected FieldRef getFieldRef() {
        return value.getValueType().isLookupIdReference()
            ? FieldRef.lookupId(getFieldName())
            : FieldRef.of(getFieldName());
    }

    @Override
    public String toString() {
        return "ComplexOperator{" + getOperatorType().getTag() + ", field='" + getFieldName()
            + "', value=" + value + "}";
    }
}
