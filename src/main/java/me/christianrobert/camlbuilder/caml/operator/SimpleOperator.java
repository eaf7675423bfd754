package me.christianrobert.camlbuilder.caml.operator;

import me.christianrobert.camlbuilder.caml.value.CamlValue;

/**
 * Unary operator: IsNull / IsNotNull. Holds the field only.
 */
class SimpleOperator extends CamlOperator {

    SimpleOperator(CamlOperatorType operatorType, String fieldName) {
        super(operatorType, fieldName);
        if (!operatorType.isUnary()) {
            throw new IllegalStateException(
                "SimpleOperator cannot represent " + operatorType + ", it requires a value");
        }
    }

    @Override
    public CamlValue getValue() {
        return null;
    }

    @Override
    protected FieldRef getFieldRef() {
        return FieldRef.of(getFieldName());
    }

    @Override
    public String toString() {
        return "SimpleOperator{" + getOperatorType().getTag() + ", field='" + getFieldName() + "'}";
    }
}
