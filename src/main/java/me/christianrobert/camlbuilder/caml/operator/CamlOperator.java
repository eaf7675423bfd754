package me.christianrobert.camlbuilder.caml.operator;

import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.value.CamlValue;
import me.christianrobert.camlbuilder.caml.value.CamlValueType;

/**
 * Defines a CAML comparison operator. This is an abstract class; use the static
 * factories to obtain an instance.
 *
 * <p>Renders as:
 * <pre>
 * &lt;Eq&gt;&lt;FieldRef Name="Title"/&gt;&lt;Value Type="Text"&gt;Report&lt;/Value&gt;&lt;/Eq&gt;
 * &lt;IsNull&gt;&lt;FieldRef Name="Title"/&gt;&lt;/IsNull&gt;
 * </pre>
 *
 * <p>Every factory funnels into one of two shapes:
 * <ul>
 *   <li>{@link SimpleOperator}: IsNull and IsNotNull, field only</li>
 *   <li>{@link ComplexOperator}: every other operator, field and value</li>
 * </ul>
 */
public abstract class CamlOperator extends CamlStatement {

    private final CamlOperatorType operatorType;
    private final String fieldName;

    protected CamlOperator(CamlOperatorType operatorType, String fieldName) {
        if (operatorType == null) {
            throw new CamlBuildException("CamlOperator operatorType cannot be null", fieldName);
        }
        if (fieldName == null || fieldName.trim().isEmpty()) {
            throw new CamlBuildException("CamlOperator fieldName cannot be null or empty", operatorType.getTag());
        }
        this.operatorType = operatorType;
        this.fieldName = fieldName;
    }

    public CamlOperatorType getOperatorType() {
        return operatorType;
    }

    /**
     * Gets the name of the field this operator acts on.
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * Gets the compared value, or null for unary operators.
     */
    public abstract CamlValue getValue();

    /**
     * Builds the field reference written before the value.
     */
    protected abstract FieldRef getFieldRef();

    @Override
    public void appendCaml(StringBuilder sb, CamlContext context) {
        String tag = operatorType.getTag();
        sb.append('<').append(tag).append('>');
        getFieldRef().appendCaml(sb, context);
        CamlValue value = getValue();
        if (value != null) {
            value.appendCaml(sb, context);
        }
        sb.append("</").append(tag).append('>');
    }

    // ========== Factories ==========

    /**
     * Instantiates a new <i>IsNull</i> operator on the given field.
     *
     * @param fieldName Name of the field to operate on
     * @return IsNull operator instance
     */
    public static CamlOperator isNull(String fieldName) {
        return new SimpleOperator(CamlOperatorType.IS_NULL, fieldName);
    }

    /**
     * Instantiates a new <i>IsNotNull</i> operator on the given field.
     *
     * @param fieldName Name of the field to operate on
     * @return IsNotNull operator instance
     */
    public static CamlOperator isNotNull(String fieldName) {
        return new SimpleOperator(CamlOperatorType.IS_NOT_NULL, fieldName);
    }

    /**
     * Instantiates a new <i>Eq</i> operator on the given field.
     *
     * @param fieldName Name of the field to operate on
     * @param valueType Field type
     * @param value Value the field is compared to
     * @return Equal operator instance
     */
    public static CamlOperator equal(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.EQUAL, fieldName, valueType, value);
    }

    /**
     * Instantiates a new <i>Eq</i> operator on the given field.
     *
     * @param fieldName Name of the field to operate on
     * @param value Value the field is compared to
     * @return Equal operator instance
     */
    public static CamlOperator equal(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.EQUAL, fieldName, value);
    }

    /** <i>Neq</i> operator. */
    public static CamlOperator notEqual(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.NOT_EQUAL, fieldName, valueType, value);
    }

    /** <i>Neq</i> operator. */
    public static CamlOperator notEqual(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.NOT_EQUAL, fieldName, value);
    }

    /** <i>Gt</i> operator. */
    public static CamlOperator greaterThan(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.GREATER_THAN, fieldName, valueType, value);
    }

    /** <i>Gt</i> operator. */
    public static CamlOperator greaterThan(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.GREATER_THAN, fieldName, value);
    }

    /** <i>Geq</i> operator. */
    public static CamlOperator greaterThanOrEqualTo(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.GREATER_THAN_OR_EQUAL_TO, fieldName, valueType, value);
    }

    /** <i>Geq</i> operator. */
    public static CamlOperator greaterThanOrEqualTo(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.GREATER_THAN_OR_EQUAL_TO, fieldName, value);
    }

    /** <i>Lt</i> operator. */
    public static CamlOperator lowerThan(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.LOWER_THAN, fieldName, valueType, value);
    }

    /** <i>Lt</i> operator. */
    public static CamlOperator lowerThan(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.LOWER_THAN, fieldName, value);
    }

    /** <i>Leq</i> operator. */
    public static CamlOperator lowerThanOrEqualTo(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.LOWER_THAN_OR_EQUAL_TO, fieldName, valueType, value);
    }

    /** <i>Leq</i> operator. */
    public static CamlOperator lowerThanOrEqualTo(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.LOWER_THAN_OR_EQUAL_TO, fieldName, value);
    }

    /** <i>BeginsWith</i> operator, for Text and Note fields. */
    public static CamlOperator beginsWith(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.BEGINS_WITH, fieldName, valueType, value);
    }

    /** <i>BeginsWith</i> operator, for Text and Note fields. */
    public static CamlOperator beginsWith(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.BEGINS_WITH, fieldName, value);
    }

    /** <i>Contains</i> operator, for Text and Note fields. */
    public static CamlOperator contains(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.CONTAINS, fieldName, valueType, value);
    }

    /** <i>Contains</i> operator, for Text and Note fields. */
    public static CamlOperator contains(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.CONTAINS, fieldName, value);
    }

    /** <i>DateRangesOverlap</i> operator, for recurring events. */
    public static CamlOperator dateRangesOverlap(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.DATE_RANGES_OVERLAP, fieldName, valueType, value);
    }

    /** <i>DateRangesOverlap</i> operator, for recurring events. */
    public static CamlOperator dateRangesOverlap(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.DATE_RANGES_OVERLAP, fieldName, value);
    }

    /** <i>Includes</i> operator, for multi-value lookup and user fields. */
    public static CamlOperator includes(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.INCLUDES, fieldName, valueType, value);
    }

    /** <i>Includes</i> operator, for multi-value lookup and user fields. */
    public static CamlOperator includes(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.INCLUDES, fieldName, value);
    }

    /** <i>NotIncludes</i> operator, for multi-value lookup and user fields. */
    public static CamlOperator notIncludes(String fieldName, CamlValueType valueType, Object value) {
        return complex(CamlOperatorType.NOT_INCLUDES, fieldName, valueType, value);
    }

    /** <i>NotIncludes</i> operator, for multi-value lookup and user fields. */
    public static CamlOperator notIncludes(String fieldName, CamlValue value) {
        return new ComplexOperator(CamlOperatorType.NOT_INCLUDES, fieldName, value);
    }

    /**
     * Generic factory for callers that pick the operator at runtime.
     *
     * @param operatorType Any operator type
     * @param fieldName Name of the field to operate on
     * @param value Compared value; must be null for unary operators
     * @return Operator instance
     */
    public static CamlOperator of(CamlOperatorType operatorType, String fieldName, CamlValue value) {
        if (operatorType == null) {
            throw new CamlBuildException("CamlOperator operatorType cannot be null", fieldName);
        }
        if (operatorType.isUnary()) {
            if (value != null) {
                throw new CamlBuildException(
                    operatorType.getTag() + " does not take a value", fieldName);
            }
            return new SimpleOperator(operatorType, fieldName);
        }
        return new ComplexOperator(operatorType, fieldName, value);
    }

    private static CamlOperator complex(CamlOperatorType operatorType, String fieldName,
                                        CamlValueType valueType, Object value) {
        return new ComplexOperator(operatorType, fieldName, CamlValue.value(valueType, value));
    }
}
