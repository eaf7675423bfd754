package me.christianrobert.camlbuilder.caml.operator;

import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.value.CamlValue;
import me.christianrobert.camlbuilder.caml.value.CamlValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CamlOperator}.
 * Tests tag mapping, field references and construction errors.
 */
class CamlOperatorTest {

    private final CamlContext context = CamlContext.defaults();

    static Stream<Arguments> operatorTags() {
        return Stream.of(
            Arguments.of(CamlOperatorType.EQUAL, "Eq"),
            Arguments.of(CamlOperatorType.NOT_EQUAL, "Neq"),
            Arguments.of(CamlOperatorType.GREATER_THAN, "Gt"),
            Arguments.of(CamlOperatorType.GREATER_THAN_OR_EQUAL_TO, "Geq"),
            Arguments.of(CamlOperatorType.LOWER_THAN, "Lt"),
            Arguments.of(CamlOperatorType.LOWER_THAN_OR_EQUAL_TO, "Leq"),
            Arguments.of(CamlOperatorType.IS_NULL, "IsNull"),
            Arguments.of(CamlOperatorType.IS_NOT_NULL, "IsNotNull"),
            Arguments.of(CamlOperatorType.BEGINS_WITH, "BeginsWith"),
            Arguments.of(CamlOperatorType.CONTAINS, "Contains"),
            Arguments.of(CamlOperatorType.DATE_RANGES_OVERLAP, "DateRangesOverlap"),
            Arguments.of(CamlOperatorType.INCLUDES, "Includes"),
            Arguments.of(CamlOperatorType.NOT_INCLUDES, "NotIncludes")
        );
    }

    // ========== TAG MAPPING TESTS ==========

    @ParameterizedTest
    @MethodSource("operatorTags")
    @DisplayName("Every operator type maps to its fixed dialect tag")
    void tagMapping(CamlOperatorType type, String expectedTag) {
        assertEquals(expectedTag, type.getTag());
    }

    @ParameterizedTest
    @EnumSource(value = CamlOperatorType.class, names = {"IS_NULL", "IS_NOT_NULL"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Binary operators render field reference followed by value")
    void binaryOperatorRendering(CamlOperatorType type) {
        CamlOperator operator = CamlOperator.of(type, "Title", CamlValue.value(CamlValueType.TEXT, "x"));

        String tag = type.getTag();
        assertEquals("<" + tag + "><FieldRef Name=\"Title\"/><Value Type=\"Text\">x</Value></" + tag + ">",
            operator.toCaml(context));
    }

    @ParameterizedTest
    @EnumSource(value = CamlOperatorType.class, names = {"IS_NULL", "IS_NOT_NULL"})
    @DisplayName("Unary operators omit the value fragment")
    void unaryOperatorRendering(CamlOperatorType type) {
        CamlOperator operator = CamlOperator.of(type, "Title", null);

        String tag = type.getTag();
        assertEquals("<" + tag + "><FieldRef Name=\"Title\"/></" + tag + ">", operator.toCaml(context));
        assertNull(operator.getValue());
    }

    // ========== FACTORY TESTS ==========

    @Test
    void factoriesPickTheirOperatorType() {
        CamlValue v = CamlValue.value(CamlValueType.INTEGER, 1);

        assertEquals(CamlOperatorType.IS_NULL, CamlOperator.isNull("F").getOperatorType());
        assertEquals(CamlOperatorType.IS_NOT_NULL, CamlOperator.isNotNull("F").getOperatorType());
        assertEquals(CamlOperatorType.EQUAL, CamlOperator.equal("F", v).getOperatorType());
        assertEquals(CamlOperatorType.NOT_EQUAL, CamlOperator.notEqual("F", v).getOperatorType());
        assertEquals(CamlOperatorType.GREATER_THAN, CamlOperator.greaterThan("F", v).getOperatorType());
        assertEquals(CamlOperatorType.GREATER_THAN_OR_EQUAL_TO,
            CamlOperator.greaterThanOrEqualTo("F", v).getOperatorType());
        assertEquals(CamlOperatorType.LOWER_THAN, CamlOperator.lowerThan("F", v).getOperatorType());
        assertEquals(CamlOperatorType.LOWER_THAN_OR_EQUAL_TO,
            CamlOperator.lowerThanOrEqualTo("F", v).getOperatorType());
        assertEquals(CamlOperatorType.BEGINS_WITH, CamlOperator.beginsWith("F", v).getOperatorType());
        assertEquals(CamlOperatorType.CONTAINS, CamlOperator.contains("F", v).getOperatorType());
        assertEquals(CamlOperatorType.DATE_RANGES_OVERLAP, CamlOperator.dateRangesOverlap("F", v).getOperatorType());
        assertEquals(CamlOperatorType.INCLUDES, CamlOperator.includes("F", v).getOperatorType());
        assertEquals(CamlOperatorType.NOT_INCLUDES, CamlOperator.notIncludes("F", v).getOperatorType());
    }

    @Test
    @DisplayName("Raw (type, payload) overloads build the same markup as the CamlValue overloads")
    void rawAndValueOverloadsAgree() {
        CamlValue v = CamlValue.value(CamlValueType.TEXT, "Rep");

        assertEquals(CamlOperator.beginsWith("Title", v).toCaml(context),
            CamlOperator.beginsWith("Title", CamlValueType.TEXT, "Rep").toCaml(context));
        assertEquals(CamlOperator.notEqual("Title", v).toCaml(context),
            CamlOperator.notEqual("Title", CamlValueType.TEXT, "Rep").toCaml(context));
        assertEquals(CamlOperator.greaterThanOrEqualTo("Title", v).toCaml(context),
            CamlOperator.greaterThanOrEqualTo("Title", CamlValueType.TEXT, "Rep").toCaml(context));
        assertEquals(CamlOperator.lowerThanOrEqualTo("Title", v).toCaml(context),
            CamlOperator.lowerThanOrEqualTo("Title", CamlValueType.TEXT, "Rep").toCaml(context));
    }

    @Test
    void equalWithText() {
        CamlOperator operator = CamlOperator.equal("Title", CamlValueType.TEXT, "Report");
        assertEquals("<Eq><FieldRef Name=\"Title\"/><Value Type=\"Text\">Report</Value></Eq>",
            operator.toCaml(context));
    }

    // ========== FIELD REFERENCE TESTS ==========

    @Test
    @DisplayName("Lookup id values reference the field by id")
    void lookupIdFieldRef() {
        CamlOperator operator = CamlOperator.equal("Category", CamlValueType.LOOKUP_ID, 5);
        assertEquals("<Eq><FieldRef Name=\"Category\" LookupId=\"TRUE\"/><Value Type=\"Lookup\">5</Value></Eq>",
            operator.toCaml(context));
    }

    @Test
    void fieldRefKindFollowsValueType() {
        ComplexOperator byId = (ComplexOperator) CamlOperator.equal("Category", CamlValueType.LOOKUP_ID, 5);
        ComplexOperator byText = (ComplexOperator) CamlOperator.equal("Category", CamlValueType.LOOKUP_VALUE, "Sales");

        assertTrue(byId.getFieldRef().isLookupId());
        assertFalse(byText.getFieldRef().isLookupId());
        assertEquals("Category", byText.getFieldRef().getName());
        assertFalse(FieldRef.ordered("Modified", false).isLookupId());
    }

    @Test
    void userIdFieldRef() {
        CamlOperator byId = CamlOperator.includes("Owners", CamlValueType.USER_ID, 12);
        assertEquals("<Includes><FieldRef Name=\"Owners\" LookupId=\"TRUE\"/><Value Type=\"Integer\">12</Value></Includes>",
            byId.toCaml(context));
    }

    @Test
    @DisplayName("Current user compares against the plain field reference")
    void currentUser() {
        CamlOperator operator = CamlOperator.equal("AssignedTo", CamlValue.userId());
        assertEquals("<Eq><FieldRef Name=\"AssignedTo\"/><Value Type=\"Integer\"><UserID/></Value></Eq>",
            operator.toCaml(context));
    }

    @Test
    void fieldNameEscaped() {
        CamlOperator operator = CamlOperator.isNull("R&D \"Team\"");
        assertEquals("<IsNull><FieldRef Name=\"R&amp;D &quot;Team&quot;\"/></IsNull>", operator.toCaml(context));
    }

    // ========== ERROR TESTS ==========

    @Test
    void blankFieldNameRejected() {
        assertThrows(CamlBuildException.class, () -> CamlOperator.isNull(""));
        assertThrows(CamlBuildException.class, () -> CamlOperator.isNull("   "));
        assertThrows(CamlBuildException.class, () -> CamlOperator.equal(null, CamlValueType.TEXT, "x"));
    }

    @Test
    void missingValueRejected() {
        assertThrows(CamlBuildException.class, () -> CamlOperator.equal("Title", (CamlValue) null));
        assertThrows(CamlBuildException.class, () -> CamlOperator.of(CamlOperatorType.CONTAINS, "Title", null));
    }

    @Test
    void missingOperatorTypeRejected() {
        assertThrows(CamlBuildException.class,
            () -> CamlOperator.of(null, "Title", CamlValue.value(CamlValueType.TEXT, "x")));
    }

    @Test
    void unaryOperatorWithValueRejected() {
        CamlBuildException e = assertThrows(CamlBuildException.class,
            () -> CamlOperator.of(CamlOperatorType.IS_NULL, "Title", CamlValue.value(CamlValueType.TEXT, "x")));
        assertEquals("Title", e.getElement());
    }

    @Test
    @DisplayName("Mismatched operator shapes are contract violations")
    void contractViolations() {
        assertThrows(IllegalStateException.class, () -> new SimpleOperator(CamlOperatorType.EQUAL, "Title"));
        assertThrows(IllegalStateException.class,
            () -> new ComplexOperator(CamlOperatorType.IS_NULL, "Title", CamlValue.value(CamlValueType.TEXT, "x")));
    }
}
