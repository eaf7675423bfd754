package me.christianrobert.camlbuilder.caml.query;

import me.christianrobert.camlbuilder.caml.CamlRenderer;
import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.operator.CamlOperator;
import me.christianrobert.camlbuilder.caml.value.CamlValueType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CamlQuery} and {@link OrderByField}.
 */
class CamlQueryTest {

    private static final String EQ_TITLE =
        "<Eq><FieldRef Name=\"Title\"/><Value Type=\"Text\">Report</Value></Eq>";

    private final CamlStatement titleIsReport = CamlOperator.equal("Title", CamlValueType.TEXT, "Report");

    @Test
    void whereOnly() {
        CamlQuery query = CamlQuery.where(titleIsReport);

        assertEquals("<Query><Where>" + EQ_TITLE + "</Where></Query>", CamlRenderer.render(query));
        assertEquals("<Where>" + EQ_TITLE + "</Where>", query.toWhereCaml(CamlContext.defaults()));
    }

    @Test
    void fullQuery() {
        CamlQuery query = CamlQuery.builder()
            .where(titleIsReport)
            .orderBy("Modified", false)
            .orderBy(OrderByField.ascending("Title"))
            .groupBy(true, "Category")
            .build();

        assertEquals("<Query>"
                + "<Where>" + EQ_TITLE + "</Where>"
                + "<OrderBy><FieldRef Name=\"Modified\" Ascending=\"FALSE\"/><FieldRef Name=\"Title\"/></OrderBy>"
                + "<GroupBy Collapse=\"TRUE\"><FieldRef Name=\"Category\"/></GroupBy>"
                + "</Query>",
            CamlRenderer.render(query));
    }

    @Test
    void groupByWithoutCollapse() {
        CamlQuery query = CamlQuery.builder().groupBy(false, "Category", "Status").build();

        assertEquals("<Query><GroupBy><FieldRef Name=\"Category\"/><FieldRef Name=\"Status\"/></GroupBy></Query>",
            CamlRenderer.render(query));
        assertFalse(query.isCollapse());
    }

    @Test
    void emptyQuery() {
        CamlQuery query = CamlQuery.builder().build();

        assertEquals("<Query></Query>", CamlRenderer.render(query));
        assertEquals("", query.toWhereCaml(CamlContext.defaults()));
        assertNull(query.getWhere());
    }

    @Test
    void orderByFieldDescription() {
        assertEquals("Modified DESC", OrderByField.descending("Modified").toString());
        assertEquals("Title ASC", new OrderByField("Title", true).toString());
    }

    @Test
    void builtQueryIsUnaffectedByLaterBuilderCalls() {
        CamlQuery.Builder builder = CamlQuery.builder().orderBy("Title", true);
        CamlQuery query = builder.build();
        builder.orderBy("Modified", false);

        assertEquals(1, query.getOrderBy().size());
        assertThrows(UnsupportedOperationException.class,
            () -> query.getOrderBy().add(OrderByField.ascending("X")));
    }

    @Test
    void rejectedGroupByLeavesBuilderUnchanged() {
        CamlQuery.Builder builder = CamlQuery.builder();

        assertThrows(CamlBuildException.class, () -> builder.groupBy(true, "Category", " "));

        CamlQuery query = builder.build();
        assertTrue(query.getGroupBy().isEmpty());
        assertFalse(query.isCollapse());
        assertEquals("<Query></Query>", CamlRenderer.render(query));
    }

    @Test
    void invalidInputRejected() {
        assertThrows(CamlBuildException.class, () -> CamlQuery.where(null));
        assertThrows(CamlBuildException.class, () -> CamlQuery.builder().orderBy(" ", true));
        assertThrows(CamlBuildException.class, () -> CamlQuery.builder().orderBy(null));
        assertThrows(CamlBuildException.class, () -> CamlQuery.builder().groupBy(true));
        assertThrows(CamlBuildException.class, () -> CamlQuery.builder().groupBy(false, "Category", ""));
    }
}
