package me.christianrobert.camlbuilder.caml.util;

import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.logical.ConnectiveFolder;
import me.christianrobert.camlbuilder.caml.logical.LogicalJoinType;
import me.christianrobert.camlbuilder.caml.logical.LogicalJoin;
import me.christianrobert.camlbuilder.caml.operator.CamlOperator;
import me.christianrobert.camlbuilder.caml.query.CamlQuery;
import me.christianrobert.camlbuilder.caml.query.CamlView;
import me.christianrobert.camlbuilder.caml.value.CamlValue;
import me.christianrobert.camlbuilder.caml.value.CamlValueType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CamlTreeFormatterTest {

    @Test
    void formatsNestedJoins() {
        CamlStatement root = LogicalJoin.andAll(
            CamlOperator.equal("Title", CamlValueType.TEXT, "Report"),
            CamlOperator.isNull("AssignedTo"),
            CamlOperator.greaterThan("Modified", CamlValue.today()));

        String expected = "And\n"
            + "  And\n"
            + "    Eq [Title]\n"
            + "      Text \"Report\"\n"
            + "    IsNull [AssignedTo]\n"
            + "  Gt [Modified]\n"
            + "    DateTime <Today/>\n";
        assertEquals(expected, CamlTreeFormatter.format(root));
    }

    @Test
    void marksIncludeTimeValue() {
        String formatted = CamlTreeFormatter.format(CamlOperator.lowerThan("Due", CamlValue.now(true)));
        assertEquals("Lt [Due]\n  DateTime (time) <Now/>\n", formatted);
    }

    @Test
    void truncatesLongText() {
        StringBuilder longText = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            longText.append('x');
        }
        String formatted = CamlTreeFormatter.format(CamlValue.value(CamlValueType.NOTE, longText.toString()));

        assertEquals("Note \"" + longText.substring(0, 50) + "...\"\n", formatted);
    }

    @Test
    void escapesLineBreaks() {
        String formatted = CamlTreeFormatter.format(CamlValue.value(CamlValueType.NOTE, "line1\nline2"));
        assertEquals("Note \"line1\\nline2\"\n", formatted);
    }

    @Test
    void formatsQuery() {
        CamlQuery query = CamlQuery.builder()
            .where(CamlOperator.equal("Title", CamlValueType.TEXT, "Report"))
            .orderBy("Modified", false)
            .orderBy("Title", true)
            .groupBy(true, "Category")
            .build();

        String expected = "Query\n"
            + "  Where\n"
            + "    Eq [Title]\n"
            + "      Text \"Report\"\n"
            + "  OrderBy [Modified DESC] [Title ASC]\n"
            + "  GroupBy [Category]\n";
        assertEquals(expected, CamlTreeFormatter.format(query));
    }

    @Test
    void formatsDeepLeftDeepFold() {
        int count = 20_000;
        List<CamlStatement> statements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            statements.add(CamlOperator.equal("F" + i, CamlValueType.INTEGER, i));
        }

        String formatted = CamlTreeFormatter.format(ConnectiveFolder.fold(LogicalJoinType.AND, statements));
        String[] lines = formatted.split("\n");

        // one line per join, per operator and per value
        assertEquals((count - 1) + 2 * count, lines.length);
        assertEquals("And", lines[0]);
        assertTrue(lines[lines.length - 1].endsWith("Integer \"" + (count - 1) + "\""));
    }

    @Test
    void indentStopsGrowingPastMaximumDepth() {
        int count = CamlTreeFormatter.MAX_INDENT_DEPTH + 6;
        List<CamlStatement> statements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            statements.add(CamlOperator.isNull("F" + i));
        }

        String formatted = CamlTreeFormatter.format(ConnectiveFolder.fold(LogicalJoinType.OR, statements));

        StringBuilder maxIndent = new StringBuilder();
        for (int i = 0; i < CamlTreeFormatter.MAX_INDENT_DEPTH; i++) {
            maxIndent.append("  ");
        }
        // F0 sits below count - 1 nested joins
        assertTrue(formatted.contains("\n" + maxIndent + "[" + (count - 1) + "] IsNull [F0]\n"));
        assertTrue(formatted.startsWith("Or\n  Or\n"));
    }

    @Test
    void nullAndUnknownNodes() {
        assertEquals("(null tree)", CamlTreeFormatter.format(null));
        assertEquals("(unknown: CamlView)\n", CamlTreeFormatter.format(CamlView.builder().build()));
    }
}
