package com.querysmith.render;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StructurePrinter.
 */
public class StructurePrinterTest {

    @Test
    @DisplayName("Test outline of a BGP with an optional")
    public void testOptionalOutline() {
        SelectQuery query = SelectQuery.builder()
            .select("?s", "?o")
            .where(
                BasicGraphPattern.of(TriplePattern.of("?s", "ex:p", "?o")),
                new OptionalPattern(BasicGraphPattern.of(TriplePattern.of("?o", "ex:q", "?x"))))
            .limit(5)
            .build();

        String expected = String.join("\n",
            "SelectQuery:",
            "  Projection: ?s, ?o",
            "  Limit: 5",
            "  Where Clause:",
            "    BGP:",
            "      Triple: ?s ex:p ?o",
            "    OPTIONAL:",
            "      BGP:",
            "        Triple: ?o ex:q ?x");
        assertEquals(expected, StructurePrinter.print(query));
        assertEquals(expected, query.toString());
    }

    @Test
    @DisplayName("Test outline of union and subquery")
    public void testUnionAndSubQuery() {
        SelectQuery inner = SelectQuery.builder()
            .where(BasicGraphPattern.of(TriplePattern.of("?a", "ex:r", "?b")))
            .build();
        SelectQuery query = SelectQuery.builder()
            .distinct(true)
            .where(
                new UnionPattern(
                    BasicGraphPattern.of(TriplePattern.of("?s", "ex:p", "?o")),
                    BasicGraphPattern.of(TriplePattern.of("?s", "ex:q", "?o"))),
                new SubQueryPattern(inner))
            .build();

        String expected = String.join("\n",
            "SelectQuery:",
            "  Projection: DISTINCT *",
            "  Where Clause:",
            "    UNION:",
            "      Left:",
            "        BGP:",
            "          Triple: ?s ex:p ?o",
            "      Right:",
            "        BGP:",
            "          Triple: ?s ex:q ?o",
            "    SUBQUERY:",
            "      Projection: *",
            "      Where Clause:",
            "        BGP:",
            "          Triple: ?a ex:r ?b");
        assertEquals(expected, StructurePrinter.print(query));
    }

    @Test
    @DisplayName("Test missing children are shown rather than rejected")
    public void testMissingChild() {
        SelectQuery query = SelectQuery.builder()
            .where(new OptionalPattern())
            .build();

        assertTrue(StructurePrinter.print(query).endsWith("    OPTIONAL:\n      <missing>"));
    }
}
