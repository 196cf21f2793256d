package com.querysmith.render;

import com.querysmith.model.Aggregation;
import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Filter;
import com.querysmith.model.GroupBy;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.Having;
import com.querysmith.model.InvalidPatternException;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.OrderBy;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import com.querysmith.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryRenderer.
 */
public class QueryRendererTest {

    @Test
    @DisplayName("Test full query layout with modifiers")
    public void testFullLayout() {
        BasicGraphPattern bgp = BasicGraphPattern.of(
            TriplePattern.of("?s", "<http://example.org/p>", "?o"));
        bgp.addFilter("?o > 3");
        SelectQuery query = SelectQuery.builder()
            .distinct(true)
            .select("?s")
            .aggregate(new Aggregation("COUNT", "?o", Variable.of("n"), false))
            .from("http://example.org/g")
            .where(bgp, new OptionalPattern(BasicGraphPattern.of(
                TriplePattern.of("?o", "<http://example.org/q>", "?x"))))
            .filter(new Filter("bound(?s)"))
            .groupBy(GroupBy.of("?s"))
            .having(new Having("?n > 1"))
            .orderBy(OrderBy.of(false, "?n"))
            .limit(10)
            .offset(5)
            .build();

        String expected = String.join("\n",
            "SELECT DISTINCT ?s (COUNT(?o) AS ?n)",
            "FROM <http://example.org/g>",
            "WHERE {",
            "  ?s <http://example.org/p> ?o .",
            "  FILTER(?o > 3)",
            "  OPTIONAL {",
            "    ?o <http://example.org/q> ?x .",
            "  }",
            "  FILTER(bound(?s))",
            "}",
            "GROUP BY ?s",
            "HAVING(?n > 1)",
            "ORDER BY DESC(?n)",
            "LIMIT 10",
            "OFFSET 5");
        assertEquals(expected, QueryRenderer.render(query));
        assertEquals(expected, query.toQueryString());
    }

    @Test
    @DisplayName("Test union, group and subquery nesting")
    public void testNesting() {
        SelectQuery inner = SelectQuery.builder()
            .select("?x")
            .where(BasicGraphPattern.of(TriplePattern.of("?x", "ex:r", "?y")))
            .limit(3)
            .build();
        SelectQuery query = SelectQuery.builder()
            .where(
                new UnionPattern(
                    BasicGraphPattern.of(TriplePattern.of("?s", "ex:p", "?o")),
                    BasicGraphPattern.of(TriplePattern.of("?s", "ex:q", "?o"))),
                GroupPattern.of(BasicGraphPattern.of(TriplePattern.of("?o", "ex:t", "?x"))),
                new SubQueryPattern(inner))
            .build();

        String expected = String.join("\n",
            "SELECT *",
            "WHERE {",
            "  {",
            "    ?s ex:p ?o .",
            "  } UNION {",
            "    ?s ex:q ?o .",
            "  }",
            "  {",
            "    ?o ex:t ?x .",
            "  }",
            "  {",
            "    SELECT ?x",
            "    WHERE {",
            "      ?x ex:r ?y .",
            "    }",
            "    LIMIT 3",
            "  }",
            "}");
        assertEquals(expected, QueryRenderer.render(query));
    }

    @Test
    @DisplayName("Test aggregate-only projection and COUNT(*)")
    public void testAggregateProjection() {
        SelectQuery query = SelectQuery.builder()
            .aggregate(new Aggregation("COUNT", "*", Variable.of("count"), false))
            .where(BasicGraphPattern.of(TriplePattern.of("?s", "?p", "?o")))
            .build();

        assertTrue(QueryRenderer.render(query).startsWith("SELECT (COUNT(*) AS ?count)\nWHERE {\n"));
    }

    @Test
    @DisplayName("Test malformed tree is rejected")
    public void testMalformed() {
        SelectQuery query = SelectQuery.builder()
            .where(new UnionPattern().left(BasicGraphPattern.of(TriplePattern.of("?s", "?p", "?o"))))
            .build();

        assertThrows(InvalidPatternException.class, () -> QueryRenderer.render(query));
    }
}
