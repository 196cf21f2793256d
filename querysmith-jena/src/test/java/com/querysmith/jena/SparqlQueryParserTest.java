package com.querysmith.jena;

import com.querysmith.iso.IsomorphismChecker;
import com.querysmith.model.Aggregation;
import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Constant;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.OrderCondition;
import com.querysmith.model.PatternKind;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import com.querysmith.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SparqlQueryParser.
 */
public class SparqlQueryParserTest {

    private static final String PREFIX = "PREFIX ex: <http://example.org/>\n";

    @Test
    @DisplayName("Test prefixes are expanded and projection is kept")
    public void testBasicSelect() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT DISTINCT ?s ?o WHERE { ?s ex:p ?o . ?o ex:q ?x }");

        assertTrue(query.isDistinct());
        assertEquals(List.of(Variable.of("s"), Variable.of("o")), query.projection());
        assertEquals(1, query.where().size());
        BasicGraphPattern bgp = (BasicGraphPattern) query.where().get(0);
        assertEquals(2, bgp.size());
        assertEquals(new TriplePattern(Variable.of("s"), Constant.iri("http://example.org/p"), Variable.of("o")),
            bgp.triples().get(0));
    }

    @Test
    @DisplayName("Test SELECT * gives an empty projection")
    public void testSelectAll() {
        SelectQuery query = SparqlQueryParser.parse("SELECT * WHERE { ?s ?p ?o }");

        assertTrue(query.isSelectAll());
        assertFalse(query.isDistinct());
    }

    @Test
    @DisplayName("Test literals keep their surface form")
    public void testLiterals() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:age 42 . ?s ex:name \"Alice\" . ?s ex:label \"chat\"@fr }");

        List<TriplePattern> triples = query.triplePatterns();
        assertEquals(Constant.literal("42"), triples.get(0).object());
        assertEquals(Constant.literal("\"Alice\""), triples.get(1).object());
        assertEquals(Constant.literal("\"chat\"@fr"), triples.get(2).object());
    }

    @Test
    @DisplayName("Test blank nodes become variables")
    public void testBlankNodes() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:knows [ ex:name ?n ] }");

        assertEquals(2, query.triplePatternCount());
        for (TriplePattern triple : query.triplePatterns()) {
            assertTrue(triple.subject().isVariable());
        }
    }

    @Test
    @DisplayName("Test n-ary UNION nests to the left")
    public void testUnion() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { { ?s ex:a ?o } UNION { ?s ex:b ?o } UNION { ?s ex:c ?o } }");

        assertEquals(1, query.where().size());
        UnionPattern outer = (UnionPattern) query.where().get(0);
        assertEquals(PatternKind.UNION, outer.left().kind());
        assertEquals(PatternKind.BGP, outer.right().kind());
        UnionPattern inner = (UnionPattern) outer.left();
        assertEquals(PatternKind.BGP, inner.left().kind());
        assertEquals(PatternKind.BGP, inner.right().kind());
        assertEquals(3, query.bgpCount());
    }

    @Test
    @DisplayName("Test union operand with several patterns becomes a group")
    public void testUnionGroupOperand() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { { ?s ex:a ?o OPTIONAL { ?o ex:b ?x } } UNION { ?s ex:c ?o } }");

        UnionPattern union = (UnionPattern) query.where().get(0);
        GroupPattern left = (GroupPattern) union.left();
        assertEquals(2, left.patterns().size());
        assertEquals(PatternKind.OPTIONAL, left.patterns().get(1).kind());
    }

    @Test
    @DisplayName("Test OPTIONAL follows its BGP")
    public void testOptional() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o OPTIONAL { ?o ex:q ?x } }");

        assertEquals(2, query.where().size());
        assertEquals(PatternKind.BGP, query.where().get(0).kind());
        OptionalPattern optional = (OptionalPattern) query.where().get(1);
        assertEquals(PatternKind.BGP, optional.pattern().kind());
    }

    @Test
    @DisplayName("Test nested group is preserved")
    public void testNestedGroup() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { { ?s ex:p ?o } ?o ex:q ?x }");

        assertEquals(2, query.where().size());
        GroupPattern group = (GroupPattern) query.where().get(0);
        assertEquals(1, group.patterns().size());
        assertEquals(PatternKind.BGP, query.where().get(1).kind());
    }

    @Test
    @DisplayName("Test subquery keeps its own modifiers")
    public void testSubQuery() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { { SELECT ?s WHERE { ?s ex:p ?o } LIMIT 5 } ?s ex:q ?z }");

        assertEquals(2, query.where().size());
        SubQueryPattern sub = (SubQueryPattern) query.where().get(0);
        assertEquals(Long.valueOf(5), sub.query().limit());
        assertEquals(List.of(Variable.of("s")), sub.query().projection());
        assertEquals(2, query.triplePatternCount());
    }

    @Test
    @DisplayName("Test outermost filters become query filters")
    public void testTopLevelFilter() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o FILTER(?o > 3) }");

        assertEquals(1, query.filters().size());
        assertTrue(query.filters().get(0).expression().contains("?o"));
        assertTrue(((BasicGraphPattern) query.where().get(0)).filters().isEmpty());
    }

    @Test
    @DisplayName("Test nested filters attach to a BGP")
    public void testNestedFilter() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o OPTIONAL { ?o ex:q ?x FILTER(?x > 1) } }");

        assertTrue(query.filters().isEmpty());
        OptionalPattern optional = (OptionalPattern) query.where().get(1);
        BasicGraphPattern bgp = (BasicGraphPattern) optional.pattern();
        assertEquals(1, bgp.size());
        assertEquals(1, bgp.filters().size());
    }

    @Test
    @DisplayName("Test filter without triples gets a filter-only BGP")
    public void testFilterOnlyGroup() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o OPTIONAL { FILTER(?o > 1) } }");

        OptionalPattern optional = (OptionalPattern) query.where().get(1);
        BasicGraphPattern bgp = (BasicGraphPattern) optional.pattern();
        assertTrue(bgp.triples().isEmpty());
        assertEquals(1, bgp.filters().size());
    }

    @Test
    @DisplayName("Test aggregates, GROUP BY, HAVING and ORDER BY")
    public void testAggregation() {
        SelectQuery query = SparqlQueryParser.parse(PREFIX
            + "SELECT ?s (COUNT(DISTINCT ?o) AS ?n) (COUNT(*) AS ?all) WHERE { ?s ex:p ?o }\n"
            + "GROUP BY ?s HAVING (COUNT(?o) > 1) ORDER BY DESC(?n) ?s LIMIT 10 OFFSET 20");

        assertEquals(List.of(Variable.of("s")), query.projection());
        assertEquals(2, query.aggregations().size());
        Aggregation distinctCount = query.aggregations().get(0);
        assertEquals("COUNT", distinctCount.function());
        assertEquals("?o", distinctCount.argument());
        assertTrue(distinctCount.distinct());
        assertEquals(Variable.of("n"), distinctCount.alias());
        Aggregation countAll = query.aggregations().get(1);
        assertEquals("*", countAll.argument());
        assertFalse(countAll.distinct());

        assertEquals(List.of(Variable.of("s")), query.groupBy().variables());
        assertEquals(1, query.having().size());
        assertEquals(List.of(
                new OrderCondition(Variable.of("n"), false),
                new OrderCondition(Variable.of("s"), true)),
            query.orderBy().conditions());
        assertEquals(Long.valueOf(10), query.limit());
        assertEquals(Long.valueOf(20), query.offset());
    }

    @Test
    @DisplayName("Test FROM graph is kept")
    public void testFrom() {
        SelectQuery query = SparqlQueryParser.parse(
            "SELECT * FROM <http://example.org/g> WHERE { ?s ?p ?o }");

        assertEquals("http://example.org/g", query.from());
    }

    @Test
    @DisplayName("Test unsupported constructs are rejected")
    public void testUnsupported() {
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p/ex:q ?o }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o BIND(1 AS ?x) }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?s ex:p ?o MINUS { ?s ex:q ?o } }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { VALUES ?s { ex:a } ?s ex:p ?o }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(PREFIX
            + "SELECT (STR(?o) AS ?x) WHERE { ?s ex:p ?o }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(
            "SELECT * FROM NAMED <http://example.org/g> WHERE { ?s ?p ?o }"));
    }

    @Test
    @DisplayName("Test non-SELECT and invalid queries are rejected")
    public void testInvalid() {
        assertThrows(QueryParseException.class,
            () -> SparqlQueryParser.parse("ASK { ?s ?p ?o }"));
        assertThrows(QueryParseException.class,
            () -> SparqlQueryParser.parse("SELECT * WHERE { ?s ?p "));
        assertThrows(QueryParseException.class,
            () -> SparqlQueryParser.parse("SELECT ?name (COUNT(?x) AS ?c) WHERE { ?x ?p ?name }"));
        assertThrows(QueryParseException.class, () -> SparqlQueryParser.parse(null));
    }

    @Test
    @DisplayName("Test rendered query parses back to an isomorphic query")
    public void testRoundTrip() {
        SelectQuery original = SparqlQueryParser.parse(PREFIX
            + "SELECT ?s (COUNT(?o) AS ?n) WHERE {\n"
            + "  ?s ex:p ?o . ?o ex:q ?x\n"
            + "  OPTIONAL { ?x ex:r ?y FILTER(?y != ?s) }\n"
            + "  { ?s ex:a ?z } UNION { ?s ex:b ?z }\n"
            + "  FILTER(?o > 3)\n"
            + "} GROUP BY ?s ORDER BY DESC(?n) LIMIT 5");

        SelectQuery reparsed = SparqlQueryParser.parse(original.toQueryString());

        assertTrue(IsomorphismChecker.defaultChecker().isomorphic(original, reparsed));
        assertEquals(original.triplePatternCount(), reparsed.triplePatternCount());
        assertEquals(original.bgpCount(), reparsed.bgpCount());
        assertEquals(original.filters().size(), reparsed.filters().size());
        assertEquals(original.limit(), reparsed.limit());
    }

    @Test
    @DisplayName("Test differently written queries are compared structurally")
    public void testIsomorphicQueries() {
        SelectQuery left = SparqlQueryParser.parse(PREFIX
            + "SELECT * WHERE { ?a ex:knows ?b . ?b ex:name ?n }");
        SelectQuery right = SparqlQueryParser.parse(
            "SELECT * WHERE { ?y <http://example.org/name> ?z . ?x <http://example.org/knows> ?y }");
        SelectQuery other = SparqlQueryParser.parse(
            "SELECT * WHERE { ?y <http://example.org/name> ?z . ?y <http://example.org/knows> ?x }");

        IsomorphismChecker checker = IsomorphismChecker.defaultChecker();
        assertTrue(checker.isomorphic(left, right));
        assertFalse(checker.isomorphic(left, other));
    }
}
