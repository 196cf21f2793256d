package com.querysmith.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Term, Variable, Constant and TriplePattern.
 */
public class TermTest {

    @Test
    @DisplayName("Test parse recognizes variables and constant kinds")
    public void testParse() {
        assertEquals(Variable.of("x"), Term.parse("?x"));
        assertEquals(Variable.of("x"), Term.parse("$x"));
        assertEquals(new Constant(Constant.Kind.IRI, "<http://example.org/p>"),
            Term.parse("<http://example.org/p>"));
        assertEquals(Constant.Kind.PREFIXED_NAME, ((Constant) Term.parse("foaf:name")).kind());
        assertEquals(Constant.Kind.PREFIXED_NAME, ((Constant) Term.parse(":local")).kind());
        assertEquals(Constant.Kind.LITERAL, ((Constant) Term.parse("\"a:b\"@en")).kind());
        assertEquals(Constant.Kind.LITERAL, ((Constant) Term.parse("42")).kind());
    }

    @Test
    @DisplayName("Test blank term text is rejected")
    public void testParseBlank() {
        assertThrows(IllegalArgumentException.class, () -> Term.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> Term.parse(null));
    }

    @Test
    @DisplayName("Test variable sigils are stripped")
    public void testVariableName() {
        assertEquals("person", Variable.of("?person").name());
        assertEquals("person", Variable.of("person").name());
        assertEquals("?person", Variable.of("$person").toSparql());
        assertThrows(InvalidPatternException.class, () -> Variable.of("?"));
    }

    @Test
    @DisplayName("Test IRI factory adds brackets once")
    public void testIriFactory() {
        assertEquals("<http://example.org/a>", Constant.iri("http://example.org/a").text());
        assertEquals("<http://example.org/a>", Constant.iri("<http://example.org/a>").text());
    }

    @Test
    @DisplayName("Test triple pattern helpers")
    public void testTriplePattern() {
        TriplePattern triple = TriplePattern.of("?s", "<http://example.org/p>", "?o");

        assertEquals(List.of(Variable.of("s"), Variable.of("o")), triple.variables());
        assertEquals(1, triple.constantCount());
        assertFalse(triple.isAllVariables());
        assertTrue(TriplePattern.of("?s", "?p", "?o").isAllVariables());
        assertEquals("?s <http://example.org/p> ?o", triple.toSparql());
    }

    @Test
    @DisplayName("Test variables are listed per position")
    public void testRepeatedVariable() {
        TriplePattern triple = TriplePattern.of("?x", "?p", "?x");
        assertEquals(List.of(Variable.of("x"), Variable.of("p"), Variable.of("x")), triple.variables());
    }
}
