package com.querysmith.iso;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IsomorphismResult.
 */
public class IsomorphismResultTest {

    @Test
    @DisplayName("Test witness keeps the binding order")
    public void testWitnessOrder() {
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        for (String name : List.of("zeta", "alpha", "mu", "beta", "omega", "gamma")) {
            bindings.put(Variable.of(name), Variable.of(name + "2"));
        }

        IsomorphismResult result = new IsomorphismResult(Verdict.ISOMORPHIC, bindings, 6);

        assertEquals(List.copyOf(bindings.keySet()), List.copyOf(result.mapping().keySet()));
        assertThrows(UnsupportedOperationException.class,
            () -> result.mapping().put(Variable.of("x"), Variable.of("y")));

        bindings.clear();
        assertEquals(6, result.mapping().size());
    }

    @Test
    @DisplayName("Test witness from the checker follows the triple positions")
    public void testCheckerWitnessOrder() {
        BasicGraphPattern left = BasicGraphPattern.of(
            TriplePattern.of("?s", "?p", "?o"));
        BasicGraphPattern right = BasicGraphPattern.of(
            TriplePattern.of("?x", "?y", "?z"));

        IsomorphismResult result = IsomorphismChecker.defaultChecker().check(left, right);

        assertTrue(result.isIsomorphic());
        assertEquals(List.of(Variable.of("s"), Variable.of("p"), Variable.of("o")),
            List.copyOf(result.mapping().keySet()));
    }

    @Test
    @DisplayName("Test non-isomorphic results carry no witness")
    public void testNoWitness() {
        Map<Variable, Variable> bindings = Map.of(Variable.of("a"), Variable.of("b"));

        IsomorphismResult result = new IsomorphismResult(Verdict.NOT_ISOMORPHIC, bindings, 3);

        assertTrue(result.mapping().isEmpty());
        assertTrue(result.witness().isEmpty());
        assertFalse(result.isIsomorphic());
    }
}
