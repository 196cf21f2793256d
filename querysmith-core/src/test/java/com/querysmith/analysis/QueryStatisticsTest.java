package com.querysmith.analysis;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryStatistics.
 */
public class QueryStatisticsTest {

    @Test
    @DisplayName("Test triple extraction in document order")
    public void testTriplePatterns() {
        TriplePattern first = TriplePattern.of("?s", "ex:p", "?o");
        TriplePattern second = TriplePattern.of("?s", "ex:q", "?o");
        TriplePattern third = TriplePattern.of("?o", "ex:r", "?z");
        SelectQuery query = SelectQuery.builder()
            .where(
                new UnionPattern(BasicGraphPattern.of(first), BasicGraphPattern.of(second)),
                new OptionalPattern(BasicGraphPattern.of(third)))
            .build();

        assertEquals(List.of(first, second, third), QueryStatistics.triplePatterns(query));
        assertEquals(3, QueryStatistics.triplePatternCount(query));
        assertEquals(3, QueryStatistics.bgpCount(query));
    }

    @Test
    @DisplayName("Test filter-only BGPs count as BGPs but add no triples")
    public void testFilterOnlyBgp() {
        BasicGraphPattern filterOnly = new BasicGraphPattern().addFilter("?o > 1");
        SelectQuery query = SelectQuery.builder()
            .where(BasicGraphPattern.of(TriplePattern.of("?s", "?p", "?o")), filterOnly)
            .build();

        assertEquals(2, QueryStatistics.bgpCount(query));
        assertEquals(1, QueryStatistics.triplePatternCount(query));
    }

    @Test
    @DisplayName("Test all-variable triple check")
    public void testAllVariables() {
        assertTrue(QueryStatistics.allVariables(TriplePattern.of("?s", "?p", "?o")));
        assertFalse(QueryStatistics.allVariables(TriplePattern.of("?s", "ex:p", "?o")));
        assertFalse(QueryStatistics.allVariables(TriplePattern.of("?s", "?p", "\"x\"")));
    }
}
