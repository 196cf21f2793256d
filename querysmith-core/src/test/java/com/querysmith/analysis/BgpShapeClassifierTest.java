package com.querysmith.analysis;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.TriplePattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BgpShapeClassifier.
 */
public class BgpShapeClassifierTest {

    private static BasicGraphPattern bgp(final String... terms) {
        BasicGraphPattern bgp = new BasicGraphPattern();
        for (int i = 0; i < terms.length; i += 3) {
            bgp.add(terms[i], terms[i + 1], terms[i + 2]);
        }
        return bgp;
    }

    @Test
    @DisplayName("Test empty and single-triple BGPs")
    public void testTrivial() {
        assertEquals(BgpShape.EMPTY, BgpShapeClassifier.classify(new BasicGraphPattern()));
        assertEquals(BgpShape.SINGLE_TRIPLE, BgpShapeClassifier.classify(bgp("?s", "?p", "?o")));
        assertEquals("Single-triple", BgpShape.SINGLE_TRIPLE.label());
    }

    @Test
    @DisplayName("Test linear chain is a path")
    public void testPath() {
        assertEquals(BgpShape.PATH, BgpShapeClassifier.classify(bgp(
            "?s1", "?p1", "?o1",
            "?o1", "?p2", "?o2",
            "?o2", "?p3", "?o3")));
    }

    @Test
    @DisplayName("Test outgoing and incoming stars")
    public void testStar() {
        assertEquals(BgpShape.STAR, BgpShapeClassifier.classify(bgp(
            "?s", "?p1", "?o1",
            "?s", "?p2", "?o2",
            "?s", "?p3", "?o3",
            "?s", "?p4", "?o4")));
        assertEquals(BgpShape.STAR, BgpShapeClassifier.classify(bgp(
            "?s1", "?p1", "?o",
            "?s2", "?p2", "?o",
            "?s3", "?p3", "?o",
            "?s4", "?p4", "?o")));
    }

    @Test
    @DisplayName("Test directed cycle")
    public void testCycle() {
        assertEquals(BgpShape.CYCLE, BgpShapeClassifier.classify(bgp(
            "?s1", "?p1", "?o1",
            "?o1", "?p2", "?o2",
            "?o2", "?p3", "?s1")));
    }

    @Test
    @DisplayName("Test branching tree")
    public void testTree() {
        assertEquals(BgpShape.TREE, BgpShapeClassifier.classify(bgp(
            "?root", "?p1", "?child1",
            "?root", "?p2", "?child2",
            "?child1", "?p3", "?grandchild1",
            "?child1", "?p4", "?grandchild2",
            "?child2", "?p5", "?grandchild3",
            "?child2", "?p6", "?grandchild4")));
    }

    @Test
    @DisplayName("Test stem path with blooms is a flower")
    public void testFlower() {
        assertEquals(BgpShape.FLOWER, BgpShapeClassifier.classify(bgp(
            "?s1", "?p1", "?s2",
            "?s2", "?p2", "?s3",
            "?s3", "?p3", "?center",
            "?center", "?p4", "?o1",
            "?center", "?p5", "?o2",
            "?center", "?p6", "?o3")));
    }

    @Test
    @DisplayName("Test two joined cycles are complex")
    public void testComplex() {
        assertEquals(BgpShape.COMPLEX, BgpShapeClassifier.classify(bgp(
            "?s1", "?p1", "?o1",
            "?o1", "?p2", "?o2",
            "?o2", "?p3", "?s1",
            "?o2", "?p4", "?o3",
            "?o3", "?p5", "?o4",
            "?o4", "?p6", "?o2")));
    }

    @Test
    @DisplayName("Test disconnected triples are complex")
    public void testDisconnected() {
        assertEquals(BgpShape.COMPLEX, BgpShapeClassifier.classify(List.of(
            TriplePattern.of("?a", "?p", "?b"),
            TriplePattern.of("?c", "?q", "?d"))));
    }

    @Test
    @DisplayName("Test constants take part in the join graph")
    public void testConstantNodes() {
        assertEquals(BgpShape.STAR, BgpShapeClassifier.classify(bgp(
            "?s", "ex:p", "ex:a",
            "?s", "ex:q", "ex:b",
            "?s", "ex:r", "\"x\"")));
    }
}
