package com.querysmith.analysis;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Term;
import com.querysmith.model.TriplePattern;
import org.jgrapht.Graph;
import org.jgrapht.GraphTests;
import org.jgrapht.Graphs;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultUndirectedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies a basic graph pattern by the shape of its join graph.
 *
 * <p>Every triple contributes one edge from its subject to its object;
 * predicates are ignored. Repeated subject-object pairs collapse into a
 * single edge. The rules are applied in order:</p>
 * <ol>
 *   <li>no triples: {@link BgpShape#EMPTY}; one triple:
 *       {@link BgpShape#SINGLE_TRIPLE}</li>
 *   <li>as many nodes as triples, each with in- and out-degree one:
 *       {@link BgpShape#CYCLE}</li>
 *   <li>in- and out-degree at most one with exactly two endpoints:
 *       {@link BgpShape#PATH}</li>
 *   <li>one node of undirected degree above one, every other node a leaf,
 *       and no node of degree two: {@link BgpShape#STAR}</li>
 *   <li>an undirected tree with one hub (degree above two) and exactly one
 *       stem path of two or more nodes hanging from it:
 *       {@link BgpShape#FLOWER}; other trees are {@link BgpShape#TREE}, or
 *       {@link BgpShape#PATH} without any hub</li>
 *   <li>otherwise {@link BgpShape#COMPLEX}</li>
 * </ol>
 */
public final class BgpShapeClassifier {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(BgpShapeClassifier.class);

    private BgpShapeClassifier() {
        throw new AssertionError("No instances");
    }

    /**
     * Classify a BGP.
     *
     * @param bgp the pattern
     * @return the shape
     */
    public static BgpShape classify(final BasicGraphPattern bgp) {
        return classify(bgp.triples());
    }

    /**
     * Classify a list of triple patterns.
     *
     * @param triples the triples
     * @return the shape
     */
    public static BgpShape classify(final List<TriplePattern> triples) {
        if (triples.isEmpty()) {
            return BgpShape.EMPTY;
        }
        if (triples.size() == 1) {
            return BgpShape.SINGLE_TRIPLE;
        }

        Graph<Term, DefaultEdge> directed = new DefaultDirectedGraph<>(DefaultEdge.class);
        Graph<Term, DefaultEdge> undirected = new DefaultUndirectedGraph<>(DefaultEdge.class);
        for (TriplePattern triple : triples) {
            Graphs.addEdgeWithVertices(directed, triple.subject(), triple.object());
            Graphs.addEdgeWithVertices(undirected, triple.subject(), triple.object());
        }

        BgpShape shape = classify(triples.size(), directed, undirected);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Classified {} triples over {} nodes as {}",
                triples.size(), directed.vertexSet().size(), shape);
        }
        return shape;
    }

    private static BgpShape classify(final int tripleCount,
                                     final Graph<Term, DefaultEdge> directed,
                                     final Graph<Term, DefaultEdge> undirected) {
        Set<Term> nodes = directed.vertexSet();

        if (nodes.size() == tripleCount && nodes.stream()
                .allMatch(n -> directed.outDegreeOf(n) == 1 && directed.inDegreeOf(n) == 1)) {
            return BgpShape.CYCLE;
        }

        if (nodes.stream().allMatch(n -> directed.outDegreeOf(n) <= 1 && directed.inDegreeOf(n) <= 1)) {
            long endpoints = nodes.stream()
                .filter(n -> directed.outDegreeOf(n) + directed.inDegreeOf(n) == 1)
                .count();
            if (endpoints == 2) {
                return BgpShape.PATH;
            }
        }

        long branching = nodes.stream().filter(n -> undirected.degreeOf(n) > 1).count();
        boolean noMiddle = nodes.stream()
            .allMatch(n -> undirected.degreeOf(n) == 1 || undirected.degreeOf(n) > 2);
        if (branching == 1 && noMiddle) {
            return BgpShape.STAR;
        }

        if (GraphTests.isTree(undirected)) {
            List<Term> hubs = nodes.stream().filter(n -> undirected.degreeOf(n) > 2)
                .collect(Collectors.toList());
            if (hubs.isEmpty()) {
                return BgpShape.PATH;
            }
            if (hubs.size() == 1 && countStems(undirected, hubs.get(0)) == 1) {
                return BgpShape.FLOWER;
            }
            return BgpShape.TREE;
        }
        return BgpShape.COMPLEX;
    }

    /**
     * Count the branches hanging off the hub that are paths of at least two
     * nodes.
     */
    private static int countStems(final Graph<Term, DefaultEdge> tree, final Term hub) {
        Set<Term> rest = new HashSet<>(tree.vertexSet());
        rest.remove(hub);
        Graph<Term, DefaultEdge> withoutHub = new AsSubgraph<>(tree, rest);
        ConnectivityInspector<Term, DefaultEdge> inspector = new ConnectivityInspector<>(withoutHub);

        int stems = 0;
        for (Term neighbor : Graphs.neighborListOf(tree, hub)) {
            Set<Term> component = inspector.connectedSetOf(neighbor);
            if (component.size() > 1 && isPath(new AsSubgraph<>(withoutHub, component))) {
                stems++;
            }
        }
        return stems;
    }

    private static boolean isPath(final Graph<Term, DefaultEdge> graph) {
        Set<Term> nodes = graph.vertexSet();
        return nodes.stream().allMatch(n -> graph.degreeOf(n) <= 2)
            && nodes.stream().filter(n -> graph.degreeOf(n) == 1).count() == 2;
    }
}
