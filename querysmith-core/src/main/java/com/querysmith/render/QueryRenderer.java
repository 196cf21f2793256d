package com.querysmith.render;

import com.querysmith.model.Aggregation;
import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Filter;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.Having;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.OrderCondition;
import com.querysmith.model.Pattern;
import com.querysmith.model.Patterns;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import com.querysmith.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes a {@link SelectQuery} to SPARQL text.
 *
 * <p>Example output:</p>
 * <pre>
 * SELECT DISTINCT ?s (COUNT(?o) AS ?n)
 * FROM &lt;http://example.org/g&gt;
 * WHERE {
 *   ?s &lt;http://example.org/p&gt; ?o .
 *   FILTER(?o &gt; 3)
 *   OPTIONAL {
 *     ?o &lt;http://example.org/q&gt; ?x .
 *   }
 * }
 * GROUP BY ?s
 * ORDER BY DESC(?n)
 * LIMIT 10
 * </pre>
 *
 * <p>Every nesting level is indented by two spaces. The output of
 * {@code render} parses back to an isomorphic query.</p>
 */
public final class QueryRenderer {

    /** One indentation level. */
    private static final String INDENT = "  ";

    private QueryRenderer() {
        throw new AssertionError("No instances");
    }

    /**
     * Render a query.
     *
     * @param query the query
     * @return the SPARQL text, without a trailing newline
     * @throws com.querysmith.model.InvalidPatternException if the where-clause is malformed
     */
    public static String render(final SelectQuery query) {
        Patterns.validate(query.where());
        StringBuilder out = new StringBuilder();
        out.append("SELECT ");
        if (query.isDistinct()) {
            out.append("DISTINCT ");
        }
        out.append(projection(query)).append('\n');

        if (query.from() != null) {
            out.append("FROM <").append(query.from()).append(">\n");
        }
        out.append("WHERE {\n");
        for (Pattern pattern : query.where()) {
            pattern(out, pattern, 1);
        }
        for (Filter filter : query.filters()) {
            out.append(INDENT).append(filter.toSparql()).append('\n');
        }
        out.append('}');

        if (query.groupBy() != null && !query.groupBy().variables().isEmpty()) {
            out.append("\nGROUP BY ").append(query.groupBy().variables().stream()
                .map(Variable::toSparql)
                .collect(Collectors.joining(" ")));
        }
        for (Having having : query.having()) {
            out.append("\nHAVING(").append(having.expression()).append(')');
        }
        if (query.orderBy() != null && !query.orderBy().conditions().isEmpty()) {
            out.append("\nORDER BY ").append(query.orderBy().conditions().stream()
                .map(OrderCondition::toSparql)
                .collect(Collectors.joining(" ")));
        }
        if (query.limit() != null) {
            out.append("\nLIMIT ").append(query.limit());
        }
        if (query.offset() != null) {
            out.append("\nOFFSET ").append(query.offset());
        }
        return out.toString();
    }

    private static String projection(final SelectQuery query) {
        if (query.isSelectAll()) {
            return "*";
        }
        List<String> parts = new ArrayList<>();
        for (Variable variable : query.projection()) {
            parts.add(variable.toSparql());
        }
        for (Aggregation aggregation : query.aggregations()) {
            parts.add(aggregation.toSparql());
        }
        return String.join(" ", parts);
    }

    private static void pattern(final StringBuilder out, final Pattern pattern, final int depth) {
        String pad = INDENT.repeat(depth);
        switch (pattern.kind()) {
            case BGP -> {
                BasicGraphPattern bgp = (BasicGraphPattern) pattern;
                for (TriplePattern triple : bgp.triples()) {
                    out.append(pad).append(triple.toSparql()).append(" .\n");
                }
                for (Filter filter : bgp.filters()) {
                    out.append(pad).append(filter.toSparql()).append('\n');
                }
            }
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                out.append(pad).append("{\n");
                pattern(out, union.left(), depth + 1);
                out.append(pad).append("} UNION {\n");
                pattern(out, union.right(), depth + 1);
                out.append(pad).append("}\n");
            }
            case OPTIONAL -> {
                out.append(pad).append("OPTIONAL {\n");
                pattern(out, ((OptionalPattern) pattern).pattern(), depth + 1);
                out.append(pad).append("}\n");
            }
            case GROUP -> {
                out.append(pad).append("{\n");
                for (Pattern child : ((GroupPattern) pattern).patterns()) {
                    pattern(out, child, depth + 1);
                }
                out.append(pad).append("}\n");
            }
            case SUBQUERY -> {
                out.append(pad).append("{\n");
                String nested = render(((SubQueryPattern) pattern).query());
                for (String line : nested.split("\n")) {
                    out.append(pad).append(INDENT).append(line).append('\n');
                }
                out.append(pad).append("}\n");
            }
        }
    }
}
