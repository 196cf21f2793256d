package com.querysmith.render;

import com.querysmith.model.Aggregation;
import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Filter;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.Having;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.OrderCondition;
import com.querysmith.model.Pattern;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import com.querysmith.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the structure of a query as an indented outline, for logging and
 * debugging.
 *
 * <pre>
 * SelectQuery:
 *   Projection: ?s, ?o
 *   Where Clause:
 *     BGP:
 *       Triple: ?s &lt;http://example.org/p&gt; ?o
 *     OPTIONAL:
 *       BGP:
 *         Triple: ?o &lt;http://example.org/q&gt; ?x
 * </pre>
 *
 * <p>Unlike {@link QueryRenderer} this tolerates incomplete trees; a missing
 * child prints as {@code <missing>}.</p>
 */
public final class StructurePrinter {

    private StructurePrinter() {
        throw new AssertionError("No instances");
    }

    /**
     * Print a query outline.
     *
     * @param query the query
     * @return the outline, one element per line
     */
    public static String print(final SelectQuery query) {
        return String.join("\n", lines(query));
    }

    private static List<String> lines(final SelectQuery query) {
        List<String> out = new ArrayList<>();
        out.add("SelectQuery:");
        out.add("  Projection: " + projection(query));

        if (query.from() != null) {
            out.add("  Graph: " + query.from());
        }
        if (!query.filters().isEmpty()) {
            out.add("  Filters:");
            for (Filter filter : query.filters()) {
                out.add("    " + filter.expression());
            }
        }
        if (query.groupBy() != null) {
            out.add("  GroupBy: " + query.groupBy().variables().stream()
                .map(Variable::toSparql)
                .collect(Collectors.joining(", ")));
        }
        if (!query.having().isEmpty()) {
            out.add("  Having:");
            for (Having having : query.having()) {
                out.add("    " + having.expression());
            }
        }
        if (query.orderBy() != null) {
            out.add("  OrderBy:");
            out.add("    " + query.orderBy().conditions().stream()
                .map(OrderCondition::toSparql)
                .collect(Collectors.joining(", ")));
        }
        if (query.limit() != null) {
            out.add("  Limit: " + query.limit());
        }
        if (query.offset() != null) {
            out.add("  Offset: " + query.offset());
        }

        out.add("  Where Clause:");
        for (Pattern pattern : query.where()) {
            pattern(out, pattern, 4);
        }
        return out;
    }

    private static String projection(final SelectQuery query) {
        StringBuilder text = new StringBuilder();
        if (query.isDistinct()) {
            text.append("DISTINCT ");
        }
        if (query.projection().isEmpty()) {
            text.append('*');
        } else {
            text.append(query.projection().stream()
                .map(Variable::toSparql)
                .collect(Collectors.joining(", ")));
        }
        if (!query.aggregations().isEmpty()) {
            text.append(' ').append(query.aggregations().stream()
                .map(Aggregation::toSparql)
                .collect(Collectors.joining(", ")));
        }
        return text.toString();
    }

    private static void pattern(final List<String> out, final Pattern pattern, final int indent) {
        String prefix = " ".repeat(indent);
        if (pattern == null) {
            out.add(prefix + "<missing>");
            return;
        }
        switch (pattern.kind()) {
            case BGP -> {
                BasicGraphPattern bgp = (BasicGraphPattern) pattern;
                out.add(prefix + "BGP:");
                for (TriplePattern triple : bgp.triples()) {
                    out.add(prefix + "  Triple: " + triple.toSparql());
                }
                for (Filter filter : bgp.filters()) {
                    out.add(prefix + "  Filter: " + filter.expression());
                }
            }
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                out.add(prefix + "UNION:");
                out.add(prefix + "  Left:");
                pattern(out, union.left(), indent + 4);
                out.add(prefix + "  Right:");
                pattern(out, union.right(), indent + 4);
            }
            case OPTIONAL -> {
                out.add(prefix + "OPTIONAL:");
                pattern(out, ((OptionalPattern) pattern).pattern(), indent + 2);
            }
            case GROUP -> {
                out.add(prefix + "GroupGraphPattern:");
                for (Pattern child : ((GroupPattern) pattern).patterns()) {
                    pattern(out, child, indent + 2);
                }
            }
            case SUBQUERY -> {
                out.add(prefix + "SUBQUERY:");
                SelectQuery nested = ((SubQueryPattern) pattern).query();
                if (nested == null) {
                    out.add(prefix + "  <missing>");
                    return;
                }
                List<String> inner = lines(nested);
                // first line is the "SelectQuery:" header
                for (String line : inner.subList(1, inner.size())) {
                    out.add(prefix + line);
                }
            }
        }
    }
}
