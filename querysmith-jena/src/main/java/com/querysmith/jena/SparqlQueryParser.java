package com.querysmith.jena;

import com.querysmith.model.Aggregation;
import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.Constant;
import com.querysmith.model.Filter;
import com.querysmith.model.GroupBy;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.Having;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.OrderBy;
import com.querysmith.model.OrderCondition;
import com.querysmith.model.Pattern;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.SubQueryPattern;
import com.querysmith.model.Term;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.UnionPattern;
import com.querysmith.model.Variable;
import com.querysmith.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.SortCondition;
import org.apache.jena.sparql.core.TriplePath;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.core.VarExprList;
import org.apache.jena.sparql.expr.Expr;
import org.apache.jena.sparql.expr.ExprAggregator;
import org.apache.jena.sparql.serializer.SerializationContext;
import org.apache.jena.sparql.syntax.Element;
import org.apache.jena.sparql.syntax.ElementFilter;
import org.apache.jena.sparql.syntax.ElementGroup;
import org.apache.jena.sparql.syntax.ElementOptional;
import org.apache.jena.sparql.syntax.ElementPathBlock;
import org.apache.jena.sparql.syntax.ElementSubQuery;
import org.apache.jena.sparql.syntax.ElementTriplesBlock;
import org.apache.jena.sparql.syntax.ElementUnion;
import org.apache.jena.sparql.util.ExprUtils;
import org.apache.jena.sparql.util.FmtUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Parses SPARQL SELECT queries into the {@link SelectQuery} model using the
 * Apache Jena ARQ syntax tree.
 *
 * <p>The syntax tree is used rather than the algebra so that the nesting the
 * author wrote (groups, union operands, subqueries) is preserved.</p>
 *
 * <h2>Term normalization</h2>
 * <ul>
 *   <li>IRIs become {@code <full-iri>} constants; prefixes are expanded</li>
 *   <li>literals keep Jena's SPARQL surface form ({@code 42}, {@code "a"@en})</li>
 *   <li>blank nodes in the pattern become variables</li>
 * </ul>
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>consecutive triple blocks of a group form one BGP</li>
 *   <li>a FILTER attaches to the BGP open at its position; with none open it
 *       goes to the group's previous BGP, or to a new filter-only BGP</li>
 *   <li>filters of the outermost group become query-level filters</li>
 *   <li>{@code A UNION B UNION C} becomes {@code (A UNION B) UNION C}</li>
 *   <li>a union or optional operand with a single pattern is unwrapped; with
 *       several it becomes a {@link GroupPattern}</li>
 * </ul>
 *
 * <p>Property paths, BIND, VALUES, MINUS, SERVICE, GRAPH and projected
 * expressions other than aggregates are rejected with
 * {@link QueryParseException}.</p>
 */
public final class SparqlQueryParser {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(SparqlQueryParser.class);

    /** Tracer for parsing. */
    private static final Tracer TRACER = TracingUtil.getTracer(TracingUtil.SCOPE_PARSER);

    /** Attribute key for the query text length. */
    private static final AttributeKey<Long> ATTR_QUERY_LENGTH =
        AttributeKey.longKey("querysmith.parse.query_length");

    /** Attribute key for the number of parsed triple patterns. */
    private static final AttributeKey<Long> ATTR_TRIPLE_COUNT =
        AttributeKey.longKey("querysmith.parse.triple_count");

    /** Aggregate text as printed by Jena, e.g. {@code count(DISTINCT ?x)}. */
    private static final java.util.regex.Pattern AGGREGATE = java.util.regex.Pattern.compile(
        "^\\s*(\\w+)\\s*\\(\\s*(DISTINCT\\s+)?(.*)\\)\\s*$",
        java.util.regex.Pattern.CASE_INSENSITIVE | java.util.regex.Pattern.DOTALL);

    /** Prefix for variables standing in for blank nodes. */
    private static final String BLANK_NODE_PREFIX = "_";

    private SparqlQueryParser() {
        throw new AssertionError("No instances");
    }

    /**
     * Parse a SPARQL SELECT query.
     *
     * @param sparql the query text
     * @return the query model
     * @throws QueryParseException if the text is not a supported SELECT query
     * @throws com.querysmith.model.QueryValidationException if the solution
     *         modifiers are inconsistent
     */
    public static SelectQuery parse(final String sparql) {
        if (sparql == null) {
            throw new QueryParseException("Query text cannot be null");
        }
        Span span = TRACER.spanBuilder("SparqlQueryParser.parse")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_QUERY_LENGTH, (long) sparql.length())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            Query jenaQuery;
            try {
                jenaQuery = QueryFactory.create(sparql);
            } catch (QueryException e) {
                throw new QueryParseException("Invalid SPARQL: " + e.getMessage(), e);
            }
            if (!jenaQuery.isSelectType()) {
                throw new QueryParseException(
                    "Only SELECT queries are supported, got " + jenaQuery.queryType());
            }

            SelectQuery query = convertQuery(jenaQuery);
            span.setAttribute(ATTR_TRIPLE_COUNT, (long) query.triplePatternCount());
            span.setStatus(StatusCode.OK);

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Parsed query with {} triple patterns in {} BGPs",
                    query.triplePatternCount(), query.bgpCount());
            }
            return query;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static SelectQuery convertQuery(final Query jenaQuery) {
        SelectQuery.Builder builder = SelectQuery.builder()
            .distinct(jenaQuery.isDistinct());

        convertProjection(jenaQuery, builder);

        if (!jenaQuery.getNamedGraphURIs().isEmpty()) {
            throw new QueryParseException("FROM NAMED is not supported");
        }
        List<String> graphs = jenaQuery.getGraphURIs();
        if (graphs.size() > 1) {
            throw new QueryParseException("At most one FROM graph is supported, got " + graphs.size());
        }
        if (graphs.size() == 1) {
            builder.from(graphs.get(0));
        }

        GroupContent where = convertGroupContent(jenaQuery.getQueryPattern(), true);
        builder.where(where.patterns);
        for (Filter filter : where.filters) {
            builder.filter(filter);
        }

        if (jenaQuery.hasGroupBy()) {
            builder.groupBy(convertGroupBy(jenaQuery.getGroupBy()));
        }
        if (jenaQuery.hasHaving()) {
            for (Expr expr : jenaQuery.getHavingExprs()) {
                builder.having(new Having(ExprUtils.fmtSPARQL(expr)));
            }
        }
        if (jenaQuery.hasOrderBy()) {
            builder.orderBy(convertOrderBy(jenaQuery.getOrderBy()));
        }
        if (jenaQuery.hasLimit()) {
            builder.limit(jenaQuery.getLimit());
        }
        if (jenaQuery.hasOffset()) {
            builder.offset(jenaQuery.getOffset());
        }
        return builder.build();
    }

    private static void convertProjection(final Query jenaQuery, final SelectQuery.Builder builder) {
        if (jenaQuery.isQueryResultStar()) {
            return;
        }
        VarExprList project = jenaQuery.getProject();
        List<Variable> variables = new ArrayList<>();
        for (Var var : project.getVars()) {
            Expr expr = project.getExpr(var);
            if (expr == null) {
                variables.add(new Variable(var.getVarName()));
            } else if (expr instanceof ExprAggregator aggregator) {
                builder.aggregate(convertAggregation(aggregator, var));
            } else {
                throw new QueryParseException(
                    "Unsupported projection expression for " + var + ": " + ExprUtils.fmtSPARQL(expr));
            }
        }
        builder.select(variables);
    }

    private static Aggregation convertAggregation(final ExprAggregator expr, final Var alias) {
        String text = expr.getAggregator().asSparqlExpr(new SerializationContext());
        Matcher matcher = AGGREGATE.matcher(text);
        if (!matcher.matches()) {
            throw new QueryParseException("Unsupported aggregate: " + text);
        }
        String function = matcher.group(1);
        if (!Aggregation.FUNCTIONS.contains(function.toUpperCase(Locale.ROOT))) {
            throw new QueryParseException("Unsupported aggregate function: " + function);
        }
        return new Aggregation(function, matcher.group(3), new Variable(alias.getVarName()),
            matcher.group(2) != null);
    }

    private static GroupBy convertGroupBy(final VarExprList groupBy) {
        List<Variable> variables = new ArrayList<>();
        for (Var var : groupBy.getVars()) {
            if (groupBy.getExpr(var) != null) {
                throw new QueryParseException("GROUP BY expressions are not supported: " + var);
            }
            variables.add(new Variable(var.getVarName()));
        }
        return new GroupBy(variables);
    }

    private static OrderBy convertOrderBy(final List<SortCondition> conditions) {
        List<OrderCondition> converted = new ArrayList<>();
        for (SortCondition condition : conditions) {
            Expr expr = condition.getExpression();
            if (!expr.isVariable()) {
                throw new QueryParseException(
                    "ORDER BY supports variables only, got " + ExprUtils.fmtSPARQL(expr));
            }
            boolean ascending = condition.getDirection() != Query.ORDER_DESCENDING;
            converted.add(new OrderCondition(new Variable(expr.getVarName()), ascending));
        }
        return new OrderBy(converted);
    }

    /**
     * Patterns of one group, and the filters of the outermost group.
     */
    private static final class GroupContent {
        /** Child patterns in document order. */
        private final List<Pattern> patterns = new ArrayList<>();

        /** Query-level filters; only filled for the outermost group. */
        private final List<Filter> filters = new ArrayList<>();
    }

    /**
     * Convert the elements of a group. Filters of the outermost group are
     * collected as query-level filters, others are attached to a BGP.
     */
    private static GroupContent convertGroupContent(final Element element, final boolean outermost) {
        GroupContent content = new GroupContent();
        List<Element> elements = element instanceof ElementGroup group
            ? group.getElements()
            : List.of(element);

        BasicGraphPattern current = null;
        for (Element child : elements) {
            if (child instanceof ElementPathBlock block) {
                current = openBgp(content, current);
                for (TriplePath path : block.getPattern()) {
                    if (!path.isTriple()) {
                        throw new QueryParseException("Property paths are not supported: " + path);
                    }
                    current.add(convertTriple(path.asTriple()));
                }
            } else if (child instanceof ElementTriplesBlock block) {
                current = openBgp(content, current);
                for (Triple triple : block.getPattern()) {
                    current.add(convertTriple(triple));
                }
            } else if (child instanceof ElementFilter filterElement) {
                Filter filter = new Filter(ExprUtils.fmtSPARQL(filterElement.getExpr()));
                if (outermost) {
                    content.filters.add(filter);
                    continue;
                }
                if (current == null) {
                    current = lastBgp(content.patterns);
                }
                current = openBgp(content, current);
                current.add(filter);
            } else {
                content.patterns.add(convertPattern(child));
                current = null;
            }
        }
        return content;
    }

    private static BasicGraphPattern openBgp(final GroupContent content, final BasicGraphPattern current) {
        if (current != null) {
            return current;
        }
        BasicGraphPattern bgp = new BasicGraphPattern();
        content.patterns.add(bgp);
        return bgp;
    }

    private static BasicGraphPattern lastBgp(final List<Pattern> patterns) {
        for (int i = patterns.size() - 1; i >= 0; i--) {
            if (patterns.get(i) instanceof BasicGraphPattern bgp) {
                return bgp;
            }
        }
        return null;
    }

    private static Pattern convertPattern(final Element element) {
        if (element instanceof ElementUnion union) {
            List<Element> operands = union.getElements();
            if (operands.size() < 2) {
                // A single-operand union only arises from the parser internals
                return convertOperand(operands.get(0));
            }
            Pattern result = new UnionPattern(convertOperand(operands.get(0)), convertOperand(operands.get(1)));
            for (int i = 2; i < operands.size(); i++) {
                result = new UnionPattern(result, convertOperand(operands.get(i)));
            }
            return result;
        }
        if (element instanceof ElementOptional optional) {
            return new OptionalPattern(convertOperand(optional.getOptionalElement()));
        }
        if (element instanceof ElementSubQuery subQuery) {
            return new SubQueryPattern(convertQuery(subQuery.getQuery()));
        }
        if (element instanceof ElementGroup group) {
            return new GroupPattern(nestedPatterns(group));
        }
        throw new QueryParseException(
            "Unsupported graph pattern: " + element.getClass().getSimpleName());
    }

    /**
     * Convert the operand of a UNION or OPTIONAL, unwrapping a group that
     * holds a single pattern.
     */
    private static Pattern convertOperand(final Element element) {
        if (element instanceof ElementGroup group) {
            List<Pattern> patterns = nestedPatterns(group);
            return patterns.size() == 1 ? patterns.get(0) : new GroupPattern(patterns);
        }
        return convertPattern(element);
    }

    private static List<Pattern> nestedPatterns(final ElementGroup group) {
        return convertGroupContent(group, false).patterns;
    }

    private static TriplePattern convertTriple(final Triple triple) {
        return new TriplePattern(
            convertNode(triple.getSubject()),
            convertNode(triple.getPredicate()),
            convertNode(triple.getObject()));
    }

    private static Term convertNode(final Node node) {
        if (node.isVariable()) {
            String name = Var.alloc(node).getVarName();
            if (Var.isBlankNodeVar(node)) {
                return new Variable(BLANK_NODE_PREFIX + name.replace("?", ""));
            }
            return new Variable(name);
        }
        if (node.isURI()) {
            return Constant.iri(node.getURI());
        }
        if (node.isLiteral()) {
            return Constant.literal(FmtUtils.stringForNode(node));
        }
        throw new QueryParseException("Unsupported term: " + node);
    }
}
