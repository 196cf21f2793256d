package com.querysmith.iso;

import com.querysmith.model.BasicGraphPattern;
import com.querysmith.model.GroupPattern;
import com.querysmith.model.OptionalPattern;
import com.querysmith.model.Pattern;
import com.querysmith.model.PatternKind;
import com.querysmith.model.Patterns;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Decides whether two query patterns are structurally equivalent under a
 * bijective renaming of variables.
 *
 * <p>Equivalence ignores variable names, the order of triples and filters
 * inside a BGP, the order of UNION operands and the order of sibling patterns
 * in a group or where-clause. Constants must match exactly and the kind of
 * every node (BGP, UNION, OPTIONAL, group, subquery) must agree.</p>
 *
 * <h2>Search</h2>
 * <p>The comparison is a backtracking search in continuation-passing style:
 * every match step receives the rest of the comparison as a continuation and
 * only reports success once that continuation succeeds. A choice made early
 * (which triple of the right BGP a left triple maps to, which UNION pairing,
 * which sibling) is therefore revisited whenever a later part of the tree
 * cannot be matched under it. Bindings are held in one
 * {@link VariableMapping} whose checkpoints undo every tentative binding on
 * the failure path.</p>
 *
 * <h2>Filters</h2>
 * <p>Filters are compared by count only. Expressions are not parsed, so two
 * BGPs with the same triples and one filter each are isomorphic whatever the
 * filter text.</p>
 *
 * <h2>Budget</h2>
 * <p>The search is factorial in the worst case. A checker built with
 * {@link Builder#maxSteps(long)} stops after that many candidate pairings and
 * reports {@link Verdict#INDETERMINATE}.</p>
 *
 * <pre>{@code
 * IsomorphismChecker checker = IsomorphismChecker.builder()
 *     .maxSteps(100_000)
 *     .build();
 * IsomorphismResult result = checker.check(left, right);
 * if (result.isIsomorphic()) {
 *     Map<Variable, Variable> witness = result.mapping();
 * }
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads; each call
 * owns its search state.</p>
 */
public final class IsomorphismChecker {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(IsomorphismChecker.class);

    /** Tracer for isomorphism checks. */
    private static final Tracer TRACER = TracingUtil.getTracer(TracingUtil.SCOPE_ISOMORPHISM);

    /** Attribute key for the left triple count. */
    private static final AttributeKey<Long> ATTR_LEFT_TRIPLES =
        AttributeKey.longKey("querysmith.iso.left_triple_count");

    /** Attribute key for the right triple count. */
    private static final AttributeKey<Long> ATTR_RIGHT_TRIPLES =
        AttributeKey.longKey("querysmith.iso.right_triple_count");

    /** Attribute key for the verdict. */
    private static final AttributeKey<String> ATTR_VERDICT =
        AttributeKey.stringKey("querysmith.iso.verdict");

    /** Attribute key for the number of steps. */
    private static final AttributeKey<Long> ATTR_STEPS =
        AttributeKey.longKey("querysmith.iso.steps");

    /** Budget value meaning no limit. */
    public static final long UNLIMITED = 0L;

    /** Shared checker without a budget. */
    private static final IsomorphismChecker DEFAULT = builder().build();

    /** Maximum candidate pairings per check, or {@link #UNLIMITED}. */
    private final long maxSteps;

    /** Tracer used for the check spans. */
    private final Tracer tracer;

    private IsomorphismChecker(final long maxSteps, final Tracer tracer) {
        this.maxSteps = maxSteps;
        this.tracer = tracer;
    }

    /**
     * Get the shared checker with no search budget.
     *
     * @return the default checker
     */
    public static IsomorphismChecker defaultChecker() {
        return DEFAULT;
    }

    /**
     * Obtain a {@link Builder} to configure a checker.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the configured budget.
     *
     * @return maximum steps, or {@link #UNLIMITED}
     */
    public long getMaxSteps() {
        return maxSteps;
    }

    /**
     * Compare two patterns.
     *
     * @param left the left pattern
     * @param right the right pattern
     * @return true if isomorphic
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     * @throws SearchBudgetExceededException if the budget ran out
     */
    public boolean isomorphic(final Pattern left, final Pattern right) {
        return decide(check(left, right));
    }

    /**
     * Compare two where-clauses as unordered sequences of sibling patterns.
     *
     * @param left the left siblings
     * @param right the right siblings
     * @return true if isomorphic
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     * @throws SearchBudgetExceededException if the budget ran out
     */
    public boolean isomorphic(final List<Pattern> left, final List<Pattern> right) {
        return decide(check(left, right));
    }

    /**
     * Compare the where-clauses of two queries. Projection and solution
     * modifiers are ignored; top-level filter counts must match.
     *
     * @param left the left query
     * @param right the right query
     * @return true if isomorphic
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     * @throws SearchBudgetExceededException if the budget ran out
     */
    public boolean isomorphic(final SelectQuery left, final SelectQuery right) {
        return decide(check(left, right));
    }

    /**
     * Compare two patterns and report the verdict with its witness.
     *
     * @param left the left pattern
     * @param right the right pattern
     * @return the result
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     */
    public IsomorphismResult check(final Pattern left, final Pattern right) {
        Patterns.validate(left);
        Patterns.validate(right);
        return traced(List.of(left), List.of(right),
            search -> search.match(left, right, () -> true));
    }

    /**
     * Compare two sibling sequences and report the verdict with its witness.
     *
     * @param left the left siblings
     * @param right the right siblings
     * @return the result
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     */
    public IsomorphismResult check(final List<Pattern> left, final List<Pattern> right) {
        Patterns.validate(left);
        Patterns.validate(right);
        return traced(left, right, search -> search.matchSiblings(left, right, () -> true));
    }

    /**
     * Compare the where-clauses of two queries and report the verdict with
     * its witness.
     *
     * @param left the left query
     * @param right the right query
     * @return the result
     * @throws com.querysmith.model.InvalidPatternException if either tree is malformed
     */
    public IsomorphismResult check(final SelectQuery left, final SelectQuery right) {
        Patterns.validate(left.where());
        Patterns.validate(right.where());
        if (left.filters().size() != right.filters().size()) {
            LOGGER.debug("Top-level filter counts differ: {} vs {}",
                left.filters().size(), right.filters().size());
            return new IsomorphismResult(Verdict.NOT_ISOMORPHIC, Map.of(), 0);
        }
        return traced(left.where(), right.where(),
            search -> search.matchSiblings(left.where(), right.where(), () -> true));
    }

    private boolean decide(final IsomorphismResult result) {
        return switch (result.verdict()) {
            case ISOMORPHIC -> true;
            case NOT_ISOMORPHIC -> false;
            case INDETERMINATE -> throw new SearchBudgetExceededException(maxSteps);
        };
    }

    /**
     * Run a search inside a tracing span.
     */
    private IsomorphismResult traced(final List<Pattern> left,
                                     final List<Pattern> right,
                                     final SearchRoot root) {
        Span span = tracer.spanBuilder("IsomorphismChecker.check")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_LEFT_TRIPLES, (long) countTriples(left))
            .setAttribute(ATTR_RIGHT_TRIPLES, (long) countTriples(right))
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            IsomorphismResult result = run(root);
            span.setAttribute(ATTR_VERDICT, result.verdict().name());
            span.setAttribute(ATTR_STEPS, result.steps());
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private IsomorphismResult run(final SearchRoot root) {
        Budget budget = new Budget(maxSteps);
        Search search = new Search(budget);
        try {
            boolean found = root.start(search);
            IsomorphismResult result = new IsomorphismResult(
                found ? Verdict.ISOMORPHIC : Verdict.NOT_ISOMORPHIC,
                search.mapping.snapshot(),
                budget.steps);
            LOGGER.debug("Isomorphism check finished: {} after {} steps",
                result.verdict(), budget.steps);
            return result;
        } catch (SearchBudgetExceededException e) {
            LOGGER.warn("Isomorphism check undecided: {}", e.getMessage());
            return new IsomorphismResult(Verdict.INDETERMINATE, Map.of(), budget.steps);
        }
    }

    private static int countTriples(final List<Pattern> patterns) {
        int[] count = {0};
        Patterns.forEachBgp(patterns, true, bgp -> count[0] += bgp.size());
        return count[0];
    }

    /**
     * Entry point of a search, given the search state.
     */
    @FunctionalInterface
    private interface SearchRoot {
        boolean start(Search search);
    }

    /**
     * Step counter shared by a search and its nested subquery searches.
     */
    private static final class Budget {

        /** Maximum steps, or {@link #UNLIMITED}. */
        private final long maxSteps;

        /** Candidate pairings tried so far. */
        private long steps;

        private Budget(final long maxSteps) {
            this.maxSteps = maxSteps;
        }

        private void step() {
            steps++;
            if (maxSteps != UNLIMITED && steps > maxSteps) {
                throw new SearchBudgetExceededException(maxSteps);
            }
        }
    }

    /**
     * State of one comparison: the mapping under construction and the budget.
     */
    private static final class Search {

        /** Left-to-right variable mapping. */
        private final VariableMapping mapping = new VariableMapping();

        /** Step budget. */
        private final Budget budget;

        private Search(final Budget budget) {
            this.budget = budget;
        }

        /**
         * Match two patterns, then run the continuation under the extended
         * mapping. Leaves the mapping unchanged when returning false.
         */
        boolean match(final Pattern left, final Pattern right, final BooleanSupplier next) {
            if (left.kind() != right.kind()) {
                LOGGER.trace("Kind mismatch: {} vs {}", left.kind(), right.kind());
                return false;
            }
            return switch (left.kind()) {
                case BGP -> matchBgp((BasicGraphPattern) left, (BasicGraphPattern) right, next);
                case UNION -> matchUnion((UnionPattern) left, (UnionPattern) right, next);
                case OPTIONAL -> match(
                    ((OptionalPattern) left).pattern(),
                    ((OptionalPattern) right).pattern(),
                    next);
                case GROUP -> matchSiblings(
                    ((GroupPattern) left).patterns(),
                    ((GroupPattern) right).patterns(),
                    next);
                case SUBQUERY -> matchSubQuery((SubQueryPattern) left, (SubQueryPattern) right, next);
            };
        }

        /**
         * Match two sibling sequences by a perfect matching between their
         * elements.
         */
        boolean matchSiblings(final List<Pattern> left,
                              final List<Pattern> right,
                              final BooleanSupplier next) {
            if (left.size() != right.size() || !sameKinds(left, right)) {
                return false;
            }
            return matchSibling(left, 0, right, new boolean[right.size()], next);
        }

        private boolean matchSibling(final List<Pattern> left,
                                     final int index,
                                     final List<Pattern> right,
                                     final boolean[] used,
                                     final BooleanSupplier next) {
            if (index == left.size()) {
                return next.getAsBoolean();
            }
            Pattern source = left.get(index);
            for (int i = 0; i < right.size(); i++) {
                Pattern candidate = right.get(i);
                if (used[i] || candidate.kind() != source.kind()) {
                    continue;
                }
                budget.step();
                used[i] = true;
                try (VariableMapping.Checkpoint checkpoint = mapping.checkpoint()) {
                    if (match(source, candidate,
                            () -> matchSibling(left, index + 1, right, used, next))) {
                        checkpoint.commit();
                        return true;
                    }
                } finally {
                    used[i] = false;
                }
            }
            return false;
        }

        private boolean matchUnion(final UnionPattern left,
                                   final UnionPattern right,
                                   final BooleanSupplier next) {
            budget.step();
            try (VariableMapping.Checkpoint checkpoint = mapping.checkpoint()) {
                if (match(left.left(), right.left(),
                        () -> match(left.right(), right.right(), next))) {
                    checkpoint.commit();
                    return true;
                }
            }
            budget.step();
            try (VariableMapping.Checkpoint checkpoint = mapping.checkpoint()) {
                if (match(left.left(), right.right(),
                        () -> match(left.right(), right.left(), next))) {
                    checkpoint.commit();
                    return true;
                }
            }
            return false;
        }

        private boolean matchSubQuery(final SubQueryPattern left,
                                      final SubQueryPattern right,
                                      final BooleanSupplier next) {
            SelectQuery leftQuery = left.query();
            SelectQuery rightQuery = right.query();
            if (leftQuery.filters().size() != rightQuery.filters().size()) {
                return false;
            }
            // Subquery variables are scoped: compare with a fresh mapping
            Search inner = new Search(budget);
            if (!inner.matchSiblings(leftQuery.where(), rightQuery.where(), () -> true)) {
                return false;
            }
            return next.getAsBoolean();
        }

        private boolean matchBgp(final BasicGraphPattern left,
                                 final BasicGraphPattern right,
                                 final BooleanSupplier next) {
            if (left.size() != right.size()) {
                LOGGER.trace("Triple counts differ: {} vs {}", left.size(), right.size());
                return false;
            }
            if (left.filters().size() != right.filters().size()) {
                LOGGER.trace("Filter counts differ: {} vs {}",
                    left.filters().size(), right.filters().size());
                return false;
            }
            if (!signatures(left.triples()).equals(signatures(right.triples()))) {
                LOGGER.trace("Triple signatures differ");
                return false;
            }
            List<TriplePattern> ordered = new ArrayList<>(left.triples());
            ordered.sort(Comparator.comparingInt(TriplePattern::constantCount).reversed());
            return matchTriple(ordered, 0, right.triples(), new boolean[right.size()], next);
        }

        private boolean matchTriple(final List<TriplePattern> left,
                                    final int index,
                                    final List<TriplePattern> right,
                                    final boolean[] used,
                                    final BooleanSupplier next) {
            if (index == left.size()) {
                return next.getAsBoolean();
            }
            TriplePattern source = left.get(index);
            for (int i = 0; i < right.size(); i++) {
                if (used[i]) {
                    continue;
                }
                budget.step();
                used[i] = true;
                try (VariableMapping.Checkpoint checkpoint = mapping.checkpoint()) {
                    if (bind(source, right.get(i))
                            && matchTriple(left, index + 1, right, used, next)) {
                        checkpoint.commit();
                        return true;
                    }
                } finally {
                    used[i] = false;
                }
            }
            return false;
        }

        private boolean bind(final TriplePattern left, final TriplePattern right) {
            return bind(left.subject(), right.subject())
                && bind(left.predicate(), right.predicate())
                && bind(left.object(), right.object());
        }

        private boolean bind(final Term left, final Term right) {
            if (left instanceof Variable source) {
                return right instanceof Variable target && mapping.bind(source, target);
            }
            return left.equals(right);
        }

        private static boolean sameKinds(final List<Pattern> left, final List<Pattern> right) {
            Map<PatternKind, Integer> counts = new EnumMap<>(PatternKind.class);
            for (Pattern pattern : left) {
                counts.merge(pattern.kind(), 1, Integer::sum);
            }
            for (Pattern pattern : right) {
                counts.merge(pattern.kind(), -1, Integer::sum);
            }
            return counts.values().stream().allMatch(count -> count == 0);
        }

        /**
         * Multiset of triple shapes with constants kept and variables blanked.
         * Equal multisets are necessary for a bijection to exist.
         */
        private static Map<String, Integer> signatures(final List<TriplePattern> triples) {
            Map<String, Integer> counts = new HashMap<>();
            for (TriplePattern triple : triples) {
                StringBuilder key = new StringBuilder();
                for (Term term : triple.terms()) {
                    key.append(term.isVariable() ? "?" : term.toSparql()).append('\u0000');
                }
                counts.merge(key.toString(), 1, Integer::sum);
            }
            return counts;
        }
    }

    /**
     * Builder for {@link IsomorphismChecker} instances.
     */
    public static final class Builder {
        /** Maximum candidate pairings per check. */
        private long maxSteps = UNLIMITED;

        /** Tracer for check spans. */
        private Tracer tracer = TRACER;

        private Builder() {
            // Use IsomorphismChecker.builder()
        }

        /**
         * Limit the number of candidate pairings a single check may try.
         *
         * @param value the budget, or {@link #UNLIMITED}
         * @return this builder
         * @throws IllegalArgumentException if value is negative
         */
        public Builder maxSteps(final long value) {
            if (value < 0) {
                throw new IllegalArgumentException("maxSteps cannot be negative: " + value);
            }
            this.maxSteps = value;
            return this;
        }

        /**
         * Use a specific tracer instead of the one from {@link TracingUtil}.
         *
         * @param value the tracer
         * @return this builder
         * @throws IllegalArgumentException if value is null
         */
        public Builder tracer(final Tracer value) {
            if (value == null) {
                throw new IllegalArgumentException("tracer cannot be null");
            }
            this.tracer = value;
            return this;
        }

        /**
         * Build the checker.
         *
         * @return the checker
         */
        public IsomorphismChecker build() {
            return new IsomorphismChecker(maxSteps, tracer);
        }
    }
}
