package com.querysmith.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Tree-walking helpers shared by the model classes.
 */
public final class Patterns {

    /** Private constructor to prevent instantiation. */
    private Patterns() {
        // Utility class
    }

    /**
     * Visit every BGP reachable from the given patterns, descending into
     * unions, optionals, groups and, when requested, subqueries.
     *
     * @param patterns the roots
     * @param intoSubqueries whether to descend into nested SELECTs
     * @param visitor callback for each BGP
     */
    public static void forEachBgp(final List<Pattern> patterns,
                                  final boolean intoSubqueries,
                                  final Consumer<BasicGraphPattern> visitor) {
        for (Pattern pattern : patterns) {
            forEachBgp(pattern, intoSubqueries, visitor);
        }
    }

    /**
     * Visit every BGP reachable from the given pattern.
     *
     * @param pattern the root, ignored if null
     * @param intoSubqueries whether to descend into nested SELECTs
     * @param visitor callback for each BGP
     */
    public static void forEachBgp(final Pattern pattern,
                                  final boolean intoSubqueries,
                                  final Consumer<BasicGraphPattern> visitor) {
        if (pattern == null) {
            return;
        }
        switch (pattern.kind()) {
            case BGP -> visitor.accept((BasicGraphPattern) pattern);
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                forEachBgp(union.left(), intoSubqueries, visitor);
                forEachBgp(union.right(), intoSubqueries, visitor);
            }
            case OPTIONAL -> forEachBgp(((OptionalPattern) pattern).pattern(), intoSubqueries, visitor);
            case GROUP -> forEachBgp(((GroupPattern) pattern).patterns(), intoSubqueries, visitor);
            case SUBQUERY -> {
                SelectQuery query = ((SubQueryPattern) pattern).query();
                if (intoSubqueries && query != null) {
                    forEachBgp(query.where(), true, visitor);
                }
            }
        }
    }

    /**
     * Check that a pattern tree is complete: every UNION has both operands,
     * every OPTIONAL its content, every group only non-null children and
     * every subquery a query.
     *
     * @param patterns the roots
     * @throws InvalidPatternException at the first missing child
     */
    public static void validate(final List<Pattern> patterns) {
        if (patterns == null) {
            throw new InvalidPatternException("Pattern sequence cannot be null");
        }
        for (Pattern pattern : patterns) {
            validate(pattern);
        }
    }

    /**
     * Check that a pattern tree is complete.
     *
     * @param pattern the root
     * @throws InvalidPatternException at the first missing child
     */
    public static void validate(final Pattern pattern) {
        if (pattern == null) {
            throw new InvalidPatternException("Pattern cannot be null");
        }
        switch (pattern.kind()) {
            case BGP -> {
                // Triples and filters are checked on insertion
            }
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                if (union.left() == null || union.right() == null) {
                    throw new InvalidPatternException("UNION is missing an operand: " + union);
                }
                validate(union.left());
                validate(union.right());
            }
            case OPTIONAL -> {
                Pattern inner = ((OptionalPattern) pattern).pattern();
                if (inner == null) {
                    throw new InvalidPatternException("OPTIONAL has no pattern");
                }
                validate(inner);
            }
            case GROUP -> validate(((GroupPattern) pattern).patterns());
            case SUBQUERY -> {
                SelectQuery query = ((SubQueryPattern) pattern).query();
                if (query == null) {
                    throw new InvalidPatternException("Subquery has no query");
                }
                validate(query.where());
            }
        }
    }

    /**
     * Visit every subquery reachable from the given patterns without entering
     * a subquery's own where-clause.
     *
     * @param patterns the roots
     * @param visitor callback for each subquery
     */
    static void forEachSubQuery(final List<Pattern> patterns, final Consumer<SubQueryPattern> visitor) {
        for (Pattern pattern : patterns) {
            forEachSubQuery(pattern, visitor);
        }
    }

    private static void forEachSubQuery(final Pattern pattern, final Consumer<SubQueryPattern> visitor) {
        if (pattern == null) {
            return;
        }
        switch (pattern.kind()) {
            case BGP -> {
                // No nested patterns
            }
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                forEachSubQuery(union.left(), visitor);
                forEachSubQuery(union.right(), visitor);
            }
            case OPTIONAL -> forEachSubQuery(((OptionalPattern) pattern).pattern(), visitor);
            case GROUP -> forEachSubQuery(((GroupPattern) pattern).patterns(), visitor);
            case SUBQUERY -> visitor.accept((SubQueryPattern) pattern);
        }
    }

    /**
     * Rewrite the terms of every triple reachable from the given patterns,
     * stopping at subqueries.
     *
     * @param patterns the roots
     * @param replacement term replacement function
     */
    static void rewriteTerms(final List<Pattern> patterns, final UnaryOperator<Term> replacement) {
        forEachBgp(patterns, false, bgp -> bgp.rewriteTerms(replacement));
    }

    /**
     * Find the last BGP among the given siblings, appending an empty one if
     * there is none.
     *
     * @param siblings the sibling list, modified if no BGP exists
     * @return the BGP
     */
    static BasicGraphPattern lastBgp(final List<Pattern> siblings) {
        for (int i = siblings.size() - 1; i >= 0; i--) {
            if (siblings.get(i) instanceof BasicGraphPattern bgp) {
                return bgp;
            }
        }
        BasicGraphPattern bgp = new BasicGraphPattern();
        siblings.add(bgp);
        return bgp;
    }

    /**
     * Remove an element compared by identity.
     *
     * @param patterns the list
     * @param target the element to remove
     * @return true if removed
     */
    static boolean removeByIdentity(final List<Pattern> patterns, final Pattern target) {
        Iterator<Pattern> iterator = patterns.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() == target) {
                iterator.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Deep-copy a list of patterns.
     *
     * @param patterns the patterns
     * @return the copies, in order
     */
    static List<Pattern> copyAll(final List<Pattern> patterns) {
        List<Pattern> copies = new ArrayList<>(patterns.size());
        for (Pattern pattern : patterns) {
            copies.add(pattern == null ? null : pattern.copy());
        }
        return copies;
    }

    /**
     * Split every BGP into one single-triple subquery per triple.
     *
     * @param pattern the pattern to rewrite
     * @param limit the LIMIT of each generated subquery
     * @return the replacement siblings for the pattern
     */
    static List<Pattern> splitIntoSubqueries(final Pattern pattern, final long limit) {
        List<Pattern> result = new ArrayList<>();
        switch (pattern.kind()) {
            case BGP -> {
                BasicGraphPattern bgp = (BasicGraphPattern) pattern;
                if (bgp.triples().isEmpty()) {
                    result.add(bgp.copy());
                    break;
                }
                for (TriplePattern triple : bgp.triples()) {
                    SelectQuery subquery = SelectQuery.builder()
                        .where(BasicGraphPattern.of(triple))
                        .limit(limit)
                        .build();
                    result.add(new SubQueryPattern(subquery));
                }
                if (!bgp.filters().isEmpty()) {
                    result.add(new BasicGraphPattern(List.of(), bgp.filters()));
                }
            }
            case UNION -> {
                UnionPattern union = (UnionPattern) pattern;
                result.add(new UnionPattern(
                    single(splitIntoSubqueries(union.left(), limit)),
                    single(splitIntoSubqueries(union.right(), limit))));
            }
            case OPTIONAL -> result.add(new OptionalPattern(
                single(splitIntoSubqueries(((OptionalPattern) pattern).pattern(), limit))));
            case GROUP -> {
                List<Pattern> children = new ArrayList<>();
                for (Pattern child : ((GroupPattern) pattern).patterns()) {
                    children.addAll(splitIntoSubqueries(child, limit));
                }
                result.add(new GroupPattern(children));
            }
            case SUBQUERY -> result.add(new SubQueryPattern(
                ((SubQueryPattern) pattern).query().replaceTriplePatternsWithSubqueries(limit)));
        }
        return result;
    }

    private static Pattern single(final List<Pattern> patterns) {
        return patterns.size() == 1 ? patterns.get(0) : new GroupPattern(patterns);
    }
}
