/**
 * Typed FILTER expressions.
 *
 * <p>{@link com.querysmith.model.filter.FilterExpression} nodes are built with
 * the static helpers of {@link com.querysmith.model.filter.FilterExpressions}
 * and rendered with {@code toSparql()}:</p>
 * <pre>{@code
 * FilterExpression expr = and(
 *     greaterThan(var("age"), number(18)),
 *     regex(str(var("name")), string("^A"), string("i")));
 * Filter filter = Filter.of(expr);
 * // FILTER(((?age > 18) && REGEX(STR(?name), "^A", "i")))
 * }</pre>
 *
 * <p>The isomorphism engine does not look inside expressions; only the
 * number of filters at each position is compared.</p>
 */
package com.querysmith.model.filter;
