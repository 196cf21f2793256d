/**
 * OpenTelemetry tracing integration for querysmith.
 *
 * <p>Spans are produced at two levels:</p>
 * <ol>
 *   <li>SPARQL parsing, with the query length and resulting triple count</li>
 *   <li>Isomorphism checks, with triple counts, verdict and search steps</li>
 * </ol>
 *
 * <p>Traces are exported via OTLP protocol to a collector such as Jaeger
 * when {@code OTEL_TRACING_ENABLED=true}.</p>
 *
 * @see com.querysmith.tracing.TracingUtil
 */
package com.querysmith.tracing;
