package com.querysmith.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TracingUtil class.
 */
public class TracingUtilTest {

    @Test
    @DisplayName("Test scope constants are defined correctly")
    public void testScopeConstants() {
        assertEquals("com.querysmith.iso.IsomorphismChecker",
            TracingUtil.SCOPE_ISOMORPHISM);
        assertEquals("com.querysmith.jena.SparqlQueryParser",
            TracingUtil.SCOPE_PARSER);
    }

    @Test
    @DisplayName("Test getOpenTelemetry returns same instance on multiple calls")
    public void testGetOpenTelemetrySingleton() {
        OpenTelemetry first = TracingUtil.getOpenTelemetry();
        OpenTelemetry second = TracingUtil.getOpenTelemetry();
        assertNotNull(first);
        assertSame(first, second);
    }

    @Test
    @DisplayName("Test getTracer returns a tracer for each scope")
    public void testGetTracer() {
        Tracer checkerTracer = TracingUtil.getTracer(TracingUtil.SCOPE_ISOMORPHISM);
        Tracer parserTracer = TracingUtil.getTracer(TracingUtil.SCOPE_PARSER);
        assertNotNull(checkerTracer);
        assertNotNull(parserTracer);
    }

    @Test
    @DisplayName("Test tracing follows OTEL_TRACING_ENABLED")
    public void testIsTracingEnabled() {
        boolean expected = Boolean.parseBoolean(System.getenv("OTEL_TRACING_ENABLED"));
        assertEquals(expected, TracingUtil.isTracingEnabled());
    }

    @Test
    @DisplayName("Test disabled tracing uses the no-op implementation")
    public void testNoopWhenDisabled() {
        if (!TracingUtil.isTracingEnabled()) {
            assertSame(OpenTelemetry.noop(), TracingUtil.getOpenTelemetry());
        }
    }

    @Test
    @DisplayName("Test shutdown does not throw")
    public void testShutdown() {
        assertDoesNotThrow(TracingUtil::shutdown);
    }

    @Test
    @DisplayName("Test TracingUtil constructor is private")
    public void testPrivateConstructor() {
        var constructors = TracingUtil.class.getDeclaredConstructors();
        assertEquals(1, constructors.length);
        assertFalse(constructors[0].canAccess(null));
    }
}
