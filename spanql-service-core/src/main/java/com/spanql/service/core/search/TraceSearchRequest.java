package com.spanql.service.core.search;

import java.time.Duration;
import java.util.Map;

/**
 * A search over traces starting in {@code [startNanos, endNanos]}. Zero bounds are open; zero limits take the
 * configured defaults; a null timeout takes the configured query timeout. {@code hints} act as defaults for
 * the query's {@code with(...)}.
 */
public record TraceSearchRequest(
        String query,
        long startNanos,
        long endNanos,
        int limit,
        int spansPerSpanSet,
        Map<String, Object> hints,
        Duration timeout) {

    public TraceSearchRequest {
        hints = hints == null ? Map.of() : Map.copyOf(hints);
    }

    public static TraceSearchRequest of(String query) {
        return new TraceSearchRequest(query, 0, 0, 0, 0, Map.of(), null);
    }

    public TraceSearchRequest withLimit(int newLimit) {
        return new TraceSearchRequest(query, startNanos, endNanos, newLimit, spansPerSpanSet, hints, timeout);
    }

    public TraceSearchRequest withHints(Map<String, Object> newHints) {
        return new TraceSearchRequest(query, startNanos, endNanos, limit, spansPerSpanSet, newHints, timeout);
    }

    public TraceSearchRequest withTimeout(Duration newTimeout) {
        return new TraceSearchRequest(query, startNanos, endNanos, limit, spansPerSpanSet, hints, newTimeout);
    }
}
