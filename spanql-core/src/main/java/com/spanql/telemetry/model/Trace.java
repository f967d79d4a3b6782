package com.spanql.telemetry.model;

import io.opentelemetry.api.trace.TraceId;
import java.util.List;
import java.util.Locale;

/**
 * A decoded trace: its id plus every span that carried it. Trace-level intrinsics are derived once at
 * construction.
 */
public final class Trace {
    private final String traceId;
    private final List<Span> spans;

    private final long startEpochNanos;
    private final long endEpochNanos;
    private final Span rootSpan;

    public Trace(String traceId, List<Span> spans) {
        if (traceId == null || !TraceId.isValid(traceId.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Invalid trace id: " + traceId);
        }
        this.traceId = traceId.toLowerCase(Locale.ROOT);
        this.spans = spans == null ? List.of() : List.copyOf(spans);

        long start = Long.MAX_VALUE;
        long end = Long.MIN_VALUE;
        Span root = null;
        for (Span span : this.spans) {
            start = Math.min(start, span.getStartEpochNanos());
            end = Math.max(end, span.getEndEpochNanos());
            if (root == null && span.isRoot()) {
                root = span;
            }
        }
        this.startEpochNanos = this.spans.isEmpty() ? 0L : start;
        this.endEpochNanos = this.spans.isEmpty() ? 0L : end;
        this.rootSpan = root;
    }

    public String getTraceId() {
        return traceId;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public long getStartEpochNanos() {
        return startEpochNanos;
    }

    public long getEndEpochNanos() {
        return endEpochNanos;
    }

    /** Latest span end minus earliest span start. */
    public long getDurationNanos() {
        return endEpochNanos - startEpochNanos;
    }

    /** First span without a parent, or null when every span has one. */
    public Span getRootSpan() {
        return rootSpan;
    }

    public String getRootSpanName() {
        return rootSpan == null ? null : rootSpan.getName();
    }

    public String getRootServiceName() {
        return rootSpan == null ? null : rootSpan.getResource().getServiceName();
    }

    @Override
    public String toString() {
        return "Trace{" + traceId + ", spans=" + spans.size() + "}";
    }
}
