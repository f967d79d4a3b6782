package com.spanql.service.core.support;

import com.spanql.telemetry.codec.TraceJsonCodec;
import com.spanql.telemetry.model.Resource;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.Trace;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** Small builders for traces used across the engine tests. */
public final class TestTraces {
    public static final long BASE_NANOS = 1_700_000_000_000_000_000L;

    private TestTraces() {}

    public static String traceId(int n) {
        return String.format("%032x", n);
    }

    public static String spanId(int n) {
        return String.format("%016x", n);
    }

    /** Span {@code id} under {@code parent} (0 for a root), starting {@code id} microseconds after the base. */
    public static Span.Builder span(int id, int parent, String name) {
        long start = BASE_NANOS + id * 1_000L;
        return Span.builder()
                .spanId(spanId(id))
                .parentSpanId(parent == 0 ? null : spanId(parent))
                .name(name)
                .resource(Resource.ofService("svc"))
                .startEpochNanos(start)
                .endEpochNanos(start + 500L);
    }

    public static Trace trace(int n, Span.Builder... spans) {
        List<Span> built = new ArrayList<>(spans.length);
        for (Span.Builder span : spans) {
            built.add(span.build());
        }
        return new Trace(traceId(n), built);
    }

    /** A single root span starting at {@code startNanos}. */
    public static Trace traceAt(int n, long startNanos, String name) {
        return trace(n, span(1, 0, name).startEpochNanos(startNanos).endEpochNanos(startNanos + 1_000L));
    }

    /** A → B → C. */
    public static Trace chain(int n) {
        return trace(n, span(1, 0, "A"), span(2, 1, "B"), span(3, 2, "C"));
    }

    public static Trace load(String resource) {
        try (InputStream in = TestTraces.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return TraceJsonCodec.decodeAll(in).get(0);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
