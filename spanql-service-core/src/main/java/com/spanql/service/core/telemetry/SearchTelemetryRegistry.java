package com.spanql.service.core.telemetry;

import com.spanql.service.core.search.TruncationReason;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class SearchTelemetryRegistry implements SearchTelemetry {
    private final LongAdder corruptTraces = new LongAdder();
    private final LongAdder danglingParents = new LongAdder();
    private final LongAdder tracesInspected = new LongAdder();
    private final LongAdder tracesPruned = new LongAdder();

    private final Map<TruncationReason, LongAdder> truncations = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> rejectedQueries = new ConcurrentHashMap<>();

    @Override
    public void recordCorruptTrace(String traceId, String reason) {
        corruptTraces.increment();
    }

    @Override
    public void recordDanglingParents(String traceId, int count) {
        if (count > 0) {
            danglingParents.add(count);
        }
    }

    @Override
    public void recordTracesInspected(long count) {
        if (count > 0) {
            tracesInspected.add(count);
        }
    }

    @Override
    public void recordTracesPruned(long count) {
        if (count > 0) {
            tracesPruned.add(count);
        }
    }

    @Override
    public void recordTruncation(TruncationReason reason) {
        if (reason == null || reason == TruncationReason.NONE) {
            return;
        }
        truncations.computeIfAbsent(reason, key -> new LongAdder()).increment();
    }

    @Override
    public void recordQueryRejected(String errorKind) {
        rejectedQueries.computeIfAbsent(errorKind, key -> new LongAdder()).increment();
    }

    public Snapshot snapshot() {
        Map<TruncationReason, Long> truncationCounts = new EnumMap<>(TruncationReason.class);
        truncations.forEach((reason, count) -> truncationCounts.put(reason, count.sum()));
        Map<String, Long> rejected = new TreeMap<>();
        rejectedQueries.forEach((kind, count) -> rejected.put(kind, count.sum()));
        return new Snapshot(
                corruptTraces.sum(),
                danglingParents.sum(),
                tracesInspected.sum(),
                tracesPruned.sum(),
                truncationCounts,
                rejected);
    }

    public record Snapshot(
            long corruptTraces,
            long danglingParents,
            long tracesInspected,
            long tracesPruned,
            Map<TruncationReason, Long> truncations,
            Map<String, Long> rejectedQueries) {}
}
