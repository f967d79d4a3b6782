package com.spanql.service.core.storage;

import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.spi.TraceShard;
import com.spanql.service.core.spi.TraceSource;
import com.spanql.telemetry.model.Trace;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Trace source backed by a list in memory. Traces are bucketed by start time into shards of a fixed width;
 * shards and the traces inside them are handed out newest first.
 */
@Slf4j
public class InMemoryTraceSource implements TraceSource {
    private final List<Trace> traces = new CopyOnWriteArrayList<>();
    private final long shardWidthNanos;

    public InMemoryTraceSource(Duration shardWidth) {
        this(List.of(), shardWidth);
    }

    public InMemoryTraceSource(Collection<Trace> traces, Duration shardWidth) {
        if (shardWidth.isZero() || shardWidth.isNegative()) {
            throw new IllegalArgumentException("shardWidth must be positive: " + shardWidth);
        }
        this.shardWidthNanos = shardWidth.toNanos();
        this.traces.addAll(traces);
    }

    public void add(Trace trace) {
        traces.add(trace);
    }

    public List<Trace> traces() {
        return List.copyOf(traces);
    }

    @Override
    public List<TraceShard> shards(FetchSpansRequest request) {
        TreeMap<Long, List<Trace>> buckets = new TreeMap<>(Comparator.reverseOrder());
        for (Trace trace : traces) {
            if (request.overlaps(trace.getStartEpochNanos())) {
                long bucket = Math.floorDiv(trace.getStartEpochNanos(), shardWidthNanos);
                buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(trace);
            }
        }
        List<TraceShard> shards = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<Trace>> entry : buckets.entrySet()) {
            List<Trace> bucket = entry.getValue();
            bucket.sort(Comparator.comparingLong(Trace::getStartEpochNanos).reversed());
            long minStart = entry.getKey() * shardWidthNanos;
            long maxStart = minStart + shardWidthNanos - 1;
            List<Trace> snapshot = List.copyOf(bucket);
            shards.add(new TraceShard("mem-" + entry.getKey(), minStart, maxStart, snapshot::stream));
        }
        log.debug("In-memory source split {} traces into {} shards", traces.size(), shards.size());
        return shards;
    }
}
