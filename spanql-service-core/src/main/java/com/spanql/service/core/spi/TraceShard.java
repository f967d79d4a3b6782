package com.spanql.service.core.spi;

import com.spanql.telemetry.model.Trace;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * A slice of the searched time range. {@link #open()} is called on a worker thread and the stream is pulled
 * one trace at a time, so sources can fetch lazily.
 *
 * @param id shard name, used in logs
 * @param minStartNanos earliest trace start the shard can hold
 * @param maxStartNanos latest trace start the shard can hold
 */
public record TraceShard(String id, long minStartNanos, long maxStartNanos, Supplier<Stream<Trace>> traces) {

    public Stream<Trace> open() {
        return traces.get();
    }
}
