package com.spanql.service.core.search;

import com.spanql.service.core.ast.Hints;
import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.config.SearchProperties;
import com.spanql.service.core.engine.CompiledQuery;
import com.spanql.service.core.engine.TraceQLEngine;
import com.spanql.service.core.eval.Spanset;
import com.spanql.service.core.spi.CandidateIndex;
import com.spanql.service.core.spi.TraceShard;
import com.spanql.service.core.spi.TraceSource;
import com.spanql.service.core.spi.TraceSourceException;
import com.spanql.service.core.telemetry.SearchTelemetry;
import com.spanql.telemetry.model.Trace;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a query over the shards of a {@link TraceSource}. Shards are scanned concurrently on the
 * {@link SearchExecutor}; workers share only the result combiner and a stop flag, and check both the flag
 * and the deadline between traces.
 */
@Service
@Slf4j
public class TraceSearchService {
    private final TraceQLEngine engine;
    private final TraceSource traceSource;
    private final Optional<CandidateIndex> candidateIndex;
    private final SearchExecutor executor;
    private final SearchProperties properties;
    private final SearchTelemetry telemetry;
    private final Clock clock;

    public TraceSearchService(
            TraceQLEngine engine,
            TraceSource traceSource,
            Optional<CandidateIndex> candidateIndex,
            SearchExecutor executor,
            SearchProperties properties,
            SearchTelemetry telemetry,
            Clock clock) {
        this.engine = engine;
        this.traceSource = traceSource;
        this.candidateIndex = candidateIndex;
        this.executor = executor;
        this.properties = properties;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    public TraceSearchResponse search(TraceSearchRequest request) {
        int limit = resolve("limit", request.limit(), properties.getDefaultLimit(), properties.getMaxLimit());
        int spansPerSpanSet = resolve(
                "spansPerSpanSet",
                request.spansPerSpanSet(),
                properties.getDefaultSpansPerSpanSet(),
                properties.getMaxSpansPerSpanSet());
        CompiledQuery query = engine.compile(request.query(), request.startNanos(), request.endNanos(), request.hints());
        boolean mostRecent = query.root().hints().getBoolean(Hints.MOST_RECENT, false);
        FetchSpansRequest fetch = query.fetchRequest();

        List<TraceShard> shards = traceSource.shards(fetch);
        Set<String> candidates =
                candidateIndex.flatMap(index -> index.candidates(fetch)).orElse(null);
        int budget = mostRecent ? Math.min(shards.size(), properties.getMostRecentShards()) : shards.size();
        List<TraceShard> scheduled = shards.subList(0, budget);

        Duration timeout = request.timeout() != null ? request.timeout() : properties.getQueryTimeout();
        Scan scan = new Scan(
                query,
                new MetadataCombiner(limit, spansPerSpanSet, mostRecent, query.outputAttributes()),
                mostRecent,
                candidates,
                clock.instant().plus(timeout));

        List<Future<Void>> futures = new ArrayList<>(scheduled.size());
        for (TraceShard shard : scheduled) {
            futures.add(executor.submit(shard.id(), () -> {
                scan.shard(shard);
                return null;
            }));
        }
        await(futures, scan);

        TruncationReason reason = TruncationReason.NONE;
        if (scan.deadlineHit.get()) {
            reason = TruncationReason.DEADLINE;
        } else if (budget < shards.size() && !scan.combinerCompleteFor(shards.get(budget).maxStartNanos())) {
            reason = TruncationReason.SCAN_BUDGET;
        }
        telemetry.recordTracesInspected(scan.inspected.get());
        telemetry.recordTracesPruned(scan.pruned.get());
        if (reason != TruncationReason.NONE) {
            telemetry.recordTruncation(reason);
        }

        SearchMetrics metrics = new SearchMetrics(
                scan.inspected.get(),
                scan.pruned.get(),
                shards.size(),
                scan.completed.get(),
                shards.size() - scan.completed.get());
        List<TraceSearchMetadata> traces;
        synchronized (scan.combiner) {
            traces = scan.combiner.metadata();
        }
        log.debug(
                "Search [{}] returned {} traces, inspected={} pruned={} shards={}/{} truncation={}",
                query,
                traces.size(),
                metrics.inspectedTraces(),
                metrics.prunedTraces(),
                metrics.completedShards(),
                metrics.totalShards(),
                reason);
        return new TraceSearchResponse(traces, metrics, reason != TruncationReason.NONE, reason);
    }

    private static void await(List<Future<Void>> futures, Scan scan) {
        try {
            for (Future<Void> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            cancel(futures, scan);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TraceSourceException("Shard scan failed", cause);
        } catch (InterruptedException ie) {
            cancel(futures, scan);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for search workers", ie);
        }
    }

    private static void cancel(List<Future<Void>> futures, Scan scan) {
        scan.stop.set(true);
        for (Future<Void> future : futures) {
            future.cancel(true);
        }
    }

    private static int resolve(String name, int requested, int defaultValue, int max) {
        if (requested <= 0) {
            return defaultValue;
        }
        if (requested > max) {
            log.warn("Requested {}={} exceeds maximum {}, clamping", name, requested, max);
            return max;
        }
        return requested;
    }

    /** State shared by the workers of one search. */
    private final class Scan {
        final CompiledQuery query;
        final MetadataCombiner combiner;
        final boolean mostRecent;
        final Set<String> candidates;
        final Instant deadline;

        final AtomicBoolean stop = new AtomicBoolean();
        final AtomicBoolean deadlineHit = new AtomicBoolean();
        final AtomicLong inspected = new AtomicLong();
        final AtomicLong pruned = new AtomicLong();
        final AtomicInteger completed = new AtomicInteger();

        Scan(CompiledQuery query, MetadataCombiner combiner, boolean mostRecent, Set<String> candidates, Instant deadline) {
            this.query = query;
            this.combiner = combiner;
            this.mostRecent = mostRecent;
            this.candidates = candidates;
            this.deadline = deadline;
        }

        void shard(TraceShard shard) {
            if (stop.get()) {
                return;
            }
            if (pastDeadline()) {
                deadlineHit.set(true);
                return;
            }
            if (mostRecent && combinerCompleteFor(shard.maxStartNanos())) {
                log.debug("Skipping shard {}: results already newer", shard.id());
                return;
            }
            try (Stream<Trace> stream = shard.open()) {
                Iterator<Trace> traces = stream.iterator();
                while (traces.hasNext()) {
                    if (stop.get()) {
                        return;
                    }
                    if (pastDeadline()) {
                        deadlineHit.set(true);
                        return;
                    }
                    Trace trace = traces.next();
                    if (candidates != null && !candidates.contains(trace.getTraceId())) {
                        pruned.incrementAndGet();
                        continue;
                    }
                    // shard traces are newest first, so nothing after this one can enter the result
                    if (mostRecent && combinerCompleteFor(trace.getStartEpochNanos())) {
                        break;
                    }
                    inspected.incrementAndGet();
                    List<Spanset> spansets = query.evaluate(trace);
                    if (!spansets.isEmpty()) {
                        synchronized (combiner) {
                            combiner.addTrace(trace, spansets);
                            if (!mostRecent && combiner.isComplete()) {
                                stop.set(true);
                            }
                        }
                    }
                }
            }
            completed.incrementAndGet();
        }

        boolean combinerCompleteFor(long maxStartNanos) {
            synchronized (combiner) {
                return combiner.isCompleteFor(maxStartNanos);
            }
        }

        private boolean pastDeadline() {
            return !clock.instant().isBefore(deadline);
        }
    }
}
