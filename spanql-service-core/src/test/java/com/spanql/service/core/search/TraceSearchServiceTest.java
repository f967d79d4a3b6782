package com.spanql.service.core.search;

import static com.spanql.service.core.support.TestTraces.load;
import static com.spanql.service.core.support.TestTraces.traceAt;
import static com.spanql.service.core.support.TestTraces.traceId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.spanql.service.core.config.SearchProperties;
import com.spanql.service.core.engine.TraceQLEngine;
import com.spanql.service.core.parser.SyntaxException;
import com.spanql.service.core.spi.TraceShard;
import com.spanql.service.core.spi.TraceSource;
import com.spanql.service.core.spi.TraceSourceException;
import com.spanql.service.core.storage.InMemoryCandidateIndex;
import com.spanql.service.core.storage.InMemoryTraceSource;
import com.spanql.service.core.telemetry.SearchTelemetryRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TraceSearchServiceTest {
    private static final long SECOND = 1_000_000_000L;
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final SearchProperties properties = new SearchProperties();
    private final SearchTelemetryRegistry telemetry = new SearchTelemetryRegistry();
    private final SearchExecutor executor = new SearchExecutor(properties);
    private final InMemoryTraceSource source = new InMemoryTraceSource(
            List.of(
                    traceAt(1, 10 * SECOND, "oldest"),
                    traceAt(2, 70 * SECOND, "middle"),
                    traceAt(3, 75 * SECOND, "middle-late"),
                    traceAt(4, 130 * SECOND, "newer"),
                    traceAt(5, 200 * SECOND, "newest")),
            Duration.ofMinutes(1));

    @BeforeEach
    void setUp() {
        executor.init(4);
    }

    @AfterEach
    void tearDown() {
        executor.stop();
    }

    private TraceSearchService service(Clock clock) {
        return new TraceSearchService(
                new TraceQLEngine(telemetry),
                source,
                Optional.of(new InMemoryCandidateIndex(source)),
                executor,
                properties,
                telemetry,
                clock);
    }

    private TraceSearchService service() {
        return service(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<String> ids(TraceSearchResponse response) {
        return response.traces().stream().map(TraceSearchMetadata::getTraceId).toList();
    }

    @Test
    void matchAllReturnsEveryTrace() {
        TraceSearchResponse response = service().search(TraceSearchRequest.of("{ }"));

        assertThat(ids(response))
                .containsExactlyInAnyOrder(traceId(1), traceId(2), traceId(3), traceId(4), traceId(5));
        assertThat(response.truncated()).isFalse();
        assertThat(response.truncationReason()).isEqualTo(TruncationReason.NONE);
        assertThat(response.metrics().inspectedTraces()).isEqualTo(5);
        assertThat(response.metrics().totalShards()).isEqualTo(4);
        assertThat(response.metrics().completedShards()).isEqualTo(4);
        assertThat(telemetry.snapshot().tracesInspected()).isEqualTo(5);
    }

    @Test
    void candidateIndexPrunesBeforeEvaluation() {
        TraceSearchResponse response = service().search(TraceSearchRequest.of("{ name = \"newest\" }"));

        assertThat(ids(response)).containsExactly(traceId(5));
        assertThat(response.metrics().inspectedTraces()).isEqualTo(1);
        assertThat(response.metrics().prunedTraces()).isEqualTo(4);
        assertThat(telemetry.snapshot().tracesPruned()).isEqualTo(4);
    }

    @Test
    void timeRangeLimitsTheScan() {
        TraceSearchRequest request = new TraceSearchRequest("{ }", 60 * SECOND, 100 * SECOND, 0, 0, Map.of(), null);

        assertThat(ids(service().search(request))).containsExactlyInAnyOrder(traceId(2), traceId(3));
    }

    @Test
    void limitStopsTheScan() {
        TraceSearchResponse response = service().search(TraceSearchRequest.of("{ }").withLimit(2));

        assertThat(response.traces()).hasSize(2);
        assertThat(response.truncated()).isFalse();
    }

    @Test
    void limitsAboveTheMaximumAreClamped() {
        properties.setMaxLimit(3);

        TraceSearchResponse response = service().search(TraceSearchRequest.of("{ }").withLimit(50));

        assertThat(response.traces()).hasSize(3);
    }

    @Test
    void mostRecentReturnsNewestTracesNewestFirst() {
        TraceSearchResponse response =
                service().search(TraceSearchRequest.of("{ } with(most_recent=true)").withLimit(3));

        assertThat(ids(response)).containsExactly(traceId(5), traceId(4), traceId(3));
    }

    @Test
    void mostRecentCanComeFromRequestHints() {
        TraceSearchResponse response = service()
                .search(TraceSearchRequest.of("{ }").withLimit(2).withHints(Map.of("most_recent", true)));

        assertThat(ids(response)).containsExactly(traceId(5), traceId(4));
    }

    @Test
    void shardBudgetTruncatesMostRecentSearches() {
        properties.setMostRecentShards(2);

        TraceSearchResponse response =
                service().search(TraceSearchRequest.of("{ } with(most_recent=true)").withLimit(5));

        assertThat(ids(response)).containsExactly(traceId(5), traceId(4));
        assertThat(response.truncated()).isTrue();
        assertThat(response.truncationReason()).isEqualTo(TruncationReason.SCAN_BUDGET);
        assertThat(telemetry.snapshot().truncations()).containsEntry(TruncationReason.SCAN_BUDGET, 1L);
    }

    @Test
    void shardBudgetIsNotTruncationWhenOlderShardsCannotContribute() {
        properties.setMostRecentShards(1);

        TraceSearchResponse response =
                service().search(TraceSearchRequest.of("{ } with(most_recent=true)").withLimit(1));

        assertThat(ids(response)).containsExactly(traceId(5));
        assertThat(response.truncated()).isFalse();
    }

    @Test
    void deadlineReturnsPartialResults() {
        TraceSearchResponse response = service(new SteppingClock(Duration.ofMinutes(1)))
                .search(TraceSearchRequest.of("{ }").withTimeout(Duration.ofSeconds(30)));

        assertThat(response.traces()).isEmpty();
        assertThat(response.truncated()).isTrue();
        assertThat(response.truncationReason()).isEqualTo(TruncationReason.DEADLINE);
        assertThat(telemetry.snapshot().truncations()).containsEntry(TruncationReason.DEADLINE, 1L);
    }

    @Test
    void resultsCarryMatchedSpans() {
        source.add(load("/traces/checkout.json"));

        TraceSearchResponse response = service().search(TraceSearchRequest.of("{ status = error } | count() = 1"));

        assertThat(response.traces()).hasSize(1);
        TraceSearchMetadata metadata = response.traces().get(0);
        assertThat(metadata.getRootServiceName()).isEqualTo("frontend");
        SpanSetResult spanSet = metadata.getSpanSets().get(0);
        assertThat(spanSet.attributes()).containsEntry("count()", 1L);
        assertThat(spanSet.spans()).singleElement().satisfies(span -> {
            assertThat(span.name()).isEqualTo("charge");
            assertThat(span.attributes()).containsEntry("status", "error");
        });
    }

    @Test
    void sourceFailuresPropagate() {
        TraceSource failing = mock(TraceSource.class);
        when(failing.shards(any())).thenReturn(List.of(new TraceShard("broken", 0, 10, () -> {
            throw new TraceSourceException("disk gone");
        })));
        TraceSearchService service = new TraceSearchService(
                new TraceQLEngine(telemetry),
                failing,
                Optional.empty(),
                executor,
                properties,
                telemetry,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> service.search(TraceSearchRequest.of("{ }")))
                .isInstanceOf(TraceSourceException.class)
                .hasMessage("disk gone");
    }

    @Test
    void invalidQueriesFailBeforeScanning() {
        TraceSource untouched = mock(TraceSource.class);
        TraceSearchService service = new TraceSearchService(
                new TraceQLEngine(telemetry),
                untouched,
                Optional.empty(),
                executor,
                properties,
                telemetry,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> service.search(TraceSearchRequest.of("{ .a = ")))
                .isInstanceOf(SyntaxException.class);
        verifyNoInteractions(untouched);
    }

    /** Moves forward by a fixed step every time it is read. */
    private static final class SteppingClock extends Clock {
        private final AtomicLong reads = new AtomicLong();
        private final Duration step;

        SteppingClock(Duration step) {
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return NOW.plus(step.multipliedBy(reads.getAndIncrement()));
        }
    }
}
