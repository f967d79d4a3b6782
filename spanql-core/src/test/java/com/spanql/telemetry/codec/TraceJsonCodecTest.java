package com.spanql.telemetry.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.SpanKind;
import com.spanql.telemetry.model.Trace;
import io.opentelemetry.api.trace.StatusCode;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceJsonCodecTest {

    private static Trace checkout() throws Exception {
        try (InputStream in = TraceJsonCodecTest.class.getResourceAsStream("/traces/checkout.json")) {
            List<Trace> traces = TraceJsonCodec.decodeAll(in);
            assertThat(traces).hasSize(1);
            return traces.get(0);
        }
    }

    @Test
    void decodesSpansWithNormalisedIdsAndEnums() throws Exception {
        Trace trace = checkout();

        assertThat(trace.getTraceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(trace.getSpans()).extracting(Span::getName).containsExactly("GET /checkout", "charge", "authorize");

        Span root = trace.getSpans().get(0);
        assertThat(root.getKind()).isEqualTo(SpanKind.SERVER);
        assertThat(root.getStatus().getCode()).isEqualTo(StatusCode.OK);
        assertThat(root.getScope().getName()).isEqualTo("io.opentelemetry.servlet");
        assertThat(root.getAttributes().get("http.status_code")).isEqualTo(200);

        Span charge = trace.getSpans().get(1);
        assertThat(charge.getKind()).isEqualTo(SpanKind.CLIENT);
        assertThat(charge.getStatus().getCode()).isEqualTo(StatusCode.ERROR);
        assertThat(charge.getStatus().getMessage()).isEqualTo("card declined");
        assertThat(charge.getAttributes().get("peer")).isInstanceOf(Map.class);
        assertThat(charge.getAttributes().get("retries")).isEqualTo(List.of(1, 2));
        assertThat(charge.getEvents()).singleElement().satisfies(e -> {
            assertThat(e.getName()).isEqualTo("exception");
            assertThat(e.getTimeSinceStartNanos()).isEqualTo(250_000_000L);
        });
        assertThat(charge.getLinks()).singleElement().satisfies(l -> assertThat(l.getSpanId())
                .isEqualTo("b7ad6b7169203331"));
    }

    @Test
    void sharesEqualResourcesWithinATrace() throws Exception {
        Trace trace = checkout();

        assertThat(trace.getSpans().get(0).getResource()).isSameAs(trace.getSpans().get(1).getResource());
        assertThat(trace.getSpans().get(2).getResource().getServiceName()).isEqualTo("payments");
    }

    @Test
    void derivesTraceIntrinsics() throws Exception {
        Trace trace = checkout();

        assertThat(trace.getStartEpochNanos()).isEqualTo(1_000_000_000L);
        assertThat(trace.getDurationNanos()).isEqualTo(1_000_000_000L);
        assertThat(trace.getRootSpanName()).isEqualTo("GET /checkout");
        assertThat(trace.getRootServiceName()).isEqualTo("frontend");
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> TraceJsonCodec.decode("{\"traceId\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decode failed");
        assertThatThrownBy(() -> TraceJsonCodec.decode("{\"traceId\":\"xyz\",\"spans\":[]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid trace id");
        assertThatThrownBy(() -> TraceJsonCodec.decode(
                        "{\"traceId\":\"4bf92f3577b34da6a3ce929d0e0e4736\",\"spans\":[{\"name\":\"x\"}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spanId");
    }
}
