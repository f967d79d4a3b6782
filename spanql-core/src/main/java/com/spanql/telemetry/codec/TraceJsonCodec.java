package com.spanql.telemetry.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.spanql.telemetry.model.AttributeMap;
import com.spanql.telemetry.model.InstrumentationScope;
import com.spanql.telemetry.model.Resource;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.SpanEvent;
import com.spanql.telemetry.model.SpanKind;
import com.spanql.telemetry.model.SpanLink;
import com.spanql.telemetry.model.SpanStatus;
import com.spanql.telemetry.model.Trace;
import io.opentelemetry.api.trace.StatusCode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Jackson based codec for the JSON trace document used by fixtures and the in-memory store:
 *
 * <pre>
 * {"traceId":"…","spans":[{"spanId":"…","parentSpanId":"…","name":"…","kind":"SERVER",
 *   "status":{"code":"ERROR","message":"…"},"startEpochNanos":1,"endEpochNanos":2,
 *   "attributes":{…},"resource":{…},"scope":{"name":"…","version":"…","attributes":{…}},
 *   "events":[{"name":"…","timeSinceStartNanos":0,"attributes":{…}}],
 *   "links":[{"traceId":"…","spanId":"…","attributes":{…}}]}]}
 * </pre>
 *
 * Spans of one trace with equal resources share a single {@link Resource} instance.
 */
public final class TraceJsonCodec {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        M.findAndRegisterModules();
        M.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    private TraceJsonCodec() {}

    public static Trace decode(String json) {
        try {
            return decodeTrace(M.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON trace decode failed", e);
        }
    }

    /** Reads either a single trace document, an array of them, or {@code {"traces":[…]}}. */
    public static List<Trace> decodeAll(InputStream in) {
        JsonNode root;
        try {
            root = M.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("JSON trace decode failed", e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        JsonNode array = root.isArray() ? root : root.get("traces");
        if (array == null) {
            return List.of(decodeTrace(root));
        }
        List<Trace> traces = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            traces.add(decodeTrace(node));
        }
        return traces;
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    private static Trace decodeTrace(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Trace document must be a JSON object");
        }
        String traceId = text(node, "traceId");
        Map<AttributeMap, Resource> resources = new HashMap<>();
        List<Span> spans = new ArrayList<>();
        JsonNode spanNodes = node.path("spans");
        for (JsonNode s : spanNodes) {
            spans.add(decodeSpan(s, resources));
        }
        return new Trace(traceId, spans);
    }

    private static Span decodeSpan(JsonNode s, Map<AttributeMap, Resource> resources) {
        String spanId = text(s, "spanId");
        if (spanId == null) {
            throw new IllegalArgumentException("Span without spanId");
        }
        Span.Builder b = Span.builder()
                .spanId(spanId.toLowerCase(Locale.ROOT))
                .parentSpanId(lower(text(s, "parentSpanId")))
                .name(text(s, "name"))
                .kind(SpanKind.parse(text(s, "kind")))
                .status(status(s.get("status")))
                .startEpochNanos(s.path("startEpochNanos").asLong())
                .endEpochNanos(s.path("endEpochNanos").asLong())
                .attributes(attributes(s.get("attributes")));

        AttributeMap resourceAttrs = attributes(s.get("resource"));
        b.resource(resources.computeIfAbsent(resourceAttrs, Resource::new));

        JsonNode scope = s.get("scope");
        if (scope != null && scope.isObject()) {
            b.scope(new InstrumentationScope(
                    text(scope, "name"), text(scope, "version"), attributes(scope.get("attributes"))));
        }
        for (JsonNode e : s.path("events")) {
            b.addEvent(new SpanEvent(
                    e.path("name").asText(""),
                    e.path("timeSinceStartNanos").asLong(),
                    attributes(e.get("attributes"))));
        }
        for (JsonNode l : s.path("links")) {
            b.addLink(new SpanLink(
                    lower(l.path("traceId").asText("")),
                    lower(l.path("spanId").asText("")),
                    attributes(l.get("attributes"))));
        }
        return b.build();
    }

    private static SpanStatus status(JsonNode node) {
        if (node == null || node.isNull()) {
            return SpanStatus.UNSET;
        }
        String code = node.isTextual() ? node.asText() : text(node, "code");
        String message = node.isObject() ? text(node, "message") : null;
        return new SpanStatus(statusCode(code), message);
    }

    private static StatusCode statusCode(String code) {
        if (code == null || code.isBlank()) return StatusCode.UNSET;
        String c = code.trim().toUpperCase(Locale.ROOT);
        if (c.startsWith("STATUS_CODE_")) c = c.substring("STATUS_CODE_".length());
        try {
            return StatusCode.valueOf(c);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status code: " + code, e);
        }
    }

    private static AttributeMap attributes(JsonNode node) {
        if (node == null || node.isNull()) {
            return AttributeMap.empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Attributes must be a JSON object");
        }
        return new AttributeMap(M.convertValue(node, MAP_TYPE));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
