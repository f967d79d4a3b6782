package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.opentelemetry.api.trace.SpanId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Getter;

/** One decoded span. Immutable once built; resources and scopes are shared references. */
@JsonInclude(Include.NON_NULL)
@Getter
public final class Span {
    private final String spanId;
    /** Parent span id, or null for a root span. The all-zero id is treated as absent. */
    private final String parentSpanId;
    private final String name;
    private final SpanKind kind;
    private final SpanStatus status;
    private final long startEpochNanos;
    private final long endEpochNanos;
    private final AttributeMap attributes;
    private final Resource resource;
    /** Instrumentation scope, or null when the producer did not report one. */
    private final InstrumentationScope scope;
    private final List<SpanEvent> events;
    private final List<SpanLink> links;

    private Span(Builder b) {
        this.spanId = Objects.requireNonNull(b.spanId, "spanId");
        this.parentSpanId = normalizeParent(b.parentSpanId);
        this.name = b.name != null ? b.name : "";
        this.kind = b.kind != null ? b.kind : SpanKind.UNSPECIFIED;
        this.status = b.status != null ? b.status : SpanStatus.UNSET;
        this.startEpochNanos = b.startEpochNanos;
        this.endEpochNanos = b.endEpochNanos;
        this.attributes = copyOf(b.attributes);
        this.resource = b.resource != null ? b.resource : Resource.empty();
        this.scope = b.scope;
        this.events = Collections.unmodifiableList(new ArrayList<>(b.events));
        this.links = Collections.unmodifiableList(new ArrayList<>(b.links));
    }

    /* ========================= Embedded Builder ========================= */

    /** Create a new builder for {@link Span}. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String spanId;
        private String parentSpanId;
        private String name;
        private SpanKind kind;
        private SpanStatus status;
        private long startEpochNanos;
        private long endEpochNanos;
        private AttributeMap attributes;
        private Resource resource;
        private InstrumentationScope scope;
        private final List<SpanEvent> events = new ArrayList<>();
        private final List<SpanLink> links = new ArrayList<>();

        private Builder() {}

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(SpanKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(SpanStatus status) {
            this.status = status;
            return this;
        }

        public Builder startEpochNanos(long startEpochNanos) {
            this.startEpochNanos = startEpochNanos;
            return this;
        }

        public Builder endEpochNanos(long endEpochNanos) {
            this.endEpochNanos = endEpochNanos;
            return this;
        }

        public Builder attributes(AttributeMap attributes) {
            this.attributes = attributes == null ? null : new AttributeMap(attributes.map());
            return this;
        }

        public Builder putAttribute(String key, Object value) {
            if (attributes == null || attributes == AttributeMap.empty()) {
                attributes = new AttributeMap();
            }
            attributes.put(key, value);
            return this;
        }

        public Builder resource(Resource resource) {
            this.resource = resource;
            return this;
        }

        public Builder scope(InstrumentationScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder events(List<SpanEvent> events) {
            this.events.clear();
            if (events != null) this.events.addAll(events);
            return this;
        }

        public Builder addEvent(SpanEvent event) {
            this.events.add(event);
            return this;
        }

        public Builder links(List<SpanLink> links) {
            this.links.clear();
            if (links != null) this.links.addAll(links);
            return this;
        }

        public Builder addLink(SpanLink link) {
            this.links.add(link);
            return this;
        }

        public Span build() {
            return new Span(this);
        }
    }

    private static AttributeMap copyOf(AttributeMap attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return AttributeMap.empty();
        }
        return new AttributeMap(attributes.map());
    }

    private static String normalizeParent(String parentSpanId) {
        if (parentSpanId == null || parentSpanId.isEmpty() || SpanId.getInvalid().equals(parentSpanId)) {
            return null;
        }
        return parentSpanId;
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public long getDurationNanos() {
        return endEpochNanos - startEpochNanos;
    }

    @Override
    public String toString() {
        return "Span{" + spanId + " '" + name + "'}";
    }
}
