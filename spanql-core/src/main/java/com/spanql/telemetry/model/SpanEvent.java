package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Objects;
import lombok.Getter;

@JsonInclude(Include.NON_NULL)
@Getter
public final class SpanEvent {
    private final String name;
    /** Offset from the owning span's start, in nanos. */
    private final long timeSinceStartNanos;

    private final AttributeMap attributes;

    public SpanEvent(String name, long timeSinceStartNanos, AttributeMap attributes) {
        this.name = Objects.requireNonNull(name, "name");
        this.timeSinceStartNanos = timeSinceStartNanos;
        this.attributes = (attributes == null ? AttributeMap.empty() : attributes);
    }
}
