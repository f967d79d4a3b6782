package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Objects;
import lombok.Getter;

@JsonInclude(Include.NON_NULL)
@Getter
public final class SpanLink {
    private final String traceId;
    private final String spanId;
    private final AttributeMap attributes;

    public SpanLink(String traceId, String spanId, AttributeMap attributes) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.spanId = Objects.requireNonNull(spanId, "spanId");
        this.attributes = (attributes == null ? AttributeMap.empty() : attributes);
    }
}
