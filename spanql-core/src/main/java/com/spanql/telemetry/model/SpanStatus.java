package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.opentelemetry.api.trace.StatusCode;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Span status. Immutable, so {@link #UNSET} can be shared by every span that reports none. */
@JsonInclude(Include.NON_NULL)
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class SpanStatus {
    public static final SpanStatus UNSET = new SpanStatus(StatusCode.UNSET, null);

    private final StatusCode code;
    private final String message;

    public static SpanStatus of(StatusCode code) {
        return new SpanStatus(code, null);
    }
}
