package com.spanql.telemetry.model;

import java.util.Locale;

/** Span kinds, including the OTLP zero value that the OpenTelemetry API enum omits. */
public enum SpanKind {
    UNSPECIFIED,
    INTERNAL,
    SERVER,
    CLIENT,
    PRODUCER,
    CONSUMER;

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts enum names in any case plus the OTLP {@code SPAN_KIND_} prefixed form; unknown values are unspecified. */
    public static SpanKind parse(String value) {
        if (value == null || value.isBlank()) return UNSPECIFIED;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("SPAN_KIND_")) v = v.substring("SPAN_KIND_".length());
        for (SpanKind kind : values()) {
            if (kind.name().equals(v)) return kind;
        }
        return UNSPECIFIED;
    }
}
