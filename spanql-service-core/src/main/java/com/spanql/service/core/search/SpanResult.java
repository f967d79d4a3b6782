package com.spanql.service.core.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SpanResult(
        String spanId, String name, long startTimeUnixNano, long durationNanos, Map<String, Object> attributes) {}
