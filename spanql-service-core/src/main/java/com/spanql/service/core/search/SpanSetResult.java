package com.spanql.service.core.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * @param spans at most the requested number of spans per spanset
 * @param matched number of spans in the spanset before truncation
 * @param attributes spanset attributes such as {@code count()} or {@code by(...)} keys
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SpanSetResult(List<SpanResult> spans, int matched, Map<String, Object> attributes) {}
