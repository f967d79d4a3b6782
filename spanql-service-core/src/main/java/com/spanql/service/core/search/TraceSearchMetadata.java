package com.spanql.service.core.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** One matching trace in a search response. */
@Getter
@Setter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceSearchMetadata {
    private String traceId;
    private String rootServiceName;
    private String rootTraceName;
    private long startTimeUnixNano;
    private long durationNanos;
    private List<SpanSetResult> spanSets = new ArrayList<>();
}
