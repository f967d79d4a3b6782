package com.spanql.service.core.search;

import java.util.List;

/**
 * Matching traces plus scan metrics. {@code truncated} is set when the deadline or the most-recent shard
 * budget stopped the scan with data left unread; the traces found so far are still returned.
 */
public record TraceSearchResponse(
        List<TraceSearchMetadata> traces, SearchMetrics metrics, boolean truncated, TruncationReason truncationReason) {}
