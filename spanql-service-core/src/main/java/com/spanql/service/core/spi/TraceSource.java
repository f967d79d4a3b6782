package com.spanql.service.core.spi;

import com.spanql.service.core.conditions.FetchSpansRequest;
import java.util.List;

/**
 * Supplies candidate traces for a search, split into shards the engine scans concurrently. Shards are
 * returned newest first; traces inside a shard may be pruned with the request's conditions, but a source must
 * never drop a trace that satisfies them.
 */
public interface TraceSource {

    List<TraceShard> shards(FetchSpansRequest request);
}
