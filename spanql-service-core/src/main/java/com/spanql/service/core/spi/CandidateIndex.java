package com.spanql.service.core.spi;

import com.spanql.service.core.conditions.FetchSpansRequest;
import java.util.Optional;
import java.util.Set;

/** Optional pre-filter that narrows a search to trace ids that may match. */
public interface CandidateIndex {

    /**
     * A superset of the ids of traces that can satisfy the request's conditions, or empty when the index cannot
     * answer (for example because the request is unconstrained).
     */
    Optional<Set<String>> candidates(FetchSpansRequest request);
}
