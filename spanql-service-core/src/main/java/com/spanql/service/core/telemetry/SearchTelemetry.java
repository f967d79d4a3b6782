package com.spanql.service.core.telemetry;

import com.spanql.service.core.search.TruncationReason;

public interface SearchTelemetry {
    void recordCorruptTrace(String traceId, String reason);

    void recordDanglingParents(String traceId, int count);

    void recordTracesInspected(long count);

    void recordTracesPruned(long count);

    void recordTruncation(TruncationReason reason);

    void recordQueryRejected(String errorKind);
}
