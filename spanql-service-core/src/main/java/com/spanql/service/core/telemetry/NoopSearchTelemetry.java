package com.spanql.service.core.telemetry;

import com.spanql.service.core.search.TruncationReason;

public class NoopSearchTelemetry implements SearchTelemetry {
    @Override
    public void recordCorruptTrace(String traceId, String reason) {}

    @Override
    public void recordDanglingParents(String traceId, int count) {}

    @Override
    public void recordTracesInspected(long count) {}

    @Override
    public void recordTracesPruned(long count) {}

    @Override
    public void recordTruncation(TruncationReason reason) {}

    @Override
    public void recordQueryRejected(String errorKind) {}
}
