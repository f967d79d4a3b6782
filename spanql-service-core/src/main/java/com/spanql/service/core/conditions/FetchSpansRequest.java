package com.spanql.service.core.conditions;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.RootExpr;
import java.util.List;

/**
 * What a trace source needs to know to fetch candidate traces for a query.
 *
 * @param startNanos inclusive lower bound on trace start, 0 for unbounded
 * @param endNanos inclusive upper bound on trace start, 0 for unbounded
 * @param conditions flattened leaf predicates
 * @param allConditions true when one span must satisfy every condition, false when any condition on any span
 *     is enough
 * @param unconstrained true when no condition may be used to prune
 * @param secondPassAttributes every attribute the query reads, for output materialisation
 * @param query the parsed query
 */
public record FetchSpansRequest(
        long startNanos,
        long endNanos,
        List<Condition> conditions,
        boolean allConditions,
        boolean unconstrained,
        List<Attribute> secondPassAttributes,
        RootExpr query) {

    public FetchSpansRequest {
        conditions = List.copyOf(conditions);
        secondPassAttributes = List.copyOf(secondPassAttributes);
    }

    /** True when the trace start lies in the requested range. */
    public boolean overlaps(long traceStartNanos) {
        return (startNanos == 0 || traceStartNanos >= startNanos) && (endNanos == 0 || traceStartNanos <= endNanos);
    }

    /** True when a shard covering {@code [minStart, maxStart]} may hold traces in range. */
    public boolean overlaps(long minStartNanos, long maxStartNanos) {
        return (startNanos == 0 || maxStartNanos >= startNanos) && (endNanos == 0 || minStartNanos <= endNanos);
    }
}
