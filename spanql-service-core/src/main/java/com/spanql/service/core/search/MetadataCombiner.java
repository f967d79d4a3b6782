package com.spanql.service.core.search;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.eval.FieldEvaluator;
import com.spanql.service.core.eval.SpanTree;
import com.spanql.service.core.eval.Spanset;
import com.spanql.service.core.eval.SpansetAttribute;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects matching traces into search results, one entry per trace id.
 *
 * <p>By default traces are kept in arrival order until the limit is reached. With {@code mostRecent} the
 * combiner keeps the freshest {@code limit} traces by start time, evicting the oldest held trace when a newer
 * one arrives. Not thread safe; callers synchronize.
 */
public final class MetadataCombiner {
    private final int limit;
    private final int spansPerSpanSet;
    private final boolean mostRecent;
    private final List<Attribute> outputAttributes;
    private final Map<String, TraceSearchMetadata> traces = new LinkedHashMap<>();

    public MetadataCombiner(int limit, int spansPerSpanSet, boolean mostRecent, List<Attribute> outputAttributes) {
        this.limit = limit;
        this.spansPerSpanSet = spansPerSpanSet;
        this.mostRecent = mostRecent;
        this.outputAttributes = List.copyOf(outputAttributes);
    }

    /**
     * Adds a trace's surviving spansets. A trace already held is merged; a new trace is rejected when full,
     * unless most-recent mode lets it replace an older one.
     *
     * @return true when the spansets were kept
     */
    public boolean addTrace(Trace trace, List<Spanset> spansets) {
        if (spansets.isEmpty()) {
            return false;
        }
        TraceSearchMetadata existing = traces.get(trace.getTraceId());
        if (existing != null) {
            merge(existing, trace, spansets);
            return true;
        }
        if (traces.size() >= limit) {
            if (!mostRecent) {
                return false;
            }
            TraceSearchMetadata oldest = oldest();
            if (oldest == null || trace.getStartEpochNanos() <= oldest.getStartTimeUnixNano()) {
                return false;
            }
            traces.remove(oldest.getTraceId());
        }
        TraceSearchMetadata metadata = new TraceSearchMetadata();
        metadata.setTraceId(trace.getTraceId());
        metadata.setRootServiceName(trace.getRootServiceName());
        metadata.setRootTraceName(trace.getRootSpanName());
        metadata.setStartTimeUnixNano(trace.getStartEpochNanos());
        metadata.setDurationNanos(trace.getDurationNanos());
        metadata.setSpanSets(new ArrayList<>());
        for (Spanset spanset : spansets) {
            metadata.getSpanSets().add(toResult(spanset));
        }
        traces.put(trace.getTraceId(), metadata);
        return true;
    }

    private void merge(TraceSearchMetadata metadata, Trace trace, List<Spanset> spansets) {
        long start = Math.min(metadata.getStartTimeUnixNano(), trace.getStartEpochNanos());
        long end = Math.max(
                metadata.getStartTimeUnixNano() + metadata.getDurationNanos(), trace.getEndEpochNanos());
        metadata.setStartTimeUnixNano(start);
        metadata.setDurationNanos(end - start);
        if (metadata.getRootServiceName() == null) {
            metadata.setRootServiceName(trace.getRootServiceName());
            metadata.setRootTraceName(trace.getRootSpanName());
        }
        for (Spanset spanset : spansets) {
            metadata.getSpanSets().add(toResult(spanset));
        }
    }

    /** True once {@code limit} traces are held. */
    public boolean isComplete() {
        return traces.size() >= limit;
    }

    /**
     * True when no trace starting at or before {@code maxStartNanos} can still enter the result: the combiner is
     * full and every held trace is newer. Only meaningful in most-recent mode.
     */
    public boolean isCompleteFor(long maxStartNanos) {
        if (!isComplete()) {
            return false;
        }
        TraceSearchMetadata oldest = oldest();
        return oldest != null && maxStartNanos <= oldest.getStartTimeUnixNano();
    }

    public int size() {
        return traces.size();
    }

    /** Held traces; newest first in most-recent mode, otherwise in arrival order. */
    public List<TraceSearchMetadata> metadata() {
        List<TraceSearchMetadata> out = new ArrayList<>(traces.values());
        if (mostRecent) {
            out.sort(Comparator.comparingLong(TraceSearchMetadata::getStartTimeUnixNano).reversed());
        }
        return out;
    }

    private TraceSearchMetadata oldest() {
        TraceSearchMetadata oldest = null;
        for (TraceSearchMetadata metadata : traces.values()) {
            if (oldest == null || metadata.getStartTimeUnixNano() < oldest.getStartTimeUnixNano()) {
                oldest = metadata;
            }
        }
        return oldest;
    }

    private SpanSetResult toResult(Spanset spanset) {
        SpanTree tree = spanset.tree();
        int[] indexes = spanset.indexes();
        int shown = Math.min(indexes.length, spansPerSpanSet);
        List<SpanResult> spans = new ArrayList<>(shown);
        for (int k = 0; k < shown; k++) {
            spans.add(toResult(tree, indexes[k]));
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (SpansetAttribute attribute : spanset.attributes()) {
            attributes.put(attribute.name(), attribute.value().toJavaValue());
        }
        return new SpanSetResult(spans, indexes.length, attributes);
    }

    private SpanResult toResult(SpanTree tree, int index) {
        Span span = tree.span(index);
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Attribute attribute : outputAttributes) {
            List<Static> values = FieldEvaluator.resolveAll(attribute, tree, index);
            if (values.size() == 1) {
                attributes.put(attribute.toString(), values.get(0).toJavaValue());
            } else if (!values.isEmpty()) {
                attributes.put(attribute.toString(), values.stream().map(Static::toJavaValue).toList());
            }
        }
        return new SpanResult(
                span.getSpanId(), span.getName(), span.getStartEpochNanos(), span.getDurationNanos(), attributes);
    }
}
