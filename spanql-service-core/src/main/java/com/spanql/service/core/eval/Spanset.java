package com.spanql.service.core.eval;

import com.spanql.service.core.ast.Static;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Spans of one trace selected by a query stage, in trace order, with the aggregate value and spanset
 * attributes earlier stages attached. Instances are immutable; the {@code with*} methods return copies.
 */
public final class Spanset {
    private final SpanTree tree;
    private final int[] indexes;
    private final Static scalar;
    private final List<SpansetAttribute> attributes;

    Spanset(SpanTree tree, int[] indexes, Static scalar, List<SpansetAttribute> attributes) {
        this.tree = tree;
        this.indexes = indexes;
        this.scalar = scalar == null ? Static.NIL : scalar;
        this.attributes = List.copyOf(attributes);
    }

    static Spanset all(SpanTree tree) {
        int[] indexes = new int[tree.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = i;
        }
        return new Spanset(tree, indexes, Static.NIL, List.of());
    }

    public SpanTree tree() {
        return tree;
    }

    public Trace trace() {
        return tree.trace();
    }

    public int size() {
        return indexes.length;
    }

    public boolean isEmpty() {
        return indexes.length == 0;
    }

    /** Positions of the selected spans within the trace, ascending. */
    public int[] indexes() {
        return indexes.clone();
    }

    int[] rawIndexes() {
        return indexes;
    }

    public List<Span> spans() {
        List<Span> spans = new ArrayList<>(indexes.length);
        for (int i : indexes) {
            spans.add(tree.span(i));
        }
        return spans;
    }

    /** Value set by the last aggregate stage, or nil. */
    public Static scalar() {
        return scalar;
    }

    public List<SpansetAttribute> attributes() {
        return attributes;
    }

    Spanset withIndexes(int[] newIndexes) {
        return new Spanset(tree, newIndexes, scalar, attributes);
    }

    Spanset withScalar(Static value, String attributeName) {
        return new Spanset(tree, indexes, value, merge(attributes, List.of(new SpansetAttribute(attributeName, value))));
    }

    Spanset withAttributes(List<SpansetAttribute> extra) {
        return new Spanset(tree, indexes, scalar, merge(attributes, extra));
    }

    /** Appends attributes, replacing values of names already present. */
    static List<SpansetAttribute> merge(List<SpansetAttribute> base, List<SpansetAttribute> extra) {
        List<SpansetAttribute> merged = new ArrayList<>(base);
        for (SpansetAttribute attribute : extra) {
            boolean replaced = false;
            for (int i = 0; i < merged.size(); i++) {
                if (merged.get(i).name().equals(attribute.name())) {
                    merged.set(i, attribute);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                merged.add(attribute);
            }
        }
        return merged;
    }

    @Override
    public String toString() {
        return "Spanset{trace=" + tree.trace().getTraceId() + ", spans=" + Arrays.toString(indexes) + ", attributes="
                + attributes + "}";
    }
}
