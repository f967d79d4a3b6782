package com.spanql.service.core.ast;

import java.util.List;
import java.util.stream.Collectors;

public record Pipeline(List<PipelineElement> elements) implements SpansetExpression {

    public Pipeline {
        elements = List.copyOf(elements);
    }

    /**
     * True when the pipeline can hand more than one spanset per trace to its consumer, which happens after a
     * {@code by()} that no {@code coalesce()} undoes.
     */
    public boolean yieldsMultipleSpansets() {
        boolean grouped = false;
        for (PipelineElement element : elements) {
            if (element instanceof GroupOperation) {
                grouped = true;
            } else if (element instanceof CoalesceOperation) {
                grouped = false;
            } else if (element instanceof Pipeline nested && nested.yieldsMultipleSpansets()) {
                grouped = true;
            }
        }
        return grouped;
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(e -> e instanceof Pipeline ? "(" + e + ")" : e.toString())
                .collect(Collectors.joining(" | "));
    }
}
