package com.spanql.service.core.ast;

import java.util.List;
import java.util.stream.Collectors;

public record GroupOperation(List<FieldExpression> by) implements PipelineElement {

    public GroupOperation {
        by = List.copyOf(by);
    }

    @Override
    public String toString() {
        return "by(" + by.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
