package com.spanql.service.core.ast;

import java.util.List;
import java.util.stream.Collectors;

/** Names extra fields to return with each matched span. Does not change which spans match. */
public record SelectOperation(List<Attribute> attributes) implements PipelineElement {

    public SelectOperation {
        attributes = List.copyOf(attributes);
    }

    @Override
    public String toString() {
        return "select(" + attributes.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
