package com.spanql.service.core.ast;

/** Merges every spanset of a trace into one, undoing an earlier {@code by()}. */
public record CoalesceOperation() implements PipelineElement {

    @Override
    public String toString() {
        return "coalesce()";
    }
}
