package com.spanql.service.core.ast;

/** {@code | count() > 2}: keeps spansets whose aggregate satisfies the comparison. */
public record ScalarFilter(Operator op, Aggregate aggregate, Static value) implements PipelineElement {

    @Override
    public String toString() {
        return aggregate + " " + op.symbol() + " " + value;
    }
}
