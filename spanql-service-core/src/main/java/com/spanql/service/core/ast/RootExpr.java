package com.spanql.service.core.ast;

/** A parsed query: the pipeline plus its hints. Immutable and safe to share between threads. */
public record RootExpr(Pipeline pipeline, Hints hints) {

    @Override
    public String toString() {
        return hints.isEmpty() ? pipeline.toString() : pipeline + " " + hints;
    }
}
