package com.spanql.service.core.ast;

/** {@code count()} or a numeric reduction over a field expression. */
public record Aggregate(AggregateOp op, FieldExpression expression) {

    public static Aggregate count() {
        return new Aggregate(AggregateOp.COUNT, null);
    }

    @Override
    public String toString() {
        return op.functionName() + "(" + (expression == null ? "" : expression) + ")";
    }
}
