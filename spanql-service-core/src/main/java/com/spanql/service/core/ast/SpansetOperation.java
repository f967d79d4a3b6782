package com.spanql.service.core.ast;

public record SpansetOperation(SpansetOperator op, SpansetExpression lhs, SpansetExpression rhs)
        implements SpansetExpression {

    @Override
    public String toString() {
        return operand(lhs) + " " + op.symbol() + " " + operand(rhs);
    }

    private static String operand(SpansetExpression e) {
        if (e instanceof SpansetFilter) {
            return e.toString();
        }
        return "(" + e + ")";
    }
}
