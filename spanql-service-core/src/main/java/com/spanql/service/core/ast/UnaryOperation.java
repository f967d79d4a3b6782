package com.spanql.service.core.ast;

/** {@code !x}, {@code -x}, and the presence tests produced from {@code x != nil} and {@code x = nil}. */
public record UnaryOperation(Operator op, FieldExpression expression) implements FieldExpression {

    @Override
    public StaticType impliedType() {
        return op == Operator.NEG ? expression.impliedType() : StaticType.BOOLEAN;
    }

    @Override
    public boolean referencesSpan() {
        return expression.referencesSpan();
    }

    @Override
    public String toString() {
        return switch (op) {
            case EXISTS -> "(" + expression + " != nil)";
            case NOT_EXISTS -> "(" + expression + " = nil)";
            default -> "(" + op.symbol() + expression + ")";
        };
    }
}
