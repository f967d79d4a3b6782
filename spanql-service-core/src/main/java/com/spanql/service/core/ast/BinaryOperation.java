package com.spanql.service.core.ast;

public record BinaryOperation(Operator op, FieldExpression lhs, FieldExpression rhs) implements FieldExpression {

    @Override
    public StaticType impliedType() {
        if (op.isComparison() || op.isLogical()) {
            return StaticType.BOOLEAN;
        }
        StaticType l = lhs.impliedType();
        StaticType r = rhs.impliedType();
        if (!l.isKnown() || !r.isKnown()) {
            return StaticType.ATTRIBUTE;
        }
        if (op == Operator.DIV || op == Operator.POW || l == StaticType.FLOAT || r == StaticType.FLOAT) {
            return StaticType.FLOAT;
        }
        if (l == StaticType.DURATION || r == StaticType.DURATION) {
            return StaticType.DURATION;
        }
        return StaticType.INT;
    }

    @Override
    public boolean referencesSpan() {
        return lhs.referencesSpan() || rhs.referencesSpan();
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + op.symbol() + " " + rhs + ")";
    }
}
