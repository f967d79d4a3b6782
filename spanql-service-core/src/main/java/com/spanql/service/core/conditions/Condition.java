package com.spanql.service.core.conditions;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.Static;

/**
 * One flattened leaf predicate a storage collaborator may use to prune traces. {@code EXISTS} conditions carry
 * no operand.
 */
public record Condition(Attribute attribute, Operator op, Static operand) {

    public static Condition exists(Attribute attribute) {
        return new Condition(attribute, Operator.EXISTS, null);
    }

    @Override
    public String toString() {
        return op == Operator.EXISTS ? attribute + " != nil" : attribute + " " + op.symbol() + " " + operand;
    }
}
