package com.spanql.service.core.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/** Walks query trees. */
public final class Expressions {

    private Expressions() {}

    /** Every top-level field expression of the query: filters, aggregate arguments, by() and select() fields. */
    public static List<FieldExpression> fieldExpressions(RootExpr root) {
        List<FieldExpression> out = new ArrayList<>();
        collect(root.pipeline(), out);
        return out;
    }

    private static void collect(PipelineElement element, List<FieldExpression> out) {
        if (element instanceof SpansetFilter filter) {
            out.add(filter.expression());
        } else if (element instanceof SpansetOperation operation) {
            collect(operation.lhs(), out);
            collect(operation.rhs(), out);
        } else if (element instanceof Pipeline pipeline) {
            for (PipelineElement e : pipeline.elements()) {
                collect(e, out);
            }
        } else if (element instanceof ScalarFilter scalar) {
            if (scalar.aggregate().expression() != null) {
                out.add(scalar.aggregate().expression());
            }
        } else if (element instanceof GroupOperation group) {
            out.addAll(group.by());
        } else if (element instanceof SelectOperation select) {
            out.addAll(select.attributes());
        }
    }

    /** Visits the expression and all of its sub-expressions, parents first. */
    public static void forEachNode(FieldExpression expression, Consumer<FieldExpression> visitor) {
        visitor.accept(expression);
        if (expression instanceof BinaryOperation binary) {
            forEachNode(binary.lhs(), visitor);
            forEachNode(binary.rhs(), visitor);
        } else if (expression instanceof UnaryOperation unary) {
            forEachNode(unary.expression(), visitor);
        }
    }

    /** Distinct attribute references of the query in order of first appearance. */
    public static List<Attribute> attributes(RootExpr root) {
        Set<Attribute> attributes = new LinkedHashSet<>();
        for (FieldExpression expression : fieldExpressions(root)) {
            forEachNode(expression, node -> {
                if (node instanceof Attribute attribute) {
                    attributes.add(attribute);
                }
            });
        }
        return List.copyOf(attributes);
    }

    public static boolean referencesScope(FieldExpression expression, Scope scope) {
        boolean[] found = {false};
        forEachNode(expression, node -> {
            if (node instanceof Attribute attribute && attribute.effectiveScope() == scope) {
                found[0] = true;
            }
        });
        return found[0];
    }
}
