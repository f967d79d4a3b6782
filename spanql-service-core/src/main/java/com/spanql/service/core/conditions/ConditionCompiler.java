package com.spanql.service.core.conditions;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.BinaryOperation;
import com.spanql.service.core.ast.Expressions;
import com.spanql.service.core.ast.FieldExpression;
import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.Pipeline;
import com.spanql.service.core.ast.PipelineElement;
import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.ast.SpansetFilter;
import com.spanql.service.core.ast.SpansetOperation;
import com.spanql.service.core.ast.SpansetOperator;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.ast.UnaryOperation;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a query into leaf conditions for storage-side pruning. The result over-approximates: every trace
 * the query can match satisfies the conditions, so a source that drops traces failing them never loses a
 * match. Anything that cannot be flattened soundly makes the request unconstrained.
 */
public final class ConditionCompiler {

    private ConditionCompiler() {}

    public static FetchSpansRequest compile(RootExpr root, long startNanos, long endNanos) {
        Constraint constraint = pipeline(root.pipeline());
        return new FetchSpansRequest(
                startNanos,
                endNanos,
                constraint.unconstrained ? List.of() : constraint.conditions,
                !constraint.unconstrained && constraint.all,
                constraint.unconstrained,
                Expressions.attributes(root),
                root);
    }

    private static Constraint pipeline(Pipeline pipeline) {
        Constraint result = Constraint.UNCONSTRAINED;
        for (PipelineElement element : pipeline.elements()) {
            result = both(result, element(element));
        }
        return result;
    }

    private static Constraint element(PipelineElement element) {
        if (element instanceof SpansetFilter filter) {
            return field(filter.expression());
        }
        if (element instanceof SpansetOperation operation) {
            Constraint lhs = element(operation.lhs());
            Constraint rhs = element(operation.rhs());
            return operation.op() == SpansetOperator.OR ? either(lhs, rhs) : both(lhs, rhs);
        }
        if (element instanceof Pipeline pipeline) {
            return pipeline(pipeline);
        }
        // aggregates, by(), coalesce() and select() never narrow the candidate set on their own
        return Constraint.UNCONSTRAINED;
    }

    // ---------------------------------------------------------------------
    // field expressions: constraints on a single span
    // ---------------------------------------------------------------------

    private static Constraint field(FieldExpression expression) {
        if (expression instanceof Attribute attribute) {
            return Constraint.of(Condition.exists(attribute));
        }
        if (expression instanceof UnaryOperation unary) {
            if (unary.op() == Operator.EXISTS && unary.expression() instanceof Attribute attribute) {
                return Constraint.of(Condition.exists(attribute));
            }
            return Constraint.UNCONSTRAINED;
        }
        if (!(expression instanceof BinaryOperation binary)) {
            return Constraint.UNCONSTRAINED;
        }
        Operator op = binary.op();
        if (op == Operator.AND) {
            return sameSpan(field(binary.lhs()), field(binary.rhs()));
        }
        if (op == Operator.OR) {
            return either(field(binary.lhs()), field(binary.rhs()));
        }
        if (!op.isComparison()) {
            return Constraint.UNCONSTRAINED;
        }
        if (binary.lhs() instanceof Attribute attribute && binary.rhs() instanceof Static operand) {
            return Constraint.of(new Condition(attribute, op, operand));
        }
        if (binary.lhs() instanceof Static operand && binary.rhs() instanceof Attribute attribute && !op.isRegex()) {
            return Constraint.of(new Condition(attribute, op.flip(), operand));
        }
        return Constraint.UNCONSTRAINED;
    }

    /** Both sides hold on the same span. */
    private static Constraint sameSpan(Constraint lhs, Constraint rhs) {
        if (lhs.unconstrained) return rhs;
        if (rhs.unconstrained) return lhs;
        if (lhs.all && rhs.all) {
            List<Condition> conditions = new ArrayList<>(lhs.conditions);
            conditions.addAll(rhs.conditions);
            return new Constraint(conditions, true, false);
        }
        return rhs.all && !lhs.all ? rhs : lhs;
    }

    /** Both sides hold somewhere in the trace, not necessarily on the same span. */
    private static Constraint both(Constraint lhs, Constraint rhs) {
        if (lhs.unconstrained) return rhs;
        if (rhs.unconstrained) return lhs;
        return anyOf(lhs, rhs);
    }

    private static Constraint either(Constraint lhs, Constraint rhs) {
        if (lhs.unconstrained || rhs.unconstrained) {
            return Constraint.UNCONSTRAINED;
        }
        return anyOf(lhs, rhs);
    }

    private static Constraint anyOf(Constraint lhs, Constraint rhs) {
        List<Condition> conditions = new ArrayList<>(lhs.conditions);
        conditions.addAll(rhs.conditions);
        return new Constraint(conditions, false, false);
    }

    private static final class Constraint {
        static final Constraint UNCONSTRAINED = new Constraint(List.of(), false, true);

        final List<Condition> conditions;
        final boolean all;
        final boolean unconstrained;

        Constraint(List<Condition> conditions, boolean all, boolean unconstrained) {
            this.conditions = conditions;
            this.all = all;
            this.unconstrained = unconstrained;
        }

        static Constraint of(Condition condition) {
            return new Constraint(List.of(condition), true, false);
        }
    }
}
