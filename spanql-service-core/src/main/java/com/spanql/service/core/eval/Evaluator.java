package com.spanql.service.core.eval;

import com.spanql.service.core.ast.Aggregate;
import com.spanql.service.core.ast.AggregateOp;
import com.spanql.service.core.ast.CoalesceOperation;
import com.spanql.service.core.ast.FieldExpression;
import com.spanql.service.core.ast.GroupOperation;
import com.spanql.service.core.ast.Pipeline;
import com.spanql.service.core.ast.PipelineElement;
import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.ast.ScalarFilter;
import com.spanql.service.core.ast.SelectOperation;
import com.spanql.service.core.ast.SpansetExpression;
import com.spanql.service.core.ast.SpansetFilter;
import com.spanql.service.core.ast.SpansetOperation;
import com.spanql.service.core.ast.SpansetOperator;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.ast.StaticType;
import com.spanql.service.core.telemetry.SearchTelemetry;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a parsed pipeline over one trace at a time. Stateless between traces, so a single instance serves all
 * search workers.
 */
@Slf4j
public final class Evaluator {
    private final RootExpr root;
    private final FieldEvaluator fields;
    private final SearchTelemetry telemetry;

    public Evaluator(RootExpr root, SearchTelemetry telemetry) {
        this(root, new FieldEvaluator(root), telemetry);
    }

    public Evaluator(RootExpr root, FieldEvaluator fields, SearchTelemetry telemetry) {
        this.root = root;
        this.fields = fields;
        this.telemetry = telemetry;
    }

    public FieldEvaluator fields() {
        return fields;
    }

    /** Spansets surviving the whole pipeline; empty when the trace does not match or cannot be evaluated. */
    public List<Spanset> evaluate(Trace trace) {
        SpanTree tree = SpanTree.build(trace);
        if (tree.isCorrupt()) {
            log.debug("Skipping trace {}: {}", trace.getTraceId(), tree.corruption());
            telemetry.recordCorruptTrace(trace.getTraceId(), tree.corruption());
            return List.of();
        }
        if (tree.danglingParents() > 0) {
            telemetry.recordDanglingParents(trace.getTraceId(), tree.danglingParents());
        }
        if (tree.size() == 0) {
            return List.of();
        }
        return pipeline(root.pipeline(), List.of(Spanset.all(tree)));
    }

    private List<Spanset> pipeline(Pipeline pipeline, List<Spanset> input) {
        List<Spanset> current = input;
        for (PipelineElement element : pipeline.elements()) {
            current = stage(element, current);
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    private List<Spanset> stage(PipelineElement element, List<Spanset> input) {
        if (element instanceof SpansetExpression expression) {
            List<Spanset> out = new ArrayList<>(input.size());
            for (Spanset spanset : input) {
                Spanset result = spansetExpression(expression, spanset);
                if (!result.isEmpty()) {
                    out.add(result);
                }
            }
            return out;
        }
        if (element instanceof ScalarFilter scalar) {
            return scalarFilter(scalar, input);
        }
        if (element instanceof GroupOperation group) {
            return group(group, input);
        }
        if (element instanceof CoalesceOperation) {
            return coalesce(input);
        }
        if (element instanceof SelectOperation) {
            return input;
        }
        throw new IllegalStateException("Unknown pipeline element " + element.getClass().getSimpleName());
    }

    // ---------------------------------------------------------------------
    // spanset expressions: one spanset in, one (possibly empty) out
    // ---------------------------------------------------------------------

    private Spanset spansetExpression(SpansetExpression expression, Spanset input) {
        if (expression instanceof SpansetFilter filter) {
            return filter(filter, input);
        }
        if (expression instanceof SpansetOperation operation) {
            return operation(operation, input);
        }
        List<Spanset> results = pipeline((Pipeline) expression, List.of(input));
        return results.size() == 1 ? results.get(0) : union(input, results);
    }

    private Spanset filter(SpansetFilter filter, Spanset input) {
        int[] candidates = input.rawIndexes();
        int[] kept = new int[candidates.length];
        int n = 0;
        for (int index : candidates) {
            if (fields.matches(filter.expression(), input.tree(), index)) {
                kept[n++] = index;
            }
        }
        return input.withIndexes(n == kept.length ? kept : Arrays.copyOf(kept, n));
    }

    private Spanset operation(SpansetOperation operation, Spanset input) {
        Spanset lhs = spansetExpression(operation.lhs(), input);
        Spanset rhs = spansetExpression(operation.rhs(), input);
        SpansetOperator op = operation.op();
        if (op == SpansetOperator.AND) {
            return lhs.isEmpty() || rhs.isEmpty() ? input.withIndexes(new int[0]) : union(input, List.of(lhs, rhs));
        }
        if (op == SpansetOperator.OR) {
            return union(input, List.of(lhs, rhs));
        }
        if (lhs.isEmpty() || rhs.isEmpty()) {
            return input.withIndexes(new int[0]);
        }

        SpanTree tree = input.tree();
        boolean[] left = mask(tree, lhs);
        boolean[] right = mask(tree, rhs);
        boolean[] rightRelated;
        boolean[] leftRelated;
        switch (op.relation()) {
            case DESCENDANT -> {
                rightRelated = tree.descendantsOf(left);
                leftRelated = tree.ancestorsOf(right);
            }
            case ANCESTOR -> {
                rightRelated = tree.ancestorsOf(left);
                leftRelated = tree.descendantsOf(right);
            }
            case CHILD -> {
                rightRelated = tree.childrenOf(left);
                leftRelated = tree.parentsOf(right);
            }
            case PARENT -> {
                rightRelated = tree.parentsOf(left);
                leftRelated = tree.childrenOf(right);
            }
            case SIBLING -> {
                rightRelated = tree.siblingsOf(left);
                leftRelated = tree.siblingsOf(right);
            }
            default -> throw new IllegalStateException("Not a structural operator: " + op);
        }

        boolean[] selected = new boolean[tree.size()];
        for (int i = 0; i < selected.length; i++) {
            if (op.isNegated()) {
                selected[i] = right[i] && !rightRelated[i];
            } else {
                selected[i] = right[i] && rightRelated[i];
            }
        }
        if (op.isUnion()) {
            boolean anyRight = false;
            for (int i = 0; i < selected.length; i++) {
                anyRight |= selected[i];
            }
            // left-hand spans only count when some right-hand partner survived
            if (anyRight) {
                for (int i = 0; i < selected.length; i++) {
                    selected[i] |= left[i] && leftRelated[i];
                }
            }
        }
        return input.withIndexes(indexes(selected))
                .withAttributes(Spanset.merge(lhs.attributes(), rhs.attributes()));
    }

    private static boolean[] mask(SpanTree tree, Spanset spanset) {
        boolean[] mask = new boolean[tree.size()];
        for (int index : spanset.rawIndexes()) {
            mask[index] = true;
        }
        return mask;
    }

    private static int[] indexes(boolean[] mask) {
        int n = 0;
        for (boolean b : mask) {
            if (b) n++;
        }
        int[] out = new int[n];
        int k = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) out[k++] = i;
        }
        return out;
    }

    /** Spans present in any of the parts, in trace order, with all of their attributes. */
    private static Spanset union(Spanset base, List<Spanset> parts) {
        boolean[] mask = new boolean[base.tree().size()];
        List<SpansetAttribute> attributes = base.attributes();
        for (Spanset part : parts) {
            for (int index : part.rawIndexes()) {
                mask[index] = true;
            }
            attributes = Spanset.merge(attributes, part.attributes());
        }
        return new Spanset(base.tree(), indexes(mask), base.scalar(), attributes);
    }

    // ---------------------------------------------------------------------
    // aggregates, grouping, coalesce
    // ---------------------------------------------------------------------

    private List<Spanset> scalarFilter(ScalarFilter filter, List<Spanset> input) {
        List<Spanset> out = new ArrayList<>();
        String name = filter.aggregate().toString();
        for (Spanset spanset : input) {
            Static value = aggregate(filter.aggregate(), spanset);
            if (value.compare(filter.op(), filter.value())) {
                out.add(spanset.withScalar(value, name));
            }
        }
        return out;
    }

    Static aggregate(Aggregate aggregate, Spanset spanset) {
        if (aggregate.op() == AggregateOp.COUNT) {
            return Static.ofInt(spanset.size());
        }
        List<Static> values = new ArrayList<>(spanset.size());
        for (int index : spanset.rawIndexes()) {
            Static value = fields.evaluate(aggregate.expression(), SpanBinding.of(spanset.tree(), index));
            if (value.isNumeric()) {
                values.add(value);
            }
        }
        if (values.isEmpty()) {
            return Static.NIL;
        }
        boolean allInt = values.stream().allMatch(v -> v.type() == StaticType.INT);
        boolean allDuration = values.stream().allMatch(v -> v.type() == StaticType.DURATION);
        switch (aggregate.op()) {
            case MIN, MAX -> {
                Static best = values.get(0);
                for (Static value : values) {
                    double cmp = Double.compare(value.asDouble(), best.asDouble());
                    if (aggregate.op() == AggregateOp.MIN ? cmp < 0 : cmp > 0) {
                        best = value;
                    }
                }
                return best;
            }
            case SUM -> {
                if (allInt || allDuration) {
                    long sum = 0;
                    for (Static value : values) {
                        sum += value.asLong();
                    }
                    return allInt ? Static.ofInt(sum) : Static.ofDuration(sum);
                }
                double sum = 0;
                for (Static value : values) {
                    sum += value.asDouble();
                }
                return Static.ofFloat(sum);
            }
            case AVG -> {
                double sum = 0;
                for (Static value : values) {
                    sum += value.asDouble();
                }
                double avg = sum / values.size();
                return allDuration ? Static.ofDuration(Math.round(avg)) : Static.ofFloat(avg);
            }
            default -> throw new IllegalStateException("Unsupported aggregate " + aggregate.op());
        }
    }

    private List<Spanset> group(GroupOperation group, List<Spanset> input) {
        List<Spanset> out = new ArrayList<>();
        for (Spanset spanset : input) {
            Map<List<Static>, List<Integer>> partitions = new LinkedHashMap<>();
            for (int index : spanset.rawIndexes()) {
                List<Static> key = new ArrayList<>(group.by().size());
                for (FieldExpression field : group.by()) {
                    key.add(fields.evaluate(field, SpanBinding.of(spanset.tree(), index)));
                }
                partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(index);
            }
            partitions.forEach((key, members) -> {
                List<SpansetAttribute> attributes = new ArrayList<>(key.size());
                for (int i = 0; i < key.size(); i++) {
                    attributes.add(new SpansetAttribute("by(" + group.by().get(i) + ")", key.get(i)));
                }
                int[] indexes = members.stream().mapToInt(Integer::intValue).toArray();
                out.add(spanset.withIndexes(indexes).withAttributes(attributes));
            });
        }
        return out;
    }

    private static List<Spanset> coalesce(List<Spanset> input) {
        if (input.isEmpty()) {
            return input;
        }
        Spanset first = input.get(0);
        boolean[] mask = new boolean[first.tree().size()];
        for (Spanset spanset : input) {
            for (int index : spanset.rawIndexes()) {
                mask[index] = true;
            }
        }
        return List.of(new Spanset(first.tree(), indexes(mask), Static.NIL, List.of()));
    }
}
