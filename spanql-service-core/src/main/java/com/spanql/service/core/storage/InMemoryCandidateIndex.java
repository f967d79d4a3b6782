package com.spanql.service.core.storage;

import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.conditions.Condition;
import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.eval.FieldEvaluator;
import com.spanql.service.core.eval.SpanTree;
import com.spanql.service.core.spi.CandidateIndex;
import com.spanql.telemetry.model.Trace;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;

/**
 * Candidate index over an {@link InMemoryTraceSource} that checks the flattened conditions span by span.
 * Regexes are matched unanchored and {@code !~} only requires the attribute to be present, which keeps the
 * answer a superset of what the evaluator accepts.
 */
@Slf4j
public class InMemoryCandidateIndex implements CandidateIndex {
    private final InMemoryTraceSource source;

    public InMemoryCandidateIndex(InMemoryTraceSource source) {
        this.source = source;
    }

    @Override
    public Optional<Set<String>> candidates(FetchSpansRequest request) {
        if (request.unconstrained() || request.conditions().isEmpty()) {
            return Optional.empty();
        }
        Set<String> ids = new HashSet<>();
        for (Trace trace : source.traces()) {
            if (request.overlaps(trace.getStartEpochNanos()) && mayMatch(trace, request)) {
                ids.add(trace.getTraceId());
            }
        }
        return Optional.of(ids);
    }

    private static boolean mayMatch(Trace trace, FetchSpansRequest request) {
        SpanTree tree = SpanTree.build(trace);
        if (tree.isCorrupt()) {
            // let the evaluator skip and count it
            return true;
        }
        for (int span = 0; span < tree.size(); span++) {
            if (request.allConditions() ? allHold(request.conditions(), tree, span) : anyHolds(request.conditions(), tree, span)) {
                return true;
            }
        }
        return false;
    }

    private static boolean allHold(List<Condition> conditions, SpanTree tree, int span) {
        for (Condition condition : conditions) {
            if (!holds(condition, tree, span)) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyHolds(List<Condition> conditions, SpanTree tree, int span) {
        for (Condition condition : conditions) {
            if (holds(condition, tree, span)) {
                return true;
            }
        }
        return false;
    }

    static boolean holds(Condition condition, SpanTree tree, int span) {
        List<Static> values = FieldEvaluator.resolveAll(condition.attribute(), tree, span);
        if (values.isEmpty()) {
            return false;
        }
        Operator op = condition.op();
        if (op == Operator.EXISTS || op == Operator.NOT_REGEX) {
            return true;
        }
        if (op == Operator.REGEX) {
            Pattern pattern = compile(condition.operand());
            return pattern == null || values.stream().anyMatch(v -> v.matches(pattern));
        }
        return values.stream().anyMatch(v -> v.compare(op, condition.operand()));
    }

    private static Pattern compile(Static operand) {
        String source = operand.asString();
        if (source == null) {
            return null;
        }
        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            log.debug("Not pruning on regex '{}': {}", source, e.getDescription());
            return null;
        }
    }
}
