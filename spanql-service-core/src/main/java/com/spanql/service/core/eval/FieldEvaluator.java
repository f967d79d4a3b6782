package com.spanql.service.core.eval;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.BinaryOperation;
import com.spanql.service.core.ast.Expressions;
import com.spanql.service.core.ast.FieldExpression;
import com.spanql.service.core.ast.Hints;
import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.ast.Scope;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.ast.StaticType;
import com.spanql.service.core.ast.UnaryOperation;
import com.spanql.telemetry.model.AttributeMap;
import com.spanql.telemetry.model.InstrumentationScope;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.SpanEvent;
import com.spanql.telemetry.model.SpanLink;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates field expressions against one span. Regexes that are literals in the query are compiled once, up
 * front; the instance is read-only afterwards and shared by all worker threads.
 */
@Slf4j
public final class FieldEvaluator {
    private static final int USES_EVENT = 1;
    private static final int USES_LINK = 2;

    private final boolean anchorRegex;
    private final Map<String, Pattern> patterns;
    private final Map<FieldExpression, Integer> bindingScopes;

    public FieldEvaluator(RootExpr root) {
        this.anchorRegex = root.hints().getBoolean(Hints.ANCHOR_REGEX, true);
        Map<String, Pattern> compiled = new HashMap<>();
        Map<FieldExpression, Integer> scopes = new IdentityHashMap<>();
        for (FieldExpression expression : Expressions.fieldExpressions(root)) {
            scopes.put(expression, bindingScopes(expression));
            Expressions.forEachNode(expression, node -> {
                if (node instanceof BinaryOperation b && b.op().isRegex() && b.rhs() instanceof Static s) {
                    String pattern = s.asString();
                    if (pattern != null) {
                        compiled.computeIfAbsent(pattern, this::compile);
                    }
                }
            });
        }
        this.patterns = Collections.unmodifiableMap(compiled);
        this.bindingScopes = Collections.unmodifiableMap(scopes);
    }

    /**
     * True when the expression holds for the span. Expressions that read events or links are tried once per
     * event/link of the span and hold if any binding does; a span without events or links is tried once with
     * nothing bound.
     */
    public boolean matches(FieldExpression expression, SpanTree tree, int span) {
        if (expression == Static.TRUE) {
            return true;
        }
        int scopes = bindingScopes.getOrDefault(expression, -1);
        if (scopes < 0) {
            scopes = bindingScopes(expression);
        }
        Span s = tree.span(span);
        List<SpanEvent> events = (scopes & USES_EVENT) != 0 && !s.getEvents().isEmpty()
                ? s.getEvents()
                : Collections.singletonList(null);
        List<SpanLink> links = (scopes & USES_LINK) != 0 && !s.getLinks().isEmpty()
                ? s.getLinks()
                : Collections.singletonList(null);
        for (SpanEvent event : events) {
            for (SpanLink link : links) {
                if (evaluate(expression, new SpanBinding(tree, span, event, link)).isTrue()) {
                    return true;
                }
            }
        }
        return false;
    }

    public Static evaluate(FieldExpression expression, SpanBinding binding) {
        if (expression instanceof Static s) {
            return s;
        }
        if (expression instanceof Attribute attribute) {
            return resolve(attribute, binding);
        }
        if (expression instanceof UnaryOperation unary) {
            Static value = evaluate(unary.expression(), binding);
            return switch (unary.op()) {
                case NOT -> value.type() == StaticType.BOOLEAN ? Static.ofBool(!value.isTrue()) : Static.NIL;
                case NEG -> value.negate();
                case EXISTS -> Static.ofBool(!value.isNil());
                case NOT_EXISTS -> Static.ofBool(value.isNil());
                default -> Static.NIL;
            };
        }
        BinaryOperation binary = (BinaryOperation) expression;
        Operator op = binary.op();
        if (op == Operator.AND) {
            return Static.ofBool(
                    evaluate(binary.lhs(), binding).isTrue() && evaluate(binary.rhs(), binding).isTrue());
        }
        if (op == Operator.OR) {
            return Static.ofBool(
                    evaluate(binary.lhs(), binding).isTrue() || evaluate(binary.rhs(), binding).isTrue());
        }
        Static lhs = evaluate(binary.lhs(), binding);
        Static rhs = evaluate(binary.rhs(), binding);
        if (op.isRegex()) {
            Pattern pattern = pattern(rhs);
            if (pattern == null) {
                return Static.FALSE;
            }
            return Static.ofBool(op == Operator.REGEX ? lhs.matches(pattern) : lhs.notMatches(pattern));
        }
        if (op.isArithmetic()) {
            return lhs.arithmetic(op, rhs);
        }
        return Static.ofBool(lhs.compare(op, rhs));
    }

    private Pattern pattern(Static value) {
        String source = value.asString();
        if (source == null) {
            return null;
        }
        Pattern precompiled = patterns.get(source);
        return precompiled != null ? precompiled : compile(source);
    }

    private Pattern compile(String source) {
        try {
            return Pattern.compile(anchorRegex ? "^(?:" + source + ")$" : source);
        } catch (PatternSyntaxException e) {
            log.debug("Regex '{}' does not compile, comparison evaluates to false: {}", source, e.getDescription());
            return null;
        }
    }

    private static int bindingScopes(FieldExpression expression) {
        int scopes = 0;
        if (Expressions.referencesScope(expression, Scope.EVENT)) scopes |= USES_EVENT;
        if (Expressions.referencesScope(expression, Scope.LINK)) scopes |= USES_LINK;
        return scopes;
    }

    // ---------------------------------------------------------------------
    // references
    // ---------------------------------------------------------------------

    /** Value of an attribute or intrinsic for the bound span; nil when absent. */
    public static Static resolve(Attribute attribute, SpanBinding binding) {
        SpanTree tree = binding.tree();
        int index = binding.span();
        if (attribute.parent()) {
            index = tree.parent(index);
            if (index < 0) {
                return Static.NIL;
            }
        }
        Span span = tree.span(index);
        if (attribute.isIntrinsic()) {
            return intrinsic(attribute, tree, index, binding);
        }
        String name = attribute.name();
        return switch (attribute.scope()) {
            case NONE -> {
                Object value = span.getAttributes().lookup(name);
                if (value == null) {
                    value = span.getResource().getAttributes().lookup(name);
                }
                yield Static.of(value);
            }
            case SPAN -> Static.of(span.getAttributes().lookup(name));
            case RESOURCE -> Static.of(span.getResource().getAttributes().lookup(name));
            case EVENT -> binding.event() == null ? Static.NIL : lookup(binding.event().getAttributes(), name);
            case LINK -> binding.link() == null ? Static.NIL : lookup(binding.link().getAttributes(), name);
            case INSTRUMENTATION -> span.getScope() == null ? Static.NIL : lookup(span.getScope().getAttributes(), name);
            case TRACE -> Static.NIL;
        };
    }

    /**
     * Values of the reference under every event or link binding of the span (a single value for references
     * that read neither). Nil values are left out.
     */
    public static List<Static> resolveAll(Attribute attribute, SpanTree tree, int span) {
        Span s = tree.span(span);
        List<Static> values = new ArrayList<>();
        Scope scope = attribute.effectiveScope();
        if (scope == Scope.EVENT && !attribute.parent()) {
            for (SpanEvent event : s.getEvents()) {
                addIfPresent(values, resolve(attribute, new SpanBinding(tree, span, event, null)));
            }
        } else if (scope == Scope.LINK && !attribute.parent()) {
            for (SpanLink link : s.getLinks()) {
                addIfPresent(values, resolve(attribute, new SpanBinding(tree, span, null, link)));
            }
        } else {
            addIfPresent(values, resolve(attribute, SpanBinding.of(tree, span)));
        }
        return values;
    }

    private static void addIfPresent(List<Static> values, Static value) {
        if (!value.isNil()) {
            values.add(value);
        }
    }

    private static Static lookup(AttributeMap attributes, String name) {
        return Static.of(attributes.lookup(name));
    }

    private static Static intrinsic(Attribute attribute, SpanTree tree, int index, SpanBinding binding) {
        Span span = tree.span(index);
        Trace trace = tree.trace();
        SpanEvent event = binding.event();
        SpanLink link = binding.link();
        InstrumentationScope scope = span.getScope();
        return switch (attribute.intrinsic()) {
            case NONE -> Static.NIL;
            case DURATION -> Static.ofDuration(span.getDurationNanos());
            case NAME -> Static.ofString(span.getName());
            case STATUS -> Static.ofStatus(span.getStatus().getCode());
            case STATUS_MESSAGE -> Static.ofString(span.getStatus().getMessage());
            case KIND -> Static.ofKind(span.getKind());
            case CHILD_COUNT -> Static.ofInt(tree.childCount(index));
            case SPAN_ID -> Static.ofString(span.getSpanId());
            case PARENT_ID, PARENT -> Static.ofString(span.getParentSpanId());
            case TRACE_DURATION -> Static.ofDuration(trace.getDurationNanos());
            case TRACE_ROOT_SPAN -> Static.ofString(trace.getRootSpanName());
            case TRACE_ROOT_SERVICE -> Static.ofString(trace.getRootServiceName());
            case TRACE_ID -> Static.ofString(trace.getTraceId());
            case EVENT_NAME -> event == null ? Static.NIL : Static.ofString(event.getName());
            case EVENT_TIME_SINCE_START -> event == null ? Static.NIL : Static.ofDuration(event.getTimeSinceStartNanos());
            case LINK_TRACE_ID -> link == null ? Static.NIL : Static.ofString(link.getTraceId());
            case LINK_SPAN_ID -> link == null ? Static.NIL : Static.ofString(link.getSpanId());
            case INSTRUMENTATION_NAME -> scope == null ? Static.NIL : Static.ofString(scope.getName());
            case INSTRUMENTATION_VERSION -> scope == null ? Static.NIL : Static.ofString(scope.getVersion());
        };
    }
}
