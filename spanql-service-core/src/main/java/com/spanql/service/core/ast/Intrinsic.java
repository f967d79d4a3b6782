package com.spanql.service.core.ast;

import java.util.Optional;

/**
 * Built-in span, trace, event, link and instrumentation fields. Each has a scoped spelling
 * ({@code span:duration}) and some keep their older unscoped spelling ({@code duration}).
 */
public enum Intrinsic {
    NONE(null, null, null, StaticType.ATTRIBUTE),
    DURATION(Scope.SPAN, "duration", "duration", StaticType.DURATION),
    NAME(Scope.SPAN, "name", "name", StaticType.STRING),
    STATUS(Scope.SPAN, "status", "status", StaticType.STATUS),
    STATUS_MESSAGE(Scope.SPAN, "statusMessage", "statusMessage", StaticType.STRING),
    KIND(Scope.SPAN, "kind", "kind", StaticType.KIND),
    CHILD_COUNT(Scope.SPAN, "childCount", "childCount", StaticType.INT),
    SPAN_ID(Scope.SPAN, "id", null, StaticType.STRING),
    PARENT_ID(Scope.SPAN, "parentID", null, StaticType.STRING),
    PARENT(null, null, "parent", StaticType.STRING),
    TRACE_DURATION(Scope.TRACE, "duration", "traceDuration", StaticType.DURATION),
    TRACE_ROOT_SPAN(Scope.TRACE, "rootName", "rootName", StaticType.STRING),
    TRACE_ROOT_SERVICE(Scope.TRACE, "rootService", "rootServiceName", StaticType.STRING),
    TRACE_ID(Scope.TRACE, "id", null, StaticType.STRING),
    EVENT_NAME(Scope.EVENT, "name", null, StaticType.STRING),
    EVENT_TIME_SINCE_START(Scope.EVENT, "timeSinceStart", null, StaticType.DURATION),
    LINK_TRACE_ID(Scope.LINK, "traceID", null, StaticType.STRING),
    LINK_SPAN_ID(Scope.LINK, "spanID", null, StaticType.STRING),
    INSTRUMENTATION_NAME(Scope.INSTRUMENTATION, "name", null, StaticType.STRING),
    INSTRUMENTATION_VERSION(Scope.INSTRUMENTATION, "version", null, StaticType.STRING);

    private final Scope scope;
    private final String scopedName;
    private final String legacyName;
    private final StaticType type;

    Intrinsic(Scope scope, String scopedName, String legacyName, StaticType type) {
        this.scope = scope;
        this.scopedName = scopedName;
        this.legacyName = legacyName;
        this.type = type;
    }

    /** Scope the intrinsic belongs to; null for the unscoped-only {@code parent}. */
    public Scope scope() {
        return scope;
    }

    public String scopedName() {
        return scopedName;
    }

    public String legacyName() {
        return legacyName;
    }

    public StaticType type() {
        return type;
    }

    public static Optional<Intrinsic> scoped(Scope scope, String name) {
        for (Intrinsic intrinsic : values()) {
            if (intrinsic.scope == scope && name.equals(intrinsic.scopedName)) {
                return Optional.of(intrinsic);
            }
        }
        return Optional.empty();
    }

    public static Optional<Intrinsic> legacy(String name) {
        for (Intrinsic intrinsic : values()) {
            if (name.equals(intrinsic.legacyName)) {
                return Optional.of(intrinsic);
            }
        }
        return Optional.empty();
    }
}
