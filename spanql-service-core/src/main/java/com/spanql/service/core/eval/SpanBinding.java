package com.spanql.service.core.eval;

import com.spanql.telemetry.model.SpanEvent;
import com.spanql.telemetry.model.SpanLink;

/** The span under evaluation plus the event and link that event- and link-scoped references read, if any. */
public record SpanBinding(SpanTree tree, int span, SpanEvent event, SpanLink link) {

    public static SpanBinding of(SpanTree tree, int span) {
        return new SpanBinding(tree, span, null, null);
    }
}
