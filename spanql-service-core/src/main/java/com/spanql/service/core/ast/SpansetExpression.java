package com.spanql.service.core.ast;

/** Stage that selects spans: a filter, a combination of spanset expressions, or a parenthesised pipeline. */
public sealed interface SpansetExpression extends PipelineElement permits SpansetFilter, SpansetOperation, Pipeline {}
