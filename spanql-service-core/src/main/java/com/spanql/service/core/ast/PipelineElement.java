package com.spanql.service.core.ast;

/** One stage of a pipeline; stages are separated by {@code |}. */
public sealed interface PipelineElement
        permits SpansetExpression, ScalarFilter, GroupOperation, CoalesceOperation, SelectOperation {}
