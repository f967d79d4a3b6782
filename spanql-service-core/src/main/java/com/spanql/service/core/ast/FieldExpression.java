package com.spanql.service.core.ast;

/** Expression evaluated against a single span (and, where referenced, one of its events or links). */
public sealed interface FieldExpression permits Static, Attribute, BinaryOperation, UnaryOperation {

    /** Type known at parse time, or {@link StaticType#ATTRIBUTE} when it depends on span data. */
    StaticType impliedType();

    /** True when evaluation reads span data; expressions without references are folded by the parser. */
    boolean referencesSpan();
}
