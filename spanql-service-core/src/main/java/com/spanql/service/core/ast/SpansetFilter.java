package com.spanql.service.core.ast;

/** {@code { expression }}; an empty pair of braces holds {@code true}. */
public record SpansetFilter(FieldExpression expression) implements SpansetExpression {

    public static SpansetFilter matchAll() {
        return new SpansetFilter(Static.TRUE);
    }

    @Override
    public String toString() {
        return "{ " + expression + " }";
    }
}
