package com.spanql.service.core.ast;

/**
 * Operators between spanset expressions. Structural operators read "left op right" and return matches from
 * the right-hand side: {@code {a} >> {b}} returns the b spans that descend from some a span.
 */
public enum SpansetOperator {
    AND("&&"),
    OR("||"),
    DESCENDANT(">>"),
    ANCESTOR("<<"),
    CHILD(">"),
    PARENT("<"),
    SIBLING("~"),
    NOT_DESCENDANT("!>>"),
    NOT_ANCESTOR("!<<"),
    NOT_CHILD("!>"),
    NOT_PARENT("!<"),
    NOT_SIBLING("!~"),
    UNION_DESCENDANT("&>>"),
    UNION_ANCESTOR("&<<"),
    UNION_CHILD("&>"),
    UNION_PARENT("&<"),
    UNION_SIBLING("&~");

    private final String symbol;

    SpansetOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isStructural() {
        return this != AND && this != OR;
    }

    public boolean isNegated() {
        return switch (this) {
            case NOT_DESCENDANT, NOT_ANCESTOR, NOT_CHILD, NOT_PARENT, NOT_SIBLING -> true;
            default -> false;
        };
    }

    public boolean isUnion() {
        return switch (this) {
            case UNION_DESCENDANT, UNION_ANCESTOR, UNION_CHILD, UNION_PARENT, UNION_SIBLING -> true;
            default -> false;
        };
    }

    /** The plain relation behind a negated or union variant. */
    public SpansetOperator relation() {
        return switch (this) {
            case NOT_DESCENDANT, UNION_DESCENDANT -> DESCENDANT;
            case NOT_ANCESTOR, UNION_ANCESTOR -> ANCESTOR;
            case NOT_CHILD, UNION_CHILD -> CHILD;
            case NOT_PARENT, UNION_PARENT -> PARENT;
            case NOT_SIBLING, UNION_SIBLING -> SIBLING;
            default -> this;
        };
    }
}
