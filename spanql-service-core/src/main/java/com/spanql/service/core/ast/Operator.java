package com.spanql.service.core.ast;

/** Operators of field expressions (inside a pair of braces). */
public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^"),
    EQ("="),
    NEQ("!="),
    REGEX("=~"),
    NOT_REGEX("!~"),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    AND("&&"),
    OR("||"),
    NOT("!"),
    NEG("-"),
    EXISTS("!= nil"),
    NOT_EXISTS("= nil");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return switch (this) {
            case ADD, SUB, MUL, DIV, MOD, POW -> true;
            default -> false;
        };
    }

    /** Comparison operators, regex matches included. */
    public boolean isComparison() {
        return switch (this) {
            case EQ, NEQ, REGEX, NOT_REGEX, GT, GTE, LT, LTE -> true;
            default -> false;
        };
    }

    public boolean isOrdering() {
        return switch (this) {
            case GT, GTE, LT, LTE -> true;
            default -> false;
        };
    }

    public boolean isRegex() {
        return this == REGEX || this == NOT_REGEX;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /** The operator that gives the same result with operands swapped; null for regex matches. */
    public Operator flip() {
        return switch (this) {
            case GT -> LT;
            case GTE -> LTE;
            case LT -> GT;
            case LTE -> GTE;
            case EQ, NEQ -> this;
            default -> null;
        };
    }

    /** Applies an ordering or equality operator to a three-way comparison result. */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NEQ -> comparison != 0;
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
            default -> false;
        };
    }
}
