package com.spanql.service.core.parser;

public class SyntaxException extends QueryException {
    private final String expected;
    private final String found;

    public SyntaxException(int offset, String expected, String found) {
        super("syntax error at offset %d: expected %s, found %s".formatted(offset, expected, found), offset);
        this.expected = expected;
        this.found = found;
    }

    public SyntaxException(int offset, String message) {
        super("syntax error at offset %d: %s".formatted(offset, message), offset);
        this.expected = null;
        this.found = null;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
