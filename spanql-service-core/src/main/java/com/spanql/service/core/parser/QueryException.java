package com.spanql.service.core.parser;

/** A query that cannot be run. Raised before any trace is read. */
public abstract class QueryException extends IllegalArgumentException {
    private final int offset;

    protected QueryException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** Byte offset into the UTF-8 encoded query text. */
    public int getOffset() {
        return offset;
    }
}
