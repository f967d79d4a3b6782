package com.spanql.service.core.parser;

/** Well-formed query text that names something unknown or combines things that cannot go together. */
public class SemanticException extends QueryException {

    public SemanticException(int offset, String message) {
        super("invalid query at offset %d: %s".formatted(offset, message), offset);
    }
}
