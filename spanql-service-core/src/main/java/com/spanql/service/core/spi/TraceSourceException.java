package com.spanql.service.core.spi;

/** Failure of a trace source; a search that hits one fails with it. */
public class TraceSourceException extends RuntimeException {

    public TraceSourceException(String message) {
        super(message);
    }

    public TraceSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
