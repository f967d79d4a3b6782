package com.spanql.service.core.ast;

import java.util.Optional;

public enum Scope {
    NONE(""),
    SPAN("span"),
    RESOURCE("resource"),
    EVENT("event"),
    LINK("link"),
    INSTRUMENTATION("instrumentation"),
    TRACE("trace");

    private final String keyword;

    Scope(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Scope> fromKeyword(String keyword) {
        for (Scope scope : values()) {
            if (scope != NONE && scope.keyword.equals(keyword)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
