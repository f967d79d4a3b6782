package com.spanql.service.core.lexer;

/**
 * A lexed token. {@code text} holds the decoded value for strings and attribute paths and the source text
 * otherwise; {@code offset} is the char index of the token start and {@code end} the index just past it.
 */
public record Token(TokenType type, String text, int offset, int end) {

    public String describe() {
        return switch (type) {
            case EOF -> "end of query";
            case STRING -> "string \"" + text + "\"";
            case PATH -> "attribute ." + text;
            case IDENT, SCOPE, INTEGER, FLOAT, DURATION -> "'" + text + "'";
            default -> "'" + type.display() + "'";
        };
    }
}
