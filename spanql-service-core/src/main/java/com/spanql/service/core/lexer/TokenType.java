package com.spanql.service.core.lexer;

public enum TokenType {
    LBRACE("{"),
    RBRACE("}"),
    LPAREN("("),
    RPAREN(")"),
    COMMA(","),
    COLON(":"),
    DOT("."),
    PIPE("|"),
    IDENT("identifier"),
    SCOPE("scope"),
    PATH("attribute"),
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    DURATION("duration"),
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
    DESCENDANT(">>"),
    ANCESTOR("<<"),
    TILDE("~"),
    NOT_DESCENDANT("!>>"),
    NOT_ANCESTOR("!<<"),
    NOT_CHILD("!>"),
    NOT_PARENT("!<"),
    UNION_DESCENDANT("&>>"),
    UNION_ANCESTOR("&<<"),
    UNION_CHILD("&>"),
    UNION_PARENT("&<"),
    UNION_SIBLING("&~"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    CARET("^"),
    EOF("end of query");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
