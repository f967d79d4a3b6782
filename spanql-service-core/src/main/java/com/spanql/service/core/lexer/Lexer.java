package com.spanql.service.core.lexer;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.parser.SyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns query text into tokens. A scope keyword directly followed by {@code .} or {@code :} becomes a
 * {@link TokenType#SCOPE} token, and a dot followed by a path character or quote starts a single
 * {@link TokenType#PATH} token holding every segment of the attribute name.
 */
public final class Lexer {
    private static final Set<String> SCOPES =
            Set.of("span", "resource", "event", "link", "instrumentation", "trace", "parent");

    private static final String[] OPERATORS = {
        "!>>", "!<<", "&>>", "&<<", ">>", "<<", ">=", "<=", "!=", "=~", "!~", "&&", "||", "!>", "!<", "&>", "&<", "&~",
        "{", "}", "(", ")", ",", ":", "~", "!", "=", ">", "<", "|", "+", "-", "*", "/", "%", "^"
    };
    private static final TokenType[] OPERATOR_TYPES = {
        TokenType.NOT_DESCENDANT, TokenType.NOT_ANCESTOR, TokenType.UNION_DESCENDANT, TokenType.UNION_ANCESTOR,
        TokenType.DESCENDANT, TokenType.ANCESTOR, TokenType.GTE, TokenType.LTE, TokenType.NEQ, TokenType.REGEX,
        TokenType.NOT_REGEX, TokenType.AND, TokenType.OR, TokenType.NOT_CHILD, TokenType.NOT_PARENT,
        TokenType.UNION_CHILD, TokenType.UNION_PARENT, TokenType.UNION_SIBLING,
        TokenType.LBRACE, TokenType.RBRACE, TokenType.LPAREN, TokenType.RPAREN, TokenType.COMMA, TokenType.COLON,
        TokenType.TILDE, TokenType.NOT, TokenType.EQ, TokenType.GT, TokenType.LT, TokenType.PIPE, TokenType.PLUS,
        TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT, TokenType.CARET
    };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private Lexer(String src) {
        this.src = src;
    }

    public static List<Token> tokenize(String query) {
        Lexer lexer = new Lexer(query == null ? "" : query);
        lexer.run();
        return List.copyOf(lexer.tokens);
    }

    /** Converts a char index into the UTF-8 byte offset reported in errors. */
    public static int byteOffset(String source, int charIndex) {
        int end = Math.max(0, Math.min(charIndex, source.length()));
        return source.substring(0, end).getBytes(StandardCharsets.UTF_8).length;
    }

    private void run() {
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos, pos));
                return;
            }
            char c = src.charAt(pos);
            if (c == '"' || c == '`') {
                string();
            } else if (c == '.') {
                dot();
            } else if (isDigit(c)) {
                number();
            } else if (isIdentStart(c)) {
                identifier();
            } else {
                operator();
            }
        }
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private void identifier() {
        int start = pos;
        while (pos < src.length() && isIdentPart(src.charAt(pos))) {
            pos++;
        }
        String word = src.substring(start, pos);
        boolean scoped = pos < src.length() && (src.charAt(pos) == '.' || src.charAt(pos) == ':');
        TokenType type = scoped && SCOPES.contains(word) ? TokenType.SCOPE : TokenType.IDENT;
        tokens.add(new Token(type, word, start, pos));
    }

    private void dot() {
        boolean afterScope = !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.SCOPE;
        char next = pos + 1 < src.length() ? src.charAt(pos + 1) : 0;
        if (!afterScope && isDigit(next)) {
            number();
            return;
        }
        if (pos + 1 < src.length() && (next == '"' || Attribute.isPathChar(next))) {
            path();
            return;
        }
        if (afterScope) {
            throw error(pos + 1, "attribute name", pos + 1 < src.length() ? "'" + next + "'" : "end of query");
        }
        tokens.add(new Token(TokenType.DOT, ".", pos, pos + 1));
        pos++;
    }

    private void path() {
        int start = pos;
        StringBuilder name = new StringBuilder();
        while (pos < src.length() && src.charAt(pos) == '.' && pos + 1 < src.length()) {
            char next = src.charAt(pos + 1);
            if (next == '"') {
                if (name.length() > 0) name.append('.');
                pos++;
                name.append(quotedSegment());
            } else if (Attribute.isPathChar(next)) {
                if (name.length() > 0) name.append('.');
                pos++;
                while (pos < src.length() && Attribute.isPathChar(src.charAt(pos))) {
                    name.append(src.charAt(pos++));
                }
            } else {
                break;
            }
        }
        tokens.add(new Token(TokenType.PATH, name.toString(), start, pos));
    }

    /** Quoted attribute segment; only {@code \"} and {@code \\} escapes are valid. */
    private String quotedSegment() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                char escaped = pos + 1 < src.length() ? src.charAt(pos + 1) : 0;
                if (escaped != '"' && escaped != '\\') {
                    throw new SyntaxException(byteOffset(src, pos), "invalid escape sequence in attribute name");
                }
                sb.append(escaped);
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new SyntaxException(byteOffset(src, start), "unterminated quoted attribute name");
    }

    private void string() {
        int start = pos;
        char quote = src.charAt(pos++);
        StringBuilder sb = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == quote) {
                pos++;
                tokens.add(new Token(TokenType.STRING, sb.toString(), start, pos));
                return;
            }
            if (c == '\\' && quote == '"') {
                char escaped = pos + 1 < src.length() ? src.charAt(pos + 1) : 0;
                switch (escaped) {
                    case '"', '\\' -> sb.append(escaped);
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> throw new SyntaxException(byteOffset(src, pos), "invalid escape sequence in string");
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new SyntaxException(byteOffset(src, start), "unterminated string");
    }

    private void number() {
        int start = pos;
        boolean fraction = readDecimal();
        int unitLen = DurationLiteral.unitLength(src, pos);
        if (unitLen > 0) {
            pos += unitLen;
            while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) {
                readDecimal();
                int next = DurationLiteral.unitLength(src, pos);
                if (next == 0) {
                    throw error(pos, "duration unit", describeAt(pos));
                }
                pos += next;
            }
            ensureTerminated(start);
            tokens.add(new Token(TokenType.DURATION, src.substring(start, pos), start, pos));
            return;
        }
        ensureTerminated(start);
        tokens.add(new Token(fraction ? TokenType.FLOAT : TokenType.INTEGER, src.substring(start, pos), start, pos));
    }

    /** Reads {@code 12}, {@code 1.5}, {@code .5} or {@code 1.}; returns whether a decimal point was read. */
    private boolean readDecimal() {
        while (pos < src.length() && isDigit(src.charAt(pos))) {
            pos++;
        }
        if (pos < src.length() && src.charAt(pos) == '.') {
            char next = pos + 1 < src.length() ? src.charAt(pos + 1) : 0;
            if (isDigit(next) || !(next == '"' || Attribute.isPathChar(next)) || next == 0) {
                pos++;
                while (pos < src.length() && isDigit(src.charAt(pos))) {
                    pos++;
                }
                return true;
            }
        }
        return false;
    }

    private void ensureTerminated(int start) {
        if (pos < src.length() && isIdentPart(src.charAt(pos))) {
            throw error(start, "number", "'" + src.substring(start, pos + 1) + "'");
        }
    }

    private void operator() {
        for (int i = 0; i < OPERATORS.length; i++) {
            if (src.startsWith(OPERATORS[i], pos)) {
                int start = pos;
                pos += OPERATORS[i].length();
                tokens.add(new Token(OPERATOR_TYPES[i], OPERATORS[i], start, pos));
                return;
            }
        }
        throw new SyntaxException(byteOffset(src, pos), "illegal character '" + src.charAt(pos) + "'");
    }

    private String describeAt(int index) {
        return index < src.length() ? "'" + src.charAt(index) + "'" : "end of query";
    }

    private SyntaxException error(int index, String expected, String found) {
        return new SyntaxException(byteOffset(src, index), expected, found);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
