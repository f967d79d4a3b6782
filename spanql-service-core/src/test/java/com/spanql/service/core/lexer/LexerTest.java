package com.spanql.service.core.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spanql.service.core.parser.SyntaxException;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {

    private static List<TokenType> types(String query) {
        return Lexer.tokenize(query).stream().map(Token::type).toList();
    }

    @Test
    void scopeKeywordBeforeDotStartsScopedPath() {
        List<Token> tokens = Lexer.tokenize("{ resource.service.name = \"api\" }");

        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(
                        TokenType.LBRACE,
                        TokenType.SCOPE,
                        TokenType.PATH,
                        TokenType.EQ,
                        TokenType.STRING,
                        TokenType.RBRACE,
                        TokenType.EOF);
        assertThat(tokens.get(1).text()).isEqualTo("resource");
        assertThat(tokens.get(2).text()).isEqualTo("service.name");
        assertThat(tokens.get(4).text()).isEqualTo("api");
    }

    @Test
    void scopeWordWithoutDotIsPlainIdentifier() {
        assertThat(types("span")).containsExactly(TokenType.IDENT, TokenType.EOF);
        assertThat(types("span:duration"))
                .containsExactly(TokenType.SCOPE, TokenType.COLON, TokenType.IDENT, TokenType.EOF);
    }

    @Test
    void quotedPathSegmentsKeepSpacesAndEscapes() {
        List<Token> tokens = Lexer.tokenize("span.\"http status\".\"a\\\"b\"");

        assertThat(tokens.get(1).type()).isEqualTo(TokenType.PATH);
        assertThat(tokens.get(1).text()).isEqualTo("http status.a\"b");
    }

    @Test
    void invalidEscapeInQuotedPathIsRejected() {
        assertThatThrownBy(() -> Lexer.tokenize(".\"a\\nb\""))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("invalid escape sequence in attribute name");
    }

    @Test
    void numbersFloatsAndDurations() {
        assertThat(types("12 1.5 .5 1. 150ms 1h30m 10µs"))
                .containsExactly(
                        TokenType.INTEGER,
                        TokenType.FLOAT,
                        TokenType.FLOAT,
                        TokenType.FLOAT,
                        TokenType.DURATION,
                        TokenType.DURATION,
                        TokenType.DURATION,
                        TokenType.EOF);
    }

    @Test
    void durationTextParsesToNanos() {
        assertThat(DurationLiteral.parseNanos("150ms")).isEqualTo(150_000_000L);
        assertThat(DurationLiteral.parseNanos("1h30m")).isEqualTo(5_400_000_000_000L);
        assertThat(DurationLiteral.parseNanos("1.5s")).isEqualTo(1_500_000_000L);
        assertThat(DurationLiteral.parseNanos("10µs")).isEqualTo(10_000L);
        assertThat(DurationLiteral.parseNanos("3ns")).isEqualTo(3L);
    }

    @Test
    void numberFollowedByLettersIsAnError() {
        assertThatThrownBy(() -> Lexer.tokenize("{ .a = 3x }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo("number");
                    assertThat(e.getOffset()).isEqualTo(7);
                });
    }

    @Test
    void longestOperatorWins() {
        assertThat(types("!>> >> > &~ !~ =~ >= &>> !<"))
                .containsExactly(
                        TokenType.NOT_DESCENDANT,
                        TokenType.DESCENDANT,
                        TokenType.GT,
                        TokenType.UNION_SIBLING,
                        TokenType.NOT_REGEX,
                        TokenType.REGEX,
                        TokenType.GTE,
                        TokenType.UNION_DESCENDANT,
                        TokenType.NOT_PARENT,
                        TokenType.EOF);
    }

    @Test
    void stringEscapesAndRawStrings() {
        List<Token> tokens = Lexer.tokenize("\"a\\\"b\\n\" `c\\d`");

        assertThat(tokens.get(0).text()).isEqualTo("a\"b\n");
        assertThat(tokens.get(1).text()).isEqualTo("c\\d");
    }

    @Test
    void unterminatedStringReportsItsStart() {
        assertThatThrownBy(() -> Lexer.tokenize("{ .a = \"abc }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> assertThat(e.getOffset())
                        .isEqualTo(7));
    }

    @Test
    void illegalCharacterIsRejected() {
        assertThatThrownBy(() -> Lexer.tokenize("{ .a = # }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("illegal character '#'");
    }

    @Test
    void offsetsAreUtf8Bytes() {
        assertThat(Lexer.byteOffset("é{", 1)).isEqualTo(2);
        assertThatThrownBy(() -> Lexer.tokenize("{ .é = # }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> assertThat(e.getOffset())
                        .isEqualTo(8));
    }
}
