package com.spanql.service.core.parser;

import com.spanql.service.core.ast.Aggregate;
import com.spanql.service.core.ast.AggregateOp;
import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.BinaryOperation;
import com.spanql.service.core.ast.CoalesceOperation;
import com.spanql.service.core.ast.FieldExpression;
import com.spanql.service.core.ast.GroupOperation;
import com.spanql.service.core.ast.Hints;
import com.spanql.service.core.ast.Intrinsic;
import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.Pipeline;
import com.spanql.service.core.ast.PipelineElement;
import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.ast.ScalarFilter;
import com.spanql.service.core.ast.Scope;
import com.spanql.service.core.ast.SelectOperation;
import com.spanql.service.core.ast.SpansetExpression;
import com.spanql.service.core.ast.SpansetFilter;
import com.spanql.service.core.ast.SpansetOperation;
import com.spanql.service.core.ast.SpansetOperator;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.ast.StaticType;
import com.spanql.service.core.ast.UnaryOperation;
import com.spanql.service.core.lexer.DurationLiteral;
import com.spanql.service.core.lexer.Lexer;
import com.spanql.service.core.lexer.Token;
import com.spanql.service.core.lexer.TokenType;
import com.spanql.telemetry.model.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive descent parser. Precedence, loosest first:
 *
 * <pre>
 * pipeline      :=  element ( '|' element )*  [ with(...) ]
 * spanset       :=  '||'  &lt;  '&amp;&amp;'  &lt;  structural (&gt;&gt; &lt;&lt; &gt; &lt; ~ and their !, &amp; forms)
 * field         :=  '||'  &lt;  '&amp;&amp;'  &lt;  comparison  &lt;  + -  &lt;  * / %  &lt;  unary ! -  &lt;  ^
 * </pre>
 *
 * Sub-expressions without span references are folded into literals.
 */
public final class Parser {
    private final String source;
    private final List<Token> tokens;
    private int pos;

    private Parser(String source) {
        this.source = source == null ? "" : source;
        this.tokens = Lexer.tokenize(this.source);
    }

    public static RootExpr parse(String query) {
        Parser parser = new Parser(query);
        RootExpr root = parser.root();
        parser.expect(TokenType.EOF, "end of query");
        return root;
    }

    /** Parses a single field reference such as {@code span.http.method}, {@code .foo} or {@code span:name}. */
    public static Attribute parseAttribute(String text) {
        Parser parser = new Parser(text);
        Token start = parser.peek();
        FieldExpression expression = parser.primary();
        if (!(expression instanceof Attribute attribute)) {
            throw new SyntaxException(parser.offset(start), "attribute", start.describe());
        }
        parser.expect(TokenType.EOF, "end of attribute");
        return attribute;
    }

    // ---------------------------------------------------------------------
    // pipeline and spanset expressions
    // ---------------------------------------------------------------------

    private RootExpr root() {
        Pipeline pipeline = pipeline();
        Hints hints = Hints.none();
        if (peek().type() == TokenType.IDENT && "with".equals(peek().text()) && peek(1).type() == TokenType.LPAREN) {
            hints = hints();
        }
        return new RootExpr(pipeline, hints);
    }

    private Pipeline pipeline() {
        List<PipelineElement> elements = new ArrayList<>();
        elements.add(element(true));
        while (accept(TokenType.PIPE)) {
            elements.add(element(false));
        }
        return new Pipeline(elements);
    }

    private PipelineElement element(boolean first) {
        Token t = peek();
        if (t.type() == TokenType.IDENT && peek(1).type() == TokenType.LPAREN) {
            Optional<AggregateOp> aggregate = AggregateOp.fromFunctionName(t.text());
            if (aggregate.isPresent()) {
                return scalarFilter();
            }
            switch (t.text()) {
                case "by" -> {
                    return groupBy();
                }
                case "coalesce" -> {
                    if (first) {
                        throw new SyntaxException(offset(t), "spanset expression", "coalesce()");
                    }
                    next();
                    expect(TokenType.LPAREN, "(");
                    expect(TokenType.RPAREN, ")");
                    return new CoalesceOperation();
                }
                case "select" -> {
                    return select();
                }
                default -> throw new SemanticException(offset(t), "unknown function " + t.text() + "()");
            }
        }
        return spansetOr();
    }

    private SpansetExpression spansetOr() {
        SpansetExpression lhs = spansetAnd();
        while (peek().type() == TokenType.OR) {
            Token op = next();
            lhs = spansetOperation(SpansetOperator.OR, lhs, spansetAnd(), op);
        }
        return lhs;
    }

    private SpansetExpression spansetAnd() {
        SpansetExpression lhs = structural();
        while (peek().type() == TokenType.AND) {
            Token op = next();
            lhs = spansetOperation(SpansetOperator.AND, lhs, structural(), op);
        }
        return lhs;
    }

    private SpansetExpression structural() {
        SpansetExpression lhs = spansetPrimary();
        SpansetOperator op;
        while ((op = structuralOperator(peek().type())) != null) {
            Token opToken = next();
            lhs = spansetOperation(op, lhs, spansetPrimary(), opToken);
        }
        return lhs;
    }

    private static SpansetOperator structuralOperator(TokenType type) {
        return switch (type) {
            case DESCENDANT -> SpansetOperator.DESCENDANT;
            case ANCESTOR -> SpansetOperator.ANCESTOR;
            case GT -> SpansetOperator.CHILD;
            case LT -> SpansetOperator.PARENT;
            case TILDE -> SpansetOperator.SIBLING;
            case NOT_DESCENDANT -> SpansetOperator.NOT_DESCENDANT;
            case NOT_ANCESTOR -> SpansetOperator.NOT_ANCESTOR;
            case NOT_CHILD -> SpansetOperator.NOT_CHILD;
            case NOT_PARENT -> SpansetOperator.NOT_PARENT;
            case NOT_REGEX -> SpansetOperator.NOT_SIBLING;
            case UNION_DESCENDANT -> SpansetOperator.UNION_DESCENDANT;
            case UNION_ANCESTOR -> SpansetOperator.UNION_ANCESTOR;
            case UNION_CHILD -> SpansetOperator.UNION_CHILD;
            case UNION_PARENT -> SpansetOperator.UNION_PARENT;
            case UNION_SIBLING -> SpansetOperator.UNION_SIBLING;
            default -> null;
        };
    }

    private SpansetOperation spansetOperation(
            SpansetOperator op, SpansetExpression lhs, SpansetExpression rhs, Token opToken) {
        for (SpansetExpression operand : List.of(lhs, rhs)) {
            if (operand instanceof Pipeline p && p.yieldsMultipleSpansets()) {
                throw new SemanticException(
                        offset(opToken),
                        "operand of '" + op.symbol() + "' returns multiple spansets per trace; consider using coalesce()");
            }
        }
        return new SpansetOperation(op, lhs, rhs);
    }

    private SpansetExpression spansetPrimary() {
        Token t = peek();
        if (accept(TokenType.LBRACE)) {
            if (accept(TokenType.RBRACE)) {
                return SpansetFilter.matchAll();
            }
            Token exprStart = peek();
            FieldExpression expression = fieldExpression();
            expect(TokenType.RBRACE, "'}'");
            StaticType type = expression.impliedType();
            if (type != StaticType.BOOLEAN && type != StaticType.ATTRIBUTE) {
                throw new SemanticException(
                        offset(exprStart), "span filter expression must be boolean, got " + type.name().toLowerCase(Locale.ROOT));
            }
            return new SpansetFilter(expression);
        }
        if (accept(TokenType.LPAREN)) {
            Pipeline pipeline = pipeline();
            expect(TokenType.RPAREN, "')'");
            if (pipeline.elements().size() == 1 && pipeline.elements().get(0) instanceof SpansetExpression single) {
                return single;
            }
            return pipeline;
        }
        throw new SyntaxException(offset(t), "'{' or '('", t.describe());
    }

    // ---------------------------------------------------------------------
    // aggregates, grouping, selection, hints
    // ---------------------------------------------------------------------

    private ScalarFilter scalarFilter() {
        Aggregate aggregate = aggregate();
        Token opToken = peek();
        Operator op = comparisonOperator(opToken.type());
        if (op == null || op.isRegex()) {
            throw new SyntaxException(offset(opToken), "comparison operator after " + aggregate, opToken.describe());
        }
        next();
        Token valueToken = peek();
        FieldExpression value = additive();
        if (!(value instanceof Static literal)) {
            throw new SyntaxException(offset(valueToken), "literal", valueToken.describe());
        }
        if (!literal.isNumeric()) {
            throw new SemanticException(offset(valueToken), "aggregate can only be compared with a number or duration");
        }
        return new ScalarFilter(op, aggregate, literal);
    }

    private Aggregate aggregate() {
        Token name = next();
        AggregateOp op = AggregateOp.fromFunctionName(name.text()).orElseThrow();
        expect(TokenType.LPAREN, "'('");
        if (op == AggregateOp.COUNT) {
            expect(TokenType.RPAREN, "')'");
            return Aggregate.count();
        }
        Token exprStart = peek();
        FieldExpression expression = fieldExpression();
        expect(TokenType.RPAREN, "')'");
        StaticType type = expression.impliedType();
        if (type.isKnown() && !type.isNumeric()) {
            throw new SemanticException(offset(exprStart), op.functionName() + "() requires a numeric field");
        }
        return new Aggregate(op, expression);
    }

    private GroupOperation groupBy() {
        next();
        expect(TokenType.LPAREN, "'('");
        List<FieldExpression> by = new ArrayList<>();
        do {
            by.add(fieldExpression());
        } while (accept(TokenType.COMMA));
        expect(TokenType.RPAREN, "')'");
        return new GroupOperation(by);
    }

    private SelectOperation select() {
        next();
        expect(TokenType.LPAREN, "'('");
        List<Attribute> attributes = new ArrayList<>();
        do {
            Token t = peek();
            FieldExpression e = fieldExpression();
            if (!(e instanceof Attribute attribute)) {
                throw new SyntaxException(offset(t), "attribute", t.describe());
            }
            attributes.add(attribute);
        } while (accept(TokenType.COMMA));
        expect(TokenType.RPAREN, "')'");
        return new SelectOperation(attributes);
    }

    private Hints hints() {
        next();
        expect(TokenType.LPAREN, "'('");
        Map<String, Static> values = new LinkedHashMap<>();
        do {
            Token name = expect(TokenType.IDENT, "hint name");
            expect(TokenType.EQ, "'='");
            Token valueToken = peek();
            FieldExpression value = unary();
            if (!(value instanceof Static literal)) {
                throw new SyntaxException(offset(valueToken), "literal", valueToken.describe());
            }
            values.put(name.text(), literal);
        } while (accept(TokenType.COMMA));
        expect(TokenType.RPAREN, "')'");
        return new Hints(values);
    }

    // ---------------------------------------------------------------------
    // field expressions
    // ---------------------------------------------------------------------

    private FieldExpression fieldExpression() {
        return or();
    }

    private FieldExpression or() {
        FieldExpression lhs = and();
        while (peek().type() == TokenType.OR) {
            Token op = next();
            lhs = binary(Operator.OR, lhs, and(), op);
        }
        return lhs;
    }

    private FieldExpression and() {
        FieldExpression lhs = comparison();
        while (peek().type() == TokenType.AND) {
            Token op = next();
            lhs = binary(Operator.AND, lhs, comparison(), op);
        }
        return lhs;
    }

    private FieldExpression comparison() {
        FieldExpression lhs = additive();
        Operator op = comparisonOperator(peek().type());
        if (op == null) {
            return lhs;
        }
        Token opToken = next();
        FieldExpression result = binary(op, lhs, additive(), opToken);
        Token after = peek();
        if (comparisonOperator(after.type()) != null) {
            throw new SyntaxException(offset(after), "'&&', '||' or closing bracket", after.describe());
        }
        return result;
    }

    private static Operator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQ -> Operator.EQ;
            case NEQ -> Operator.NEQ;
            case REGEX -> Operator.REGEX;
            case NOT_REGEX -> Operator.NOT_REGEX;
            case GT -> Operator.GT;
            case GTE -> Operator.GTE;
            case LT -> Operator.LT;
            case LTE -> Operator.LTE;
            default -> null;
        };
    }

    private FieldExpression additive() {
        FieldExpression lhs = multiplicative();
        while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
            Token op = next();
            lhs = binary(op.type() == TokenType.PLUS ? Operator.ADD : Operator.SUB, lhs, multiplicative(), op);
        }
        return lhs;
    }

    private FieldExpression multiplicative() {
        FieldExpression lhs = unary();
        while (true) {
            Operator op = switch (peek().type()) {
                case STAR -> Operator.MUL;
                case SLASH -> Operator.DIV;
                case PERCENT -> Operator.MOD;
                default -> null;
            };
            if (op == null) {
                return lhs;
            }
            Token opToken = next();
            lhs = binary(op, lhs, unary(), opToken);
        }
    }

    private FieldExpression unary() {
        Token t = peek();
        if (accept(TokenType.NOT)) {
            return unaryOperation(Operator.NOT, unary(), t);
        }
        if (accept(TokenType.MINUS)) {
            return unaryOperation(Operator.NEG, unary(), t);
        }
        return power();
    }

    private FieldExpression power() {
        FieldExpression base = primary();
        if (peek().type() == TokenType.CARET) {
            Token op = next();
            return binary(Operator.POW, base, unary(), op);
        }
        return base;
    }

    private FieldExpression primary() {
        Token t = next();
        switch (t.type()) {
            case LPAREN -> {
                FieldExpression inner = fieldExpression();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case STRING -> {
                return Static.ofString(t.text());
            }
            case INTEGER -> {
                try {
                    return Static.ofInt(Long.parseLong(t.text()));
                } catch (NumberFormatException e) {
                    throw new SyntaxException(offset(t), "integer in range", t.describe());
                }
            }
            case FLOAT -> {
                return Static.ofFloat(Double.parseDouble(t.text()));
            }
            case DURATION -> {
                try {
                    return Static.ofDuration(DurationLiteral.parseNanos(t.text()));
                } catch (NumberFormatException | ArithmeticException e) {
                    throw new SyntaxException(offset(t), "duration in range", t.describe());
                }
            }
            case PATH -> {
                return Attribute.custom(Scope.NONE, t.text());
            }
            case SCOPE -> {
                return scopedReference(t);
            }
            case IDENT -> {
                return identifier(t);
            }
            default -> throw new SyntaxException(offset(t), "field expression", t.describe());
        }
    }

    private FieldExpression scopedReference(Token scopeToken) {
        String keyword = scopeToken.text();
        if ("parent".equals(keyword)) {
            if (peek().type() != TokenType.PATH) {
                throw new SemanticException(offset(scopeToken), "parent scope only supports attributes");
            }
            String path = next().text();
            if (path.startsWith("span.") && path.length() > 5) {
                return Attribute.ofParent(Scope.SPAN, path.substring(5));
            }
            if (path.startsWith("resource.") && path.length() > 9) {
                return Attribute.ofParent(Scope.RESOURCE, path.substring(9));
            }
            return Attribute.ofParent(Scope.NONE, path);
        }
        Scope scope = Scope.fromKeyword(keyword)
                .orElseThrow(() -> new SemanticException(offset(scopeToken), "unknown scope " + keyword));
        if (accept(TokenType.COLON)) {
            Token name = expect(TokenType.IDENT, "intrinsic name");
            Intrinsic intrinsic = Intrinsic.scoped(scope, name.text())
                    .orElseThrow(() -> new SemanticException(
                            offset(name), "unknown intrinsic " + keyword + ":" + name.text()));
            return Attribute.scopedIntrinsic(intrinsic);
        }
        Token path = expect(TokenType.PATH, "attribute name");
        if (scope == Scope.TRACE) {
            throw new SemanticException(offset(scopeToken), "trace scope only supports intrinsics, e.g. trace:duration");
        }
        return Attribute.custom(scope, path.text());
    }

    private FieldExpression identifier(Token t) {
        String word = t.text();
        Static literal = switch (word) {
            case "true" -> Static.TRUE;
            case "false" -> Static.FALSE;
            case "nil" -> Static.NIL;
            case "error" -> Static.ofStatus(StatusCode.ERROR);
            case "ok" -> Static.ofStatus(StatusCode.OK);
            case "unset" -> Static.ofStatus(StatusCode.UNSET);
            case "unspecified" -> Static.ofKind(SpanKind.UNSPECIFIED);
            case "internal" -> Static.ofKind(SpanKind.INTERNAL);
            case "server" -> Static.ofKind(SpanKind.SERVER);
            case "client" -> Static.ofKind(SpanKind.CLIENT);
            case "producer" -> Static.ofKind(SpanKind.PRODUCER);
            case "consumer" -> Static.ofKind(SpanKind.CONSUMER);
            default -> null;
        };
        if (literal != null) {
            return literal;
        }
        Optional<Intrinsic> intrinsic = Intrinsic.legacy(word);
        if (intrinsic.isPresent()) {
            return Attribute.legacyIntrinsic(intrinsic.get());
        }
        Token following = peek();
        if (following.offset() == t.end() && (following.type() == TokenType.PATH || following.type() == TokenType.COLON)) {
            throw new SemanticException(offset(t), "unknown scope " + word);
        }
        if (following.type() == TokenType.LPAREN) {
            throw new SemanticException(offset(t), "unknown function " + word + "() in field expression");
        }
        throw new SemanticException(offset(t), "unknown identifier " + word);
    }

    // ---------------------------------------------------------------------
    // validation and folding
    // ---------------------------------------------------------------------

    private FieldExpression binary(Operator op, FieldExpression lhs, FieldExpression rhs, Token opToken) {
        if (op == Operator.EQ || op == Operator.NEQ) {
            Operator presence = op == Operator.NEQ ? Operator.EXISTS : Operator.NOT_EXISTS;
            if (isNil(rhs) && !(lhs instanceof Static)) {
                return new UnaryOperation(presence, lhs);
            }
            if (isNil(lhs) && !(rhs instanceof Static)) {
                return new UnaryOperation(presence, rhs);
            }
        }
        if (op.isRegex() && rhs instanceof Static pattern) {
            if (pattern.type() != StaticType.STRING) {
                throw new SemanticException(offset(opToken), "regular expression must be a string");
            }
            try {
                Pattern.compile(pattern.asString());
            } catch (PatternSyntaxException e) {
                throw new SemanticException(offset(opToken), "invalid regular expression: " + e.getDescription());
            }
        }
        if (op.isArithmetic()) {
            requireType(lhs, opToken, "arithmetic", true);
            requireType(rhs, opToken, "arithmetic", true);
        }
        if (op.isLogical()) {
            requireType(lhs, opToken, "'" + op.symbol() + "'", false);
            requireType(rhs, opToken, "'" + op.symbol() + "'", false);
        }
        if (lhs instanceof Static l && rhs instanceof Static r && !op.isRegex()) {
            Static folded;
            if (op.isArithmetic()) {
                folded = l.arithmetic(op, r);
            } else if (op.isLogical()) {
                folded = Static.ofBool(op == Operator.AND ? l.isTrue() && r.isTrue() : l.isTrue() || r.isTrue());
            } else {
                folded = Static.ofBool(l.compare(op, r));
            }
            if (!folded.isNil() && folded.isFinite()) {
                return folded;
            }
        }
        return new BinaryOperation(op, lhs, rhs);
    }

    private FieldExpression unaryOperation(Operator op, FieldExpression operand, Token opToken) {
        requireType(operand, opToken, "'" + op.symbol() + "'", op == Operator.NEG);
        if (operand instanceof Static s) {
            Static folded = op == Operator.NEG ? s.negate() : Static.ofBool(!s.isTrue());
            if (!folded.isNil()) {
                return folded;
            }
        }
        return new UnaryOperation(op, operand);
    }

    private void requireType(FieldExpression e, Token at, String what, boolean numeric) {
        StaticType type = e.impliedType();
        if (!type.isKnown()) {
            return;
        }
        boolean ok = numeric ? type.isNumeric() : type == StaticType.BOOLEAN;
        if (!ok) {
            throw new SemanticException(
                    offset(at),
                    what + " requires " + (numeric ? "numeric" : "boolean") + " operands, got "
                            + type.name().toLowerCase(Locale.ROOT));
        }
    }

    private static boolean isNil(FieldExpression e) {
        return e instanceof Static s && s.isNil();
    }

    // ---------------------------------------------------------------------
    // token helpers
    // ---------------------------------------------------------------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String expected) {
        Token t = peek();
        if (t.type() != type) {
            throw new SyntaxException(offset(t), expected, t.describe());
        }
        return next();
    }

    private int offset(Token t) {
        return Lexer.byteOffset(source, t.offset());
    }
}
