package com.spanql.service.core.ast;

import com.spanql.telemetry.model.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A literal or a resolved attribute value. The {@link StaticType} tag decides how values compare:
 *
 * <ul>
 *   <li>int, float and duration compare numerically with each other (durations as nanos);
 *   <li>ordering operators between a string and a number compare the string with the number's text;
 *   <li>arrays satisfy a comparison when any element does;
 *   <li>nil and maps satisfy no comparison, nor does any other mix of tags.
 * </ul>
 */
public final class Static implements FieldExpression {
    public static final Static NIL = new Static(StaticType.NIL, null);
    public static final Static TRUE = new Static(StaticType.BOOLEAN, Boolean.TRUE);
    public static final Static FALSE = new Static(StaticType.BOOLEAN, Boolean.FALSE);

    private static final long NANOS_PER_US = 1_000L;
    private static final long NANOS_PER_MS = 1_000_000L;
    private static final long NANOS_PER_S = 1_000_000_000L;
    private static final long NANOS_PER_M = 60 * NANOS_PER_S;
    private static final long NANOS_PER_H = 60 * NANOS_PER_M;

    private final StaticType type;
    private final Object value;

    private Static(StaticType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Static ofInt(long value) {
        return new Static(StaticType.INT, value);
    }

    public static Static ofFloat(double value) {
        return new Static(StaticType.FLOAT, value);
    }

    public static Static ofString(String value) {
        return value == null ? NIL : new Static(StaticType.STRING, value);
    }

    public static Static ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Static ofDuration(long nanos) {
        return new Static(StaticType.DURATION, nanos);
    }

    public static Static ofStatus(StatusCode code) {
        return code == null ? NIL : new Static(StaticType.STATUS, code);
    }

    public static Static ofKind(SpanKind kind) {
        return kind == null ? NIL : new Static(StaticType.KIND, kind);
    }

    /** Converts a decoded attribute value. Unknown object types fall back to their string form. */
    public static Static of(Object raw) {
        if (raw == null) return NIL;
        if (raw instanceof Static s) return s;
        if (raw instanceof String s) return ofString(s);
        if (raw instanceof Boolean b) return ofBool(b);
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ofInt(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) return ofFloat(((Number) raw).doubleValue());
        if (raw instanceof BigDecimal d) return ofFloat(d.doubleValue());
        if (raw instanceof Number n) return ofInt(n.longValue());
        if (raw instanceof java.time.Duration d) return ofDuration(d.toNanos());
        if (raw instanceof StatusCode c) return ofStatus(c);
        if (raw instanceof SpanKind k) return ofKind(k);
        if (raw instanceof List<?> list) {
            List<Static> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(of(element));
            }
            return new Static(StaticType.ARRAY, Collections.unmodifiableList(elements));
        }
        if (raw instanceof Map<?, ?> map) {
            return new Static(StaticType.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(map)));
        }
        return ofString(String.valueOf(raw));
    }

    public StaticType type() {
        return type;
    }

    @Override
    public StaticType impliedType() {
        return type;
    }

    @Override
    public boolean referencesSpan() {
        return false;
    }

    public boolean isNil() {
        return type == StaticType.NIL;
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }

    /** True only for the boolean {@code true}. */
    public boolean isTrue() {
        return type == StaticType.BOOLEAN && (Boolean) value;
    }

    public long asLong() {
        return switch (type) {
            case INT, DURATION -> (Long) value;
            case FLOAT -> (long) (double) (Double) value;
            default -> throw new IllegalStateException("not numeric: " + type);
        };
    }

    public double asDouble() {
        return switch (type) {
            case INT, DURATION -> (double) (Long) value;
            case FLOAT -> (Double) value;
            default -> throw new IllegalStateException("not numeric: " + type);
        };
    }

    public String asString() {
        return type == StaticType.STRING ? (String) value : null;
    }

    @SuppressWarnings("unchecked")
    public List<Static> asList() {
        return type == StaticType.ARRAY ? (List<Static>) value : List.of();
    }

    /** Plain Java form for results: numbers, strings, booleans, lower-case status/kind names, lists and maps. */
    public Object toJavaValue() {
        return switch (type) {
            case NIL, ATTRIBUTE -> null;
            case STATUS -> ((StatusCode) value).name().toLowerCase(Locale.ROOT);
            case KIND -> ((SpanKind) value).lowerName();
            case ARRAY -> asList().stream().map(Static::toJavaValue).toList();
            default -> value;
        };
    }

    // ---------------------------------------------------------------------
    // comparison
    // ---------------------------------------------------------------------

    /** Applies an equality or ordering operator. Regex operators go through {@link #matches}. */
    public boolean compare(Operator op, Static rhs) {
        if (type == StaticType.NIL || rhs.type == StaticType.NIL) return false;
        if (type == StaticType.ARRAY) {
            for (Static element : asList()) {
                if (element.compare(op, rhs)) return true;
            }
            return false;
        }
        if (rhs.type == StaticType.ARRAY) {
            for (Static element : rhs.asList()) {
                if (compare(op, element)) return true;
            }
            return false;
        }
        if (type == StaticType.MAP || rhs.type == StaticType.MAP) return false;

        if (isNumeric() && rhs.isNumeric()) {
            if (type == StaticType.FLOAT || rhs.type == StaticType.FLOAT) {
                double a = asDouble();
                double b = rhs.asDouble();
                if (Double.isNaN(a) || Double.isNaN(b)) return false;
                return op.test(a < b ? -1 : (a > b ? 1 : 0));
            }
            return op.test(Long.compare(asLong(), rhs.asLong()));
        }
        if (type == StaticType.STRING && rhs.type == StaticType.STRING) {
            return op.test(asString().compareTo(rhs.asString()));
        }
        if (op.isOrdering()) {
            if (type == StaticType.STRING && rhs.isNumeric()) {
                return op.test(asString().compareTo(rhs.plainText()));
            }
            if (isNumeric() && rhs.type == StaticType.STRING) {
                return op.test(plainText().compareTo(rhs.asString()));
            }
            return false;
        }
        if (type == rhs.type && (op == Operator.EQ || op == Operator.NEQ)) {
            boolean equal = value.equals(rhs.value);
            return op == Operator.EQ ? equal : !equal;
        }
        return false;
    }

    /** Regex match against strings or any string element of an array; everything else never matches. */
    public boolean matches(Pattern pattern) {
        if (type == StaticType.STRING) {
            return pattern.matcher(asString()).find();
        }
        if (type == StaticType.ARRAY) {
            for (Static element : asList()) {
                if (element.matches(pattern)) return true;
            }
        }
        return false;
    }

    /** Negated regex match. Only strings (or arrays holding one) can satisfy it. */
    public boolean notMatches(Pattern pattern) {
        if (type == StaticType.STRING) {
            return !pattern.matcher(asString()).find();
        }
        if (type == StaticType.ARRAY) {
            for (Static element : asList()) {
                if (element.notMatches(pattern)) return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // arithmetic
    // ---------------------------------------------------------------------

    /**
     * Int op int stays int (division and power give float), duration plus or minus duration and duration
     * times int stay durations, every other numeric mix is float. Non-numeric operands give nil.
     */
    public Static arithmetic(Operator op, Static rhs) {
        if (!isNumeric() || !rhs.isNumeric()) return NIL;
        StaticType a = type;
        StaticType b = rhs.type;
        if (a == StaticType.INT && b == StaticType.INT) {
            long x = asLong();
            long y = rhs.asLong();
            return switch (op) {
                case ADD -> ofInt(x + y);
                case SUB -> ofInt(x - y);
                case MUL -> ofInt(x * y);
                case MOD -> y == 0 ? NIL : ofInt(x % y);
                case DIV -> ofFloat((double) x / y);
                case POW -> ofFloat(Math.pow(x, y));
                default -> NIL;
            };
        }
        if (a == StaticType.DURATION && b == StaticType.DURATION && (op == Operator.ADD || op == Operator.SUB)) {
            return ofDuration(op == Operator.ADD ? asLong() + rhs.asLong() : asLong() - rhs.asLong());
        }
        if (op == Operator.MUL
                && ((a == StaticType.DURATION && b == StaticType.INT) || (a == StaticType.INT && b == StaticType.DURATION))) {
            return ofDuration(asLong() * rhs.asLong());
        }
        double x = asDouble();
        double y = rhs.asDouble();
        return switch (op) {
            case ADD -> ofFloat(x + y);
            case SUB -> ofFloat(x - y);
            case MUL -> ofFloat(x * y);
            case DIV -> ofFloat(x / y);
            case MOD -> ofFloat(x % y);
            case POW -> ofFloat(Math.pow(x, y));
            default -> NIL;
        };
    }

    public Static negate() {
        return switch (type) {
            case INT -> ofInt(-asLong());
            case DURATION -> ofDuration(-asLong());
            case FLOAT -> ofFloat(-asDouble());
            default -> NIL;
        };
    }

    /** False for NaN and infinite floats; folding keeps the unfolded expression in that case. */
    public boolean isFinite() {
        return type != StaticType.FLOAT || Double.isFinite((Double) value);
    }

    // ---------------------------------------------------------------------
    // rendering
    // ---------------------------------------------------------------------

    @Override
    public String toString() {
        return switch (type) {
            case NIL, ATTRIBUTE -> "nil";
            case BOOLEAN -> value.toString();
            // the smallest long has no literal form: its magnitude overflows before the minus applies
            case INT -> asLong() == Long.MIN_VALUE ? "(" + (Long.MIN_VALUE + 1) + " - 1)" : value.toString();
            case FLOAT -> renderFloat((Double) value);
            case STRING -> quote(asString());
            case DURATION -> asLong() == Long.MIN_VALUE
                    ? "(" + renderDuration(Long.MIN_VALUE + 1) + " - 1ns)"
                    : renderDuration(asLong());
            case STATUS -> ((StatusCode) value).name().toLowerCase(Locale.ROOT);
            case KIND -> ((SpanKind) value).lowerName();
            case ARRAY -> asList().toString();
            case MAP -> value.toString();
        };
    }

    private String plainText() {
        return switch (type) {
            case INT -> value.toString();
            case FLOAT -> renderFloat((Double) value);
            case DURATION -> renderDuration(asLong());
            default -> String.valueOf(value);
        };
    }

    static String renderFloat(double d) {
        if (!Double.isFinite(d)) return Double.toString(d);
        if (d == 0.0 && 1 / d < 0) return "-0.0";
        String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /** Renders nanos in the largest unit that divides them exactly. */
    static String renderDuration(long nanos) {
        if (nanos == 0) return "0s";
        String sign = nanos < 0 ? "-" : "";
        long abs = Math.abs(nanos);
        if (abs % NANOS_PER_H == 0) return sign + abs / NANOS_PER_H + "h";
        if (abs % NANOS_PER_M == 0) return sign + abs / NANOS_PER_M + "m";
        if (abs % NANOS_PER_S == 0) return sign + abs / NANOS_PER_S + "s";
        if (abs % NANOS_PER_MS == 0) return sign + abs / NANOS_PER_MS + "ms";
        if (abs % NANOS_PER_US == 0) return sign + abs / NANOS_PER_US + "us";
        return sign + abs + "ns";
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Static other && type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
