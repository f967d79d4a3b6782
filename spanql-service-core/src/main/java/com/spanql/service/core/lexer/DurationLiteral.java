package com.spanql.service.core.lexer;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Duration literals such as {@code 150ms}, {@code 1.5m} or {@code 1h30m}. */
public final class DurationLiteral {
    private static final String[] UNITS = {"ns", "us", "µs", "μs", "ms", "s", "m", "h"};
    private static final long[] UNIT_NANOS = {1L, 1_000L, 1_000L, 1_000L, 1_000_000L, 1_000_000_000L, 60_000_000_000L,
        3_600_000_000_000L};

    private DurationLiteral() {}

    /** Length of the unit starting at {@code pos}, or 0 when none does. Longer units win over their prefixes. */
    static int unitLength(String s, int pos) {
        int best = 0;
        for (String unit : UNITS) {
            if (s.startsWith(unit, pos) && unit.length() > best) {
                best = unit.length();
            }
        }
        return best;
    }

    /** Parses lexed duration text into nanoseconds. Fractions of a nanosecond are dropped. */
    public static long parseNanos(String text) {
        BigDecimal total = BigDecimal.ZERO;
        int i = 0;
        while (i < text.length()) {
            int start = i;
            while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                i++;
            }
            int unitLen = unitLength(text, i);
            if (start == i || unitLen == 0) {
                throw new NumberFormatException("malformed duration: " + text);
            }
            String unit = text.substring(i, i + unitLen);
            total = total.add(new BigDecimal(text.substring(start, i)).multiply(BigDecimal.valueOf(nanosOf(unit))));
            i += unitLen;
        }
        return total.setScale(0, RoundingMode.DOWN).longValueExact();
    }

    private static long nanosOf(String unit) {
        for (int i = 0; i < UNITS.length; i++) {
            if (UNITS[i].equals(unit)) return UNIT_NANOS[i];
        }
        throw new NumberFormatException("unknown duration unit: " + unit);
    }
}
