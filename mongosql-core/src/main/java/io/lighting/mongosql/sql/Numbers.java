package io.lighting.mongosql.sql;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric helpers shared by the parser and the binder. Integral values use the
 * narrowest of {@link Integer} and {@link Long}; values written with a dot are
 * {@link Double}.
 */
public final class Numbers {
    private Numbers() {
    }

    public static Number parse(String text) {
        if (text.indexOf('.') >= 0) {
            return Double.parseDouble(text);
        }
        return narrow(Long.parseLong(text));
    }

    public static Number negate(Number value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long longValue = value.longValue();
            if (longValue == Long.MIN_VALUE) {
                throw new ArithmeticException("Cannot negate " + value);
            }
            return narrow(-longValue);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.negate();
        }
        if (value instanceof BigInteger integer) {
            return integer.negate();
        }
        if (value instanceof Float floatValue) {
            return -floatValue;
        }
        return -value.doubleValue();
    }

    private static Number narrow(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }
}
