package com.pystructure.core.ast;

import java.math.BigDecimal;

/**
 * Printed forms of Python literal values.
 *
 * <p>Used when a {@link PythonTree.Constant} arrives without the parser's own printed form
 * (hand-built trees, older dumps). Follows Python's {@code repr()} for the value types a
 * JSON tree can carry.
 */
public final class PythonLiterals {

    private static final char SINGLE_QUOTE = '\'';
    private static final char DOUBLE_QUOTE = '"';

    private PythonLiterals() {
        // Utility class - no instantiation
    }

    /**
     * Returns the printed form of a literal value.
     *
     * @param value literal value (null stands for {@code None})
     * @return printed form
     */
    public static String repr(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof String text) {
            return quote(text);
        }
        if (value instanceof Double || value instanceof Float) {
            return floatRepr(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return floatRepr(decimal.doubleValue());
        }
        return String.valueOf(value);
    }

    /**
     * Quotes a string the way Python's {@code repr()} does: single quotes unless the text
     * contains a single quote and no double quote.
     *
     * @param text raw string
     * @return quoted and escaped string
     */
    public static String quote(String text) {
        char quote = text.indexOf(SINGLE_QUOTE) >= 0 && text.indexOf(DOUBLE_QUOTE) < 0
            ? DOUBLE_QUOTE
            : SINGLE_QUOTE;

        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append(quote);
        return sb.toString();
    }

    private static String floatRepr(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        String text = Double.toString(value);
        int exponentAt = text.indexOf('E');
        if (exponentAt < 0) {
            return text;
        }
        double magnitude = Math.abs(value);
        if (magnitude >= 1e-4 && magnitude < 1e16) {
            String plain = new BigDecimal(text).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        // 1.0E20 -> 1e+20, 1.5E-7 -> 1.5e-07
        String mantissa = text.substring(0, exponentAt);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        int exponent = Integer.parseInt(text.substring(exponentAt + 1));
        String sign = exponent < 0 ? "-" : "+";
        return mantissa + "e" + sign + String.format("%02d", Math.abs(exponent));
    }
}
