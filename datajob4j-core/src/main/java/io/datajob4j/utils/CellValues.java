package io.datajob4j.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cell typing rules shared by datasets, the CSV formatter and file parsing.
 * <p>
 * A normalized cell is one of {@code null}, {@link Boolean}, {@link Long}, {@link BigInteger},
 * {@link Double} or {@link String}.
 */
public final class CellValues {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private CellValues() {
    }

    /**
     * Coerce a Java value into the normalized cell representation.
     *
     * @throws IllegalArgumentException for values that are not scalar
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof Boolean || value instanceof Long
                || value instanceof Double || value instanceof String) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValueExact() : bi;
        }
        if (value instanceof BigDecimal bd) {
            return bd.doubleValue();
        }
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        throw new IllegalArgumentException("Unsupported cell type: " + value.getClass().getName());
    }

    /**
     * Locale-independent text form of a normalized cell.
     */
    public static String render(Object cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof Double d) {
            return (d.isNaN() || d.isInfinite()) ? "" : Double.toString(d);
        }
        return cell.toString();
    }

    /**
     * Lenient type inference used for user-supplied CSV files.
     */
    public static Object parse(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return text;
        }
        String lower = t.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lower)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(t).matches()) {
            return normalize(new BigInteger(t.startsWith("+") ? t.substring(1) : t));
        }
        if (DECIMAL.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        return text;
    }

    /**
     * Strict inference: a typed value is returned only when it renders back to exactly {@code text}.
     */
    public static Object parseCanonical(String text) {
        Object value = parse(text);
        if (value == null || value instanceof String) {
            return value;
        }
        return render(value).equals(text) ? value : text;
    }
}
