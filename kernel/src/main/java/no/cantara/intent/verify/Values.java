package no.cantara.intent.verify;

import no.cantara.intent.canonical.Canonicalizer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Accessors for untrusted, untyped artifact values as produced by a JSON parser.
 */
public final class Values {

    public static final Pattern SHA256_HASH = Pattern.compile("^sha256:[0-9a-f]{64}$");
    public static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private Values() {}

    /** The value as a string-keyed map, or {@code null} if it is not a JSON object. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        if (!(value instanceof Map<?, ?> map)) return null;
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) return null;
        }
        return (Map<String, Object>) map;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List<?> list ? (List<Object>) list : null;
    }

    public static String asString(Object value) {
        return value instanceof String s ? s : null;
    }

    public static boolean isNonEmptyString(Object value) {
        return value instanceof String s && !s.isEmpty();
    }

    /**
     * Integral JSON number (no fraction) within {@code +-(2^53 - 1)}, whatever Java type the
     * parser chose. Larger integers have no canonical form and no exact long arithmetic here.
     */
    public static boolean isInteger(Object value) {
        return Canonicalizer.isSafeInteger(value);
    }

    public static boolean isNumber(Object value) {
        if (value instanceof Double d) return !d.isNaN() && !d.isInfinite();
        if (value instanceof Float f) return !f.isNaN() && !f.isInfinite();
        return value instanceof Number;
    }

    /**
     * Integral value as a long; callers check {@link #isInteger} first.
     *
     * @throws ArithmeticException if the value has a fraction or does not fit a long
     */
    public static long longValue(Object value) {
        if (value instanceof BigDecimal bd) return bd.longValueExact();
        if (value instanceof BigInteger bi) return bi.longValueExact();
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Math.abs(d) > Canonicalizer.MAX_SAFE_INTEGER) {
                throw new ArithmeticException("Not an exact integer: " + d);
            }
        }
        return ((Number) value).longValue();
    }

    public static boolean isHash(Object value) {
        return value instanceof String s && SHA256_HASH.matcher(s).matches();
    }

    public static boolean isSorted(List<String> values) {
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i - 1).compareTo(values.get(i)) > 0) return false;
        }
        return true;
    }

    /** The strings of a list, skipping non-strings; {@code null} if the value is not a list. */
    public static List<String> strings(Object value) {
        List<Object> list = asList(value);
        if (list == null) return null;
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    public static boolean allStrings(Collection<?> values) {
        return values.stream().allMatch(String.class::isInstance);
    }

    /** Absolute on any platform: leading slash or backslash, or a drive letter. */
    public static boolean isAbsolutePath(String path) {
        return path.startsWith("/") || path.startsWith("\\") || path.matches("^[A-Za-z]:.*");
    }

    /** JSON type name for messages: object, array, string, number, boolean, null. */
    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Map) return "object";
        if (value instanceof List) return "array";
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        return value.getClass().getSimpleName();
    }
}
