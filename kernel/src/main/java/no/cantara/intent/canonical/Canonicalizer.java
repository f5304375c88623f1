package no.cantara.intent.canonical;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic serialization and content hashing of JSON-like values.
 *
 * <p>Supported values are {@code null}, {@link Boolean}, integral {@link Number}s
 * within {@code +-(2^53 - 1)},
 * {@link String}, {@link List} (order preserved), {@link Map} with string keys
 * (keys emitted in UTF-16 code unit order) and {@link CanonicalValue}. Anything
 * else, including cycles, non-finite and fractional numbers, is rejected with a
 * {@link CanonicalizationException}.
 *
 * <p>The output contains no insignificant whitespace and never depends on the
 * platform, the default locale or map insertion order.
 */
public final class Canonicalizer {

    public static final String HASH_PREFIX = "sha256:";

    /** Largest integer a double represents exactly; larger integers are ambiguous across platforms. */
    public static final long MAX_SAFE_INTEGER = 9007199254740991L;

    private static final BigInteger MAX_SAFE = BigInteger.valueOf(MAX_SAFE_INTEGER);
    private static final int MAX_SAFE_DIGITS = 16;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Canonicalizer() {}

    /**
     * Serialize a value to its canonical string form.
     *
     * @throws CanonicalizationException if the value (or anything nested in it) is unsupported
     */
    public static String canonicalize(Object value) {
        StringBuilder out = new StringBuilder();
        write(value, "$", out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out.toString();
    }

    /** UTF-8 bytes of {@link #canonicalize(Object)}. */
    public static byte[] canonicalBytes(Object value) {
        return canonicalize(value).getBytes(StandardCharsets.UTF_8);
    }

    /** {@code "sha256:" + hex(sha256(canonical bytes))}. */
    public static String contentHash(Object value) {
        return HASH_PREFIX + sha256Hex(canonicalBytes(value));
    }

    /**
     * Content-derived identifier, {@code prefix + "_" + first 16 hex chars} of the canonical hash.
     */
    public static String contentId(String prefix, Object value) {
        return prefix + "_" + sha256Hex(canonicalBytes(value)).substring(0, 16);
    }

    /** Hex SHA-256 of the UTF-8 bytes of a raw string, without canonicalization. */
    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available in this JVM", e);
        }
        byte[] hash = digest.digest(bytes);
        char[] chars = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            chars[i * 2] = HEX[(hash[i] >> 4) & 0x0f];
            chars[i * 2 + 1] = HEX[hash[i] & 0x0f];
        }
        return new String(chars);
    }

    /**
     * True when canonicalizing the value, parsing the result back and canonicalizing
     * again yields the same bytes.
     */
    public static boolean isRoundTripStable(Object value) {
        String first = canonicalize(value);
        String second = canonicalize(ArtifactJson.parse(first));
        return first.equals(second);
    }

    // ── writer ──────────────────────────────────────────────────────────────

    private static void write(Object value, String path, StringBuilder out, Set<Object> onPath) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Boolean b) {
            out.append(b ? "true" : "false");
        } else if (value instanceof String s) {
            writeString(s, out);
        } else if (value instanceof Number n) {
            writeNumber(n, path, out);
        } else if (value instanceof CanonicalValue c) {
            enter(value, path, onPath);
            write(c.toCanonicalValue(), path, out, onPath);
            onPath.remove(value);
        } else if (value instanceof Map<?, ?> map) {
            enter(value, path, onPath);
            writeObject(map, path, out, onPath);
            onPath.remove(value);
        } else if (value instanceof List<?> list) {
            enter(value, path, onPath);
            out.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) out.append(',');
                write(list.get(i), path + "[" + i + "]", out, onPath);
            }
            out.append(']');
            onPath.remove(value);
        } else {
            throw new CanonicalizationException(path,
                    "Unsupported value at " + path + ": " + value.getClass().getName());
        }
    }

    private static void enter(Object value, String path, Set<Object> onPath) {
        if (!onPath.add(value)) {
            throw new CanonicalizationException(path, "Cyclic structure at " + path);
        }
    }

    private static void writeObject(Map<?, ?> map, String path, StringBuilder out, Set<Object> onPath) {
        List<String> keys = new ArrayList<>(map.size());
        for (Object key : map.keySet()) {
            if (!(key instanceof String s)) {
                throw new CanonicalizationException(path,
                        "Non-string key at " + path + ": " + (key == null ? "null" : key.getClass().getName()));
            }
            keys.add(s);
        }
        Collections.sort(keys);
        out.append('{');
        boolean first = true;
        for (String key : keys) {
            if (!first) out.append(',');
            first = false;
            writeString(key, out);
            out.append(':');
            write(map.get(key), path + "." + key, out, onPath);
        }
        out.append('}');
    }

    /**
     * True for an integral number within {@code +-MAX_SAFE_INTEGER}, whatever its Java type.
     * These are the only numbers with a canonical form.
     */
    public static boolean isSafeInteger(Object value) {
        return value instanceof Number n && numberProblem(n) == null;
    }

    private static void writeNumber(Number n, String path, StringBuilder out) {
        String problem = numberProblem(n);
        if (problem != null) {
            throw new CanonicalizationException(path, problem + " at " + path + ": " + describe(n));
        }
        out.append(n.longValue());
    }

    /** Why a number has no canonical form, or {@code null} if it has one. */
    private static String numberProblem(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return null;
        }
        if (n instanceof Long l) {
            return l >= -MAX_SAFE_INTEGER && l <= MAX_SAFE_INTEGER ? null : "Number out of exact range";
        }
        if (n instanceof BigInteger bi) {
            return bi.abs().compareTo(MAX_SAFE) <= 0 ? null : "Number out of exact range";
        }
        if (n instanceof BigDecimal bd) {
            BigDecimal stripped = bd.stripTrailingZeros();
            if (stripped.scale() > 0) {
                return "Non-integral number";
            }
            // count digits before expanding, an exponent like 1e99999999 must never be materialized
            if ((long) stripped.precision() - stripped.scale() > MAX_SAFE_DIGITS) {
                return "Number out of exact range";
            }
            return stripped.toBigInteger().abs().compareTo(MAX_SAFE) <= 0 ? null : "Number out of exact range";
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "Non-finite number";
            }
            if (d != Math.rint(d)) {
                return "Non-integral number";
            }
            return Math.abs(d) <= MAX_SAFE_INTEGER ? null : "Number out of exact range";
        }
        return "Unsupported value";
    }

    private static String describe(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger || n instanceof BigDecimal
                || n instanceof Double || n instanceof Float) {
            return n.toString();
        }
        return n.getClass().getName();
    }

    private static void writeString(String s, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        appendUnicodeEscape(c, out);
                    } else if (Character.isHighSurrogate(c)) {
                        if (i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                            out.append(c).append(s.charAt(++i));
                        } else {
                            appendUnicodeEscape(c, out);
                        }
                    } else if (Character.isLowSurrogate(c)) {
                        // a low surrogate here has no high surrogate before it
                        appendUnicodeEscape(c, out);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static void appendUnicodeEscape(char c, StringBuilder out) {
        out.append("\\u")
                .append(HEX[(c >> 12) & 0x0f])
                .append(HEX[(c >> 8) & 0x0f])
                .append(HEX[(c >> 4) & 0x0f])
                .append(HEX[c & 0x0f]);
    }
}
