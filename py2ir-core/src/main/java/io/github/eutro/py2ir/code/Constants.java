package io.github.eutro.py2ir.code;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Helpers for constant pool values.
 * <p>
 * Constants are plain Java values: {@code null} is None, then {@link Boolean}, {@link Integer},
 * {@link Long}, {@link BigInteger}, {@link Double}, {@link String}, {@code byte[]},
 * {@link ConstCollection}, {@link #ELLIPSIS} and {@link CodeObject}.
 */
public final class Constants {
    private Constants() {
    }

    public static final Object ELLIPSIS = new Object() {
        @Override
        public String toString() {
            return "...";
        }
    };

    /**
     * Whether two constants are the same Python value of the same type.
     * {@code True} and {@code 1} are different constants here.
     *
     * @param a The first constant.
     * @param b The second constant.
     * @return Whether they are the same.
     */
    public static boolean sameConstant(@Nullable Object a, @Nullable Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (isInt(a) && isInt(b)) return toBigInteger(a).equals(toBigInteger(b));
        if (a.getClass() != b.getClass()) return false;
        return Objects.deepEquals(a, b);
    }

    public static int constantHash(@Nullable Object k) {
        if (k == null) return 0;
        if (isInt(k)) return toBigInteger(k).hashCode();
        if (k instanceof byte[]) return Arrays.hashCode((byte[]) k);
        return k.hashCode();
    }

    public static boolean isInt(@Nullable Object k) {
        return k instanceof Integer || k instanceof Long || k instanceof BigInteger;
    }

    public static BigInteger toBigInteger(Object k) {
        if (k instanceof BigInteger) return (BigInteger) k;
        return BigInteger.valueOf(((Number) k).longValue());
    }

    /**
     * Render a constant the way Python's {@code repr} would, except that strings use double quotes.
     *
     * @param k The constant.
     * @return The rendered constant.
     */
    public static String repr(@Nullable Object k) {
        StringBuilder sb = new StringBuilder();
        repr(sb, k);
        return sb.toString();
    }

    private static void repr(StringBuilder sb, @Nullable Object k) {
        if (k == null) {
            sb.append("None");
        } else if (k instanceof Boolean) {
            sb.append((Boolean) k ? "True" : "False");
        } else if (k instanceof String) {
            quote(sb, (String) k);
        } else if (k instanceof byte[]) {
            sb.append('b');
            quote(sb, new String((byte[]) k, java.nio.charset.StandardCharsets.ISO_8859_1));
        } else if (k instanceof Double) {
            double d = (Double) k;
            if (Double.isNaN(d)) {
                sb.append("nan");
            } else if (Double.isInfinite(d)) {
                sb.append(d > 0 ? "inf" : "-inf");
            } else if (d == Math.rint(d) && Math.abs(d) < 1e16) {
                sb.append((long) d).append(".0");
            } else {
                sb.append(d);
            }
        } else if (k instanceof CodeObject) {
            sb.append("<code ").append(((CodeObject) k).name).append('>');
        } else if (k instanceof ConstCollection) {
            reprCollection(sb, (ConstCollection) k);
        } else {
            sb.append(k);
        }
    }

    private static void reprCollection(StringBuilder sb, ConstCollection coll) {
        String open, close;
        switch (coll.kind) {
            case TUPLE:
                open = "(";
                close = ")";
                break;
            case LIST:
                open = "[";
                close = "]";
                break;
            case SET:
                if (coll.items.isEmpty()) {
                    sb.append("set()");
                    return;
                }
                open = "{";
                close = "}";
                break;
            case FROZENSET:
                open = "frozenset({";
                close = "})";
                break;
            case DICT:
                sb.append('{');
                for (int i = 0; i < coll.items.size(); i += 2) {
                    if (i != 0) sb.append(", ");
                    repr(sb, coll.items.get(i));
                    sb.append(": ");
                    repr(sb, coll.items.get(i + 1));
                }
                sb.append('}');
                return;
            default:
                throw new IllegalStateException();
        }
        sb.append(open);
        boolean first = true;
        for (Object item : coll.items) {
            if (!first) sb.append(", ");
            first = false;
            repr(sb, item);
        }
        if (coll.kind == ConstCollection.Kind.TUPLE && coll.items.size() == 1) sb.append(',');
        sb.append(close);
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
