package com.libragraph.catalog.util;

import java.lang.reflect.Array;
import java.util.List;

/**
 * Parses the track/disc notations found across tag dialects into a {@link TrackDiscPair}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code null} → (null, null)</li>
 *   <li>pair-like: a {@link List}, an array or a {@link TrackDiscPair} with at least
 *       two elements, e.g. MP4 {@code trkn = (3, 12)}</li>
 *   <li>slash notation: {@code "3/12"}, {@code "5/"}, as in ID3 {@code TRCK}</li>
 *   <li>bare scalar: {@code "9"} or {@code 9}</li>
 * </ul>
 * A zero or empty total is reported as absent. Unparseable input never throws;
 * it degrades to {@link TrackDiscPair#empty()}.
 */
public final class TrackDiscNotation {

    private TrackDiscNotation() {
    }

    public static TrackDiscPair parse(Object raw) {
        if (raw == null) {
            return TrackDiscPair.empty();
        }
        if (raw instanceof TrackDiscPair pair) {
            return pair.total() != null && pair.total() == 0
                    ? TrackDiscPair.of(pair.number())
                    : pair;
        }
        if (raw instanceof List<?> list) {
            return list.size() >= 2 ? parsePair(list.get(0), list.get(1)) : TrackDiscPair.empty();
        }
        if (raw.getClass().isArray()) {
            return Array.getLength(raw) >= 2
                    ? parsePair(Array.get(raw, 0), Array.get(raw, 1))
                    : TrackDiscPair.empty();
        }
        if (raw instanceof CharSequence text && text.toString().indexOf('/') >= 0) {
            return parseSlashed(text.toString());
        }
        Integer number = toInteger(raw);
        return number != null ? TrackDiscPair.of(number) : TrackDiscPair.empty();
    }

    private static TrackDiscPair parsePair(Object first, Object second) {
        Integer number = toInteger(first);
        if (number == null) {
            return TrackDiscPair.empty();
        }
        if (isBlank(second)) {
            return TrackDiscPair.of(number);
        }
        Integer total = toInteger(second);
        if (total == null) {
            return TrackDiscPair.empty();
        }
        return new TrackDiscPair(number, total == 0 ? null : total);
    }

    private static TrackDiscPair parseSlashed(String text) {
        String[] parts = text.split("/", -1);
        Integer number = toInteger(parts[0]);
        if (number == null) {
            return TrackDiscPair.empty();
        }
        if (parts[1].isEmpty()) {
            return TrackDiscPair.of(number);
        }
        Integer total = toInteger(parts[1]);
        if (total == null) {
            return TrackDiscPair.empty();
        }
        return new TrackDiscPair(number, total == 0 ? null : total);
    }

    /** Empty strings, zero and null count as "no total". */
    private static boolean isBlank(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence text) return text.length() == 0;
        if (value instanceof Number n) return n.doubleValue() == 0;
        if (value instanceof Boolean b) return !b;
        return false;
    }

    /**
     * Integer coercion: trimmed decimal strings, integral numbers, and
     * floating-point numbers truncated toward zero. Returns null when the value
     * does not fit an int or is not numeric.
     */
    static Integer toInteger(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            return fitsInt(l) ? (int) l : null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            long l = (long) d;
            return fitsInt(l) ? (int) l : null;
        }
        if (value instanceof CharSequence text) {
            try {
                return Integer.parseInt(text.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean fitsInt(long l) {
        return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
    }
}
