package com.phillippitts.granupose.domain.osc;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single typed OSC argument.
 *
 * <p>Type tags follow OSC 1.0: {@code f} float32, {@code i} int32, {@code d} float64,
 * {@code s} string, {@code h} int64, {@code t} timetag, {@code b} blob, and the
 * payload-less {@code T}, {@code F}, {@code N}, {@code I}.
 *
 * @param type OSC type tag
 * @param value Java value ({@link Float}, {@link Integer}, {@link Double}, {@link String},
 *              {@link Long}, {@code byte[]}, {@link Boolean} or {@code null})
 */
public record OscArgument(char type, Object value) {

    public static OscArgument ofFloat(float value) {
        return new OscArgument('f', value);
    }

    public static OscArgument ofInt(int value) {
        return new OscArgument('i', value);
    }

    public static OscArgument ofDouble(double value) {
        return new OscArgument('d', value);
    }

    public static OscArgument ofString(String value) {
        return new OscArgument('s', Objects.requireNonNull(value, "value"));
    }

    /** Returns the numeric value as a double, or {@code null} for non-numeric arguments. */
    public Double numericValue() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OscArgument other)) {
            return false;
        }
        if (type != other.type) {
            return false;
        }
        if (value instanceof byte[] a && other.value instanceof byte[] b) {
            return Arrays.equals(a, b);
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int valueHash = value instanceof byte[] bytes ? Arrays.hashCode(bytes) : Objects.hashCode(value);
        return 31 * Character.hashCode(type) + valueHash;
    }

    @Override
    public String toString() {
        String rendered = value instanceof byte[] bytes ? "blob[" + bytes.length + "]" : String.valueOf(value);
        return type + ":" + rendered;
    }
}
