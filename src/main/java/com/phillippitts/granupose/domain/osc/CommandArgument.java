package com.phillippitts.granupose.domain.osc;

/**
 * Untrusted argument of a {@link CommandRequest} as supplied by a caller.
 *
 * @param type declared type: {@code f}, {@code i}, {@code d} or {@code s}
 * @param value raw value, a number or a string; coerced by the relay
 */
public record CommandArgument(String type, Object value) {

    public static CommandArgument ofFloat(double value) {
        return new CommandArgument("f", value);
    }

    public static CommandArgument ofInt(long value) {
        return new CommandArgument("i", value);
    }

    public static CommandArgument ofString(String value) {
        return new CommandArgument("s", value);
    }
}
