package com.phillippitts.granupose.domain.osc;

import java.util.List;
import java.util.Objects;

/**
 * An OSC message: address pattern plus ordered typed arguments.
 */
public record OscMessage(String address, List<OscArgument> arguments) {

    public OscMessage {
        Objects.requireNonNull(address, "address");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static OscMessage of(String address, OscArgument... arguments) {
        return new OscMessage(address, List.of(arguments));
    }

    /** Type tag string without the leading comma, e.g. {@code "ffi"}. */
    public String typeTags() {
        StringBuilder sb = new StringBuilder(arguments.size());
        for (OscArgument arg : arguments) {
            sb.append(arg.type());
        }
        return sb.toString();
    }
}
