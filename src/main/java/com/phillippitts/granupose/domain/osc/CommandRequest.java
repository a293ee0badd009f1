package com.phillippitts.granupose.domain.osc;

import java.util.List;

/**
 * Outbound command request handed to the command relay. Transient, never persisted.
 *
 * @param address OSC address; must begin with {@code /}
 * @param arguments ordered arguments, validated and coerced by the relay
 * @param rateLimitKey optional key for the rate limiter; the address is used when blank
 */
public record CommandRequest(String address, List<CommandArgument> arguments, String rateLimitKey) {

    public CommandRequest {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public CommandRequest(String address, List<CommandArgument> arguments) {
        this(address, arguments, null);
    }

    /** Effective rate-limit key: the explicit key when present, otherwise the address. */
    public String effectiveRateLimitKey() {
        if (rateLimitKey != null && !rateLimitKey.isBlank()) {
            return rateLimitKey;
        }
        return address;
    }
}
