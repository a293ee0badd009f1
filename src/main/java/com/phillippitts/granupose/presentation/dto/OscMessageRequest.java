package com.phillippitts.granupose.presentation.dto;

import com.phillippitts.granupose.domain.osc.CommandRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/**
 * Body of {@code POST /api/osc} and the {@code osc:send} WebSocket payload.
 *
 * @param args optional; absent means no arguments
 * @param rateLimitKey optional; the address is used when absent
 */
public record OscMessageRequest(
        @NotBlank(message = "address is required")
        @Pattern(regexp = "^/.*", message = "OSC addresses must start with /")
        String address,

        List<@Valid @NotNull OscArgumentRequest> args,

        String rateLimitKey
) {
    public CommandRequest toCommandRequest() {
        List<OscArgumentRequest> safeArgs = args == null ? List.of() : args;
        return new CommandRequest(address,
                safeArgs.stream().map(OscArgumentRequest::toCommandArgument).toList(),
                rateLimitKey);
    }
}
