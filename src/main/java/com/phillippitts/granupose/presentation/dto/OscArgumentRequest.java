package com.phillippitts.granupose.presentation.dto;

import com.phillippitts.granupose.domain.osc.CommandArgument;
import com.phillippitts.granupose.presentation.dto.validation.NumberOrString;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * One OSC argument as sent by a client: {@code {"type": "f", "value": 0.5}}.
 */
public record OscArgumentRequest(
        @NotNull(message = "type is required")
        @Pattern(regexp = "[fids]", message = "type must be one of f, i, d, s")
        String type,

        @NotNull(message = "value is required")
        @NumberOrString
        Object value
) {
    public CommandArgument toCommandArgument() {
        return new CommandArgument(type, value);
    }
}
