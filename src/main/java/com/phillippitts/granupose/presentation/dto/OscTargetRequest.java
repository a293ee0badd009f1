package com.phillippitts.granupose.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/osc/target}: new destination for outbound OSC.
 */
public record OscTargetRequest(
        @NotBlank(message = "host is required")
        String host,

        @NotNull(message = "port is required")
        @Min(value = 1, message = "port must be between 1 and 65535")
        @Max(value = 65535, message = "port must be between 1 and 65535")
        Integer port
) {
}
