package com.phillippitts.granupose.presentation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/channels} and the {@code channel:set} WebSocket payload.
 */
public record ChannelRequest(
        @NotNull(message = "channel is required")
        @Min(value = 1, message = "channel must be between 1 and 64")
        @Max(value = 64, message = "channel must be between 1 and 64")
        Integer channel,

        @NotNull(message = "value is required")
        @DecimalMin(value = "0.0", message = "value must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "value must be between 0 and 1")
        Double value
) {
}
