package com.phillippitts.granupose.presentation.dto;

import com.phillippitts.granupose.domain.osc.ChannelValue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/channels/batch} and the {@code channels:set} WebSocket payload.
 */
public record ChannelBatchRequest(
        @NotNull(message = "channels is required")
        @Size(min = 1, max = 64, message = "channels must contain 1 to 64 items")
        List<@Valid @NotNull ChannelRequest> channels
) {
    public List<ChannelValue> toChannelValues() {
        return channels.stream()
                .map(c -> new ChannelValue(c.channel(), c.value()))
                .toList();
    }
}
