package com.phillippitts.granupose.presentation.dto;

import com.phillippitts.granupose.domain.osc.CommandRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/osc/batch} and the {@code osc:batch} WebSocket payload.
 */
public record OscBatchRequest(
        @NotNull(message = "messages is required")
        @Size(min = 1, max = 64, message = "messages must contain 1 to 64 items")
        List<@Valid @NotNull OscMessageRequest> messages
) {
    public List<CommandRequest> toCommandRequests() {
        return messages.stream().map(OscMessageRequest::toCommandRequest).toList();
    }
}
