package com.phillippitts.granupose.domain.engine;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a lifecycle operation: success flag, optional error and the state afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineOperationResult(boolean ok, String error, EngineStatusSnapshot state) {

    public static EngineOperationResult success(EngineStatusSnapshot state) {
        return new EngineOperationResult(true, null, state);
    }

    public static EngineOperationResult failure(String error, EngineStatusSnapshot state) {
        return new EngineOperationResult(false, error, state);
    }
}
