package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.domain.engine.EngineStatusSnapshot;

/**
 * Published by {@link EngineSupervisor} after every state transition.
 *
 * @param previous state before the transition
 * @param current state after the transition
 * @param timestampMs wall-clock time of the transition
 */
public record EngineStatusChangedEvent(EngineStatusSnapshot previous, EngineStatusSnapshot current,
                                       long timestampMs) {
}
