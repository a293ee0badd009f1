package com.phillippitts.granupose.domain.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of the supervised engine process.
 */
public enum EngineStatus {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    ERROR;

    /** Whether a process handle exists in this status. */
    public boolean hasProcess() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
