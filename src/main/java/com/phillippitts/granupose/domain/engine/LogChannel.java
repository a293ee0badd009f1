package com.phillippitts.granupose.domain.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a {@link LogEntry}.
 */
public enum LogChannel {
    STDOUT,
    STDERR,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
