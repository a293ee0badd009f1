package com.phillippitts.granupose.domain.engine;

/**
 * One line of engine output or a supervisor event.
 */
public record LogEntry(long timestampMs, LogChannel channel, String line) {
}
