package com.phillippitts.granupose.domain.engine;

import java.util.List;

/**
 * Immutable view of the supervisor state, published after every transition.
 *
 * <p>{@code pid} is non-null exactly when {@code status} is {@code starting}, {@code running}
 * or {@code stopping}.
 *
 * @param autoRestartEnabled effective flag: configured auto-restart and not disabled by an
 *                           intentional stop or watchdog exhaustion
 */
public record EngineStatusSnapshot(
        EngineStatus status,
        Long pid,
        String binaryPath,
        List<String> args,
        Long startedAtMs,
        Long stoppedAtMs,
        boolean autoStartEnabled,
        boolean autoRestartEnabled,
        int restartAttempts,
        int restartMaxAttempts,
        String lastError
) {
    public EngineStatusSnapshot {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static EngineStatusSnapshot initial(boolean autoStartEnabled, boolean autoRestartEnabled,
                                               int restartMaxAttempts) {
        return new EngineStatusSnapshot(EngineStatus.STOPPED, null, null, List.of(), null, null,
                autoStartEnabled, autoRestartEnabled, 0, restartMaxAttempts, null);
    }
}
