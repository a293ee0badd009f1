package com.phillippitts.granupose.service.engine.watchdog;

import com.phillippitts.granupose.config.engine.EngineWatchdogProperties;

import java.time.Clock;
import java.util.Objects;

/**
 * Exponential-backoff restart budget for unexpected engine exits.
 *
 * <p>The n-th consecutive restart waits {@code min(maxDelay, baseDelay * 2^(n-1))}. The
 * counter starts over when more than the backoff-reset window passed since the previous
 * unexpected exit. Once the counter reached the maximum, further exits are reported as
 * exhausted and no restart is scheduled.
 *
 * <p>Not thread-safe; owned by the supervisor thread.
 */
public class EngineWatchdog {

    /**
     * Outcome of an unexpected exit.
     *
     * @param exhausted no further restart is allowed
     * @param attempt attempt number to run (1-based); the current count when exhausted
     * @param delayMs backoff before the attempt; 0 when exhausted
     */
    public record RestartDecision(boolean exhausted, int attempt, long delayMs) {
    }

    private final EngineWatchdogProperties props;
    private final Clock clock;

    private int attempts;
    private long lastUnexpectedExitMs = -1;

    public EngineWatchdog(EngineWatchdogProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RestartDecision onUnexpectedExit() {
        long now = clock.millis();
        if (lastUnexpectedExitMs < 0 || now - lastUnexpectedExitMs > props.getRestartBackoffResetMs()) {
            attempts = 0;
        }
        lastUnexpectedExitMs = now;

        if (attempts >= props.getRestartMaxAttempts()) {
            return new RestartDecision(true, attempts, 0);
        }
        attempts++;
        return new RestartDecision(false, attempts, delayForAttempt(attempts));
    }

    /** Backoff before the given 1-based attempt. */
    public long delayForAttempt(int attempt) {
        long base = props.getRestartBaseDelayMs();
        long max = props.getRestartMaxDelayMs();
        int shift = Math.max(0, attempt - 1);
        if (shift >= 62 || base > (max >> shift)) {
            return max;
        }
        return Math.min(max, base << shift);
    }

    /** Clears the counter after an intentional start or stop. */
    public void reset() {
        attempts = 0;
        lastUnexpectedExitMs = -1;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return props.getRestartMaxAttempts();
    }
}
