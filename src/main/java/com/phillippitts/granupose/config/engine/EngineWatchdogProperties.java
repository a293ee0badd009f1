package com.phillippitts.granupose.config.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the engine crash-recovery watchdog.
 *
 * <p>Out-of-range values are clamped into their bounds rather than rejected:
 * base delay 250..60000 ms, max delay 500..300000 ms, attempts 1..25,
 * backoff reset 10000..900000 ms.
 */
@ConfigurationProperties(prefix = "engine.watchdog")
public class EngineWatchdogProperties {

    /** Enable automatic restart after unexpected exits. */
    private boolean autoRestart = true;

    private long restartBaseDelayMs = 1000;

    private long restartMaxDelayMs = 30000;

    private int restartMaxAttempts = 5;

    /** Quiet period after which the attempt counter starts over. */
    private long restartBackoffResetMs = 120000;

    public boolean isAutoRestart() {
        return autoRestart;
    }

    public void setAutoRestart(boolean autoRestart) {
        this.autoRestart = autoRestart;
    }

    public long getRestartBaseDelayMs() {
        return restartBaseDelayMs;
    }

    public void setRestartBaseDelayMs(long restartBaseDelayMs) {
        this.restartBaseDelayMs = clamp(restartBaseDelayMs, 250, 60_000);
    }

    public long getRestartMaxDelayMs() {
        return restartMaxDelayMs;
    }

    public void setRestartMaxDelayMs(long restartMaxDelayMs) {
        this.restartMaxDelayMs = clamp(restartMaxDelayMs, 500, 300_000);
    }

    public int getRestartMaxAttempts() {
        return restartMaxAttempts;
    }

    public void setRestartMaxAttempts(int restartMaxAttempts) {
        this.restartMaxAttempts = (int) clamp(restartMaxAttempts, 1, 25);
    }

    public long getRestartBackoffResetMs() {
        return restartBackoffResetMs;
    }

    public void setRestartBackoffResetMs(long restartBackoffResetMs) {
        this.restartBackoffResetMs = clamp(restartBackoffResetMs, 10_000, 900_000);
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
