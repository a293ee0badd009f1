package com.phillippitts.granupose.service.relay;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-key minimum-interval gate.
 *
 * <p>The interval is {@code floor(1000 / maxMessagesPerSecond)} ms; a non-positive rate
 * disables the gate. Each key keeps the timestamp of its last accepted message; entries are
 * never removed. If the clock steps backwards past a key's timestamp, the next message for
 * that key is accepted and its window restarts from the new time. Check-and-update is atomic
 * per key, so concurrent callers on the same key cannot both pass within one interval.
 */
final class RateLimiter {

    private final long minIntervalMs;
    private final Clock clock;
    private final ConcurrentMap<String, Long> lastSentByKey = new ConcurrentHashMap<>();

    RateLimiter(int maxMessagesPerSecond, Clock clock) {
        this.minIntervalMs = maxMessagesPerSecond > 0 ? 1000L / maxMessagesPerSecond : 0L;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    long minIntervalMs() {
        return minIntervalMs;
    }

    /**
     * Returns {@code true} and records the send when {@code key} may send now; {@code false}
     * when the message should be dropped. Blank keys are never limited.
     */
    boolean tryAcquire(String key) {
        if (minIntervalMs <= 0 || key == null || key.isEmpty()) {
            return true;
        }
        long now = clock.millis();
        boolean[] allowed = new boolean[1];
        lastSentByKey.compute(key, (k, last) -> {
            // a backwards clock step (now < last) starts a fresh window at now
            if (last != null && now >= last && now - last < minIntervalMs) {
                allowed[0] = false;
                return last;
            }
            allowed[0] = true;
            return now;
        });
        return allowed[0];
    }

    /** Number of distinct keys seen so far. */
    int trackedKeys() {
        return lastSentByKey.size();
    }
}
