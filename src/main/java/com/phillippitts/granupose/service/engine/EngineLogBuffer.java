package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.config.engine.EngineProperties;
import com.phillippitts.granupose.domain.engine.LogChannel;
import com.phillippitts.granupose.domain.engine.LogEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded ring of engine output lines and supervisor events.
 *
 * <p>Lines are trimmed and blank lines are not stored. When full, the oldest entry is
 * dropped. Thread-safe: the stdout/stderr reader threads and the supervisor thread append
 * concurrently.
 */
@Component
public class EngineLogBuffer {

    private static final Logger LOG = LogManager.getLogger(EngineLogBuffer.class);

    static final int DEFAULT_READ_LIMIT = 200;

    private final Deque<LogEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    public EngineLogBuffer(EngineProperties props, Clock clock) {
        this.capacity = props.getLogLimit();
        this.clock = clock;
    }

    public void append(LogChannel channel, String line) {
        if (line == null) {
            return;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        switch (channel) {
            case SYSTEM -> LOG.info(trimmed);
            case STDERR -> LOG.debug("[engine:stderr] {}", trimmed);
            default -> LOG.debug("[engine:stdout] {}", trimmed);
        }
        LogEntry entry = new LogEntry(clock.millis(), channel, trimmed);
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
    }

    /** Appends a supervisor event line. */
    public void system(String line) {
        append(LogChannel.SYSTEM, line);
    }

    /**
     * Most recent entries, oldest first.
     *
     * @param limit requested count; {@code null} selects 200, otherwise clamped to [1, capacity]
     */
    public List<LogEntry> entries(Integer limit) {
        int requested = limit == null ? DEFAULT_READ_LIMIT : limit;
        int bounded = Math.max(1, Math.min(capacity, requested));
        synchronized (entries) {
            int skip = Math.max(0, entries.size() - bounded);
            List<LogEntry> out = new ArrayList<>(Math.min(bounded, entries.size()));
            Iterator<LogEntry> it = entries.iterator();
            for (int i = 0; it.hasNext(); i++) {
                LogEntry e = it.next();
                if (i >= skip) {
                    out.add(e);
                }
            }
            return out;
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
