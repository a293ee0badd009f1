package com.phillippitts.granupose.util;

import java.time.Duration;

/**
 * Timeout values for engine process and reader-thread management.
 *
 * @see com.phillippitts.granupose.service.engine.EngineSupervisor
 */
public final class ProcessTimeouts {

    /**
     * Time granted to the output reader threads to flush the last lines after the process exited.
     *
     * <p>Reader threads are daemons; if they do not finish they are abandoned.
     */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Extra time, on top of the stop grace period, that application shutdown waits for the
     * engine to exit before giving up.
     */
    public static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(2);

    /** Wait applied after {@link Process#destroyForcibly()} during application shutdown. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
