/**
 * Crash-recovery policy for the supervised engine.
 *
 * <p>{@link com.phillippitts.granupose.service.engine.watchdog.EngineWatchdog} decides whether and
 * when to restart; scheduling and the restart itself belong to
 * {@link com.phillippitts.granupose.service.engine.EngineSupervisor}.
 */
package com.phillippitts.granupose.service.engine.watchdog;
