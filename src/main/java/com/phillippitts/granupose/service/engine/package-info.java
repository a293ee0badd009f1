/**
 * Supervision of the external {@code ec2_headless} engine process.
 *
 * <p>{@link com.phillippitts.granupose.service.engine.EngineSupervisor} owns the lifecycle and
 * runs every transition on one thread. Process launching ({@link
 * com.phillippitts.granupose.service.engine.ProcessFactory}), runtime discovery ({@link
 * com.phillippitts.granupose.service.engine.EngineRuntimeResolver}) and delayed tasks ({@link
 * com.phillippitts.granupose.service.engine.RestartScheduler}) are seams so the supervisor can be
 * tested without real processes or real time.
 */
package com.phillippitts.granupose.service.engine;
