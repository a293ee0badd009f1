package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.domain.engine.EngineRuntime;

/**
 * Resolves how to launch the engine: binary, CLI arguments, working directory and
 * environment.
 */
@FunctionalInterface
public interface EngineRuntimeResolver {

    /**
     * @throws com.phillippitts.granupose.exception.EngineBinaryNotFoundException if no binary exists
     * @throws com.phillippitts.granupose.exception.EngineLaunchException if the data directory
     *         cannot be created
     */
    EngineRuntime resolve();
}
