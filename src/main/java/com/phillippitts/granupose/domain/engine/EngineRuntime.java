package com.phillippitts.granupose.domain.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to launch the engine process.
 *
 * @param binary resolved executable
 * @param args CLI arguments, excluding the executable
 * @param workingDirectory directory the process starts in
 * @param environment variables to set or override on top of the inherited environment
 * @param dataDir writable engine data directory (exists)
 * @param samplesDir bundled samples directory, or {@code null} when none was found
 * @param libDir shared-library directory, or {@code null} when none was found
 */
public record EngineRuntime(Path binary, List<String> args, Path workingDirectory,
                            Map<String, String> environment, Path dataDir, Path samplesDir, Path libDir) {

    public EngineRuntime {
        args = List.copyOf(args);
        environment = Map.copyOf(environment);
    }

    /** Full command line, executable first. */
    public List<String> command() {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(binary.toString());
        cmd.addAll(args);
        return cmd;
    }
}
