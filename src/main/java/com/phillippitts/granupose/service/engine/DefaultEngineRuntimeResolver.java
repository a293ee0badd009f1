package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.config.engine.EngineProperties;
import com.phillippitts.granupose.domain.engine.EngineRuntime;
import com.phillippitts.granupose.exception.EngineBinaryNotFoundException;
import com.phillippitts.granupose.exception.EngineLaunchException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the engine runtime from {@link EngineProperties} and well-known locations.
 *
 * <p>Search order for each path: the explicit setting, then locations below
 * {@code engine.base-dir}:
 * <ul>
 *   <li>binary: {@code engine-bin/<platform>/}, {@code engine-bin/}, {@code EmissionControl2/ecSource/bin/}</li>
 *   <li>samples: {@code EmissionControl2/externalResources/samples}, {@code engine-resources/samples}</li>
 *   <li>libs: {@code EmissionControl2/externalResources/libsndfile}, {@code engine-resources/libs}</li>
 * </ul>
 * The library directory, when found, is prepended to {@code PATH} (Windows),
 * {@code DYLD_LIBRARY_PATH} (macOS) or {@code LD_LIBRARY_PATH} (other).
 */
public class DefaultEngineRuntimeResolver implements EngineRuntimeResolver {

    static final String BINARY_BASE_NAME = "ec2_headless";

    private final EngineProperties props;
    private final String osName;
    private final Map<String, String> systemEnv;

    public DefaultEngineRuntimeResolver(EngineProperties props) {
        this(props, System.getProperty("os.name", ""), System.getenv());
    }

    DefaultEngineRuntimeResolver(EngineProperties props, String osName, Map<String, String> systemEnv) {
        this.props = Objects.requireNonNull(props, "props");
        this.osName = osName.toLowerCase(Locale.ROOT);
        this.systemEnv = Map.copyOf(systemEnv);
    }

    @Override
    public EngineRuntime resolve() {
        List<Path> binaryCandidates = binaryCandidates();
        Path binary = firstExisting(binaryCandidates);
        if (binary == null) {
            throw new EngineBinaryNotFoundException(binaryName(),
                    binaryCandidates.stream().map(Path::toString).toList());
        }

        Path dataDir = dataDir();
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new EngineLaunchException("Cannot create engine data dir " + dataDir, binary.toString(), e);
        }

        Path samplesDir = firstExisting(candidates(props.getSamplesDir(),
                Path.of("EmissionControl2", "externalResources", "samples"),
                Path.of("engine-resources", "samples")));
        Path libDir = firstExisting(candidates(props.getLibDir(),
                Path.of("EmissionControl2", "externalResources", "libsndfile"),
                Path.of("engine-resources", "libs")));

        Map<String, String> env = new HashMap<>();
        if (libDir != null) {
            String var = libraryPathVariable();
            env.put(var, prependPath(systemEnv.get(var), libDir.toString()));
        }

        List<String> args = new ArrayList<>();
        args.add("--osc-host");
        args.add(props.getOscHost());
        args.add("--osc-port");
        args.add(String.valueOf(props.getOscPort()));
        args.add("--telemetry-host");
        args.add(props.getTelemetryHost());
        args.add("--telemetry-port");
        args.add(String.valueOf(props.getTelemetryPort()));
        args.add("--data-dir");
        args.add(dataDir.toString());
        if (samplesDir != null) {
            args.add("--samples-dir");
            args.add(samplesDir.toString());
        }
        if (props.isAutostartAudio()) {
            args.add("--autostart-audio");
        }
        if (props.isNoAudio()) {
            args.add("--no-audio");
        }

        return new EngineRuntime(binary, args, binary.getParent(), env, dataDir, samplesDir, libDir);
    }

    String binaryName() {
        return isWindows() ? BINARY_BASE_NAME + ".exe" : BINARY_BASE_NAME;
    }

    List<Path> binaryCandidates() {
        String name = binaryName();
        return candidates(props.getBinaryPath(),
                Path.of("engine-bin", platformDir(), name),
                Path.of("engine-bin", name),
                Path.of("EmissionControl2", "ecSource", "bin", name));
    }

    private List<Path> candidates(String explicit, Path... relativeToBase) {
        Set<Path> ordered = new LinkedHashSet<>();
        Path configured = resolveConfigured(explicit);
        if (configured != null) {
            ordered.add(configured);
        }
        Path base = absolute(Path.of(props.getBaseDir()));
        for (Path relative : relativeToBase) {
            ordered.add(base.resolve(relative).normalize());
        }
        return new ArrayList<>(ordered);
    }

    private Path dataDir() {
        Path configured = resolveConfigured(props.getDataDir());
        if (configured != null) {
            return configured;
        }
        return Path.of(System.getProperty("user.home"), ".granupose", "ec2");
    }

    private static Path resolveConfigured(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return absolute(Path.of(raw.trim()));
    }

    private static Path absolute(Path path) {
        return path.isAbsolute() ? path.normalize() : path.toAbsolutePath().normalize();
    }

    private static Path firstExisting(List<Path> candidates) {
        for (Path candidate : candidates) {
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private String platformDir() {
        if (isWindows()) {
            return "win32";
        }
        return osName.contains("mac") ? "darwin" : "linux";
    }

    private String libraryPathVariable() {
        if (isWindows()) {
            return "PATH";
        }
        return osName.contains("mac") ? "DYLD_LIBRARY_PATH" : "LD_LIBRARY_PATH";
    }

    private boolean isWindows() {
        return osName.contains("win");
    }

    static String prependPath(String existing, String prepend) {
        if (existing == null || existing.isEmpty()) {
            return prepend;
        }
        return prepend + File.pathSeparator + existing;
    }
}
