package com.phillippitts.granupose.config.engine;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the supervised {@code ec2_headless} engine process.
 *
 * <p>Path settings are optional. When blank, the runtime resolver searches well-known
 * locations below {@link #getBaseDir()}.
 *
 * <p>Example application.properties:
 * <pre>
 * engine.binary-path=/opt/granupose/engine-bin/linux/ec2_headless
 * engine.data-dir=${user.home}/.granupose/ec2
 * engine.auto-start=true
 * engine.log-limit=400
 * </pre>
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public class EngineProperties {

    static final int LOG_LIMIT_MIN = 50;
    static final int LOG_LIMIT_MAX = 2000;

    /** Explicit engine binary; checked before the well-known locations. */
    private String binaryPath = "";

    /** Root of the well-known engine layout (engine-bin/, engine-resources/, EmissionControl2/). */
    @NotBlank(message = "Engine base dir must not be blank")
    private String baseDir = ".";

    /** Writable engine data directory; created on start. Blank selects ~/.granupose/ec2. */
    private String dataDir = "";

    private String samplesDir = "";

    /** Shared-library directory prepended to the platform library path. */
    private String libDir = "";

    @NotBlank(message = "Engine OSC host must not be blank")
    private String oscHost = "127.0.0.1";

    @Min(value = 1, message = "Engine OSC port must be between 1 and 65535")
    @Max(value = 65535, message = "Engine OSC port must be between 1 and 65535")
    private int oscPort = 16447;

    @NotBlank(message = "Engine telemetry host must not be blank")
    private String telemetryHost = "127.0.0.1";

    @Min(value = 1, message = "Engine telemetry port must be between 1 and 65535")
    @Max(value = 65535, message = "Engine telemetry port must be between 1 and 65535")
    private int telemetryPort = 16448;

    /** Start the engine once the application is ready. */
    private boolean autoStart = true;

    /** Pass {@code --autostart-audio}. */
    private boolean autostartAudio = true;

    /** Pass {@code --no-audio}. */
    private boolean noAudio = false;

    /** Log buffer capacity, clamped to 50..2000. */
    private int logLimit = 400;

    /** Grace period between graceful termination and forced kill. */
    @Positive(message = "Stop grace period must be positive")
    private long stopGraceMs = 5000;

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getSamplesDir() {
        return samplesDir;
    }

    public void setSamplesDir(String samplesDir) {
        this.samplesDir = samplesDir;
    }

    public String getLibDir() {
        return libDir;
    }

    public void setLibDir(String libDir) {
        this.libDir = libDir;
    }

    public String getOscHost() {
        return oscHost;
    }

    public void setOscHost(String oscHost) {
        this.oscHost = oscHost;
    }

    public int getOscPort() {
        return oscPort;
    }

    public void setOscPort(int oscPort) {
        this.oscPort = oscPort;
    }

    public String getTelemetryHost() {
        return telemetryHost;
    }

    public void setTelemetryHost(String telemetryHost) {
        this.telemetryHost = telemetryHost;
    }

    public int getTelemetryPort() {
        return telemetryPort;
    }

    public void setTelemetryPort(int telemetryPort) {
        this.telemetryPort = telemetryPort;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isAutostartAudio() {
        return autostartAudio;
    }

    public void setAutostartAudio(boolean autostartAudio) {
        this.autostartAudio = autostartAudio;
    }

    public boolean isNoAudio() {
        return noAudio;
    }

    public void setNoAudio(boolean noAudio) {
        this.noAudio = noAudio;
    }

    public int getLogLimit() {
        return logLimit;
    }

    public void setLogLimit(int logLimit) {
        this.logLimit = Math.max(LOG_LIMIT_MIN, Math.min(LOG_LIMIT_MAX, logLimit));
    }

    public long getStopGraceMs() {
        return stopGraceMs;
    }

    public void setStopGraceMs(long stopGraceMs) {
        this.stopGraceMs = stopGraceMs;
    }
}
