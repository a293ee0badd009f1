package com.phillippitts.granupose.config.telemetry;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the inbound telemetry listener.
 */
@ConfigurationProperties(prefix = "bridge.telemetry")
@Validated
public class TelemetryProperties {

    @NotBlank(message = "Telemetry listen host must not be blank")
    private String listenHost = "0.0.0.0";

    /** 0 binds an ephemeral port (used by tests). */
    @Min(value = 0, message = "Telemetry listen port must be between 0 and 65535")
    @Max(value = 65535, message = "Telemetry listen port must be between 0 and 65535")
    private int listenPort = 16448;

    @Pattern(regexp = "^/.*", message = "Hello address must start with /")
    private String helloAddress = "/ec2/hello";

    @Pattern(regexp = "^/.*", message = "Scan address must start with /")
    private String scanAddress = "/ec2/telemetry/scan";

    @Positive(message = "Scan buffer capacity must be positive")
    private int scanBufferCapacity = 12000;

    /** Poll interval of capture windows and hello waits. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 150;

    public String getListenHost() {
        return listenHost;
    }

    public void setListenHost(String listenHost) {
        this.listenHost = listenHost;
    }

    public int getListenPort() {
        return listenPort;
    }

    public void setListenPort(int listenPort) {
        this.listenPort = listenPort;
    }

    public String getHelloAddress() {
        return helloAddress;
    }

    public void setHelloAddress(String helloAddress) {
        this.helloAddress = helloAddress;
    }

    public String getScanAddress() {
        return scanAddress;
    }

    public void setScanAddress(String scanAddress) {
        this.scanAddress = scanAddress;
    }

    public int getScanBufferCapacity() {
        return scanBufferCapacity;
    }

    public void setScanBufferCapacity(int scanBufferCapacity) {
        this.scanBufferCapacity = scanBufferCapacity;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }
}
