package com.phillippitts.granupose.config.osc;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the outbound OSC command relay.
 *
 * <p>Example application.properties:
 * <pre>
 * bridge.osc.target-host=127.0.0.1
 * bridge.osc.target-port=16447
 * bridge.osc.channel-prefix=/pose/out
 * bridge.osc.channel-count=16
 * bridge.osc.max-messages-per-second=60
 * </pre>
 */
@ConfigurationProperties(prefix = "bridge.osc")
@Validated
public class OscProperties {

    static final String DEFAULT_CHANNEL_PREFIX = "/pose/out";

    /** Host the engine receives OSC commands on. */
    @NotBlank(message = "OSC target host must not be blank")
    private String targetHost = "127.0.0.1";

    @Min(value = 1, message = "OSC target port must be between 1 and 65535")
    @Max(value = 65535, message = "OSC target port must be between 1 and 65535")
    private int targetPort = 16447;

    /** Prefix for channel addresses; trailing slashes are stripped. */
    private String channelPrefix = DEFAULT_CHANNEL_PREFIX;

    @Positive(message = "Channel count must be positive")
    private int channelCount = 16;

    /** Per-key send rate ceiling; 0 or less disables rate limiting. */
    private int maxMessagesPerSecond = 60;

    @Positive(message = "Bind timeout must be positive")
    private long bindTimeoutMs = 2000;

    /** Interval of the activity summary log; 0 disables it. */
    @PositiveOrZero(message = "Activity log interval must not be negative")
    private long activityLogIntervalMs = 1000;

    public String getTargetHost() {
        return targetHost;
    }

    public void setTargetHost(String targetHost) {
        this.targetHost = targetHost;
    }

    public int getTargetPort() {
        return targetPort;
    }

    public void setTargetPort(int targetPort) {
        this.targetPort = targetPort;
    }

    public String getChannelPrefix() {
        return channelPrefix;
    }

    public void setChannelPrefix(String channelPrefix) {
        this.channelPrefix = normalizePrefix(channelPrefix);
    }

    public int getChannelCount() {
        return channelCount;
    }

    public void setChannelCount(int channelCount) {
        this.channelCount = channelCount;
    }

    public int getMaxMessagesPerSecond() {
        return maxMessagesPerSecond;
    }

    public void setMaxMessagesPerSecond(int maxMessagesPerSecond) {
        this.maxMessagesPerSecond = maxMessagesPerSecond;
    }

    public long getBindTimeoutMs() {
        return bindTimeoutMs;
    }

    public void setBindTimeoutMs(long bindTimeoutMs) {
        this.bindTimeoutMs = bindTimeoutMs;
    }

    public long getActivityLogIntervalMs() {
        return activityLogIntervalMs;
    }

    public void setActivityLogIntervalMs(long activityLogIntervalMs) {
        this.activityLogIntervalMs = activityLogIntervalMs;
    }

    /**
     * Strips trailing slashes; falls back to {@code /pose/out} when nothing is left.
     */
    static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return DEFAULT_CHANNEL_PREFIX;
        }
        String trimmed = prefix.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        return end == 0 ? DEFAULT_CHANNEL_PREFIX : trimmed.substring(0, end);
    }
}
