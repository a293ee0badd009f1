package com.phillippitts.granupose.domain.telemetry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Startup announcement from the engine. Arguments are normalized to {@link String},
 * {@link Number} or {@link Boolean}; {@code key=value} strings are split by {@link #argsMap()}.
 */
public record TelemetryHelloSample(long timestampMs, String address, List<Object> args) {

    public TelemetryHelloSample {
        args = List.copyOf(args);
    }

    /**
     * Splits {@code key=value} string arguments into an ordered map. Non-string arguments and
     * strings without a key are skipped; later keys overwrite earlier ones.
     */
    public Map<String, String> argsMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Object arg : args) {
            if (!(arg instanceof String s)) {
                continue;
            }
            String trimmed = s.trim();
            int separator = trimmed.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = trimmed.substring(0, separator).trim();
            if (key.isEmpty()) {
                continue;
            }
            map.put(key, trimmed.substring(separator + 1).trim());
        }
        return map;
    }
}
