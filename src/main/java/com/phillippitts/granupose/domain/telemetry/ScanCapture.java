package com.phillippitts.granupose.domain.telemetry;

import java.util.List;

/**
 * Result of a time-windowed scan capture.
 */
public record ScanCapture(long startedAtMs, long completedAtMs, List<TelemetryScanSample> samples,
                          ScanWindowStats stats) {

    public ScanCapture {
        samples = List.copyOf(samples);
    }
}
