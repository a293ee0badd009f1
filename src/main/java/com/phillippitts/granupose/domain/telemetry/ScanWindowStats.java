package com.phillippitts.granupose.domain.telemetry;

import java.util.List;

/**
 * Aggregate statistics over a window of scan samples.
 */
public record ScanWindowStats(
        int count,
        long elapsedMs,
        double cadenceHz,
        double playheadSpan,
        double scanHeadSpan,
        double scanRangeSpan,
        int activeGrainMax
) {
    public static final ScanWindowStats EMPTY = new ScanWindowStats(0, 0, 0, 0, 0, 0, 0);

    /**
     * Computes spans (max - min), the maximum active-grain count and the cadence
     * ({@code count / elapsedSeconds}, 0 when elapsed is 0) over {@code samples}.
     */
    public static ScanWindowStats of(List<TelemetryScanSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return EMPTY;
        }
        double minPlayhead = Double.POSITIVE_INFINITY;
        double maxPlayhead = Double.NEGATIVE_INFINITY;
        double minScanHead = Double.POSITIVE_INFINITY;
        double maxScanHead = Double.NEGATIVE_INFINITY;
        double minScanRange = Double.POSITIVE_INFINITY;
        double maxScanRange = Double.NEGATIVE_INFINITY;
        int grainMax = 0;

        for (TelemetryScanSample s : samples) {
            minPlayhead = Math.min(minPlayhead, s.playheadNorm());
            maxPlayhead = Math.max(maxPlayhead, s.playheadNorm());
            minScanHead = Math.min(minScanHead, s.scanHeadNorm());
            maxScanHead = Math.max(maxScanHead, s.scanHeadNorm());
            minScanRange = Math.min(minScanRange, s.scanRangeNorm());
            maxScanRange = Math.max(maxScanRange, s.scanRangeNorm());
            grainMax = Math.max(grainMax, Math.max(0, s.activeGrainCount()));
        }

        long first = samples.get(0).timestampMs();
        long last = samples.get(samples.size() - 1).timestampMs();
        long elapsedMs = Math.max(0, last - first);
        double cadenceHz = elapsedMs > 0 ? samples.size() / (elapsedMs / 1000.0) : 0.0;

        return new ScanWindowStats(
                samples.size(),
                elapsedMs,
                cadenceHz,
                Math.max(0, maxPlayhead - minPlayhead),
                Math.max(0, maxScanHead - minScanHead),
                Math.max(0, maxScanRange - minScanRange),
                grainMax
        );
    }
}
