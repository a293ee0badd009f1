package com.phillippitts.granupose.domain.telemetry;

import java.util.List;

/**
 * One scan telemetry sample. All normalized fields are clamped to [0,1] by the parser before
 * a sample is created.
 *
 * @param timestampMs receive time, epoch millis
 * @param soundFileFrames total frames of the loaded sound file, or {@code null} when unknown
 * @param activeGrainIndices grain frame indices, at most 2048
 * @param activeGrainNormPositions grain positions normalized against {@code soundFileFrames}
 */
public record TelemetryScanSample(
        long timestampMs,
        double playheadNorm,
        double scanHeadNorm,
        double scanRangeNorm,
        Integer soundFileFrames,
        int activeGrainCount,
        List<Integer> activeGrainIndices,
        List<Double> activeGrainNormPositions
) {
    public TelemetryScanSample {
        activeGrainIndices = List.copyOf(activeGrainIndices);
        activeGrainNormPositions = List.copyOf(activeGrainNormPositions);
    }
}
