package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns decoded OSC messages into typed telemetry samples. Pure: no I/O, no state.
 *
 * <p>Scan layout: {@code [playhead, scanHead, scanRange, frames?, grainIndex...]}. The first
 * three must be numeric and are clamped to [0,1]; {@code frames} counts only when greater
 * than 1; grain indices are truncated, floored at 0 and capped at {@value #MAX_GRAINS}.
 * Malformed scans are dropped without side effects.
 */
public final class TelemetryParser {

    static final int MAX_GRAINS = 2048;
    static final int MAX_HELLO_ARGS = 32;

    private final String helloAddress;
    private final String scanAddress;

    public TelemetryParser(String helloAddress, String scanAddress) {
        this.helloAddress = Objects.requireNonNull(helloAddress, "helloAddress");
        this.scanAddress = Objects.requireNonNull(scanAddress, "scanAddress");
    }

    public boolean isHello(OscMessage message) {
        return message != null && helloAddress.equals(message.address());
    }

    public boolean isScan(OscMessage message) {
        return message != null && scanAddress.equals(message.address());
    }

    /**
     * Parses a scan message.
     *
     * @param receivedAtMs timestamp to stamp on the sample
     * @return the sample, or empty when the address differs or the payload is malformed
     */
    public Optional<TelemetryScanSample> parseScan(OscMessage message, long receivedAtMs) {
        if (!isScan(message)) {
            return Optional.empty();
        }
        List<OscArgument> args = message.arguments();
        if (args.size() < 3) {
            return Optional.empty();
        }
        Double playhead = finite(args.get(0));
        Double scanHead = finite(args.get(1));
        Double scanRange = finite(args.get(2));
        if (playhead == null || scanHead == null || scanRange == null) {
            return Optional.empty();
        }

        Integer frames = null;
        if (args.size() >= 4) {
            Double rawFrames = finite(args.get(3));
            if (rawFrames != null && rawFrames > 1) {
                frames = (int) Math.min(Integer.MAX_VALUE, Math.floor(rawFrames));
            }
        }

        List<Integer> indices = new ArrayList<>();
        for (int i = 4; i < args.size() && indices.size() < MAX_GRAINS; i++) {
            Double value = finite(args.get(i));
            if (value == null) {
                continue;
            }
            indices.add((int) Math.max(0, Math.min(Integer.MAX_VALUE, value.longValue())));
        }

        List<Double> positions = new ArrayList<>(indices.size());
        for (int index : indices) {
            positions.add(frames != null ? clamp01((double) index / frames) : clamp01(index));
        }

        return Optional.of(new TelemetryScanSample(
                receivedAtMs,
                clamp01(playhead),
                clamp01(scanHead),
                clamp01(scanRange),
                frames,
                indices.size(),
                indices,
                positions));
    }

    /**
     * Parses a hello message. Strings are trimmed and dropped when empty, finite numbers and
     * booleans are kept, anything else is rendered as a string; at most
     * {@value #MAX_HELLO_ARGS} arguments are retained.
     */
    public Optional<TelemetryHelloSample> parseHello(OscMessage message, long receivedAtMs) {
        if (!isHello(message)) {
            return Optional.empty();
        }
        List<Object> args = new ArrayList<>();
        for (OscArgument arg : message.arguments()) {
            Object normalized = normalizeHelloArg(arg.value());
            if (normalized == null) {
                continue;
            }
            args.add(normalized);
            if (args.size() >= MAX_HELLO_ARGS) {
                break;
            }
        }
        return Optional.of(new TelemetryHelloSample(receivedAtMs, message.address(), args));
    }

    private static Object normalizeHelloArg(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return Double.isFinite(n.doubleValue()) ? n : String.valueOf(n);
        }
        if (value instanceof byte[] bytes) {
            return "blob[" + bytes.length + "]";
        }
        return String.valueOf(value);
    }

    private static Double finite(OscArgument arg) {
        Double value = arg.numericValue();
        return value != null && Double.isFinite(value) ? value : null;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
