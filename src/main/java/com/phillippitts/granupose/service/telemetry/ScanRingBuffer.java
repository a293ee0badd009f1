package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bounded ring of scan samples. Thread-safe for one producer (the telemetry event loop) and
 * any number of readers.
 *
 * <p>Every appended sample gets the next value of a sequence that is never reset, not even by
 * {@link #clear()}, so readers can ask for "everything after sequence N".
 */
final class ScanRingBuffer {

    private final TelemetryScanSample[] buffer;
    private int writePos = 0;
    private int size = 0;
    private long sequence = 0;

    ScanRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.buffer = new TelemetryScanSample[capacity];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized void append(TelemetryScanSample sample) {
        buffer[writePos] = sample;
        writePos = (writePos + 1) % buffer.length;
        size = Math.min(size + 1, buffer.length);
        sequence++;
    }

    /** Total number of samples ever appended. */
    synchronized long sequence() {
        return sequence;
    }

    synchronized int size() {
        return size;
    }

    /**
     * Retained samples appended after {@code afterSequence}, oldest first. Samples already
     * overwritten or cleared are not returned.
     */
    synchronized List<TelemetryScanSample> since(long afterSequence) {
        long newer = sequence - afterSequence;
        int count = (int) Math.max(0, Math.min(newer, size));
        return tail(count);
    }

    synchronized List<TelemetryScanSample> snapshot() {
        return tail(size);
    }

    synchronized void clear() {
        Arrays.fill(buffer, null);
        writePos = 0;
        size = 0;
    }

    private List<TelemetryScanSample> tail(int count) {
        List<TelemetryScanSample> out = new ArrayList<>(count);
        int start = (writePos - count + buffer.length) % buffer.length;
        for (int i = 0; i < count; i++) {
            out.add(buffer[(start + i) % buffer.length]);
        }
        return out;
    }
}
