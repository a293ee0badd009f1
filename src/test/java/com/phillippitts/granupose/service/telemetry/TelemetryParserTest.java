package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;
import com.phillippitts.granupose.service.osc.OscCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class TelemetryParserTest {

    private static final String HELLO = "/ec2/hello";
    private static final String SCAN = "/ec2/telemetry/scan";

    private final TelemetryParser parser = new TelemetryParser(HELLO, SCAN);

    @Test
    void parsesScanWithFramesAndOneGrain() {
        OscMessage msg = OscMessage.of(SCAN, f(0.5), f(0.3), f(0.2), f(1000), f(500));

        TelemetryScanSample sample = parser.parseScan(msg, 42L).orElseThrow();

        assertThat(sample.timestampMs()).isEqualTo(42L);
        assertThat(sample.playheadNorm()).isEqualTo(0.5);
        assertThat(sample.scanHeadNorm()).isEqualTo(0.3, offset(1e-6));
        assertThat(sample.scanRangeNorm()).isEqualTo(0.2, offset(1e-6));
        assertThat(sample.soundFileFrames()).isEqualTo(1000);
        assertThat(sample.activeGrainCount()).isEqualTo(1);
        assertThat(sample.activeGrainIndices()).containsExactly(500);
        assertThat(sample.activeGrainNormPositions()).containsExactly(0.5);
    }

    @Test
    void clampsHeadsIntoUnitRange() {
        OscMessage msg = OscMessage.of(SCAN, f(-0.5), f(1.7), OscArgument.ofInt(3));

        TelemetryScanSample sample = parser.parseScan(msg, 0L).orElseThrow();

        assertThat(sample.playheadNorm()).isZero();
        assertThat(sample.scanHeadNorm()).isEqualTo(1.0);
        assertThat(sample.scanRangeNorm()).isEqualTo(1.0);
        assertThat(sample.soundFileFrames()).isNull();
        assertThat(sample.activeGrainCount()).isZero();
    }

    @Test
    void framesOfOneOrLessAreIgnored() {
        OscMessage msg = OscMessage.of(SCAN, f(0.1), f(0.1), f(0.1), f(1), f(0.4));

        TelemetryScanSample sample = parser.parseScan(msg, 0L).orElseThrow();

        assertThat(sample.soundFileFrames()).isNull();
        // index truncated to 0, position is the index clamped
        assertThat(sample.activeGrainIndices()).containsExactly(0);
        assertThat(sample.activeGrainNormPositions()).containsExactly(0.0);
    }

    @Test
    void negativeGrainIndexIsFlooredAtZero() {
        OscMessage msg = OscMessage.of(SCAN, f(0), f(0), f(0), f(100), f(-20), f(250));

        TelemetryScanSample sample = parser.parseScan(msg, 0L).orElseThrow();

        assertThat(sample.activeGrainIndices()).containsExactly(0, 250);
        assertThat(sample.activeGrainNormPositions()).containsExactly(0.0, 1.0);
    }

    @Test
    void grainListIsCapped() {
        List<OscArgument> args = new ArrayList<>(List.of(f(0), f(0), f(0), f(100000)));
        for (int i = 0; i < TelemetryParser.MAX_GRAINS + 100; i++) {
            args.add(OscArgument.ofInt(i));
        }

        TelemetryScanSample sample = parser.parseScan(new OscMessage(SCAN, args), 0L).orElseThrow();

        assertThat(sample.activeGrainCount()).isEqualTo(TelemetryParser.MAX_GRAINS);
        assertThat(sample.activeGrainIndices()).hasSize(TelemetryParser.MAX_GRAINS);
    }

    @Test
    void dropsScanWithTooFewOrNonNumericHeads() {
        assertThat(parser.parseScan(OscMessage.of(SCAN, f(0.1), f(0.2)), 0L)).isEmpty();
        assertThat(parser.parseScan(OscMessage.of(SCAN, f(0.1), OscArgument.ofString("x"), f(0.2)), 0L)).isEmpty();
        assertThat(parser.parseScan(OscMessage.of(SCAN, f(Float.NaN), f(0.1), f(0.2)), 0L)).isEmpty();
    }

    @Test
    void ignoresOtherAddresses() {
        assertThat(parser.parseScan(OscMessage.of("/other", f(0), f(0), f(0)), 0L)).isEmpty();
        assertThat(parser.parseHello(OscMessage.of("/other"), 0L)).isEmpty();
    }

    @Test
    void helloKeepsTrimmedStringsAndSplitsKeyValues() {
        OscMessage msg = OscMessage.of(HELLO,
                OscArgument.ofString(" version=1.2 "), OscArgument.ofString("   "),
                OscArgument.ofInt(7), OscArgument.ofString("oscPort=16447"));

        TelemetryHelloSample hello = parser.parseHello(msg, 9L).orElseThrow();

        assertThat(hello.args()).containsExactly("version=1.2", 7, "oscPort=16447");
        assertThat(hello.argsMap()).containsEntry("version", "1.2").containsEntry("oscPort", "16447");
    }

    @Test
    void helloArgumentsAreCapped() {
        List<OscArgument> args = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            args.add(OscArgument.ofString("k" + i + "=v"));
        }

        TelemetryHelloSample hello = parser.parseHello(new OscMessage(HELLO, args), 0L).orElseThrow();

        assertThat(hello.args()).hasSize(TelemetryParser.MAX_HELLO_ARGS);
    }

    @Test
    void parsingTheSameDatagramTwiceYieldsEqualSamples() {
        byte[] datagram = OscCodec.encode(OscMessage.of(SCAN, f(0.5), f(0.3), f(0.2), f(1000),
                f(500), OscArgument.ofInt(250), OscArgument.ofString("noise"), f(-3)));

        TelemetryScanSample first = parser.parseScan(OscCodec.decode(datagram).get(0), 7L).orElseThrow();
        TelemetryScanSample second = parser.parseScan(OscCodec.decode(datagram).get(0), 7L).orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(first.activeGrainIndices()).containsExactly(500, 250, 0);
    }

    private static OscArgument f(double v) {
        return OscArgument.ofFloat((float) v);
    }
}
