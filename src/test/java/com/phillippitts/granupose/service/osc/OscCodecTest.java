package com.phillippitts.granupose.service.osc;

import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.exception.OscCodecException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OscCodecTest {

    @Test
    void encodesSingleFloatMessageOnFourByteBoundaries() {
        byte[] bytes = OscCodec.encode(OscMessage.of("/a", OscArgument.ofFloat(0.5f)));

        assertThat(bytes).hasSize(12);
        assertThat(new String(bytes, 0, 2, StandardCharsets.US_ASCII)).isEqualTo("/a");
        assertThat(bytes[2]).isZero();
        assertThat(bytes[3]).isZero();
        assertThat(new String(bytes, 4, 2, StandardCharsets.US_ASCII)).isEqualTo(",f");
        assertThat(ByteBuffer.wrap(bytes, 8, 4).getFloat()).isEqualTo(0.5f);
    }

    @Test
    void addressOfFourCharactersGetsAFullPaddingWord() {
        byte[] bytes = OscCodec.encode(OscMessage.of("/abc"));

        // "/abc" + 4 NULs, ",\0\0\0"
        assertThat(bytes).hasSize(12);
        assertThat(bytes[4]).isZero();
        assertThat(bytes[8]).isEqualTo((byte) ',');
    }

    @Test
    void decodesWhatItEncodes() {
        OscMessage original = OscMessage.of("/pose/out/03",
                OscArgument.ofFloat(0.25f), OscArgument.ofInt(-7),
                OscArgument.ofDouble(1e-9), OscArgument.ofString("héllo"));

        List<OscMessage> decoded = OscCodec.decode(OscCodec.encode(original));

        assertThat(decoded).containsExactly(original);
        assertThat(decoded.get(0).typeTags()).isEqualTo("fids");
    }

    @Test
    void decodesNestedBundleInWireOrder() {
        byte[] first = OscCodec.encode(OscMessage.of("/ec2/telemetry/scan",
                OscArgument.ofFloat(0.5f), OscArgument.ofFloat(0.3f)));
        byte[] second = OscCodec.encode(OscMessage.of("/ec2/hello", OscArgument.ofString("ok")));
        byte[] inner = bundle(second);
        byte[] outer = bundle(first, inner);

        List<OscMessage> decoded = OscCodec.decode(outer);

        assertThat(decoded).extracting(OscMessage::address)
                .containsExactly("/ec2/telemetry/scan", "/ec2/hello");
    }

    @Test
    void rejectsEmptyPacket() {
        assertThatThrownBy(() -> OscCodec.decode(new byte[0]))
                .isInstanceOf(OscCodecException.class)
                .hasMessageContaining("Empty");
    }

    @Test
    void rejectsTruncatedArgument() {
        byte[] full = OscCodec.encode(OscMessage.of("/a", OscArgument.ofFloat(1f)));
        byte[] truncated = Arrays.copyOf(full, full.length - 2);

        assertThatThrownBy(() -> OscCodec.decode(truncated))
                .isInstanceOf(OscCodecException.class);
    }

    @Test
    void rejectsPacketThatIsNeitherMessageNorBundle() {
        assertThatThrownBy(() -> OscCodec.decode("hello\0\0\0".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(OscCodecException.class)
                .hasMessageContaining("Not an OSC message");
    }

    @Test
    void rejectsAddressWithoutLeadingSlashOnEncode() {
        assertThatThrownBy(() -> OscCodec.encode(OscMessage.of("pose")))
                .isInstanceOf(OscCodecException.class);
    }

    @Test
    void rejectsValueThatDoesNotMatchItsTag() {
        assertThatThrownBy(() -> OscCodec.encode(OscMessage.of("/a", new OscArgument('f', "x"))))
                .isInstanceOf(OscCodecException.class)
                .hasMessageContaining("not numeric");
    }

    private static byte[] bundle(byte[]... elements) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes("#bundle\0".getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(ByteBuffer.allocate(8).putLong(1L).array());
        for (byte[] element : elements) {
            out.writeBytes(ByteBuffer.allocate(4).putInt(element.length).array());
            out.writeBytes(element);
        }
        return out.toByteArray();
    }
}
