package com.phillippitts.granupose.service.osc;

import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.exception.OscCodecException;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OSC 1.0 binary codec.
 *
 * <p>Encoding supports {@code f i d s h t b T F N I}. Decoding accepts single messages and
 * bundles; bundles (nested included) are flattened into their messages in order, time tags
 * are ignored. All multi-byte values are big-endian and every field is padded to 4 bytes.
 */
public final class OscCodec {

    private static final String BUNDLE_TAG = "#bundle";
    private static final int MAX_BUNDLE_DEPTH = 8;

    private OscCodec() {}

    /**
     * Encodes one message into a datagram payload.
     *
     * @throws OscCodecException if an argument value does not match its type tag
     */
    public static byte[] encode(OscMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        if (!message.address().startsWith("/")) {
            throw new OscCodecException("OSC address must start with '/': " + message.address());
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        writeString(out, message.address());
        writeString(out, "," + message.typeTags());
        for (OscArgument arg : message.arguments()) {
            writeArgument(out, arg);
        }
        return out.toByteArray();
    }

    /**
     * Decodes a datagram payload into its messages.
     *
     * @return messages in wire order; one element for a plain message
     * @throws OscCodecException if the packet is truncated or malformed
     */
    public static List<OscMessage> decode(byte[] packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        if (packet.length == 0) {
            throw new OscCodecException("Empty OSC packet");
        }
        List<OscMessage> messages = new ArrayList<>();
        ByteBuffer buf = ByteBuffer.wrap(packet).order(ByteOrder.BIG_ENDIAN);
        try {
            decodePacket(buf, messages, 0);
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new OscCodecException("Truncated OSC packet", buf.position());
        }
        return messages;
    }

    private static void decodePacket(ByteBuffer buf, List<OscMessage> sink, int depth) {
        byte first = buf.get(buf.position());
        if (first == '#') {
            decodeBundle(buf, sink, depth);
        } else if (first == '/') {
            sink.add(decodeMessage(buf));
        } else {
            throw new OscCodecException("Not an OSC message or bundle", buf.position());
        }
    }

    private static void decodeBundle(ByteBuffer buf, List<OscMessage> sink, int depth) {
        if (depth >= MAX_BUNDLE_DEPTH) {
            throw new OscCodecException("OSC bundle nesting too deep", buf.position());
        }
        String tag = readString(buf);
        if (!BUNDLE_TAG.equals(tag)) {
            throw new OscCodecException("Bad bundle tag: " + tag, buf.position());
        }
        buf.getLong(); // time tag
        while (buf.hasRemaining()) {
            int size = buf.getInt();
            if (size <= 0 || size % 4 != 0 || size > buf.remaining()) {
                throw new OscCodecException("Bad bundle element size " + size, buf.position());
            }
            ByteBuffer element = buf.slice();
            element.limit(size);
            element.order(ByteOrder.BIG_ENDIAN);
            decodePacket(element, sink, depth + 1);
            buf.position(buf.position() + size);
        }
    }

    private static OscMessage decodeMessage(ByteBuffer buf) {
        String address = readString(buf);
        if (!buf.hasRemaining()) {
            // type tag string is optional in very old senders
            return new OscMessage(address, List.of());
        }
        String tags = readString(buf);
        if (tags.isEmpty() || tags.charAt(0) != ',') {
            throw new OscCodecException("Missing type tag string for " + address, buf.position());
        }
        List<OscArgument> args = new ArrayList<>(tags.length() - 1);
        for (int i = 1; i < tags.length(); i++) {
            args.add(readArgument(buf, tags.charAt(i)));
        }
        return new OscMessage(address, args);
    }

    private static OscArgument readArgument(ByteBuffer buf, char type) {
        return switch (type) {
            case 'f' -> new OscArgument(type, buf.getFloat());
            case 'i' -> new OscArgument(type, buf.getInt());
            case 'd' -> new OscArgument(type, buf.getDouble());
            case 'h', 't' -> new OscArgument(type, buf.getLong());
            case 's', 'S' -> new OscArgument('s', readString(buf));
            case 'b' -> new OscArgument(type, readBlob(buf));
            case 'T' -> new OscArgument(type, Boolean.TRUE);
            case 'F' -> new OscArgument(type, Boolean.FALSE);
            case 'N' -> new OscArgument(type, null);
            case 'I' -> new OscArgument(type, Double.POSITIVE_INFINITY);
            default -> throw new OscCodecException("Unsupported OSC type tag '" + type + "'", buf.position());
        };
    }

    private static String readString(ByteBuffer buf) {
        int start = buf.position();
        int end = start;
        while (buf.get(end) != 0) {
            end++;
        }
        String s = new String(buf.array(), buf.arrayOffset() + start, end - start, StandardCharsets.UTF_8);
        buf.position(pad4(end + 1 - start) + start);
        return s;
    }

    private static byte[] readBlob(ByteBuffer buf) {
        int size = buf.getInt();
        if (size < 0 || size > buf.remaining()) {
            throw new OscCodecException("Bad blob size " + size, buf.position());
        }
        byte[] blob = new byte[size];
        buf.get(blob);
        buf.position(buf.position() + (pad4(size) - size));
        return blob;
    }

    private static void writeArgument(ByteArrayOutputStream out, OscArgument arg) {
        Object v = arg.value();
        switch (arg.type()) {
            case 'f' -> writeInt(out, Float.floatToIntBits(requireNumber(arg).floatValue()));
            case 'i' -> writeInt(out, requireNumber(arg).intValue());
            case 'd' -> writeLong(out, Double.doubleToLongBits(requireNumber(arg).doubleValue()));
            case 'h', 't' -> writeLong(out, requireNumber(arg).longValue());
            case 's' -> {
                if (!(v instanceof String s)) {
                    throw new OscCodecException("Argument " + arg + " is not a string");
                }
                writeString(out, s);
            }
            case 'b' -> {
                if (!(v instanceof byte[] bytes)) {
                    throw new OscCodecException("Argument " + arg + " is not a blob");
                }
                writeInt(out, bytes.length);
                out.writeBytes(bytes);
                writePadding(out, pad4(bytes.length) - bytes.length);
            }
            case 'T', 'F', 'N', 'I' -> {
                // no payload
            }
            default -> throw new OscCodecException("Unsupported OSC type tag '" + arg.type() + "'");
        }
    }

    private static Number requireNumber(OscArgument arg) {
        if (arg.value() instanceof Number n) {
            return n;
        }
        throw new OscCodecException("Argument " + arg + " is not numeric");
    }

    private static void writeString(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.writeBytes(bytes);
        // at least one NUL terminator
        writePadding(out, pad4(bytes.length + 1) - bytes.length);
    }

    private static void writeInt(ByteArrayOutputStream out, int v) {
        out.write((v >>> 24) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write(v & 0xFF);
    }

    private static void writeLong(ByteArrayOutputStream out, long v) {
        writeInt(out, (int) (v >>> 32));
        writeInt(out, (int) v);
    }

    private static void writePadding(ByteArrayOutputStream out, int count) {
        for (int i = 0; i < count; i++) {
            out.write(0);
        }
    }

    private static int pad4(int n) {
        return (n + 3) & ~3;
    }
}
