package com.phillippitts.granupose.exception;

/**
 * Thrown when an OSC packet is malformed or an argument cannot be encoded.
 */
public class OscCodecException extends GranuPoseException {

    private final int offset;

    public OscCodecException(String message) {
        super(message);
        this.offset = -1;
    }

    public OscCodecException(String message, int offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    /** Byte offset where decoding failed, or -1 when not applicable. */
    public int getOffset() {
        return offset;
    }
}
