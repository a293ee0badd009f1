package com.phillippitts.granupose.exception;

/**
 * Base exception for all GranuPose bridge errors.
 * Domain exceptions extend this class so the REST boundary can map them in one place.
 */
public class GranuPoseException extends RuntimeException {

    public GranuPoseException(String message) {
        super(message);
    }

    public GranuPoseException(String message, Throwable cause) {
        super(message, cause);
    }

    public GranuPoseException(Throwable cause) {
        super(cause);
    }
}
