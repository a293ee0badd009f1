package com.phillippitts.granupose.exception;

/**
 * Thrown when the engine subprocess cannot be spawned or its runtime cannot be prepared
 * (e.g. the data directory cannot be created).
 */
public class EngineLaunchException extends GranuPoseException {

    private final String binaryPath;

    public EngineLaunchException(String message) {
        super(message);
        this.binaryPath = "unknown";
    }

    public EngineLaunchException(String message, String binaryPath, Throwable cause) {
        super(message + " (binary: " + binaryPath + ")", cause);
        this.binaryPath = binaryPath;
    }

    public String getBinaryPath() {
        return binaryPath;
    }
}
