package com.phillippitts.granupose.exception;

import java.util.List;

/**
 * Thrown when none of the candidate locations contains the engine executable.
 * Fatal for the {@code start()} call that triggered resolution; never retried automatically.
 */
public class EngineBinaryNotFoundException extends GranuPoseException {

    private final String binaryName;
    private final List<String> checkedPaths;

    public EngineBinaryNotFoundException(String binaryName, List<String> checkedPaths) {
        super(binaryName + " binary not found. Checked: " + String.join(" | ", checkedPaths));
        this.binaryName = binaryName;
        this.checkedPaths = List.copyOf(checkedPaths);
    }

    public String getBinaryName() {
        return binaryName;
    }

    public List<String> getCheckedPaths() {
        return checkedPaths;
    }
}
