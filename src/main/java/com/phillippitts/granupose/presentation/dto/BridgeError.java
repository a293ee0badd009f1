package com.phillippitts.granupose.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Compact gateway error body: {@code {"error": "validation_failed", "issues": [...]}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeError(String error, List<ValidationIssue> issues) {

    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String INVALID_JSON = "invalid_json";

    public static BridgeError of(String error) {
        return new BridgeError(error, null);
    }

    public static BridgeError validationFailed(List<ValidationIssue> issues) {
        return new BridgeError(VALIDATION_FAILED, List.copyOf(issues));
    }
}
