package com.phillippitts.granupose.presentation.dto;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * One failed constraint.
 *
 * @param path property path, e.g. {@code channels[2].value}
 * @param message human-readable reason
 */
public record ValidationIssue(String path, String message) {

    /**
     * Issue for a JSON value of the wrong type, located by the binding path.
     *
     * @param prefix path prepended to the binding path, e.g. {@code payload}; may be empty
     */
    public static ValidationIssue fromTypeMismatch(String prefix, MismatchedInputException e) {
        StringBuilder path = new StringBuilder(prefix);
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return new ValidationIssue(path.toString(), describe(e.getTargetType()));
    }

    private static String describe(Class<?> target) {
        if (target == Integer.class || target == int.class || target == Long.class || target == long.class) {
            return "must be an integer";
        }
        if (target != null && (Number.class.isAssignableFrom(target) || target == double.class || target == float.class)) {
            return "must be a number";
        }
        if (target == Boolean.class || target == boolean.class) {
            return "must be a boolean";
        }
        if (target == String.class) {
            return "must be a string";
        }
        return "has the wrong type";
    }
}
