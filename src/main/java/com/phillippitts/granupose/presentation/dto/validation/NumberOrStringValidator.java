package com.phillippitts.granupose.presentation.dto.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class NumberOrStringValidator implements ConstraintValidator<NumberOrString, Object> {

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        return value == null || value instanceof Number || value instanceof String;
    }
}
