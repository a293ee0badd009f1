package com.phillippitts.granupose.presentation.dto.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated JSON value must be a number or a string. {@code null} is left to
 * {@code @NotNull}.
 */
@Documented
@Constraint(validatedBy = NumberOrStringValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface NumberOrString {

    String message() default "Expected number or string";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
