package com.bookcatalog.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must be an ISBN-10 or ISBN-13 once hyphens and spaces are removed.
 * {@code null} is considered valid; combine with {@code @NotBlank} for required fields.
 */
@Documented
@Constraint(validatedBy = IsbnValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface Isbn {

    String message() default "ISBN must be 10 or 13 characters (digits, optional trailing X for ISBN-10)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
