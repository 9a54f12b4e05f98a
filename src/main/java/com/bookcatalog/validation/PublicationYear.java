package com.bookcatalog.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated year must lie between {@link #min()} and the current calendar year,
 * both inclusive. The upper bound is read from the system clock on every validation.
 * {@code null} is considered valid.
 */
@Documented
@Constraint(validatedBy = PublicationYearValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface PublicationYear {

    /** Earliest accepted year; defaults to the introduction of movable-type printing. */
    int min() default 1450;

    String message() default "Published year must be between {min} and the current year";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
