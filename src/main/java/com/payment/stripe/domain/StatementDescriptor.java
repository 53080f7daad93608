package com.payment.stripe.domain;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Text shown on the customer's statement: at most 22 characters and none of {@code < > " '}.
 * {@code null} is valid (the account default is used).
 */
@Documented
@Size(max = 22, message = "must not be longer than 22 characters")
@Pattern(regexp = "[^<>\"']*", message = "must not contain any of < > \" '")
@Constraint(validatedBy = {})
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface StatementDescriptor {

    String message() default "invalid statement descriptor";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
