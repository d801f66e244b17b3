package com.genads.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Account and owner emails: non-blank, a dotted domain, and short enough for
 * the email columns.
 */
@NotBlank
@Email(regexp = AccountEmail.DOTTED_DOMAIN)
@Size(max = AccountEmail.MAX_LENGTH)
@Documented
@Constraint(validatedBy = {})
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface AccountEmail {

    int MAX_LENGTH = 320;

    String DOTTED_DOMAIN = ".+@.+\\..+";

    String message() default "must be a well-formed email address";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
