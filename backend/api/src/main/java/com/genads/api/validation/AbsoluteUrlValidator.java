package com.genads.api.validation;

import com.genads.api.util.UrlValidator;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class AbsoluteUrlValidator implements ConstraintValidator<AbsoluteUrl, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || UrlValidator.isAbsoluteHttpUrl(value);
    }
}
