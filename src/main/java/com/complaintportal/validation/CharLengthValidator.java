package com.complaintportal.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class CharLengthValidator implements ConstraintValidator<CharLength, CharSequence> {

    private int min;
    private int max;

    @Override
    public void initialize(CharLength constraint) {
        this.min = constraint.min();
        this.max = constraint.max();
    }

    @Override
    public boolean isValid(CharSequence value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        // Cheap bounds first: code points <= UTF-16 units <= 2 * code points
        int units = value.length();
        if (units < min || (units + 1) / 2 > max) {
            return false;
        }
        int chars = Character.codePointCount(value, 0, units);
        return chars >= min && chars <= max;
    }
}
