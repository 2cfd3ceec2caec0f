package com.chainindexer.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Bean Validation bridge for {@link HexAddress}; delegates to HexAddressValidator.
 */
@Component
public class HexAddressConstraintValidator implements ConstraintValidator<HexAddress, String> {

    private final HexAddressValidator hexAddressValidator;

    public HexAddressConstraintValidator(HexAddressValidator hexAddressValidator) {
        this.hexAddressValidator = hexAddressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && hexAddressValidator.isValidAddress(value);
    }
}
