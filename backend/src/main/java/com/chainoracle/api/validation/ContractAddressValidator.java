package com.chainoracle.api.validation;

import com.chainoracle.publish.ContractEventPublisher;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Jakarta Bean Validation check for {@link ContractAddress}. Delegates to the publisher's rule for a single source
 * of truth.
 */
public class ContractAddressValidator implements ConstraintValidator<ContractAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || ContractEventPublisher.isValidContractAddress(value);
    }
}
