package com.tokenvest.core.error;

/**
 * Malformed or out-of-range input.
 */
public class ValidationException extends VestingException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }
}
