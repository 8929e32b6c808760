package com.tokenvest.core.error;

/**
 * Caller lacks the capability required by an operation.
 */
public class AuthorizationException extends VestingException {

    public AuthorizationException(String message) {
        super(ErrorCategory.AUTHORIZATION, message);
    }
}
