package com.tokenvest.core.error;

/**
 * Operation is not valid in the current state.
 */
public class StateException extends VestingException {

    public StateException(String message) {
        super(ErrorCategory.STATE, message);
    }
}
