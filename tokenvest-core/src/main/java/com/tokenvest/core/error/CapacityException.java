package com.tokenvest.core.error;

/**
 * A pool ceiling would be exceeded.
 */
public class CapacityException extends VestingException {

    public CapacityException(String message) {
        super(ErrorCategory.CAPACITY, message);
    }
}
