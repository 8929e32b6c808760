package com.tokenvest.core.error;

/**
 * Base type for every failure raised by the vesting engine and the distribution ledger.
 */
public abstract class VestingException extends RuntimeException {

    private final ErrorCategory category;

    protected VestingException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected VestingException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return category.code();
    }
}
