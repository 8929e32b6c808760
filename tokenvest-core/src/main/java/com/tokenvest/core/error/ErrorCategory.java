package com.tokenvest.core.error;

/**
 * Failure classes surfaced by vesting and distribution operations.
 * Every category aborts the enclosing operation and rolls back its writes.
 */
public enum ErrorCategory {
    AUTHORIZATION("VEST_001"),
    VALIDATION("VEST_002"),
    STATE("VEST_003"),
    CAPACITY("VEST_004"),
    DEPENDENCY_FAILURE("VEST_005");

    private final String code;

    ErrorCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
