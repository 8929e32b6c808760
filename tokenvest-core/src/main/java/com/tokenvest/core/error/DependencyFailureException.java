package com.tokenvest.core.error;

/**
 * The external token ledger reported a failed transfer or could not be reached.
 */
public class DependencyFailureException extends VestingException {

    public DependencyFailureException(String message) {
        super(ErrorCategory.DEPENDENCY_FAILURE, message);
    }

    public DependencyFailureException(String message, Throwable cause) {
        super(ErrorCategory.DEPENDENCY_FAILURE, message, cause);
    }
}
