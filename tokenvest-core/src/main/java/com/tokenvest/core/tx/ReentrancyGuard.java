package com.tokenvest.core.tx;

import com.tokenvest.core.error.StateException;

import java.util.function.Supplier;

/**
 * Operation-in-progress flag for one component instance. Nested entry into any guarded
 * operation of the same instance is rejected; the flag is cleared on every exit path.
 */
public final class ReentrancyGuard {

    private final String component;
    private String activeOperation;

    public ReentrancyGuard(String component) {
        this.component = component;
    }

    public <T> T enter(String operation, Supplier<T> body) {
        if (activeOperation != null) {
            throw new StateException("Reentrant call to " + component + "." + operation
                    + " while " + activeOperation + " is in progress");
        }
        activeOperation = operation;
        try {
            return body.get();
        } finally {
            activeOperation = null;
        }
    }

    public void run(String operation, Runnable body) {
        enter(operation, () -> {
            body.run();
            return null;
        });
    }

    public boolean isEntered() {
        return activeOperation != null;
    }
}
