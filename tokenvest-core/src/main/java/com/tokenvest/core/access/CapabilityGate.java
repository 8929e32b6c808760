package com.tokenvest.core.access;

import com.tokenvest.core.error.AuthorizationException;
import com.tokenvest.core.error.StateException;

/**
 * Role and pause-state checks queried on every call.
 * The {@code require*} methods abort the caller with an {@link AuthorizationException}.
 */
public interface CapabilityGate {

    boolean hasRole(Role role, String account);

    boolean isPaused();

    default boolean isAdmin(String account) {
        return hasRole(Role.ADMIN, account);
    }

    default boolean isScript(String account) {
        return hasRole(Role.SCRIPT, account);
    }

    default boolean isApprovedContract(String account) {
        return hasRole(Role.APPROVED_CONTRACT, account);
    }

    default boolean isAdminOrApprovedContract(String account) {
        return isAdmin(account) || isApprovedContract(account);
    }

    default void requireAdmin(String caller) {
        if (!isAdmin(caller)) {
            throw new AuthorizationException("Caller " + caller + " is not an administrator");
        }
    }

    default void requireScript(String caller) {
        if (!isScript(caller)) {
            throw new AuthorizationException("Caller " + caller + " does not hold the script role");
        }
    }

    default void requireApprovedContract(String caller) {
        if (!isApprovedContract(caller)) {
            throw new AuthorizationException("Caller " + caller + " is not an approved contract");
        }
    }

    default void requireAdminOrApprovedContract(String caller) {
        if (!isAdminOrApprovedContract(caller)) {
            throw new AuthorizationException(
                    "Caller " + caller + " is neither an administrator nor an approved contract");
        }
    }

    default void requireDistributor(String caller) {
        if (!hasRole(Role.DISTRIBUTOR, caller)) {
            throw new AuthorizationException("Caller " + caller + " is not a token distributor");
        }
    }

    default void requireNotPaused() {
        if (isPaused()) {
            throw new StateException("Operations are paused");
        }
    }
}
