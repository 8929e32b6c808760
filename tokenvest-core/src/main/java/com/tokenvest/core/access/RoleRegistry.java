package com.tokenvest.core.access;

import com.tokenvest.core.error.AuthorizationException;
import com.tokenvest.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory capability gate. The owner manages role membership; administrators and the owner
 * toggle the pause state.
 */
public class RoleRegistry implements CapabilityGate {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final Map<Role, Set<String>> members;
    private volatile boolean paused;

    public RoleRegistry(String owner) {
        requireAccount(owner);
        this.members = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            members.put(role, ConcurrentHashMap.newKeySet());
        }
        members.get(Role.OWNER).add(owner);
    }

    @Override
    public boolean hasRole(Role role, String account) {
        if (role == null || account == null) {
            return false;
        }
        return members.get(role).contains(account);
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    /**
     * Grants a role. Only an owner may change membership.
     */
    public void grantRole(String caller, Role role, String account) {
        requireOwner(caller);
        Objects.requireNonNull(role, "Role cannot be null");
        requireAccount(account);
        if (members.get(role).add(account)) {
            log.info("Granted {} to {}", role, account);
        }
    }

    public void revokeRole(String caller, Role role, String account) {
        requireOwner(caller);
        Objects.requireNonNull(role, "Role cannot be null");
        if (members.get(role).remove(account)) {
            log.info("Revoked {} from {}", role, account);
        }
    }

    public void pause(String caller) {
        requireAdminOrOwner(caller);
        paused = true;
        log.warn("Operations paused by {}", caller);
    }

    public void unpause(String caller) {
        requireAdminOrOwner(caller);
        paused = false;
        log.info("Operations resumed by {}", caller);
    }

    public Set<String> getMembers(Role role) {
        return Set.copyOf(members.get(role));
    }

    private void requireOwner(String caller) {
        if (!hasRole(Role.OWNER, caller)) {
            throw new AuthorizationException("Caller " + caller + " is not an owner");
        }
    }

    private void requireAdminOrOwner(String caller) {
        if (!hasRole(Role.OWNER, caller) && !isAdmin(caller)) {
            throw new AuthorizationException("Caller " + caller + " may not change the pause state");
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ValidationException("Account address cannot be empty");
        }
    }
}
