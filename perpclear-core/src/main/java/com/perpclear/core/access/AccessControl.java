package com.perpclear.core.access;

import com.perpclear.core.exception.AccessDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role registry checked before every privileged mutation.
 * ADMIN implies every other role.
 */
public class AccessControl {

    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final Map<String, Set<Role>> grants = new ConcurrentHashMap<>();

    public AccessControl(String initialAdmin) {
        grants.put(initialAdmin, EnumSet.of(Role.ADMIN));
    }

    public void grant(String caller, String account, Role role) throws AccessDeniedException {
        check(caller, Role.ADMIN);
        grants.computeIfAbsent(account, k -> EnumSet.noneOf(Role.class)).add(role);
        log.info("Role {} granted to {} by {}", role, account, caller);
    }

    public void revoke(String caller, String account, Role role) throws AccessDeniedException {
        check(caller, Role.ADMIN);
        Set<Role> roles = grants.get(account);
        if (roles != null) {
            roles.remove(role);
            log.info("Role {} revoked from {} by {}", role, account, caller);
        }
    }

    public boolean hasRole(String account, Role role) {
        Set<Role> roles = grants.get(account);
        return roles != null && (roles.contains(role) || roles.contains(Role.ADMIN));
    }

    public void check(String caller, Role role) throws AccessDeniedException {
        if (caller == null || !hasRole(caller, role)) {
            log.warn("Access denied: {} lacks {}", caller, role);
            throw new AccessDeniedException(caller + " lacks role " + role);
        }
    }
}
