package com.flagship.drink_ledger.authz;

import com.flagship.drink_ledger.ledger.exception.ForbiddenException;
import com.flagship.drink_ledger.ledger.exception.UnauthorizedException;

import java.util.Objects;

/**
 * Decides whether a principal may perform an operation.
 *
 * The decision is a pure predicate over the principal's group set:
 * - NONE: always allowed, even without a principal
 * - AUTHENTICATED: any principal, regardless of groups
 * - MEMBER: member group or admin group
 * - ADMIN: admin group only
 *
 * Ownership rules (e.g. topping up one's own prepaid user) are checked by the
 * transaction service after this gate, since they need ledger data.
 */
public class AuthorizationPolicy {

    private final String memberGroup;
    private final String adminGroup;

    public AuthorizationPolicy(String memberGroup, String adminGroup) {
        this.memberGroup = Objects.requireNonNull(memberGroup, "memberGroup");
        this.adminGroup = Objects.requireNonNull(adminGroup, "adminGroup");
    }

    public Decision decide(LedgerPrincipal principal, LedgerOperation operation) {
        LedgerOperation.Requirement requirement = operation.getRequirement();
        if (requirement == LedgerOperation.Requirement.NONE) {
            return Decision.ALLOW;
        }
        if (principal == null) {
            return Decision.UNAUTHORIZED;
        }

        boolean allowed = switch (requirement) {
            case NONE, AUTHENTICATED -> true;
            case MEMBER -> isMember(principal);
            case ADMIN -> isAdmin(principal);
        };
        return allowed ? Decision.ALLOW : Decision.FORBIDDEN;
    }

    /**
     * Throws unless {@link #decide} allows the operation.
     *
     * @throws UnauthorizedException if there is no principal
     * @throws ForbiddenException if the principal lacks the required group
     */
    public void check(LedgerPrincipal principal, LedgerOperation operation) {
        switch (decide(principal, operation)) {
            case ALLOW -> {
            }
            case UNAUTHORIZED -> throw new UnauthorizedException(
                "Authentication required for " + operation);
            case FORBIDDEN -> throw new ForbiddenException(
                String.format("User %s is not allowed to perform %s", principal.getUsername(), operation));
        }
    }

    public boolean isAdmin(LedgerPrincipal principal) {
        return principal != null && principal.isMemberOf(adminGroup);
    }

    public boolean isMember(LedgerPrincipal principal) {
        return principal != null && (principal.isMemberOf(memberGroup) || principal.isMemberOf(adminGroup));
    }

    public enum Decision {
        ALLOW,
        UNAUTHORIZED,
        FORBIDDEN
    }
}
