package com.flagship.drink_ledger.authz;

import lombok.Value;

import java.util.Set;

/**
 * Authenticated identity of the current request: the username and the groups
 * asserted by the identity provider. Not persisted.
 */
@Value
public class LedgerPrincipal {
    String username;
    Set<String> groups;

    public static LedgerPrincipal of(String username, Set<String> groups) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Principal username is required");
        }
        return new LedgerPrincipal(username, groups == null ? Set.of() : Set.copyOf(groups));
    }

    public boolean isMemberOf(String group) {
        return groups.contains(group);
    }
}
