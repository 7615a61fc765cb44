package com.flagship.drink_ledger.authz;

import com.flagship.drink_ledger.ledger.exception.ForbiddenException;
import com.flagship.drink_ledger.ledger.exception.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationPolicyTest {

    private final AuthorizationPolicy policy = new AuthorizationPolicy("drinks-members", "drinks-admins");

    private final LedgerPrincipal member = LedgerPrincipal.of("alice", Set.of("drinks-members"));
    private final LedgerPrincipal admin = LedgerPrincipal.of("root", Set.of("drinks-admins"));
    private final LedgerPrincipal outsider = LedgerPrincipal.of("eve", Set.of("other"));

    @ParameterizedTest
    @EnumSource(value = LedgerOperation.class, names = "RECORD_DRINK_BY_KEY", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Every operation but key drinks needs a principal")
    void anonymousIsUnauthorized(LedgerOperation operation) {
        assertEquals(AuthorizationPolicy.Decision.UNAUTHORIZED, policy.decide(null, operation));
    }

    @Test
    @DisplayName("Key drinks need no principal")
    void keyDrinkIsOpen() {
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(null, LedgerOperation.RECORD_DRINK_BY_KEY));
    }

    @Test
    @DisplayName("Authenticated operations ignore groups")
    void authenticatedOperations() {
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(outsider, LedgerOperation.RECORD_DRINK));
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(outsider, LedgerOperation.ENSURE_ACCOUNT));
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(outsider, LedgerOperation.LIST_DRINK_TYPES));
    }

    @Test
    @DisplayName("Member operations need the member or admin group")
    void memberOperations() {
        assertEquals(AuthorizationPolicy.Decision.FORBIDDEN, policy.decide(outsider, LedgerOperation.ADD_PREPAID_USER));
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(member, LedgerOperation.ADD_PREPAID_USER));
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(admin, LedgerOperation.ADD_MONEY_PREPAID));
    }

    @Test
    @DisplayName("Admin operations need the admin group")
    void adminOperations() {
        assertEquals(AuthorizationPolicy.Decision.FORBIDDEN, policy.decide(member, LedgerOperation.PAYUP));
        assertEquals(AuthorizationPolicy.Decision.FORBIDDEN, policy.decide(member, LedgerOperation.VIEW_LEDGER));
        assertEquals(AuthorizationPolicy.Decision.ALLOW, policy.decide(admin, LedgerOperation.DELETE_PREPAID_USER));
        assertTrue(policy.isAdmin(admin));
        assertFalse(policy.isAdmin(member));
        assertTrue(policy.isMember(admin));
    }

    @Test
    @DisplayName("Check throws the matching failure")
    void checkThrows() {
        assertThrows(UnauthorizedException.class, () -> policy.check(null, LedgerOperation.VIEW_LEDGER));
        assertThrows(ForbiddenException.class, () -> policy.check(member, LedgerOperation.VIEW_LEDGER));
        assertDoesNotThrow(() -> policy.check(admin, LedgerOperation.VIEW_LEDGER));
    }

    @Test
    @DisplayName("Principals need a username")
    void principalNeedsUsername() {
        assertThrows(IllegalArgumentException.class, () -> LedgerPrincipal.of(" ", Set.of()));
        assertEquals(Set.of(), LedgerPrincipal.of("bob", null).getGroups());
    }
}
