package com.flagship.drink_ledger.authz;

/**
 * Operations gated by the {@link AuthorizationPolicy}, each with the
 * membership it requires.
 */
public enum LedgerOperation {
    RECORD_DRINK_BY_KEY(Requirement.NONE),
    RECORD_DRINK(Requirement.AUTHENTICATED),
    ENSURE_ACCOUNT(Requirement.AUTHENTICATED),
    LIST_DRINK_TYPES(Requirement.AUTHENTICATED),
    VIEW_OWN_PREPAID(Requirement.MEMBER),
    ADD_PREPAID_USER(Requirement.MEMBER),
    ADD_MONEY_PREPAID(Requirement.MEMBER),
    VIEW_LEDGER(Requirement.ADMIN),
    TOGGLE_ACTIVATED(Requirement.ADMIN),
    SET_MONEY(Requirement.ADMIN),
    PAYUP(Requirement.ADMIN),
    DELETE_PREPAID_USER(Requirement.ADMIN),
    MANAGE_DRINK_TYPES(Requirement.ADMIN);

    private final Requirement requirement;

    LedgerOperation(Requirement requirement) {
        this.requirement = requirement;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public enum Requirement {
        NONE,
        AUTHENTICATED,
        MEMBER,
        ADMIN
    }
}
