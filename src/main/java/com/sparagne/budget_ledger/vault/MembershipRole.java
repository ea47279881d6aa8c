package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.LedgerException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Role of a user inside a vault or a single cash flow.
 */
public enum MembershipRole {
    /**
     * The vault owner. Exactly one per vault, never granted through membership calls.
     */
    OWNER(EnumSet.allOf(Capability.class)),

    /**
     * Reads and records; may organize wallets and flows when the grant is vault-wide.
     */
    MEMBER(EnumSet.of(Capability.VIEW, Capability.RECORD, Capability.ORGANIZE)),

    /**
     * Read-only access.
     */
    VIEWER(EnumSet.of(Capability.VIEW));

    private final Set<Capability> capabilities;

    MembershipRole(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    public boolean allows(Capability capability) {
        return capabilities.contains(capability);
    }

    public static MembershipRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw LedgerException.invalidInput("membership", "role", "Role is required");
        }
        try {
            return MembershipRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput("membership", "role", "Invalid membership role: " + value);
        }
    }
}
