package com.sparagne.budget_ledger.vault;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A grant of access for a user to a whole vault, or to a single cash flow
 * within it when {@code cashFlowId} is set.
 */
@Value
public class Membership {
    UUID vaultId;
    UUID cashFlowId;
    String username;
    MembershipRole role;
    Instant grantedAt;

    public static Membership vaultWide(UUID vaultId, String username, MembershipRole role) {
        return new Membership(vaultId, null, username, role, Instant.now());
    }

    public static Membership flowScoped(UUID vaultId, UUID cashFlowId, String username, MembershipRole role) {
        return new Membership(vaultId, cashFlowId, username, role, Instant.now());
    }

    public boolean isFlowScoped() {
        return cashFlowId != null;
    }

    public Membership withRole(MembershipRole newRole) {
        return new Membership(vaultId, cashFlowId, username, newRole, grantedAt);
    }
}
