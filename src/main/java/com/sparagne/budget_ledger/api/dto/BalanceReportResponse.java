package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.ledger.BalanceDrift;
import com.sparagne.budget_ledger.ledger.BalanceReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BalanceReportResponse {

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("consistent")
    boolean consistent;

    @JsonProperty("wallets_checked")
    int walletsChecked;

    @JsonProperty("cash_flows_checked")
    int cashFlowsChecked;

    @JsonProperty("drifts")
    List<Drift> drifts;

    @JsonProperty("checked_at")
    Instant checkedAt;

    public static BalanceReportResponse from(BalanceReport report) {
        return BalanceReportResponse.builder()
            .vaultId(report.getVaultId())
            .consistent(report.isConsistent())
            .walletsChecked(report.getWalletsChecked())
            .cashFlowsChecked(report.getCashFlowsChecked())
            .drifts(report.getDrifts().stream().map(Drift::from).toList())
            .checkedAt(report.getCheckedAt())
            .build();
    }

    @Value
    public static class Drift {

        @JsonProperty("target")
        String target;

        @JsonProperty("target_id")
        UUID targetId;

        @JsonProperty("name")
        String name;

        @JsonProperty("stored_minor")
        long storedMinor;

        @JsonProperty("expected_minor")
        long expectedMinor;

        static Drift from(BalanceDrift drift) {
            return new Drift(drift.getTarget().name(), drift.getTargetId(), drift.getName(),
                drift.getStored().getMinor(), drift.getExpected().getMinor());
        }
    }
}
