package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.api.dto.BalanceHolderResponse;
import com.sparagne.budget_ledger.api.dto.BalanceReportResponse;
import com.sparagne.budget_ledger.api.dto.CashFlowModeRequest;
import com.sparagne.budget_ledger.api.dto.CreateVaultRequest;
import com.sparagne.budget_ledger.api.dto.NameRequest;
import com.sparagne.budget_ledger.api.dto.UpdateTargetRequest;
import com.sparagne.budget_ledger.api.dto.VaultDetailResponse;
import com.sparagne.budget_ledger.api.dto.VaultResponse;
import com.sparagne.budget_ledger.ledger.LedgerEngine;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.CashFlowMode;
import com.sparagne.budget_ledger.vault.VaultService;
import com.sparagne.budget_ledger.vault.Wallet;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.sparagne.budget_ledger.api.RequestHeaders.USER_HEADER;

/**
 * REST controller for vaults and the wallets and cash flows inside them.
 *
 * The caller is identified by the {@code X-User} header, set by the
 * authenticating proxy in front of this service.
 */
@RestController
@RequestMapping("/api/vaults")
@RequiredArgsConstructor
public class VaultController {

    private final VaultService vaultService;
    private final LedgerEngine ledgerEngine;

    @PostMapping
    public ResponseEntity<VaultResponse> createVault(@Valid @RequestBody CreateVaultRequest request,
                                                     @RequestHeader(USER_HEADER) String caller) {
        CurrencyCode currency = request.getCurrency() == null ? null : CurrencyCode.parse(request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(VaultResponse.from(vaultService.createVault(caller, request.getName(), currency)));
    }

    /**
     * Returns the caller's default vault, creating it on first use.
     */
    @PostMapping("/default")
    public ResponseEntity<VaultResponse> provisionDefaultVault(@RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(VaultResponse.from(vaultService.provisionDefaultVault(caller)));
    }

    @GetMapping
    public ResponseEntity<List<VaultResponse>> listVaults(@RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(vaultService.listVaults(caller).stream().map(VaultResponse::from).toList());
    }

    @GetMapping("/{vaultId}")
    public ResponseEntity<VaultDetailResponse> getVault(@PathVariable("vaultId") UUID vaultId,
                                                        @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(VaultDetailResponse.from(vaultService.getVault(vaultId, caller)));
    }

    @DeleteMapping("/{vaultId}")
    public ResponseEntity<Void> deleteVault(@PathVariable("vaultId") UUID vaultId,
                                            @RequestHeader(USER_HEADER) String caller) {
        vaultService.deleteVault(vaultId, caller);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{vaultId}/balance-check")
    public ResponseEntity<BalanceReportResponse> verifyBalances(@PathVariable("vaultId") UUID vaultId,
                                                                @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(BalanceReportResponse.from(ledgerEngine.verifyBalances(vaultId, caller)));
    }

    // ==================== Wallets ====================

    @PostMapping("/{vaultId}/wallets")
    public ResponseEntity<BalanceHolderResponse> createWallet(@PathVariable("vaultId") UUID vaultId,
                                                              @Valid @RequestBody NameRequest request,
                                                              @RequestHeader(USER_HEADER) String caller) {
        Wallet wallet = vaultService.createWallet(vaultId, caller, request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceHolderResponse.from(wallet));
    }

    @GetMapping("/{vaultId}/wallets/{walletId}")
    public ResponseEntity<BalanceHolderResponse> getWallet(@PathVariable("vaultId") UUID vaultId,
                                                           @PathVariable("walletId") UUID walletId,
                                                           @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(BalanceHolderResponse.from(vaultService.getWallet(vaultId, walletId, caller)));
    }

    @PatchMapping("/{vaultId}/wallets/{walletId}")
    public ResponseEntity<BalanceHolderResponse> updateWallet(@PathVariable("vaultId") UUID vaultId,
                                                              @PathVariable("walletId") UUID walletId,
                                                              @RequestBody UpdateTargetRequest request,
                                                              @RequestHeader(USER_HEADER) String caller) {
        Wallet wallet = null;
        if (request.getName() != null) {
            wallet = vaultService.renameWallet(vaultId, walletId, caller, request.getName());
        }
        if (request.getArchived() != null) {
            wallet = vaultService.setWalletArchived(vaultId, walletId, caller, request.getArchived());
        }
        if (wallet == null) {
            wallet = vaultService.getWallet(vaultId, walletId, caller);
        }
        return ResponseEntity.ok(BalanceHolderResponse.from(wallet));
    }

    // ==================== Cash flows ====================

    @PostMapping("/{vaultId}/cash-flows")
    public ResponseEntity<BalanceHolderResponse> createCashFlow(@PathVariable("vaultId") UUID vaultId,
                                                                @Valid @RequestBody NameRequest request,
                                                                @RequestHeader(USER_HEADER) String caller) {
        CashFlow cashFlow = vaultService.createCashFlow(vaultId, caller, request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceHolderResponse.from(cashFlow));
    }

    @GetMapping("/{vaultId}/cash-flows/{cashFlowId}")
    public ResponseEntity<BalanceHolderResponse> getCashFlow(@PathVariable("vaultId") UUID vaultId,
                                                             @PathVariable("cashFlowId") UUID cashFlowId,
                                                             @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(BalanceHolderResponse.from(vaultService.getCashFlow(vaultId, cashFlowId, caller)));
    }

    @PatchMapping("/{vaultId}/cash-flows/{cashFlowId}")
    public ResponseEntity<BalanceHolderResponse> updateCashFlow(@PathVariable("vaultId") UUID vaultId,
                                                                @PathVariable("cashFlowId") UUID cashFlowId,
                                                                @RequestBody UpdateTargetRequest request,
                                                                @RequestHeader(USER_HEADER) String caller) {
        CashFlow cashFlow = null;
        if (request.getName() != null) {
            cashFlow = vaultService.renameCashFlow(vaultId, cashFlowId, caller, request.getName());
        }
        if (request.getArchived() != null) {
            cashFlow = vaultService.setCashFlowArchived(vaultId, cashFlowId, caller, request.getArchived());
        }
        if (cashFlow == null) {
            cashFlow = vaultService.getCashFlow(vaultId, cashFlowId, caller);
        }
        return ResponseEntity.ok(BalanceHolderResponse.from(cashFlow));
    }

    @PutMapping("/{vaultId}/cash-flows/{cashFlowId}/mode")
    public ResponseEntity<BalanceHolderResponse> setCashFlowMode(@PathVariable("vaultId") UUID vaultId,
                                                                 @PathVariable("cashFlowId") UUID cashFlowId,
                                                                 @Valid @RequestBody CashFlowModeRequest request,
                                                                 @RequestHeader(USER_HEADER) String caller) {
        CashFlow cashFlow = vaultService.setCashFlowMode(vaultId, cashFlowId, caller,
            CashFlowMode.parse(request.getMode()), request.getCapMinor());
        return ResponseEntity.ok(BalanceHolderResponse.from(cashFlow));
    }
}
