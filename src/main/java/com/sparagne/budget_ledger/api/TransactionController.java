package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.api.dto.EntryRequest;
import com.sparagne.budget_ledger.api.dto.RefundRequest;
import com.sparagne.budget_ledger.api.dto.RefundableResponse;
import com.sparagne.budget_ledger.api.dto.TransactionCreatedResponse;
import com.sparagne.budget_ledger.api.dto.TransactionPageResponse;
import com.sparagne.budget_ledger.api.dto.TransactionResponse;
import com.sparagne.budget_ledger.api.dto.TransferRequest;
import com.sparagne.budget_ledger.api.dto.UpdateTransactionRequest;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.EntryCommand;
import com.sparagne.budget_ledger.ledger.LedgerEngine;
import com.sparagne.budget_ledger.ledger.RefundCommand;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionFilter;
import com.sparagne.budget_ledger.ledger.TransactionType;
import com.sparagne.budget_ledger.ledger.TransactionUpdate;
import com.sparagne.budget_ledger.ledger.TransferCommand;
import com.sparagne.budget_ledger.money.CurrencyCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

import static com.sparagne.budget_ledger.api.RequestHeaders.USER_HEADER;

/**
 * REST controller for recording, correcting and listing transactions.
 *
 * Amounts are integer minor units. Every endpoint addressing a single
 * transaction answers 404 when it belongs to another vault than the path names.
 */
@RestController
@RequestMapping("/api/vaults/{vaultId}/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final LedgerEngine ledgerEngine;

    @PostMapping("/income")
    public ResponseEntity<TransactionCreatedResponse> recordIncome(@PathVariable("vaultId") UUID vaultId,
                                                                   @Valid @RequestBody EntryRequest request,
                                                                   @RequestHeader(USER_HEADER) String caller) {
        Transaction tx = ledgerEngine.recordIncome(caller, toEntryCommand(vaultId, request));
        return created(tx);
    }

    @PostMapping("/expense")
    public ResponseEntity<TransactionCreatedResponse> recordExpense(@PathVariable("vaultId") UUID vaultId,
                                                                    @Valid @RequestBody EntryRequest request,
                                                                    @RequestHeader(USER_HEADER) String caller) {
        Transaction tx = ledgerEngine.recordExpense(caller, toEntryCommand(vaultId, request));
        return created(tx);
    }

    @PostMapping("/{transactionId}/refunds")
    public ResponseEntity<TransactionCreatedResponse> recordRefund(@PathVariable("vaultId") UUID vaultId,
                                                                   @PathVariable("transactionId") UUID transactionId,
                                                                   @Valid @RequestBody RefundRequest request,
                                                                   @RequestHeader(USER_HEADER) String caller) {
        requireInVault(vaultId, transactionId, caller);
        Transaction tx = ledgerEngine.recordRefund(caller, RefundCommand.builder()
            .originalId(transactionId)
            .amountMinor(request.getAmountMinor())
            .currency(currencyOf(request.getCurrency()))
            .note(request.getNote())
            .category(request.getCategory())
            .occurredAt(request.getOccurredAt())
            .build());
        return created(tx);
    }

    @PostMapping("/transfers/wallet")
    public ResponseEntity<TransactionCreatedResponse> transferWallet(@PathVariable("vaultId") UUID vaultId,
                                                                     @Valid @RequestBody TransferRequest request,
                                                                     @RequestHeader(USER_HEADER) String caller) {
        return created(ledgerEngine.transferWallet(caller, toTransferCommand(vaultId, request)));
    }

    @PostMapping("/transfers/flow")
    public ResponseEntity<TransactionCreatedResponse> transferFlow(@PathVariable("vaultId") UUID vaultId,
                                                                   @Valid @RequestBody TransferRequest request,
                                                                   @RequestHeader(USER_HEADER) String caller) {
        return created(ledgerEngine.transferFlow(caller, toTransferCommand(vaultId, request)));
    }

    @GetMapping
    public ResponseEntity<TransactionPageResponse> listTransactions(
            @PathVariable("vaultId") UUID vaultId,
            @RequestParam(name = "wallet_id", required = false) UUID walletId,
            @RequestParam(name = "cash_flow_id", required = false) UUID cashFlowId,
            @RequestParam(name = "type", required = false) TransactionType type,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(name = "include_voided", defaultValue = "false") boolean includeVoided,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "cursor", required = false) String cursor,
            @RequestHeader(USER_HEADER) String caller) {

        TransactionFilter filter = TransactionFilter.builder()
            .walletId(walletId)
            .cashFlowId(cashFlowId)
            .type(type)
            .from(from)
            .to(to)
            .includeVoided(includeVoided)
            .limit(limit)
            .cursor(cursor)
            .build();
        return ResponseEntity.ok(TransactionPageResponse.from(ledgerEngine.listTransactions(vaultId, caller, filter)));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("vaultId") UUID vaultId,
                                                              @PathVariable("transactionId") UUID transactionId,
                                                              @RequestHeader(USER_HEADER) String caller) {
        return ResponseEntity.ok(TransactionResponse.from(requireInVault(vaultId, transactionId, caller)));
    }

    @PatchMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> updateTransaction(@PathVariable("vaultId") UUID vaultId,
                                                                 @PathVariable("transactionId") UUID transactionId,
                                                                 @RequestBody UpdateTransactionRequest request,
                                                                 @RequestHeader(USER_HEADER) String caller) {
        requireInVault(vaultId, transactionId, caller);
        Transaction updated = ledgerEngine.updateTransaction(transactionId, caller, TransactionUpdate.builder()
            .note(request.getNote())
            .category(request.getCategory())
            .amountMinor(request.getAmountMinor())
            .type(request.getType())
            .walletId(request.getWalletId())
            .cashFlowId(request.getCashFlowId())
            .toWalletId(request.getToWalletId())
            .toCashFlowId(request.getToCashFlowId())
            .occurredAt(request.getOccurredAt())
            .build());
        return ResponseEntity.ok(TransactionResponse.from(updated));
    }

    @PostMapping("/{transactionId}/void")
    public ResponseEntity<TransactionResponse> voidTransaction(@PathVariable("vaultId") UUID vaultId,
                                                               @PathVariable("transactionId") UUID transactionId,
                                                               @RequestHeader(USER_HEADER) String caller) {
        requireInVault(vaultId, transactionId, caller);
        return ResponseEntity.ok(TransactionResponse.from(ledgerEngine.voidTransaction(transactionId, caller)));
    }

    @GetMapping("/{transactionId}/refundable")
    public ResponseEntity<RefundableResponse> refundableRemainder(@PathVariable("vaultId") UUID vaultId,
                                                                  @PathVariable("transactionId") UUID transactionId,
                                                                  @RequestHeader(USER_HEADER) String caller) {
        requireInVault(vaultId, transactionId, caller);
        return ResponseEntity.ok(RefundableResponse.of(transactionId,
            ledgerEngine.refundableRemainder(transactionId, caller)));
    }

    private Transaction requireInVault(UUID vaultId, UUID transactionId, String caller) {
        Transaction tx = ledgerEngine.getTransaction(transactionId, caller);
        if (!tx.getVaultId().equals(vaultId)) {
            throw LedgerException.notFound("transaction", transactionId);
        }
        return tx;
    }

    private static EntryCommand toEntryCommand(UUID vaultId, EntryRequest request) {
        return EntryCommand.builder()
            .vaultId(vaultId)
            .walletId(request.getWalletId())
            .cashFlowId(request.getCashFlowId())
            .amountMinor(request.getAmountMinor())
            .currency(currencyOf(request.getCurrency()))
            .note(request.getNote())
            .category(request.getCategory())
            .occurredAt(request.getOccurredAt())
            .build();
    }

    private static TransferCommand toTransferCommand(UUID vaultId, TransferRequest request) {
        return TransferCommand.builder()
            .vaultId(vaultId)
            .fromId(request.getFromId())
            .toId(request.getToId())
            .amountMinor(request.getAmountMinor())
            .currency(currencyOf(request.getCurrency()))
            .note(request.getNote())
            .category(request.getCategory())
            .occurredAt(request.getOccurredAt())
            .build();
    }

    private static CurrencyCode currencyOf(String code) {
        return code == null ? null : CurrencyCode.parse(code);
    }

    private static ResponseEntity<TransactionCreatedResponse> created(Transaction tx) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionCreatedResponse.from(tx));
    }
}
