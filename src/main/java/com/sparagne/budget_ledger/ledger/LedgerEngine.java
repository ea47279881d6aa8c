package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.observability.LedgerMetrics;
import com.sparagne.budget_ledger.store.LedgerStore;
import com.sparagne.budget_ledger.store.TransactionQuery;
import com.sparagne.budget_ledger.vault.AccessGate;
import com.sparagne.budget_ledger.vault.AccessGrant;
import com.sparagne.budget_ledger.vault.Capability;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.sparagne.budget_ledger.observability.CorrelationContext.TRANSACTION_ID_MDC_KEY;
import static com.sparagne.budget_ledger.observability.CorrelationContext.VAULT_ID_MDC_KEY;

/**
 * Ledger engine: the only writer of transactions and balances.
 *
 * Every mutating operation runs authorize, load, validate, compute and commit
 * inside one per-vault unit of work:
 * <ol>
 *   <li>{@link AccessGate} resolves the caller's grant for the vault</li>
 *   <li>participants are loaded and checked (existence, vault, archived flag)</li>
 *   <li>{@link DeltaCalculator} computes the legs</li>
 *   <li>one {@link LedgerCommit} is handed to the {@link LedgerStore}</li>
 * </ol>
 * All validation completes before the commit, so a rejected command writes
 * nothing. A {@link LedgerCommittedEvent} is published after each successful
 * unit of work.
 */
@Service
@Slf4j
public class LedgerEngine {

    private final LedgerStore store;
    private final AccessGate accessGate;
    private final LedgerMetrics metrics;
    private final ApplicationEventPublisher events;
    private final int defaultPageSize;
    private final int maxPageSize;

    public LedgerEngine(LedgerStore store,
                        AccessGate accessGate,
                        LedgerMetrics metrics,
                        ApplicationEventPublisher events,
                        @Value("${ledger.transactions.page-size:50}") int defaultPageSize,
                        @Value("${ledger.transactions.max-page-size:200}") int maxPageSize) {
        this.store = store;
        this.accessGate = accessGate;
        this.metrics = metrics;
        this.events = events;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    // ==================== Recording ====================

    /**
     * Records money coming in: +amount on the wallet and/or cash flow.
     */
    public Transaction recordIncome(String caller, EntryCommand command) {
        return recordEntry(TransactionType.INCOME, caller, command);
    }

    /**
     * Records money going out: -amount on the wallet and/or cash flow.
     * Balances may go negative.
     */
    public Transaction recordExpense(String caller, EntryCommand command) {
        return recordEntry(TransactionType.EXPENSE, caller, command);
    }

    private Transaction recordEntry(TransactionType type, String caller, EntryCommand command) {
        String operation = type.name().toLowerCase(Locale.ROOT);
        return execute(operation, type, () -> requireVaultId(command.getVaultId()), vaultId -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
            Vault vault = grant.getVault();
            Money amount = amountOf(vault, command.getAmountMinor(), command.getCurrency());
            if (command.getWalletId() == null && command.getCashFlowId() == null) {
                throw LedgerException.invalidInput("transaction", "wallet_id",
                    "A wallet or a cash flow is required");
            }
            if (command.getWalletId() != null) {
                requireActiveWallet(vaultId, command.getWalletId());
            }
            if (command.getCashFlowId() != null) {
                requireActiveCashFlow(vaultId, command.getCashFlowId());
            }

            EntryMetadata metadata = EntryMetadata.of(command.getNote(), command.getCategory(),
                command.getOccurredAt());
            Transaction tx = type == TransactionType.INCOME
                ? Transaction.income(vaultId, command.getWalletId(), command.getCashFlowId(), amount, metadata, caller)
                : Transaction.expense(vaultId, command.getWalletId(), command.getCashFlowId(), amount, metadata,
                    caller);
            return post(grant, tx, null);
        });
    }

    /**
     * Refunds part or all of a posted income or expense on the same wallet and
     * cash flow. The refund amount may not exceed the refundable remainder.
     */
    public Transaction recordRefund(String caller, RefundCommand command) {
        UUID originalId = command.getOriginalId();
        return execute("refund", TransactionType.REFUND,
            () -> vaultOf(requireParticipant(originalId, "refund_of")), vaultId -> {
                AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
                Transaction original = loadTransaction(vaultId, originalId);
                grant.requireVisible(original);

                if (original.isVoided()) {
                    throw LedgerException.invalidState("transaction", originalId,
                        "Cannot refund voided transaction " + originalId);
                }
                if (!original.getType().isRefundable()) {
                    throw LedgerException.invalidState("transaction", originalId,
                        "Transactions of type " + original.getType() + " cannot be refunded");
                }

                Money amount = amountOf(grant.getVault(), command.getAmountMinor(), command.getCurrency());
                Money remainder = remainderOf(original);
                if (amount.compareTo(remainder) > 0) {
                    throw LedgerException.invalidAmount(originalId, "amount_minor",
                        String.format("Refund of %s exceeds refundable remainder %s", amount.format(), remainder.format()));
                }
                if (original.getWalletId() != null) {
                    requireActiveWallet(vaultId, original.getWalletId());
                }
                if (original.getCashFlowId() != null) {
                    requireActiveCashFlow(vaultId, original.getCashFlowId());
                }

                Transaction refund = Transaction.refund(original, amount,
                    EntryMetadata.of(command.getNote(), command.getCategory(), command.getOccurredAt()), caller);
                return post(grant, refund, original);
            });
    }

    /**
     * Moves money between two wallets of one vault in a single commit.
     */
    public Transaction transferWallet(String caller, TransferCommand command) {
        return execute("transfer_wallet", TransactionType.TRANSFER_WALLET,
            () -> requireVaultId(command.getVaultId()), vaultId -> {
                AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
                Money amount = amountOf(grant.getVault(), command.getAmountMinor(), command.getCurrency());
                UUID from = requireParticipant(command.getFromId(), "from_wallet_id");
                UUID to = requireParticipant(command.getToId(), "to_wallet_id");
                if (from.equals(to)) {
                    throw LedgerException.sameWallet(from);
                }
                requireActiveWallet(vaultId, from);
                requireActiveWallet(vaultId, to);

                Transaction tx = Transaction.walletTransfer(vaultId, from, to, amount,
                    EntryMetadata.of(command.getNote(), command.getCategory(), command.getOccurredAt()), caller);
                return post(grant, tx, null);
            });
    }

    /**
     * Moves budget between two cash flows of one vault in a single commit.
     */
    public Transaction transferFlow(String caller, TransferCommand command) {
        return execute("transfer_flow", TransactionType.TRANSFER_FLOW,
            () -> requireVaultId(command.getVaultId()), vaultId -> {
                AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
                Money amount = amountOf(grant.getVault(), command.getAmountMinor(), command.getCurrency());
                UUID from = requireParticipant(command.getFromId(), "from_cash_flow_id");
                UUID to = requireParticipant(command.getToId(), "to_cash_flow_id");
                if (from.equals(to)) {
                    throw LedgerException.sameFlow(from);
                }
                requireActiveCashFlow(vaultId, from);
                requireActiveCashFlow(vaultId, to);

                Transaction tx = Transaction.flowTransfer(vaultId, from, to, amount,
                    EntryMetadata.of(command.getNote(), command.getCategory(), command.getOccurredAt()), caller);
                return post(grant, tx, null);
            });
    }

    // ==================== Corrections ====================

    /**
     * Rewrites note and category. Any other field may only repeat its current
     * value. Balances are not touched.
     *
     * @throws LedgerException INVALID_STATE for a voided transaction,
     *                         IMMUTABLE when another field would change
     */
    public Transaction updateTransaction(UUID transactionId, String caller, TransactionUpdate update) {
        return execute("update", null, () -> vaultOf(transactionId), vaultId -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
            Transaction tx = loadTransaction(vaultId, transactionId);
            grant.requireVisible(tx);
            if (tx.isVoided()) {
                throw LedgerException.invalidState("transaction", transactionId,
                    "Cannot update voided transaction " + transactionId);
            }
            rejectImmutableChanges(tx, update);

            String note = update.getNote() == null ? tx.getNote() : EntryMetadata.normalize(update.getNote());
            String category = update.getCategory() == null
                ? tx.getCategory()
                : EntryMetadata.normalize(update.getCategory());
            Transaction updated = tx.withMetadata(note, category, Instant.now());
            store.commit(LedgerCommit.metadata(updated));
            return updated;
        });
    }

    /**
     * Voids a posted transaction, applying the exact negation of its stored legs.
     *
     * @throws LedgerException ALREADY_VOIDED on a second void,
     *                         INVALID_STATE while posted refunds of it exist
     */
    public Transaction voidTransaction(UUID transactionId, String caller) {
        Transaction voided = execute("void", null, () -> vaultOf(transactionId), vaultId -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.RECORD);
            Transaction tx = loadTransaction(vaultId, transactionId);
            grant.requireLegs(tx.getLegs());
            if (tx.isVoided()) {
                throw LedgerException.alreadyVoided(transactionId);
            }
            boolean refunded = store.findRefundsOf(transactionId).stream().anyMatch(Transaction::isPosted);
            if (refunded) {
                throw LedgerException.invalidState("transaction", transactionId,
                    "Transaction " + transactionId + " has posted refunds; void them first");
            }

            Transaction result = tx.voidBy(caller, Instant.now());
            LedgerCommit commit = LedgerCommit.voiding(result);
            requireApplicable(commit.getDeltas(), false);
            store.commit(commit);
            return result;
        });
        metrics.incrementVoids();
        return voided;
    }

    // ==================== Queries ====================

    public Transaction getTransaction(UUID transactionId, String caller) {
        return store.readOnly(() -> {
            Transaction tx = store.findTransaction(transactionId)
                .orElseThrow(() -> LedgerException.notFound("transaction", transactionId));
            AccessGrant grant = accessGate.require(tx.getVaultId(), caller, Capability.VIEW);
            grant.requireVisible(tx);
            return tx;
        });
    }

    /**
     * Lists a vault's transactions newest first, one page at a time.
     * Flow-scoped callers only see transactions touching their cash flows.
     */
    public TransactionPage listTransactions(UUID vaultId, String caller, TransactionFilter filter) {
        TransactionFilter criteria = filter != null ? filter : TransactionFilter.builder().build();
        int limit = pageSize(criteria.getLimit());
        TransactionCursor cursor = criteria.getCursor() == null || criteria.getCursor().isBlank()
            ? null
            : TransactionCursor.decode(criteria.getCursor());
        if (criteria.getFrom() != null && criteria.getTo() != null && !criteria.getFrom().isBefore(criteria.getTo())) {
            throw LedgerException.invalidInput("transaction", "from", "'from' must be before 'to'");
        }

        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            if (criteria.getWalletId() != null) {
                grant.requireWallet(criteria.getWalletId());
            }
            if (criteria.getCashFlowId() != null) {
                grant.requireCashFlow(criteria.getCashFlowId());
            }

            List<Transaction> rows = store.findTransactions(TransactionQuery.builder()
                .vaultId(vaultId)
                .walletId(criteria.getWalletId())
                .cashFlowId(criteria.getCashFlowId())
                .visibleFlows(grant.visibleCashFlows())
                .type(criteria.getType())
                .from(criteria.getFrom())
                .to(criteria.getTo())
                .includeVoided(criteria.isIncludeVoided())
                .after(cursor)
                .limit(limit + 1)
                .build());

            if (rows.size() <= limit) {
                return new TransactionPage(rows, null);
            }
            List<Transaction> page = rows.subList(0, limit);
            return new TransactionPage(List.copyOf(page), TransactionCursor.after(page.get(limit - 1)).encode());
        });
    }

    /**
     * Amount still refundable on {@code originalId}: its amount minus every
     * non-voided refund of it.
     */
    public Money refundableRemainder(UUID originalId, String caller) {
        return store.readOnly(() -> {
            Transaction original = store.findTransaction(originalId)
                .orElseThrow(() -> LedgerException.notFound("transaction", originalId));
            AccessGrant grant = accessGate.require(original.getVaultId(), caller, Capability.VIEW);
            grant.requireVisible(original);
            if (!original.getType().isRefundable() || original.isVoided()) {
                return Money.zero(original.getAmount().getCurrency());
            }
            return remainderOf(original);
        });
    }

    /**
     * Recomputes every wallet and cash flow balance from the legs of posted
     * transactions and reports the ones that disagree. Read-only.
     */
    public BalanceReport verifyBalances(UUID vaultId, String caller) {
        BalanceReport report = store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            if (!grant.isVaultWide()) {
                throw LedgerException.unauthorized(caller, "vault", vaultId, "verify balances of vault " + vaultId);
            }
            CurrencyCode currency = grant.getVault().getCurrency();
            Map<DeltaTarget, Map<UUID, Long>> sums = store.sumPostedLegs(vaultId);
            List<Wallet> wallets = store.findWallets(vaultId);
            List<CashFlow> cashFlows = store.findCashFlows(vaultId);

            List<BalanceDrift> drifts = new ArrayList<>();
            for (Wallet wallet : wallets) {
                Money expected = Money.of(sums.get(DeltaTarget.WALLET).getOrDefault(wallet.getId(), 0L), currency);
                if (!expected.equals(wallet.getBalance())) {
                    drifts.add(new BalanceDrift(DeltaTarget.WALLET, wallet.getId(), wallet.getName(),
                        wallet.getBalance(), expected));
                }
            }
            for (CashFlow cashFlow : cashFlows) {
                Money expected = Money.of(sums.get(DeltaTarget.CASH_FLOW).getOrDefault(cashFlow.getId(), 0L),
                    currency);
                if (!expected.equals(cashFlow.getBalance())) {
                    drifts.add(new BalanceDrift(DeltaTarget.CASH_FLOW, cashFlow.getId(), cashFlow.getName(),
                        cashFlow.getBalance(), expected));
                }
            }
            return new BalanceReport(vaultId, wallets.size(), cashFlows.size(), List.copyOf(drifts), Instant.now());
        });

        if (!report.isConsistent()) {
            metrics.recordBalanceDrift(report.getDrifts().size());
            report.getDrifts().forEach(drift -> log.warn("Balance drift: vaultId={}, {}={}, stored={}, expected={}",
                vaultId, drift.getTarget(), drift.getTargetId(), drift.getStored(), drift.getExpected()));
        }
        return report;
    }

    // ==================== Internals ====================

    /**
     * Runs one mutating operation in its vault's unit of work, with MDC, metrics
     * and logging around it, and publishes the commit event on success.
     */
    private Transaction execute(String operation, TransactionType type, Supplier<UUID> vaultResolver,
                                Function<UUID, Transaction> work) {
        long startTime = System.currentTimeMillis();
        String typeTag = type != null ? type.name() : operation;
        try {
            UUID vaultId = vaultResolver.get();
            MDC.put(VAULT_ID_MDC_KEY, vaultId.toString());

            Transaction tx = store.inVaultTransaction(vaultId, () -> work.apply(vaultId));
            MDC.put(TRANSACTION_ID_MDC_KEY, tx.getId().toString());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransaction(typeTag, "success");
            metrics.recordLatency(operation, duration);
            log.info("Ledger {} committed: type={}, amount={}, state={}, duration={}ms",
                operation, tx.getType(), tx.getAmount(), tx.getState(), duration);

            events.publishEvent(LedgerCommittedEvent.of(vaultId, tx.getId(), operation));
            return tx;

        } catch (LedgerException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransaction(typeTag, e.getKind().name().toLowerCase(Locale.ROOT));
            metrics.recordLatency(operation, duration);
            if (e.getKind() == ErrorKind.STORE_FAILURE) {
                log.error("Ledger {} failed: error={}, duration={}ms", operation, e.getMessage(), duration, e);
            } else {
                log.warn("Ledger {} rejected: kind={}, error={}", operation, e.getKind(), e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove(VAULT_ID_MDC_KEY);
            MDC.remove(TRANSACTION_ID_MDC_KEY);
        }
    }

    private Transaction post(AccessGrant grant, Transaction tx, Transaction original) {
        Transaction posted = tx.withLegs(DeltaCalculator.legsFor(tx, original));
        grant.requireLegs(posted.getLegs());
        requireApplicable(posted.getLegs(), true);
        store.commit(LedgerCommit.post(posted));
        return posted;
    }

    /**
     * Checks every delta against the current state of its target, so that an
     * overflowing, dangling or cap-breaking delta is rejected before anything is
     * written. {@code newLegs} is false for a void, whose deltas reverse stored
     * legs and so never add to a flow's running income.
     */
    private void requireApplicable(List<BalanceDelta> deltas, boolean newLegs) {
        for (BalanceDelta delta : deltas) {
            switch (delta.getTarget()) {
                case WALLET -> store.findWallet(delta.getTargetId())
                    .map(Wallet::getBalance)
                    .orElseThrow(() -> LedgerException.notFound("wallet", delta.getTargetId()))
                    .plus(delta.getAmount());
                case CASH_FLOW -> {
                    CashFlow flow = store.findCashFlow(delta.getTargetId())
                        .orElseThrow(() -> LedgerException.notFound("cash_flow", delta.getTargetId()));
                    Money next = flow.getBalance().plus(delta.getAmount());
                    requireWithinCap(flow, delta.getAmount(), next, newLegs);
                }
            }
        }
    }

    private void requireWithinCap(CashFlow flow, Money amount, Money next, boolean newLegs) {
        if (!amount.isPositive()) {
            return;
        }
        switch (flow.getMode()) {
            case UNLIMITED -> {
            }
            case NET_CAPPED -> {
                if (next.getMinor() > flow.getCapMinor()) {
                    throw LedgerException.maxBalanceReached(flow.getId(), flow.getName(), flow.getCapMinor());
                }
            }
            case INCOME_CAPPED -> {
                if (newLegs) {
                    long inflow = store.sumPostedInflow(flow.getVaultId(), flow.getId());
                    if (amount.getMinor() > flow.getCapMinor() - inflow) {
                        throw LedgerException.maxBalanceReached(flow.getId(), flow.getName(), flow.getCapMinor());
                    }
                }
            }
        }
    }

    private Money amountOf(Vault vault, Long amountMinor, CurrencyCode currency) {
        if (currency != null && currency != vault.getCurrency()) {
            throw LedgerException.currencyMismatch(vault.getCurrency().name(), currency.name());
        }
        if (amountMinor == null || amountMinor <= 0) {
            throw LedgerException.invalidAmount("amount_minor", "Amount must be positive");
        }
        return Money.of(amountMinor, vault.getCurrency());
    }

    private Money remainderOf(Transaction original) {
        Money refunded = store.findRefundsOf(original.getId()).stream()
            .filter(Transaction::isPosted)
            .map(Transaction::getAmount)
            .reduce(Money.zero(original.getAmount().getCurrency()), Money::plus);
        return original.getAmount().minus(refunded);
    }

    private void rejectImmutableChanges(Transaction tx, TransactionUpdate update) {
        if (update.getAmountMinor() != null && update.getAmountMinor() != tx.getAmount().getMinor()) {
            throw LedgerException.immutable(tx.getId(), "amount_minor");
        }
        if (update.getType() != null && update.getType() != tx.getType()) {
            throw LedgerException.immutable(tx.getId(), "type");
        }
        if (update.getWalletId() != null && !update.getWalletId().equals(tx.getWalletId())) {
            throw LedgerException.immutable(tx.getId(), "wallet_id");
        }
        if (update.getCashFlowId() != null && !update.getCashFlowId().equals(tx.getCashFlowId())) {
            throw LedgerException.immutable(tx.getId(), "cash_flow_id");
        }
        if (update.getToWalletId() != null && !update.getToWalletId().equals(tx.getToWalletId())) {
            throw LedgerException.immutable(tx.getId(), "to_wallet_id");
        }
        if (update.getToCashFlowId() != null && !update.getToCashFlowId().equals(tx.getToCashFlowId())) {
            throw LedgerException.immutable(tx.getId(), "to_cash_flow_id");
        }
        if (update.getOccurredAt() != null && !update.getOccurredAt().equals(tx.getOccurredAt())) {
            throw LedgerException.immutable(tx.getId(), "occurred_at");
        }
    }

    private UUID vaultOf(UUID transactionId) {
        return store.readOnly(() -> store.findTransaction(transactionId)
            .map(Transaction::getVaultId)
            .orElseThrow(() -> LedgerException.notFound("transaction", transactionId)));
    }

    private Transaction loadTransaction(UUID vaultId, UUID transactionId) {
        return store.findTransaction(transactionId)
            .filter(t -> t.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("transaction", transactionId));
    }

    private void requireActiveWallet(UUID vaultId, UUID walletId) {
        Wallet wallet = store.findWallet(walletId)
            .filter(w -> w.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("wallet", walletId));
        if (wallet.isArchived()) {
            throw LedgerException.invalidState("wallet", walletId, "Wallet " + wallet.getName() + " is archived");
        }
    }

    private void requireActiveCashFlow(UUID vaultId, UUID cashFlowId) {
        CashFlow cashFlow = store.findCashFlow(cashFlowId)
            .filter(f -> f.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("cash_flow", cashFlowId));
        if (cashFlow.isArchived()) {
            throw LedgerException.invalidState("cash_flow", cashFlowId,
                "Cash flow " + cashFlow.getName() + " is archived");
        }
    }

    private static UUID requireVaultId(UUID vaultId) {
        if (vaultId == null) {
            throw LedgerException.invalidInput("vault", "vault_id", "Vault id is required");
        }
        return vaultId;
    }

    private static UUID requireParticipant(UUID id, String field) {
        if (id == null) {
            throw LedgerException.invalidInput("transaction", field, field + " is required");
        }
        return id;
    }

    private int pageSize(Integer requested) {
        if (requested == null) {
            return defaultPageSize;
        }
        if (requested < 1) {
            throw LedgerException.invalidInput("transaction", "limit", "limit must be at least 1");
        }
        return Math.min(requested, maxPageSize);
    }
}
