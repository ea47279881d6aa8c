package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.LedgerCommittedEvent;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static com.sparagne.budget_ledger.observability.CorrelationContext.VAULT_ID_MDC_KEY;

/**
 * Vault lifecycle plus wallet and cash flow management.
 *
 * Balances are never touched here: wallets and cash flows are created at zero
 * and afterwards only their name, archived flag and (for cash flows) cap change.
 */
@Service
@Slf4j
public class VaultService {

    static final int MAX_NAME_LENGTH = 64;

    private final LedgerStore store;
    private final AccessGate accessGate;
    private final ApplicationEventPublisher events;
    private final VaultDeletePolicy deletePolicy;
    private final CurrencyCode defaultCurrency;
    private final String defaultVaultName;

    public VaultService(LedgerStore store,
                        AccessGate accessGate,
                        ApplicationEventPublisher events,
                        @Value("${ledger.vault.delete-policy:REJECT}") VaultDeletePolicy deletePolicy,
                        @Value("${ledger.vault.default-currency:EUR}") CurrencyCode defaultCurrency,
                        @Value("${ledger.vault.default-name:Main}") String defaultVaultName) {
        this.store = store;
        this.accessGate = accessGate;
        this.events = events;
        this.deletePolicy = deletePolicy;
        this.defaultCurrency = defaultCurrency;
        this.defaultVaultName = defaultVaultName;
    }

    // ==================== Vaults ====================

    /**
     * Creates a vault owned by {@code caller}, with the owner membership.
     * Vault names are unique per owner, ignoring case.
     */
    public Vault createVault(String caller, String name, CurrencyCode currency) {
        requireCaller(caller);
        String vaultName = normalizeName("vault", name);
        CurrencyCode vaultCurrency = currency != null ? currency : defaultCurrency;

        Vault vault = store.inOwnerTransaction(caller, () -> {
            boolean taken = store.findVaultsVisibleTo(caller).stream()
                .filter(v -> v.isOwnedBy(caller))
                .anyMatch(v -> v.getName().equalsIgnoreCase(vaultName));
            if (taken) {
                throw LedgerException.invalidInput("vault", "name", "Vault name already in use: " + vaultName);
            }
            Vault created = Vault.create(vaultName, caller, vaultCurrency);
            store.insertVault(created);
            store.saveMembership(Membership.vaultWide(created.getId(), caller, MembershipRole.OWNER));
            return created;
        });

        log.info("Vault created: vaultId={}, owner={}, currency={}", vault.getId(), caller, vaultCurrency);
        return vault;
    }

    /**
     * Returns the oldest vault the caller owns, creating a default one on first use.
     * Concurrent first calls for one caller all return the same vault.
     */
    public Vault provisionDefaultVault(String caller) {
        requireCaller(caller);
        Optional<Vault> existing = findOldestOwned(caller);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return createVault(caller, defaultVaultName, defaultCurrency);
        } catch (LedgerException e) {
            if (e.getKind() != ErrorKind.INVALID_INPUT) {
                throw e;
            }
            // another call created it first
            log.debug("Default vault for {} created concurrently, reading it back", caller);
            return findOldestOwned(caller).orElseThrow(() -> e);
        }
    }

    private Optional<Vault> findOldestOwned(String caller) {
        return store.readOnly(() -> store.findVaultsVisibleTo(caller).stream()
            .filter(v -> v.isOwnedBy(caller))
            .findFirst());
    }

    public VaultView getVault(UUID vaultId, String caller) {
        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            if (!grant.isVaultWide()) {
                List<CashFlow> flows = store.findCashFlows(vaultId).stream()
                    .filter(f -> grant.coversCashFlow(f.getId()))
                    .toList();
                return new VaultView(grant.getVault(), grant.getRole(), List.of(), flows, List.of());
            }
            return new VaultView(grant.getVault(), grant.getRole(),
                store.findWallets(vaultId), store.findCashFlows(vaultId), store.findMemberships(vaultId));
        });
    }

    public List<Vault> listVaults(String caller) {
        requireCaller(caller);
        return store.readOnly(() -> store.findVaultsVisibleTo(caller));
    }

    /**
     * Deletes a vault according to the configured {@link VaultDeletePolicy}.
     *
     * @throws LedgerException INVALID_STATE under REJECT while the vault has content
     */
    public void deleteVault(UUID vaultId, String caller) {
        MDC.put(VAULT_ID_MDC_KEY, vaultId.toString());
        try {
            store.inVaultTransaction(vaultId, () -> {
                accessGate.require(vaultId, caller, Capability.ADMINISTER);
                if (deletePolicy == VaultDeletePolicy.REJECT && store.hasLedgerContent(vaultId)) {
                    throw LedgerException.invalidState("vault", vaultId,
                        "Vault " + vaultId + " still has wallets, cash flows or transactions");
                }
                store.deleteVault(vaultId);
                return null;
            });
            log.info("Vault deleted: policy={}", deletePolicy);
            events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "vault_delete"));
        } finally {
            MDC.remove(VAULT_ID_MDC_KEY);
        }
    }

    // ==================== Wallets ====================

    public Wallet createWallet(UUID vaultId, String caller, String name) {
        Wallet wallet = store.inVaultTransaction(vaultId, () -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.ORGANIZE);
            String walletName = uniqueName("wallet", name, store.findWallets(vaultId),
                Wallet::getId, Wallet::getName, null);
            Wallet created = Wallet.open(grant.getVault(), walletName);
            store.insertWallet(created);
            return created;
        });
        log.info("Wallet created: vaultId={}, walletId={}, name={}", vaultId, wallet.getId(), wallet.getName());
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "wallet_create"));
        return wallet;
    }

    public Wallet getWallet(UUID vaultId, UUID walletId, String caller) {
        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            grant.requireWallet(walletId);
            return loadWallet(vaultId, walletId);
        });
    }

    public Wallet renameWallet(UUID vaultId, UUID walletId, String caller, String name) {
        Wallet renamed = store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ORGANIZE);
            Wallet wallet = loadWallet(vaultId, walletId);
            String walletName = uniqueName("wallet", name, store.findWallets(vaultId),
                Wallet::getId, Wallet::getName, walletId);
            Wallet updated = wallet.rename(walletName);
            store.updateWalletDetails(updated);
            return updated;
        });
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "wallet_rename"));
        return renamed;
    }

    /**
     * Archives or restores a wallet. Archived wallets keep balance and history
     * but accept no new transactions.
     */
    public Wallet setWalletArchived(UUID vaultId, UUID walletId, String caller, boolean archived) {
        Wallet result = store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ORGANIZE);
            Wallet updated = loadWallet(vaultId, walletId).withArchived(archived);
            store.updateWalletDetails(updated);
            return updated;
        });
        log.info("Wallet {}: vaultId={}, walletId={}", archived ? "archived" : "restored", vaultId, walletId);
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, archived ? "wallet_archive" : "wallet_restore"));
        return result;
    }

    // ==================== Cash flows ====================

    public CashFlow createCashFlow(UUID vaultId, String caller, String name) {
        return createCashFlow(vaultId, caller, name, CashFlowMode.UNLIMITED, null);
    }

    public CashFlow createCashFlow(UUID vaultId, String caller, String name, CashFlowMode mode, Long capMinor) {
        CashFlowMode flowMode = mode != null ? mode : CashFlowMode.UNLIMITED;
        CashFlow cashFlow = store.inVaultTransaction(vaultId, () -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.ORGANIZE);
            String flowName = uniqueName("cash_flow", name, store.findCashFlows(vaultId),
                CashFlow::getId, CashFlow::getName, null);
            CashFlow created = CashFlow.open(grant.getVault(), flowName, flowMode, capMinor);
            store.insertCashFlow(created);
            return created;
        });
        log.info("Cash flow created: vaultId={}, cashFlowId={}, name={}, mode={}",
            vaultId, cashFlow.getId(), cashFlow.getName(), flowMode);
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "cash_flow_create"));
        return cashFlow;
    }

    public CashFlow getCashFlow(UUID vaultId, UUID cashFlowId, String caller) {
        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            grant.requireCashFlow(cashFlowId);
            return loadCashFlow(vaultId, cashFlowId);
        });
    }

    public CashFlow renameCashFlow(UUID vaultId, UUID cashFlowId, String caller, String name) {
        CashFlow renamed = store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ORGANIZE);
            CashFlow cashFlow = loadCashFlow(vaultId, cashFlowId);
            String flowName = uniqueName("cash_flow", name, store.findCashFlows(vaultId),
                CashFlow::getId, CashFlow::getName, cashFlowId);
            CashFlow updated = cashFlow.rename(flowName);
            store.updateCashFlowDetails(updated);
            return updated;
        });
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "cash_flow_rename"));
        return renamed;
    }

    public CashFlow setCashFlowArchived(UUID vaultId, UUID cashFlowId, String caller, boolean archived) {
        CashFlow result = store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ORGANIZE);
            CashFlow updated = loadCashFlow(vaultId, cashFlowId).withArchived(archived);
            store.updateCashFlowDetails(updated);
            return updated;
        });
        log.info("Cash flow {}: vaultId={}, cashFlowId={}", archived ? "archived" : "restored", vaultId, cashFlowId);
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null,
            archived ? "cash_flow_archive" : "cash_flow_restore"));
        return result;
    }

    /**
     * Changes the cap of a cash flow. A capped mode is refused while the flow
     * already exceeds the new cap: its balance for NET_CAPPED, its running
     * income total for INCOME_CAPPED.
     *
     * @throws LedgerException MAX_BALANCE_REACHED when the flow is already above the cap,
     *                         INVALID_INPUT when the cap does not fit the mode
     */
    public CashFlow setCashFlowMode(UUID vaultId, UUID cashFlowId, String caller, CashFlowMode mode, Long capMinor) {
        if (mode == null) {
            throw LedgerException.invalidInput("cash_flow", "mode", "Mode is required");
        }
        CashFlow result = store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ORGANIZE);
            CashFlow updated = loadCashFlow(vaultId, cashFlowId).withMode(mode, capMinor);
            long current = switch (mode) {
                case UNLIMITED -> 0L;
                case NET_CAPPED -> updated.getBalance().getMinor();
                case INCOME_CAPPED -> store.sumPostedInflow(vaultId, cashFlowId);
            };
            if (mode.isCapped() && current > capMinor) {
                throw LedgerException.maxBalanceReached(cashFlowId, updated.getName(), capMinor);
            }
            store.updateCashFlowDetails(updated);
            return updated;
        });
        log.info("Cash flow mode set: vaultId={}, cashFlowId={}, mode={}, capMinor={}",
            vaultId, cashFlowId, mode, capMinor);
        events.publishEvent(LedgerCommittedEvent.of(vaultId, null, "cash_flow_mode"));
        return result;
    }

    // ==================== Helpers ====================

    private Wallet loadWallet(UUID vaultId, UUID walletId) {
        return store.findWallet(walletId)
            .filter(w -> w.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("wallet", walletId));
    }

    private CashFlow loadCashFlow(UUID vaultId, UUID cashFlowId) {
        return store.findCashFlow(cashFlowId)
            .filter(f -> f.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("cash_flow", cashFlowId));
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw LedgerException.invalidInput("user", "username", "Caller username is required");
        }
    }

    /**
     * Trimmed, non-blank, at most {@value #MAX_NAME_LENGTH} characters.
     */
    static String normalizeName(String entity, String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw LedgerException.invalidInput(entity, "name", "Name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw LedgerException.invalidInput(entity, "name",
                "Name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }

    private static <T> String uniqueName(String entity, String raw, Collection<T> siblings,
                                         Function<T, UUID> idOf, Function<T, String> nameOf, UUID selfId) {
        String name = normalizeName(entity, raw);
        String key = name.toLowerCase(Locale.ROOT);
        boolean taken = siblings.stream()
            .filter(s -> !idOf.apply(s).equals(selfId))
            .anyMatch(s -> nameOf.apply(s).toLowerCase(Locale.ROOT).equals(key));
        if (taken) {
            throw LedgerException.invalidInput(entity, "name", "Name already in use in this vault: " + name);
        }
        return name;
    }
}
