package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.ledger.LedgerCommit;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionState;
import com.sparagne.budget_ledger.store.LedgerStore;
import com.sparagne.budget_ledger.store.TransactionQuery;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Membership;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Relational {@link LedgerStore} backed by Spring Data JPA.
 *
 * Each vault unit of work runs in one database transaction that first takes a
 * PESSIMISTIC_WRITE lock on the vault row, so writers on the same vault are
 * serialized while readers keep seeing the last committed state. Balances are
 * changed with in-place {@code balance = balance + delta} updates inside that
 * transaction, never by writing back a value read earlier.
 */
@Component
@ConditionalOnProperty(name = "ledger.store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private static final String SUM_POSTED_LEGS_SQL =
        "SELECT l.target, l.target_id, SUM(l.amount_minor) AS total " +
        "FROM transaction_legs l JOIN transactions t ON t.id = l.transaction_id " +
        "WHERE t.vault_id = ? AND t.state = ? " +
        "GROUP BY l.target, l.target_id";

    private static final String SUM_POSTED_INFLOW_SQL =
        "SELECT COALESCE(SUM(l.amount_minor), 0) " +
        "FROM transaction_legs l JOIN transactions t ON t.id = l.transaction_id " +
        "WHERE t.vault_id = ? AND t.state = ? AND l.target = ? AND l.target_id = ? AND l.amount_minor > 0";

    private final VaultRepository vaultRepository;
    private final WalletRepository walletRepository;
    private final CashFlowRepository cashFlowRepository;
    private final MembershipRepository membershipRepository;
    private final TransactionRepository transactionRepository;
    private final TransactionLegRepository legRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public JpaLedgerStore(VaultRepository vaultRepository,
                          WalletRepository walletRepository,
                          CashFlowRepository cashFlowRepository,
                          MembershipRepository membershipRepository,
                          TransactionRepository transactionRepository,
                          TransactionLegRepository legRepository,
                          JdbcTemplate jdbcTemplate,
                          PlatformTransactionManager transactionManager,
                          @Value("${ledger.transaction-timeout-seconds:30}") int timeoutSeconds) {
        this.vaultRepository = vaultRepository;
        this.walletRepository = walletRepository;
        this.cashFlowRepository = cashFlowRepository;
        this.membershipRepository = membershipRepository;
        this.transactionRepository = transactionRepository;
        this.legRepository = legRepository;
        this.jdbcTemplate = jdbcTemplate;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);
        this.writeTemplate.setIsolationLevel(TransactionTemplate.ISOLATION_READ_COMMITTED);
        this.writeTemplate.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRED);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRED);
    }

    @Override
    public <T> T inVaultTransaction(UUID vaultId, Supplier<T> work) {
        return execute(writeTemplate, "vault unit of work", () -> {
            vaultRepository.lockById(vaultId)
                .orElseThrow(() -> LedgerException.notFound("vault", vaultId));
            return work.get();
        });
    }

    /**
     * Concurrent creators for one owner are not serialized here; the
     * {@code uq_vaults_owner_name} constraint rejects the second insert of a name.
     */
    @Override
    public <T> T inOwnerTransaction(String owner, Supplier<T> work) {
        return execute(writeTemplate, "owner unit of work", work);
    }

    @Override
    public <T> T readOnly(Supplier<T> work) {
        return execute(readTemplate, "read", work);
    }

    private <T> T execute(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Store failure during {}: {}", operation, e.getMessage());
            throw LedgerException.storeFailure(operation, e);
        }
    }

    // Vaults

    @Override
    public void insertVault(Vault vault) {
        try {
            vaultRepository.saveAndFlush(VaultEntity.fromDomain(vault));
        } catch (DataIntegrityViolationException e) {
            log.debug("Vault name '{}' already taken for owner {}: {}", vault.getName(), vault.getOwner(),
                e.getMessage());
            throw LedgerException.invalidInput("vault", "name", "Vault name already in use: " + vault.getName());
        }
        log.debug("Inserted vault {}", vault.getId());
    }

    @Override
    public Optional<Vault> findVault(UUID vaultId) {
        return vaultRepository.findById(vaultId).map(VaultEntity::toDomain);
    }

    @Override
    public List<Vault> findVaultsVisibleTo(String username) {
        return vaultRepository.findVisibleTo(username).stream()
            .map(VaultEntity::toDomain)
            .toList();
    }

    @Override
    public boolean hasLedgerContent(UUID vaultId) {
        return transactionRepository.existsByVaultId(vaultId)
            || !walletRepository.findByVaultIdOrderByCreatedAt(vaultId).isEmpty()
            || !cashFlowRepository.findByVaultIdOrderByCreatedAt(vaultId).isEmpty();
    }

    @Override
    public void deleteVault(UUID vaultId) {
        int legs = legRepository.deleteByVault(vaultId);
        int transactions = transactionRepository.deleteByVault(vaultId);
        int memberships = membershipRepository.deleteByVault(vaultId);
        int wallets = walletRepository.deleteByVault(vaultId);
        int flows = cashFlowRepository.deleteByVault(vaultId);
        vaultRepository.deleteById(vaultId);
        log.debug("Deleted vault {} with {} transactions ({} legs), {} memberships, {} wallets, {} cash flows",
            vaultId, transactions, legs, memberships, wallets, flows);
    }

    // Memberships

    @Override
    public void saveMembership(Membership membership) {
        Optional<MembershipEntity> existing =
            findGrantEntity(membership.getVaultId(), membership.getCashFlowId(), membership.getUsername());
        if (existing.isPresent()) {
            MembershipEntity entity = existing.get();
            entity.updateRole(membership.getRole());
            membershipRepository.save(entity);
        } else {
            membershipRepository.save(MembershipEntity.fromDomain(membership));
        }
    }

    @Override
    public boolean deleteMembership(UUID vaultId, UUID cashFlowId, String username) {
        Optional<MembershipEntity> existing = findGrantEntity(vaultId, cashFlowId, username);
        existing.ifPresent(membershipRepository::delete);
        return existing.isPresent();
    }

    @Override
    public Optional<Membership> findMembership(UUID vaultId, UUID cashFlowId, String username) {
        return findGrantEntity(vaultId, cashFlowId, username).map(MembershipEntity::toDomain);
    }

    @Override
    public List<Membership> findMemberships(UUID vaultId) {
        return membershipRepository.findByVaultIdOrderByGrantedAt(vaultId).stream()
            .map(MembershipEntity::toDomain)
            .toList();
    }

    @Override
    public List<Membership> findMembershipsOf(UUID vaultId, String username) {
        return membershipRepository.findByVaultIdAndUsername(vaultId, username).stream()
            .map(MembershipEntity::toDomain)
            .toList();
    }

    private Optional<MembershipEntity> findGrantEntity(UUID vaultId, UUID cashFlowId, String username) {
        return cashFlowId == null
            ? membershipRepository.findByVaultIdAndCashFlowIdIsNullAndUsername(vaultId, username)
            : membershipRepository.findByVaultIdAndCashFlowIdAndUsername(vaultId, cashFlowId, username);
    }

    // Wallets and cash flows

    @Override
    public void insertWallet(Wallet wallet) {
        walletRepository.save(WalletEntity.fromDomain(wallet));
    }

    @Override
    public void updateWalletDetails(Wallet wallet) {
        WalletEntity entity = walletRepository.findById(wallet.getId())
            .orElseThrow(() -> LedgerException.notFound("wallet", wallet.getId()));
        entity.updateFromDomain(wallet);
        walletRepository.save(entity);
    }

    @Override
    public Optional<Wallet> findWallet(UUID walletId) {
        return walletRepository.findById(walletId).map(WalletEntity::toDomain);
    }

    @Override
    public List<Wallet> findWallets(UUID vaultId) {
        return walletRepository.findByVaultIdOrderByCreatedAt(vaultId).stream()
            .map(WalletEntity::toDomain)
            .toList();
    }

    @Override
    public void insertCashFlow(CashFlow cashFlow) {
        cashFlowRepository.save(CashFlowEntity.fromDomain(cashFlow));
    }

    @Override
    public void updateCashFlowDetails(CashFlow cashFlow) {
        CashFlowEntity entity = cashFlowRepository.findById(cashFlow.getId())
            .orElseThrow(() -> LedgerException.notFound("cash_flow", cashFlow.getId()));
        entity.updateFromDomain(cashFlow);
        cashFlowRepository.save(entity);
    }

    @Override
    public Optional<CashFlow> findCashFlow(UUID cashFlowId) {
        return cashFlowRepository.findById(cashFlowId).map(CashFlowEntity::toDomain);
    }

    @Override
    public List<CashFlow> findCashFlows(UUID vaultId) {
        return cashFlowRepository.findByVaultIdOrderByCreatedAt(vaultId).stream()
            .map(CashFlowEntity::toDomain)
            .toList();
    }

    // Transactions

    @Override
    public Optional<Transaction> findTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(entity -> entity.toDomain(legsOf(entity.getId())));
    }

    @Override
    public List<Transaction> findRefundsOf(UUID originalId) {
        return withLegs(transactionRepository.findByRefundOfOrderByRecordedAt(originalId));
    }

    @Override
    public List<Transaction> findTransactions(TransactionQuery query) {
        PageRequest page = PageRequest.of(0, query.getLimit(), TransactionSpecifications.NEWEST_FIRST);
        return withLegs(transactionRepository.findAll(TransactionSpecifications.matching(query), page).getContent());
    }

    @Override
    public List<Transaction> findPostedTransactions(UUID vaultId, Instant from, Instant to) {
        return withLegs(transactionRepository.findAll(
            TransactionSpecifications.inVault(vaultId)
                .and(TransactionSpecifications.inState(TransactionState.POSTED))
                .and(TransactionSpecifications.occurredWithin(from, to)),
            TransactionSpecifications.NEWEST_FIRST));
    }

    @Override
    public long sumPostedInflow(UUID vaultId, UUID cashFlowId) {
        Long total = jdbcTemplate.queryForObject(SUM_POSTED_INFLOW_SQL, Long.class,
            vaultId, TransactionState.POSTED.name(), DeltaTarget.CASH_FLOW.name(), cashFlowId);
        return total != null ? total : 0L;
    }

    @Override
    public Map<DeltaTarget, Map<UUID, Long>> sumPostedLegs(UUID vaultId) {
        Map<DeltaTarget, Map<UUID, Long>> sums = new EnumMap<>(DeltaTarget.class);
        for (DeltaTarget target : DeltaTarget.values()) {
            sums.put(target, new HashMap<>());
        }
        jdbcTemplate.query(SUM_POSTED_LEGS_SQL, rs -> {
            DeltaTarget target = DeltaTarget.valueOf(rs.getString("target"));
            sums.get(target).put(UUID.fromString(rs.getString("target_id")), rs.getLong("total"));
        }, vaultId, TransactionState.POSTED.name());
        return sums;
    }

    @Override
    public void commit(LedgerCommit commit) {
        Transaction tx = commit.getTransaction();
        switch (commit.getKind()) {
            case POST -> {
                transactionRepository.save(TransactionEntity.fromDomain(tx));
                List<TransactionLegEntity> legs = new ArrayList<>();
                for (int i = 0; i < tx.getLegs().size(); i++) {
                    legs.add(TransactionLegEntity.fromDomain(tx.getId(), i, tx.getLegs().get(i)));
                }
                legRepository.saveAll(legs);
            }
            case VOID, METADATA -> {
                TransactionEntity entity = transactionRepository.findById(tx.getId())
                    .orElseThrow(() -> LedgerException.notFound("transaction", tx.getId()));
                entity.updateFromDomain(tx);
                transactionRepository.save(entity);
            }
        }
        for (BalanceDelta delta : commit.getDeltas()) {
            applyDelta(delta);
        }
        log.debug("Committed {} of transaction {} with {} deltas",
            commit.getKind(), tx.getId(), commit.getDeltas().size());
    }

    private void applyDelta(BalanceDelta delta) {
        long amount = delta.getAmount().getMinor();
        int updated = switch (delta.getTarget()) {
            case WALLET -> walletRepository.adjustBalance(delta.getTargetId(), amount);
            case CASH_FLOW -> cashFlowRepository.adjustBalance(delta.getTargetId(), amount);
        };
        if (updated != 1) {
            throw LedgerException.notFound(delta.targetsWallet() ? "wallet" : "cash_flow", delta.getTargetId());
        }
    }

    private List<BalanceDelta> legsOf(UUID transactionId) {
        return legRepository.findByTransactionIdOrderByPosition(transactionId).stream()
            .map(TransactionLegEntity::toDomain)
            .toList();
    }

    private List<Transaction> withLegs(Collection<TransactionEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<UUID, List<TransactionLegEntity>> legsByTransaction = legRepository
            .findByTransactionIdIn(entities.stream().map(TransactionEntity::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(TransactionLegEntity::getTransactionId));
        return entities.stream()
            .map(entity -> entity.toDomain(legsByTransaction.getOrDefault(entity.getId(), List.of()).stream()
                .sorted(Comparator.comparingInt(TransactionLegEntity::getPosition))
                .map(TransactionLegEntity::toDomain)
                .toList()))
            .toList();
    }
}
