package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.LedgerFixture;
import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static com.sparagne.budget_ledger.LedgerFixture.transfer;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Random operation sequences checked against an independent model: after every
 * sequence each balance equals the sum of the effects of the transactions that
 * are still posted, and balance verification finds no drift.
 */
class BalanceInvariantPropertyTest {

    private static final int OPERATIONS = 300;

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 2024L, 99991L})
    @DisplayName("Balances always equal the sum of posted transaction effects")
    void testBalancesMatchModel(long seed) {
        Random random = new Random(seed);
        LedgerFixture fx = new LedgerFixture();
        Vault vault = fx.vault("frank");
        List<Wallet> wallets = List.of(fx.wallet(vault, "A"), fx.wallet(vault, "B"), fx.wallet(vault, "C"));
        List<CashFlow> flows = List.of(fx.cashFlow(vault, "X"), fx.cashFlow(vault, "Y"));

        Map<UUID, Map<UUID, Long>> effects = new HashMap<>();
        Map<UUID, Long> remainders = new HashMap<>();
        Map<UUID, UUID> refundOf = new HashMap<>();
        List<UUID> posted = new ArrayList<>();

        for (int i = 0; i < OPERATIONS; i++) {
            int choice = random.nextInt(6);
            long amount = 1 + random.nextInt(5000);
            UUID wallet = wallets.get(random.nextInt(wallets.size())).getId();
            UUID flow = random.nextBoolean() ? flows.get(random.nextInt(flows.size())).getId() : null;

            switch (choice) {
                case 0, 1 -> {
                    boolean income = choice == 0;
                    Transaction tx = income
                        ? fx.income(vault, wallet, flow, amount)
                        : fx.expense(vault, wallet, flow, amount);
                    long signed = income ? amount : -amount;
                    Map<UUID, Long> effect = new HashMap<>();
                    effect.put(wallet, signed);
                    if (flow != null) {
                        effect.put(flow, signed);
                    }
                    effects.put(tx.getId(), effect);
                    remainders.put(tx.getId(), amount);
                    posted.add(tx.getId());
                }
                case 2 -> {
                    UUID to = wallets.get(random.nextInt(wallets.size())).getId();
                    if (to.equals(wallet)) {
                        assertEquals(ErrorKind.SAME_WALLET, assertThrows(LedgerException.class, () ->
                            fx.engine.transferWallet("frank", transfer(vault, wallet, to, amount))).getKind());
                        continue;
                    }
                    Transaction tx = fx.engine.transferWallet("frank", transfer(vault, wallet, to, amount));
                    effects.put(tx.getId(), Map.of(wallet, -amount, to, amount));
                    posted.add(tx.getId());
                }
                case 3 -> {
                    UUID original = pickRefundable(random, posted, remainders);
                    if (original == null) {
                        continue;
                    }
                    long remaining = remainders.get(original);
                    long requested = 1 + random.nextInt((int) Math.min(remaining + 100, Integer.MAX_VALUE - 1));
                    if (requested > remaining) {
                        assertEquals(ErrorKind.INVALID_AMOUNT, assertThrows(LedgerException.class, () ->
                            fx.engine.recordRefund("frank", RefundCommand.builder()
                                .originalId(original).amountMinor(requested).build())).getKind());
                        continue;
                    }
                    Transaction refund = fx.engine.recordRefund("frank",
                        RefundCommand.builder().originalId(original).amountMinor(requested).build());
                    Map<UUID, Long> effect = new HashMap<>();
                    effects.get(original).forEach((target, signed) ->
                        effect.put(target, signed > 0 ? -requested : requested));
                    effects.put(refund.getId(), effect);
                    remainders.merge(original, -requested, Long::sum);
                    refundOf.put(refund.getId(), original);
                    posted.add(refund.getId());
                }
                default -> {
                    if (posted.isEmpty()) {
                        continue;
                    }
                    UUID target = posted.get(random.nextInt(posted.size()));
                    boolean hasPostedRefunds = refundOf.entrySet().stream()
                        .anyMatch(e -> e.getValue().equals(target) && posted.contains(e.getKey()));
                    if (hasPostedRefunds) {
                        assertEquals(ErrorKind.INVALID_STATE, assertThrows(LedgerException.class, () ->
                            fx.engine.voidTransaction(target, "frank")).getKind());
                        continue;
                    }
                    fx.engine.voidTransaction(target, "frank");
                    posted.remove(target);
                    remainders.remove(target);
                    UUID original = refundOf.get(target);
                    if (original != null && remainders.containsKey(original)) {
                        remainders.merge(original, fx.engine.getTransaction(target, "frank").getAmount().getMinor(),
                            Long::sum);
                    }
                }
            }
        }

        Map<UUID, Long> expected = new HashMap<>();
        for (UUID id : posted) {
            effects.get(id).forEach((target, signed) -> expected.merge(target, signed, Long::sum));
        }
        for (Wallet wallet : wallets) {
            assertEquals(expected.getOrDefault(wallet.getId(), 0L), fx.walletBalance(wallet.getId()),
                "wallet " + wallet.getName());
        }
        for (CashFlow flow : flows) {
            assertEquals(expected.getOrDefault(flow.getId(), 0L), fx.cashFlowBalance(flow.getId()),
                "cash flow " + flow.getName());
        }
        remainders.forEach((id, remaining) ->
            assertEquals(remaining, fx.engine.refundableRemainder(id, "frank").getMinor()));
        assertTrue(fx.engine.verifyBalances(vault.getId(), "frank").isConsistent());
    }

    private static UUID pickRefundable(Random random, List<UUID> posted, Map<UUID, Long> remainders) {
        List<UUID> candidates = posted.stream()
            .filter(id -> remainders.containsKey(id) && remainders.get(id) > 0)
            .toList();
        return candidates.isEmpty() ? null : candidates.get(random.nextInt(candidates.size()));
    }
}
