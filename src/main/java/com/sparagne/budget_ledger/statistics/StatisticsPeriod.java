package com.sparagne.budget_ledger.statistics;

import com.sparagne.budget_ledger.exception.LedgerException;
import lombok.Value;

import java.time.Instant;

/**
 * Half-open window {@code [from, to)} on occurredAt. Either bound may be null
 * (open); {@link #ALL_TIME} has both open.
 */
@Value
public class StatisticsPeriod {

    public static final StatisticsPeriod ALL_TIME = new StatisticsPeriod(null, null);

    Instant from;
    Instant to;

    public static StatisticsPeriod of(Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw LedgerException.invalidInput("statistics", "from", "'from' must be before 'to'");
        }
        if (from == null && to == null) {
            return ALL_TIME;
        }
        return new StatisticsPeriod(from, to);
    }

    public boolean contains(Instant instant) {
        return (from == null || !instant.isBefore(from)) && (to == null || instant.isBefore(to));
    }
}
