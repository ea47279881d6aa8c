package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.exception.LedgerException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Keyset position in a transaction listing ordered by occurredAt desc, id desc.
 * Encoded as an opaque URL-safe token.
 */
@Value
public class TransactionCursor {
    Instant occurredAt;
    UUID id;

    public static TransactionCursor after(Transaction last) {
        return new TransactionCursor(last.getOccurredAt(), last.getId());
    }

    public String encode() {
        String raw = occurredAt.toString() + "|" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static TransactionCursor decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            int separator = raw.indexOf('|');
            if (separator < 0) {
                throw LedgerException.invalidInput("transaction", "cursor", "Malformed cursor");
            }
            return new TransactionCursor(Instant.parse(raw.substring(0, separator)),
                UUID.fromString(raw.substring(separator + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw LedgerException.invalidInput("transaction", "cursor", "Malformed cursor");
        }
    }

    /**
     * True if {@code transaction} sorts strictly after this position.
     * Ids are compared in their canonical text form, which matches the byte
     * order databases use for UUID columns.
     */
    public boolean precedes(Transaction transaction) {
        int byTime = transaction.getOccurredAt().compareTo(occurredAt);
        if (byTime != 0) {
            return byTime < 0;
        }
        return transaction.getId().toString().compareTo(id.toString()) < 0;
    }
}
