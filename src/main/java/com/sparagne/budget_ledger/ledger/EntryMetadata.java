package com.sparagne.budget_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Free-text and date metadata supplied when a transaction is recorded.
 * Blank strings are normalized to null.
 */
@Value
public class EntryMetadata {
    String note;
    String category;
    Instant occurredAt;

    public static EntryMetadata of(String note, String category, Instant occurredAt) {
        return new EntryMetadata(normalize(note), normalize(category), occurredAt);
    }

    public static EntryMetadata note(String note) {
        return of(note, null, null);
    }

    public Instant occurredAtOr(Instant fallback) {
        return occurredAt != null ? occurredAt : fallback;
    }

    static String normalize(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
