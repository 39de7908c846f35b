package com.flagship.complaint_ledger.ledger;

import java.util.Locale;

/**
 * Translates the record store's status strings into ledger status codes.
 *
 * Phase 1: Ledger model.
 *
 * This is the only place where domain statuses meet ledger codes. When the
 * record store grows a new status, it has to be added here, otherwise it
 * silently maps to {@link LedgerStatus#PENDING}.
 */
public final class StatusMapper {

    private StatusMapper() {
        // Utility class
    }

    /**
     * Maps a domain status to a ledger status. Case-insensitive and total:
     * null, blank and unknown values map to {@link LedgerStatus#PENDING}.
     * Surrounding whitespace is not stripped, so " resolved " is unknown.
     */
    public static LedgerStatus map(String status) {
        if (status == null) {
            return LedgerStatus.PENDING;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "resolved" -> LedgerStatus.RESOLVED;
            case "verified" -> LedgerStatus.VERIFIED;
            default -> LedgerStatus.PENDING;
        };
    }
}
