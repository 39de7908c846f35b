package com.flagship.complaint_ledger.ledger;

/**
 * Status codes understood by the on-chain complaint registry.
 *
 * Phase 1: Ledger model.
 * The numeric codes are part of the contract ABI (uint8) and must not be reordered.
 */
public enum LedgerStatus {
    /**
     * Complaint recorded, no action taken yet.
     * Every minted complaint starts here.
     */
    PENDING(0),

    /**
     * Municipality reports the complaint as resolved.
     */
    RESOLVED(1),

    /**
     * Citizen verified the resolution.
     */
    VERIFIED(2);

    private final int code;

    LedgerStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Resolves a code read back from the ledger.
     *
     * @throws IllegalArgumentException if the code is not one the registry defines
     */
    public static LedgerStatus fromCode(int code) {
        for (LedgerStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ledger status code: " + code);
    }
}
