package com.flagship.complaint_ledger.complaint;

import lombok.Builder;
import lombok.Value;

/**
 * Projection of a row in the complaints table.
 *
 * Only the columns the synchronization engine needs:
 * - id: primary correlation key for every engine operation
 * - status: pending | resolved | verified
 * - city / locationAddress / category: ledger payload
 * - ledgerReceipt: transaction hash of the mint; null until minted
 */
@Value
@Builder(toBuilder = true)
public class ComplaintRecord {

    static final String UNKNOWN_CITY = "Unknown";
    static final String GENERAL_CATEGORY = "General";

    Long id;
    String status;
    String city;
    String locationAddress;
    String category;
    String ledgerReceipt;

    public boolean hasReceipt() {
        return ledgerReceipt != null && !ledgerReceipt.isBlank();
    }

    /**
     * City sent to the ledger: the municipality, then the address, then a placeholder.
     */
    public String ledgerCity() {
        if (city != null && !city.isBlank()) {
            return city;
        }
        if (locationAddress != null && !locationAddress.isBlank()) {
            return locationAddress;
        }
        return UNKNOWN_CITY;
    }

    /**
     * Category sent to the ledger, with a generic label when missing.
     */
    public String ledgerCategory() {
        return category != null && !category.isBlank() ? category : GENERAL_CATEGORY;
    }

    public ComplaintRecord withReceipt(String receipt) {
        return toBuilder().ledgerReceipt(receipt).build();
    }
}
