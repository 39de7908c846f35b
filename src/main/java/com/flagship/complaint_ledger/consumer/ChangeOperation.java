package com.flagship.complaint_ledger.consumer;

/**
 * Kind of row change carried by a change event.
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE
}
