package com.flagship.complaint_ledger.consumer;

/**
 * Connection state of the change feed subscription.
 *
 * DISCONNECTED -> CONNECTING -> SUBSCRIBED -> (ERROR | DISCONNECTED) -> CONNECTING
 */
public enum FeedConnectionState {
    CONNECTING,
    SUBSCRIBED,
    ERROR,
    DISCONNECTED
}
