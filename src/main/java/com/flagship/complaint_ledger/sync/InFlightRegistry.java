package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operations currently being submitted to the ledger.
 *
 * Phase 2: Duplicate suppression.
 *
 * tryAcquire is an atomic check-and-insert: of two notifications racing for
 * the same key exactly one wins. The loser must drop its work, not queue it.
 *
 * The registry lives as long as the engine and is process-local. Two engine
 * instances running side by side can still double-submit; deployments run a
 * single active instance.
 */
@Component
@Slf4j
public class InFlightRegistry {

    private final Set<OperationKey> inFlight = ConcurrentHashMap.newKeySet();

    public InFlightRegistry() {
    }

    @Autowired
    public InFlightRegistry(SyncMetrics metrics) {
        metrics.registerInFlightGauge(inFlight::size);
    }

    /**
     * Marks an operation as in flight.
     *
     * @return true if the key was newly inserted, false if an equivalent operation is underway
     */
    public boolean tryAcquire(OperationKey key) {
        boolean acquired = inFlight.add(key);
        if (!acquired) {
            log.debug("Operation {} already in flight", key);
        }
        return acquired;
    }

    /**
     * Removes the key unconditionally. Called on every terminal outcome.
     */
    public void release(OperationKey key) {
        inFlight.remove(key);
    }

    public boolean isInFlight(OperationKey key) {
        return inFlight.contains(key);
    }

    public int size() {
        return inFlight.size();
    }
}
