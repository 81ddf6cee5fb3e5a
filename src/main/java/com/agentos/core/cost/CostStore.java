package com.agentos.core.cost;

import java.time.Instant;
import java.util.List;

/**
 * Append-only ledger of model calls.
 */
public interface CostStore {

    void append(CostRecord record);

    /**
     * Records with a timestamp at or after {@code from}, oldest first.
     */
    List<CostRecord> findSince(Instant from);

    default List<CostRecord> findAll() {
        return findSince(Instant.EPOCH);
    }
}
