package com.agentos.core.cost;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger kept in the heap. Spend is lost when the process exits.
 */
public class InMemoryCostStore implements CostStore {

    private final List<CostRecord> records = new ArrayList<>();

    @Override
    public synchronized void append(CostRecord record) {
        records.add(record);
    }

    @Override
    public synchronized List<CostRecord> findSince(Instant from) {
        return records.stream()
                .filter(r -> !r.timestamp().isBefore(from))
                .toList();
    }
}
