package com.billing.benchmark.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent map of group key label → manual proxy amount.
 * Reads are served from an in-memory snapshot; {@link #loadAll()} refreshes it from the backing store.
 */
public interface OverrideRepository {

    Optional<Double> get(String label);

    void set(String label, double amount);

    /**
     * @return true when an override existed for the label
     */
    boolean delete(String label);

    void clearAll();

    /**
     * Reload every override from the backing store, replacing the snapshot.
     */
    Map<String, Double> loadAll();

    /**
     * Replace the stored overrides with the given map.
     */
    void saveAll(Map<String, Double> overrides);

    /**
     * Current snapshot, sorted by label.
     */
    Map<String, Double> findAll();
}
