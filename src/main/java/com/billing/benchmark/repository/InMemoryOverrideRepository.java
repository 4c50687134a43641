package com.billing.benchmark.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local override store, used when Aerospike is disabled.
 */
@Repository
@ConditionalOnProperty(prefix = "aerospike", name = "enabled", havingValue = "false")
public class InMemoryOverrideRepository implements OverrideRepository {

    private final AtomicReference<Map<String, Double>> store = new AtomicReference<>(Collections.emptyMap());

    @Override
    public Optional<Double> get(String label) {
        return Optional.ofNullable(store.get().get(label));
    }

    @Override
    public void set(String label, double amount) {
        Map<String, Double> next = new TreeMap<>(store.get());
        next.put(label, amount);
        store.set(Collections.unmodifiableMap(next));
    }

    @Override
    public boolean delete(String label) {
        Map<String, Double> next = new TreeMap<>(store.get());
        boolean removed = next.remove(label) != null;
        store.set(Collections.unmodifiableMap(next));
        return removed;
    }

    @Override
    public void clearAll() {
        store.set(Collections.emptyMap());
    }

    @Override
    public Map<String, Double> loadAll() {
        return store.get();
    }

    @Override
    public void saveAll(Map<String, Double> overrides) {
        store.set(Collections.unmodifiableMap(new TreeMap<>(overrides)));
    }

    @Override
    public Map<String, Double> findAll() {
        return store.get();
    }
}
