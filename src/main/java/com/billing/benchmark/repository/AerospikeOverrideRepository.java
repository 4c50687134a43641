package com.billing.benchmark.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.benchmark.config.AerospikeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Repository
@ConditionalOnProperty(prefix = "aerospike", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AerospikeOverrideRepository implements OverrideRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeOverrideRepository.class);

    static final String BIN_LABEL = "label";
    static final String BIN_AMOUNT = "amount";
    static final String BIN_UPDATED_AT = "updatedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    // Snapshot served to every recompute; writes go to Aerospike and then swap the snapshot
    private final AtomicReference<Map<String, Double>> cache = new AtomicReference<>(Collections.emptyMap());

    public AerospikeOverrideRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    @Override
    public Optional<Double> get(String label) {
        return Optional.ofNullable(cache.get().get(label));
    }

    @Override
    public void set(String label, double amount) {
        Map<String, Double> next = new TreeMap<>(cache.get());
        next.put(label, amount);
        cache.set(Collections.unmodifiableMap(next));
        try {
            write(label, amount);
        } catch (AerospikeException e) {
            log.error("Failed to persist override {}={}", label, amount, e);
        }
    }

    @Override
    public boolean delete(String label) {
        if (!cache.get().containsKey(label)) {
            return false;
        }
        Map<String, Double> next = new TreeMap<>(cache.get());
        next.remove(label);
        cache.set(Collections.unmodifiableMap(next));
        try {
            client.delete(writePolicy, key(label));
        } catch (AerospikeException e) {
            log.error("Failed to delete override {}", label, e);
        }
        return true;
    }

    @Override
    public void clearAll() {
        cache.set(Collections.emptyMap());
        try {
            client.truncate(null, namespace, AerospikeConfig.SET_PROXY_OVERRIDES, null);
        } catch (AerospikeException e) {
            log.error("Failed to truncate set {}", AerospikeConfig.SET_PROXY_OVERRIDES, e);
        }
    }

    @Override
    public Map<String, Double> loadAll() {
        try {
            Map<String, Double> loaded = scanAll();
            cache.set(Collections.unmodifiableMap(new TreeMap<>(loaded)));
            log.debug("Override cache refreshed, {} overrides loaded", loaded.size());
        } catch (AerospikeException e) {
            log.error("Failed to load overrides, keeping {} cached", cache.get().size(), e);
        }
        return cache.get();
    }

    @Override
    public void saveAll(Map<String, Double> overrides) {
        clearAll();
        cache.set(Collections.unmodifiableMap(new TreeMap<>(overrides)));
        try {
            overrides.forEach(this::write);
        } catch (AerospikeException e) {
            log.error("Failed to persist {} overrides", overrides.size(), e);
        }
    }

    @Override
    public Map<String, Double> findAll() {
        return cache.get();
    }

    private void write(String label, double amount) {
        client.put(writePolicy, key(label),
                new Bin(BIN_LABEL, label),
                new Bin(BIN_AMOUNT, amount),
                new Bin(BIN_UPDATED_AT, System.currentTimeMillis()));
    }

    private Map<String, Double> scanAll() {
        Map<String, Double> overrides = new ConcurrentHashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PROXY_OVERRIDES,
                (key, record) -> {
                    String label = record.getString(BIN_LABEL);
                    double amount = record.getDouble(BIN_AMOUNT);
                    if (label != null && Double.isFinite(amount)) {
                        overrides.put(label, amount);
                    } else {
                        log.warn("Skipping malformed override record: {}", record);
                    }
                });
        return overrides;
    }

    private Key key(String label) {
        return new Key(namespace, AerospikeConfig.SET_PROXY_OVERRIDES, label);
    }
}
