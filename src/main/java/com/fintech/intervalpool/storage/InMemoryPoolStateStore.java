package com.fintech.intervalpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-only store. State is lost on restart; used for tests and throwaway runs.
 */
@Repository
@ConditionalOnProperty(name = "interval-pool.storage.type", havingValue = "memory")
public class InMemoryPoolStateStore implements PoolStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPoolStateStore.class);

    private final Map<String, String> states = new ConcurrentHashMap<>();

    public InMemoryPoolStateStore() {
        log.info("Using in-memory pool state store");
    }

    @Override
    public Optional<String> load(String subjectId) {
        return Optional.ofNullable(states.get(subjectId));
    }

    @Override
    public void save(String subjectId, String serializedState) {
        states.put(subjectId, serializedState);
    }

    @Override
    public void remove(String subjectId) {
        states.remove(subjectId);
    }

    @Override
    public long count() {
        return states.size();
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
