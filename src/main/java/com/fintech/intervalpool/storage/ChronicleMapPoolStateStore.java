package com.fintech.intervalpool.storage;

import com.fintech.intervalpool.config.IntervalPoolProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import net.openhft.chronicle.map.ChronicleMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chronicle Map implementation of PoolStateStore.
 *
 * Keeps one JSON document per subject in an off-heap, memory-mapped file:
 * - Each save is a single entry put, so a crash leaves the old or the new document
 * - Survives restarts via createOrRecoverPersistedTo
 *
 * Thread-safe for concurrent access.
 */
@Repository
@ConditionalOnProperty(name = "interval-pool.storage.type", havingValue = "chronicle-map", matchIfMissing = true)
public class ChronicleMapPoolStateStore implements PoolStateStore {

    private static final Logger log = LoggerFactory.getLogger(ChronicleMapPoolStateStore.class);

    private static final String HEALTH_CHECK_PREFIX = "__health-check-";

    private final IntervalPoolProperties.Storage.ChronicleMapConfig config;
    private ChronicleMap<String, String> stateMap;
    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong readCounter = new AtomicLong(0);

    public ChronicleMapPoolStateStore(IntervalPoolProperties properties) {
        this.config = properties.getStorage().getChronicleMap();
    }

    @PostConstruct
    public void initialize() {
        try {
            File dataFile = new File(config.getPath());
            File parentDir = dataFile.getParentFile();

            if (parentDir != null && !parentDir.exists()) {
                boolean created = parentDir.mkdirs();
                if (created) {
                    log.info("Created Chronicle Map data directory: {}", parentDir.getAbsolutePath());
                }
            }

            stateMap = ChronicleMap
                .of(String.class, String.class)
                .name("interval-pool-state")
                .entries(config.getEntries())
                .averageKeySize(config.getAverageKeySize())
                .averageValueSize(config.getAverageValueSize())
                .createOrRecoverPersistedTo(dataFile);

            log.info("Chronicle Map initialized: path={}, stored_subjects={}",
                    dataFile.getAbsolutePath(), stateMap.size());

        } catch (IOException e) {
            log.error("Failed to initialize Chronicle Map", e);
            throw new StorageException("Chronicle Map initialization failed", e);
        }
    }

    @Override
    public Optional<String> load(String subjectId) {
        readCounter.incrementAndGet();
        try {
            return Optional.ofNullable(stateMap.get(subjectId));
        } catch (RuntimeException e) {
            throw new StorageException("Failed to load state for subject " + subjectId, e);
        }
    }

    @Override
    public void save(String subjectId, String serializedState) {
        try {
            stateMap.put(subjectId, serializedState);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to save state for subject " + subjectId, e);
        }
        writeCounter.incrementAndGet();

        if (log.isTraceEnabled()) {
            log.trace("Saved state: subject={}, bytes={}", subjectId, serializedState.length());
        }
    }

    @Override
    public void remove(String subjectId) {
        try {
            stateMap.remove(subjectId);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to remove state for subject " + subjectId, e);
        }
    }

    @Override
    public long count() {
        return stateMap.size();
    }

    @Override
    public boolean isHealthy() {
        try {
            String testKey = HEALTH_CHECK_PREFIX + System.currentTimeMillis();
            stateMap.put(testKey, "{}");
            String retrieved = stateMap.get(testKey);
            stateMap.remove(testKey);

            return retrieved != null;
        } catch (Exception e) {
            log.error("Health check failed", e);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        if (stateMap != null) {
            log.info("Closing Chronicle Map: total_writes={}, total_reads={}",
                    writeCounter.get(), readCounter.get());
            stateMap.close();
        }
    }

    public long getWriteCount() {
        return writeCounter.get();
    }

    public long getReadCount() {
        return readCounter.get();
    }
}
