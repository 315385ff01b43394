package com.fintech.intervalpool.storage;

import java.util.Optional;

/**
 * Key-value store for serialized pool state, one entry per subject.
 * Abstracts the underlying storage mechanism (Chronicle Map, in-memory) from the pools.
 */
public interface PoolStateStore {

    /**
     * Loads the serialized state of a subject.
     *
     * @param subjectId Subject to load
     * @return Optional containing the JSON document if one was saved
     * @throws StorageException if the store cannot be read
     */
    Optional<String> load(String subjectId);

    /**
     * Replaces the serialized state of a subject.
     * A single put: readers see either the old or the new document.
     *
     * @param subjectId Subject to save
     * @param serializedState JSON document
     * @throws StorageException if the store cannot be written
     */
    void save(String subjectId, String serializedState);

    /**
     * Removes the state of a subject. Removing an unknown subject is a no-op.
     *
     * @param subjectId Subject to remove
     */
    void remove(String subjectId);

    /**
     * Returns the number of subjects with stored state.
     */
    long count();

    /**
     * Checks if the store is ready to serve requests.
     *
     * @return true if operational, false otherwise
     */
    boolean isHealthy();
}
