package com.tandem.sync;

import java.util.List;
import java.util.Optional;

/**
 * Keyed access to execution records.
 */
public interface ExecutionRecordStore {

    Optional<ExecutionRecord> find(String executionId);

    /** Inserts or replaces the record with the same id. */
    void save(ExecutionRecord record);

    List<ExecutionRecord> findAll();
}
