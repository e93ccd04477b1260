package com.alertrelay.core.store;

import com.alertrelay.core.check.CheckRun;

import java.util.List;

/**
 * Audit log of checker executions.
 *
 * @since 1.0.0
 */
public interface CheckRunStore {

    /**
     * @return the saved record, carrying its assigned id and timestamp
     */
    CheckRun record(CheckRun run);

    List<CheckRun> findByTraceId(String traceId);

    List<CheckRun> findAll();
}
