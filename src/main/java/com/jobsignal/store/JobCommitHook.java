package com.jobsignal.store;

/**
 * Callback registered with {@link JobStore}, invoked after the transaction that wrote a job row
 * committed or rolled back.
 */
@FunctionalInterface
public interface JobCommitHook {

    void afterCompletion(JobChange change);
}
