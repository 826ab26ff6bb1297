package com.jobsignal.store;

import com.jobsignal.Job;

/**
 * A completed persistence operation on a job row, handed to every {@link JobCommitHook} once the
 * surrounding transaction has finished.
 *
 * @param job      the row as it was written
 * @param kind     what happened to the row
 * @param internal true when the writer asked for the mutation not to be announced (lock stamps)
 */
public record JobChange(Job job, Kind kind, boolean internal) {

    public enum Kind {
        CREATE,
        UPDATE,
        DESTROY,
        ROLLBACK
    }

    JobChange rolledBack() {
        return new JobChange(job, Kind.ROLLBACK, internal);
    }
}
