package com.jobsignal.store;

import com.jobsignal.Job;
import com.jobsignal.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Write path for job rows. Every create, update and delete goes through here so that the
 * registered {@link JobCommitHook}s see the change once its transaction has completed. Outside a
 * transaction the repository call commits on its own and hooks run right after it.
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRepository jobRepository;
    private final JobStoreClock clock;
    private final List<JobCommitHook> hooks;

    public JobStore(JobRepository jobRepository, JobStoreClock clock, List<JobCommitHook> hooks) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.hooks = List.copyOf(hooks);
    }

    /**
     * Persists the job, refreshing {@code updated_at} from the store clock. Hooks receive a CREATE or
     * UPDATE change.
     */
    public Job save(Job job) {
        return persist(job, false);
    }

    /**
     * Same as {@link #save(Job)} but the change is flagged internal, so subscribers that announce
     * changes (the notifier) stay silent. Used for lock stamps.
     */
    public Job saveInternal(Job job) {
        return persist(job, true);
    }

    public void delete(Job job) {
        jobRepository.delete(job);
        afterCompletion(new JobChange(job, JobChange.Kind.DESTROY, false));
    }

    private Job persist(Job job, boolean internal) {
        JobChange.Kind kind = job.getId() == null ? JobChange.Kind.CREATE : JobChange.Kind.UPDATE;
        job.setUpdatedAt(clock.now());
        Job saved = jobRepository.saveAndFlush(job);
        if (saved != job) {
            // merge() hands back a managed copy; keep transient state on the instance callers hold
            saved.setAttachedMessage(job.getAttachedMessage());
        }
        afterCompletion(new JobChange(saved, kind, internal));
        return saved;
    }

    private void afterCompletion(JobChange change) {
        if (hooks.isEmpty()) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatch(change);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                dispatch(status == STATUS_COMMITTED ? change : change.rolledBack());
            }
        });
    }

    private void dispatch(JobChange change) {
        for (JobCommitHook hook : hooks) {
            try {
                hook.afterCompletion(change);
            } catch (RuntimeException e) {
                log.error("Commit hook {} failed for {} of job {}", hook.getClass().getName(), change.kind(),
                        change.job().getId(), e);
            }
        }
    }
}
