package com.jobsignal;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Aggregated lifecycle counters fetched in a single query.
     */
    interface LifecycleCounts {
        Long getPendingCount();

        Long getLockedCount();

        Long getFailedCount();
    }

    /**
     * Reads the row with an exclusive row lock ({@code SELECT ... FOR UPDATE}). Blocks while another
     * transaction holds the lock on the same id. Must be called inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT j FROM Job j WHERE j.failedAt IS NULL ORDER BY j.id ASC")
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    Slice<Job> findDispatchableJobs(Pageable pageable);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN j.lockedAt IS NULL AND j.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS pendingCount,
              COALESCE(SUM(CASE
                WHEN j.lockedAt IS NOT NULL AND j.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS lockedCount,
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM Job j
            """)
    LifecycleCounts countLifecycleCounts();
}
