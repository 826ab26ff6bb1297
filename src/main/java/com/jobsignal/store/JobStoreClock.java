package com.jobsignal.store;

import java.time.OffsetDateTime;

/**
 * Current time as seen by the job store. All staleness comparisons use this clock, never the
 * worker's wall clock, so that clock or time-zone skew between worker processes does not matter.
 */
@FunctionalInterface
public interface JobStoreClock {

    OffsetDateTime now();
}
