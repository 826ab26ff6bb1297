package com.jobsignal.notify;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Digest of a job's identity and last-modified time. Equal fingerprints mean the notification and
 * the row describe the same persisted version of the job; any write that moves {@code updated_at}
 * past the current second produces a new one.
 */
public final class JobFingerprint {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private JobFingerprint() {
    }

    public static String of(Long jobId, OffsetDateTime lastModifiedAt) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
        String material = jobId + ":" + canonicalTimestamp(lastModifiedAt);
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * The instant truncated to whole seconds and rendered in UTC, e.g. {@code 2026-10-19T12:00:00Z}.
     */
    public static String canonicalTimestamp(OffsetDateTime timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(CANONICAL);
    }
}
