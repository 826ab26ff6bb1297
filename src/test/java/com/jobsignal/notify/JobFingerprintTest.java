package com.jobsignal.notify;

import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobFingerprintTest {

    private static final OffsetDateTime NOON_UTC = OffsetDateTime.of(2026, 10, 19, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void shouldBeDeterministic() {
        assertEquals(JobFingerprint.of(42L, NOON_UTC), JobFingerprint.of(42L, NOON_UTC));
    }

    @Test
    void shouldMatchMd5OfIdAndCanonicalTimestamp() {
        String expected = DigestUtils.md5DigestAsHex("42:2026-10-19T12:00:00Z".getBytes(StandardCharsets.UTF_8));

        assertEquals(expected, JobFingerprint.of(42L, NOON_UTC));
    }

    @Test
    void shouldIgnoreZoneOfTheSameInstant() {
        OffsetDateTime sameInstantInTokyo = NOON_UTC.withOffsetSameInstant(ZoneOffset.ofHours(9));

        assertEquals(JobFingerprint.of(7L, NOON_UTC), JobFingerprint.of(7L, sameInstantInTokyo));
        assertEquals("2026-10-19T12:00:00Z", JobFingerprint.canonicalTimestamp(sameInstantInTokyo));
    }

    @Test
    void shouldTruncateToWholeSeconds() {
        OffsetDateTime later = NOON_UTC.plusNanos(999_000_000);

        assertEquals(JobFingerprint.of(7L, NOON_UTC), JobFingerprint.of(7L, later));
        assertNotEquals(JobFingerprint.of(7L, NOON_UTC), JobFingerprint.of(7L, NOON_UTC.plusSeconds(1)));
    }

    @Test
    void shouldDifferForDifferentJobs() {
        assertNotEquals(JobFingerprint.of(1L, NOON_UTC), JobFingerprint.of(2L, NOON_UTC));
    }

    @Test
    void shouldRejectNullInputs() {
        assertThrows(IllegalArgumentException.class, () -> JobFingerprint.of(null, NOON_UTC));
        assertThrows(IllegalArgumentException.class, () -> JobFingerprint.of(1L, null));
    }
}
