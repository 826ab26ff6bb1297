package com.jobsignal.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobsignal.Job;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotificationCodec codec = new NotificationCodec(objectMapper);

    @Test
    void shouldWriteSnakeCaseFields() throws Exception {
        Job job = persistedJob(5L, OffsetDateTime.of(2026, 10, 19, 14, 30, 15, 123_000_000, ZoneOffset.ofHours(2)));

        JsonNode json = objectMapper.readTree(codec.encode(NotificationMessage.of(job)));

        assertEquals(5L, json.get("job_id").asLong());
        assertEquals("2026-10-19T12:30:15Z", json.get("last_modified_at").asText());
        assertEquals(JobFingerprint.of(5L, job.getUpdatedAt()), json.get("fingerprint").asText());
    }

    @Test
    void shouldDecodeNotificationWrittenByAnotherProcess() {
        String wire = "{\"job_id\":9,\"last_modified_at\":\"2026-10-19T12:00:00Z\",\"fingerprint\":\"abc\"}";

        Optional<NotificationMessage> decoded = codec.decode(wire.getBytes(StandardCharsets.UTF_8));

        assertTrue(decoded.isPresent());
        assertEquals(9L, decoded.get().jobId());
        assertEquals("abc", decoded.get().fingerprint());
    }

    @Test
    void shouldTreatForeignPayloadsAsNotNotifications() {
        assertFalse(codec.decode("not json".getBytes(StandardCharsets.UTF_8)).isPresent());
        assertFalse(codec.decode("{\"event\":\"user.created\"}".getBytes(StandardCharsets.UTF_8)).isPresent());
        assertFalse(codec.decode("[1,2,3]".getBytes(StandardCharsets.UTF_8)).isPresent());
        assertFalse(codec.decode(new byte[0]).isPresent());
        assertFalse(codec.decode(
                "{\"job_id\":\"x\",\"last_modified_at\":\"t\",\"fingerprint\":\"f\"}".getBytes(StandardCharsets.UTF_8))
                .isPresent());
    }

    @Test
    void describesShouldFollowTheRowVersion() {
        OffsetDateTime modified = OffsetDateTime.of(2026, 10, 19, 12, 0, 0, 0, ZoneOffset.UTC);
        Job job = persistedJob(3L, modified);
        NotificationMessage message = NotificationMessage.of(job);

        job.setUpdatedAt(modified.plusNanos(500_000_000));
        assertTrue(message.describes(job), "same second keeps the fingerprint");

        job.setUpdatedAt(modified.plusSeconds(1));
        assertFalse(message.describes(job));
    }

    @Test
    void shouldRefuseToDescribeUnsavedJobs() {
        Job unsaved = new Job("TYPE", null, 3, 0);

        assertThrows(UnpersistedJobException.class, () -> NotificationMessage.of(unsaved));
    }

    private static Job persistedJob(Long id, OffsetDateTime updatedAt) {
        Job job = new Job("TYPE", null, 3, 0);
        job.setId(id);
        job.setUpdatedAt(updatedAt);
        return job;
    }
}
