package com.jobsignal;

import com.jobsignal.broker.BrokerMessage;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "jobsignal_jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String type;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private com.fasterxml.jackson.databind.JsonNode payload;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "attempts")
    private int attempts = 0;

    @Column(name = "max_attempts")
    private int maxAttempts = 25;

    @Column(name = "priority")
    private int priority = 0;

    @Column(name = "run_at")
    private OffsetDateTime runAt;

    /**
     * Broker message that caused this row to be reserved. Never persisted; the
     * {@link com.jobsignal.internal.JobInvoker} acknowledges and clears it.
     */
    @Transient
    private BrokerMessage attachedMessage;

    public Job() {
        this.runAt = OffsetDateTime.now();
    }

    public Job(String type, com.fasterxml.jackson.databind.JsonNode payload, int maxAttempts, int priority) {
        this.type = type;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.priority = priority;
        this.runAt = OffsetDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public com.fasterxml.jackson.databind.JsonNode getPayload() {
        return payload;
    }

    public void setPayload(com.fasterxml.jackson.databind.JsonNode payload) {
        this.payload = payload;
    }

    @Transient
    public boolean isLocked() {
        return lockedAt != null && lockedBy != null;
    }

    @Transient
    public boolean isFailed() {
        return failedAt != null;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    /**
     * Sets both lock fields at once; they are either both null or both set.
     */
    public void lock(OffsetDateTime lockedAt, String lockedBy) {
        if (lockedAt == null || lockedBy == null) {
            throw new IllegalArgumentException("lockedAt and lockedBy must both be non-null");
        }
        this.lockedAt = lockedAt;
        this.lockedBy = lockedBy;
    }

    public void unlock() {
        this.lockedAt = null;
        this.lockedBy = null;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public void incrementAttempts() {
        this.attempts++;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public OffsetDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(OffsetDateTime runAt) {
        this.runAt = runAt;
    }

    public BrokerMessage getAttachedMessage() {
        return attachedMessage;
    }

    public void setAttachedMessage(BrokerMessage attachedMessage) {
        this.attachedMessage = attachedMessage;
    }
}
