package com.jobsignal.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.jobsignal.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job type to {@link JobWorker} lookup, built once from the worker beans.
 */
public class JobWorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobWorkerRegistry.class);

    private final Map<String, RegisteredWorker> workersByType;

    public JobWorkerRegistry(List<JobWorker<?>> workers, ObjectMapper objectMapper) {
        Map<String, RegisteredWorker> registrations = new LinkedHashMap<>();
        for (JobWorker<?> worker : workers) {
            Class<?> workerClass = ClassUtils.getUserClass(worker);
            String source = "JobWorker bean " + workerClass.getName();
            com.jobsignal.annotation.Job annotation = AnnotationUtils.findAnnotation(
                    workerClass, com.jobsignal.annotation.Job.class);
            String jobType = normalizeRequiredType(resolveJobType(worker, annotation), source);
            ObjectReader reader = objectMapper.readerFor(resolvePayloadClass(worker, workerClass));
            RegisteredWorker existing = registrations.putIfAbsent(jobType,
                    new RegisteredWorker(jobType, worker, reader, annotation));
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate job type '" + jobType + "' detected while registering " + source
                                + ". Each job type must be unique.");
            }
        }
        this.workersByType = Map.copyOf(registrations);
        log.info("Registered {} job workers: {}", workersByType.size(), workersByType.keySet());
    }

    public Optional<RegisteredWorker> find(String jobType) {
        return Optional.ofNullable(workersByType.get(jobType));
    }

    public RegisteredWorker require(String jobType) {
        return find(jobType).orElseThrow(() -> new IllegalStateException(
                "No JobWorker registered for job type '" + jobType + "'"));
    }

    private static String resolveJobType(JobWorker<?> worker, com.jobsignal.annotation.Job annotation) {
        String explicit = worker.getJobType();
        if (explicit != null) {
            return explicit;
        }
        return annotation != null ? annotation.value() : null;
    }

    private static Class<?> resolvePayloadClass(JobWorker<?> worker, Class<?> workerClass) {
        Class<?> explicit = worker.getPayloadClass();
        if (explicit != null) {
            return explicit;
        }
        Class<?> inferred = ResolvableType.forClass(workerClass).as(JobWorker.class).getGeneric(0).resolve();
        if (inferred == null) {
            throw new IllegalStateException("Cannot infer the payload type of " + workerClass.getName()
                    + "; declare a concrete JobWorker<T> or override getPayloadClass()");
        }
        return inferred;
    }

    private String normalizeRequiredType(String type, String source) {
        if (type == null) {
            throw new IllegalStateException(source + " must be annotated with @Job or override getJobType()");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalStateException("Job type must not be blank for " + source);
        }
        return trimmed;
    }

    /**
     * @param annotation the worker's {@code @Job} annotation, null when it has none
     */
    public record RegisteredWorker(
            String type,
            JobWorker<?> worker,
            ObjectReader payloadReader,
            com.jobsignal.annotation.Job annotation) {

        Object readPayload(JsonNode rawPayload) throws IOException {
            if (rawPayload == null || rawPayload.isNull()) {
                return null;
            }
            return payloadReader.readValue(rawPayload);
        }

        void process(Long jobId, Object payload) throws Exception {
            @SuppressWarnings("unchecked")
            JobWorker<Object> castWorker = (JobWorker<Object>) worker;
            castWorker.process(jobId, payload);
        }

        void onError(Long jobId, Object payload, Exception exception) {
            @SuppressWarnings("unchecked")
            JobWorker<Object> castWorker = (JobWorker<Object>) worker;
            castWorker.onError(jobId, payload, exception);
        }

        void onSuccess(Long jobId, Object payload) {
            @SuppressWarnings("unchecked")
            JobWorker<Object> castWorker = (JobWorker<Object>) worker;
            castWorker.onSuccess(jobId, payload);
        }
    }
}
