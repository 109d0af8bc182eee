package com.stardust.core.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Data-subject request (export, erasure, anonymization or rectification).
 * Moves from PENDING to exactly one of COMPLETED or REJECTED.
 */
public class DataRequest {

    /** Response window granted for answering a data-subject request. */
    public static final Duration RESPONSE_WINDOW = Duration.ofDays(30);

    private UUID id;
    private UUID ownerId;
    private RequestType type;
    private RequestStatus status;
    private Priority priority;
    private Map<String, String> details;
    private Instant createdAt;
    private Instant estimatedCompletion;
    private Instant resolvedAt;
    private String resolution;

    public enum RequestType {
        EXPORT,
        DELETE,
        ANONYMIZE,
        RECTIFY
    }

    public enum RequestStatus {
        PENDING,
        COMPLETED,
        REJECTED
    }

    public enum Priority {
        MEDIUM,
        HIGH
    }

    protected DataRequest() {}

    public static DataRequest create(UUID ownerId, RequestType type, Map<String, String> details, Instant now) {
        if (ownerId == null) {
            throw new IllegalArgumentException("Owner ID is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Request type is required");
        }
        var request = new DataRequest();
        request.id = UUID.randomUUID();
        request.ownerId = ownerId;
        request.type = type;
        request.status = RequestStatus.PENDING;
        request.priority = type == RequestType.DELETE ? Priority.HIGH : Priority.MEDIUM;
        request.details = details == null ? Map.of() : Map.copyOf(details);
        request.createdAt = now;
        request.estimatedCompletion = now.plus(RESPONSE_WINDOW);
        return request;
    }

    public DataRequest copy() {
        var copy = new DataRequest();
        copy.id = id;
        copy.ownerId = ownerId;
        copy.type = type;
        copy.status = status;
        copy.priority = priority;
        copy.details = details;
        copy.createdAt = createdAt;
        copy.estimatedCompletion = estimatedCompletion;
        copy.resolvedAt = resolvedAt;
        copy.resolution = resolution;
        return copy;
    }

    public void markCompleted(String summary, Instant at) {
        resolve(RequestStatus.COMPLETED, summary, at);
    }

    public void markRejected(String reason, Instant at) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Rejection reason is required");
        }
        resolve(RequestStatus.REJECTED, reason, at);
    }

    private void resolve(RequestStatus target, String resolution, Instant at) {
        if (status != RequestStatus.PENDING) {
            throw new IllegalStateException("Request " + id + " is already " + status);
        }
        this.status = target;
        this.resolution = resolution;
        this.resolvedAt = at;
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public RequestType getType() { return type; }
    public RequestStatus getStatus() { return status; }
    public Priority getPriority() { return priority; }
    public Map<String, String> getDetails() { return details; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getEstimatedCompletion() { return estimatedCompletion; }
    public Instant getResolvedAt() { return resolvedAt; }
    public String getResolution() { return resolution; }
}
