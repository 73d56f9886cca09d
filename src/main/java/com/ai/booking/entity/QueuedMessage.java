package com.ai.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One logical inbound event from a client, possibly carrying the text of
 * earlier events it superseded.
 */
@Entity
@Table(name = "queued_message", indexes = {
    @Index(name = "idx_queued_message_client", columnList = "project_id, client_id"),
    @Index(name = "idx_queued_message_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueuedMessage {

    public enum Status {
        PENDING,
        PROCESSING,
        COMPLETED,
        CANCELLED,
        SUPERSEDED;

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED || this == SUPERSEDED;
        }

        public Set<Status> allowedTargets() {
            return switch (this) {
                case PENDING -> EnumSet.of(PROCESSING, SUPERSEDED);
                case PROCESSING -> EnumSet.of(COMPLETED, CANCELLED, SUPERSEDED);
                default -> EnumSet.noneOf(Status.class);
            };
        }

        public boolean canTransitionTo(Status target) {
            return allowedTargets().contains(target);
        }
    }

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "client_id", nullable = false, length = 128)
    private String clientId;

    @Column(length = 32)
    private String channel;

    @Column(name = "original_text", nullable = false, length = 8000)
    private String originalText;

    @Column(name = "aggregated_text", nullable = false, length = 8000)
    private String aggregatedText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Status status = Status.PENDING;

    /** Per-client creation order, assigned under the client lock. */
    @Column(name = "seq_no", nullable = false)
    private long sequence;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    /**
     * Moves the row to {@code target}, rejecting edges that are not in the
     * transition table.
     */
    public void transitionTo(Status target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal queued message transition " + status + " -> " + target + " for " + id);
        }
        status = target;
        if (target.isTerminal()) {
            processedAt = Instant.now();
        }
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
