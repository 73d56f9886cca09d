package com.ai.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Last activity of a client within a project. The row doubles as the lock
 * anchor for everything the coordinator does for that client.
 */
@Entity
@Table(name = "client_activity", uniqueConstraints = {
    @UniqueConstraint(name = "uq_client_activity", columnNames = {"project_id", "client_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "client_id", nullable = false, length = 128)
    private String clientId;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "message_sequence", nullable = false)
    @Builder.Default
    private long messageSequence = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public long nextSequence() {
        messageSequence++;
        return messageSequence;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
