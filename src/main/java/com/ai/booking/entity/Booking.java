package com.ai.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "booking", indexes = {
    @Index(name = "idx_booking_schedule", columnList = "project_id, specialist, booking_date"),
    @Index(name = "idx_booking_client", columnList = "project_id, client_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    public enum Status { ACTIVE, CANCELLED }

    /** Whether the last committed state of this row has reached the spreadsheet. */
    public enum MirrorState { PENDING, SYNCED, FAILED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 100)
    private String specialist;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_slots", nullable = false)
    private int durationSlots;

    @Column(name = "client_id", nullable = false, length = 128)
    private String clientId;

    @Column(name = "client_name", length = 100)
    private String clientName;

    @Column(name = "client_phone", length = 30)
    private String clientPhone;

    @Column(name = "service_name", length = 200)
    private String serviceName;

    @Column(length = 1000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Status status = Status.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "mirror_state", nullable = false, length = 16)
    @Builder.Default
    private MirrorState mirrorState = MirrorState.PENDING;

    /** When the mirror last confirmed a write of this row. */
    @Column(name = "mirror_synced_at")
    private Instant mirrorSyncedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isActive() {
        return status == Status.ACTIVE;
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
