package com.ai.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Lock anchor for one specialist's day. Allocation, cancellation, change and
 * reconciliation all lock this row before touching the day's bookings.
 */
@Entity
@Table(name = "schedule_day", uniqueConstraints = {
    @UniqueConstraint(name = "uq_schedule_day", columnNames = {"project_id", "specialist", "schedule_date"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 100)
    private String specialist;

    @Column(name = "schedule_date", nullable = false)
    private LocalDate scheduleDate;
}
