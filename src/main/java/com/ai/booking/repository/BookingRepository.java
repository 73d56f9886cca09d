package com.ai.booking.repository;

import com.ai.booking.entity.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByProjectIdAndSpecialistAndBookingDateAndStatusOrderByStartTimeAsc(
            String projectId,
            String specialist,
            LocalDate bookingDate,
            Booking.Status status
    );

    List<Booking> findByProjectIdAndClientIdAndStatusOrderByCreatedAtDesc(
            String projectId,
            String clientId,
            Booking.Status status
    );

    long countByProjectId(String projectId);

    long countByProjectIdAndStatus(String projectId, Booking.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    /**
     * Records the mirror outcome only if the row has not changed since it was
     * pushed; a newer version will be pushed on its own.
     */
    @Transactional
    @Modifying
    @Query("UPDATE Booking b SET b.mirrorState = :state WHERE b.id = :id AND b.version = :version")
    int updateMirrorState(@Param("id") Long id, @Param("version") Long version, @Param("state") Booking.MirrorState state);

    @Transactional
    @Modifying
    @Query("UPDATE Booking b SET b.mirrorState = :state, b.mirrorSyncedAt = :syncedAt "
            + "WHERE b.id = :id AND b.version = :version")
    int recordMirrorSync(@Param("id") Long id, @Param("version") Long version,
                         @Param("state") Booking.MirrorState state, @Param("syncedAt") Instant syncedAt);

    default int markSynced(Long id, Long version, Instant syncedAt) {
        return recordMirrorSync(id, version, Booking.MirrorState.SYNCED, syncedAt);
    }
}
