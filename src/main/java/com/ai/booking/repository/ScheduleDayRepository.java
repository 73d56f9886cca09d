package com.ai.booking.repository;

import com.ai.booking.entity.ScheduleDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface ScheduleDayRepository extends JpaRepository<ScheduleDay, Long> {

    Optional<ScheduleDay> findByProjectIdAndSpecialistAndScheduleDate(String projectId, String specialist, LocalDate scheduleDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM ScheduleDay d WHERE d.projectId = :projectId AND d.specialist = :specialist AND d.scheduleDate = :date")
    Optional<ScheduleDay> findForUpdate(@Param("projectId") String projectId,
                                        @Param("specialist") String specialist,
                                        @Param("date") LocalDate date);
}
