package com.ai.booking.repository;

import com.ai.booking.entity.ClientActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ClientActivityRepository extends JpaRepository<ClientActivity, Long> {

    Optional<ClientActivity> findByProjectIdAndClientId(String projectId, String clientId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ClientActivity a WHERE a.projectId = :projectId AND a.clientId = :clientId")
    Optional<ClientActivity> findForUpdate(@Param("projectId") String projectId,
                                           @Param("clientId") String clientId);

    List<ClientActivity> findByProjectIdAndLastMessageAtBefore(String projectId, Instant cutoff);
}
