package com.ai.booking.repository;

import com.ai.booking.entity.QueuedMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;

@Repository
public interface QueuedMessageRepository extends JpaRepository<QueuedMessage, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM QueuedMessage m WHERE m.projectId = :projectId AND m.clientId = :clientId ORDER BY m.sequence ASC")
    List<QueuedMessage> findAllForUpdate(@Param("projectId") String projectId,
                                         @Param("clientId") String clientId);

    List<QueuedMessage> findByProjectIdAndClientIdOrderBySequenceAsc(String projectId, String clientId);

    long countByProjectIdAndStatus(String projectId, QueuedMessage.Status status);
}
