package com.ai.booking.repository;

import com.ai.booking.entity.DialogueEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DialogueEntryRepository extends JpaRepository<DialogueEntry, Long> {

    List<DialogueEntry> findByProjectIdAndClientIdOrderByCreatedAtDescIdDesc(String projectId, String clientId, Pageable pageable);
}
