package com.ai.booking.service;

import com.ai.booking.dto.ChatMessage;
import com.ai.booking.entity.DialogueEntry;
import com.ai.booking.entity.Feedback;
import com.ai.booking.repository.DialogueEntryRepository;
import com.ai.booking.repository.FeedbackRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DialogueService {

    private static final int MAX_CONTENT = 4000;

    private final DialogueEntryRepository repository;
    private final FeedbackRepository feedbackRepository;

    /** The last {@code limit} entries, oldest first. */
    @Transactional(readOnly = true)
    public List<ChatMessage> recent(String projectId, String clientId, int limit) {
        List<ChatMessage> messages = new ArrayList<>();
        repository.findByProjectIdAndClientIdOrderByCreatedAtDescIdDesc(projectId, clientId, PageRequest.of(0, Math.max(limit, 1)))
                .forEach(e -> messages.add(new ChatMessage(e.getRole(), e.getContent())));
        Collections.reverse(messages);
        return messages;
    }

    @Transactional
    public void append(String projectId, String clientId, String role, String content) {
        if (StringUtils.isBlank(content)) {
            return;
        }
        repository.save(DialogueEntry.builder()
                .projectId(projectId)
                .clientId(clientId)
                .role(role)
                .content(StringUtils.abbreviate(content, MAX_CONTENT))
                .build());
    }

    /** Stores the client's (aggregated) message and the reply that was delivered for it. */
    @Transactional
    public void recordTurn(String projectId, String clientId, String clientText, String reply) {
        append(projectId, clientId, DialogueEntry.ROLE_CLIENT, clientText);
        append(projectId, clientId, DialogueEntry.ROLE_ASSISTANT, reply);
    }

    @Transactional
    public void saveFeedback(String projectId, String clientId, String comment) {
        if (StringUtils.isBlank(comment)) {
            return;
        }
        feedbackRepository.save(Feedback.builder()
                .projectId(projectId)
                .clientId(clientId)
                .comment(StringUtils.abbreviate(comment.trim(), 2000))
                .build());
    }

    @Transactional(readOnly = true)
    public long feedbackCount(String projectId) {
        return feedbackRepository.countByProjectId(projectId);
    }
}
