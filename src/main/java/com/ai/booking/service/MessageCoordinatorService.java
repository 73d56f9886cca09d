package com.ai.booking.service;

import com.ai.booking.dto.ClaimOutcome;
import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.SubmitResult;
import com.ai.booking.entity.ClientActivity;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.exception.ValidationException;
import com.ai.booking.repository.QueuedMessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Folds bursts of inbound messages from one client into a single turn and
 * decides which of several concurrently finishing turns gets to reply.
 * Every state change runs under {@link ClientLockScope}.
 */
@Service
public class MessageCoordinatorService {

    private static final Logger log = LoggerFactory.getLogger(MessageCoordinatorService.class);

    private final ClientLockScope lockScope;
    private final QueuedMessageRepository messageRepository;

    public MessageCoordinatorService(ClientLockScope lockScope, QueuedMessageRepository messageRepository) {
        this.lockScope = lockScope;
        this.messageRepository = messageRepository;
    }

    public SubmitResult submit(InboundEvent event) {
        if (event == null || StringUtils.isBlank(event.projectId()) || StringUtils.isBlank(event.clientId())) {
            throw new ValidationException("project_id and client_id are required");
        }
        if (event.retry() && event.deliveryCount() == 0) {
            log.info("Skipping retried delivery for {}/{}", event.projectId(), event.clientId());
            return SubmitResult.skipped();
        }
        String text = StringUtils.defaultString(event.text()).trim();

        QueuedMessage created = lockScope.withClientLock(event.projectId(), event.clientId(), lock -> {
            List<String> parts = new ArrayList<>();
            for (QueuedMessage open : lock.open()) {
                if (StringUtils.isNotBlank(open.getAggregatedText())) {
                    parts.add(open.getAggregatedText());
                }
                open.transitionTo(QueuedMessage.Status.SUPERSEDED);
                log.debug("Superseded {} by new message from {}/{}", open.getId(), event.projectId(), event.clientId());
            }
            if (!text.isEmpty()) {
                parts.add(text);
            }

            ClientActivity activity = lock.activity();
            activity.setLastMessageAt(Instant.now());
            long sequence = activity.nextSequence();

            QueuedMessage item = QueuedMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .projectId(event.projectId())
                    .clientId(event.clientId())
                    .channel(event.channel())
                    .originalText(text)
                    .aggregatedText(String.join(" ", parts))
                    .sequence(sequence)
                    .retryCount(event.retry() ? Math.max(event.deliveryCount(), 0) : 0)
                    .build();
            return messageRepository.save(item);
        });

        log.info("Queued message {} for {}/{} (seq {})", created.getId(), created.getProjectId(),
                created.getClientId(), created.getSequence());
        return SubmitResult.queued(created);
    }

    /**
     * PENDING to PROCESSING. Returns false when the item was superseded or
     * otherwise finished before processing started.
     */
    public boolean markProcessing(String itemId) {
        Optional<QueuedMessage> snapshot = messageRepository.findById(itemId);
        if (snapshot.isEmpty()) {
            log.warn("markProcessing: unknown queued message {}", itemId);
            return false;
        }
        QueuedMessage known = snapshot.get();
        return lockScope.withClientLock(known.getProjectId(), known.getClientId(), lock -> {
            QueuedMessage item = lock.find(itemId).orElse(null);
            if (item == null || item.getStatus() != QueuedMessage.Status.PENDING) {
                log.debug("Queued message {} not pending, not processing it", itemId);
                return false;
            }
            item.transitionTo(QueuedMessage.Status.PROCESSING);
            return true;
        });
    }

    /**
     * Decides whether {@code itemId} is the turn that replies. Considers every
     * row of the client whatever its status, so an item submitted after this
     * one always beats it.
     */
    public ClaimOutcome claimWinner(String itemId) {
        Optional<QueuedMessage> snapshot = messageRepository.findById(itemId);
        if (snapshot.isEmpty()) {
            log.warn("claimWinner: unknown queued message {}", itemId);
            return ClaimOutcome.LOSE;
        }
        QueuedMessage known = snapshot.get();
        ClaimOutcome outcome = lockScope.withClientLock(known.getProjectId(), known.getClientId(), lock -> {
            QueuedMessage item = lock.find(itemId).orElseThrow();
            QueuedMessage latest = lock.latest().orElseThrow();
            boolean eligible = item.getStatus() == QueuedMessage.Status.COMPLETED || !item.getStatus().isTerminal();

            if (latest.getId().equals(itemId) && eligible) {
                if (item.getStatus() != QueuedMessage.Status.COMPLETED) {
                    pickUp(item);
                    item.transitionTo(QueuedMessage.Status.COMPLETED);
                }
                for (QueuedMessage other : lock.open()) {
                    if (!other.getId().equals(itemId)) {
                        other.transitionTo(QueuedMessage.Status.SUPERSEDED);
                    }
                }
                return ClaimOutcome.WIN;
            }
            if (!item.getStatus().isTerminal()) {
                item.transitionTo(QueuedMessage.Status.SUPERSEDED);
            }
            return ClaimOutcome.LOSE;
        });
        log.info("Claim for {} ({}/{}): {}", itemId, known.getProjectId(), known.getClientId(), outcome);
        return outcome;
    }

    public void markFailed(String itemId) {
        Optional<QueuedMessage> snapshot = messageRepository.findById(itemId);
        if (snapshot.isEmpty()) {
            log.warn("markFailed: unknown queued message {}", itemId);
            return;
        }
        QueuedMessage known = snapshot.get();
        lockScope.withClientLock(known.getProjectId(), known.getClientId(), lock -> {
            lock.find(itemId)
                    .filter(item -> !item.getStatus().isTerminal())
                    .ifPresent(item -> {
                        pickUp(item);
                        item.transitionTo(QueuedMessage.Status.CANCELLED);
                        log.info("Queued message {} cancelled after processing failure", itemId);
                    });
            return null;
        });
    }

    public Map<QueuedMessage.Status, Long> queueStats(String projectId) {
        Map<QueuedMessage.Status, Long> stats = new EnumMap<>(QueuedMessage.Status.class);
        for (QueuedMessage.Status status : QueuedMessage.Status.values()) {
            stats.put(status, messageRepository.countByProjectIdAndStatus(projectId, status));
        }
        return stats;
    }

    /** A row that was claimed or failed without markProcessing still passes through PROCESSING. */
    private static void pickUp(QueuedMessage item) {
        if (item.getStatus() == QueuedMessage.Status.PENDING) {
            item.transitionTo(QueuedMessage.Status.PROCESSING);
        }
    }
}
