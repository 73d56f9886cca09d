package com.ai.booking.service;

import com.ai.booking.entity.ClientActivity;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.exception.StoreUnavailableException;
import com.ai.booking.repository.ClientActivityRepository;
import com.ai.booking.repository.QueuedMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs work inside one transaction holding row locks on everything the
 * coordinator owns for a (project, client): the client_activity anchor row
 * first, then every queued_message row of that client whatever its status.
 * A second caller for the same client blocks until the first commits.
 */
@Component
public class ClientLockScope {

    private static final Logger log = LoggerFactory.getLogger(ClientLockScope.class);

    private final ClientActivityRepository activityRepository;
    private final QueuedMessageRepository messageRepository;
    private final TransactionTemplate lockTemplate;
    private final TransactionTemplate anchorTemplate;

    public ClientLockScope(ClientActivityRepository activityRepository,
                           QueuedMessageRepository messageRepository,
                           PlatformTransactionManager transactionManager) {
        this.activityRepository = activityRepository;
        this.messageRepository = messageRepository;
        this.lockTemplate = new TransactionTemplate(transactionManager);
        this.anchorTemplate = new TransactionTemplate(transactionManager);
        this.anchorTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T withClientLock(String projectId, String clientId, Function<ClientLock, T> work) {
        try {
            ensureAnchor(projectId, clientId);
            return lockTemplate.execute(status -> {
                ClientActivity anchor = activityRepository.findForUpdate(projectId, clientId)
                        .orElseThrow(() -> new IllegalStateException("Missing client_activity row for " + projectId + "/" + clientId));
                List<QueuedMessage> rows = messageRepository.findAllForUpdate(projectId, clientId);
                return work.apply(new ClientLock(anchor, rows));
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Client lock transaction failed for " + projectId + "/" + clientId, e);
        }
    }

    private void ensureAnchor(String projectId, String clientId) {
        if (activityRepository.findByProjectIdAndClientId(projectId, clientId).isPresent()) {
            return;
        }
        try {
            anchorTemplate.executeWithoutResult(status -> activityRepository.saveAndFlush(ClientActivity.builder()
                    .projectId(projectId)
                    .clientId(clientId)
                    .build()));
            log.debug("Created client_activity anchor for {}/{}", projectId, clientId);
        } catch (DataIntegrityViolationException e) {
            // lost the insert race; the row exists now
            log.debug("client_activity anchor for {}/{} created concurrently", projectId, clientId);
        }
    }

    /**
     * Locked view of one client's rows, ordered by creation.
     */
    public record ClientLock(ClientActivity activity, List<QueuedMessage> messages) {

        public Optional<QueuedMessage> find(String itemId) {
            return messages.stream().filter(m -> m.getId().equals(itemId)).findFirst();
        }

        public Optional<QueuedMessage> latest() {
            return messages.stream().max(Comparator
                    .comparingLong(QueuedMessage::getSequence)
                    .thenComparing(QueuedMessage::getCreatedAt));
        }

        public List<QueuedMessage> open() {
            return messages.stream()
                    .filter(m -> !m.getStatus().isTerminal())
                    .sorted(Comparator.comparingLong(QueuedMessage::getSequence))
                    .toList();
        }
    }
}
