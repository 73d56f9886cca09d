package com.ai.booking.service;

import com.ai.booking.dto.ClaimOutcome;
import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.SubmitResult;
import com.ai.booking.dto.TurnResponse;
import com.ai.booking.dto.TurnResult;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One inbound event end to end: submit, process the aggregated turn, then
 * claim the right to reply. Channel adapters deliver the reply only when the
 * returned response says so.
 */
@Service
public class InboundMessageService {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageService.class);

    private final MessageCoordinatorService coordinator;
    private final TurnProcessor turnProcessor;
    private final DialogueService dialogueService;

    public InboundMessageService(MessageCoordinatorService coordinator,
                                 TurnProcessor turnProcessor,
                                 DialogueService dialogueService) {
        this.coordinator = coordinator;
        this.turnProcessor = turnProcessor;
        this.dialogueService = dialogueService;
    }

    public TurnResponse handle(InboundEvent event) {
        SubmitResult submitted = coordinator.submit(event);
        if (submitted.isSkipped()) {
            return TurnResponse.skipped();
        }
        QueuedMessage item = submitted.getItem();
        String itemId = item.getId();

        if (!coordinator.markProcessing(itemId)) {
            log.info("Message {} superseded before processing", itemId);
            return TurnResponse.superseded(itemId, item.getAggregatedText());
        }

        TurnResult result;
        try {
            result = turnProcessor.process(item);
        } catch (RuntimeException e) {
            log.error("Turn processing failed for message {} ({}/{})", itemId, item.getProjectId(), item.getClientId(), e);
            markFailedQuietly(itemId);
            return TurnResponse.failed(itemId, item.getAggregatedText());
        }

        ClaimOutcome outcome;
        try {
            outcome = coordinator.claimWinner(itemId);
        } catch (StoreUnavailableException e) {
            log.error("Winner claim failed for message {}", itemId, e);
            markFailedQuietly(itemId);
            return TurnResponse.failed(itemId, item.getAggregatedText());
        }

        if (outcome == ClaimOutcome.LOSE) {
            log.info("Message {} lost the claim, reply discarded", itemId);
            return TurnResponse.superseded(itemId, item.getAggregatedText());
        }
        try {
            dialogueService.recordTurn(item.getProjectId(), item.getClientId(), item.getAggregatedText(), result.replyText());
        } catch (RuntimeException e) {
            log.warn("Could not store dialogue for message {}: {}", itemId, e.getMessage());
        }
        return TurnResponse.reply(itemId, item.getAggregatedText(), result.replyText());
    }

    private void markFailedQuietly(String itemId) {
        try {
            coordinator.markFailed(itemId);
        } catch (RuntimeException e) {
            log.error("Could not mark message {} failed", itemId, e);
        }
    }
}
