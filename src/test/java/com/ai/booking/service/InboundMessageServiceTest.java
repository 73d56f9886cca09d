package com.ai.booking.service;

import com.ai.booking.dto.ClaimOutcome;
import com.ai.booking.dto.DirectiveOutcome;
import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.SubmitResult;
import com.ai.booking.dto.TurnResponse;
import com.ai.booking.dto.TurnResult;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.exception.StoreUnavailableException;
import com.ai.booking.exception.TurnProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InboundMessageServiceTest {

    @Mock
    private MessageCoordinatorService coordinator;

    @Mock
    private TurnProcessor turnProcessor;

    @Mock
    private DialogueService dialogueService;

    @InjectMocks
    private InboundMessageService service;

    private QueuedMessage item;
    private InboundEvent event;

    @BeforeEach
    void setUp() {
        item = QueuedMessage.builder()
                .id("item-1")
                .projectId("salon")
                .clientId("c1")
                .channel("api")
                .originalText("tomorrow 14:00")
                .aggregatedText("Hi tomorrow 14:00")
                .sequence(2)
                .build();
        event = InboundEvent.firstDelivery("salon", "c1", "api", "tomorrow 14:00");
    }

    @Test
    void testHandle_SkippedRetryNeverReachesProcessor() {
        InboundEvent retry = new InboundEvent("salon", "c1", "api", "hello", true, 0);
        when(coordinator.submit(retry)).thenReturn(SubmitResult.skipped());

        TurnResponse response = service.handle(retry);

        assertEquals(TurnResponse.Type.SKIPPED, response.getType());
        assertFalse(response.shouldDeliver());
        verifyNoInteractions(turnProcessor, dialogueService);
    }

    @Test
    void testHandle_WinnerRepliesAndRecordsDialogue() {
        // Given
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(true);
        when(turnProcessor.process(item)).thenReturn(new TurnResult("Booked for 14:00", DirectiveOutcome.none()));
        when(coordinator.claimWinner("item-1")).thenReturn(ClaimOutcome.WIN);

        // When
        TurnResponse response = service.handle(event);

        // Then
        assertTrue(response.shouldDeliver());
        assertEquals("Booked for 14:00", response.getReply());
        assertEquals("Hi tomorrow 14:00", response.getAggregatedText());
        verify(dialogueService).recordTurn("salon", "c1", "Hi tomorrow 14:00", "Booked for 14:00");
    }

    @Test
    void testHandle_LoserDiscardsReply() {
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(true);
        when(turnProcessor.process(item)).thenReturn(new TurnResult("stale answer", DirectiveOutcome.none()));
        when(coordinator.claimWinner("item-1")).thenReturn(ClaimOutcome.LOSE);

        TurnResponse response = service.handle(event);

        assertEquals(TurnResponse.Type.SUPERSEDED, response.getType());
        assertNull(response.getReply());
        verifyNoInteractions(dialogueService);
    }

    @Test
    void testHandle_SupersededBeforeProcessing() {
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(false);

        TurnResponse response = service.handle(event);

        assertEquals(TurnResponse.Type.SUPERSEDED, response.getType());
        verifyNoInteractions(turnProcessor);
        verify(coordinator, never()).claimWinner(anyString());
    }

    @Test
    void testHandle_ProcessorFailureCancelsItem() {
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(true);
        when(turnProcessor.process(item)).thenThrow(new TurnProcessingException("OpenAI call failed"));

        TurnResponse response = service.handle(event);

        assertEquals(TurnResponse.Type.FAILED, response.getType());
        verify(coordinator).markFailed("item-1");
        verify(coordinator, never()).claimWinner(anyString());
        verifyNoInteractions(dialogueService);
    }

    @Test
    void testHandle_ClaimFailureCancelsItem() {
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(true);
        when(turnProcessor.process(item)).thenReturn(new TurnResult("ok", DirectiveOutcome.none()));
        when(coordinator.claimWinner("item-1")).thenThrow(new StoreUnavailableException("db down", null));

        TurnResponse response = service.handle(event);

        assertEquals(TurnResponse.Type.FAILED, response.getType());
        verify(coordinator).markFailed("item-1");
    }

    @Test
    void testHandle_DialogueFailureStillDeliversReply() {
        when(coordinator.submit(event)).thenReturn(SubmitResult.queued(item));
        when(coordinator.markProcessing("item-1")).thenReturn(true);
        when(turnProcessor.process(item)).thenReturn(new TurnResult("See you", DirectiveOutcome.none()));
        when(coordinator.claimWinner("item-1")).thenReturn(ClaimOutcome.WIN);
        doThrow(new IllegalStateException("constraint")).when(dialogueService)
                .recordTurn(anyString(), anyString(), anyString(), any());

        TurnResponse response = service.handle(event);

        assertTrue(response.shouldDeliver());
        assertEquals("See you", response.getReply());
    }
}
