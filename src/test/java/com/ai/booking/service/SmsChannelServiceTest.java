package com.ai.booking.service;

import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.TurnResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SmsChannelServiceTest {

    @Mock
    private InboundMessageService inboundMessageService;

    @Mock
    private TwilioService twilioService;

    private SmsChannelService service;

    @BeforeEach
    void setUp() {
        service = new SmsChannelService(inboundMessageService, twilioService, new SyncTaskExecutor());
    }

    @Test
    void testAccept_WinningReplyIsTexted() {
        when(inboundMessageService.handle(any(InboundEvent.class)))
                .thenReturn(TurnResponse.reply("item-1", "cancel please", "Your booking is cancelled."));

        assertTrue(service.accept("salon", "+15550001111", "cancel please"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(inboundMessageService).handle(captor.capture());
        assertEquals(SmsChannelService.CHANNEL, captor.getValue().channel());
        assertEquals("+15550001111", captor.getValue().clientId());
        verify(twilioService).sendSms("+15550001111", "Your booking is cancelled.");
    }

    @Test
    void testAccept_SupersededTurnStaysSilent() {
        when(inboundMessageService.handle(any(InboundEvent.class)))
                .thenReturn(TurnResponse.superseded("item-1", "hi"));

        service.accept("salon", "+15550001111", "hi");

        verify(twilioService, never()).sendSms(anyString(), anyString());
    }

    @Test
    void testAccept_EmptyMessageIsIgnored() {
        assertFalse(service.accept("salon", "+15550001111", " "));
        assertFalse(service.accept("salon", null, "hello"));

        verifyNoInteractions(inboundMessageService, twilioService);
    }

    @Test
    void testHandle_PipelineErrorIsContained() {
        when(inboundMessageService.handle(any(InboundEvent.class))).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> service.handle("salon", "+15550001111", "hello"));
        verifyNoInteractions(twilioService);
    }
}
