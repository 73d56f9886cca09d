package com.ai.booking.controller;

import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.TelegramUpdate;
import com.ai.booking.dto.TurnResponse;
import com.ai.booking.service.InboundMessageService;
import com.ai.booking.service.SmsChannelService;
import com.ai.booking.service.TelegramService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WebhookController.class)
@TestPropertySource(properties = "telegram.webhook-secret=s3cret")
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InboundMessageService inboundMessageService;

    @MockBean
    private TelegramService telegramService;

    @MockBean
    private SmsChannelService smsChannelService;

    @Test
    void testInbound_WinningTurnIsSent() throws Exception {
        // Given
        when(inboundMessageService.handle(any(InboundEvent.class)))
                .thenReturn(TurnResponse.reply("item-1", "Hi tomorrow 14:00", "Booked for 14:00"));

        // When / Then
        mockMvc.perform(post("/webhook/api")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_id\":\"salon\",\"tg_id\":\"c1\",\"response\":\"tomorrow 14:00\",\"retry\":false,\"count\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.send_status").value("TRUE"))
                .andExpect(jsonPath("$.reply").value("Booked for 14:00"))
                .andExpect(jsonPath("$.status").value("reply"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.user_message").value("Hi tomorrow 14:00"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(inboundMessageService).handle(captor.capture());
        InboundEvent event = captor.getValue();
        assertEquals("salon", event.projectId());
        assertEquals("c1", event.clientId());
        assertEquals("api", event.channel());
        assertEquals("tomorrow 14:00", event.text());
        assertFalse(event.retry());
        assertEquals(2, event.deliveryCount());
    }

    @Test
    void testInbound_SkippedRetryIsNotSent() throws Exception {
        when(inboundMessageService.handle(any(InboundEvent.class))).thenReturn(TurnResponse.skipped());

        mockMvc.perform(post("/webhook/api")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_id\":\"salon\",\"client_id\":\"c1\",\"text\":\"hi\",\"retry\":true,\"count\":0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.send_status").value("FALSE"))
                .andExpect(jsonPath("$.status").value("skipped"))
                .andExpect(jsonPath("$.reply").doesNotExist())
                .andExpect(jsonPath("$.user_message").value("hi"));
    }

    @Test
    void testTelegram_WrongSecretIsForbidden() throws Exception {
        mockMvc.perform(post("/webhook/telegram/salon")
                        .header("X-Telegram-Bot-Api-Secret-Token", "guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":1,\"message\":{\"message_id\":5,\"chat\":{\"id\":42},\"text\":\"hi\"}}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(telegramService);
    }

    @Test
    void testTelegram_UpdateIsAccepted() throws Exception {
        mockMvc.perform(post("/webhook/telegram/salon")
                        .header("X-Telegram-Bot-Api-Secret-Token", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":1,\"message\":{\"message_id\":5,\"chat\":{\"id\":42},\"text\":\"hi\"}}"))
                .andExpect(status().isOk());

        verify(telegramService).accept(eq("salon"), any(TelegramUpdate.class));
    }

    @Test
    void testSms_RepliesWithEmptyTwiml() throws Exception {
        mockMvc.perform(post("/webhook/sms/salon")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("From", "+15550001111")
                        .param("Body", "cancel my booking"))
                .andExpect(status().isOk())
                .andExpect(content().string("<Response></Response>"));

        verify(smsChannelService).accept("salon", "+15550001111", "cancel my booking");
        verify(smsChannelService, never()).accept(anyString(), eq(""), anyString());
    }
}
