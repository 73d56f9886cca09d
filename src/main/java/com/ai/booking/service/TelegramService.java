package com.ai.booking.service;

import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.TelegramUpdate;
import com.ai.booking.dto.TurnResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Telegram channel: turns webhook updates into inbound events and sends the
 * winning reply with the Bot API.
 */
@Service
public class TelegramService {

    private static final Logger log = LoggerFactory.getLogger(TelegramService.class);

    public static final String CHANNEL = "telegram";

    @Value("${telegram.bot-token:}")
    private String botToken;

    @Value("${telegram.api-base:https://api.telegram.org}")
    private String apiBase;

    private final RestTemplate restTemplate;
    private final InboundMessageService inboundMessageService;
    private final Executor turnExecutor;

    public TelegramService(RestTemplateBuilder builder,
                           InboundMessageService inboundMessageService,
                           @Qualifier("turnExecutor") Executor turnExecutor) {
        this.restTemplate = builder.build();
        this.inboundMessageService = inboundMessageService;
        this.turnExecutor = turnExecutor;
    }

    /** Queues the update for processing; returns false when it carries no text. */
    public boolean accept(String projectId, TelegramUpdate update) {
        Long chatId = update != null ? update.chatId() : null;
        String text = update != null ? update.text() : null;
        if (chatId == null || StringUtils.isBlank(text)) {
            log.debug("Ignoring Telegram update without text for project {}", projectId);
            return false;
        }
        try {
            turnExecutor.execute(() -> handle(projectId, chatId, text));
            return true;
        } catch (TaskRejectedException e) {
            log.error("Telegram update for chat {} rejected: {}", chatId, e.getMessage());
            return false;
        }
    }

    void handle(String projectId, Long chatId, String text) {
        try {
            TurnResponse response = inboundMessageService.handle(
                    InboundEvent.firstDelivery(projectId, String.valueOf(chatId), CHANNEL, text));
            if (response.shouldDeliver()) {
                sendMessage(chatId, response.getReply());
            }
        } catch (RuntimeException e) {
            log.error("Telegram message from chat {} failed", chatId, e);
        }
    }

    public void sendMessage(Long chatId, String text) {
        if (StringUtils.isBlank(botToken)) {
            log.warn("telegram.bot-token not set; not replying to chat {}", chatId);
            return;
        }
        if (StringUtils.isBlank(text)) {
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        try {
            restTemplate.postForEntity(apiBase + "/bot{token}/sendMessage", new HttpEntity<>(payload, headers),
                    String.class, botToken);
            log.info("Telegram reply sent to chat {}", chatId);
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message to chat {}: {}", chatId, e.getMessage(), e);
        }
    }
}
