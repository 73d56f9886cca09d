package com.ai.booking.controller;

import com.ai.booking.dto.TelegramUpdate;
import com.ai.booking.dto.TurnResponse;
import com.ai.booking.dto.WebhookRequest;
import com.ai.booking.dto.WebhookResponse;
import com.ai.booking.service.InboundMessageService;
import com.ai.booking.service.SmsChannelService;
import com.ai.booking.service.TelegramService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/webhook")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final InboundMessageService inboundMessageService;
    private final TelegramService telegramService;
    private final SmsChannelService smsChannelService;

    @Value("${telegram.webhook-secret:}")
    private String telegramSecret;

    public WebhookController(InboundMessageService inboundMessageService,
                             TelegramService telegramService,
                             SmsChannelService smsChannelService) {
        this.inboundMessageService = inboundMessageService;
        this.telegramService = telegramService;
        this.smsChannelService = smsChannelService;
    }

    /**
     * Chat platforms that wait for the reply in the response body.
     */
    @PostMapping(value = "/{channel}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WebhookResponse inbound(@PathVariable String channel, @RequestBody WebhookRequest request) {
        log.info("Webhook {} for {}/{} retry={} count={}", channel, request.projectId(), request.clientId(),
                request.retry(), request.count());
        TurnResponse response = inboundMessageService.handle(request.toEvent(channel));
        return WebhookResponse.from(response, request.count(), request.text());
    }

    @PostMapping("/telegram/{projectId}")
    public ResponseEntity<Void> telegram(
            @PathVariable String projectId,
            @RequestHeader(value = "X-Telegram-Bot-Api-Secret-Token", required = false) String secretToken,
            @RequestBody TelegramUpdate update) {
        if (StringUtils.isNotBlank(telegramSecret) && !telegramSecret.equals(secretToken)) {
            log.warn("Rejected Telegram webhook for {}: invalid secret token", projectId);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        telegramService.accept(projectId, update);
        return ResponseEntity.ok().build();
    }

    /** Twilio inbound SMS; the reply goes out later through the Messages API. */
    @PostMapping(value = "/sms/{projectId}", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> sms(@PathVariable String projectId,
                                      @RequestParam(required = false) Map<String, String> params) {
        String from = params != null ? params.getOrDefault("From", "") : "";
        String body = params != null ? params.getOrDefault("Body", "") : "";
        log.info("Inbound SMS for {} from {}", projectId, from);
        smsChannelService.accept(projectId, from, body);
        return ResponseEntity.ok("<Response></Response>");
    }
}
