package com.ai.booking.service;

import com.ai.booking.dto.InboundEvent;
import com.ai.booking.dto.TurnResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;

/**
 * SMS channel: inbound texts arrive as Twilio webhooks, replies go out
 * through {@link TwilioService}.
 */
@Service
public class SmsChannelService {

    private static final Logger log = LoggerFactory.getLogger(SmsChannelService.class);

    public static final String CHANNEL = "sms";

    private final InboundMessageService inboundMessageService;
    private final TwilioService twilioService;
    private final Executor turnExecutor;

    public SmsChannelService(InboundMessageService inboundMessageService,
                             TwilioService twilioService,
                             @Qualifier("turnExecutor") Executor turnExecutor) {
        this.inboundMessageService = inboundMessageService;
        this.twilioService = twilioService;
        this.turnExecutor = turnExecutor;
    }

    public boolean accept(String projectId, String from, String body) {
        if (StringUtils.isBlank(from) || StringUtils.isBlank(body)) {
            return false;
        }
        try {
            turnExecutor.execute(() -> handle(projectId, from, body));
            return true;
        } catch (TaskRejectedException e) {
            log.error("SMS from {} rejected: {}", from, e.getMessage());
            return false;
        }
    }

    void handle(String projectId, String from, String body) {
        try {
            TurnResponse response = inboundMessageService.handle(InboundEvent.firstDelivery(projectId, from, CHANNEL, body));
            if (response.shouldDeliver()) {
                twilioService.sendSms(from, response.getReply());
            }
        } catch (RuntimeException e) {
            log.error("SMS from {} failed", from, e);
        }
    }
}
