package com.ai.booking.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound SMS through the Twilio Messages API.
 */
@Service
public class TwilioService {

    private static final Logger log = LoggerFactory.getLogger(TwilioService.class);

    private static final String TWILIO_API_BASE = "https://api.twilio.com/2010-04-01";

    @Value("${twilio.accountSid:${twilio.account-sid:}}")
    private String accountSid;

    @Value("${twilio.authToken:${twilio.auth-token:}}")
    private String authToken;

    @Value("${twilio.from-number:}")
    private String fromNumber;

    private final RestTemplate restTemplate;

    public TwilioService(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    public boolean isConfigured() {
        return StringUtils.isNoneBlank(accountSid, authToken, fromNumber);
    }

    /**
     * Sends one SMS. Returns false when credentials are missing or Twilio
     * rejects the request.
     */
    public boolean sendSms(String to, String text) {
        if (StringUtils.isBlank(to) || StringUtils.isBlank(text)) {
            return false;
        }
        if (!isConfigured()) {
            log.warn("Twilio credentials not set; skipping SMS to {}", to);
            return false;
        }
        String apiUrl = TWILIO_API_BASE + "/Accounts/" + accountSid + "/Messages.json";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("To", to);
        body.add("From", fromNumber);
        body.add("Body", text);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Twilio Messages API returned {} for {}", response.getStatusCode(), to);
                return false;
            }
            return true;
        } catch (RestClientException e) {
            log.error("Twilio SMS to {} failed", to, e);
            return false;
        }
    }
}
