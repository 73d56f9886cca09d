package com.ai.booking.service;

import com.ai.booking.dto.ChatMessage;
import com.ai.booking.dto.TurnContext;
import com.ai.booking.dto.TurnDecision;
import com.ai.booking.entity.Booking;
import com.ai.booking.entity.DialogueEntry;
import com.ai.booking.exception.TurnProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Asks OpenAI Chat Completions for the next reply and booking action, as a
 * JSON object.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${openai.url:https://api.openai.com/v1/chat/completions}")
    private String openAiUrl;

    public LlmService(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    public TurnDecision decide(TurnContext context, List<ChatMessage> history, String clientText) {
        if (StringUtils.isBlank(openAiApiKey)) {
            throw new TurnProcessingException("OPENAI_API_KEY is not set");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt(context)));
        for (ChatMessage msg : history) {
            messages.add(message(DialogueEntry.ROLE_CLIENT.equals(msg.role()) ? "user" : "assistant", msg.content()));
        }
        messages.add(message("user", clientText));

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0.2);
        body.put("messages", messages);
        body.put("response_format", Map.of("type", "json_object"));

        String content;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(openAiUrl, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("");
        } catch (RestClientException | JsonProcessingException e) {
            throw new TurnProcessingException("OpenAI call failed", e);
        }
        if (StringUtils.isBlank(content)) {
            throw new TurnProcessingException("OpenAI returned an empty reply");
        }
        return parseDecision(content);
    }

    /**
     * Reads the model's JSON; anything that is not a JSON object is taken as
     * a plain reply with no action.
     */
    TurnDecision parseDecision(String content) {
        String json = content.trim();
        if (json.startsWith("```")) {
            json = StringUtils.substringBetween(json, "\n", "```");
            json = json == null ? content.trim() : json.trim();
        }
        try {
            TurnDecision decision = mapper.readValue(json, TurnDecision.class);
            if (StringUtils.isBlank(decision.reply()) && decision.actionType() == TurnDecision.Action.NONE) {
                log.warn("Model decision without reply or action: {}", StringUtils.abbreviate(json, 200));
            }
            return decision;
        } catch (JsonProcessingException e) {
            log.warn("Model reply is not a decision object, using it as text: {}", e.getOriginalMessage());
            return TurnDecision.replyOnly(content.trim());
        }
    }

    private String systemPrompt(TurnContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are the booking assistant of a beauty salon. Today is ")
                .append(context.today().format(DATE)).append(" (").append(context.today().getDayOfWeek()).append(").\n\n");

        sb.append("SPECIALISTS: ").append(String.join(", ", context.specialists())).append("\n");
        sb.append("SERVICES (duration in minutes):\n");
        context.servicesMinutes().forEach((name, minutes) -> sb.append("- ").append(name).append(": ").append(minutes).append("\n"));

        sb.append("\nFREE SLOT STARTS (each slot is one unit; a longer service needs consecutive free starts):\n");
        context.availability().forEach((specialist, byDate) -> {
            sb.append(specialist).append(": ");
            List<String> days = new ArrayList<>();
            byDate.forEach((date, times) -> days.add(date.format(DATE) + " " + formatTimes(times)));
            sb.append(days.isEmpty() ? "no free slots" : String.join("; ", days)).append("\n");
        });

        if (context.clientBookings().isEmpty()) {
            sb.append("\nCLIENT HAS NO ACTIVE BOOKINGS.\n");
        } else {
            sb.append("\nCLIENT'S ACTIVE BOOKINGS:\n");
            for (Booking b : context.clientBookings()) {
                sb.append("- ").append(b.getSpecialist()).append(", ").append(b.getBookingDate().format(DATE))
                        .append(" ").append(b.getStartTime());
                if (StringUtils.isNotBlank(b.getServiceName())) {
                    sb.append(", ").append(b.getServiceName());
                }
                sb.append("\n");
            }
        }

        sb.append("\nRULES:\n");
        sb.append("- Be short and friendly. Answer in the client's language.\n");
        sb.append("- Only offer times from FREE SLOT STARTS.\n");
        sb.append("- Before booking you need specialist, date, time, service and the client's name. Ask for what is missing.\n");
        sb.append("- Book, cancel or move only after the client clearly confirms.\n");
        sb.append("\nRespond with ONE JSON object and nothing else:\n");
        sb.append("{\"reply\": text for the client, \"action\": \"none\"|\"activate\"|\"reject\"|\"change\", ");
        sb.append("\"specialist\", \"date\" (dd.MM.yyyy), \"time\" (HH:mm), \"service\", \"client_name\", \"phone\", ");
        sb.append("\"old_date\" and \"old_time\" (the booking being changed or cancelled), ");
        sb.append("\"feedback\" (client's comment about the service, if any)}.\n");
        sb.append("Use null for unknown fields. \"activate\" books, \"reject\" cancels, \"change\" moves an existing booking.\n");
        return sb.toString();
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    private static String formatTimes(SortedSet<LocalTime> times) {
        if (times.isEmpty()) {
            return "none";
        }
        return times.stream().map(LocalTime::toString).collect(Collectors.joining(","));
    }
}
