package com.ai.booking.service;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.ChatMessage;
import com.ai.booking.dto.DirectiveOutcome;
import com.ai.booking.dto.TurnContext;
import com.ai.booking.dto.TurnDecision;
import com.ai.booking.dto.TurnResult;
import com.ai.booking.entity.Booking;
import com.ai.booking.entity.QueuedMessage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

@Service
public class LanguageModelTurnProcessor implements TurnProcessor {

    private static final Logger log = LoggerFactory.getLogger(LanguageModelTurnProcessor.class);

    private final LlmService llmService;
    private final BookingDirectiveExecutor directiveExecutor;
    private final DialogueService dialogueService;
    private final SlotAllocatorService allocator;
    private final BookingProperties properties;

    @Value("${assistant.history-size:20}")
    private int historySize;

    @Value("${assistant.lookahead-days:3}")
    private int lookaheadDays;

    public LanguageModelTurnProcessor(LlmService llmService,
                                      BookingDirectiveExecutor directiveExecutor,
                                      DialogueService dialogueService,
                                      SlotAllocatorService allocator,
                                      BookingProperties properties) {
        this.llmService = llmService;
        this.directiveExecutor = directiveExecutor;
        this.dialogueService = dialogueService;
        this.allocator = allocator;
        this.properties = properties;
    }

    @Override
    public TurnResult process(QueuedMessage item) {
        String projectId = item.getProjectId();
        String clientId = item.getClientId();

        List<ChatMessage> history = dialogueService.recent(projectId, clientId, historySize);
        TurnContext context = buildContext(projectId, clientId);
        TurnDecision decision = llmService.decide(context, history, item.getAggregatedText());
        log.debug("Decision for {}: action={} specialist={} date={} time={}", item.getId(),
                decision.actionType(), decision.specialist(), decision.date(), decision.time());

        DirectiveOutcome outcome = directiveExecutor.execute(projectId, clientId, decision);
        dialogueService.saveFeedback(projectId, clientId, decision.feedback());

        String reply = StringUtils.trimToEmpty(decision.reply());
        if (!outcome.success() && StringUtils.isNotBlank(outcome.message())) {
            reply = reply.isEmpty() ? outcome.message() : reply + "\n\n" + outcome.message();
        }
        return new TurnResult(reply, outcome);
    }

    private TurnContext buildContext(String projectId, String clientId) {
        LocalDate today = LocalDate.now();
        LocalTime now = LocalTime.now();
        BookingProperties.Project project = properties.project(projectId).orElse(null);
        List<String> specialists = project != null ? project.safeSpecialists() : List.of();
        Map<String, Integer> services = project != null ? project.safeServices() : Map.of();

        Map<String, Map<LocalDate, SortedSet<LocalTime>>> availability = new LinkedHashMap<>();
        for (String specialist : specialists) {
            Map<LocalDate, SortedSet<LocalTime>> byDate = new LinkedHashMap<>();
            for (int i = 0; i < Math.max(lookaheadDays, 1); i++) {
                LocalDate date = today.plusDays(i);
                SortedSet<LocalTime> free = allocator.getAvailableSlots(projectId, specialist, date, 1);
                if (i == 0) {
                    free = free.tailSet(now);
                }
                if (!free.isEmpty()) {
                    byDate.put(date, free);
                }
            }
            availability.put(specialist, byDate);
        }
        List<Booking> bookings = allocator.findActiveBookings(projectId, clientId);
        return new TurnContext(today, specialists, services, availability, bookings);
    }
}
