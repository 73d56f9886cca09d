package com.ai.booking.controller;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.ReconcileReport;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.mirror.MirrorReconciler;
import com.ai.booking.service.DialogueService;
import com.ai.booking.service.MessageCoordinatorService;
import com.ai.booking.service.SlotAllocatorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProjectController.class)
@EnableConfigurationProperties(BookingProperties.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SlotAllocatorService allocator;

    @MockBean
    private MessageCoordinatorService coordinator;

    @MockBean
    private DialogueService dialogueService;

    @MockBean
    private MirrorReconciler reconciler;

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void testStats_CombinesBookingsQueueAndFeedback() throws Exception {
        Map<String, Long> bookings = new LinkedHashMap<>();
        bookings.put("total", 3L);
        bookings.put("active", 2L);
        bookings.put("cancelled", 1L);
        Map<QueuedMessage.Status, Long> queue = new EnumMap<>(QueuedMessage.Status.class);
        queue.put(QueuedMessage.Status.PENDING, 1L);
        queue.put(QueuedMessage.Status.SUPERSEDED, 4L);
        when(allocator.bookingStats("salon")).thenReturn(bookings);
        when(coordinator.queueStats("salon")).thenReturn(queue);
        when(dialogueService.feedbackCount("salon")).thenReturn(5L);

        mockMvc.perform(get("/projects/salon/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bookings.active").value(2))
                .andExpect(jsonPath("$.queue.superseded").value(4))
                .andExpect(jsonPath("$.feedback").value(5));
    }

    @Test
    void testStats_UnknownProject() throws Exception {
        mockMvc.perform(get("/projects/nowhere/stats"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));

        verifyNoInteractions(allocator, coordinator);
    }

    @Test
    void testReconcile_RunsForRequestedDay() throws Exception {
        LocalDate day = LocalDate.of(2031, 5, 10);
        when(reconciler.reconcileDay("salon", "Anna", day))
                .thenReturn(new ReconcileReport("salon", "Anna", day, 1, 0, 0, 2, 0));

        mockMvc.perform(post("/projects/salon/mirror/reconcile")
                        .param("specialist", "Anna")
                        .param("date", "2031-05-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repushed").value(1))
                .andExpect(jsonPath("$.imported").value(2));

        verify(reconciler, never()).reconcileDay(anyString(), anyString(), eq(day.plusDays(1)));
    }
}
