package com.ai.booking.controller;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.ReconcileReport;
import com.ai.booking.entity.QueuedMessage;
import com.ai.booking.exception.ValidationException;
import com.ai.booking.mirror.MirrorReconciler;
import com.ai.booking.service.DialogueService;
import com.ai.booking.service.MessageCoordinatorService;
import com.ai.booking.service.SlotAllocatorService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints: stats, queue state and on-demand reconciliation.
 */
@RestController
public class ProjectController {

    private final BookingProperties properties;
    private final SlotAllocatorService allocator;
    private final MessageCoordinatorService coordinator;
    private final DialogueService dialogueService;
    private final MirrorReconciler reconciler;

    public ProjectController(BookingProperties properties,
                             SlotAllocatorService allocator,
                             MessageCoordinatorService coordinator,
                             DialogueService dialogueService,
                             MirrorReconciler reconciler) {
        this.properties = properties;
        this.allocator = allocator;
        this.coordinator = coordinator;
        this.dialogueService = dialogueService;
        this.reconciler = reconciler;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/projects/{projectId}/stats")
    public Map<String, Object> stats(@PathVariable String projectId) {
        requireProject(projectId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", projectId);
        body.put("bookings", allocator.bookingStats(projectId));
        body.put("queue", queueCounts(projectId));
        body.put("feedback", dialogueService.feedbackCount(projectId));
        return body;
    }

    @GetMapping("/projects/{projectId}/queue")
    public Map<String, Long> queue(@PathVariable String projectId) {
        requireProject(projectId);
        return queueCounts(projectId);
    }

    @PostMapping("/projects/{projectId}/mirror/reconcile")
    public ReconcileReport reconcile(@PathVariable String projectId,
                                     @RequestParam String specialist,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        requireProject(projectId);
        return reconciler.reconcileDay(projectId, specialist, date);
    }

    private Map<String, Long> queueCounts(String projectId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<QueuedMessage.Status, Long> stats = coordinator.queueStats(projectId);
        stats.forEach((status, count) -> counts.put(status.name().toLowerCase(), count));
        return counts;
    }

    private void requireProject(String projectId) {
        if (properties.project(projectId).isEmpty()) {
            throw new ValidationException("Unknown project: " + projectId);
        }
    }
}
