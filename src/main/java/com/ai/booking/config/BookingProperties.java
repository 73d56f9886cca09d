package com.ai.booking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scheduling settings shared by every project plus the per-project catalogue
 * of specialists and services. Times are "HH:mm" strings.
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        Integer slotMinutes,
        String workStart,
        String workEnd,
        Map<String, Project> projects,
        Mirror mirror,
        List<String> adminPhones
) {

    public record Project(
            List<String> specialists,
            Map<String, Integer> services,
            String workStart,
            String workEnd,
            String sheetId
    ) {
        public List<String> safeSpecialists() {
            return specialists != null ? specialists : List.of();
        }

        public Map<String, Integer> safeServices() {
            return services != null ? services : Map.of();
        }
    }

    public record Mirror(
            boolean enabled,
            String clientId,
            String clientSecret,
            String refreshToken,
            String tokenUri,
            String apiBase,
            Integer reconcileDays
    ) {
        public boolean isConfigured() {
            return enabled
                    && notBlank(clientId)
                    && notBlank(clientSecret)
                    && notBlank(refreshToken);
        }

        public String safeTokenUri() {
            return notBlank(tokenUri) ? tokenUri : "https://oauth2.googleapis.com/token";
        }

        public String safeApiBase() {
            return notBlank(apiBase) ? apiBase : "https://sheets.googleapis.com/v4";
        }

        public int safeReconcileDays() {
            return reconcileDays != null && reconcileDays > 0 ? reconcileDays : 14;
        }
    }

    public int safeSlotMinutes() {
        return slotMinutes != null && slotMinutes > 0 ? slotMinutes : 30;
    }

    public Map<String, Project> safeProjects() {
        return projects != null ? projects : Map.of();
    }

    public Optional<Project> project(String projectId) {
        if (projectId == null) return Optional.empty();
        return Optional.ofNullable(safeProjects().get(projectId));
    }

    public Mirror safeMirror() {
        return mirror != null ? mirror : new Mirror(false, null, null, null, null, null, null);
    }

    public List<String> safeAdminPhones() {
        return adminPhones != null ? adminPhones : List.of();
    }

    public LocalTime workStartFor(String projectId) {
        String configured = project(projectId).map(Project::workStart).orElse(null);
        return parseTime(notBlank(configured) ? configured : workStart, LocalTime.of(9, 0));
    }

    public LocalTime workEndFor(String projectId) {
        String configured = project(projectId).map(Project::workEnd).orElse(null);
        return parseTime(notBlank(configured) ? configured : workEnd, LocalTime.of(18, 0));
    }

    private static LocalTime parseTime(String value, LocalTime fallback) {
        return notBlank(value) ? LocalTime.parse(value.trim()) : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
