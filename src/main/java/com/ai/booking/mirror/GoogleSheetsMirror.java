package com.ai.booking.mirror;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.exception.MirrorSyncException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Google Sheets rendition of the mirror. Each specialist has a worksheet named
 * after them; one row per slot with columns
 * A date (dd.MM.yyyy), B time (HH:mm), C client id, D client name, E service.
 * Row 1 is a header.
 */
@Component
public class GoogleSheetsMirror implements BookingMirror {

    private static final Logger log = LoggerFactory.getLogger(GoogleSheetsMirror.class);

    private static final DateTimeFormatter DATE_OUT = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final DateTimeFormatter DATE_IN = DateTimeFormatter.ofPattern("d.M.yyyy");
    private static final DateTimeFormatter TIME_OUT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter TIME_IN = DateTimeFormatter.ofPattern("H:mm");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final BookingProperties properties;

    private String accessToken;
    private Instant accessTokenExpiresAt = Instant.EPOCH;

    public GoogleSheetsMirror(RestTemplateBuilder builder, BookingProperties properties) {
        this.restTemplate = builder.build();
        this.properties = properties;
    }

    @Override
    public boolean isEnabled(String projectId) {
        return properties.safeMirror().isConfigured() && StringUtils.isNotBlank(sheetId(projectId));
    }

    @Override
    public void setSlot(String projectId, String specialist, LocalDate date, LocalTime time, MirrorRecord record) {
        if (!isEnabled(projectId)) {
            log.debug("Mirror disabled for project {}, skipping setSlot", projectId);
            return;
        }
        List<List<String>> rows = readRows(projectId, specialist);
        int index = findRow(rows, date, time);
        List<String> cells = List.of(
                StringUtils.defaultString(record.clientId()),
                StringUtils.defaultString(record.clientName()),
                StringUtils.defaultString(record.serviceName()));
        if (index >= 0) {
            int row = index + 2;
            writeValues(projectId, tab(specialist) + "!C" + row + ":E" + row, List.of(cells));
        } else {
            List<String> full = new ArrayList<>();
            full.add(date.format(DATE_OUT));
            full.add(time.format(TIME_OUT));
            full.addAll(cells);
            appendValues(projectId, tab(specialist) + "!A:E", List.of(full));
        }
        log.debug("Mirror set {} {} {} -> {}", specialist, date, time, record.clientId());
    }

    @Override
    public void clearSlot(String projectId, String specialist, LocalDate date, LocalTime time) {
        if (!isEnabled(projectId)) {
            return;
        }
        List<List<String>> rows = readRows(projectId, specialist);
        int index = findRow(rows, date, time);
        if (index < 0) {
            return;
        }
        int row = index + 2;
        writeValues(projectId, tab(specialist) + "!C" + row + ":E" + row, List.of(List.of("", "", "")));
        log.debug("Mirror cleared {} {} {}", specialist, date, time);
    }

    @Override
    public Optional<MirrorRecord> readSlot(String projectId, String specialist, LocalDate date, LocalTime time) {
        if (!isEnabled(projectId)) {
            return Optional.empty();
        }
        List<List<String>> rows = readRows(projectId, specialist);
        int index = findRow(rows, date, time);
        return index < 0 ? Optional.empty() : Optional.ofNullable(toRecord(rows.get(index)));
    }

    @Override
    public Map<LocalTime, MirrorRecord> readDay(String projectId, String specialist, LocalDate date) {
        Map<LocalTime, MirrorRecord> day = new TreeMap<>();
        if (!isEnabled(projectId)) {
            return day;
        }
        for (List<String> row : readRows(projectId, specialist)) {
            if (!date.equals(parseDate(cell(row, 0)))) {
                continue;
            }
            LocalTime time = parseTime(cell(row, 1));
            MirrorRecord record = toRecord(row);
            if (time != null && record != null) {
                day.put(time, record);
            }
        }
        return day;
    }

    private List<List<String>> readRows(String projectId, String specialist) {
        String url = properties.safeMirror().safeApiBase() + "/spreadsheets/{sheetId}/values/{range}";
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(authHeaders()), String.class, sheetId(projectId), tab(specialist) + "!A2:E");
            JsonNode values = mapper.readTree(response.getBody()).path("values");
            List<List<String>> rows = new ArrayList<>();
            for (JsonNode rowNode : values) {
                List<String> row = new ArrayList<>();
                rowNode.forEach(c -> row.add(c.asText("")));
                rows.add(row);
            }
            return rows;
        } catch (RestClientException | JsonProcessingException e) {
            throw new MirrorSyncException("Failed to read mirror sheet for " + specialist, e);
        }
    }

    private void writeValues(String projectId, String range, List<List<String>> values) {
        String url = properties.safeMirror().safeApiBase() + "/spreadsheets/{sheetId}/values/{range}?valueInputOption=RAW";
        try {
            restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(valueBody(range, values), jsonHeaders()),
                    String.class, sheetId(projectId), range);
        } catch (RestClientException e) {
            throw new MirrorSyncException("Failed to write mirror range " + range, e);
        }
    }

    private void appendValues(String projectId, String range, List<List<String>> values) {
        String url = properties.safeMirror().safeApiBase()
                + "/spreadsheets/{sheetId}/values/{range}:append?valueInputOption=RAW&insertDataOption=INSERT_ROWS";
        try {
            restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(valueBody(range, values), jsonHeaders()),
                    String.class, sheetId(projectId), range);
        } catch (RestClientException e) {
            throw new MirrorSyncException("Failed to append mirror range " + range, e);
        }
    }

    private Map<String, Object> valueBody(String range, List<List<String>> values) {
        Map<String, Object> body = new HashMap<>();
        body.put("range", range);
        body.put("majorDimension", "ROWS");
        body.put("values", values);
        return body;
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken());
        return headers;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    /**
     * Refresh-token grant; the token is cached until a minute before expiry.
     */
    private synchronized String accessToken() {
        if (accessToken != null && Instant.now().isBefore(accessTokenExpiresAt)) {
            return accessToken;
        }
        BookingProperties.Mirror mirror = properties.safeMirror();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", mirror.clientId());
        body.add("client_secret", mirror.clientSecret());
        body.add("refresh_token", mirror.refreshToken());
        body.add("grant_type", "refresh_token");

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(mirror.safeTokenUri(),
                    new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String token = root.path("access_token").asText(null);
            if (StringUtils.isBlank(token)) {
                throw new MirrorSyncException("Token endpoint returned no access_token");
            }
            long expiresIn = root.path("expires_in").asLong(3600);
            accessToken = token;
            accessTokenExpiresAt = Instant.now().plusSeconds(Math.max(expiresIn - 60, 0));
            log.debug("Refreshed Google access token, expires in {}s", expiresIn);
            return token;
        } catch (RestClientException | JsonProcessingException e) {
            throw new MirrorSyncException("Failed to refresh Google access token", e);
        }
    }

    private String sheetId(String projectId) {
        return properties.project(projectId).map(BookingProperties.Project::sheetId).orElse(null);
    }

    private static String tab(String specialist) {
        return "'" + specialist.replace("'", "''") + "'";
    }

    private static int findRow(List<List<String>> rows, LocalDate date, LocalTime time) {
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (date.equals(parseDate(cell(row, 0))) && time.equals(parseTime(cell(row, 1)))) {
                return i;
            }
        }
        return -1;
    }

    private static MirrorRecord toRecord(List<String> row) {
        return MirrorRecord.fromCells(cell(row, 2), cell(row, 3), cell(row, 4));
    }

    private static String cell(List<String> row, int index) {
        return index < row.size() ? row.get(index) : "";
    }

    private static LocalDate parseDate(String value) {
        if (StringUtils.isBlank(value)) return null;
        try {
            return LocalDate.parse(value.trim(), DATE_IN);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalTime parseTime(String value) {
        if (StringUtils.isBlank(value)) return null;
        try {
            return LocalTime.parse(value.trim(), TIME_IN);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
