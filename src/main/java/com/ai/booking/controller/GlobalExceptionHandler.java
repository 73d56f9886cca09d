package com.ai.booking.controller;

import com.ai.booking.exception.BookingNotFoundException;
import com.ai.booking.exception.MirrorSyncException;
import com.ai.booking.exception.SlotConflictException;
import com.ai.booking.exception.StoreUnavailableException;
import com.ai.booking.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(SlotConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(SlotConflictException e) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, "slot_conflict", e.getMessage());
        response.getBody().put("source", e.getSource().name().toLowerCase());
        return response;
    }

    @ExceptionHandler(BookingNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(BookingNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(MirrorSyncException.class)
    public ResponseEntity<Map<String, Object>> mirror(MirrorSyncException e) {
        log.warn("Mirror unavailable: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "mirror_unavailable", e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> store(StoreUnavailableException e) {
        log.error("Store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", "Please retry later");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
