package com.menuassist.chat.controller;

import com.menuassist.chat.cache.CacheUnavailableException;
import com.menuassist.chat.service.ConversationNotFoundException;
import com.menuassist.chat.service.RestaurantNotFoundException;
import com.menuassist.chat.service.config.InvalidConfigException;
import com.menuassist.chat.service.speech.SpeechDisabledException;
import com.menuassist.chat.service.speech.SpeechUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidConfigException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidConfig(InvalidConfigException exception) {
        return ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Invalid assistant configuration",
                        "violations", exception.getViolations()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        List<String> violations = exception.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Invalid request",
                        "violations", violations
                ));
    }

    @ExceptionHandler(RestaurantNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRestaurantNotFound(RestaurantNotFoundException exception) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", exception.getMessage()));
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleConversationNotFound(ConversationNotFoundException exception) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", exception.getMessage()));
    }

    @ExceptionHandler(SpeechDisabledException.class)
    public ResponseEntity<Map<String, Object>> handleSpeechDisabled(SpeechDisabledException exception) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of("error", exception.getMessage()));
    }

    @ExceptionHandler(SpeechUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleSpeechUnavailable(SpeechUnavailableException exception) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", exception.getMessage()));
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleCacheUnavailable(CacheUnavailableException exception) {
        log.warn("Cache backend unavailable: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Cache backend is unavailable, retry later"));
    }
}
