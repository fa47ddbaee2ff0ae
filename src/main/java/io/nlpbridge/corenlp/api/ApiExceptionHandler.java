package io.nlpbridge.corenlp.api;

import io.nlpbridge.corenlp.exception.AnnotatorUnavailableException;
import io.nlpbridge.corenlp.exception.ModelNotFoundException;
import io.nlpbridge.corenlp.exception.UnresolvedLanguageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnresolvedLanguageException.class)
    public ResponseEntity<Map<String, Object>> handleUnresolvedLanguage(UnresolvedLanguageException e) {
        Map<String, Object> body = new LinkedHashMap<>(errorBody("UNRESOLVED_LANGUAGE", e.getMessage()));
        body.put("language", String.valueOf(e.getToken()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleModelNotFound(ModelNotFoundException e) {
        logger.warn("Missing model file: {}", e.getPath());
        return error(HttpStatus.NOT_FOUND, "MODEL_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(AnnotatorUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleAnnotatorUnavailable(AnnotatorUnavailableException e) {
        Map<String, Object> body = new LinkedHashMap<>(errorBody("ANNOTATOR_UNAVAILABLE", e.getMessage()));
        body.put("annotator", e.getFamily().getId());
        body.put("language", e.getLanguage().getKey());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(errorBody(code, message));
    }

    private Map<String, Object> errorBody(String code, String message) {
        return Map.of(
                "error", code,
                "message", message,
                "timestamp", LocalDateTime.now()
        );
    }
}
