package org.be.trackerservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestionException(IngestionException e) {
        log.error("수집 예외 발생", e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INGESTION_ERROR", e.getMessage());
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAlertNotFoundException(AlertNotFoundException e) {
        log.warn("알림을 찾을 수 없음: {}", e.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "ALERT_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(MentionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleMentionNotFoundException(MentionNotFoundException e) {
        log.warn("멘션을 찾을 수 없음: {}", e.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "MENTION_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(AlertConfigNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAlertConfigNotFoundException(AlertConfigNotFoundException e) {
        log.warn("알림 설정을 찾을 수 없음: {}", e.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "ALERT_CONFIG_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("요청 검증 실패: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        log.warn("잘못된 요청: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        log.error("예상치 못한 예외 발생", e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "내부 서버 오류가 발생했습니다");
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", LocalDateTime.now());
        return ResponseEntity.status(status).body(body);
    }
}
