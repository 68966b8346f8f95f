package com.example.gdprpdp.http;

import com.example.gdprpdp.service.PdpException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body(PdpException.Code.INVALID_REQUEST.name(), message(ex), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .sorted()
                .toList();
        return ResponseEntity.badRequest().body(body(
                PdpException.Code.INVALID_REQUEST.name(), "Request body failed validation", violations));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return ResponseEntity.badRequest().body(body(
                PdpException.Code.INVALID_REQUEST.name(), "Malformed request: " + message(ex), null));
    }

    @ExceptionHandler(PdpException.class)
    public ResponseEntity<Map<String, Object>> domainError(PdpException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case SCHEMA_INVALID, INVALID_REQUEST -> status = HttpStatus.BAD_REQUEST;
            case POLICY_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case POLICY_ALREADY_EXISTS, CHAIN_VERIFICATION_FAILED -> status = HttpStatus.CONFLICT;
            case CONCURRENT_WRITE_CONFLICT -> status = HttpStatus.SERVICE_UNAVAILABLE;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", ex.getCode(), ex);
        }

        return ResponseEntity.status(status)
                .body(body(ex.getCode().name(), ex.getMessage(),
                        ex.getViolations().isEmpty() ? null : ex.getViolations()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", message(ex), null));
    }

    private static Map<String, Object> body(String code, String message, List<String> violations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        if (violations != null) {
            body.put("violations", violations);
        }
        return body;
    }

    private static String message(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
