package com.agro.fertilizer.web;

import com.agro.fertilizer.exception.BlendingException;
import com.agro.fertilizer.exception.InvalidInputException;
import com.agro.fertilizer.exception.MissingColumnException;
import com.agro.fertilizer.exception.UnknownCropException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Bad tables or parameters. The client has to fix the request.
     */
    @ExceptionHandler({MissingColumnException.class, UnknownCropException.class, InvalidInputException.class})
    public ResponseEntity<Object> handleInputErrors(BlendingException ex) {
        log.warn("Rejected input: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getDetails());
    }

    /**
     * Precheck, infeasible/unbounded solve, timeout. The request was valid but
     * has no optimal blend.
     */
    @ExceptionHandler(BlendingException.class)
    public ResponseEntity<Object> handleNoBlend(BlendingException ex) {
        log.warn("No blend produced: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), ex.getDetails());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be parsed", List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error while optimizing", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred. Check the server log for this timestamp.", List.of());
    }

    private ResponseEntity<Object> body(HttpStatus status, String error, String message, List<String> details) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message,
                "details", details
        ));
    }
}
