package com.zzf.optrace.api;

import com.zzf.optrace.model.CustomException;
import com.zzf.optrace.model.ErrorResponse;
import com.zzf.optrace.session.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String JSON_UTF8 = "application/json;charset=UTF-8";

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        log.info("api.session.missing msg={}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    /** Rejected variable values and other caller mistakes. */
    @ExceptionHandler(CustomException.class)
    public ResponseEntity<ErrorResponse> handleCustomException(CustomException e) {
        log.info("api.rejected code={} msg={}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is not valid JSON");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception e) {
        log.error("api.error", e);
        String msg = e.getMessage();
        String detail = msg == null || msg.trim().isEmpty()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + msg;
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", detail);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status)
                .header("Content-Type", JSON_UTF8)
                .body(new ErrorResponse(errorCode, message));
    }
}
