package com.signalrelay.ingest.controller;

import com.signalrelay.common.exception.SignalParseException;
import com.signalrelay.common.exception.SignalRelayException;
import com.signalrelay.ingest.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SignalParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(SignalParseException ex) {
        log.warn("422 Unprocessable signal. component={} detail={}", ex.getComponent(), ex.getDetail());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse(ex.getDetail()));
    }

    @ExceptionHandler(SignalRelayException.class)
    public ResponseEntity<ErrorResponse> handleRelayFailure(SignalRelayException ex) {
        log.error("500 Relay failure. component={}", ex.getComponent(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        int code = ex.getStatusCode().value();
        if (code >= 500) {
            log.error("{} {}", code, ex.getReason(), ex);
        } else {
            log.warn("{} {}", code, ex.getReason());
        }
        String detail = ex.getReason() != null ? ex.getReason() : ex.getMessage();
        return ResponseEntity.status(ex.getStatusCode()).body(new ErrorResponse(detail));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("An unexpected error occurred: " + ex.getMessage()));
    }
}
