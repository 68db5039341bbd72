package uk.investir.cgt.web.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.investir.cgt.core.exception.IncompleteRecordsException;
import uk.investir.cgt.core.exception.InvestirException;
import uk.investir.cgt.web.dto.ErrorResponse;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IncompleteRecordsException.class)
    public ResponseEntity<ErrorResponse> handleIncompleteRecords(IncompleteRecordsException ex) {
        log.warn("Incomplete records: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Incomplete Records", ex.getMessage());
    }

    @ExceptionHandler(InvestirException.class)
    public ResponseEntity<ErrorResponse> handleInvestirException(InvestirException ex) {
        log.warn("Invalid transaction history: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Transaction History", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
