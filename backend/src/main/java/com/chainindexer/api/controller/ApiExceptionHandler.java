package com.chainindexer.api.controller;

import com.chainindexer.advisory.AgentException;
import com.chainindexer.api.dto.ErrorBody;
import com.chainindexer.query.EntityNotFoundException;
import com.chainindexer.query.InvalidPageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps read API failures to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidPageException.class)
    public ResponseEntity<ErrorBody> handleInvalidPage(InvalidPageException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PAGE", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorBody> handleValidation(HandlerMethodValidationException ex) {
        String error = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream())
                .map(MessageSourceResolvable::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .findFirst()
                .orElse("VALIDATION_ERROR");
        String message = "INVALID_ADDRESS".equals(error) ? "Invalid hex address format" : "Validation failed";
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ErrorBody> handleAgent(AgentException ex) {
        log.warn("Advisory agent request failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("AGENT_UNAVAILABLE", ex.getMessage()));
    }
}
