package com.example.Botlyne.controller;

import com.example.Botlyne.exception.AccessDeniedException;
import com.example.Botlyne.exception.ConversationNotFoundException;
import com.example.Botlyne.exception.IllegalConversationStateException;
import com.example.Botlyne.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorBody(int status, String error, String message, Instant timestamp) {
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    public ResponseEntity<ErrorBody> notFound(ConversationNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorBody> forbidden(AccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return body(HttpStatus.FORBIDDEN, "Access denied");
    }

    @ExceptionHandler({
            InvalidRequestException.class,
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorBody> badRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, e instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : e.getMessage());
    }

    @ExceptionHandler({IllegalConversationStateException.class, ObjectOptimisticLockingFailureException.class})
    public ResponseEntity<ErrorBody> conflict(Exception e) {
        log.debug("Conflict: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    private static ResponseEntity<ErrorBody> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorBody(status.value(), status.getReasonPhrase(), message, Instant.now()));
    }
}
