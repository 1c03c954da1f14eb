package com.herzen.quiz.api;

import com.herzen.quiz.error.ConfigurationException;
import com.herzen.quiz.error.ConflictException;
import com.herzen.quiz.error.NotFoundException;
import com.herzen.quiz.error.PresentationException;
import com.herzen.quiz.error.QuizException;
import com.herzen.quiz.error.TimerSubsystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> conflict(ConflictException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> configuration(ConfigurationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(TimerSubsystemException.class)
    public ResponseEntity<ErrorResponse> timer(TimerSubsystemException e) {
        LOGGER.error("Timer subsystem failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(PresentationException.class)
    public ResponseEntity<ErrorResponse> presentation(PresentationException e) {
        LOGGER.warn("Presentation failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(QuizException.class)
    public ResponseEntity<ErrorResponse> other(QuizException e) {
        LOGGER.error("Unhandled quiz failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, QuizException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.code(), e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
