package com.yourapp.tasks.recurring_tasks.controller;

import com.yourapp.tasks.recurring_tasks.exception.RecurrenceProcessingException;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.exception.SequenceAllocationException;
import com.yourapp.tasks.recurring_tasks.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to {@code {success:false, error, message}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RecurrenceValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RecurrenceValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * A missing task or invalid input surfaced through the worker keeps its own status; anything
     * else is a server error.
     */
    @ExceptionHandler(RecurrenceProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleProcessing(RecurrenceProcessingException e) {
        Throwable cause = e.getCause();
        if (cause instanceof TaskNotFoundException) {
            return error(HttpStatus.NOT_FOUND, cause.getMessage());
        }
        if (cause instanceof RecurrenceValidationException || cause instanceof IllegalArgumentException) {
            return error(HttpStatus.BAD_REQUEST, cause.getMessage());
        }
        logger.error("Recurring task processing failed for operation {}", e.getOperation(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(SequenceAllocationException.class)
    public ResponseEntity<Map<String, Object>> handleAllocation(SequenceAllocationException e) {
        logger.error("Identifier allocation failed for counter {}", e.getCounterName(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
