package com.yourapp.tasks.recurring_tasks.exception;

/**
 * A request or task violates a recurrence rule. Always the caller's fault.
 */
public class RecurrenceValidationException extends RuntimeException {

    public RecurrenceValidationException(String message) {
        super(message);
    }
}
