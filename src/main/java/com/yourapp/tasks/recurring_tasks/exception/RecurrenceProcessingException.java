package com.yourapp.tasks.recurring_tasks.exception;

/**
 * Wraps any failure raised while the worker processed an operation.
 */
public class RecurrenceProcessingException extends RuntimeException {

    private final String operation;

    public RecurrenceProcessingException(String operation, Throwable cause) {
        super("Worker failed to process " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
