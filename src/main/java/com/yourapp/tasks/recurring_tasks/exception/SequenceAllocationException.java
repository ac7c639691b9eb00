package com.yourapp.tasks.recurring_tasks.exception;

public class SequenceAllocationException extends RuntimeException {

    private final String counterName;

    public SequenceAllocationException(String counterName, Throwable cause) {
        super("Failed to allocate sequence value for counter '" + counterName + "': " + cause.getMessage(), cause);
        this.counterName = counterName;
    }

    public String getCounterName() {
        return counterName;
    }
}
