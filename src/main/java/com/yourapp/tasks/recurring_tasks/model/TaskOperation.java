package com.yourapp.tasks.recurring_tasks.model;

import java.util.Locale;

/**
 * Lifecycle events the recurrence worker reacts to.
 */
public enum TaskOperation {
    CREATE("create"),
    COMPLETE("complete"),
    DELETE("delete");

    private final String value;

    TaskOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean requiresUser() {
        return this == DELETE;
    }

    /**
     * Activity action recorded when processing this operation fails, e.g. {@code WORKER_COMPLETE_FAILED}.
     */
    public String failureAction() {
        return "WORKER_" + name() + "_FAILED";
    }

    public static TaskOperation fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TaskOperation operation : values()) {
                if (operation.value.equals(normalized)) {
                    return operation;
                }
            }
        }
        throw new IllegalArgumentException("Invalid operation. Must be one of: create, complete, delete");
    }
}
