package com.yourapp.tasks.recurring_tasks.model;

import java.util.Locale;

/**
 * Defines the repeat cadence of a task.
 */
public enum Recurrence {
    /**
     * Does not repeat
     */
    NONE("none", "No recurrence"),

    /**
     * Repeats every day
     */
    DAILY("daily", "Repeats daily"),

    /**
     * Repeats every 7 days
     */
    WEEKLY("weekly", "Repeats weekly"),

    /**
     * Repeats on the same day of every month, clamped to the month's last day
     */
    MONTHLY("monthly", "Repeats monthly");

    private final String value;
    private final String description;

    Recurrence(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRecurring() {
        return this != NONE;
    }

    /**
     * Resolves a wire value such as {@code "weekly"}. A null or blank value means {@link #NONE}.
     *
     * @throws IllegalArgumentException for anything outside none, daily, weekly and monthly
     */
    public static Recurrence fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Recurrence recurrence : values()) {
            if (recurrence.value.equals(normalized)) {
                return recurrence;
            }
        }
        throw new IllegalArgumentException("Invalid repeat type: " + value
                + ". Must be one of: none, daily, weekly, monthly");
    }
}
