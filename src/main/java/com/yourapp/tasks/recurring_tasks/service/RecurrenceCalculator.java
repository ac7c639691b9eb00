package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.config.RecurrenceProperties;
import com.yourapp.tasks.recurring_tasks.dto.NextOccurrence;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Date arithmetic for recurring tasks. Every method is a pure function of its arguments; the clock
 * is only read by rule validation.
 */
@Component
public class RecurrenceCalculator {

    private final Clock clock;
    private final RecurrenceProperties properties;

    public RecurrenceCalculator(Clock clock, RecurrenceProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Calculates the occurrence following {@code baseDate}.
     * Monthly recurrence keeps the day of month and falls back to the last day of a shorter month,
     * so Jan 31 becomes Feb 29 in a leap year and Feb 28 otherwise.
     *
     * @param baseDate the date to calculate from
     * @param repeatType daily, weekly or monthly
     * @return the next occurrence, time of day unchanged
     * @throws IllegalArgumentException if the date is missing or the repeat type does not repeat
     */
    public LocalDateTime nextOccurrence(LocalDateTime baseDate, Recurrence repeatType) {
        if (baseDate == null) {
            throw new IllegalArgumentException("Valid base date is required");
        }
        if (repeatType == null || !repeatType.isRecurring()) {
            throw new IllegalArgumentException("Invalid repeat type: " + repeatType
                    + ". Must be one of: daily, weekly, monthly");
        }

        switch (repeatType) {
            case DAILY:
                return baseDate.plusDays(1);
            case WEEKLY:
                return baseDate.plusWeeks(1);
            case MONTHLY:
                // plusMonths clamps to the last valid day of the target month
                return baseDate.plusMonths(1);
            default:
                throw new IllegalArgumentException("Unsupported repeat type: " + repeatType);
        }
    }

    /**
     * Generates {@code count} consecutive occurrences strictly after {@code start}.
     */
    public List<LocalDateTime> generateOccurrences(LocalDateTime start, Recurrence repeatType, int count) {
        if (start == null) {
            throw new IllegalArgumentException("Valid start date is required");
        }
        if (count < 1) {
            throw new IllegalArgumentException("Count must be a positive integer");
        }
        if (count > properties.getMaxOccurrences()) {
            throw new IllegalArgumentException("Count cannot exceed " + properties.getMaxOccurrences() + " occurrences");
        }

        List<LocalDateTime> occurrences = new ArrayList<>(count);
        LocalDateTime current = start;
        for (int i = 0; i < count; i++) {
            current = nextOccurrence(current, repeatType);
            occurrences.add(current);
        }
        return occurrences;
    }

    /**
     * Checks that a task may carry its repeat type. Tasks that do not repeat are always valid.
     *
     * @return true when the rules hold
     * @throws RecurrenceValidationException naming the first violated rule
     */
    public boolean validateRecurrenceRules(Task task) {
        if (task == null) {
            throw new RecurrenceValidationException("Valid task object is required");
        }
        Recurrence repeatType = task.getRepeatType();
        if (repeatType == null || !repeatType.isRecurring()) {
            return true;
        }

        if (task.getDueDate() == null) {
            throw new RecurrenceValidationException("Due date is required for recurring tasks");
        }

        LocalDateTime earliestAllowed = LocalDateTime.now(clock).minus(properties.getPastDueTolerance());
        if (task.getDueDate().isBefore(earliestAllowed)) {
            throw new RecurrenceValidationException(
                    "Due date for recurring tasks should not be more than 1 day in the past");
        }

        if (task.isSubtask()) {
            throw new RecurrenceValidationException("Sub-tasks cannot have recurring patterns");
        }
        return true;
    }

    /**
     * Validates raw request values: the repeat type must be known and the due date must parse as an
     * ISO date-time, with or without an offset.
     */
    public boolean validateRecurrenceRules(String repeatType, String dueDate, Long parentId) {
        Task candidate = new Task();
        try {
            candidate.setRepeatType(Recurrence.fromValue(repeatType));
        } catch (IllegalArgumentException e) {
            throw new RecurrenceValidationException(e.getMessage());
        }
        if (dueDate != null && !dueDate.isBlank()) {
            candidate.setDueDate(parseDueDate(dueDate));
        }
        candidate.setParentId(parentId);
        return validateRecurrenceRules(candidate);
    }

    /**
     * Lists occurrences from {@code start} (inclusive) up to and including {@code end}.
     * Stops after the configured iteration ceiling.
     */
    public List<LocalDateTime> occurrencesInPeriod(LocalDateTime start, LocalDateTime end, Recurrence repeatType) {
        if (start == null) {
            throw new IllegalArgumentException("Valid start date is required");
        }
        if (end == null) {
            throw new IllegalArgumentException("Valid end date is required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("End date must be after start date");
        }

        List<LocalDateTime> occurrences = new ArrayList<>();
        LocalDateTime current = start;
        int iterations = 0;
        while (!current.isAfter(end) && iterations < properties.getMaxPeriodIterations()) {
            occurrences.add(current);
            current = nextOccurrence(current, repeatType);
            iterations++;
        }
        return occurrences;
    }

    public NextOccurrence timeUntilNext(LocalDateTime baseDate, Recurrence repeatType) {
        LocalDateTime next = nextOccurrence(baseDate, repeatType);
        return new NextOccurrence(next, Duration.between(LocalDateTime.now(clock), next));
    }

    public String describe(Recurrence repeatType) {
        return repeatType != null ? repeatType.getDescription() : "Unknown recurrence pattern";
    }

    public boolean isWeekend(LocalDateTime date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * Moves a weekend date forward to Monday. Never applied to generated instances automatically.
     */
    public LocalDateTime adjustToBusinessDay(LocalDateTime date) {
        LocalDateTime adjusted = date;
        while (isWeekend(adjusted)) {
            adjusted = adjusted.plusDays(1);
        }
        return adjusted;
    }

    private LocalDateTime parseDueDate(String value) {
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException e) {
                throw new RecurrenceValidationException("Due date must be a valid date");
            }
        }
    }
}
