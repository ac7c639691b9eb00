package com.yourapp.tasks.recurring_tasks.dto;

import java.time.Duration;
import java.time.LocalDateTime;

public record NextOccurrence(LocalDateTime nextDate, Duration untilNext) {

    public boolean isPast() {
        return untilNext.isNegative();
    }
}
