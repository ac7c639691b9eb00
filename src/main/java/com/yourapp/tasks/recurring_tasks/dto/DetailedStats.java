package com.yourapp.tasks.recurring_tasks.dto;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * {@code scope} is the user id the counts are limited to, or {@code all_users}.
 */
public record DetailedStats(LocalDateTime timestamp,
                            String scope,
                            RecurringTaskStats recurringTasks,
                            Map<String, String> workerStatus) {
}
