package com.yourapp.tasks.recurring_tasks.dto;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public record WorkerHealth(String status,
                           LocalDateTime timestamp,
                           Map<String, String> services,
                           RecurringTaskStats stats,
                           String error) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static WorkerHealth healthy(LocalDateTime timestamp, RecurringTaskStats stats) {
        return new WorkerHealth(HEALTHY, timestamp, services("operational", "operational"), stats, null);
    }

    public static WorkerHealth unhealthy(LocalDateTime timestamp, String error) {
        return new WorkerHealth(UNHEALTHY, timestamp, services("error", "unknown"), null, error);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

    private static Map<String, String> services(String orchestrator, String calculator) {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("recurringTaskOrchestrator", orchestrator);
        services.put("recurrenceCalculator", calculator);
        return services;
    }
}
