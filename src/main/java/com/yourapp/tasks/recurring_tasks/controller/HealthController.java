package com.yourapp.tasks.recurring_tasks.controller;

import com.yourapp.tasks.recurring_tasks.dto.WorkerHealth;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskWorkerService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController implements HealthIndicator {

    private final RecurringTaskWorkerService workerService;

    @Override
    public Health health() {
        WorkerHealth workerHealth = workerService.health();
        Health.Builder builder = workerHealth.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("timestamp", workerHealth.timestamp())
                .withDetail("services", workerHealth.services());
        if (workerHealth.stats() != null) {
            builder.withDetail("stats", workerHealth.stats());
        }
        if (workerHealth.error() != null) {
            builder.withDetail("error", workerHealth.error());
        }
        return builder.build();
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        WorkerHealth workerHealth = workerService.health();
        Map<String, Object> response = new HashMap<>();
        response.put("status", workerHealth.isHealthy() ? "UP" : "DOWN");
        response.put("timestamp", workerHealth.timestamp());
        response.put("service", "Recurring Tasks");
        response.put("worker", workerHealth);
        return ResponseEntity.status(workerHealth.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(response);
    }
}
