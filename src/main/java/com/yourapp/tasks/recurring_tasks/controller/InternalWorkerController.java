package com.yourapp.tasks.recurring_tasks.controller;

import com.yourapp.tasks.recurring_tasks.dto.DispatchResult;
import com.yourapp.tasks.recurring_tasks.dto.MaintenanceReport;
import com.yourapp.tasks.recurring_tasks.dto.RecurrenceRequest;
import com.yourapp.tasks.recurring_tasks.dto.RecurrenceRulesRequest;
import com.yourapp.tasks.recurring_tasks.dto.WorkerHealth;
import com.yourapp.tasks.recurring_tasks.model.UserActivity;
import com.yourapp.tasks.recurring_tasks.service.ActivityLogService;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskWorkerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoints used by other back-end components to drive the recurrence worker directly.
 */
@RestController
@RequestMapping("/internal/worker")
@RequiredArgsConstructor
public class InternalWorkerController {

    private final RecurringTaskWorkerService workerService;
    private final ActivityLogService activityLogService;

    @PostMapping("/tasks/recurrence")
    public ResponseEntity<Map<String, Object>> processRecurrence(@RequestBody RecurrenceRequest request) {
        DispatchResult result = workerService.dispatch(request.taskId(), request.operation(), request.userId());
        return ResponseEntity.ok(success("Successfully processed " + result.operation() + " for task " + result.taskId(),
                result));
    }

    @PostMapping("/tasks/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        MaintenanceReport report = workerService.maintenance();
        return ResponseEntity.ok(success("Cleanup operations completed successfully", report));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        WorkerHealth health = workerService.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", health.isHealthy());
        body.put("data", health);
        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(@RequestParam(required = false) String userId) {
        return ResponseEntity.ok(success(null, workerService.detailedStats(userId)));
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody RecurrenceRulesRequest request) {
        String description = workerService.validateRecurrence(request);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("valid", true);
        data.put("description", description);
        data.put("task", request);
        return ResponseEntity.ok(success(null, data));
    }

    @GetMapping("/activity")
    public ResponseEntity<List<UserActivity>> activity(@RequestParam Long userId) {
        return ResponseEntity.ok(activityLogService.recentActivity(userId));
    }

    private static Map<String, Object> success(String message, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (message != null) {
            body.put("message", message);
        }
        body.put("data", data);
        return body;
    }
}
