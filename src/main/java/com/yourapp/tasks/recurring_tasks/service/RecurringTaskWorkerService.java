package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.dto.DetailedStats;
import com.yourapp.tasks.recurring_tasks.dto.DispatchResult;
import com.yourapp.tasks.recurring_tasks.dto.MaintenanceReport;
import com.yourapp.tasks.recurring_tasks.dto.RecurrenceRulesRequest;
import com.yourapp.tasks.recurring_tasks.dto.RecurringTaskStats;
import com.yourapp.tasks.recurring_tasks.dto.WorkerHealth;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceProcessingException;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.TaskOperation;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single entry point for lifecycle events coming from the task API, the internal worker endpoints
 * and the maintenance scheduler.
 */
@Service
@RequiredArgsConstructor
public class RecurringTaskWorkerService {
    private static final Logger logger = LoggerFactory.getLogger(RecurringTaskWorkerService.class);

    private final RecurringTaskOrchestrator orchestrator;
    private final RecurrenceCalculator calculator;
    private final ActivityRecorder activityRecorder;
    private final Clock clock;

    /**
     * Validates raw request values and dispatches the operation. Nothing is orchestrated unless every
     * value is valid.
     *
     * @throws RecurrenceValidationException for a missing or malformed value
     * @throws RecurrenceProcessingException when the orchestration itself fails
     */
    public DispatchResult dispatch(String taskId, String operation, String userId) {
        if (taskId == null || taskId.isBlank()) {
            throw new RecurrenceValidationException("Valid taskId is required");
        }
        if (operation == null || operation.isBlank()) {
            throw new RecurrenceValidationException("Valid operation is required");
        }

        TaskOperation op;
        try {
            op = TaskOperation.fromValue(operation.trim());
        } catch (IllegalArgumentException e) {
            throw new RecurrenceValidationException(e.getMessage());
        }

        boolean hasUser = userId != null && !userId.isBlank();
        if (op.requiresUser() && !hasUser) {
            throw new RecurrenceValidationException("userId is required for " + op.getValue() + " operation");
        }

        long parsedTaskId = parseId(taskId, "taskId");
        Long parsedUserId = hasUser ? parseId(userId, "userId") : null;
        return dispatch(parsedTaskId, op, parsedUserId);
    }

    public DispatchResult dispatch(long taskId, TaskOperation operation, Long userId) {
        if (operation == null) {
            throw new RecurrenceValidationException("Valid operation is required");
        }
        if (operation.requiresUser() && userId == null) {
            throw new RecurrenceValidationException("userId is required for " + operation.getValue() + " operation");
        }

        logger.info("Processing recurring task operation: {} for task {}", operation.getValue(), taskId);
        try {
            Object result;
            switch (operation) {
                case CREATE:
                    result = orchestrator.onCreate(taskId);
                    break;
                case COMPLETE:
                    result = orchestrator.onComplete(taskId);
                    break;
                case DELETE:
                    result = orchestrator.onDelete(taskId, userId);
                    break;
                default:
                    throw new IllegalStateException("Unhandled operation: " + operation);
            }
            return new DispatchResult(true, operation.getValue(), taskId, result);
        } catch (RuntimeException e) {
            logger.error("Worker failed to process {} for task {}", operation.getValue(), taskId, e);
            if (userId != null) {
                try {
                    activityRecorder.record(userId, operation.failureAction(), taskId, e.getMessage());
                } catch (RuntimeException logError) {
                    logger.warn("Failed to record worker failure for task {}: {}", taskId, logError.getMessage());
                }
            }
            throw new RecurrenceProcessingException(operation.getValue(), e);
        }
    }

    public WorkerHealth health() {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            RecurringTaskStats stats = orchestrator.stats(null);
            return WorkerHealth.healthy(now, stats);
        } catch (RuntimeException e) {
            logger.error("Worker health check failed", e);
            return WorkerHealth.unhealthy(now, e.getMessage());
        }
    }

    /**
     * Runs the orphan sweep and reports how many records it removed.
     */
    public MaintenanceReport maintenance() {
        logger.info("Starting recurring task maintenance");
        try {
            int cleaned = orchestrator.sweepOrphans();
            return new MaintenanceReport(LocalDateTime.now(clock), true,
                    new MaintenanceReport.OrphanCleanup(true, cleaned));
        } catch (RuntimeException e) {
            logger.error("Recurring task maintenance failed", e);
            throw new RecurrenceProcessingException("maintenance", e);
        }
    }

    public DetailedStats detailedStats(String userId) {
        Long parsedUserId = userId != null && !userId.isBlank() ? parseId(userId, "userId") : null;
        RecurringTaskStats stats = orchestrator.stats(parsedUserId);

        Map<String, String> workerStatus = new LinkedHashMap<>();
        workerStatus.put("isHealthy", "true");
        workerStatus.put("lastCheck", LocalDateTime.now(clock).toString());

        return new DetailedStats(LocalDateTime.now(clock),
                parsedUserId != null ? parsedUserId.toString() : "all_users",
                stats, workerStatus);
    }

    /**
     * @return the human-readable description of the validated repeat type
     * @throws RecurrenceValidationException naming the violated rule
     */
    public String validateRecurrence(RecurrenceRulesRequest request) {
        if (request == null) {
            throw new RecurrenceValidationException("Task data is required for validation");
        }
        calculator.validateRecurrenceRules(request.repeatType(), request.dueDate(), request.parentId());
        return calculator.describe(Recurrence.fromValue(request.repeatType()));
    }

    private long parseId(String value, String field) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new RecurrenceValidationException("Valid " + field + " is required");
        }
    }
}
