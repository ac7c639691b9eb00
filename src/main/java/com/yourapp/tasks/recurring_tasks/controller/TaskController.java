package com.yourapp.tasks.recurring_tasks.controller;

import com.yourapp.tasks.recurring_tasks.dto.DispatchResult;
import com.yourapp.tasks.recurring_tasks.dto.DueDateChangeRequest;
import com.yourapp.tasks.recurring_tasks.dto.RegenerationResult;
import com.yourapp.tasks.recurring_tasks.dto.RepeatTypeChangeRequest;
import com.yourapp.tasks.recurring_tasks.dto.TaskRequest;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import com.yourapp.tasks.recurring_tasks.model.TaskOperation;
import com.yourapp.tasks.recurring_tasks.service.RecurrenceCalculator;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskOrchestrator;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskWorkerService;
import com.yourapp.tasks.recurring_tasks.service.TaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task CRUD. Each change is stored first and then handed to the recurrence worker, except deletion,
 * which removes the chain before the record itself.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;
    private final RecurrenceCalculator calculator;
    private final RecurringTaskWorkerService workerService;
    private final RecurringTaskOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody TaskRequest request) {
        Task task = taskService.fromRequest(request);
        calculator.validateRecurrenceRules(task);

        Task saved = taskService.createTask(task);
        Object instances = Collections.emptyList();
        if (saved.getRepeatType().isRecurring()) {
            instances = workerService.dispatch(saved.getTaskId(), TaskOperation.CREATE, saved.getUserId()).result();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", saved);
        body.put("recurringInstances", instances);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Task> get(@PathVariable Long taskId) {
        return taskService.findTask(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<Map<String, Object>> complete(@PathVariable Long taskId) {
        boolean alreadyCompleted = taskService.findTask(taskId).map(Task::isCompleted).orElse(false);
        Task task = taskService.completeTask(taskId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", task);
        if (alreadyCompleted) {
            // repeated completion must not advance the window again
            body.put("recurrence", null);
            return ResponseEntity.ok(body);
        }
        DispatchResult result = workerService.dispatch(taskId, TaskOperation.COMPLETE, task.getUserId());
        body.put("recurrence", result.result());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long taskId, @RequestParam Long userId) {
        DispatchResult result = workerService.dispatch(taskId, TaskOperation.DELETE, userId);
        boolean deleted = taskService.deleteTask(taskId, userId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deleted", deleted);
        body.put("recurringTasksDeleted", result.result());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/{taskId}/due-date")
    public ResponseEntity<RegenerationResult> reschedule(@PathVariable Long taskId,
                                                         @RequestBody DueDateChangeRequest request) {
        return ResponseEntity.ok(orchestrator.reschedule(taskId, request.dueDate()));
    }

    @PutMapping("/{taskId}/repeat-type")
    public ResponseEntity<RegenerationResult> changeRepeatType(@PathVariable Long taskId,
                                                               @RequestBody RepeatTypeChangeRequest request) {
        if (request.repeatType() == null || request.repeatType().isBlank()) {
            throw new RecurrenceValidationException("Valid repeat type is required (none, daily, weekly, monthly)");
        }
        Recurrence repeatType = Recurrence.fromValue(request.repeatType());
        return ResponseEntity.ok(orchestrator.changeRepeatType(taskId, repeatType));
    }
}
