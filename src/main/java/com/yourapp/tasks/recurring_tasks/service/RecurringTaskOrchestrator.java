package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.config.RecurrenceProperties;
import com.yourapp.tasks.recurring_tasks.dto.CompletionResult;
import com.yourapp.tasks.recurring_tasks.dto.RecurringTaskStats;
import com.yourapp.tasks.recurring_tasks.dto.RegenerationResult;
import com.yourapp.tasks.recurring_tasks.dto.ReplenishResult;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.exception.TaskNotFoundException;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import com.yourapp.tasks.recurring_tasks.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the task store's recurring chains consistent: generates the forward window when a
 * recurring task is created, advances it on completion, removes a chain on deletion and sweeps
 * instances whose recurring parent has disappeared.
 * <p>
 * There is no locking across operations. Two completions racing on one chain may each append an
 * instance, and a completion racing a deletion may leave an instance behind; {@link #sweepOrphans()}
 * reconciles the latter.
 */
@Service
public class RecurringTaskOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RecurringTaskOrchestrator.class);

    private final TaskRepository taskRepository;
    private final TaskService taskService;
    private final RecurrenceCalculator calculator;
    private final ActivityRecorder activityRecorder;
    private final RecurrenceProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public RecurringTaskOrchestrator(TaskRepository taskRepository,
                                     TaskService taskService,
                                     RecurrenceCalculator calculator,
                                     ActivityRecorder activityRecorder,
                                     RecurrenceProperties properties,
                                     Clock clock,
                                     PlatformTransactionManager transactionManager) {
        this.taskRepository = taskRepository;
        this.taskService = taskService;
        this.calculator = calculator;
        this.activityRecorder = activityRecorder;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Generates the initial forward window for a newly created recurring task. All instances are
     * written in one transaction, so a failure part-way leaves no partial window behind.
     *
     * @return the created instances, empty if the task does not repeat
     */
    @Transactional
    public List<Task> onCreate(Long taskId) {
        Task parent = taskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        if (!parent.getRepeatType().isRecurring()) {
            return Collections.emptyList();
        }
        if (parent.isRecurringInstance()) {
            throw new RecurrenceValidationException("Cannot generate instances from a recurring instance");
        }

        calculator.validateRecurrenceRules(parent);

        List<Task> created = generateWindow(parent, parent.getDueDate(), properties.getWindowSize());
        logger.info("Created {} recurring tasks for task {}", created.size(), taskId);
        return created;
    }

    /**
     * Advances a chain after one of its tasks was completed: re-links the next unfinished instance
     * to the chain root and appends one instance after the last unfinished future one.
     */
    @Transactional
    public CompletionResult onComplete(Long taskId) {
        Task completedTask = taskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        if (!completedTask.getRepeatType().isRecurring()) {
            return CompletionResult.none();
        }

        Long rootId = completedTask.chainRootId();
        Long userId = completedTask.getUserId();

        // The lookup already filters on rootId; the re-stamp repairs drift if the query ever widens.
        Task updatedTask = null;
        Optional<Task> nextInstance = taskRepository
                .findFirstByRecurringParentIdAndCompletedFalseAndDueDateAfterOrderByDueDateAsc(
                        rootId, completedTask.getDueDate());
        if (nextInstance.isPresent()) {
            Task next = nextInstance.get();
            next.setRecurringParentId(rootId);
            updatedTask = taskRepository.save(next);
            notifyQuietly(userId, ActivityRecorder.RECURRING_TASK_UPDATED, updatedTask.getTaskId());
        }

        Task createdTask = null;
        Optional<Task> lastFuture = taskRepository
                .findFirstByRecurringParentIdAndCompletedFalseAndDueDateAfterOrderByDueDateDesc(rootId, now());
        if (lastFuture.isPresent()) {
            LocalDateTime nextDate = calculator.nextOccurrence(lastFuture.get().getDueDate(),
                    completedTask.getRepeatType());
            Task template = taskRepository.findByTaskId(rootId).orElse(completedTask);
            createdTask = taskService.createTask(buildInstance(template, completedTask.getRepeatType(), nextDate, rootId));
            notifyQuietly(userId, ActivityRecorder.RECURRING_TASK_CREATED, createdTask.getTaskId());
        }

        logger.info("Processed completion for recurring task {} (chain {})", taskId, rootId);
        return new CompletionResult(updatedTask, createdTask);
    }

    /**
     * Deletes every instance of the chain the task belongs to. A task with instances of its own is
     * the root; otherwise the task's own recurring parent is.
     *
     * @return number of instances removed, 0 when the task is not part of a chain
     * @throws TaskNotFoundException if nothing references the id and no such task exists for the user
     */
    @Transactional
    public long onDelete(Long taskId, Long userId) {
        Long rootId = taskId;

        if (!taskRepository.existsByRecurringParentIdAndUserId(taskId, userId)) {
            Task task = taskRepository.findByTaskIdAndUserId(taskId, userId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
            if (task.getRecurringParentId() == null) {
                logger.debug("Task {} has no recurring chain, nothing to delete", taskId);
                return 0;
            }
            rootId = task.getRecurringParentId();
        }

        long deleted = taskRepository.deleteByRecurringParentIdAndUserId(rootId, userId);
        if (deleted > 0) {
            notifyQuietly(userId, ActivityRecorder.RECURRING_TASKS_DELETED, rootId);
        }
        logger.info("Deleted {} recurring tasks for task {} (chain {})", deleted, taskId, rootId);
        return deleted;
    }

    /**
     * Removes instances whose recurring parent no longer exists. Each orphan is removed on its own,
     * so a failure on one record is logged and the sweep moves on. Safe to repeat.
     *
     * @return number of orphans removed by this run
     */
    public int sweepOrphans() {
        List<Task> instances = taskRepository.findByRecurringParentIdIsNotNull();
        Map<Long, Boolean> rootExists = new HashMap<>();
        int cleanedCount = 0;

        for (Task instance : instances) {
            Long rootId = instance.getRecurringParentId();
            boolean exists = rootExists.computeIfAbsent(rootId, taskRepository::existsByTaskId);
            if (exists) {
                continue;
            }

            try {
                Boolean removed = transactionTemplate.execute(status -> taskRepository.findById(instance.getId())
                        .map(orphan -> {
                            taskRepository.delete(orphan);
                            return true;
                        })
                        .orElse(false));
                if (Boolean.TRUE.equals(removed)) {
                    cleanedCount++;
                    notifyQuietly(instance.getUserId(), ActivityRecorder.ORPHANED_RECURRING_TASK_CLEANED,
                            instance.getTaskId());
                }
            } catch (RuntimeException e) {
                logger.error("Failed to remove orphaned recurring task {}", instance.getTaskId(), e);
            }
        }

        logger.info("Cleaned up {} orphaned recurring tasks", cleanedCount);
        return cleanedCount;
    }

    /**
     * Tops up every chain that still has unfinished future instances but fewer than the window
     * size. Chains with no unfinished future instance are left alone. Each chain is handled in its
     * own transaction.
     */
    public ReplenishResult replenishWindows() {
        List<Task> parents = taskRepository.findByRepeatTypeNotAndRecurringParentIdIsNull(Recurrence.NONE);
        logger.info("Found {} recurring parent tasks to check", parents.size());

        int generated = 0;
        int failures = 0;
        for (Task parent : parents) {
            try {
                Integer count = transactionTemplate.execute(status -> topUpWindow(parent));
                generated += count != null ? count : 0;
            } catch (RuntimeException e) {
                failures++;
                logger.error("Failed to replenish recurring task {}", parent.getTaskId(), e);
            }
        }

        logger.info("Replenished recurring windows: {} parents checked, {} instances generated, {} failures",
                parents.size(), generated, failures);
        return new ReplenishResult(parents.size(), generated, failures);
    }

    /**
     * Moves a task to a new due date. For a recurring parent the unfinished instances from now on
     * are dropped and a fresh window is generated from the new date.
     */
    @Transactional
    public RegenerationResult reschedule(Long taskId, LocalDateTime newDueDate) {
        if (newDueDate == null) {
            throw new RecurrenceValidationException("Valid new due date is required");
        }
        Task task = taskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        task.setDueDate(newDueDate);
        if (!task.isRecurringParent()) {
            taskRepository.save(task);
            return new RegenerationResult(0, 0, Collections.emptyList());
        }

        calculator.validateRecurrenceRules(task);
        long deleted = deleteOpenInstances(task);
        Task saved = taskRepository.save(task);
        List<Task> instances = generateWindow(saved, saved.getDueDate(), properties.getWindowSize());

        logger.info("Rescheduled task {}: deleted {} future instances and generated {} new instances",
                taskId, deleted, instances.size());
        return new RegenerationResult(deleted, instances.size(), instances);
    }

    /**
     * Changes the repeat type of a task that is not itself an instance, replacing its unfinished
     * future instances. Switching to {@link Recurrence#NONE} only removes them.
     */
    @Transactional
    public RegenerationResult changeRepeatType(Long taskId, Recurrence newRepeatType) {
        if (newRepeatType == null) {
            throw new RecurrenceValidationException("Valid repeat type is required (none, daily, weekly, monthly)");
        }
        Task task = taskRepository.findByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.isRecurringInstance()) {
            throw new RecurrenceValidationException("Cannot change the repeat type of a recurring instance");
        }

        long deleted = task.isRecurringParent() ? deleteOpenInstances(task) : 0;
        task.setRepeatType(newRepeatType);
        calculator.validateRecurrenceRules(task);
        Task saved = taskRepository.save(task);

        List<Task> instances = newRepeatType.isRecurring()
                ? generateWindow(saved, saved.getDueDate(), properties.getWindowSize())
                : Collections.emptyList();

        logger.info("Changed repeat type of task {} to {}: deleted {} instances, generated {}",
                taskId, newRepeatType.getValue(), deleted, instances.size());
        return new RegenerationResult(deleted, instances.size(), instances);
    }

    /**
     * Aggregate counts over all tasks, or over one user's tasks when {@code userId} is given.
     */
    @Transactional(readOnly = true)
    public RecurringTaskStats stats(Long userId) {
        long total = 0;
        long parents = 0;
        long instances = 0;
        Map<Recurrence, Long> byRepeatType = new HashMap<>();

        List<Object[]> rows = userId != null
                ? taskRepository.countByRepeatTypeForUser(userId)
                : taskRepository.countByRepeatType();
        for (Object[] row : rows) {
            Recurrence repeatType = (Recurrence) row[0];
            long count = ((Number) row[1]).longValue();
            long withParent = ((Number) row[2]).longValue();

            total += count;
            instances += withParent;
            if (repeatType != null && repeatType.isRecurring()) {
                parents += count - withParent;
            }
            byRepeatType.merge(repeatType, count, Long::sum);
        }

        return new RecurringTaskStats(total, parents, instances,
                byRepeatType.getOrDefault(Recurrence.DAILY, 0L),
                byRepeatType.getOrDefault(Recurrence.WEEKLY, 0L),
                byRepeatType.getOrDefault(Recurrence.MONTHLY, 0L));
    }

    private int topUpWindow(Task parent) {
        LocalDateTime now = now();
        long open = taskRepository.countByRecurringParentIdAndCompletedFalseAndDueDateAfter(parent.getTaskId(), now);
        if (open == 0 || open >= properties.getWindowSize()) {
            return 0;
        }

        Optional<Task> last = taskRepository
                .findFirstByRecurringParentIdAndCompletedFalseAndDueDateAfterOrderByDueDateDesc(parent.getTaskId(), now);
        if (last.isEmpty()) {
            return 0;
        }

        int missing = (int) (properties.getWindowSize() - open);
        List<Task> created = generateWindow(parent, last.get().getDueDate(), missing);
        logger.info("Generated {} missing instances for recurring task {}", created.size(), parent.getTaskId());
        return created.size();
    }

    private List<Task> generateWindow(Task parent, LocalDateTime from, int count) {
        List<LocalDateTime> dates = calculator.generateOccurrences(from, parent.getRepeatType(), count);
        List<Task> created = new ArrayList<>(dates.size());
        for (LocalDateTime date : dates) {
            Task instance = taskService.createTask(buildInstance(parent, parent.getRepeatType(), date, parent.getTaskId()));
            created.add(instance);
            notifyQuietly(parent.getUserId(), ActivityRecorder.RECURRING_TASK_CREATED, instance.getTaskId());
        }
        return created;
    }

    private long deleteOpenInstances(Task parent) {
        return taskRepository.deleteByRecurringParentIdAndUserIdAndCompletedFalseAndDueDateGreaterThanEqual(
                parent.getTaskId(), parent.getUserId(), now());
    }

    private Task buildInstance(Task template, Recurrence repeatType, LocalDateTime dueDate, Long rootId) {
        Task instance = new Task();
        instance.setUserId(template.getUserId());
        instance.setParentId(template.getParentId());
        instance.setTitle(template.getTitle());
        instance.setDescription(template.getDescription());
        instance.setCategory(template.getCategory());
        instance.setPriority(template.getPriority());
        instance.setLinks(template.getLinks() != null ? new ArrayList<>(template.getLinks()) : new ArrayList<>());
        instance.setAdditionalNotes(template.getAdditionalNotes());
        instance.setDueDate(dueDate);
        instance.setOriginalDueDate(dueDate);
        instance.setRepeatType(repeatType);
        instance.setRecurringParentId(rootId);
        instance.setCompleted(false);
        return instance;
    }

    private void notifyQuietly(Long userId, String action, Long taskId) {
        try {
            activityRecorder.record(userId, action, taskId);
        } catch (RuntimeException e) {
            logger.warn("Failed to record {} for task {}: {}", action, taskId, e.getMessage());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
