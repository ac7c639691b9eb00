package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.dto.TaskRequest;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.exception.TaskNotFoundException;
import com.yourapp.tasks.recurring_tasks.model.Priority;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import com.yourapp.tasks.recurring_tasks.repository.TaskRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Task record storage. Every new record gets its {@code taskId} from the {@link SequenceAllocator}.
 */
@Service
public class TaskService {

    private final TaskRepository repo;
    private final SequenceAllocator sequenceAllocator;
    private final Clock clock;

    @Autowired
    public TaskService(TaskRepository repo, SequenceAllocator sequenceAllocator, Clock clock) {
        this.repo = repo;
        this.sequenceAllocator = sequenceAllocator;
        this.clock = clock;
    }

    @Transactional
    public Task createTask(Task task) {
        if (task.getUserId() == null) {
            throw new RecurrenceValidationException("userId is required");
        }
        if (task.getTitle() == null || task.getTitle().isBlank()) {
            throw new RecurrenceValidationException("title is required");
        }
        if (task.getDueDate() == null) {
            throw new RecurrenceValidationException("dueDate is required");
        }
        if (task.getRepeatType() == null) {
            task.setRepeatType(Recurrence.NONE);
        }
        if (task.getPriority() == null) {
            task.setPriority(Priority.MEDIUM);
        }
        task.setTaskId(sequenceAllocator.next(SequenceAllocator.TASK_COUNTER));
        return repo.save(task);
    }

    public Task fromRequest(TaskRequest request) {
        Task task = new Task();
        task.setUserId(request.userId());
        task.setTitle(request.title() != null ? request.title().trim() : null);
        task.setDescription(request.description());
        task.setCategory(request.category());
        task.setPriority(request.priority());
        task.setDueDate(request.dueDate());
        task.setParentId(request.parentId());
        task.setAdditionalNotes(request.additionalNotes());
        if (request.links() != null) {
            task.setLinks(new ArrayList<>(request.links()));
        }
        try {
            task.setRepeatType(Recurrence.fromValue(request.repeatType()));
        } catch (IllegalArgumentException e) {
            throw new RecurrenceValidationException(e.getMessage());
        }
        return task;
    }

    @Transactional(readOnly = true)
    public Optional<Task> findTask(Long taskId) {
        return repo.findByTaskId(taskId);
    }

    @Transactional(readOnly = true)
    public Task getTask(Long taskId) {
        return repo.findByTaskId(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Transactional
    public Task completeTask(Long taskId) {
        Task task = getTask(taskId);
        if (!task.isCompleted()) {
            task.setCompleted(true);
            task.setCompletionTimestamp(LocalDateTime.now(clock));
            task = repo.save(task);
        }
        return task;
    }

    /**
     * @return true if the task existed for this user and was removed
     */
    @Transactional
    public boolean deleteTask(Long taskId, Long userId) {
        Optional<Task> task = repo.findByTaskIdAndUserId(taskId, userId);
        task.ifPresent(repo::delete);
        return task.isPresent();
    }
}
