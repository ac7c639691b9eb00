package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.config.RecurrenceProperties;
import com.yourapp.tasks.recurring_tasks.dto.CompletionResult;
import com.yourapp.tasks.recurring_tasks.dto.RecurringTaskStats;
import com.yourapp.tasks.recurring_tasks.dto.RegenerationResult;
import com.yourapp.tasks.recurring_tasks.dto.ReplenishResult;
import com.yourapp.tasks.recurring_tasks.exception.RecurrenceValidationException;
import com.yourapp.tasks.recurring_tasks.exception.TaskNotFoundException;
import com.yourapp.tasks.recurring_tasks.model.Priority;
import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import com.yourapp.tasks.recurring_tasks.repository.SequenceCounterRepository;
import com.yourapp.tasks.recurring_tasks.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Runs the orchestrator against an in-memory database. The clock is fixed one day before the
 * parents' due dates so every generated instance lies in the future.
 */
@DataJpaTest
class RecurringTaskOrchestratorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 10, 8, 0);
    private static final LocalDateTime DUE = LocalDateTime.of(2024, 1, 11, 9, 0);
    private static final Long USER = 1L;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private SequenceCounterRepository counterRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TaskService taskService;
    private ActivityRecorder activityRecorder;
    private RecurringTaskOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        RecurrenceProperties properties = new RecurrenceProperties();
        taskService = new TaskService(taskRepository, new SequenceAllocator(counterRepository), clock);
        activityRecorder = mock(ActivityRecorder.class);
        orchestrator = new RecurringTaskOrchestrator(taskRepository, taskService,
                new RecurrenceCalculator(clock, properties), activityRecorder, properties, clock, transactionManager);
    }

    @Nested
    @DisplayName("onCreate")
    class OnCreate {

        @Test
        @DisplayName("a daily parent gets three instances one, two and three days out")
        void generatesWindow() {
            Task parent = newTask(Recurrence.DAILY);

            List<Task> instances = orchestrator.onCreate(parent.getTaskId());

            assertEquals(3, instances.size());
            assertEquals(List.of(DUE.plusDays(1), DUE.plusDays(2), DUE.plusDays(3)),
                    instances.stream().map(Task::getDueDate).collect(Collectors.toList()));
            for (Task instance : instances) {
                assertEquals(parent.getTaskId(), instance.getRecurringParentId());
                assertEquals("Water plants", instance.getTitle());
                assertEquals("home", instance.getCategory());
                assertEquals(Priority.HIGH, instance.getPriority());
                assertEquals(Recurrence.DAILY, instance.getRepeatType());
                assertEquals(List.of("https://example.com/plants"), instance.getLinks());
                assertEquals("use rain water", instance.getAdditionalNotes());
                assertEquals(instance.getDueDate(), instance.getOriginalDueDate());
                assertFalse(instance.isCompleted());
                assertNotEquals(parent.getTaskId(), instance.getTaskId());
            }
            assertEquals(3, taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).size());
            verify(activityRecorder, times(3))
                    .record(eq(USER), eq(ActivityRecorder.RECURRING_TASK_CREATED), anyLong());
        }

        @Test
        @DisplayName("a non-recurring task gets nothing")
        void nonRecurring() {
            Task task = newTask(Recurrence.NONE);

            assertTrue(orchestrator.onCreate(task.getTaskId()).isEmpty());
            verifyNoInteractions(activityRecorder);
        }

        @Test
        @DisplayName("a failing activity log does not stop generation")
        void survivesRecorderFailure() {
            doThrow(new IllegalStateException("log store down"))
                    .when(activityRecorder).record(anyLong(), anyString(), anyLong());
            Task parent = newTask(Recurrence.WEEKLY);

            assertEquals(3, orchestrator.onCreate(parent.getTaskId()).size());
        }

        @Test
        @DisplayName("a recurring sub-task is rejected and nothing is generated")
        void rejectsSubtask() {
            Task parent = newTask(Recurrence.NONE);
            Task subtask = taskTemplate(Recurrence.WEEKLY);
            subtask.setParentId(parent.getTaskId());
            subtask = taskService.createTask(subtask);
            Long subtaskId = subtask.getTaskId();

            assertThrows(RecurrenceValidationException.class, () -> orchestrator.onCreate(subtaskId));
            assertTrue(taskRepository.findByRecurringParentIdOrderByDueDateAsc(subtaskId).isEmpty());
        }

        @Test
        @DisplayName("an instance cannot seed its own chain")
        void rejectsInstance() {
            Task parent = newTask(Recurrence.DAILY);
            Task instance = orchestrator.onCreate(parent.getTaskId()).get(0);

            assertThrows(RecurrenceValidationException.class, () -> orchestrator.onCreate(instance.getTaskId()));
        }

        @Test
        @DisplayName("a missing task is reported")
        void missingTask() {
            assertThrows(TaskNotFoundException.class, () -> orchestrator.onCreate(987654L));
        }
    }

    @Nested
    @DisplayName("onComplete")
    class OnComplete {

        @Test
        @DisplayName("completing the earliest instance appends one at four days and keeps three open")
        void advancesWindow() {
            Task parent = newTask(Recurrence.DAILY);
            List<Task> instances = orchestrator.onCreate(parent.getTaskId());
            Task first = taskService.completeTask(instances.get(0).getTaskId());

            CompletionResult result = orchestrator.onComplete(first.getTaskId());

            assertNotNull(result.createdTask());
            assertEquals(DUE.plusDays(4), result.createdTask().getDueDate());
            assertEquals(parent.getTaskId(), result.createdTask().getRecurringParentId());
            assertNotNull(result.updatedTask());
            assertEquals(instances.get(1).getTaskId(), result.updatedTask().getTaskId());
            assertEquals(parent.getTaskId(), result.updatedTask().getRecurringParentId());
            assertEquals(3, taskRepository.countByRecurringParentIdAndCompletedFalseAndDueDateAfter(
                    parent.getTaskId(), NOW));
            verify(activityRecorder).record(USER, ActivityRecorder.RECURRING_TASK_UPDATED, instances.get(1).getTaskId());
        }

        @Test
        @DisplayName("completing the parent re-links the first instance and appends one")
        void completingParent() {
            Task parent = newTask(Recurrence.WEEKLY);
            List<Task> instances = orchestrator.onCreate(parent.getTaskId());
            taskService.completeTask(parent.getTaskId());

            CompletionResult result = orchestrator.onComplete(parent.getTaskId());

            assertEquals(instances.get(0).getTaskId(), result.updatedTask().getTaskId());
            assertEquals(DUE.plusWeeks(4), result.createdTask().getDueDate());
        }

        @Test
        @DisplayName("a non-recurring task is a no-op")
        void nonRecurring() {
            Task task = newTask(Recurrence.NONE);

            CompletionResult result = orchestrator.onComplete(task.getTaskId());

            assertNull(result.updatedTask());
            assertNull(result.createdTask());
        }

        @Test
        @DisplayName("a chain without open future instances is left exhausted")
        void exhaustedChain() {
            Task parent = newTask(Recurrence.DAILY);
            for (Task instance : orchestrator.onCreate(parent.getTaskId())) {
                taskService.completeTask(instance.getTaskId());
            }

            CompletionResult result = orchestrator.onComplete(parent.getTaskId());

            assertNull(result.createdTask());
        }

        @Test
        @DisplayName("a missing task is reported")
        void missingTask() {
            assertThrows(TaskNotFoundException.class, () -> orchestrator.onComplete(987654L));
        }
    }

    @Nested
    @DisplayName("onDelete")
    class OnDelete {

        @Test
        @DisplayName("deleting the parent removes every instance")
        void fromParent() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());

            assertEquals(3, orchestrator.onDelete(parent.getTaskId(), USER));
            assertTrue(taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).isEmpty());
            assertTrue(taskRepository.existsByTaskId(parent.getTaskId()));
            verify(activityRecorder).record(USER, ActivityRecorder.RECURRING_TASKS_DELETED, parent.getTaskId());
        }

        @Test
        @DisplayName("deleting a child removes the whole chain")
        void fromChild() {
            Task parent = newTask(Recurrence.MONTHLY);
            List<Task> instances = orchestrator.onCreate(parent.getTaskId());

            assertEquals(3, orchestrator.onDelete(instances.get(1).getTaskId(), USER));
            assertTrue(taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).isEmpty());
        }

        @Test
        @DisplayName("a task outside any chain deletes nothing")
        void noChain() {
            Task task = newTask(Recurrence.NONE);

            assertEquals(0, orchestrator.onDelete(task.getTaskId(), USER));
            verifyNoInteractions(activityRecorder);
        }

        @Test
        @DisplayName("another user's chain is not found")
        void otherUser() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());

            assertThrows(TaskNotFoundException.class, () -> orchestrator.onDelete(parent.getTaskId(), 99L));
            assertEquals(3, taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).size());
        }
    }

    @Nested
    @DisplayName("sweepOrphans")
    class SweepOrphans {

        @Test
        @DisplayName("an empty store sweeps nothing")
        void emptyStore() {
            assertEquals(0, orchestrator.sweepOrphans());
        }

        @Test
        @DisplayName("removes orphans once and is a no-op when repeated")
        void idempotent() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());
            Task kept = newTask(Recurrence.WEEKLY);
            orchestrator.onCreate(kept.getTaskId());
            taskRepository.delete(parent);

            assertEquals(3, orchestrator.sweepOrphans());
            assertEquals(0, orchestrator.sweepOrphans());
            assertEquals(3, taskRepository.findByRecurringParentIdOrderByDueDateAsc(kept.getTaskId()).size());
            verify(activityRecorder, times(3))
                    .record(eq(USER), eq(ActivityRecorder.ORPHANED_RECURRING_TASK_CLEANED), anyLong());
        }

        @Test
        @DisplayName("a stable chain is left alone")
        void stableChain() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());

            assertEquals(0, orchestrator.sweepOrphans());
            assertEquals(3, taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).size());
        }
    }

    @Nested
    @DisplayName("replenishWindows")
    class ReplenishWindows {

        @Test
        @DisplayName("tops a shrunken window back up after its latest instance")
        void topsUp() {
            Task parent = newTask(Recurrence.DAILY);
            List<Task> instances = orchestrator.onCreate(parent.getTaskId());
            taskRepository.delete(instances.get(0));

            ReplenishResult result = orchestrator.replenishWindows();

            assertEquals(1, result.instancesGenerated());
            assertEquals(0, result.failures());
            List<Task> chain = taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId());
            assertEquals(List.of(DUE.plusDays(2), DUE.plusDays(3), DUE.plusDays(4)),
                    chain.stream().map(Task::getDueDate).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("full and exhausted chains are untouched")
        void leavesFullAndExhaustedChains() {
            Task full = newTask(Recurrence.DAILY);
            orchestrator.onCreate(full.getTaskId());
            Task exhausted = newTask(Recurrence.WEEKLY);
            for (Task instance : orchestrator.onCreate(exhausted.getTaskId())) {
                taskService.completeTask(instance.getTaskId());
            }

            ReplenishResult result = orchestrator.replenishWindows();

            assertEquals(2, result.parentsChecked());
            assertEquals(0, result.instancesGenerated());
        }
    }

    @Nested
    @DisplayName("reschedule and changeRepeatType")
    class Regeneration {

        @Test
        @DisplayName("moving a parent's due date regenerates its window")
        void reschedule() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());
            LocalDateTime newDue = LocalDateTime.of(2024, 1, 20, 9, 0);

            RegenerationResult result = orchestrator.reschedule(parent.getTaskId(), newDue);

            assertEquals(3, result.deletedCount());
            assertEquals(3, result.generatedCount());
            assertEquals(List.of(newDue.plusDays(1), newDue.plusDays(2), newDue.plusDays(3)),
                    taskRepository.findByRecurringParentIdOrderByDueDateAsc(parent.getTaskId()).stream()
                            .map(Task::getDueDate).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("rescheduling a plain task only moves it")
        void reschedulePlainTask() {
            Task task = newTask(Recurrence.NONE);
            LocalDateTime newDue = LocalDateTime.of(2024, 2, 1, 9, 0);

            RegenerationResult result = orchestrator.reschedule(task.getTaskId(), newDue);

            assertEquals(0, result.generatedCount());
            assertEquals(newDue, taskRepository.findByTaskId(task.getTaskId()).orElseThrow().getDueDate());
        }

        @Test
        @DisplayName("switching to weekly replaces daily instances")
        void switchToWeekly() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());

            RegenerationResult result = orchestrator.changeRepeatType(parent.getTaskId(), Recurrence.WEEKLY);

            assertEquals(3, result.deletedCount());
            assertEquals(List.of(DUE.plusWeeks(1), DUE.plusWeeks(2), DUE.plusWeeks(3)),
                    result.newInstances().stream().map(Task::getDueDate).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("switching to none only removes instances")
        void switchToNone() {
            Task parent = newTask(Recurrence.DAILY);
            orchestrator.onCreate(parent.getTaskId());

            RegenerationResult result = orchestrator.changeRepeatType(parent.getTaskId(), Recurrence.NONE);

            assertEquals(3, result.deletedCount());
            assertEquals(0, result.generatedCount());
            assertEquals(Recurrence.NONE, taskRepository.findByTaskId(parent.getTaskId()).orElseThrow().getRepeatType());
        }

        @Test
        @DisplayName("an instance's repeat type cannot be changed")
        void rejectsInstance() {
            Task parent = newTask(Recurrence.DAILY);
            Task instance = orchestrator.onCreate(parent.getTaskId()).get(0);

            assertThrows(RecurrenceValidationException.class,
                    () -> orchestrator.changeRepeatType(instance.getTaskId(), Recurrence.WEEKLY));
        }
    }

    @Test
    @DisplayName("stats count parents, instances and cadences, optionally per user")
    void stats() {
        Task parent = newTask(Recurrence.DAILY);
        orchestrator.onCreate(parent.getTaskId());
        Task other = taskTemplate(Recurrence.NONE);
        other.setUserId(2L);
        taskService.createTask(other);

        RecurringTaskStats all = orchestrator.stats(null);
        assertEquals(5, all.totalTasks());
        assertEquals(1, all.recurringParents());
        assertEquals(3, all.recurringInstances());
        assertEquals(4, all.dailyRecurring());
        assertEquals(0, all.weeklyRecurring());

        RecurringTaskStats second = orchestrator.stats(2L);
        assertEquals(1, second.totalTasks());
        assertEquals(0, second.recurringParents());
    }

    private Task newTask(Recurrence repeatType) {
        return taskService.createTask(taskTemplate(repeatType));
    }

    private Task taskTemplate(Recurrence repeatType) {
        Task task = new Task();
        task.setUserId(USER);
        task.setTitle("Water plants");
        task.setCategory("home");
        task.setPriority(Priority.HIGH);
        task.setDueDate(DUE);
        task.setRepeatType(repeatType);
        task.setLinks(new ArrayList<>(List.of("https://example.com/plants")));
        task.setAdditionalNotes("use rain water");
        return task;
    }
}
