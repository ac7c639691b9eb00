package com.yourapp.tasks.recurring_tasks.repository;

import com.yourapp.tasks.recurring_tasks.model.Recurrence;
import com.yourapp.tasks.recurring_tasks.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface TaskRepository extends JpaRepository<Task, Long> {
    Optional<Task> findByTaskId(Long taskId);

    Optional<Task> findByTaskIdAndUserId(Long taskId, Long userId);

    boolean existsByTaskId(Long taskId);

    // Chain members
    List<Task> findByRecurringParentIdOrderByDueDateAsc(Long recurringParentId);

    boolean existsByRecurringParentIdAndUserId(Long recurringParentId, Long userId);

    // Earliest unfinished instance after a given due date
    Optional<Task> findFirstByRecurringParentIdAndCompletedFalseAndDueDateAfterOrderByDueDateAsc(
            Long recurringParentId, LocalDateTime after);

    // Latest unfinished instance after a given instant, the tail of the forward window
    Optional<Task> findFirstByRecurringParentIdAndCompletedFalseAndDueDateAfterOrderByDueDateDesc(
            Long recurringParentId, LocalDateTime after);

    long countByRecurringParentIdAndCompletedFalseAndDueDateAfter(Long recurringParentId, LocalDateTime after);

    List<Task> findByRecurringParentIdIsNotNull();

    List<Task> findByRepeatTypeNotAndRecurringParentIdIsNull(Recurrence repeatType);

    @Transactional
    long deleteByRecurringParentIdAndUserId(Long recurringParentId, Long userId);

    @Transactional
    long deleteByRecurringParentIdAndUserIdAndCompletedFalseAndDueDateGreaterThanEqual(
            Long recurringParentId, Long userId, LocalDateTime from);

    /**
     * One row per repeat type: {@code [Recurrence, task count, count of tasks with a recurring parent]}.
     */
    @Query("SELECT t.repeatType, COUNT(t), COUNT(t.recurringParentId) FROM Task t GROUP BY t.repeatType")
    List<Object[]> countByRepeatType();

    @Query("SELECT t.repeatType, COUNT(t), COUNT(t.recurringParentId) FROM Task t " +
            "WHERE t.userId = :userId GROUP BY t.repeatType")
    List<Object[]> countByRepeatTypeForUser(@Param("userId") Long userId);
}
