package com.yourapp.tasks.recurring_tasks.service;

/**
 * Best-effort activity notification.
 * <p>
 * Implementations must never throw: a failure to record an activity is logged where it happens and
 * the caller carries on as if the call succeeded.
 */
public interface ActivityRecorder {

    String RECURRING_TASK_CREATED = "RECURRING_TASK_CREATED";
    String RECURRING_TASK_UPDATED = "RECURRING_TASK_UPDATED";
    String RECURRING_TASKS_DELETED = "RECURRING_TASKS_DELETED";
    String ORPHANED_RECURRING_TASK_CLEANED = "ORPHANED_RECURRING_TASK_CLEANED";

    /**
     * @param userId the user the action belongs to
     * @param action action name such as {@code RECURRING_TASK_CREATED}
     * @param taskId the task involved, may be null
     * @param error error message when the action failed, may be null
     */
    void record(Long userId, String action, Long taskId, String error);

    default void record(Long userId, String action, Long taskId) {
        record(userId, action, taskId, null);
    }
}
