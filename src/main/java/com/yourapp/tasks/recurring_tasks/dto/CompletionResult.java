package com.yourapp.tasks.recurring_tasks.dto;

import com.yourapp.tasks.recurring_tasks.model.Task;

/**
 * Outcome of a completion: the re-linked next instance and the instance appended to the window.
 * Either may be null.
 */
public record CompletionResult(Task updatedTask, Task createdTask) {

    public static CompletionResult none() {
        return new CompletionResult(null, null);
    }
}
