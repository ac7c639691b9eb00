package com.yourapp.tasks.recurring_tasks.dto;

public record DispatchResult(boolean success, String operation, long taskId, Object result) {
}
