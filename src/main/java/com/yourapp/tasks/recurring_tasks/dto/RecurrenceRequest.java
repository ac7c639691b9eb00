package com.yourapp.tasks.recurring_tasks.dto;

/**
 * Body of an internal worker call. Fields stay strings; the worker service validates them.
 */
public record RecurrenceRequest(String taskId, String operation, String userId) {
}
