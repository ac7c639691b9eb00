package com.yourapp.tasks.recurring_tasks.dto;

public record RecurrenceRulesRequest(String repeatType, String dueDate, Long parentId) {
}
