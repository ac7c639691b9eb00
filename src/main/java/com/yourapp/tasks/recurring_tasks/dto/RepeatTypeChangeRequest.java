package com.yourapp.tasks.recurring_tasks.dto;

public record RepeatTypeChangeRequest(String repeatType) {
}
