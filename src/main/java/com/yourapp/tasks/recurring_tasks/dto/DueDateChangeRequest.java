package com.yourapp.tasks.recurring_tasks.dto;

import java.time.LocalDateTime;

public record DueDateChangeRequest(LocalDateTime dueDate) {
}
