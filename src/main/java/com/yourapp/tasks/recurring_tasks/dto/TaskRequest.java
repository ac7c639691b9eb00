package com.yourapp.tasks.recurring_tasks.dto;

import com.yourapp.tasks.recurring_tasks.model.Priority;

import java.time.LocalDateTime;
import java.util.List;

public record TaskRequest(Long userId,
                          String title,
                          String description,
                          String category,
                          Priority priority,
                          LocalDateTime dueDate,
                          String repeatType,
                          Long parentId,
                          List<String> links,
                          String additionalNotes) {
}
