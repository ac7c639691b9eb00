package com.yourapp.tasks.recurring_tasks.dto;

import com.yourapp.tasks.recurring_tasks.model.Task;

import java.util.List;

public record RegenerationResult(long deletedCount, int generatedCount, List<Task> newInstances) {
}
