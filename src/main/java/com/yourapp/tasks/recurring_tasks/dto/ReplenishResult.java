package com.yourapp.tasks.recurring_tasks.dto;

public record ReplenishResult(int parentsChecked, int instancesGenerated, int failures) {
}
