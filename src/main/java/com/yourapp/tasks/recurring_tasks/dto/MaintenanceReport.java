package com.yourapp.tasks.recurring_tasks.dto;

import java.time.LocalDateTime;

public record MaintenanceReport(LocalDateTime timestamp, boolean success, OrphanCleanup orphanedTasksCleanup) {

    public record OrphanCleanup(boolean completed, int cleanedCount) {
    }
}
