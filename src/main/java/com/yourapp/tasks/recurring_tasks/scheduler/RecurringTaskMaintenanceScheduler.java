package com.yourapp.tasks.recurring_tasks.scheduler;

import com.yourapp.tasks.recurring_tasks.dto.MaintenanceReport;
import com.yourapp.tasks.recurring_tasks.dto.ReplenishResult;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskOrchestrator;
import com.yourapp.tasks.recurring_tasks.service.RecurringTaskWorkerService;
import com.yourapp.tasks.recurring_tasks.service.TelegramService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecurringTaskMaintenanceScheduler {
    private static final Logger logger = LoggerFactory.getLogger(RecurringTaskMaintenanceScheduler.class);

    private final RecurringTaskOrchestrator orchestrator;
    private final RecurringTaskWorkerService workerService;
    private final TelegramService telegramService;

    // daily at 2 AM UTC
    @Scheduled(cron = "${recurrence.maintenance.replenish-cron:0 0 2 * * *}", zone = "UTC")
    public void replenishRecurringWindows() {
        logger.info("Running scheduled recurring task replenishment");
        try {
            ReplenishResult result = orchestrator.replenishWindows();
            if (result.failures() > 0) {
                telegramService.sendAlert("⚠️ <b>Recurring tasks</b>\nReplenishment finished with "
                        + result.failures() + " failed chain(s) out of " + result.parentsChecked());
            }
        } catch (RuntimeException e) {
            logger.error("Scheduled recurring task replenishment failed", e);
            telegramService.sendAlert("❌ <b>Recurring tasks</b>\nReplenishment failed: " + e.getMessage());
        }
    }

    // daily at 3 AM UTC
    @Scheduled(cron = "${recurrence.maintenance.sweep-cron:0 0 3 * * *}", zone = "UTC")
    public void sweepOrphanedInstances() {
        logger.info("Running scheduled orphaned recurring task cleanup");
        try {
            MaintenanceReport report = workerService.maintenance();
            logger.info("Scheduled cleanup removed {} orphaned recurring tasks",
                    report.orphanedTasksCleanup().cleanedCount());
        } catch (RuntimeException e) {
            logger.error("Scheduled orphaned recurring task cleanup failed", e);
            telegramService.sendAlert("❌ <b>Recurring tasks</b>\nOrphan cleanup failed: " + e.getMessage());
        }
    }
}
