package com.yourapp.tasks.recurring_tasks.dto;

public record RecurringTaskStats(long totalTasks,
                                 long recurringParents,
                                 long recurringInstances,
                                 long dailyRecurring,
                                 long weeklyRecurring,
                                 long monthlyRecurring) {

    public static RecurringTaskStats empty() {
        return new RecurringTaskStats(0, 0, 0, 0, 0, 0);
    }
}
