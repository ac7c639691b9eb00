package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.model.UserActivity;
import com.yourapp.tasks.recurring_tasks.repository.UserActivityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Stores activity records in {@code user_activity}. Each record is written in its own transaction
 * so a failed insert cannot roll back the work that triggered it.
 */
@Service
public class ActivityLogService implements ActivityRecorder {
    private static final Logger logger = LoggerFactory.getLogger(ActivityLogService.class);

    private final UserActivityRepository activityRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public ActivityLogService(UserActivityRepository activityRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.activityRepository = activityRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public void record(Long userId, String action, Long taskId, String error) {
        if (userId == null) {
            logger.warn("Skipping activity {}: userId is required", action);
            return;
        }
        if (action == null || action.isBlank()) {
            logger.warn("Skipping activity for user {}: action is required", userId);
            return;
        }

        UserActivity activity = new UserActivity();
        activity.setUserId(userId);
        activity.setAction(action.trim());
        activity.setTaskId(taskId);
        activity.setMessage(buildMessage(action.trim(), taskId, error));
        activity.setError(error != null ? error.trim() : null);
        activity.setTimestamp(LocalDateTime.now(clock));

        try {
            transactionTemplate.executeWithoutResult(status -> activityRepository.save(activity));
        } catch (RuntimeException e) {
            logger.warn("Failed to record activity {} for user {} (task {}): {}",
                    action, userId, taskId, e.getMessage());
        }
    }

    public List<UserActivity> recentActivity(Long userId) {
        return activityRepository.findTop50ByUserIdOrderByTimestampDesc(userId);
    }

    static String buildMessage(String action, Long taskId, String error) {
        if (error != null) {
            return taskId != null
                    ? "User attempted " + action + " :: " + taskId + " :: ERROR: " + error
                    : "User attempted " + action + " :: ERROR: " + error;
        }
        return taskId != null
                ? "User performed " + action + " :: " + taskId
                : "User performed " + action;
    }
}
