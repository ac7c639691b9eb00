package com.yourapp.tasks.recurring_tasks.repository;

import com.yourapp.tasks.recurring_tasks.model.UserActivity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserActivityRepository extends JpaRepository<UserActivity, Long> {
    List<UserActivity> findTop50ByUserIdOrderByTimestampDesc(Long userId);

    List<UserActivity> findByTaskIdOrderByTimestampDesc(Long taskId);

    List<UserActivity> findByUserIdAndActionOrderByTimestampDesc(Long userId, String action);
}
