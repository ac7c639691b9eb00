package com.yourapp.tasks.recurring_tasks.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "user_activity", indexes = {
        @Index(name = "idx_user_activity_user_time", columnList = "user_id, activity_time"),
        @Index(name = "idx_user_activity_task", columnList = "task_id")
})
@Getter
@Setter
public class UserActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String action;

    @Column(name = "task_id")
    private Long taskId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "activity_time", nullable = false)
    private LocalDateTime timestamp;
}
