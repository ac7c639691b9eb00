package com.yourapp.tasks.recurring_tasks.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "task")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // application-level id, allocated from the "taskId" sequence counter
    @Column(name = "task_id", unique = true, nullable = false)
    private Long taskId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    // subtask link, never touched by recurrence
    @Column(name = "parent_id")
    private Long parentId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String category;

    @Enumerated(EnumType.STRING)
    private Priority priority = Priority.MEDIUM;

    @Column(name = "due_date", nullable = false)
    private LocalDateTime dueDate;

    @Column(name = "original_due_date")
    private LocalDateTime originalDueDate;

    private boolean completed;

    @Column(name = "completion_timestamp")
    private LocalDateTime completionTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_type", nullable = false)
    private Recurrence repeatType = Recurrence.NONE;

    @Column(name = "recurring_parent_id")
    private Long recurringParentId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_link", joinColumns = @JoinColumn(name = "task_pk"))
    @Column(name = "link")
    private List<String> links = new ArrayList<>();

    @Column(name = "additional_notes", columnDefinition = "TEXT")
    private String additionalNotes;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    /**
     * True for the original task of a chain: it repeats and was not generated from another task.
     */
    public boolean isRecurringParent() {
        return repeatType != null && repeatType.isRecurring() && recurringParentId == null;
    }

    public boolean isRecurringInstance() {
        return recurringParentId != null;
    }

    public boolean isSubtask() {
        return parentId != null;
    }

    /**
     * The taskId every member of this task's chain points at.
     */
    public Long chainRootId() {
        return recurringParentId != null ? recurringParentId : taskId;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getTaskId() {
        return taskId;
    }

    public void setTaskId(Long taskId) {
        this.taskId = taskId;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public Long getParentId() {
        return parentId;
    }

    public void setParentId(Long parentId) {
        this.parentId = parentId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public LocalDateTime getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDateTime dueDate) {
        this.dueDate = dueDate;
    }

    public LocalDateTime getOriginalDueDate() {
        return originalDueDate;
    }

    public void setOriginalDueDate(LocalDateTime originalDueDate) {
        this.originalDueDate = originalDueDate;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public LocalDateTime getCompletionTimestamp() {
        return completionTimestamp;
    }

    public void setCompletionTimestamp(LocalDateTime completionTimestamp) {
        this.completionTimestamp = completionTimestamp;
    }

    public Recurrence getRepeatType() {
        return repeatType;
    }

    public void setRepeatType(Recurrence repeatType) {
        this.repeatType = repeatType;
    }

    public Long getRecurringParentId() {
        return recurringParentId;
    }

    public void setRecurringParentId(Long recurringParentId) {
        this.recurringParentId = recurringParentId;
    }

    public List<String> getLinks() {
        return links;
    }

    public void setLinks(List<String> links) {
        this.links = links;
    }

    public String getAdditionalNotes() {
        return additionalNotes;
    }

    public void setAdditionalNotes(String additionalNotes) {
        this.additionalNotes = additionalNotes;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
