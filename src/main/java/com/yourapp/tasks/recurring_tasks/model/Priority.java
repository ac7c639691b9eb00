package com.yourapp.tasks.recurring_tasks.model;

public enum Priority {
    LOW, MEDIUM, HIGH
}
