package com.yourapp.tasks.recurring_tasks.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "recurrence")
public class RecurrenceProperties {
    private int windowSize = 3;            // incomplete future instances kept per chain
    private int maxOccurrences = 100;      // upper bound for a single generateOccurrences call
    private int maxPeriodIterations = 1000;
    private Duration pastDueTolerance = Duration.ofHours(24);

    @PostConstruct
    public void init() {
        if (windowSize < 1 || windowSize > maxOccurrences) {
            throw new IllegalStateException("recurrence.window-size must be between 1 and " + maxOccurrences);
        }
        if (pastDueTolerance.isNegative()) {
            throw new IllegalStateException("recurrence.past-due-tolerance must not be negative");
        }
    }

    public int getWindowSize() { return windowSize; }
    public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    public int getMaxOccurrences() { return maxOccurrences; }
    public void setMaxOccurrences(int maxOccurrences) { this.maxOccurrences = maxOccurrences; }
    public int getMaxPeriodIterations() { return maxPeriodIterations; }
    public void setMaxPeriodIterations(int maxPeriodIterations) { this.maxPeriodIterations = maxPeriodIterations; }
    public Duration getPastDueTolerance() { return pastDueTolerance; }
    public void setPastDueTolerance(Duration pastDueTolerance) { this.pastDueTolerance = pastDueTolerance; }
}
