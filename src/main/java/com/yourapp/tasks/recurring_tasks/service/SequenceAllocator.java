package com.yourapp.tasks.recurring_tasks.service;

import com.yourapp.tasks.recurring_tasks.exception.SequenceAllocationException;
import com.yourapp.tasks.recurring_tasks.model.SequenceCounter;
import com.yourapp.tasks.recurring_tasks.repository.SequenceCounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hands out sequential identifiers per named counter.
 * <p>
 * Values from {@link #next(String)} are unique and strictly increasing as long as every caller
 * allocates through {@code next}. {@link #reset(String, long)} running alongside {@code next}
 * voids that guarantee.
 */
@Service
public class SequenceAllocator {
    private static final Logger logger = LoggerFactory.getLogger(SequenceAllocator.class);

    public static final String TASK_COUNTER = "taskId";

    // a lost creation race costs one attempt, so a handful is plenty
    private static final int MAX_ATTEMPTS = 5;

    private final SequenceCounterRepository counterRepository;

    @Autowired
    public SequenceAllocator(SequenceCounterRepository counterRepository) {
        this.counterRepository = counterRepository;
    }

    /**
     * Atomically increments the counter and returns the new value, creating the counter at 1 on
     * first use.
     *
     * @throws SequenceAllocationException if the counter store fails
     */
    public long next(String counterName) {
        requireName(counterName);

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return counterRepository.incrementAndGet(counterName);
            } catch (DataIntegrityViolationException | TransientDataAccessException e) {
                // another caller created the counter first, or held its lock too long
                lastFailure = e;
                logger.debug("Retrying allocation for counter {} (attempt {}): {}", counterName, attempt, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Failed to get next sequence for {}", counterName, e);
                throw new SequenceAllocationException(counterName, e);
            }
        }
        logger.error("Giving up on counter {} after {} attempts", counterName, MAX_ATTEMPTS, lastFailure);
        throw new SequenceAllocationException(counterName, lastFailure);
    }

    /**
     * Creates a counter holding {@code startValue}. An existing counter is never overwritten.
     *
     * @return true if the counter was created, false if it already existed
     */
    public boolean initialize(String counterName, long startValue) {
        requireName(counterName);
        requirePositive(startValue, "Start value");

        try {
            if (counterRepository.existsById(counterName)) {
                logger.info("Counter for {} already exists", counterName);
                return false;
            }
            counterRepository.saveAndFlush(new SequenceCounter(counterName, startValue));
            logger.info("Initialized counter for {} with start value {}", counterName, startValue);
            return true;
        } catch (DataIntegrityViolationException e) {
            logger.info("Counter for {} was created concurrently", counterName);
            return false;
        } catch (RuntimeException e) {
            logger.error("Failed to initialize counter for {}", counterName, e);
            throw new SequenceAllocationException(counterName, e);
        }
    }

    /**
     * Overwrites the counter unconditionally. Identifiers already issued above {@code value} will be
     * handed out again.
     */
    public long reset(String counterName, long value) {
        requireName(counterName);
        requirePositive(value, "New value");

        try {
            long result = counterRepository.overwrite(counterName, value);
            logger.warn("Reset counter for {} to {}", counterName, value);
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to reset counter for {}", counterName, e);
            throw new SequenceAllocationException(counterName, e);
        }
    }

    /**
     * @return the last value handed out, or 0 if the counter does not exist yet
     */
    public long currentValue(String counterName) {
        requireName(counterName);

        try {
            return counterRepository.findById(counterName)
                    .map(SequenceCounter::getSequenceValue)
                    .orElse(0L);
        } catch (RuntimeException e) {
            logger.error("Failed to get current value for {}", counterName, e);
            throw new SequenceAllocationException(counterName, e);
        }
    }

    public List<SequenceCounter> allCounters() {
        try {
            return counterRepository.findAllByOrderByNameAsc();
        } catch (RuntimeException e) {
            logger.error("Failed to get all counters", e);
            throw new SequenceAllocationException("*", e);
        }
    }

    private static void requireName(String counterName) {
        if (counterName == null || counterName.isBlank()) {
            throw new IllegalArgumentException("Counter name is required");
        }
    }

    private static void requirePositive(long value, String label) {
        if (value < 1) {
            throw new IllegalArgumentException(label + " must be a positive integer");
        }
    }
}
