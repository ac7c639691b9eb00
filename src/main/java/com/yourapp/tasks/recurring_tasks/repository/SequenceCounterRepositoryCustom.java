package com.yourapp.tasks.recurring_tasks.repository;

public interface SequenceCounterRepositoryCustom {
    long incrementAndGet(String name);
    long overwrite(String name, long value);
}
