package com.yourapp.tasks.recurring_tasks.repository;

import com.yourapp.tasks.recurring_tasks.model.SequenceCounter;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SequenceCounterRepository extends JpaRepository<SequenceCounter, String>, SequenceCounterRepositoryCustom {
    List<SequenceCounter> findAllByOrderByNameAsc();
}
