package com.yourapp.tasks.recurring_tasks.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A named counter; {@code sequenceValue} is the last identifier handed out.
 */
@Entity
@Table(name = "sequence_counter")
@Getter
@Setter
@NoArgsConstructor
public class SequenceCounter {

    @Id
    @Column(length = 100)
    private String name;

    @Column(name = "sequence_value", nullable = false)
    private long sequenceValue;

    public SequenceCounter(String name, long sequenceValue) {
        this.name = name;
        this.sequenceValue = sequenceValue;
    }
}
