package com.yourapp.tasks.recurring_tasks.repository;

import com.yourapp.tasks.recurring_tasks.model.SequenceCounter;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Counter updates run in their own transaction so an allocated value never depends on the
 * outcome of the caller's transaction, the same way a database sequence behaves.
 */
@Repository
public class SequenceCounterRepositoryImpl implements SequenceCounterRepositoryCustom {
    private static final Logger logger = LoggerFactory.getLogger(SequenceCounterRepositoryImpl.class);

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Increments the counter with a single UPDATE, which holds the row lock until commit, and reads
     * the new value back inside the same transaction. A missing counter is created at 1; when two
     * callers race to create it the loser fails on the primary key and must retry.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long incrementAndGet(String name) {
        int updated = entityManager.createQuery(
                        "UPDATE SequenceCounter c SET c.sequenceValue = c.sequenceValue + 1 WHERE c.name = :name")
                .setParameter("name", name)
                .executeUpdate();

        if (updated == 0) {
            entityManager.persist(new SequenceCounter(name, 1L));
            entityManager.flush();
            logger.info("Created sequence counter {}", name);
            return 1L;
        }

        return entityManager.createQuery(
                        "SELECT c.sequenceValue FROM SequenceCounter c WHERE c.name = :name", Long.class)
                .setParameter("name", name)
                .getSingleResult();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long overwrite(String name, long value) {
        int updated = entityManager.createQuery(
                        "UPDATE SequenceCounter c SET c.sequenceValue = :value WHERE c.name = :name")
                .setParameter("value", value)
                .setParameter("name", name)
                .executeUpdate();

        if (updated == 0) {
            entityManager.persist(new SequenceCounter(name, value));
            entityManager.flush();
        }
        return value;
    }
}
