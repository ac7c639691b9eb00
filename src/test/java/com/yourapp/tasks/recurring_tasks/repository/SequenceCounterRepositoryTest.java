package com.yourapp.tasks.recurring_tasks.repository;

import com.yourapp.tasks.recurring_tasks.service.SequenceAllocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Counter writes commit in their own transactions, so these tests run outside the usual
 * rolled-back test transaction and use a fresh counter name each time.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SequenceCounterRepositoryTest {

    @Autowired
    private SequenceCounterRepository repository;

    @Test
    @DisplayName("first increment creates the counter at 1, later ones count up")
    void incrementCreatesThenCounts() {
        String name = uniqueName();

        assertEquals(1L, repository.incrementAndGet(name));
        assertEquals(2L, repository.incrementAndGet(name));
        assertEquals(3L, repository.incrementAndGet(name));
        assertEquals(3L, repository.findById(name).orElseThrow().getSequenceValue());
    }

    @Test
    @DisplayName("overwrite replaces the value and creates missing counters")
    void overwrite() {
        String name = uniqueName();

        assertEquals(10L, repository.overwrite(name, 10L));
        assertEquals(11L, repository.incrementAndGet(name));
        assertEquals(4L, repository.overwrite(name, 4L));
        assertEquals(4L, repository.findById(name).orElseThrow().getSequenceValue());
    }

    @Test
    @DisplayName("ten concurrent allocations on an empty counter return exactly 1..10")
    void concurrentAllocation() throws Exception {
        String name = uniqueName();
        SequenceAllocator allocator = new SequenceAllocator(repository);
        int callers = 10;

        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<Long> call = () -> {
                    start.await();
                    return allocator.next(name);
                };
                futures.add(executor.submit(call));
            }
            start.countDown();

            List<Long> values = new ArrayList<>();
            for (Future<Long> future : futures) {
                values.add(future.get(30, TimeUnit.SECONDS));
            }

            Set<Long> expected = LongStream.rangeClosed(1, callers).boxed().collect(Collectors.toSet());
            assertEquals(callers, values.size());
            assertEquals(expected, new TreeSet<>(values));
            assertEquals(callers, allocator.currentValue(name));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("counters are listed by name")
    void listsCountersByName() {
        String prefix = uniqueName();
        repository.incrementAndGet(prefix + "-b");
        repository.incrementAndGet(prefix + "-a");

        List<String> names = repository.findAllByOrderByNameAsc().stream()
                .map(c -> c.getName())
                .filter(n -> n.startsWith(prefix))
                .collect(Collectors.toList());
        assertEquals(List.of(prefix + "-a", prefix + "-b"), names);
    }

    private static String uniqueName() {
        return "test-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
