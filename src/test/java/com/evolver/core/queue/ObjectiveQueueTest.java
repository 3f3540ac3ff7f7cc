package com.evolver.core.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveQueueTest {

    private final ObjectiveQueue queue = new ObjectiveQueue();

    @Test
    void popsMostRecentFirst() {
        queue.push("original");
        queue.push("correction");

        assertEquals("correction", queue.pop());
        assertEquals("original", queue.pop());
        assertTrue(queue.isEmpty());
    }

    @Test
    void popOnEmptyThrows() {
        assertThrows(NoSuchElementException.class, queue::pop);
    }

    @Test
    void blankObjectivesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> queue.push(" "));
        assertThrows(IllegalArgumentException.class, () -> queue.push(null));
        assertEquals(0, queue.size());
    }

    @Test
    void pollTimesOutOnEmptyQueue() throws InterruptedException {
        assertTrue(queue.poll(Duration.ofMillis(20)).isEmpty());
    }

    @Test
    void concurrentProducersLoseNothing() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        var start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            int producer = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 250; i++) {
                    queue.push("p" + producer + "-" + i);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1000, queue.size());
        queue.clear();
        assertTrue(queue.isEmpty());
    }
}
