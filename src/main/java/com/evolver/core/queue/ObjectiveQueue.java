package com.evolver.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe LIFO stack of pending objectives. The most recently pushed objective
 * runs next, so a correction pushed after its original runs first.
 */
@Component
public class ObjectiveQueue {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveQueue.class);

    private final LinkedBlockingDeque<String> stack = new LinkedBlockingDeque<>();

    public void push(String objective) {
        if (objective == null || objective.isBlank()) {
            throw new IllegalArgumentException("Objective must not be blank");
        }
        stack.addFirst(objective);
        log.debug("Pushed objective ({} pending)", stack.size());
    }

    /**
     * @throws NoSuchElementException when the queue is empty
     */
    public String pop() {
        return stack.removeFirst();
    }

    /**
     * Waits up to {@code timeout} for an objective.
     */
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(stack.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int size() {
        return stack.size();
    }

    public void clear() {
        stack.clear();
    }
}
