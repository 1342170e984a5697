package com.fusiongate.backend.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity FIFO buffer. Pushing into a full window evicts the oldest element first.
 */
public class RollingWindow<T> {

    private final int capacity;
    private final Deque<T> values;

    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Rolling window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public synchronized void push(T value) {
        if (values.size() == capacity) {
            values.pollFirst();
        }
        values.addLast(value);
    }

    public synchronized Optional<T> last() {
        return Optional.ofNullable(values.peekLast());
    }

    /**
     * Oldest first.
     */
    public synchronized List<T> values() {
        return new ArrayList<>(values);
    }

    public synchronized int size() {
        return values.size();
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        values.clear();
    }

    /**
     * Replaces the content with the given elements, keeping only the newest {@code capacity} of them.
     */
    public synchronized void replaceWith(Collection<? extends T> elements) {
        values.clear();
        for (T element : elements) {
            push(element);
        }
    }
}
