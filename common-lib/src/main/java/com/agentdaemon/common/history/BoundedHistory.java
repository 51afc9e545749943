package com.agentdaemon.common.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity circular buffer. Appending to a full buffer overwrites the oldest
 * element in O(1).
 *
 * <p>Thread-safe: every method synchronises on the instance, so appends from the
 * cycle and watchdog threads are strictly ordered.
 *
 * @param <T> element type
 */
public final class BoundedHistory<T> {

    private final Object[] slots;
    private int head;   // index of the oldest element
    private int size;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public synchronized void add(T element) {
        if (element == null) {
            throw new IllegalArgumentException("element must not be null");
        }
        int tail = (head + size) % slots.length;
        slots[tail] = element;
        if (size < slots.length) {
            size++;
        } else {
            head = (head + 1) % slots.length;
        }
    }

    /** Most recently added element, if any. */
    public synchronized Optional<T> latest() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(at(size - 1));
    }

    /** The last {@code limit} elements, oldest first. */
    public synchronized List<T> recent(int limit) {
        int count = Math.max(0, Math.min(limit, size));
        List<T> out = new ArrayList<>(count);
        for (int i = size - count; i < size; i++) {
            out.add(at(i));
        }
        return Collections.unmodifiableList(out);
    }

    /** Every retained element, oldest first. */
    public synchronized List<T> snapshot() {
        return recent(size);
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public synchronized boolean isEmpty() {
        return size == 0;
    }

    @SuppressWarnings("unchecked")
    private T at(int logicalIndex) {
        return (T) slots[(head + logicalIndex) % slots.length];
    }
}
