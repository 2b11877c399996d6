/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Stable priority queue of pending task ids.
 *
 * <p>
 * Ordering is strictly descending by priority; ids with equal priority leave in the order they were pushed. The tie
 * break uses a monotonic push sequence, so the guarantee holds across any interleaving of pushes and pops.
 *
 * <p>
 * The queue holds ids only. Removing an id never touches the task record. All operations are non-blocking and
 * synchronized on the queue instance.
 */
@ApplicationScoped
public class TaskPriorityQueue {

    private static final Comparator<Entry> ORDER = Comparator.comparingInt(Entry::priority).reversed()
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Map<String, Entry> entries = new HashMap<>();
    private long nextSequence;

    /**
     * Adds a task id. Pushing an id that is already queued is a no-op.
     *
     * @param taskId
     *            task identifier
     * @param priority
     *            dispatch priority, higher first
     * @return true if the id was added
     */
    public synchronized boolean push(String taskId, int priority) {
        if (entries.containsKey(taskId)) {
            return false;
        }
        Entry entry = new Entry(taskId, priority, nextSequence++);
        heap.add(entry);
        entries.put(taskId, entry);
        return true;
    }

    /**
     * Removes and returns the highest-priority id. Never blocks.
     *
     * @return the next task id, or empty if the queue is empty
     */
    public synchronized Optional<String> pop() {
        Entry entry = heap.poll();
        if (entry == null) {
            return Optional.empty();
        }
        entries.remove(entry.taskId());
        return Optional.of(entry.taskId());
    }

    /**
     * Extracts a specific id if it is still queued. The relative order of the remaining ids is unchanged.
     *
     * @param taskId
     *            task identifier
     * @return true if the id was queued and has been removed
     */
    public synchronized boolean remove(String taskId) {
        Entry entry = entries.remove(taskId);
        if (entry == null) {
            return false;
        }
        heap.remove(entry);
        return true;
    }

    public synchronized boolean contains(String taskId) {
        return entries.containsKey(taskId);
    }

    public synchronized int size() {
        return heap.size();
    }

    public synchronized boolean isEmpty() {
        return heap.isEmpty();
    }

    /**
     * Returns the queued ids in dispatch order without removing them.
     */
    public synchronized List<String> snapshot() {
        List<Entry> ordered = new ArrayList<>(heap);
        ordered.sort(ORDER);
        List<String> ids = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            ids.add(entry.taskId());
        }
        return ids;
    }

    private record Entry(String taskId, int priority, long sequence) {
    }
}
