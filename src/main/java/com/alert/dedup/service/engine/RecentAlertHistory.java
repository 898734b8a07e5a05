package com.alert.dedup.service.engine;

import com.alert.dedup.service.model.ProcessedAlert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded record of escalated alerts, for the recent alerts query.
 *
 * Keeps the last {@code capacity} alerts in escalation order; older entries
 * are dropped.
 */
public class RecentAlertHistory {

    private final int capacity;
    private final Deque<ProcessedAlert> entries = new ArrayDeque<>();

    public RecentAlertHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void addAll(Collection<ProcessedAlert> alerts) {
        for (ProcessedAlert alert : alerts) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(alert);
        }
    }

    /**
     * Gets the most recently escalated alerts, last escalated first.
     *
     * @param limit maximum number of alerts
     * @return up to {@code limit} alerts
     */
    public synchronized List<ProcessedAlert> latest(int limit) {
        List<ProcessedAlert> result = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<ProcessedAlert> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
