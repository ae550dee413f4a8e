package com.thughari.oteditor.reconcile;

import com.thughari.oteditor.model.Operation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locally broadcast operations that the server may not have seen yet, keyed by id and read back
 * in timestamp order.
 * <p>
 * An entry leaves the queue when the server acknowledges it or, failing that, once its grace
 * window has elapsed. Expiry is a time-based guess with no causal guarantee.
 */
@Slf4j
public class PendingOperationQueue {

    private static final Comparator<Operation> BY_TIMESTAMP = Comparator.comparingLong(Operation::getTimestamp);

    private final Duration graceWindow;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private static final class Entry {
        final Operation operation;
        final Instant enqueuedAt;

        Entry(Operation operation, Instant enqueuedAt) {
            this.operation = operation;
            this.enqueuedAt = enqueuedAt;
        }
    }

    public PendingOperationQueue(Duration graceWindow) {
        this.graceWindow = graceWindow;
    }

    public void add(Operation operation, Instant now) {
        entries.put(operation.getId(), new Entry(operation, now));
    }

    public boolean acknowledge(String operationId) {
        boolean removed = entries.remove(operationId) != null;
        if (removed) {
            log.debug("Operation {} acknowledged, {} still pending", operationId, entries.size());
        }
        return removed;
    }

    /**
     * Drops every entry enqueued at least one grace window before {@code now}.
     *
     * @return number of entries dropped
     */
    public int expire(Instant now) {
        int expired = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            if (!entry.enqueuedAt.plus(graceWindow).isAfter(now)) {
                it.remove();
                expired++;
            }
        }
        if (expired > 0) {
            log.debug("Expired {} unacknowledged operations, {} still pending", expired, entries.size());
        }
        return expired;
    }

    /** Snapshot of the pending operations, oldest timestamp first. */
    public List<Operation> pending() {
        List<Operation> operations = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            operations.add(entry.operation);
        }
        operations.sort(BY_TIMESTAMP);
        return operations;
    }

    public boolean contains(String operationId) {
        return entries.containsKey(operationId);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }
}
