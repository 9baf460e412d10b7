package com.edwardjones.personnelsync.model.dto;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate outcome of a reconciliation run.
 *
 * Counters are incremented concurrently by apply tasks, so every mutator is atomic.
 */
public class ChangeResults {

    private final AtomicLong created = new AtomicLong(0);
    private final AtomicLong updated = new AtomicLong(0);
    private final AtomicLong deleted = new AtomicLong(0);
    private final List<String> errors = new CopyOnWriteArrayList<>();

    public static ChangeResults failed(String error) {
        ChangeResults results = new ChangeResults();
        results.addError(error);
        return results;
    }

    /**
     * Predicted outcome of applying the given change set; used in dry-run mode.
     */
    public static ChangeResults predicted(ChangeSet changeSet) {
        ChangeResults results = new ChangeResults();
        results.created.set(changeSet.toCreate().size());
        results.updated.set(changeSet.toUpdate().size());
        results.deleted.set(changeSet.toDelete().size());
        return results;
    }

    public long incrementCreated() {
        return created.incrementAndGet();
    }

    public long incrementUpdated() {
        return updated.incrementAndGet();
    }

    public long incrementDeleted() {
        return deleted.incrementAndGet();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public long getCreated() {
        return created.get();
    }

    public long getUpdated() {
        return updated.get();
    }

    public long getDeleted() {
        return deleted.get();
    }

    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ChangeResults{" +
                "created=" + created.get() +
                ", updated=" + updated.get() +
                ", deleted=" + deleted.get() +
                ", errors=" + errors +
                '}';
    }
}
