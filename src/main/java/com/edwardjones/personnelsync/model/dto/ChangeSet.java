package com.edwardjones.personnelsync.model.dto;

import com.edwardjones.personnelsync.model.domain.ChangePolicy;
import com.edwardjones.personnelsync.model.domain.Person;

import java.util.List;

/**
 * The three-way result of diffing a source listing against a destination listing.
 *
 * A compare key appears in at most one of the three lists.
 */
public record ChangeSet(
    List<Person> toCreate,
    List<Person> toUpdate,
    List<Person> toDelete
) {

    public ChangeSet {
        toCreate = toCreate == null ? List.of() : List.copyOf(toCreate);
        toUpdate = toUpdate == null ? List.of() : List.copyOf(toUpdate);
        toDelete = toDelete == null ? List.of() : List.copyOf(toDelete);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }

    public int size() {
        return toCreate.size() + toUpdate.size() + toDelete.size();
    }

    /**
     * Drops the categories the destination has disabled.
     */
    public ChangeSet restrictTo(ChangePolicy policy) {
        if (policy == null) {
            return this;
        }
        return new ChangeSet(
                policy.disableAdd() ? List.of() : toCreate,
                policy.disableUpdate() ? List.of() : toUpdate,
                policy.disableDelete() ? List.of() : toDelete);
    }
}
