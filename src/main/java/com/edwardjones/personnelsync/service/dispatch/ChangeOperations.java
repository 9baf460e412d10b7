package com.edwardjones.personnelsync.service.dispatch;

import com.edwardjones.personnelsync.model.domain.Person;

/**
 * Per-record write operations a destination performs against its remote system.
 *
 * Each call either completes (the change is confirmed) or throws.
 */
public interface ChangeOperations {

    void create(Person person);

    void update(Person person);

    default void delete(Person person) {
        throw new UnsupportedOperationException("delete is not supported");
    }

    /**
     * Destinations that implement {@link #delete(Person)} must also return {@code true} here.
     */
    default boolean supportsDelete() {
        return false;
    }
}
