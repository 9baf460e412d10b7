package com.edwardjones.personnelsync.client;

import com.edwardjones.personnelsync.model.domain.Person;

import java.util.List;
import java.util.Map;

/**
 * Interface for systems people are read from.
 * Allows swapping between the REST and LDAP implementations.
 */
public interface PersonSource {

    /**
     * Applies the per-sync-set options. Sources without set specific settings ignore them.
     */
    default void forSet(Map<String, String> options) {
    }

    /**
     * Returns every person known to the source, with pagination fully drained.
     *
     * @param desiredAttributes attribute names the run compares on; an empty list means all
     * @throws SyncClientException if the listing cannot be retrieved
     */
    List<Person> listUsers(List<String> desiredAttributes);
}
