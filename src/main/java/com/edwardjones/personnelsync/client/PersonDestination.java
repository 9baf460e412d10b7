package com.edwardjones.personnelsync.client;

import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import com.edwardjones.personnelsync.service.event.EventLogSink;

import java.util.List;
import java.util.Map;

/**
 * Interface for systems people are written to.
 */
public interface PersonDestination {

    default void forSet(Map<String, String> options) {
    }

    /**
     * Current state of the destination, used as the diff baseline.
     *
     * @throws SyncClientException if the listing cannot be retrieved
     */
    List<Person> listUsers(List<String> desiredAttributes);

    /**
     * Applies the change set, pacing the remote calls with a batch timer.
     *
     * Counters only reflect confirmed changes and a failed operation does not stop the others.
     * Every attempt is reported to {@code eventLog}.
     */
    ChangeResults applyChangeSet(ChangeSet changes, EventLogSink eventLog);
}
