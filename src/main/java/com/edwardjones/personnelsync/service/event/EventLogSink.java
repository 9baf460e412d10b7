package com.edwardjones.personnelsync.service.event;

import com.edwardjones.personnelsync.model.dto.EventLogEntry;

/**
 * Multi-producer channel for apply events. Handed explicitly to the dispatcher and destinations.
 *
 * Implementations must never block a producer indefinitely.
 */
@FunctionalInterface
public interface EventLogSink {

    void publish(EventLogEntry entry);

    /**
     * Sink that discards everything.
     */
    static EventLogSink discarding() {
        return entry -> { };
    }
}
