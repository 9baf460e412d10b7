package com.edwardjones.personnelsync.service.event;

import com.edwardjones.personnelsync.model.dto.EventLogEntry;
import com.edwardjones.personnelsync.model.dto.EventLogEntry.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded event buffer for one sync run.
 *
 * Every entry is mirrored to the application log as it is published and kept until a consumer
 * drains it. Publishing never blocks.
 */
@Slf4j
public class BufferedEventLog implements EventLogSink {

    private final String runName;
    private final Queue<EventLogEntry> entries = new ConcurrentLinkedQueue<>();
    private final AtomicLong errorCount = new AtomicLong(0);

    public BufferedEventLog(String runName) {
        this.runName = runName;
    }

    @Override
    public void publish(EventLogEntry entry) {
        entries.add(entry);
        Severity severity = entry.severity();
        if (severity.isAtLeast(Severity.ERROR)) {
            errorCount.incrementAndGet();
            log.error("[{}] {}", runName, entry);
        } else if (severity == Severity.WARNING) {
            log.warn("[{}] {}", runName, entry);
        } else if (severity == Severity.DEBUG) {
            log.debug("[{}] {}", runName, entry);
        } else {
            log.info("[{}] {}", runName, entry);
        }
    }

    /**
     * Removes and returns everything buffered so far, in publish order.
     */
    public List<EventLogEntry> drain() {
        List<EventLogEntry> drained = new ArrayList<>();
        EventLogEntry entry;
        while ((entry = entries.poll()) != null) {
            drained.add(entry);
        }
        return drained;
    }

    public List<EventLogEntry> snapshot() {
        return List.copyOf(entries);
    }

    public long getErrorCount() {
        return errorCount.get();
    }
}
