package com.edwardjones.personnelsync.service;

import com.edwardjones.personnelsync.client.PersonDestination;
import com.edwardjones.personnelsync.client.PersonSource;
import com.edwardjones.personnelsync.client.impl.SyncAdapterFactory;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.service.event.BufferedEventLog;
import com.edwardjones.personnelsync.service.reconciliation.ReconciliationService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every configured sync set, one after the other.
 *
 * Each set gets fresh adapters and its own event log. Sets that report errors are logged as alerts;
 * delivering those alerts anywhere else is left to the log pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncJobService {

    public static final String DEFAULT_SET_NAME = "default";

    private final SyncProperties properties;
    private final SyncAdapterFactory adapterFactory;
    private final ReconciliationService reconciliationService;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${app.sync.cron:-}")
    public void runScheduled() {
        log.info("Starting scheduled personnel sync...");
        runAll(properties.isDryRun());
    }

    public Map<String, ChangeResults> runAll(boolean dryRun) {
        List<SyncProperties.SyncSet> syncSets = properties.getSyncSets().isEmpty()
                ? List.of(defaultSet())
                : properties.getSyncSets();

        log.info("Running {} sync sets{}", syncSets.size(), dryRun ? " in DRY RUN mode" : "");
        Map<String, ChangeResults> resultsBySet = new LinkedHashMap<>();
        int index = 0;
        for (SyncProperties.SyncSet syncSet : syncSets) {
            index++;
            String name = syncSet.getName() == null || syncSet.getName().isBlank()
                    ? "set-" + index
                    : syncSet.getName();
            log.info("  {}) Sync set: {}", index, name);
            resultsBySet.put(name, runSet(name, syncSet, dryRun));
        }
        return resultsBySet;
    }

    ChangeResults runSet(String name, SyncProperties.SyncSet syncSet, boolean dryRun) {
        BufferedEventLog eventLog = new BufferedEventLog(name);
        ChangeResults results;

        try {
            PersonSource source = adapterFactory.createSource(properties.getSource());
            PersonDestination destination = adapterFactory.createDestination(properties.getDestination());
            source.forSet(syncSet.getSource());
            destination.forSet(syncSet.getDestination());

            results = reconciliationService.reconcile(source, destination, properties.getAttributeMap(),
                    properties.getDestination().toChangePolicy(), dryRun, eventLog);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Sync set {} is misconfigured: {}", name, e.getMessage(), e);
            results = ChangeResults.failed("configuration error: " + e.getMessage());
        }

        recordMetrics(name, dryRun, results, eventLog.getErrorCount());

        if (results.hasErrors() || eventLog.getErrorCount() > 0) {
            log.error("ALERT: sync set {} finished with {} run errors and {} failed operations: {}",
                    name, results.getErrors().size(), eventLog.getErrorCount(), results.getErrors());
        }
        log.info("Sync set {} results: created {}, updated {}, deleted {}",
                name, results.getCreated(), results.getUpdated(), results.getDeleted());
        eventLog.drain();
        return results;
    }

    private void recordMetrics(String name, boolean dryRun, ChangeResults results, long failedOperations) {
        String mode = dryRun ? "dry-run" : "apply";
        meterRegistry.counter("personnel.sync.created", "syncSet", name, "mode", mode).increment(results.getCreated());
        meterRegistry.counter("personnel.sync.updated", "syncSet", name, "mode", mode).increment(results.getUpdated());
        meterRegistry.counter("personnel.sync.deleted", "syncSet", name, "mode", mode).increment(results.getDeleted());
        meterRegistry.counter("personnel.sync.errors", "syncSet", name, "mode", mode)
                .increment(results.getErrors().size() + failedOperations);
    }

    private static SyncProperties.SyncSet defaultSet() {
        SyncProperties.SyncSet syncSet = new SyncProperties.SyncSet();
        syncSet.setName(DEFAULT_SET_NAME);
        return syncSet;
    }
}
