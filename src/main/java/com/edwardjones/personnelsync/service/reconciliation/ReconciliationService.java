package com.edwardjones.personnelsync.service.reconciliation;

import com.edwardjones.personnelsync.client.PersonDestination;
import com.edwardjones.personnelsync.client.PersonSource;
import com.edwardjones.personnelsync.model.domain.AttributeMapping;
import com.edwardjones.personnelsync.model.domain.ChangePolicy;
import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import com.edwardjones.personnelsync.model.dto.EventLogEntry;
import com.edwardjones.personnelsync.service.event.EventLogSink;
import com.edwardjones.personnelsync.service.logic.AttributeProjector;
import com.edwardjones.personnelsync.service.logic.DiffEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one source against one destination.
 *
 * Responsibilities:
 * - Fetch both listings and project the source onto destination attributes
 * - Diff them into a change set
 * - Report the plan in dry-run mode, otherwise hand it to the destination
 *
 * No retries happen here. A listing that cannot be fetched ends the run with an error result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final AttributeProjector attributeProjector;
    private final DiffEngine diffEngine;

    public ChangeResults reconcile(PersonSource source,
                                   PersonDestination destination,
                                   List<AttributeMapping> mapping,
                                   boolean dryRun,
                                   EventLogSink eventLog) {
        return reconcile(source, destination, mapping, ChangePolicy.ALLOW_ALL, dryRun, eventLog);
    }

    public ChangeResults reconcile(PersonSource source,
                                   PersonDestination destination,
                                   List<AttributeMapping> mapping,
                                   ChangePolicy policy,
                                   boolean dryRun,
                                   EventLogSink eventLog) {
        ReconciliationState state = transition(ReconciliationState.IDLE, ReconciliationState.FETCHING_SOURCE);

        List<Person> sourcePeople;
        try {
            sourcePeople = source.listUsers(AttributeProjector.sourceKeys(mapping));
        } catch (RuntimeException e) {
            log.error("Unable to fetch people from source: {}", e.getMessage(), e);
            transition(state, ReconciliationState.DONE);
            return ChangeResults.failed("source listing failed: " + e.getMessage());
        }
        log.info("Found {} people in source", sourcePeople.size());

        state = transition(state, ReconciliationState.PROJECTING);
        List<Person> projected = attributeProjector.project(sourcePeople, mapping);

        state = transition(state, ReconciliationState.FETCHING_DESTINATION);
        List<Person> destinationPeople;
        try {
            destinationPeople = destination.listUsers(AttributeProjector.destinationKeys(mapping));
        } catch (RuntimeException e) {
            log.error("Unable to fetch people from destination: {}", e.getMessage(), e);
            transition(state, ReconciliationState.DONE);
            return ChangeResults.failed("destination listing failed: " + e.getMessage());
        }
        log.info("Found {} people in destination", destinationPeople.size());

        state = transition(state, ReconciliationState.DIFFING);
        ChangeSet changeSet = diffEngine.diff(projected, destinationPeople).restrictTo(policy);

        ChangeResults results;
        if (dryRun) {
            state = transition(state, ReconciliationState.DRY_RUN_REPORTING);
            reportPlan(changeSet, eventLog);
            results = ChangeResults.predicted(changeSet);
        } else {
            state = transition(state, ReconciliationState.APPLYING);
            results = destination.applyChangeSet(changeSet, eventLog);
        }

        transition(state, ReconciliationState.DONE);
        log.info("Reconciliation {}: created {}, updated {}, deleted {}",
                dryRun ? "planned (dry run)" : "complete",
                results.getCreated(), results.getUpdated(), results.getDeleted());
        return results;
    }

    private void reportPlan(ChangeSet changeSet, EventLogSink eventLog) {
        eventLog.publish(EventLogEntry.info(String.format("ChangeSet Plans: Create %d, Update %d, Delete %d",
                changeSet.toCreate().size(), changeSet.toUpdate().size(), changeSet.toDelete().size())));
        reportCategory("Users to be created", changeSet.toCreate(), eventLog);
        reportCategory("Users to be updated", changeSet.toUpdate(), eventLog);
        reportCategory("Users to be deleted", changeSet.toDelete(), eventLog);
    }

    private void reportCategory(String heading, List<Person> people, EventLogSink eventLog) {
        if (people.isEmpty()) {
            return;
        }
        StringBuilder message = new StringBuilder(heading).append(':');
        for (int i = 0; i < people.size(); i++) {
            message.append("\n  ").append(i + 1).append(") ").append(people.get(i).compareKey());
        }
        eventLog.publish(EventLogEntry.info(message.toString()));
    }

    private ReconciliationState transition(ReconciliationState from, ReconciliationState to) {
        log.debug("Reconciliation state {} -> {}", from, to);
        return to;
    }
}
