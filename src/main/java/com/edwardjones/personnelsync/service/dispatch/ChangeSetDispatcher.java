package com.edwardjones.personnelsync.service.dispatch;

import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import com.edwardjones.personnelsync.model.dto.EventLogEntry;
import com.edwardjones.personnelsync.service.event.EventLogSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Fans a change set out as independent tasks, paced by a {@link BatchTimer}.
 *
 * Every create, update and delete is admitted by the timer and then runs on its own. Counters are
 * only incremented after the remote call returned, a failed call is reported to the event log and
 * the remaining operations still run. The caller is released once all tasks finished.
 */
@Slf4j
@Component
public class ChangeSetDispatcher {

    private final Executor applyExecutor;

    public ChangeSetDispatcher(@Qualifier("syncApplyExecutor") Executor applyExecutor) {
        this.applyExecutor = applyExecutor;
    }

    public ChangeResults dispatch(ChangeSet changes,
                                  ChangeOperations operations,
                                  BatchTimer batchTimer,
                                  EventLogSink eventLog) {
        ChangeResults results = new ChangeResults();
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(changes.size());

        try {
            for (Person person : changes.toCreate()) {
                batchTimer.admit();
                inFlight.add(submit("CreateUser", "create", person, operations::create, results::incrementCreated, eventLog));
            }

            for (Person person : changes.toUpdate()) {
                batchTimer.admit();
                inFlight.add(submit("UpdateUser", "update", person, operations::update, results::incrementUpdated, eventLog));
            }

            if (!operations.supportsDelete()) {
                if (!changes.toDelete().isEmpty()) {
                    eventLog.publish(EventLogEntry.warning("destination does not support deleting users, skipped "
                            + changes.toDelete().size() + " deletes"));
                }
            } else {
                for (Person person : changes.toDelete()) {
                    batchTimer.admit();
                    inFlight.add(submit("DeleteUser", "delete", person, operations::delete, results::incrementDeleted, eventLog));
                }
            }
        } catch (DispatchInterruptedException e) {
            log.error("Apply phase interrupted after dispatching {} of {} operations", inFlight.size(), changes.size());
            results.addError(e.getMessage());
        }

        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();

        log.info("Applied change set: created {}, updated {}, deleted {} ({} planned)",
                results.getCreated(), results.getUpdated(), results.getDeleted(), changes.size());
        return results;
    }

    private CompletableFuture<Void> submit(String eventName,
                                           String verb,
                                           Person person,
                                           Consumer<Person> operation,
                                           Runnable onSuccess,
                                           EventLogSink eventLog) {
        Runnable task = () -> {
            try {
                operation.accept(person);
                onSuccess.run();
                eventLog.publish(EventLogEntry.info(eventName + " " + person.compareKey()));
            } catch (Exception e) {
                eventLog.publish(EventLogEntry.error("unable to " + verb + " user " + person.compareKey()
                        + ", error: " + e.getMessage()));
            }
        };

        try {
            return CompletableFuture.runAsync(task, applyExecutor);
        } catch (RejectedExecutionException e) {
            eventLog.publish(EventLogEntry.error("unable to schedule " + verb + " for user " + person.compareKey()
                    + ", error: " + e.getMessage()));
            return CompletableFuture.completedFuture(null);
        }
    }
}
