package com.edwardjones.personnelsync.service.logic;

import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the create/update/delete lists that make the destination match the source.
 *
 * Matching is on the lower-cased compare key through a hash index. When a listing holds duplicate
 * keys the first one in listing order wins.
 */
@Slf4j
@Component
public class DiffEngine {

    public enum MembershipStatus {
        ABSENT,
        PRESENT_IDENTICAL,
        PRESENT_DIFFERENT
    }

    public ChangeSet diff(List<Person> source, List<Person> destination) {
        Map<String, Person> destinationIndex = index(destination);
        Map<String, Person> sourceIndex = index(source);

        List<Person> toCreate = new ArrayList<>();
        List<Person> toUpdate = new ArrayList<>();
        List<Person> toDelete = new ArrayList<>();

        for (Person sp : source) {
            // Degraded records are never written, but still count as present below
            if (sp.changesDisabled()) {
                continue;
            }

            Person match = destinationIndex.get(sp.normalizedKey());
            switch (statusOf(sp, match)) {
                case ABSENT -> toCreate.add(sp);
                case PRESENT_DIFFERENT -> toUpdate.add(sp.withExternalId(match.externalId()));
                case PRESENT_IDENTICAL -> log.trace("Person {} is in sync", sp.compareKey());
            }
        }

        for (Person dp : destination) {
            if (!sourceIndex.containsKey(dp.normalizedKey())) {
                toDelete.add(dp);
            }
        }

        log.debug("Diff complete - create: {}, update: {}, delete: {}", toCreate.size(), toUpdate.size(), toDelete.size());
        return new ChangeSet(toCreate, toUpdate, toDelete);
    }

    /**
     * Membership of a single person in the given listing.
     */
    public MembershipStatus statusOf(Person person, List<Person> listing) {
        return statusOf(person, index(listing).get(person.normalizedKey()));
    }

    private MembershipStatus statusOf(Person person, Person match) {
        if (match == null) {
            return MembershipStatus.ABSENT;
        }
        // Full structural equality: a destination-only attribute is a difference too
        if (!person.attributes().equals(match.attributes())) {
            log.debug("Attributes differ for {}: source={}, destination={}",
                    person.compareKey(), person.attributes(), match.attributes());
            return MembershipStatus.PRESENT_DIFFERENT;
        }
        return MembershipStatus.PRESENT_IDENTICAL;
    }

    private static Map<String, Person> index(List<Person> people) {
        Map<String, Person> index = new HashMap<>(people.size() * 2);
        for (Person person : people) {
            index.putIfAbsent(person.normalizedKey(), person);
        }
        return index;
    }
}
