package com.edwardjones.personnelsync.model.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The comparable unit of a reconciliation run.
 *
 * Instances are produced fresh on every run by the adapters or the attribute projector and are
 * never mutated; the {@code with*} methods return copies.
 *
 * @param compareKey      identity used to match source and destination records, case-insensitive
 * @param externalId      destination handle used for update/delete addressing, null if unknown
 * @param attributes      flat attribute name to value mapping
 * @param changesDisabled true if the record must not be created or updated
 */
public record Person(
    String compareKey,
    String externalId,
    Map<String, String> attributes,
    boolean changesDisabled
) {

    public Person {
        Objects.requireNonNull(compareKey, "compareKey must not be null");
        attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Person of(String compareKey, Map<String, String> attributes) {
        return new Person(compareKey, null, attributes, false);
    }

    /**
     * Lower-cased compare key; two persons are the same identity when these are equal.
     */
    public String normalizedKey() {
        return normalize(compareKey);
    }

    public Person withChangesDisabled() {
        return changesDisabled ? this : new Person(compareKey, externalId, attributes, true);
    }

    public Person withExternalId(String id) {
        return Objects.equals(externalId, id) ? this : new Person(compareKey, id, attributes, changesDisabled);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public static String normalize(String compareKey) {
        return compareKey == null ? null : compareKey.toLowerCase(Locale.ROOT);
    }
}
