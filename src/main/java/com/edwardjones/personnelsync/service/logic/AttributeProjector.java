package com.edwardjones.personnelsync.service.logic;

import com.edwardjones.personnelsync.model.domain.AttributeMapping;
import com.edwardjones.personnelsync.model.domain.Person;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-keys source people onto the attribute names the destination uses.
 *
 * A person missing a required attribute is not dropped: it is returned with changes disabled so it
 * still protects its destination counterpart from deletion. This step never fails the run.
 */
@Slf4j
@Component
public class AttributeProjector {

    public List<Person> project(List<Person> sourcePeople, List<AttributeMapping> mapping) {
        List<Person> projected = new ArrayList<>(sourcePeople.size());

        for (Person person : sourcePeople) {
            Map<String, String> attrs = new LinkedHashMap<>();
            boolean disableChanges = false;

            for (AttributeMapping entry : mapping) {
                String value = person.attributes().get(entry.sourceKey());
                if (value != null) {
                    attrs.put(entry.destinationKey(), value);
                } else if (entry.required()) {
                    log.warn("Person {} is missing required attribute '{}'; changes disabled for this record",
                            person.compareKey(), entry.sourceKey());
                    disableChanges = true;
                }
            }

            // Source ids are not destination handles
            projected.add(new Person(person.compareKey(), null, attrs, disableChanges));
        }

        long degraded = projected.stream().filter(Person::changesDisabled).count();
        if (degraded > 0) {
            log.info("Projected {} source people, {} with changes disabled", projected.size(), degraded);
        }
        return projected;
    }

    /**
     * Source-side keys named by the mapping, in mapping order.
     */
    public static List<String> sourceKeys(List<AttributeMapping> mapping) {
        return mapping.stream().map(AttributeMapping::sourceKey).distinct().toList();
    }

    /**
     * Destination-side keys named by the mapping, in mapping order.
     */
    public static List<String> destinationKeys(List<AttributeMapping> mapping) {
        return mapping.stream().map(AttributeMapping::destinationKey).distinct().toList();
    }
}
