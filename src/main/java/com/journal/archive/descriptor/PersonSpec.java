package com.journal.archive.descriptor;

import java.util.Map;

/**
 * A person mentioned by an entry.
 *
 * @param relationType relation to the author on this entry, stored as association role
 * @param attributes   editable person fields such as {@code full_name} or {@code alias}
 */
public record PersonSpec(String name, String disambiguator, String relationType, Map<String, Object> attributes) {

    public PersonSpec {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static PersonSpec of(String name) {
        return new PersonSpec(name, null, null, null);
    }
}
