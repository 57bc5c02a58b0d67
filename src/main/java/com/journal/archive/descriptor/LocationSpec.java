package com.journal.archive.descriptor;

import java.util.Map;

/**
 * A location, optionally qualified by its city. Without a city the name must
 * match exactly one existing location.
 */
public record LocationSpec(String name, String city, Map<String, Object> attributes) {

    public LocationSpec {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static LocationSpec of(String name, String city) {
        return new LocationSpec(name, city, null);
    }
}
