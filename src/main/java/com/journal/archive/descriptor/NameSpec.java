package com.journal.archive.descriptor;

import java.util.Map;

/**
 * A spec naming an entity by name and optional disambiguator: cities, tags, themes.
 */
public record NameSpec(String name, String disambiguator, Map<String, Object> attributes) {

    public NameSpec {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static NameSpec of(String name) {
        return new NameSpec(name, null, null);
    }
}
