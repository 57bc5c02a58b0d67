package com.journal.archive.descriptor;

import java.util.List;
import java.util.Map;

/**
 * An event the entry belongs to, with the scenes of this entry that belong to it.
 */
public record EventSpec(String name, List<String> scenes, Map<String, Object> attributes) {

    public EventSpec {
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static EventSpec of(String name, String... scenes) {
        return new EventSpec(name, List.of(scenes), null);
    }
}
