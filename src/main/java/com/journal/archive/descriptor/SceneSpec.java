package com.journal.archive.descriptor;

import java.util.List;

/**
 * A scene of the entry. People and locations are referenced by name and must
 * also be declared at entry level; dates become narrated dates of the entry.
 */
public record SceneSpec(
        String name,
        String description,
        String timeOfDay,
        List<String> dates,
        List<String> people,
        List<String> locations
) {
    public SceneSpec {
        dates = dates != null ? List.copyOf(dates) : List.of();
        people = people != null ? List.copyOf(people) : List.of();
        locations = locations != null ? List.copyOf(locations) : List.of();
    }

    public static SceneSpec of(String name) {
        return new SceneSpec(name, null, null, null, null, null);
    }
}
