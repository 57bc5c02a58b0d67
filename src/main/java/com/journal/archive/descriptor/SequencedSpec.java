package com.journal.archive.descriptor;

import java.util.Map;

/**
 * Membership of the entry in a thread or an arc.
 *
 * @param sequence optional position label; across members it must grow with entry date
 */
public record SequencedSpec(String name, Integer sequence, Map<String, Object> attributes) {

    public SequencedSpec {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static SequencedSpec of(String name) {
        return new SequencedSpec(name, null, null);
    }

    public static SequencedSpec of(String name, int sequence) {
        return new SequencedSpec(name, sequence, null);
    }
}
