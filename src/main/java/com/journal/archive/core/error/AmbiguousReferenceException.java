package com.journal.archive.core.error;

import com.journal.archive.core.model.EntityKind;

import java.util.List;

/**
 * Raised when a name without a disambiguator matches more than one live entity.
 * The caller must supply a disambiguator; the failure is not retried.
 */
public class AmbiguousReferenceException extends ArchiveException {

    private final EntityKind kind;
    private final String name;
    private final List<String> candidates;

    public AmbiguousReferenceException(EntityKind kind, String name, List<String> candidates) {
        super(kind.getLabel() + " '" + name + "' is ambiguous, candidates: " + candidates
                + ". Add a disambiguator.");
        this.kind = kind;
        this.name = name;
        this.candidates = List.copyOf(candidates);
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
