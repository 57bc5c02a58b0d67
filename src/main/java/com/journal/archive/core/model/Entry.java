package com.journal.archive.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One dated unit of source material. At most one entry exists per calendar day.
 */
public record Entry(
        long id,
        LocalDate date,
        String contentDigest,
        String metadataDigest,
        int wordCount,
        Instant deletedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public Entry {
        Objects.requireNonNull(date, "date is required");
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount must be >= 0");
        }
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
