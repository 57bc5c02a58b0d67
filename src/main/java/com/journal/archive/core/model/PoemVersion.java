package com.journal.archive.core.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * An immutable revision of a poem. Versions are only ever appended.
 */
public record PoemVersion(
        long id,
        long poemId,
        Long entryId,
        String content,
        String contentHash,
        LocalDate revisionDate,
        Instant createdAt
) {
}
