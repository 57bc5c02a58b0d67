package com.journal.archive.descriptor;

import java.time.LocalDate;

/**
 * A poem written or revised in the entry.
 */
public record PoemSpec(String title, String content, LocalDate revisionDate) {

    public static PoemSpec of(String title, String content) {
        return new PoemSpec(title, content, null);
    }
}
