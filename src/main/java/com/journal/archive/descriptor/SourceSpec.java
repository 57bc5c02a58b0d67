package com.journal.archive.descriptor;

/**
 * The work a reference is taken from.
 */
public record SourceSpec(String title, String author, String type, String url) {

    public static SourceSpec of(String title, String author) {
        return new SourceSpec(title, author, null, null);
    }
}
