package com.journal.archive.descriptor;

/**
 * A date the entry talks about, e.g. {@code 2019-06-02}, {@code 2019-06} or {@code ~2019}.
 */
public record NarratedDateSpec(String date, String context) {

    public static NarratedDateSpec of(String date) {
        return new NarratedDateSpec(date, null);
    }
}
