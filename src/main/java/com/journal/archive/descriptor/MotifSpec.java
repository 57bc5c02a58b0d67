package com.journal.archive.descriptor;

/**
 * One instance of a motif in the entry.
 *
 * @param locator excerpt or scene reference locating the instance
 */
public record MotifSpec(String name, String locator, String description) {

    public static MotifSpec of(String name, String locator) {
        return new MotifSpec(name, locator, null);
    }
}
