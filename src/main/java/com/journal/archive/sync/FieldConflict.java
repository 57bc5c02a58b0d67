package com.journal.archive.sync;

/**
 * An editable field changed on both sides since the last merge, to different values.
 */
public record FieldConflict(String field, Object storeValue, Object noteValue, Object baselineValue) {
}
