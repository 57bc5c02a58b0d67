package com.journal.archive.core.error;

import java.time.LocalDate;

/**
 * Raised when adding an entry to a thread or arc would break the chronological
 * order of its members. The entry is not added.
 */
public class OrderingViolationException extends ArchiveException {

    private final String memberOf;
    private final LocalDate entryDate;
    private final LocalDate conflictingDate;

    public OrderingViolationException(String memberOf, LocalDate entryDate, LocalDate conflictingDate,
                                      String message) {
        super(memberOf + ": " + message);
        this.memberOf = memberOf;
        this.entryDate = entryDate;
        this.conflictingDate = conflictingDate;
    }

    public String getMemberOf() {
        return memberOf;
    }

    public LocalDate getEntryDate() {
        return entryDate;
    }

    public LocalDate getConflictingDate() {
        return conflictingDate;
    }
}
