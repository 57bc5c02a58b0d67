package com.journal.archive.core.error;

/**
 * Raised for a malformed or unsatisfiable relationship spec, for example a
 * reference without a source. The whole reconciliation of the entry is rolled back.
 */
public class InvalidAssociationException extends ArchiveException {

    private final String relation;
    private final Object spec;

    public InvalidAssociationException(String relation, Object spec, String message) {
        super(relation + ": " + message + " [spec=" + spec + "]");
        this.relation = relation;
        this.spec = spec;
    }

    public InvalidAssociationException(String relation, Object spec, String message, Throwable cause) {
        super(relation + ": " + message + " [spec=" + spec + "]", cause);
        this.relation = relation;
        this.spec = spec;
    }

    public String getRelation() {
        return relation;
    }

    public Object getSpec() {
        return spec;
    }
}
