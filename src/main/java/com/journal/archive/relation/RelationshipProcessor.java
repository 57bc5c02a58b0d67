package com.journal.archive.relation;

import com.journal.archive.descriptor.EntryDescriptor;

import java.util.List;

/**
 * Reconciles one relationship kind of one entry against its declared specs.
 *
 * @param <S> spec type declared for this kind
 */
public interface RelationshipProcessor<S> {

    RelationKind kind();

    /**
     * Specs declared for this kind, including specs cascaded from other kinds
     * (cities of locations, dates of scenes).
     */
    List<S> declaredSpecs(EntryDescriptor descriptor);

    /**
     * Brings the stored associations of {@code context.entry()} in line with {@code specs}.
     * Runs inside the caller's transaction; any exception aborts the whole reconciliation.
     */
    ReconciliationDelta apply(ReconciliationContext context, List<S> specs, ReconcileMode mode);
}
