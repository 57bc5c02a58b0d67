package com.journal.archive.relation;

import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.Resolution;

import java.util.List;
import java.util.function.Function;

/**
 * Processor for kinds whose specs map one-to-one onto an entity with no
 * association metadata: cities, tags, themes and events as entry tags.
 */
public class SimpleRelationshipProcessor<S> extends AbstractRelationshipProcessor<S> {

    private final Function<EntryDescriptor, List<S>> declared;
    private final Function<S, EntityDescriptor> describe;

    public SimpleRelationshipProcessor(RelationKind kind, Function<EntryDescriptor, List<S>> declared,
                                       Function<S, EntityDescriptor> describe) {
        super(kind);
        this.declared = declared;
        this.describe = describe;
    }

    @Override
    public List<S> declaredSpecs(EntryDescriptor descriptor) {
        return declared.apply(descriptor);
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, S spec) {
        Resolution resolution = context.resolve(kind().targetKind(), describe.apply(spec));
        return List.of(AssociationTarget.of(resolution.entity(), spec));
    }
}
