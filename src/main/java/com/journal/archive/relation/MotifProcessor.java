package com.journal.archive.relation;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.MotifSpec;
import com.journal.archive.resolve.EntityDescriptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Motif instances. The same motif may appear several times in an entry with
 * different locators; the same (motif, locator) pair collapses to one instance.
 */
public class MotifProcessor extends AbstractRelationshipProcessor<MotifSpec> {

    public MotifProcessor() {
        super(RelationKind.MOTIFS);
    }

    @Override
    public List<MotifSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.motifs();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, MotifSpec spec) {
        if (isBlank(spec.locator())) {
            throw invalid(spec, "motif instance has no locator");
        }
        Map<String, Object> attributes = new HashMap<>();
        if (spec.description() != null) {
            attributes.put("description", spec.description());
        }
        Entity motif = context.resolve(EntityKind.MOTIF,
                new EntityDescriptor(spec.name(), null, null, null, attributes)).entity();
        String locator = spec.locator().strip().replaceAll("\\s+", " ");
        return List.of(AssociationTarget.of(motif, spec).withLocator(locator));
    }
}
