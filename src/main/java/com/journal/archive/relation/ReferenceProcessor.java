package com.journal.archive.relation;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.ReferenceMode;
import com.journal.archive.core.model.ReferenceType;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.ReferenceSpec;
import com.journal.archive.descriptor.SourceSpec;
import com.journal.archive.resolve.EntityDescriptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * References to outside works. The source is resolved first and becomes the
 * parent of the reference; a reference without a source is rejected.
 * The speaker, when given, is the association role.
 */
public class ReferenceProcessor extends AbstractRelationshipProcessor<ReferenceSpec> {

    public ReferenceProcessor() {
        super(RelationKind.REFERENCES);
    }

    @Override
    public List<ReferenceSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.references();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, ReferenceSpec spec) {
        SourceSpec source = spec.source();
        if (source == null || isBlank(source.title())) {
            throw invalid(spec, "reference has no source");
        }
        String text = !isBlank(spec.content()) ? spec.content() : spec.description();
        if (isBlank(text)) {
            throw invalid(spec, "reference has neither content nor description");
        }

        Map<String, Object> sourceAttributes = new HashMap<>();
        if (source.type() != null) {
            sourceAttributes.put("type", ReferenceType.fromValue(source.type()).name());
        }
        if (source.url() != null) {
            sourceAttributes.put("url", source.url());
        }
        Map<String, Object> attributes = new HashMap<>();
        if (spec.mode() != null) {
            attributes.put("mode", ReferenceMode.fromValue(spec.mode()).name());
        }
        if (spec.description() != null && !text.equals(spec.description())) {
            attributes.put("description", spec.description());
        }

        Entity sourceEntity = context.resolve(EntityKind.REFERENCE_SOURCE,
                new EntityDescriptor(source.title(), source.author(), null, null, sourceAttributes)).entity();
        Entity reference = context.resolve(EntityKind.REFERENCE,
                new EntityDescriptor(text, sourceEntity.displayKey(), sourceEntity.getId(), null, attributes))
                .entity();
        String speaker = isBlank(spec.speaker()) ? null : spec.speaker().strip();
        return List.of(AssociationTarget.of(reference, spec).withRole(speaker));
    }
}
