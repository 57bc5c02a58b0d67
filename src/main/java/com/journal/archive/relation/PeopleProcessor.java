package com.journal.archive.relation;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.RelationType;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.PersonSpec;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.Resolution;

import java.util.List;

/**
 * People mentioned by the entry. The declared relation type is kept as the association role.
 */
public class PeopleProcessor extends AbstractRelationshipProcessor<PersonSpec> {

    public PeopleProcessor() {
        super(RelationKind.PEOPLE);
    }

    @Override
    public List<PersonSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.people();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, PersonSpec spec) {
        String role = spec.relationType() != null ? RelationType.fromValue(spec.relationType()).name() : null;
        Resolution person = context.resolve(EntityKind.PERSON,
                new EntityDescriptor(spec.name(), spec.disambiguator(), null, null, spec.attributes()));
        return List.of(AssociationTarget.of(person.entity(), spec).withRole(role));
    }
}
