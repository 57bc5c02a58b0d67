package com.journal.archive.relation;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.LocationSpec;
import com.journal.archive.resolve.EntityDescriptor;

import java.util.List;

/**
 * Locations of the entry. A location is keyed by its name and its city, and the
 * city becomes the location's parent. A location declared without a city must
 * name exactly one existing location.
 */
public class LocationProcessor extends AbstractRelationshipProcessor<LocationSpec> {

    public LocationProcessor() {
        super(RelationKind.LOCATIONS);
    }

    @Override
    public List<LocationSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.locations();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, LocationSpec spec) {
        if (isBlank(spec.city())) {
            Entity existing = context.find(EntityKind.LOCATION, EntityDescriptor.of(spec.name()))
                    .orElseThrow(() -> invalid(spec, "location has no city and matches no existing location"));
            return List.of(AssociationTarget.of(existing, spec));
        }
        Entity city = context.resolve(EntityKind.CITY, EntityDescriptor.of(spec.city())).entity();
        Entity location = context.resolve(EntityKind.LOCATION,
                new EntityDescriptor(spec.name(), city.displayKey(), city.getId(), null, spec.attributes())).entity();
        return List.of(AssociationTarget.of(location, spec));
    }
}
