package com.journal.archive.relation;

import com.journal.archive.core.model.EntityKind;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.NarratedDateSpec;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.Resolution;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dates the entry narrates, declared directly or through scene dates.
 * Accepted forms: {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD}, each optionally prefixed by {@code ~}.
 */
public class NarratedDateProcessor extends AbstractRelationshipProcessor<NarratedDateSpec> {

    static final Pattern DATE_EXPRESSION =
            Pattern.compile("~?\\d{4}(-(0[1-9]|1[0-2])(-(0[1-9]|[12]\\d|3[01]))?)?");

    public NarratedDateProcessor() {
        super(RelationKind.NARRATED_DATES);
    }

    @Override
    public List<NarratedDateSpec> declaredSpecs(EntryDescriptor descriptor) {
        return SpecCascades.narratedDates(descriptor);
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, NarratedDateSpec spec) {
        String date = spec.date() != null ? spec.date().strip() : "";
        if (!DATE_EXPRESSION.matcher(date).matches()) {
            throw invalid(spec, "malformed narrated date '" + spec.date() + "'");
        }
        Map<String, Object> attributes = new HashMap<>();
        if (!isBlank(spec.context())) {
            attributes.put("context", spec.context());
        }
        Resolution resolution = context.resolve(EntityKind.NARRATED_DATE,
                new EntityDescriptor(date, null, null, null, attributes));
        return List.of(AssociationTarget.of(resolution.entity(), spec));
    }
}
