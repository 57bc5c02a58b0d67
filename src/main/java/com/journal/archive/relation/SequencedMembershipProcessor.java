package com.journal.archive.relation;

import com.journal.archive.core.error.OrderingViolationException;
import com.journal.archive.core.model.Association;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.SequencedSpec;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.resolve.Resolution;
import com.journal.archive.store.AssociationRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Membership in threads and arcs. Members are read back in entry date order; an
 * optional sequence number is stored as the association ordinal and must grow
 * with entry date across all members and stay unique.
 */
public class SequencedMembershipProcessor extends AbstractRelationshipProcessor<SequencedSpec> {

    private final Function<EntryDescriptor, List<SequencedSpec>> declared;

    public SequencedMembershipProcessor(RelationKind kind, Function<EntryDescriptor, List<SequencedSpec>> declared) {
        super(kind);
        this.declared = declared;
    }

    @Override
    public List<SequencedSpec> declaredSpecs(EntryDescriptor descriptor) {
        return declared.apply(descriptor);
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, SequencedSpec spec) {
        Resolution resolution = context.resolve(kind().targetKind(),
                new EntityDescriptor(spec.name(), null, null, null, spec.attributes()));
        return List.of(AssociationTarget.of(resolution.entity(), spec).withOrdinal(spec.sequence()));
    }

    @Override
    protected void validate(ReconciliationContext context, Collection<AssociationTarget> targets,
                            List<Association> current, ReconcileMode mode) {
        LocalDate date = context.entry().date();
        long entryId = context.entry().id();
        for (AssociationTarget target : targets) {
            Integer sequence = target.ordinal();
            if (sequence == null) {
                continue;
            }
            for (AssociationRepository.Member member : context.uow().associations()
                    .members(target.entity().getId(), kind().associationName())) {
                if (member.entryId() == entryId || member.sequence() == null) {
                    continue;
                }
                int other = member.sequence();
                boolean outOfOrder = (other < sequence && member.entryDate().isAfter(date))
                        || (other > sequence && member.entryDate().isBefore(date));
                if (other == sequence || outOfOrder) {
                    throw new OrderingViolationException(target.entity().displayKey(), date, member.entryDate(),
                            "sequence " + sequence + " on " + date + " conflicts with sequence " + other
                                    + " on " + member.entryDate());
                }
            }
        }
    }
}
