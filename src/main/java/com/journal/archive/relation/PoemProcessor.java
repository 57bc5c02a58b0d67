package com.journal.archive.relation;

import com.journal.archive.core.model.Entity;
import com.journal.archive.core.model.EntityKind;
import com.journal.archive.core.model.PoemVersion;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.PoemSpec;
import com.journal.archive.resolve.EntityDescriptor;
import com.journal.archive.store.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Poems of the entry. Versions are append-only: a new version is stored only
 * when no stored version of the poem has the same content hash, so drafts
 * carried by different entries never re-append on re-ingestion.
 */
public class PoemProcessor extends AbstractRelationshipProcessor<PoemSpec> {
    private static final Logger log = LoggerFactory.getLogger(PoemProcessor.class);

    public PoemProcessor() {
        super(RelationKind.POEMS);
    }

    @Override
    public List<PoemSpec> declaredSpecs(EntryDescriptor descriptor) {
        return descriptor.poems();
    }

    @Override
    protected List<AssociationTarget> targetsFor(ReconciliationContext context, PoemSpec spec) {
        if (isBlank(spec.content())) {
            throw invalid(spec, "poem has no content");
        }
        Entity poem = context.resolve(EntityKind.POEM, EntityDescriptor.of(spec.title())).entity();
        return List.of(AssociationTarget.of(poem, spec));
    }

    @Override
    protected void afterSync(ReconciliationContext context, Collection<AssociationTarget> targets,
                             ReconcileMode mode, Changes changes) {
        for (AssociationTarget target : targets) {
            PoemSpec spec = (PoemSpec) target.spec();
            String content = normalizeContent(spec.content());
            String hash = JsonCodec.sha256(content);
            long poemId = target.entity().getId();
            Optional<PoemVersion> known = context.uow().poemVersions().findByHash(poemId, hash);
            if (known.isPresent()) {
                continue;
            }
            LocalDate revisionDate = spec.revisionDate() != null ? spec.revisionDate() : context.entry().date();
            PoemVersion version = context.uow().poemVersions()
                    .append(poemId, context.entry().id(), content, hash, revisionDate, context.uow().now());
            changes.updated();
            log.debug("poem.versionAppended poem={} version={} entry={}",
                    target.entity().displayKey(), version.id(), context.entry().date());
        }
    }

    static String normalizeContent(String content) {
        return content.replace("\r\n", "\n").strip();
    }
}
