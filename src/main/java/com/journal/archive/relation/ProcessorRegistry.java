package com.journal.archive.relation;

import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.EventSpec;
import com.journal.archive.descriptor.NameSpec;
import com.journal.archive.resolve.EntityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Holds one processor per relationship kind and the order they run in.
 *
 * <p>The order is a topological sort of the prerequisite graph; kinds without
 * mutual dependencies keep their declaration order.</p>
 */
public class ProcessorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private final Map<RelationKind, RelationshipProcessor<?>> processors;
    private final List<RelationshipProcessor<?>> ordered;

    /**
     * @throws IllegalArgumentException if a kind has no processor or two processors
     * @throws IllegalStateException    if the prerequisite graph has a cycle
     */
    public ProcessorRegistry(Collection<? extends RelationshipProcessor<?>> processors) {
        this.processors = new EnumMap<>(RelationKind.class);
        for (RelationshipProcessor<?> processor : processors) {
            if (this.processors.put(processor.kind(), processor) != null) {
                throw new IllegalArgumentException("Duplicate processor for " + processor.kind());
            }
        }
        for (RelationKind kind : RelationKind.values()) {
            if (!this.processors.containsKey(kind)) {
                throw new IllegalArgumentException("No processor registered for " + kind);
            }
        }
        this.ordered = topologicalOrder(this.processors);
        log.debug("processors.ordered order={}", ordered.stream().map(RelationshipProcessor::kind).toList());
    }

    public static ProcessorRegistry defaults() {
        List<RelationshipProcessor<?>> processors = new ArrayList<>();
        processors.add(new PeopleProcessor());
        processors.add(new SimpleRelationshipProcessor<NameSpec>(
                RelationKind.CITIES, SpecCascades::cities, ProcessorRegistry::named));
        processors.add(new SimpleRelationshipProcessor<NameSpec>(
                RelationKind.TAGS, EntryDescriptor::tags, ProcessorRegistry::named));
        processors.add(new SimpleRelationshipProcessor<NameSpec>(
                RelationKind.THEMES, EntryDescriptor::themes, ProcessorRegistry::named));
        processors.add(new SequencedMembershipProcessor(RelationKind.ARCS, EntryDescriptor::arcs));
        processors.add(new SequencedMembershipProcessor(RelationKind.THREADS, EntryDescriptor::threads));
        processors.add(new NarratedDateProcessor());
        processors.add(new PoemProcessor());
        processors.add(new MotifProcessor());
        processors.add(new ReferenceProcessor());
        processors.add(new SimpleRelationshipProcessor<EventSpec>(
                RelationKind.EVENT_ENTRIES, EntryDescriptor::events, ProcessorRegistry::event));
        processors.add(new LocationProcessor());
        processors.add(new SceneProcessor());
        processors.add(new EventSceneProcessor());
        return new ProcessorRegistry(processors);
    }

    /**
     * Processors in execution order.
     */
    public List<RelationshipProcessor<?>> ordered() {
        return ordered;
    }

    public RelationshipProcessor<?> get(RelationKind kind) {
        return processors.get(kind);
    }

    /**
     * Kahn's algorithm over the prerequisite edges. Ready kinds are taken in enum order.
     */
    static List<RelationshipProcessor<?>> topologicalOrder(Map<RelationKind, RelationshipProcessor<?>> processors) {
        Map<RelationKind, Integer> pending = new EnumMap<>(RelationKind.class);
        Map<RelationKind, List<RelationKind>> dependents = new EnumMap<>(RelationKind.class);
        for (RelationKind kind : processors.keySet()) {
            pending.put(kind, kind.prerequisites().size());
            for (RelationKind prerequisite : kind.prerequisites()) {
                dependents.computeIfAbsent(prerequisite, k -> new ArrayList<>()).add(kind);
            }
        }

        Deque<RelationKind> ready = new ArrayDeque<>();
        for (RelationKind kind : processors.keySet()) {
            if (pending.get(kind) == 0) {
                ready.add(kind);
            }
        }

        List<RelationshipProcessor<?>> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            RelationKind kind = ready.poll();
            order.add(processors.get(kind));
            for (RelationKind dependent : dependents.getOrDefault(kind, List.of())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != processors.size()) {
            List<RelationKind> stuck = pending.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .toList();
            throw new IllegalStateException("Relationship prerequisites form a cycle among " + stuck);
        }
        return List.copyOf(order);
    }

    private static EntityDescriptor named(NameSpec spec) {
        return new EntityDescriptor(spec.name(), spec.disambiguator(), null, null, spec.attributes());
    }

    private static EntityDescriptor event(EventSpec spec) {
        return new EntityDescriptor(spec.name(), null, null, null, spec.attributes());
    }
}
