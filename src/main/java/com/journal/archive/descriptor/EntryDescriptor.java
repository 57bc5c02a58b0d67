package com.journal.archive.descriptor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the ingestion side declares about one entry: identity, content
 * digest and the full list of relationship specs per kind.
 */
public record EntryDescriptor(
        LocalDate date,
        String contentDigest,
        int wordCount,
        List<PersonSpec> people,
        List<NameSpec> cities,
        List<LocationSpec> locations,
        List<NameSpec> tags,
        List<NameSpec> themes,
        List<NarratedDateSpec> narratedDates,
        List<SceneSpec> scenes,
        List<EventSpec> events,
        List<SequencedSpec> threads,
        List<SequencedSpec> arcs,
        List<MotifSpec> motifs,
        List<ReferenceSpec> references,
        List<PoemSpec> poems
) {
    public EntryDescriptor {
        Objects.requireNonNull(date, "date is required");
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount must be >= 0");
        }
        people = copy(people);
        cities = copy(cities);
        locations = copy(locations);
        tags = copy(tags);
        themes = copy(themes);
        narratedDates = copy(narratedDates);
        scenes = copy(scenes);
        events = copy(events);
        threads = copy(threads);
        arcs = copy(arcs);
        motifs = copy(motifs);
        references = copy(references);
        poems = copy(poems);
    }

    /**
     * The descriptor without content digest and word count, used to fingerprint
     * the declared metadata.
     */
    public EntryDescriptor metadataOnly() {
        return new EntryDescriptor(date, null, 0, people, cities, locations, tags, themes, narratedDates,
                scenes, events, threads, arcs, motifs, references, poems);
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }

    public static Builder builder(LocalDate date) {
        return new Builder(date);
    }

    public static class Builder {
        private final LocalDate date;
        private String contentDigest;
        private int wordCount;
        private final List<PersonSpec> people = new ArrayList<>();
        private final List<NameSpec> cities = new ArrayList<>();
        private final List<LocationSpec> locations = new ArrayList<>();
        private final List<NameSpec> tags = new ArrayList<>();
        private final List<NameSpec> themes = new ArrayList<>();
        private final List<NarratedDateSpec> narratedDates = new ArrayList<>();
        private final List<SceneSpec> scenes = new ArrayList<>();
        private final List<EventSpec> events = new ArrayList<>();
        private final List<SequencedSpec> threads = new ArrayList<>();
        private final List<SequencedSpec> arcs = new ArrayList<>();
        private final List<MotifSpec> motifs = new ArrayList<>();
        private final List<ReferenceSpec> references = new ArrayList<>();
        private final List<PoemSpec> poems = new ArrayList<>();

        private Builder(LocalDate date) {
            this.date = date;
        }

        public Builder contentDigest(String contentDigest) {
            this.contentDigest = contentDigest;
            return this;
        }

        public Builder wordCount(int wordCount) {
            this.wordCount = wordCount;
            return this;
        }

        public Builder person(PersonSpec spec) {
            people.add(spec);
            return this;
        }

        public Builder person(String name) {
            return person(PersonSpec.of(name));
        }

        public Builder city(String name) {
            cities.add(NameSpec.of(name));
            return this;
        }

        public Builder location(LocationSpec spec) {
            locations.add(spec);
            return this;
        }

        public Builder location(String name, String city) {
            return location(LocationSpec.of(name, city));
        }

        public Builder tag(String name) {
            tags.add(NameSpec.of(name));
            return this;
        }

        public Builder theme(NameSpec spec) {
            themes.add(spec);
            return this;
        }

        public Builder theme(String name) {
            return theme(NameSpec.of(name));
        }

        public Builder narratedDate(NarratedDateSpec spec) {
            narratedDates.add(spec);
            return this;
        }

        public Builder narratedDate(String date) {
            return narratedDate(NarratedDateSpec.of(date));
        }

        public Builder scene(SceneSpec spec) {
            scenes.add(spec);
            return this;
        }

        public Builder event(EventSpec spec) {
            events.add(spec);
            return this;
        }

        public Builder thread(SequencedSpec spec) {
            threads.add(spec);
            return this;
        }

        public Builder arc(SequencedSpec spec) {
            arcs.add(spec);
            return this;
        }

        public Builder motif(MotifSpec spec) {
            motifs.add(spec);
            return this;
        }

        public Builder reference(ReferenceSpec spec) {
            references.add(spec);
            return this;
        }

        public Builder poem(PoemSpec spec) {
            poems.add(spec);
            return this;
        }

        public EntryDescriptor build() {
            return new EntryDescriptor(date, contentDigest, wordCount, people, cities, locations, tags, themes,
                    narratedDates, scenes, events, threads, arcs, motifs, references, poems);
        }
    }
}
