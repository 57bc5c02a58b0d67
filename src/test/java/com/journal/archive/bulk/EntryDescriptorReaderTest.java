package com.journal.archive.bulk;

import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.LocationSpec;
import com.journal.archive.descriptor.PersonSpec;
import com.journal.archive.descriptor.SceneSpec;
import com.journal.archive.store.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntryDescriptorReaderTest {

    private EntryDescriptorReader reader;

    @BeforeEach
    void setUp() {
        reader = new EntryDescriptorReader(new JsonCodec().mapper());
    }

    @Test
    @DisplayName("Should read a JSON array of entries")
    void testReadArray() {
        String json = """
                [
                  {"date": "2024-03-01", "content_digest": "abc", "word_count": 412,
                   "people": ["Alice", {"name": "Bob", "disambiguator": "Smith", "relation_type": "friend",
                                        "attributes": {"alias": "Bobby"}}],
                   "locations": [{"name": "Café Flore", "city": "Paris"}, "Home"],
                   "tags": ["travel"],
                   "scenes": [{"name": "Breakfast", "dates": ["2024-02-28"], "people": ["Alice"]}],
                   "events": [{"name": "Paris trip", "scenes": ["Breakfast"]}],
                   "threads": [{"name": "Letters", "sequence": 2}],
                   "motifs": [{"name": "rain", "locator": "p. 2"}],
                   "references": [{"content": "To be or not", "mode": "direct",
                                   "source": {"title": "Hamlet", "author": "Shakespeare", "type": "book"}}],
                   "poems": [{"title": "Ode", "content": "line", "revision_date": "2024-02-29"}]},
                  {"date": "2024-03-02"}
                ]
                """;

        DescriptorReadResult result = reader.read(new StringReader(json));

        assertFalse(result.hasErrors());
        assertEquals(2, result.descriptors().size());

        EntryDescriptor first = result.descriptors().get(0);
        assertEquals(LocalDate.of(2024, 3, 1), first.date());
        assertEquals("abc", first.contentDigest());
        assertEquals(412, first.wordCount());
        assertEquals(PersonSpec.of("Alice"), first.people().get(0));
        assertEquals(new PersonSpec("Bob", "Smith", "friend", Map.of("alias", "Bobby")), first.people().get(1));
        assertEquals(new LocationSpec("Café Flore", "Paris", null), first.locations().get(0));
        assertEquals("Home", first.locations().get(1).name());
        assertNull(first.locations().get(1).city());
        assertEquals(new SceneSpec("Breakfast", null, null, List.of("2024-02-28"), List.of("Alice"), null),
                first.scenes().get(0));
        assertEquals(List.of("Breakfast"), first.events().get(0).scenes());
        assertEquals(2, first.threads().get(0).sequence());
        assertEquals("rain", first.motifs().get(0).name());
        assertEquals("Hamlet", first.references().get(0).source().title());
        assertEquals("book", first.references().get(0).source().type());
        assertEquals(LocalDate.of(2024, 2, 29), first.poems().get(0).revisionDate());

        EntryDescriptor second = result.descriptors().get(1);
        assertTrue(second.people().isEmpty());
        assertNull(second.contentDigest());
        assertEquals(0, second.wordCount());
    }

    @Test
    @DisplayName("Should read one entry per line")
    void testReadLines() {
        String lines = "{\"date\": \"2024-03-01\", \"tags\": [\"a\"]}\n"
                + "{\"date\": \"2024-03-02\", \"tags\": [\"b\"]}\n";

        DescriptorReadResult result = reader.read(
                new ByteArrayInputStream(lines.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, result.descriptors().size());
        assertEquals("b", result.descriptors().get(1).tags().get(0).name());
    }

    @Test
    @DisplayName("Should report invalid records and keep the valid ones")
    void testInvalidRecords() {
        String lines = """
                {"date": "2024-03-01"}
                {"tags": ["no date"]}
                {"date": "2024-13-40"}
                {"date": "2024-03-04", "tags": "travel"}
                {"date": "2024-03-05", "arcs": [{"name": "Move", "sequence": "first"}]}
                ["not", "an", "object"]
                {"date": "2024-03-07"}
                """;

        DescriptorReadResult result = reader.read(new StringReader(lines));

        assertEquals(2, result.descriptors().size());
        assertEquals(LocalDate.of(2024, 3, 7), result.descriptors().get(1).date());
        assertEquals(List.of(2L, 3L, 4L, 5L, 6L), result.errors().stream()
                .map(DescriptorReadResult.ReadError::recordNumber)
                .toList());
        assertTrue(result.errors().get(2).message().contains("tags"));
    }

    @Test
    @DisplayName("Should stop at malformed JSON and keep what was read")
    void testMalformedJson() {
        String lines = "{\"date\": \"2024-03-01\"}\n{\"date\": ";

        DescriptorReadResult result = reader.read(new StringReader(lines));

        assertEquals(1, result.descriptors().size());
        assertEquals(1, result.errors().size());
        assertEquals(0, result.errors().get(0).recordNumber());
    }
}
