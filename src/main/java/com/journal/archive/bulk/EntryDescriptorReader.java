package com.journal.archive.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.descriptor.EventSpec;
import com.journal.archive.descriptor.LocationSpec;
import com.journal.archive.descriptor.MotifSpec;
import com.journal.archive.descriptor.NameSpec;
import com.journal.archive.descriptor.NarratedDateSpec;
import com.journal.archive.descriptor.PersonSpec;
import com.journal.archive.descriptor.PoemSpec;
import com.journal.archive.descriptor.ReferenceSpec;
import com.journal.archive.descriptor.SceneSpec;
import com.journal.archive.descriptor.SequencedSpec;
import com.journal.archive.descriptor.SourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads entry descriptors produced by the ingestion side.
 *
 * <p>Accepts either a JSON array of entry objects or one entry object per line:</p>
 * <pre>
 * {"date": "2024-03-01", "content_digest": "9f2c...", "word_count": 412,
 *  "people": ["Alice", {"name": "Bob", "relation_type": "friend"}],
 *  "locations": [{"name": "Cafe Flore", "city": "Paris"}],
 *  "tags": ["travel"],
 *  "scenes": [{"name": "Breakfast", "dates": ["2024-02-28"], "people": ["Alice"]}],
 *  "events": [{"name": "Paris trip", "scenes": ["Breakfast"]}]}
 * </pre>
 *
 * <p>Name-only specs may be given as plain strings. A record that fails to parse
 * is reported and skipped; the others are still returned.</p>
 */
public class EntryDescriptorReader {
    private static final Logger log = LoggerFactory.getLogger(EntryDescriptorReader.class);

    private final ObjectMapper mapper;

    public EntryDescriptorReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public DescriptorReadResult read(InputStream input) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public DescriptorReadResult read(Reader reader) {
        List<EntryDescriptor> descriptors = new ArrayList<>();
        List<DescriptorReadResult.ReadError> errors = new ArrayList<>();
        long recordNumber = 0;
        try (MappingIterator<JsonNode> records = mapper.readerFor(JsonNode.class).readValues(reader)) {
            while (records.hasNextValue()) {
                JsonNode node = records.nextValue();
                recordNumber++;
                try {
                    descriptors.add(toDescriptor(node));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    errors.add(new DescriptorReadResult.ReadError(recordNumber, e.getMessage()));
                    log.warn("descriptors.invalidRecord record={} error={}", recordNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("descriptors.readFailed record={} error={}", recordNumber, e.getMessage());
            errors.add(new DescriptorReadResult.ReadError(0, "IO error: " + e.getMessage()));
        }
        log.info("descriptors.read records={} valid={} invalid={}", recordNumber, descriptors.size(), errors.size());
        return new DescriptorReadResult(descriptors, errors);
    }

    /**
     * Converts one entry object.
     *
     * @throws IllegalArgumentException if the object has no valid date or a spec is malformed
     */
    EntryDescriptor toDescriptor(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("entry record must be a JSON object");
        }
        String date = text(node, "date");
        if (date == null) {
            throw new IllegalArgumentException("entry record has no date");
        }
        return new EntryDescriptor(
                LocalDate.parse(date),
                text(node, "content_digest"),
                node.path("word_count").asInt(0),
                list(node, "people", this::person),
                list(node, "cities", this::name),
                list(node, "locations", this::location),
                list(node, "tags", this::name),
                list(node, "themes", this::name),
                list(node, "narrated_dates", this::narratedDate),
                list(node, "scenes", this::scene),
                list(node, "events", this::event),
                list(node, "threads", this::sequenced),
                list(node, "arcs", this::sequenced),
                list(node, "motifs", this::motif),
                list(node, "references", this::reference),
                list(node, "poems", this::poem));
    }

    // ========== Specs ==========

    private PersonSpec person(JsonNode node) {
        if (node.isTextual()) {
            return PersonSpec.of(node.asText());
        }
        return new PersonSpec(text(node, "name"), text(node, "disambiguator"), text(node, "relation_type"),
                attributes(node));
    }

    private NameSpec name(JsonNode node) {
        if (node.isTextual()) {
            return NameSpec.of(node.asText());
        }
        return new NameSpec(text(node, "name"), text(node, "disambiguator"), attributes(node));
    }

    private LocationSpec location(JsonNode node) {
        if (node.isTextual()) {
            return new LocationSpec(node.asText(), null, null);
        }
        return new LocationSpec(text(node, "name"), text(node, "city"), attributes(node));
    }

    private NarratedDateSpec narratedDate(JsonNode node) {
        if (node.isTextual()) {
            return NarratedDateSpec.of(node.asText());
        }
        return new NarratedDateSpec(text(node, "date"), text(node, "context"));
    }

    private SceneSpec scene(JsonNode node) {
        if (node.isTextual()) {
            return SceneSpec.of(node.asText());
        }
        return new SceneSpec(text(node, "name"), text(node, "description"), text(node, "time_of_day"),
                strings(node, "dates"), strings(node, "people"), strings(node, "locations"));
    }

    private EventSpec event(JsonNode node) {
        if (node.isTextual()) {
            return new EventSpec(node.asText(), null, null);
        }
        return new EventSpec(text(node, "name"), strings(node, "scenes"), attributes(node));
    }

    private SequencedSpec sequenced(JsonNode node) {
        if (node.isTextual()) {
            return SequencedSpec.of(node.asText());
        }
        JsonNode sequence = node.get("sequence");
        if (sequence != null && !sequence.isNull() && !sequence.canConvertToInt()) {
            throw new IllegalArgumentException("sequence must be an integer: " + sequence);
        }
        return new SequencedSpec(text(node, "name"),
                sequence == null || sequence.isNull() ? null : sequence.asInt(), attributes(node));
    }

    private MotifSpec motif(JsonNode node) {
        return new MotifSpec(text(node, "name"), text(node, "locator"), text(node, "description"));
    }

    private ReferenceSpec reference(JsonNode node) {
        JsonNode source = node.get("source");
        SourceSpec sourceSpec = null;
        if (source != null && source.isTextual()) {
            sourceSpec = new SourceSpec(source.asText(), null, null, null);
        } else if (source != null && source.isObject()) {
            sourceSpec = new SourceSpec(text(source, "title"), text(source, "author"), text(source, "type"),
                    text(source, "url"));
        }
        return new ReferenceSpec(text(node, "content"), text(node, "description"), text(node, "speaker"),
                text(node, "mode"), sourceSpec);
    }

    private PoemSpec poem(JsonNode node) {
        String revision = text(node, "revision_date");
        return new PoemSpec(text(node, "title"), text(node, "content"),
                revision != null ? LocalDate.parse(revision) : null);
    }

    // ========== JSON helpers ==========

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode node, String field) {
        return list(node, field, JsonNode::asText);
    }

    private static <T> List<T> list(JsonNode node, String field, Function<JsonNode, T> converter) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array");
        }
        List<T> result = new ArrayList<>();
        for (JsonNode element : array) {
            result.add(converter.apply(element));
        }
        return result;
    }

    private Map<String, Object> attributes(JsonNode node) {
        JsonNode attributes = node.get("attributes");
        if (attributes == null || attributes.isNull()) {
            return Map.of();
        }
        if (!attributes.isObject()) {
            throw new IllegalArgumentException("'attributes' must be an object");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Object value = mapper.convertValue(field.getValue(), Object.class);
            if (value != null) {
                result.put(field.getKey(), value);
            }
        }
        return result;
    }
}
