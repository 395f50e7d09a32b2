package ch.so.arp.faq.bot;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the FAQ corpus from a JSON array of {@code {"question", "answer"}}
 * objects. Additional fields are ignored.
 */
class JsonCorpusLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonCorpusLoader.class);

    private final ObjectMapper objectMapper;

    JsonCorpusLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    List<CorpusEntry> load(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        JsonNode root;
        try (InputStream input = resource.getInputStream()) {
            root = objectMapper.readTree(input);
        } catch (IOException ex) {
            throw new CorpusLoadException("Unable to read FAQ corpus from " + resource.getDescription(), ex);
        }
        if (root == null || !root.isArray()) {
            throw new CorpusLoadException("FAQ corpus " + resource.getDescription() + " must be a JSON array");
        }
        List<CorpusEntry> entries = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode item = root.get(i);
            entries.add(new CorpusEntry(requireText(item, "question", i), requireText(item, "answer", i)));
        }
        LOGGER.info("Loaded {} FAQ entries from {}", entries.size(), resource.getDescription());
        return List.copyOf(entries);
    }

    private String requireText(JsonNode item, String field, int position) {
        JsonNode value = item == null ? null : item.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new CorpusLoadException("FAQ entry " + position + " has no '" + field + "'");
        }
        return value.asText();
    }
}
