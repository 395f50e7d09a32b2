package ch.so.arp.faq.bot;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link EmbeddingProvider} backed by the Ollama {@code /api/embeddings}
 * endpoint.
 */
class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    static final String EMBEDDINGS_PATH = "/api/embeddings";

    private final RestClient restClient;
    private final String model;

    OllamaEmbeddingProvider(RestClient restClient, String model) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public EmbeddingVector embed(String text) {
        JsonNode body;
        try {
            body = restClient.post()
                    .uri(EMBEDDINGS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "prompt", text))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new EmbeddingUnavailableException("Embedding request failed: " + ex.getMessage(), ex);
        }
        return toVector(body);
    }

    private EmbeddingVector toVector(JsonNode body) {
        JsonNode embedding = body == null ? null : body.get("embedding");
        if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
            throw new EmbeddingUnavailableException("Embedding response does not contain an embedding");
        }
        double[] values = new double[embedding.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingUnavailableException("Embedding value at index " + i + " is not a number");
            }
            values[i] = value.asDouble();
        }
        LOGGER.trace("Received embedding with {} dimensions from model {}", values.length, model);
        return EmbeddingVector.of(values);
    }
}
