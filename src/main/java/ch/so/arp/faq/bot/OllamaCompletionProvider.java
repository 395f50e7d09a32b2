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
 * {@link CompletionProvider} backed by the non-streaming Ollama
 * {@code /api/generate} endpoint.
 */
class OllamaCompletionProvider implements CompletionProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaCompletionProvider.class);

    static final String GENERATE_PATH = "/api/generate";

    private final RestClient restClient;
    private final String model;

    OllamaCompletionProvider(RestClient restClient, String model) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public String complete(String prompt) {
        LOGGER.debug("Requesting completion from model {}", model);
        JsonNode body;
        try {
            body = restClient.post()
                    .uri(GENERATE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "prompt", prompt, "stream", false))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new CompletionUnavailableException("Completion request failed: " + ex.getMessage(), ex);
        }
        JsonNode response = body == null ? null : body.get("response");
        if (response == null || !response.isTextual()) {
            throw new CompletionUnavailableException("Completion response does not contain generated text");
        }
        return response.asText();
    }
}
